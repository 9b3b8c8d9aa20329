/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.fleak.regexfn.api.structure;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.NonNull;

/**
 * Immutable, ordered batch of optional text values. A null element is an absent row.
 *
 * <p>Used both for the rows a function reads and for the rows it produces.
 */
@EqualsAndHashCode
public final class StringBatch implements Iterable<String> {

  private final List<String> values;

  private StringBatch(List<String> values) {
    this.values = Collections.unmodifiableList(values);
  }

  public static StringBatch of(String... values) {
    return new StringBatch(new ArrayList<>(Arrays.asList(values)));
  }

  public static StringBatch of(@NonNull List<String> values) {
    return new StringBatch(new ArrayList<>(values));
  }

  public static StringBatch nulls(int length) {
    return repeat(null, length);
  }

  public static StringBatch repeat(String value, int length) {
    return new StringBatch(Collections.nCopies(length, value));
  }

  public int length() {
    return values.size();
  }

  public String get(int index) {
    return values.get(index);
  }

  public boolean isNull(int index) {
    return values.get(index) == null;
  }

  public boolean hasNulls() {
    return values.stream().anyMatch(Objects::isNull);
  }

  public List<String> asList() {
    return values;
  }

  @Override
  public Iterator<String> iterator() {
    return values.iterator();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}

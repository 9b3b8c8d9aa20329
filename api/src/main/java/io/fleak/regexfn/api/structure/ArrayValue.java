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
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.Data;
import lombok.NonNull;

/** A column of values sharing one {@link DataType}. Any element may be null. */
@Data
public class ArrayValue implements ColumnarValue {

  private final DataType dataType;
  private final List<Object> values;

  public ArrayValue(@NonNull DataType dataType, @NonNull List<?> values) {
    for (Object v : values) {
      if (v != null && DataType.of(v) != dataType) {
        throw new IllegalArgumentException(
            String.format(
                "value (%s) of type %s cannot be stored in a %s array",
                v, DataType.of(v).getDisplayName(), dataType.getDisplayName()));
      }
    }
    List<Object> normalized = new ArrayList<>(values.size());
    for (Object v : values) {
      normalized.add(dataType.normalize(v));
    }
    this.dataType = dataType;
    this.values = Collections.unmodifiableList(normalized);
  }

  /** Infers the array type from the first non-null element. An all-null list is a NULL array. */
  public static ArrayValue of(List<?> values) {
    DataType type =
        values.stream()
            .filter(Objects::nonNull)
            .findFirst()
            .map(DataType::of)
            .orElse(DataType.NULL);
    return new ArrayValue(type, values);
  }

  public static ArrayValue of(StringBatch batch) {
    return new ArrayValue(DataType.UTF8, batch.asList());
  }

  @Override
  public boolean isScalar() {
    return false;
  }

  @Override
  public int length() {
    return values.size();
  }

  @Override
  public String describe() {
    return "Array(" + dataType.getDisplayName() + ")";
  }

  @Override
  public StringBatch getStringBatch() {
    return switch (dataType) {
      case UTF8 ->
          StringBatch.of(values.stream().map(v -> v == null ? null : v.toString()).toList());
      case NULL -> StringBatch.nulls(values.size());
      default -> ColumnarValue.super.getStringBatch();
    };
  }

  @Override
  public String toString() {
    return describe() + values;
  }
}

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
import java.util.Collection;

/**
 * A function call argument as handed over by the host query engine: either a whole column of
 * values ({@link ArrayValue}) or a single literal shared by every row ({@link ScalarValue}).
 *
 * <p>Typed accessors throw {@link UnsupportedOperationException} unless the value has the matching
 * shape. Callers that need to validate a shape should check {@link #isScalar()} and {@link
 * #getDataType()} first.
 */
public interface ColumnarValue {

  DataType getDataType();

  boolean isScalar();

  /** Number of rows. A scalar reports one row. */
  int length();

  /** Human readable shape, e.g. {@code Array(Utf8)} or {@code Scalar(Int64, null)}. */
  String describe();

  default StringBatch getStringBatch() {
    throw new UnsupportedOperationException("trying to get a string batch from " + describe());
  }

  default String getStringValue() {
    throw new UnsupportedOperationException("trying to get a string value from " + describe());
  }

  default long getLongValue() {
    throw new UnsupportedOperationException("trying to get a long value from " + describe());
  }

  static ColumnarValue wrap(Object obj) {
    if (obj instanceof ColumnarValue v) {
      return v;
    }
    if (obj instanceof StringBatch batch) {
      return ArrayValue.of(batch);
    }
    if (obj instanceof Collection<?> c) {
      return ArrayValue.of(new ArrayList<>(c));
    }
    return ScalarValue.of(obj);
  }
}

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

import lombok.Data;
import lombok.NonNull;

/**
 * A single literal applied to every row of an invocation. A scalar may be a typed null, e.g. a
 * {@code CAST(NULL AS VARCHAR)} literal is a {@link DataType#UTF8} scalar without a value.
 */
@Data
public class ScalarValue implements ColumnarValue {

  private final DataType dataType;
  private final Object value;

  public ScalarValue(@NonNull DataType dataType, Object value) {
    if (value != null && DataType.of(value) != dataType) {
      throw new IllegalArgumentException(
          String.format(
              "value (%s) of type %s cannot be used as a %s scalar",
              value, DataType.of(value).getDisplayName(), dataType.getDisplayName()));
    }
    this.dataType = dataType;
    this.value = dataType.normalize(value);
  }

  public static ScalarValue of(Object obj) {
    if (obj == null) {
      return new ScalarValue(DataType.NULL, null);
    }
    if (obj instanceof CharSequence s) {
      return utf8(s.toString());
    }
    if (DataType.of(obj) == DataType.INT64) {
      return int64(((Number) obj).longValue());
    }
    if (obj instanceof Number n) {
      return new ScalarValue(DataType.FLOAT64, n.doubleValue());
    }
    return new ScalarValue(DataType.of(obj), obj);
  }

  public static ScalarValue utf8(String value) {
    return new ScalarValue(DataType.UTF8, value);
  }

  public static ScalarValue int64(Long value) {
    return new ScalarValue(DataType.INT64, value);
  }

  public boolean isNull() {
    return value == null;
  }

  @Override
  public boolean isScalar() {
    return true;
  }

  @Override
  public int length() {
    return 1;
  }

  @Override
  public String describe() {
    if (value == null && dataType != DataType.NULL) {
      return "Scalar(" + dataType.getDisplayName() + ", null)";
    }
    return "Scalar(" + dataType.getDisplayName() + ")";
  }

  @Override
  public String getStringValue() {
    if (dataType != DataType.UTF8 || value == null) {
      return ColumnarValue.super.getStringValue();
    }
    return (String) value;
  }

  @Override
  public long getLongValue() {
    if (dataType != DataType.INT64 || value == null) {
      return ColumnarValue.super.getLongValue();
    }
    return (Long) value;
  }

  @Override
  public String toString() {
    return describe() + "[" + value + "]";
  }
}

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

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Logical type carried by a {@link ColumnarValue}. */
@Getter
@RequiredArgsConstructor
public enum DataType {
  UTF8("Utf8"),
  INT64("Int64"),
  FLOAT64("Float64"),
  BOOLEAN("Boolean"),
  NULL("Null");

  private final String displayName;

  /**
   * Infers the logical type of a java value. Integral numbers map to {@link #INT64}, all other
   * numbers to {@link #FLOAT64}.
   */
  public static DataType of(Object value) {
    if (value == null) {
      return NULL;
    }
    if (value instanceof CharSequence) {
      return UTF8;
    }
    if (value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte) {
      return INT64;
    }
    if (value instanceof Number) {
      return FLOAT64;
    }
    if (value instanceof Boolean) {
      return BOOLEAN;
    }
    throw new IllegalArgumentException(
        String.format("value (%s) of class %s has no columnar data type", value, value.getClass()));
  }

  /**
   * Converts a value already known to be of this type to its canonical java class: String for
   * UTF8, Long for INT64 and Double for FLOAT64.
   */
  Object normalize(Object value) {
    if (value == null) {
      return null;
    }
    return switch (this) {
      case UTF8 -> value.toString();
      case INT64 -> ((Number) value).longValue();
      case FLOAT64 -> ((Number) value).doubleValue();
      default -> value;
    };
  }
}

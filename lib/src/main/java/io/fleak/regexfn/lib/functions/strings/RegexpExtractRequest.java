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
package io.fleak.regexfn.lib.functions.strings;

import io.fleak.regexfn.api.function.ArgumentBindingException;
import io.fleak.regexfn.api.structure.ArrayValue;
import io.fleak.regexfn.api.structure.ColumnarValue;
import io.fleak.regexfn.api.structure.DataType;
import io.fleak.regexfn.api.structure.ScalarValue;
import io.fleak.regexfn.api.structure.StringBatch;
import lombok.Getter;

/**
 * Arguments of one {@code regexp_extract} call. Each field is bound by its own setter, which
 * rejects any value that does not have the accepted shape and leaves the request unchanged.
 */
@Getter
public class RegexpExtractRequest {

  public static final String FIELD_INPUT = "input";
  public static final String FIELD_REGEX = "regex";
  public static final String FIELD_GROUP = "group";

  private StringBatch input;
  private String regex;
  private Long group;

  /** Builds a request from typed values. A null input or regex leaves the request unusable. */
  public static RegexpExtractRequest of(StringBatch input, String regex, long group) {
    RegexpExtractRequest request = new RegexpExtractRequest();
    request.input = input;
    request.regex = regex;
    request.group = group;
    return request;
  }

  /** Accepts a Utf8 column. An all-null column is read as that many absent rows. */
  public RegexpExtractRequest setInput(ColumnarValue value) {
    if (!(value instanceof ArrayValue array)
        || (array.getDataType() != DataType.UTF8 && array.getDataType() != DataType.NULL)) {
      throw new ArgumentBindingException(FIELD_INPUT, "Array(Utf8)", describe(value));
    }
    this.input = array.getStringBatch();
    return this;
  }

  /** Accepts a non-null Utf8 literal. */
  public RegexpExtractRequest setRegex(ColumnarValue value) {
    if (!(value instanceof ScalarValue scalar)
        || scalar.getDataType() != DataType.UTF8
        || scalar.isNull()) {
      throw new ArgumentBindingException(FIELD_REGEX, "Scalar(Utf8)", describe(value));
    }
    this.regex = scalar.getStringValue();
    return this;
  }

  /** Accepts a non-null Int64 literal. */
  public RegexpExtractRequest setGroup(ColumnarValue value) {
    if (!(value instanceof ScalarValue scalar)
        || scalar.getDataType() != DataType.INT64
        || scalar.isNull()) {
      throw new ArgumentBindingException(FIELD_GROUP, "Scalar(Int64)", describe(value));
    }
    this.group = scalar.getLongValue();
    return this;
  }

  public boolean isUsable() {
    return input != null && regex != null && group != null;
  }

  private static String describe(ColumnarValue value) {
    return value == null ? "nothing" : value.describe();
  }
}

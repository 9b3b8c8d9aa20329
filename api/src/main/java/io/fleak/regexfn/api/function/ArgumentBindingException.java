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
package io.fleak.regexfn.api.function;

import lombok.Getter;

/** A call argument does not have the shape its parameter accepts. */
@Getter
public class ArgumentBindingException extends FunctionExecutionException {

  private final String field;
  private final String expectedShape;
  private final String actualShape;

  public ArgumentBindingException(String field, String expectedShape, String actualShape) {
    super(
        String.format(
            "wrong columnar value type for %s: expected %s, got %s",
            field, expectedShape, actualShape));
    this.field = field;
    this.expectedShape = expectedShape;
    this.actualShape = actualShape;
  }
}

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

import io.fleak.regexfn.api.structure.ColumnarValue;
import io.fleak.regexfn.api.structure.DataType;
import java.util.List;

/**
 * Registration surface of a row-wise function. The host evaluates a call by handing over one
 * columnar value per positional argument and expects a value with one row per input row.
 */
public interface ScalarFunction {

  String getName();

  /** Argument types in positional order. */
  List<DataType> getSignature();

  DataType getReturnType();

  Volatility getVolatility();

  /**
   * Evaluates one call.
   *
   * @throws FunctionExecutionException when the arguments are not usable for this function
   */
  ColumnarValue invoke(List<ColumnarValue> args);
}

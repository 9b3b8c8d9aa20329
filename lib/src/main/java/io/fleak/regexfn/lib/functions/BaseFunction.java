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
package io.fleak.regexfn.lib.functions;

import io.fleak.regexfn.api.function.FunctionExecutionException;
import io.fleak.regexfn.api.function.ScalarFunction;
import io.fleak.regexfn.api.function.Volatility;
import io.fleak.regexfn.api.structure.ColumnarValue;
import io.fleak.regexfn.api.structure.DataType;
import java.util.List;
import lombok.Data;

@Data
public abstract class BaseFunction implements ScalarFunction {

  private final String name;
  private final List<DataType> signature;
  private final DataType returnType;
  private final Volatility volatility;

  protected BaseFunction(
      String name, List<DataType> signature, DataType returnType, Volatility volatility) {
    this.name = name;
    this.signature = List.copyOf(signature);
    this.returnType = returnType;
    this.volatility = volatility;
  }

  public abstract ColumnarValue invoke(List<ColumnarValue> args);

  public void assertArgsAtMost(List<ColumnarValue> args, int number, String error) {
    if (args.size() > number) {
      throw new FunctionExecutionException(
          "function " + getName() + " argument mismatch; " + error);
    }
  }
}

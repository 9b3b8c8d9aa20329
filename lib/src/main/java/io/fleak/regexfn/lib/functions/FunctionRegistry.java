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
import io.fleak.regexfn.api.structure.ColumnarValue;
import io.fleak.regexfn.lib.config.RegexpExtractConfig;
import io.fleak.regexfn.lib.functions.strings.RegexpExtract;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/** Functions exposed to a host query engine, looked up by their registered name. */
@Slf4j
public class FunctionRegistry {

  private final Map<String, ScalarFunction> functions;

  public FunctionRegistry(Collection<? extends ScalarFunction> functions) {
    Map<String, ScalarFunction> byName = new LinkedHashMap<>();
    for (ScalarFunction fn : functions) {
      if (byName.putIfAbsent(fn.getName(), fn) != null) {
        throw new IllegalArgumentException(
            "function " + fn.getName() + " is registered more than once");
      }
      log.debug(
          "registered function {}{} -> {} ({})",
          fn.getName(),
          fn.getSignature(),
          fn.getReturnType(),
          fn.getVolatility());
    }
    this.functions = Collections.unmodifiableMap(byName);
  }

  public static FunctionRegistry defaultRegistry(RegexpExtractConfig config) {
    return new FunctionRegistry(List.of(new RegexpExtract(config)));
  }

  public ScalarFunction lookupFunction(String name) {
    var fn = functions.get(name);
    if (fn == null) {
      throw new FunctionExecutionException("the function " + name + " does not exist");
    }
    return fn;
  }

  public Set<String> getFunctionNames() {
    return functions.keySet();
  }

  public ColumnarValue invoke(String name, List<ColumnarValue> args) {
    return lookupFunction(name).invoke(args);
  }
}

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
package io.fleak.regexfn.evaluator;

import static io.fleak.regexfn.lib.utils.JsonUtils.toJsonString;

import io.fleak.regexfn.api.structure.ColumnarValue;
import io.fleak.regexfn.api.structure.StringBatch;
import io.fleak.regexfn.lib.functions.FunctionRegistry;
import io.fleak.regexfn.lib.functions.strings.RegexpExtract;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.ParseException;

/** Runs {@code regexp_extract} over a batch of rows and prints the result rows as json. */
@Slf4j
public class Main {

  public static void main(String[] args) {
    EvaluatorConfig config;
    try {
      config = EvaluatorConfig.parse(args);
    } catch (ParseException e) {
      log.error("failed to parse command line: {}", e.getMessage());
      EvaluatorConfig.printUsage("regexfn-evaluator");
      System.exit(1);
      return;
    }
    System.out.println(toJsonString(evaluate(config).asList()));
  }

  static StringBatch evaluate(EvaluatorConfig config) {
    FunctionRegistry registry = FunctionRegistry.defaultRegistry(config.getFunctionConfig());
    log.debug(
        "evaluating {} on {} rows with {}",
        RegexpExtract.NAME,
        config.getInput().length(),
        config.getFunctionConfig());
    ColumnarValue output =
        registry.invoke(
            RegexpExtract.NAME,
            List.of(
                ColumnarValue.wrap(config.getInput()),
                ColumnarValue.wrap(config.getPattern()),
                ColumnarValue.wrap(config.getGroup())));
    return output.getStringBatch();
  }
}

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

import io.fleak.regexfn.api.function.Volatility;
import io.fleak.regexfn.api.structure.ArrayValue;
import io.fleak.regexfn.api.structure.ColumnarValue;
import io.fleak.regexfn.api.structure.DataType;
import io.fleak.regexfn.lib.config.RegexpExtractConfig;
import io.fleak.regexfn.lib.functions.BaseFunction;
import java.util.List;
import lombok.Getter;

/**
 * {@code regexp_extract(input, regex, group)}: the text captured by {@code group} in the first
 * match of {@code regex}, or an empty string. {@code input} is a column, {@code regex} and {@code
 * group} are literals.
 */
public class RegexpExtract extends BaseFunction {

  public static final String NAME = "regexp_extract";

  @Getter private final RegexpExtractor extractor;

  public RegexpExtract(RegexpExtractConfig config) {
    this(new RegexpExtractor(config));
  }

  public RegexpExtract(RegexpExtractor extractor) {
    super(
        NAME,
        List.of(DataType.UTF8, DataType.UTF8, DataType.INT64),
        DataType.UTF8,
        Volatility.IMMUTABLE);
    this.extractor = extractor;
  }

  @Override
  public ColumnarValue invoke(List<ColumnarValue> args) {
    assertArgsAtMost(args, 3, "(input, regex, group)");

    var request = new RegexpExtractRequest();
    if (args.size() > 0) request.setInput(args.get(0));
    if (args.size() > 1) request.setRegex(args.get(1));
    if (args.size() > 2) request.setGroup(args.get(2));

    return ArrayValue.of(extractor.extract(request));
  }
}

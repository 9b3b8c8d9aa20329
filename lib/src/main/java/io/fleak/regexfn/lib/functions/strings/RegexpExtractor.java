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

import io.fleak.regexfn.api.structure.StringBatch;
import io.fleak.regexfn.lib.config.FallbackMode;
import io.fleak.regexfn.lib.config.RegexpExtractConfig;
import io.fleak.regexfn.lib.regex.CompiledRegex;
import io.fleak.regexfn.lib.regex.GroupExtractor;
import io.fleak.regexfn.lib.regex.PatternCache;
import io.fleak.regexfn.lib.regex.PatternCompilationException;
import io.fleak.regexfn.lib.regex.RegexEngine;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies one capture group of one pattern to every row of a batch.
 *
 * <p>The pattern is compiled once per call and every row is matched with the same matcher. Rows
 * that are absent are matched as empty text. A row yields the empty string when the pattern does
 * not match it, or when the requested group is not declared by the pattern or did not take part in
 * the match. A request that is incomplete or whose pattern does not compile yields the fallback
 * batch configured by {@link FallbackMode}. Nothing on this path throws.
 */
@Slf4j
public class RegexpExtractor {

  @Getter private final RegexEngine engine;
  @Getter private final FallbackMode fallbackMode;

  public RegexpExtractor(RegexpExtractConfig config) {
    config.validate();
    RegexEngine base = RegexEngine.create(config.getEngine());
    this.engine =
        config.getPatternCacheSize() > 0
            ? new PatternCache(base, config.getPatternCacheSize())
            : base;
    this.fallbackMode = config.getFallbackMode();
  }

  public RegexpExtractor(RegexEngine engine, FallbackMode fallbackMode) {
    this.engine = engine;
    this.fallbackMode = fallbackMode;
  }

  public StringBatch extract(StringBatch input, String pattern, long group) {
    return extract(RegexpExtractRequest.of(input, pattern, group));
  }

  public StringBatch extract(RegexpExtractRequest request) {
    if (!request.isUsable()) {
      log.debug("incomplete regexp_extract request, returning fallback batch");
      return fallback(request.getInput());
    }

    CompiledRegex regex;
    try {
      regex = engine.compile(request.getRegex());
    } catch (PatternCompilationException e) {
      log.debug("returning fallback batch: {}", e.getMessage());
      return fallback(request.getInput());
    }

    StringBatch input = request.getInput();
    long group = request.getGroup();
    GroupExtractor extractor = regex.newExtractor();
    List<String> output = new ArrayList<>(input.length());
    for (String row : input) {
      String captured = extractor.extract(row == null ? "" : row, group);
      output.add(captured == null ? "" : captured);
    }
    return StringBatch.of(output);
  }

  StringBatch fallback(StringBatch input) {
    if (fallbackMode == FallbackMode.SINGLE_ROW || input == null) {
      return StringBatch.of("");
    }
    return StringBatch.repeat("", input.length());
  }
}

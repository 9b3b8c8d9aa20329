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
package io.fleak.regexfn.lib.regex;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Compiles with {@link Pattern#UNICODE_CASE} so that {@code (?i)} folds beyond ASCII. */
public class JdkRegexEngine implements RegexEngine {

  @Override
  public RegexEngineType getType() {
    return RegexEngineType.JDK;
  }

  @Override
  public CompiledRegex compile(String pattern) throws PatternCompilationException {
    try {
      return new JdkCompiledRegex(Pattern.compile(pattern, Pattern.UNICODE_CASE));
    } catch (PatternSyntaxException e) {
      throw new PatternCompilationException(pattern, e);
    }
  }

  private record JdkCompiledRegex(Pattern compiled) implements CompiledRegex {

    @Override
    public String getPattern() {
      return compiled.pattern();
    }

    @Override
    public int groupCount() {
      return compiled.matcher("").groupCount();
    }

    @Override
    public GroupExtractor newExtractor() {
      Matcher matcher = compiled.matcher("");
      return GroupExtractor.firstMatch(
          matcher.groupCount(), text -> matcher.reset(text).find(), matcher::group);
    }
  }
}

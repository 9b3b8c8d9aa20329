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

import java.util.function.IntFunction;
import java.util.function.Predicate;

/** Reusable matching state of a {@link CompiledRegex}. Not thread safe. */
public interface GroupExtractor {

  /**
   * Finds the leftmost match in {@code text} and returns the text captured by {@code group}.
   *
   * @return the captured text, or null when nothing matched, the pattern has no such group, or the
   *     group did not take part in the match
   */
  String extract(CharSequence text, long group);

  /**
   * Builds an extractor over one engine's matcher.
   *
   * @param groupCount number of groups the pattern declares
   * @param find resets the matcher to the given text and looks for the first match
   * @param group reads a group of the last successful match
   */
  static GroupExtractor firstMatch(
      int groupCount, Predicate<CharSequence> find, IntFunction<String> group) {
    return (text, g) -> {
      if (g < 0 || g > groupCount || !find.test(text)) {
        return null;
      }
      return group.apply((int) g);
    };
  }
}

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

/**
 * A compiled pattern. Implementations are immutable and may be shared between threads; the
 * mutable matching state lives in the {@link GroupExtractor}s they hand out.
 */
public interface CompiledRegex {

  String getPattern();

  /** Number of capture groups declared by the pattern, not counting group 0. */
  int groupCount();

  /** Creates matching state for one caller. The returned extractor is not thread safe. */
  GroupExtractor newExtractor();
}

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
 * Regular expression library used to compile patterns. Both engines support inline flags such as
 * {@code (?i)}, with Unicode case folding, and the Unicode property classes {@code \p{L}} and
 * {@code \p{N}}.
 *
 * <p>{@code \d}, {@code \w} and {@code \s} are ASCII only in both engines: {@code \d} does not
 * match non-ASCII decimal digits such as {@code U+0661}. Use {@code \p{Nd}} to match any decimal
 * digit.
 */
public enum RegexEngineType {
  /** {@code com.google.re2j}, linear time in the size of the input. */
  RE2J,
  /** {@code java.util.regex}, backtracking. */
  JDK
}

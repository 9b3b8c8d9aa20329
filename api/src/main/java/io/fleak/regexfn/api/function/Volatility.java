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

/** How freely the host may cache, reorder or fold calls of a function. */
public enum Volatility {
  /** Result depends only on the arguments. Calls may be cached, reordered or constant-folded. */
  IMMUTABLE,
  /** Result is fixed within one query but may change between queries. */
  STABLE,
  /** Result may change on every call. */
  VOLATILE
}

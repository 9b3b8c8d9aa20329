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

import com.google.common.base.Preconditions;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.map.LRUMap;

/**
 * {@link RegexEngine} that keeps the most recently used compiled patterns of another engine, keyed
 * by the full pattern text. Patterns that fail to compile are not cached.
 */
@Slf4j
public class PatternCache implements RegexEngine {

  private final RegexEngine delegate;
  private final Map<String, CompiledRegex> cache;

  public PatternCache(RegexEngine delegate, int maxSize) {
    Preconditions.checkArgument(maxSize > 0, "pattern cache size must be positive: %s", maxSize);
    this.delegate = delegate;
    this.cache = new LRUMap<>(maxSize);
  }

  @Override
  public RegexEngineType getType() {
    return delegate.getType();
  }

  @Override
  public CompiledRegex compile(String pattern) throws PatternCompilationException {
    synchronized (cache) {
      CompiledRegex cached = cache.get(pattern);
      if (cached != null) {
        return cached;
      }
    }
    CompiledRegex compiled = delegate.compile(pattern);
    synchronized (cache) {
      cache.put(pattern, compiled);
    }
    log.debug("cached compiled pattern: {}", pattern);
    return compiled;
  }

  public int size() {
    synchronized (cache) {
      return cache.size();
    }
  }
}

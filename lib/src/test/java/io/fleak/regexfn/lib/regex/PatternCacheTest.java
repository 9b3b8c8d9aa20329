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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import org.junit.jupiter.api.Test;

class PatternCacheTest {

  @Test
  void testReusesCompiledPattern() throws Exception {
    RegexEngine delegate = spy(new Re2jRegexEngine());
    PatternCache cache = new PatternCache(delegate, 10);

    CompiledRegex first = cache.compile("(a)");
    CompiledRegex second = cache.compile("(a)");

    assertSame(first, second);
    assertNotSame(first, cache.compile("(b)"));
    verify(delegate, times(1)).compile("(a)");
    assertEquals(2, cache.size());
    assertEquals(RegexEngineType.RE2J, cache.getType());
  }

  @Test
  void testEvictsLeastRecentlyUsed() throws Exception {
    RegexEngine delegate = spy(new JdkRegexEngine());
    PatternCache cache = new PatternCache(delegate, 2);

    cache.compile("a");
    cache.compile("b");
    cache.compile("a");
    cache.compile("c");
    assertEquals(2, cache.size());

    cache.compile("a");
    verify(delegate, times(1)).compile("a");
    cache.compile("b");
    verify(delegate, times(2)).compile("b");
  }

  @Test
  void testFailuresAreNotCached() throws Exception {
    RegexEngine delegate = spy(new Re2jRegexEngine());
    PatternCache cache = new PatternCache(delegate, 10);

    assertThrows(PatternCompilationException.class, () -> cache.compile("("));
    assertThrows(PatternCompilationException.class, () -> cache.compile("("));
    verify(delegate, times(2)).compile("(");
    assertEquals(0, cache.size());
  }

  @Test
  void testRejectsNonPositiveSize() {
    var engine = new Re2jRegexEngine();
    assertThrows(IllegalArgumentException.class, () -> new PatternCache(engine, 0));
  }
}

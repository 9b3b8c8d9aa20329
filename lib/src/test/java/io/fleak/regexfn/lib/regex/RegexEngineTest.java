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

import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class RegexEngineTest {

  static Stream<RegexEngine> engines() {
    return Stream.of(RegexEngineType.values()).map(RegexEngine::create);
  }

  @ParameterizedTest
  @MethodSource("engines")
  void testGroupCount(RegexEngine engine) throws PatternCompilationException {
    assertEquals(0, engine.compile("abc").groupCount());
    assertEquals(2, engine.compile("([a-z]+)(\\d+)").groupCount());
    assertEquals(1, engine.compile("(?:x)(y)").groupCount());
    assertEquals("([a-z]+)(\\d+)", engine.compile("([a-z]+)(\\d+)").getPattern());
  }

  @ParameterizedTest
  @MethodSource("engines")
  void testExtract(RegexEngine engine) throws PatternCompilationException {
    GroupExtractor extractor = engine.compile("([a-z]+)(\\d+)?").newExtractor();

    assertEquals("abc123", extractor.extract("--abc123--", 0));
    assertEquals("abc", extractor.extract("--abc123--", 1));
    assertEquals("123", extractor.extract("--abc123--", 2));
    assertNull(extractor.extract("--abc--", 2));
    assertNull(extractor.extract("--abc--", 3));
    assertNull(extractor.extract("--abc--", -1));
    assertNull(extractor.extract("1234", 0));
  }

  @ParameterizedTest
  @MethodSource("engines")
  void testUnicodeClasses(RegexEngine engine) throws PatternCompilationException {
    GroupExtractor extractor = engine.compile("(\\p{L}+)(\\p{N}+)").newExtractor();
    assertEquals("ábč", extractor.extract("ábč45", 1));
    assertEquals("漢字", extractor.extract("漢字9", 1));
  }

  @ParameterizedTest
  @MethodSource("engines")
  void testCaseFoldingIsUnicode(RegexEngine engine) throws PatternCompilationException {
    GroupExtractor extractor = engine.compile("(?i)émile(\\d)").newExtractor();
    assertEquals("5", extractor.extract("ÉMILE5", 1));
    assertEquals("ÉMILE5", extractor.extract("ÉMILE5", 0));
  }

  @ParameterizedTest
  @MethodSource("engines")
  void testDigitClassIsAscii(RegexEngine engine) throws PatternCompilationException {
    assertNull(engine.compile("(\\d+)").newExtractor().extract("abc\u0661\u0662\u0663", 1));
    assertEquals(
        "\u0661\u0662\u0663",
        engine.compile("(\\p{Nd}+)").newExtractor().extract("abc\u0661\u0662\u0663", 1));
  }

  @ParameterizedTest
  @MethodSource("engines")
  void testSyntaxErrors(RegexEngine engine) {
    for (String pattern : new String[] {"([a-z]+(\\d+", "(", "[a-", "*a"}) {
      var e = assertThrows(PatternCompilationException.class, () -> engine.compile(pattern));
      assertEquals(pattern, e.getPattern());
      assertTrue(e.getMessage().contains(pattern));
    }
  }

  @ParameterizedTest
  @MethodSource("engines")
  void testCompiledRegexIsShareable(RegexEngine engine) throws Exception {
    CompiledRegex regex = engine.compile("(\\d+)");
    Thread[] threads = new Thread[4];
    String[] results = new String[threads.length];
    for (int i = 0; i < threads.length; i++) {
      final int n = i;
      threads[i] =
          new Thread(
              () -> {
                GroupExtractor extractor = regex.newExtractor();
                String last = null;
                for (int k = 0; k < 1000; k++) {
                  last = extractor.extract("row" + n + "-" + k, 1);
                }
                results[n] = last;
              });
      threads[i].start();
    }
    for (int i = 0; i < threads.length; i++) {
      threads[i].join();
      assertEquals(i + "", results[i]);
    }
  }
}

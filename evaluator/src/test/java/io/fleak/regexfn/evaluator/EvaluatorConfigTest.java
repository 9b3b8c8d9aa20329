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
package io.fleak.regexfn.evaluator;

import static io.fleak.regexfn.lib.utils.MiscUtils.toBase64String;
import static org.junit.jupiter.api.Assertions.*;

import io.fleak.regexfn.api.structure.StringBatch;
import io.fleak.regexfn.lib.config.FallbackMode;
import io.fleak.regexfn.lib.config.RegexpExtractConfig;
import io.fleak.regexfn.lib.regex.RegexEngineType;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.cli.MissingOptionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EvaluatorConfigTest {

  @TempDir Path tempDir;

  @Test
  void testParseBase64Input() throws Exception {
    String json = "[\"abc123def\", null, \"漢字9\"]";
    String input = toBase64String(json.getBytes(StandardCharsets.UTF_8));
    var config =
        EvaluatorConfig.parse(new String[] {"-p", "([a-z]+)(\\d+)", "-g", "2", "-i", input});

    assertEquals("([a-z]+)(\\d+)", config.getPattern());
    assertEquals(2L, config.getGroup());
    assertEquals(StringBatch.of("abc123def", null, "漢字9"), config.getInput());
    assertEquals(RegexpExtractConfig.defaultConfig(), config.getFunctionConfig());
  }

  @Test
  void testParseInputFileAndConfigFile() throws Exception {
    Path inputFile = tempDir.resolve("rows.txt");
    Files.write(inputFile, List.of("a1", "b22", "xxxx"));
    Path configFile = tempDir.resolve("regexp_extract.yml");
    Files.writeString(configFile, "engine: JDK\nfallbackMode: SINGLE_ROW\n");

    var config =
        EvaluatorConfig.parse(
            new String[] {
              "--pattern", "(\\d+)",
              "--group", "1",
              "--inputFile", inputFile.toString(),
              "--configFile", configFile.toString()
            });

    assertEquals(StringBatch.of("a1", "b22", "xxxx"), config.getInput());
    assertEquals(RegexEngineType.JDK, config.getFunctionConfig().getEngine());
    assertEquals(FallbackMode.SINGLE_ROW, config.getFunctionConfig().getFallbackMode());
  }

  @Test
  void testMissingRequiredOption() {
    assertThrows(
        MissingOptionException.class,
        () -> EvaluatorConfig.parse(new String[] {"-p", "(a)", "-f", "rows.txt"}));
  }

  @Test
  void testMissingInput() {
    var e =
        assertThrows(
            IllegalArgumentException.class,
            () -> EvaluatorConfig.parse(new String[] {"-p", "(a)", "-g", "1"}));
    assertTrue(e.getMessage().contains("no input"));
  }

  @Test
  void testBadGroup() {
    String input = toBase64String("[\"a\"]".getBytes(StandardCharsets.UTF_8));
    assertThrows(
        IllegalArgumentException.class,
        () -> EvaluatorConfig.parse(new String[] {"-p", "(a)", "-g", "one", "-i", input}));
  }

  @Test
  void testBadInput() {
    String input = toBase64String("{\"a\": 1}".getBytes(StandardCharsets.UTF_8));
    assertThrows(
        IllegalArgumentException.class,
        () -> EvaluatorConfig.parse(new String[] {"-p", "(a)", "-g", "1", "-i", input}));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            EvaluatorConfig.parse(
                new String[] {"-p", "(a)", "-g", "1", "-f", tempDir.resolve("none").toString()}));
  }
}

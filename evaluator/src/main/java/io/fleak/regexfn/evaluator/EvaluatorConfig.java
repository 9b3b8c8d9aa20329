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

import static io.fleak.regexfn.lib.utils.JsonUtils.fromJsonString;
import static io.fleak.regexfn.lib.utils.MiscUtils.*;

import com.fasterxml.jackson.core.type.TypeReference;
import io.fleak.regexfn.api.structure.StringBatch;
import io.fleak.regexfn.lib.config.RegexpExtractConfig;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.*;
import org.apache.commons.lang3.StringUtils;

@Slf4j
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class EvaluatorConfig {
  private static final Options CLI_OPTIONS;
  private static final Option PATTERN_OPT =
      Option.builder("p")
          .longOpt("pattern")
          .desc("regular expression applied to every input row")
          .hasArg()
          .required(true)
          .build();

  private static final Option GROUP_OPT =
      Option.builder("g")
          .longOpt("group")
          .desc("capture group index. 0 is the whole match")
          .hasArg()
          .required(true)
          .build();

  private static final Option INPUT_OPT =
      Option.builder("i")
          .longOpt("input")
          .desc("Base64 encoded json array of strings (null for an absent row)")
          .hasArg()
          .build();

  private static final Option INPUT_FILE_OPT =
      Option.builder("f")
          .longOpt("inputFile")
          .desc("path to a text file, one input row per line")
          .hasArg()
          .build();

  private static final Option CONFIG_FILE_OPT =
      Option.builder("c")
          .longOpt("configFile")
          .desc("path to the regexp_extract yaml config file")
          .hasArg()
          .build();

  static {
    CLI_OPTIONS = new Options();
    CLI_OPTIONS
        .addOption(PATTERN_OPT)
        .addOption(GROUP_OPT)
        .addOption(INPUT_OPT)
        .addOption(INPUT_FILE_OPT)
        .addOption(CONFIG_FILE_OPT);
  }

  private String pattern;
  private long group;
  private StringBatch input;
  private RegexpExtractConfig functionConfig;

  public static EvaluatorConfig parse(String[] args) throws ParseException {
    CommandLineParser commandLineParser = new DefaultParser();
    CommandLine commandLine = commandLineParser.parse(CLI_OPTIONS, args);

    String pattern = getRequiredCommandArgValue(commandLine, "p", p -> p);
    long group =
        getRequiredCommandArgValue(
            commandLine,
            "g",
            g -> {
              try {
                return Long.parseLong(g.trim());
              } catch (NumberFormatException e) {
                throw new IllegalArgumentException("group index is not an integer: " + g, e);
              }
            });
    RegexpExtractConfig functionConfig =
        getOptionalCommandArgValue(
            commandLine,
            "c",
            c -> {
              try {
                String yaml = Files.readString(Path.of(c));
                log.info("read function config from file: {}", c);
                return RegexpExtractConfig.fromYaml(yaml);
              } catch (Exception e) {
                throw new IllegalArgumentException("failed to load config from file: " + c, e);
              }
            },
            RegexpExtractConfig.defaultConfig());

    return EvaluatorConfig.builder()
        .pattern(pattern)
        .group(group)
        .input(getInput(commandLine))
        .functionConfig(functionConfig)
        .build();
  }

  private static StringBatch getInput(CommandLine commandLine) {
    StringBatch input =
        getOptionalCommandArgValue(
            commandLine,
            "i",
            i -> {
              if (StringUtils.isBlank(i)) {
                return null;
              }
              try {
                String json = new String(fromBase64String(i), StandardCharsets.UTF_8);
                List<String> rows = fromJsonString(json, new TypeReference<>() {});
                return StringBatch.of(rows);
              } catch (Exception e) {
                throw new IllegalArgumentException(
                    "failed to convert -i argument into a json string array: " + i, e);
              }
            },
            null);
    if (input != null) {
      return input;
    }

    input =
        getOptionalCommandArgValue(
            commandLine,
            "f",
            f -> {
              if (StringUtils.isBlank(f)) {
                return null;
              }
              try {
                return StringBatch.of(Files.readAllLines(Path.of(f)));
              } catch (Exception e) {
                throw new IllegalArgumentException("failed to load input rows from file: " + f, e);
              }
            },
            null);
    if (input != null) {
      return input;
    }
    throw new IllegalArgumentException("no input were provided, use -i or -f");
  }

  public static void printUsage(String prog) {
    HelpFormatter formatter = new HelpFormatter();
    formatter.printHelp(prog, "Options:", CLI_OPTIONS, "\n", true);
  }
}

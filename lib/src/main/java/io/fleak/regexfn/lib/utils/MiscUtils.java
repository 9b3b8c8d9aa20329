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
package io.fleak.regexfn.lib.utils;

import com.google.common.base.Preconditions;
import java.util.Base64;
import java.util.function.Function;
import org.apache.commons.cli.CommandLine;

public interface MiscUtils {

  static byte[] fromBase64String(String base64String) {
    return Base64.getDecoder().decode(base64String);
  }

  static String toBase64String(byte[] bytes) {
    if (bytes == null) {
      return null;
    }
    return Base64.getEncoder().encodeToString(bytes);
  }

  static <T> T getRequiredCommandArgValue(
      CommandLine cmd, String argName, Function<String, T> func) {
    String value = cmd.getOptionValue(argName);
    Preconditions.checkNotNull(value, "missing required option: %s", argName);
    return func.apply(value);
  }

  static <T> T getOptionalCommandArgValue(
      CommandLine cmd, String argName, Function<String, T> func, T defaultValue) {
    if (!cmd.hasOption(argName)) {
      return defaultValue;
    }
    String value = cmd.getOptionValue(argName);
    return func.apply(value);
  }
}

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
package io.fleak.regexfn.lib.config;

import static io.fleak.regexfn.lib.utils.YamlUtils.fromYamlString;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.base.Preconditions;
import io.fleak.regexfn.lib.regex.RegexEngineType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * Settings of the {@code regexp_extract} function. Example yaml:
 *
 * <pre>
 * engine: RE2J
 * fallbackMode: PER_ROW
 * patternCacheSize: 100
 * </pre>
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RegexpExtractConfig {

  public static final int DEFAULT_PATTERN_CACHE_SIZE = 100;

  @Builder.Default private RegexEngineType engine = RegexEngineType.RE2J;
  @Builder.Default private FallbackMode fallbackMode = FallbackMode.PER_ROW;

  /** Maximum number of compiled patterns kept between calls. 0 disables the cache. */
  @Builder.Default private int patternCacheSize = DEFAULT_PATTERN_CACHE_SIZE;

  public static RegexpExtractConfig defaultConfig() {
    return RegexpExtractConfig.builder().build();
  }

  /** Parses yaml settings. Blank text yields the default settings. */
  public static RegexpExtractConfig fromYaml(String yaml) {
    if (StringUtils.isBlank(yaml)) {
      return defaultConfig();
    }
    RegexpExtractConfig config = fromYamlString(yaml, new TypeReference<>() {});
    config.validate();
    return config;
  }

  public void validate() {
    Preconditions.checkNotNull(engine, "engine must be set");
    Preconditions.checkNotNull(fallbackMode, "fallbackMode must be set");
    Preconditions.checkArgument(
        patternCacheSize >= 0, "patternCacheSize must not be negative: %s", patternCacheSize);
  }
}

/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.rubyjs.compiler;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Reads per-file settings from a comment at the top of a source file, for example:
 *
 * <pre>
 * # rubyjs: preset filters: camelCase eslevel: 2021
 * </pre>
 *
 * <p>The legacy {@code ruby2js:} prefix is accepted as well. Recognized settings are {@code
 * preset}, {@code filters:}, {@code disable_filters:}, {@code eslevel:} and {@code comparison:}.
 * Filter lists are comma separated.
 */
final class MagicComments {

  /** The filters a preset turns on, ahead of any named in the comment. */
  static final ImmutableList<String> PRESET_FILTERS = ImmutableList.of("functions", "return");

  private static final Pattern MARKER = Pattern.compile("^#\\s*(?:rubyjs|ruby2js):(.*)$");
  private static final Pattern SETTING =
      Pattern.compile("\\s*(\\w+)(?::\\s*([^\\s,]+(?:\\s*,\\s*[^\\s,]+)*))?");
  private static final Splitter LIST_SPLITTER =
      Splitter.on(',').trimResults().omitEmptyStrings();

  private MagicComments() {}

  /**
   * Returns the settings line of the first comment in the source, or null when the source does
   * not open with a magic comment. Only blank lines and comments may precede it.
   */
  static @Nullable String find(String source) {
    for (String line : Splitter.on('\n').split(source)) {
      String trimmed = CharMatcher.whitespace().trimFrom(line);
      if (trimmed.isEmpty()) {
        continue;
      }
      if (!trimmed.startsWith("#")) {
        return null;
      }
      Matcher m = MARKER.matcher(trimmed);
      return m.matches() ? m.group(1) : null;
    }
    return null;
  }

  /**
   * Applies the magic comment of {@code source}, if any, to {@code options}.
   *
   * @throws ConfigurationException for an unknown setting or a malformed value
   */
  static void apply(String source, ConversionOptions options) {
    String settings = find(source);
    if (settings != null) {
      applySettings(settings, options);
    }
  }

  static void applySettings(String settings, ConversionOptions options) {
    boolean preset = false;
    List<String> filters = new ArrayList<>();
    List<String> disabled = new ArrayList<>();
    LanguageMode level = null;
    ConversionOptions.Comparison comparison = null;

    Matcher m = SETTING.matcher(settings);
    int pos = 0;
    while (pos < settings.length()) {
      if (CharMatcher.whitespace().matchesAllOf(settings.substring(pos))) {
        break;
      }
      if (!m.find(pos) || m.start() != pos) {
        throw new ConfigurationException("malformed magic comment: " + settings.trim());
      }
      String key = m.group(1);
      String value = m.group(2);
      switch (key) {
        case "preset":
          preset = true;
          break;
        case "filters":
          filters.addAll(LIST_SPLITTER.splitToList(requireValue(key, value)));
          break;
        case "disable_filters":
          disabled.addAll(LIST_SPLITTER.splitToList(requireValue(key, value)));
          break;
        case "eslevel":
          level = LanguageMode.fromString(requireValue(key, value));
          break;
        case "comparison":
          comparison = parseComparison(requireValue(key, value));
          break;
        default:
          throw new ConfigurationException("unknown magic comment setting '" + key + "'");
      }
      pos = m.end();
    }

    if (preset) {
      List<String> combined = new ArrayList<>(PRESET_FILTERS);
      combined.addAll(options.getFilters());
      options.setFilters(combined);
      options.setLanguageMode(LanguageMode.ECMASCRIPT_2022);
      options.setComparison(ConversionOptions.Comparison.IDENTITY);
      options.setUnderscoredPrivate(true);
    }
    for (String filter : filters) {
      options.addFilter(filter);
    }
    if (!disabled.isEmpty()) {
      List<String> remaining = new ArrayList<>();
      for (String filter : options.getFilters()) {
        if (disabled.stream().noneMatch(d -> Ascii.equalsIgnoreCase(d, filter))) {
          remaining.add(filter);
        }
      }
      options.setFilters(remaining);
    }
    if (level != null) {
      options.setLanguageMode(level);
    }
    if (comparison != null) {
      options.setComparison(comparison);
    }
  }

  private static String requireValue(String key, @Nullable String value) {
    if (value == null) {
      throw new ConfigurationException("magic comment setting '" + key + "' needs a value");
    }
    return value;
  }

  private static ConversionOptions.Comparison parseComparison(String value) {
    try {
      return ConversionOptions.Comparison.valueOf(Ascii.toUpperCase(value));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("unknown comparison '" + value + "'");
    }
  }
}

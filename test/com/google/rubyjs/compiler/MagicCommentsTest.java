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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MagicCommentsTest {

  @Test
  public void testFindReadsLeadingComment() {
    assertThat(MagicComments.find("\n# rubyjs: preset\nputs 1\n")).isEqualTo(" preset");
    assertThat(MagicComments.find("#ruby2js: filters: return")).isEqualTo(" filters: return");
  }

  @Test
  public void testFindIgnoresLaterComments() {
    assertThat(MagicComments.find("puts 1\n# rubyjs: preset\n")).isNull();
    assertThat(MagicComments.find("# just a comment\n# rubyjs: preset\n")).isNull();
    assertThat(MagicComments.find("")).isNull();
  }

  @Test
  public void testFiltersAreAppended() {
    ConversionOptions options = new ConversionOptions();
    options.addFilter("camelCase");
    MagicComments.applySettings(" filters: functions, return", options);
    assertThat(options.getFilters()).containsExactly("camelCase", "functions", "return").inOrder();
  }

  @Test
  public void testPreset() {
    ConversionOptions options = new ConversionOptions();
    options.addFilter("camelCase");
    MagicComments.applySettings(" preset", options);
    assertThat(options.getFilters()).containsExactly("functions", "return", "camelCase").inOrder();
    assertThat(options.getLanguageMode()).isEqualTo(LanguageMode.ECMASCRIPT_2022);
    assertThat(options.getComparison()).isEqualTo(ConversionOptions.Comparison.IDENTITY);
    assertThat(options.isUnderscoredPrivate()).isTrue();
  }

  @Test
  public void testPresetWithOverrides() {
    ConversionOptions options = new ConversionOptions();
    MagicComments.applySettings(
        " preset disable_filters: RETURN eslevel: 2017 comparison: equality", options);
    assertThat(options.getFilters()).containsExactly("functions");
    assertThat(options.getLanguageMode()).isEqualTo(LanguageMode.ECMASCRIPT_2017);
    assertThat(options.getComparison()).isEqualTo(ConversionOptions.Comparison.EQUALITY);
  }

  @Test
  public void testApplyWithoutMagicCommentLeavesOptionsAlone() {
    ConversionOptions options = new ConversionOptions();
    MagicComments.apply("x = 1\n", options);
    assertThat(options.getFilters()).isEmpty();
    assertThat(options.getLanguageMode()).isEqualTo(LanguageMode.DEFAULT);
  }

  @Test
  public void testErrors() {
    ConversionOptions options = new ConversionOptions();
    assertThrows(
        ConfigurationException.class, () -> MagicComments.applySettings(" colour: red", options));
    assertThrows(
        ConfigurationException.class, () -> MagicComments.applySettings(" eslevel", options));
    assertThrows(
        ConfigurationException.class,
        () -> MagicComments.applySettings(" comparison: fuzzy", options));
    assertThrows(
        ConfigurationException.class, () -> MagicComments.applySettings(" eslevel: 1999", options));
  }
}

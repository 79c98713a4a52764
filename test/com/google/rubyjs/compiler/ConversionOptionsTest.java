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

import com.google.common.collect.ImmutableList;
import com.google.rubyjs.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ConversionOptionsTest {

  @Test
  public void testDefaults() {
    ConversionOptions options = new ConversionOptions();
    assertThat(options.getLanguageMode()).isEqualTo(LanguageMode.ECMASCRIPT_2020);
    assertThat(options.getFilters()).isEmpty();
    assertThat(options.getLineWidth()).isEqualTo(80);
    assertThat(options.getComparison()).isEqualTo(ConversionOptions.Comparison.EQUALITY);
    assertThat(options.isStrict()).isFalse();
    assertThat(options.shouldCreateSourceMap()).isFalse();
  }

  @Test
  public void testFiltersAreDeduplicatedIgnoringCase() {
    ConversionOptions options = new ConversionOptions();
    options.setFilters(ImmutableList.of("return", "functions", "RETURN"));
    options.addFilter("Functions");
    assertThat(options.getFilters()).containsExactly("return", "functions").inOrder();
  }

  @Test
  public void testCopyIsIndependent() {
    ConversionOptions options = new ConversionOptions();
    options.addFilter("return");
    options.exclude("each");
    options.excludeNodeTypes("functions", Token.BLOCK);
    options.setStrict(true);

    ConversionOptions copy = options.copy();
    copy.addFilter("functions");
    copy.exclude("map");
    copy.setLanguageMode(LanguageMode.ECMASCRIPT5);

    assertThat(options.getFilters()).containsExactly("return");
    assertThat(options.getExcludedMethods()).containsExactly("each");
    assertThat(options.getLanguageMode()).isEqualTo(LanguageMode.DEFAULT);
    assertThat(copy.getFilters()).containsExactly("return", "functions").inOrder();
    assertThat(copy.getExcludedMethods()).containsExactly("each", "map").inOrder();
    assertThat(copy.isStrict()).isTrue();
    assertThat(copy.isNodeTypeExcluded("Functions", Token.BLOCK)).isTrue();
    assertThat(copy.isNodeTypeExcluded("functions", Token.SEND)).isFalse();
  }

  @Test
  public void testValidate() {
    new ConversionOptions().validate();

    ConversionOptions negativeWidth = new ConversionOptions();
    negativeWidth.setLineWidth(-1);
    assertThrows(ConfigurationException.class, negativeWidth::validate);

    ConversionOptions blankFilter = new ConversionOptions();
    blankFilter.addFilter(" ");
    assertThrows(ConfigurationException.class, blankFilter::validate);

    ConversionOptions conflicting = new ConversionOptions().exclude("puts").include("puts");
    ConfigurationException e = assertThrows(ConfigurationException.class, conflicting::validate);
    assertThat(e).hasMessageThat().contains("puts");
  }
}

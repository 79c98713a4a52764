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
public final class LanguageModeTest {

  @Test
  public void testFromYear() {
    assertThat(LanguageMode.fromYear(5)).isEqualTo(LanguageMode.ECMASCRIPT5);
    assertThat(LanguageMode.fromYear(2009)).isEqualTo(LanguageMode.ECMASCRIPT5);
    assertThat(LanguageMode.fromYear(6)).isEqualTo(LanguageMode.ECMASCRIPT_2015);
    assertThat(LanguageMode.fromYear(2021)).isEqualTo(LanguageMode.ECMASCRIPT_2021);
    assertThrows(ConfigurationException.class, () -> LanguageMode.fromYear(2008));
  }

  @Test
  public void testFromString() {
    assertThat(LanguageMode.fromString("es2015")).isEqualTo(LanguageMode.ECMASCRIPT_2015);
    assertThat(LanguageMode.fromString("ECMASCRIPT_2021")).isEqualTo(LanguageMode.ECMASCRIPT_2021);
    assertThat(LanguageMode.fromString(" es5 ")).isEqualTo(LanguageMode.ECMASCRIPT5);
    assertThat(LanguageMode.fromString("2020")).isEqualTo(LanguageMode.ECMASCRIPT_2020);
  }

  @Test
  public void testFromStringRejectsUnknownNames() {
    assertThrows(ConfigurationException.class, () -> LanguageMode.fromString("es1999"));
    assertThrows(ConfigurationException.class, () -> LanguageMode.fromString("next"));
  }

  @Test
  public void testOrdering() {
    assertThat(LanguageMode.ECMASCRIPT_2022.isAtLeast(LanguageMode.ECMASCRIPT_2016)).isTrue();
    assertThat(LanguageMode.ECMASCRIPT_2016.isAtLeast(LanguageMode.ECMASCRIPT_2016)).isTrue();
    assertThat(LanguageMode.ECMASCRIPT5.isAtLeast(LanguageMode.ECMASCRIPT_2015)).isFalse();
    assertThat(LanguageMode.ECMASCRIPT5.isEs5()).isTrue();
    assertThat(LanguageMode.DEFAULT.getYear()).isEqualTo(2020);
  }
}

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

/** The JavaScript feature tiers the code generator can target. */
public enum LanguageMode {
  /** Traditional JavaScript: {@code var}, function expressions and prototype classes. */
  ECMASCRIPT5(2009),

  /** Adds classes, arrow functions, {@code let}, template literals and spread. */
  ECMASCRIPT_2015(2015),

  /** Adds the exponent operator (**). */
  ECMASCRIPT_2016(2016),

  ECMASCRIPT_2017(2017),

  /** Adds "..." in object literals and patterns. */
  ECMASCRIPT_2018(2018),

  /** Adds catch blocks with no error binding. */
  ECMASCRIPT_2019(2019),

  /** Adds optional chaining and the nullish coalescing operator. */
  ECMASCRIPT_2020(2020),

  /** Adds the logical assignment operators. */
  ECMASCRIPT_2021(2021),

  /** Adds private and static class fields, static blocks and {@code Array.prototype.at}. */
  ECMASCRIPT_2022(2022);

  /** The level used when a conversion names none. */
  public static final LanguageMode DEFAULT = ECMASCRIPT_2020;

  private final int year;

  LanguageMode(int year) {
    this.year = year;
  }

  /** The publication year of the edition; 2009 for ECMAScript 5. */
  public int getYear() {
    return year;
  }

  /** Whether this level includes everything in {@code other}. */
  public boolean isAtLeast(LanguageMode other) {
    return compareTo(other) >= 0;
  }

  public boolean isEs5() {
    return this == ECMASCRIPT5;
  }

  /**
   * Returns the mode for an edition year. Both the year ({@code 2015}) and the edition number
   * ({@code 5}, {@code 6}) are accepted.
   *
   * @throws ConfigurationException if no mode matches
   */
  public static LanguageMode fromYear(int year) {
    switch (year) {
      case 5:
      case 2009:
        return ECMASCRIPT5;
      case 6:
        return ECMASCRIPT_2015;
      default:
        break;
    }
    for (LanguageMode mode : values()) {
      if (mode.year == year) {
        return mode;
      }
    }
    throw new ConfigurationException("unknown language level " + year);
  }

  /**
   * Parses a level such as {@code es2015}, {@code ECMASCRIPT_2021}, {@code es5} or {@code 2020}.
   *
   * @throws ConfigurationException if the name matches no mode
   */
  public static LanguageMode fromString(String value) {
    // Trim spaces, disregard case, and allow abbreviation of ECMASCRIPT for convenience.
    String canonicalizedName = Ascii.toUpperCase(value.trim()).replaceFirst("^ES", "ECMASCRIPT");
    String digits = canonicalizedName.replaceFirst("^ECMASCRIPT_?", "");
    if (!digits.isEmpty() && digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
      try {
        return fromYear(Integer.parseInt(digits));
      } catch (NumberFormatException e) {
        throw new ConfigurationException("unknown language level " + value);
      }
    }
    try {
      return LanguageMode.valueOf(canonicalizedName);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("unknown language level " + value);
    }
  }
}

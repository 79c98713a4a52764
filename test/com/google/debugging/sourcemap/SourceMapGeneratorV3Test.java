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

package com.google.debugging.sourcemap;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceMapGeneratorV3Test {

  private SourceMapGeneratorV3 generator;

  @Before
  public void setUp() {
    generator = new SourceMapGeneratorV3();
    generator.addMapping(
        "a.rb", null, new FilePosition(0, 0), new FilePosition(0, 0), new FilePosition(0, 5));
    generator.addMapping(
        "a.rb", "foo", new FilePosition(1, 2), new FilePosition(0, 6), new FilePosition(0, 9));
    generator.addMapping(
        "a.rb", null, new FilePosition(2, 0), new FilePosition(1, 0), new FilePosition(1, 4));
  }

  @Test
  public void testJson() {
    assertThat(generator.toJsonString("a.js"))
        .isEqualTo(
            "{\"version\":3,\"file\":\"a.js\",\"sources\":[\"a.rb\"],\"names\":[\"foo\"],"
                + "\"mappings\":\"AAAA,K,CACEA,G;AACF\"}");
  }

  @Test
  public void testConsumerReadsGeneratedMap() {
    SourceMapConsumerV3 consumer = SourceMapConsumerV3.parse(generator.toJsonString("a.js"));
    assertThat(consumer.getOriginalSources()).containsExactly("a.rb");

    OriginalMapping first = consumer.getMappingForLine(1, 1);
    assertThat(first.getOriginalFile()).isEqualTo("a.rb");
    assertThat(first.getLineNumber()).isEqualTo(1);
    assertThat(first.getColumnPosition()).isEqualTo(1);
    assertThat(first.getIdentifier().isPresent()).isFalse();

    OriginalMapping named = consumer.getMappingForLine(1, 8);
    assertThat(named.getLineNumber()).isEqualTo(2);
    assertThat(named.getColumnPosition()).isEqualTo(3);
    assertThat(named.getIdentifier().get()).isEqualTo("foo");

    assertThat(consumer.getMappingForLine(1, 6)).isNull();
    assertThat(consumer.getMappingForLine(2, 3).getLineNumber()).isEqualTo(3);
    assertThat(consumer.getMappingForLine(3, 1)).isNull();
  }

  @Test
  public void testNestedMappingReturnsToParent() {
    SourceMapGeneratorV3 nested = new SourceMapGeneratorV3();
    nested.addMapping(
        "b.rb", null, new FilePosition(4, 0), new FilePosition(0, 0), new FilePosition(0, 10));
    nested.addMapping(
        "b.rb", null, new FilePosition(4, 6), new FilePosition(0, 3), new FilePosition(0, 5));
    SourceMapConsumerV3 consumer = SourceMapConsumerV3.parse(nested.toJsonString("b.js"));

    assertThat(consumer.getMappingForLine(1, 4).getColumnPosition()).isEqualTo(7);
    assertThat(consumer.getMappingForLine(1, 8).getColumnPosition()).isEqualTo(1);
  }

  @Test
  public void testSourcesContent() {
    generator.addSourcesContent("a.rb", "x = 1\n");
    SourceMapConsumerV3 consumer = SourceMapConsumerV3.parse(generator.toJsonString("a.js"));
    assertThat(consumer.getSourceContent("a.rb")).isEqualTo("x = 1\n");
    assertThat(consumer.getSourceContent("other.rb")).isEmpty();
  }

  @Test
  public void testMappingsMustBeAddedInOrder() {
    assertThrows(
        IllegalStateException.class,
        () ->
            generator.addMapping(
                "a.rb",
                null,
                new FilePosition(0, 0),
                new FilePosition(0, 2),
                new FilePosition(0, 3)));
  }

  @Test
  public void testResetForgetsEverything() {
    generator.reset();
    assertThat(generator.toJsonString(""))
        .isEqualTo("{\"version\":3,\"file\":\"\",\"sources\":[],\"names\":[],\"mappings\":\"\"}");
  }

  @Test
  public void testConsumerRejectsOtherVersions() {
    assertThrows(IllegalArgumentException.class, () -> SourceMapConsumerV3.parse("[]"));
    assertThrows(
        IllegalArgumentException.class, () -> SourceMapConsumerV3.parse("{\"version\":2}"));
  }
}

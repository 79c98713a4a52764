/*
 * Copyright 2011 The Closure Compiler Authors.
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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Reads a Source Map Revision 3 document and answers which original position a generated position
 * came from.
 */
public final class SourceMapConsumerV3 {
  private static final int UNMAPPED = -1;

  private final ImmutableList<String> sources;
  private final ImmutableList<String> sourcesContent;
  private final ImmutableList<String> names;
  /** Entries per generated line; null for lines with no segments. */
  private final List<@Nullable List<Entry>> lines = new ArrayList<>();

  private SourceMapConsumerV3(
      ImmutableList<String> sources,
      ImmutableList<String> sourcesContent,
      ImmutableList<String> names) {
    this.sources = sources;
    this.sourcesContent = sourcesContent;
    this.names = names;
  }

  /**
   * Parses a source map.
   *
   * @throws IllegalArgumentException if the text is not a version 3 source map
   */
  public static SourceMapConsumerV3 parse(String contents) {
    JsonObject map;
    try {
      map = JsonParser.parseString(contents).getAsJsonObject();
    } catch (JsonParseException | IllegalStateException e) {
      throw new IllegalArgumentException("source map is not a JSON object", e);
    }
    checkArgument(
        map.has("version") && map.get("version").getAsInt() == 3, "unsupported version");
    SourceMapConsumerV3 consumer =
        new SourceMapConsumerV3(
            stringList(map.getAsJsonArray("sources")),
            contentList(map.getAsJsonArray("sourcesContent")),
            stringList(map.getAsJsonArray("names")));
    consumer.parseMappings(map.get("mappings").getAsString());
    return consumer;
  }

  private static ImmutableList<String> stringList(@Nullable JsonArray array) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    if (array != null) {
      for (JsonElement e : array) {
        builder.add(e.getAsString());
      }
    }
    return builder.build();
  }

  /** Like {@link #stringList}, with missing entries read as the empty string. */
  private static ImmutableList<String> contentList(@Nullable JsonArray array) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    if (array != null) {
      for (JsonElement e : array) {
        builder.add(e.isJsonNull() ? "" : e.getAsString());
      }
    }
    return builder.build();
  }

  private void parseMappings(String mappings) {
    int sourceId = 0;
    int sourceLine = 0;
    int sourceColumn = 0;
    int nameId = 0;
    List<Entry> current = null;
    int column = 0;
    int pos = 0;
    while (pos <= mappings.length()) {
      if (pos == mappings.length() || mappings.charAt(pos) == ';') {
        lines.add(current);
        current = null;
        column = 0;
        pos++;
        continue;
      }
      if (mappings.charAt(pos) == ',') {
        pos++;
        continue;
      }
      Base64VLQ.Cursor cursor = new Base64VLQ.Cursor(mappings, pos);
      column += cursor.decode();
      Entry entry;
      if (cursor.atSegmentEnd()) {
        entry = new Entry(column, UNMAPPED, 0, 0, UNMAPPED);
      } else {
        sourceId += cursor.decode();
        sourceLine += cursor.decode();
        sourceColumn += cursor.decode();
        int entryName = UNMAPPED;
        if (!cursor.atSegmentEnd()) {
          nameId += cursor.decode();
          entryName = nameId;
        }
        entry = new Entry(column, sourceId, sourceLine, sourceColumn, entryName);
      }
      if (current == null) {
        current = new ArrayList<>();
      }
      current.add(entry);
      pos = cursor.position();
    }
  }

  public ImmutableList<String> getOriginalSources() {
    return sources;
  }

  /** The embedded source text, or the empty string when the map carries none for that source. */
  public String getSourceContent(String source) {
    int index = sources.indexOf(source);
    return index >= 0 && index < sourcesContent.size() ? sourcesContent.get(index) : "";
  }

  /**
   * Returns the original position for a 1-based generated line and column, or null if the
   * position is not mapped.
   */
  public @Nullable OriginalMapping getMappingForLine(int lineNumber, int column) {
    lineNumber--;
    column--;
    if (lineNumber < 0 || lineNumber >= lines.size()) {
      return null;
    }
    List<Entry> entries = lines.get(lineNumber);
    if (entries == null || entries.get(0).generatedColumn > column) {
      return getPreviousMapping(lineNumber);
    }
    Entry match = entries.get(0);
    for (Entry entry : entries) {
      if (entry.generatedColumn > column) {
        break;
      }
      match = entry;
    }
    return toOriginalMapping(match, OriginalMapping.Precision.EXACT);
  }

  private @Nullable OriginalMapping getPreviousMapping(int lineNumber) {
    do {
      if (lineNumber == 0) {
        return null;
      }
      lineNumber--;
    } while (lines.get(lineNumber) == null);
    List<Entry> entries = lines.get(lineNumber);
    return toOriginalMapping(
        entries.get(entries.size() - 1), OriginalMapping.Precision.APPROXIMATE_LINE);
  }

  private @Nullable OriginalMapping toOriginalMapping(
      Entry entry, OriginalMapping.Precision precision) {
    if (entry.sourceFileId == UNMAPPED) {
      return null;
    }
    OriginalMapping.Builder builder =
        OriginalMapping.builder()
            .setOriginalFile(sources.get(entry.sourceFileId))
            .setLineNumber(entry.sourceLine + 1)
            .setColumnPosition(entry.sourceColumn + 1)
            .setPrecision(precision);
    if (entry.nameId != UNMAPPED) {
      builder.setIdentifier(names.get(entry.nameId));
    }
    return builder.build();
  }

  private static final class Entry {
    final int generatedColumn;
    final int sourceFileId;
    final int sourceLine;
    final int sourceColumn;
    final int nameId;

    Entry(int generatedColumn, int sourceFileId, int sourceLine, int sourceColumn, int nameId) {
      this.generatedColumn = generatedColumn;
      this.sourceFileId = sourceFileId;
      this.sourceLine = sourceLine;
      this.sourceColumn = sourceColumn;
      this.nameId = nameId;
    }
  }
}

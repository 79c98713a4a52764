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

import static com.google.common.base.Preconditions.checkState;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Collects mappings from generated code to original source and writes them as a Source Map
 * Revision 3 document.
 *
 * <p>Mappings are added in the order the code generator opens them, which is a pre-order walk of
 * the printed tree. A mapping may enclose later ones; text that follows a nested mapping but is
 * still inside its parent is attributed back to the parent.
 */
public final class SourceMapGeneratorV3 {

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  private final List<Mapping> mappings = new ArrayList<>();
  private final Map<String, Integer> sourceFileIds = new LinkedHashMap<>();
  private final Map<String, @Nullable String> sourcesContent = new LinkedHashMap<>();
  private final Map<String, Integer> originalNameIds = new LinkedHashMap<>();
  private @Nullable Mapping lastMapping;

  /** Forgets all mappings and sources. */
  public void reset() {
    mappings.clear();
    sourceFileIds.clear();
    sourcesContent.clear();
    originalNameIds.clear();
    lastMapping = null;
  }

  /** Records the text of a source file, emitted as {@code sourcesContent}. */
  public void addSourcesContent(String sourceName, String content) {
    getSourceId(sourceName);
    sourcesContent.put(sourceName, content);
  }

  /**
   * Adds a mapping for a span of generated code. Mappings must be added in order of their start
   * position.
   *
   * @param sourceName the original file
   * @param symbolName the original identifier at this position, if any
   * @param originalPosition zero-based position in the original file
   * @param startPosition zero-based start in the generated file
   * @param endPosition zero-based end in the generated file
   */
  public void addMapping(
      String sourceName,
      @Nullable String symbolName,
      FilePosition originalPosition,
      FilePosition startPosition,
      FilePosition endPosition) {
    if (originalPosition.getLine() < 0) {
      return;
    }
    Mapping mapping = new Mapping(sourceName, symbolName, originalPosition, startPosition,
        endPosition);
    if (lastMapping != null) {
      checkState(
          mapping.startPosition.compareTo(lastMapping.startPosition) >= 0,
          "Incorrect source mappings order, previous : %s\nnew : %s",
          lastMapping.startPosition,
          mapping.startPosition);
    }
    lastMapping = mapping;
    mappings.add(mapping);
  }

  /** Returns the source map as a JSON object. */
  public JsonObject toJson(String generatedFileName) {
    JsonObject map = new JsonObject();
    map.addProperty("version", 3);
    map.addProperty("file", generatedFileName);

    StringBuilder encoded = new StringBuilder();
    new LineMapper(encoded).appendLineMappings();

    JsonArray sources = new JsonArray();
    sourceFileIds.keySet().forEach(sources::add);
    map.add("sources", sources);
    if (!sourcesContent.isEmpty()) {
      JsonArray contents = new JsonArray();
      for (String source : sourceFileIds.keySet()) {
        String content = sourcesContent.get(source);
        if (content == null) {
          contents.add(JsonNull.INSTANCE);
        } else {
          contents.add(content);
        }
      }
      map.add("sourcesContent", contents);
    }
    JsonArray names = new JsonArray();
    originalNameIds.keySet().forEach(names::add);
    map.add("names", names);
    map.addProperty("mappings", encoded.toString());
    return map;
  }

  /** Appends the source map in JSON form. */
  public String toJsonString(String generatedFileName) {
    return GSON.toJson(toJson(generatedFileName));
  }

  private int getSourceId(String sourceName) {
    return sourceFileIds.computeIfAbsent(sourceName, k -> sourceFileIds.size());
  }

  private int getNameId(String symbolName) {
    return originalNameIds.computeIfAbsent(symbolName, k -> originalNameIds.size());
  }

  /** A span of generated code and the original position it came from. */
  private static final class Mapping {
    final String sourceFile;
    final @Nullable String originalName;
    final FilePosition originalPosition;
    final FilePosition startPosition;
    final FilePosition endPosition;

    Mapping(
        String sourceFile,
        @Nullable String originalName,
        FilePosition originalPosition,
        FilePosition startPosition,
        FilePosition endPosition) {
      this.sourceFile = sourceFile;
      this.originalName = originalName;
      this.originalPosition = originalPosition;
      this.startPosition = startPosition;
      this.endPosition = endPosition;
    }

    /** Whether {@code this} still encloses the start of {@code next}. */
    boolean encloses(Mapping next) {
      return endPosition.compareTo(next.startPosition) > 0;
    }
  }

  private interface MappingVisitor {
    /** Visits a segment of generated code; {@code m} is null for unmapped text. */
    void visit(@Nullable Mapping m, int line, int col, int nextLine, int nextCol);
  }

  /**
   * Visits each segment of generated code once, rebuilding the nesting of mappings with a stack.
   */
  private final class MappingTraversal {
    private int line;
    private int col;

    void traverse(MappingVisitor v) {
      Deque<Mapping> stack = new ArrayDeque<>();
      for (Mapping m : mappings) {
        while (!stack.isEmpty() && !stack.peek().encloses(m)) {
          maybeVisit(v, stack.pop(), stack.peek());
        }
        // The gap before this mapping belongs to its parent.
        advanceTo(v, stack.peek(), m.startPosition);
        stack.push(m);
      }
      while (!stack.isEmpty()) {
        maybeVisit(v, stack.pop(), stack.peek());
      }
    }

    private void maybeVisit(MappingVisitor v, Mapping m, @Nullable Mapping parent) {
      FilePosition end = m.endPosition;
      if (parent != null && parent.endPosition.compareTo(end) < 0) {
        end = parent.endPosition;
      }
      advanceTo(v, m, end);
    }

    private void advanceTo(MappingVisitor v, @Nullable Mapping m, FilePosition next) {
      if (line < next.getLine() || (line == next.getLine() && col < next.getColumn())) {
        v.visit(m, line, col, next.getLine(), next.getColumn());
        line = next.getLine();
        col = next.getColumn();
      }
    }
  }

  /** Writes the "mappings" field: one group per generated line, segments relative-encoded. */
  private final class LineMapper implements MappingVisitor {
    private final StringBuilder out;

    private int previousLine = -1;
    private int previousColumn = 0;
    private int previousSourceFileId;
    private int previousSourceLine;
    private int previousSourceColumn;
    private int previousNameId;
    private int currentLine = 0;

    LineMapper(StringBuilder out) {
      this.out = out;
    }

    @Override
    public void visit(@Nullable Mapping m, int line, int col, int nextLine, int nextCol) {
      while (currentLine < line) {
        out.append(';');
        currentLine++;
      }
      if (previousLine != line) {
        previousColumn = 0;
      } else {
        out.append(',');
      }
      writeEntry(m, col);
      previousLine = line;
    }

    private void writeEntry(@Nullable Mapping m, int column) {
      Base64VLQ.encode(out, column - previousColumn);
      previousColumn = column;
      if (m == null) {
        return;
      }
      int sourceId = getSourceId(m.sourceFile);
      Base64VLQ.encode(out, sourceId - previousSourceFileId);
      previousSourceFileId = sourceId;

      int srcLine = m.originalPosition.getLine();
      int srcColumn = m.originalPosition.getColumn();
      Base64VLQ.encode(out, srcLine - previousSourceLine);
      previousSourceLine = srcLine;
      Base64VLQ.encode(out, srcColumn - previousSourceColumn);
      previousSourceColumn = srcColumn;

      if (m.originalName != null) {
        int nameId = getNameId(m.originalName);
        Base64VLQ.encode(out, nameId - previousNameId);
        previousNameId = nameId;
      }
    }

    void appendLineMappings() {
      new MappingTraversal().traverse(this);
    }
  }
}

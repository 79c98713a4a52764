/*
 * Copyright 2004 The Closure Compiler Authors.
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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.debugging.sourcemap.FilePosition;
import com.google.debugging.sourcemap.SourceMapGeneratorV3;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.rubyjs.ast.Comment;
import com.google.rubyjs.ast.Node;
import com.google.rubyjs.ast.SourceRange;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * CodePrinter prints out JavaScript code in either pretty format or on a single line.
 *
 * @see CodeGenerator
 */
public final class CodePrinter {
  // There are two separate CodeConsumers, one for pretty-printing and
  // another for single line output.

  private abstract static class MappedCodePrinter extends CodeConsumer {
    private final @Nullable Deque<Mapping> mappings;
    private final @Nullable List<Mapping> allMappings;
    private final boolean createSrcMap;
    protected final StringBuilder code = new StringBuilder(1024);
    protected final int lineLengthThreshold;
    protected int lineLength = 0;
    protected int lineIndex = 0;

    MappedCodePrinter(int lineLengthThreshold, boolean createSrcMap) {
      this.lineLengthThreshold = lineLengthThreshold <= 0 ? Integer.MAX_VALUE :
        lineLengthThreshold;
      this.createSrcMap = createSrcMap;
      this.mappings = createSrcMap ? new ArrayDeque<Mapping>() : null;
      this.allMappings = createSrcMap ? new ArrayList<Mapping>() : null;
    }

    /**
     * Maintains a mapping from a given node to the position
     * in the source code at which its generated form was
     * placed. This position is relative only to the current
     * run of the CodeConsumer and will be normalized
     * later on by the SourceMap.
     */
    private static class Mapping {
      Node node;
      FilePosition start;
      FilePosition end;

      @Override
      public String toString() {
        // This toString() representation is used for debugging purposes only.
        return "Mapping: start " + start + ", end " + end + ", node " + node;
      }
    }

    /**
     * Starts the source mapping for the given
     * node at the current position.
     */
    @Override
    void startSourceMapping(Node node) {
      if (createSrcMap && !node.isSynthetic()) {
        int line = getCurrentLineIndex();
        int index = getCurrentCharIndex();
        checkState(line >= 0);
        Mapping mapping = new Mapping();
        mapping.node = node;
        mapping.start = new FilePosition(line, index);
        mappings.push(mapping);
        allMappings.add(mapping);
      }
    }

    /**
     * Finishes the source mapping for the given
     * node at the current position.
     */
    @Override
    void endSourceMapping(Node node) {
      if (createSrcMap && !mappings.isEmpty() && mappings.peek().node == node) {
        Mapping mapping = mappings.pop();
        int line = getCurrentLineIndex();
        int index = lineLength;
        checkState(line >= 0);
        mapping.end = new FilePosition(line, index);
      }
    }

    /**
     * Generates the source map from the given code consumer,
     * appending the information it saved to the generator given.
     */
    void generateSourceMap(String code, SourceMapGeneratorV3 map, String sourceName) {
      if (createSrcMap) {
        List<Integer> lineLengths = computeLineLengths(code);
        for (Mapping mapping : allMappings) {
          if (mapping.end == null) {
            continue;
          }
          SourceRange range = mapping.node.getSourceRange();
          map.addMapping(
              sourceName,
              null,
              new FilePosition(range.line() - 1, range.column()),
              mapping.start,
              adjustEndPosition(lineLengths, mapping.end));
        }
      }
    }

    public String getCode() {
      return code.toString();
    }

    @Override
    char getLastChar() {
      return (code.length() > 0) ? code.charAt(code.length() - 1) : '\0';
    }

    /** The column the next printed character will land on. */
    protected int getCurrentCharIndex() {
      return lineLength;
    }

    protected final int getCurrentLineIndex() {
      return lineIndex;
    }

    /** Calculates length of each line in generated code. */
    private static ImmutableList<Integer> computeLineLengths(String code) {
      ImmutableList.Builder<Integer> builder = ImmutableList.<Integer>builder();
      int lineStartPos = 0;
      int lineEndPos = code.indexOf('\n');
      while (lineEndPos > -1) {
        builder.add(lineEndPos - lineStartPos);
        // Next line starts where current line ends + 1 to skip "\n" character.
        lineStartPos = lineEndPos + 1;
        lineEndPos = code.indexOf('\n', lineStartPos);
      }
      return builder.build();
    }

    /**
     * Adjusts end position of a mapping. End position points to a column *after* the last character
     * that is covered by a mapping. If that is the end of the line, it is changed to point to the
     * first character on the next line, so that mappings ending at the same place agree.
     *
     * @param lineLengths List of all line lengths in generated code.
     * @param endPosition End position of a mapping.
     */
    private static FilePosition adjustEndPosition(
        List<Integer> lineLengths, FilePosition endPosition) {
      int line = endPosition.getLine();
      // if position points to non-existing line, return it unmodified
      if (line >= lineLengths.size()) {
        return endPosition;
      }

      Preconditions.checkState(
          endPosition.getColumn() <= lineLengths.get(line),
          "End position %s points to a column larger than line length %s",
          endPosition,
          lineLengths.get(line));

      if (endPosition.getColumn() == lineLengths.get(line)) {
        return new FilePosition(line + 1, 0);
      }
      return endPosition;
    }
  }

  static class PrettyCodePrinter extends MappedCodePrinter {
    static final String INDENT = "  ";

    private int indent = 0;

    /**
     * @param lineLengthThreshold The length of a line after which we force
     *                            a newline when possible.
     * @param createSourceMap Whether to generate source map data.
     */
    private PrettyCodePrinter(int lineLengthThreshold, boolean createSourceMap) {
      super(lineLengthThreshold, createSourceMap);
    }

    /**
     * Appends a string to the code, keeping track of the current line length.
     */
    @Override
    void append(String str) {
      // For pretty printing: indent at the beginning of the line
      if (lineLength == 0) {
        for (int i = 0; i < indent; i++) {
          code.append(INDENT);
          lineLength += INDENT.length();
        }
      }
      code.append(str);
      lineLength += str.length();
      // Correct lineIndex and lineLength if there were newlines in the string.
      int newlines = CharMatcher.is('\n').countIn(str);
      if (newlines > 0) {
        lineIndex += newlines;
        lineLength = str.length() - str.lastIndexOf('\n') - 1;
      }
    }

    @Override
    protected int getCurrentCharIndex() {
      return lineLength == 0 ? indent * INDENT.length() : lineLength;
    }

    /**
     * Adds a newline to the code, resetting the line length and handling indenting for pretty
     * printing.
     */
    @Override
    void startNewLine() {
      if (lineLength > 0) {
        code.append('\n');
        lineIndex++;
        lineLength = 0;
      }
    }

    @Override
    boolean breaksLines() {
      return true;
    }

    @Override
    void blankLine() {
      startNewLine();
      code.append('\n');
      lineIndex++;
    }

    /**
     * This may start a new line if the current line is longer than the line
     * length threshold.
     */
    @Override
    void maybeCutLine() {
      if (lineLength > lineLengthThreshold) {
        startNewLine();
      }
    }

    @Override
    void endLine() {
      startNewLine();
    }

    @Override
    void appendBlockStart() {
      append("{");
      indent++;
    }

    @Override
    void appendBlockEnd() {
      endLine();
      indent--;
      append("}");
    }

    @Override
    void listSeparator() {
      add(", ");
      maybeCutLine();
    }

    @Override
    void beginCaseBody() {
      super.beginCaseBody();
      indent++;
      endLine();
    }

    @Override
    void endCaseBody() {
      super.endCaseBody();
      endLine();
      indent--;
    }

    @Override
    void appendOp(String op, boolean binOp) {
      if (getLastChar() != ' ' && binOp && op.charAt(0) != ',') {
        append(" ");
      }
      append(op);
      if (binOp) {
        append(" ");
      }
    }

    @Override
    void addComment(String text) {
      startNewLine();
      if (text.indexOf('\n') >= 0) {
        append("/*\n" + text + "\n*/");
      } else {
        append(text.isEmpty() ? "//" : "// " + text);
      }
      startNewLine();
    }

    @Override
    void addTrailingComment(String text) {
      append(" // " + text);
    }
  }

  /** Prints everything on one line, with a space wherever the pretty layout has a line break. */
  static class OneLineCodePrinter extends MappedCodePrinter {
    private boolean pendingSpace = false;

    private OneLineCodePrinter(boolean createSrcMap) {
      super(0, createSrcMap);
      semicolons = true;
    }

    /**
     * Appends a string to the code, keeping track of the current line length.
     */
    @Override
    void append(String str) {
      if (pendingSpace) {
        pendingSpace = false;
        if (code.length() > 0 && !(str.startsWith("}") && getLastChar() == '{')) {
          code.append(' ');
          lineLength++;
        }
      }
      code.append(str);
      lineLength += str.length();
      // Correct lineIndex and lineLength if there were newlines in the string.
      int newlines = CharMatcher.is('\n').countIn(str);
      if (newlines > 0) {
        lineIndex += newlines;
        lineLength = str.length() - str.lastIndexOf('\n') - 1;
      }
    }

    @Override
    protected int getCurrentCharIndex() {
      return pendingSpace && code.length() > 0 ? lineLength + 1 : lineLength;
    }

    @Override
    void startNewLine() {
      pendingSpace = true;
    }

    @Override
    void endLine() {
      startNewLine();
    }

    @Override
    void listSeparator() {
      add(", ");
    }

    @Override
    void beginCaseBody() {
      super.beginCaseBody();
      endLine();
    }

    @Override
    void appendOp(String op, boolean binOp) {
      if (getLastChar() != ' ' && binOp && op.charAt(0) != ',') {
        append(" ");
      }
      append(op);
      if (binOp) {
        append(" ");
      }
    }

    @Override
    void addComment(String text) {
      append("/* " + text.trim() + " */");
      startNewLine();
    }

    @Override
    void addTrailingComment(String text) {
      append(" /* " + text.trim() + " */");
    }
  }

  public static final class Builder {
    private final Node root;
    private final ConversionContext context;
    private boolean prettyPrint = true;
    private ImmutableList<Comment> comments = ImmutableList.of();
    private @Nullable SourceMapGeneratorV3 sourceMap = null;

    /**
     * Sets the root node from which to generate the source code.
     * @param node The root node.
     */
    public Builder(ConversionContext context, Node node) {
      this.context = context;
      this.root = node;
    }

    /**
     * Sets whether pretty printing should be used.
     * @param prettyPrint If true, pretty printing will be used.
     */
    @CanIgnoreReturnValue
    public Builder setPrettyPrint(boolean prettyPrint) {
      this.prettyPrint = prettyPrint;
      return this;
    }

    /** Sets the source comments to re-attach to the printed statements. */
    @CanIgnoreReturnValue
    public Builder setComments(List<Comment> comments) {
      this.comments = ImmutableList.copyOf(comments);
      return this;
    }

    /**
     * Sets the source map to which to write the metadata about
     * the generated source code.
     *
     * @param sourceMap The source map.
     */
    @CanIgnoreReturnValue
    public Builder setSourceMap(SourceMapGeneratorV3 sourceMap) {
      this.sourceMap = sourceMap;
      return this;
    }

    /**
     * Generates the source code and returns it.
     */
    public String build() {
      if (root == null) {
        throw new IllegalStateException(
            "Cannot build without root node being specified");
      }
      return toSource(root, context, prettyPrint, comments, sourceMap);
    }
  }

  /** Converts a tree to JavaScript code. */
  private static String toSource(
      Node root,
      ConversionContext context,
      boolean prettyPrint,
      List<Comment> comments,
      @Nullable SourceMapGeneratorV3 sourceMap) {
    boolean createSourceMap = (sourceMap != null);
    ConversionOptions options = context.getOptions();
    MappedCodePrinter mcp =
        prettyPrint
            ? new PrettyCodePrinter(options.getLineWidth(), createSourceMap)
            : new OneLineCodePrinter(createSourceMap);
    if (prettyPrint) {
      mcp.semicolons = options.getSemicolons();
    }
    CodeGenerator cg = new CodeGenerator(mcp, context, new CommentMap(comments));
    cg.printProgram(root);
    mcp.endFile();

    String code = mcp.getCode();

    if (createSourceMap) {
      String sourceName = context.getSourceName();
      mcp.generateSourceMap(code, sourceMap, sourceName == null ? "" : sourceName);
    }

    return code;
  }

  private CodePrinter() {}
}

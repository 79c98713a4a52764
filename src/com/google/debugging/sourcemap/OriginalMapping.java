/*
 * Copyright 2009 The Closure Compiler Authors.
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

import com.google.auto.value.AutoValue;
import java.util.Optional;

/**
 * The original source position of a generated position, as answered by {@link
 * SourceMapConsumerV3#getMappingForLine}. Lines and columns are 1-based.
 */
@AutoValue
public abstract class OriginalMapping {

  /** Whether the lookup hit a mapping segment exactly or fell back to the closest one before. */
  public enum Precision {
    EXACT,
    APPROXIMATE_LINE
  }

  public static Builder builder() {
    return new AutoValue_OriginalMapping.Builder();
  }

  public abstract String getOriginalFile();

  public abstract int getLineNumber();

  public abstract int getColumnPosition();

  /** The original name of the identifier, if the segment named one. */
  public abstract Optional<String> getIdentifier();

  public abstract Precision getPrecision();

  /** Builder for {@link OriginalMapping}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setOriginalFile(String originalFile);

    public abstract Builder setLineNumber(int lineNumber);

    public abstract Builder setColumnPosition(int columnPosition);

    public abstract Builder setIdentifier(String identifier);

    public abstract Builder setPrecision(Precision precision);

    public abstract OriginalMapping build();
  }
}

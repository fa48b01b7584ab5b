// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.flowlint.java.syntax;

import com.google.auto.value.AutoValue;

/**
 * FileOptions is a set of options that affect the scanning and parsing of a single source file.
 * These options select the dialect accepted by the frontend.
 *
 * <p>The {@link #DEFAULT} options accept the full language subset understood by the analyses.
 * Stricter options exist for callers that analyze code written for older interpreters.
 */
@AutoValue
public abstract class FileOptions {

  /** The default options. New clients should use these defaults. */
  public static final FileOptions DEFAULT = builder().build();

  /**
   * During parsing, treat {@code match} and {@code case} at the start of a statement as the soft
   * keywords of a structural pattern matching statement.
   */
  public abstract boolean allowMatchStatements();

  /** During lexing, accept tab characters in indentation (each counts as one column). */
  public abstract boolean allowTabsInIndentation();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_FileOptions.Builder()
        .allowMatchStatements(true)
        .allowTabsInIndentation(true);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link FileOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder allowMatchStatements(boolean value);

    public abstract Builder allowTabsInIndentation(boolean value);

    public abstract FileOptions build();
  }
}

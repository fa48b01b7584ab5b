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

package net.flowlint.java.analysis;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;
import java.util.regex.Pattern;
import net.flowlint.java.syntax.FileOptions;

/** Options that affect how a unit is analyzed. */
@AutoValue
public abstract class AnalysisOptions {

  /** The default options. */
  public static final AnalysisOptions DEFAULT = builder().build();

  /** The options used to parse source text passed to the {@link Analyzer}. */
  public abstract FileOptions fileOptions();

  /**
   * Names of methods presumed to change the object they are called on. A call {@code x.m(...)}
   * where a prefix of {@code m} matches this pattern modifies {@code x}.
   */
  public abstract Pattern mutatingMethods();

  /**
   * Builtins that expose variables by name when called without arguments. A unit that calls one
   * of them has no dataflow facts.
   */
  public abstract ImmutableSet<String> dynamicScopeBuiltins();

  /**
   * Whether a call of a known function also reads, at the call site, the outer variables that the
   * function reads.
   */
  public abstract boolean interproceduralCalls();

  private static final String MUTATING_METHODS =
      "append|clear|extend|insert|pop|remove|reverse|sort|add|.*update|write";

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_AnalysisOptions.Builder()
        .fileOptions(FileOptions.DEFAULT)
        .mutatingMethods(Pattern.compile(MUTATING_METHODS))
        .dynamicScopeBuiltins(ImmutableSet.of("locals", "globals", "vars"))
        .interproceduralCalls(true);
  }

  public abstract Builder toBuilder();

  /** Reports whether a call of the named method modifies its receiver. */
  public boolean isMutatingMethod(String name) {
    return mutatingMethods().matcher(name).lookingAt();
  }

  /** Builder for {@link AnalysisOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder fileOptions(FileOptions value);

    public abstract Builder mutatingMethods(Pattern value);

    public abstract Builder dynamicScopeBuiltins(ImmutableSet<String> value);

    public abstract Builder interproceduralCalls(boolean value);

    public abstract AnalysisOptions build();
  }
}

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

/**
 * A variable: a name bound in a particular scope. Two occurrences of a name denote the same
 * variable when they resolve to the same scope.
 */
@AutoValue
public abstract class Variable {

  public abstract String getName();

  public abstract Scope getScope();

  public static Variable of(String name, Scope scope) {
    return new AutoValue_Variable(name, scope);
  }

  @Override
  public final String toString() {
    return getName() + "@" + getScope().getName();
  }
}

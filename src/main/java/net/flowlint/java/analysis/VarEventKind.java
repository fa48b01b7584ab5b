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

/** The ways in which an occurrence of a name affects its variable. */
public enum VarEventKind {
  /** The first binding of the variable in its scope, or the first after a deletion. */
  ASSIGN,
  /** A binding of a variable that was already bound. */
  REASSIGN,
  /**
   * An in-place change of the value: a store to an attribute or element, or a call of a mutating
   * method. A modification both uses and redefines the variable.
   */
  MODIFY,
  READ,
  DELETE;

  /** Reports whether events of this kind use the value reaching them. */
  public boolean isUse() {
    return this == READ || this == MODIFY;
  }

  /** Reports whether events of this kind replace the value of the variable. */
  public boolean isDefinition() {
    return this != READ;
  }
}

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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import net.flowlint.java.cfg.CfgLoc;
import net.flowlint.java.syntax.Expression;
import net.flowlint.java.syntax.Identifier;

/**
 * A VarEvent records what one occurrence of a name does to its variable.
 *
 * <p>Reaching-definitions analysis links events: a use (a read or a modification) lists the
 * definitions that may reach it, and each definition lists the uses it reaches. Definitions are
 * also linked to the earlier definitions of the same variable that they may overwrite.
 */
public final class VarEvent {

  private final Variable variable;
  private final Identifier node;
  private final Expression access;
  private final VarEventKind kind;
  private final CfgLoc loc;

  private final List<VarEvent> definitions = new ArrayList<>();
  private final List<VarEvent> uses = new ArrayList<>();
  private final List<VarEvent> redefines = new ArrayList<>();
  private final List<VarEvent> redefinedBy = new ArrayList<>();

  VarEvent(Variable variable, Identifier node, Expression access, VarEventKind kind, CfgLoc loc) {
    this.variable = variable;
    this.node = node;
    this.access = access;
    this.kind = kind;
    this.loc = loc;
  }

  public Variable getVariable() {
    return variable;
  }

  /** Returns the occurrence of the name. */
  public Identifier getNode() {
    return node;
  }

  /**
   * Returns the expression through which the variable is accessed: the name itself, or for a
   * modification, the attribute, subscript or method reference rooted at the name.
   */
  public Expression getAccess() {
    return access;
  }

  public VarEventKind getKind() {
    return kind;
  }

  /** Returns the location of the statement (or statement part) in which the event occurs. */
  public CfgLoc getLoc() {
    return loc;
  }

  /** Returns the definitions that may reach this use, in order of appearance. */
  public List<VarEvent> getDefinitions() {
    return Collections.unmodifiableList(definitions);
  }

  /** Returns the uses that this definition may reach. */
  public List<VarEvent> getUses() {
    return Collections.unmodifiableList(uses);
  }

  /** Returns the earlier definitions of the variable that this definition may overwrite. */
  public List<VarEvent> getRedefines() {
    return Collections.unmodifiableList(redefines);
  }

  /** Returns the later definitions of the variable that may overwrite this one. */
  public List<VarEvent> getRedefinedBy() {
    return Collections.unmodifiableList(redefinedBy);
  }

  /** Returns the definitions reaching this use that bind or modify the variable. */
  public ImmutableList<VarEvent> getLiveDefinitions() {
    ImmutableList.Builder<VarEvent> result = ImmutableList.builder();
    for (VarEvent def : definitions) {
      if (def.kind != VarEventKind.DELETE) {
        result.add(def);
      }
    }
    return result.build();
  }

  // Links a definition to a use it reaches.
  static void linkUse(VarEvent def, VarEvent use) {
    if (!use.definitions.contains(def)) {
      use.definitions.add(def);
      def.uses.add(use);
    }
  }

  // Links a definition to an earlier definition it may overwrite.
  static void linkRedefinition(VarEvent earlier, VarEvent later) {
    if (!later.redefines.contains(earlier)) {
      later.redefines.add(earlier);
      earlier.redefinedBy.add(later);
    }
  }

  void clearLinks() {
    definitions.clear();
    uses.clear();
    redefines.clear();
    redefinedBy.clear();
  }

  void sortLinks(Comparator<VarEvent> order) {
    definitions.sort(order);
    uses.sort(order);
    redefines.sort(order);
    redefinedBy.sort(order);
  }

  @Override
  public String toString() {
    return kind + " " + variable + " at " + node.getStartLocation();
  }
}

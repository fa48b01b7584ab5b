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
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import net.flowlint.java.cfg.CfgLoc;
import net.flowlint.java.cfg.CfgWalks;
import net.flowlint.java.syntax.ClassStatement;
import net.flowlint.java.syntax.DefStatement;
import net.flowlint.java.syntax.FlowStatement;
import net.flowlint.java.syntax.ForStatement;
import net.flowlint.java.syntax.LambdaExpression;
import net.flowlint.java.syntax.Node;
import net.flowlint.java.syntax.NodeVisitor;
import net.flowlint.java.syntax.RaiseStatement;
import net.flowlint.java.syntax.ReturnStatement;
import net.flowlint.java.syntax.Statement;
import net.flowlint.java.syntax.WhileStatement;

/** Queries over the linked variable events of a unit. */
public final class DataDependency {

  private DataDependency() {}

  /** Returns the events of the occurrences of names within a subtree, in order of collection. */
  public static ImmutableList<VarEvent> eventsFor(UnitAnalysis unit, Node node) {
    return eventsWithin(unit, ImmutableList.of(node));
  }

  private static ImmutableList<VarEvent> eventsWithin(
      UnitAnalysis unit, List<? extends Node> roots) {
    Set<Node> rootSet = identitySet(roots);
    ImmutableList.Builder<VarEvent> result = ImmutableList.builder();
    for (VarEvent event : unit.getEvents()) {
      if (isWithin(event.getNode(), rootSet)) {
        result.add(event);
      }
    }
    return result.build();
  }

  /** Returns the variables occurring within the given subtrees, with their events. */
  public static ImmutableListMultimap<Variable, VarEvent> varsIn(
      UnitAnalysis unit, List<? extends Node> nodes) {
    return varsIn(unit, nodes, null);
  }

  /**
   * Returns the variables occurring within the given subtrees, with their events of the given
   * kinds (or of all kinds, if {@code kinds} is null).
   */
  public static ImmutableListMultimap<Variable, VarEvent> varsIn(
      UnitAnalysis unit, List<? extends Node> nodes, @Nullable Set<VarEventKind> kinds) {
    ImmutableListMultimap.Builder<Variable, VarEvent> result = ImmutableListMultimap.builder();
    for (VarEvent event : eventsWithin(unit, nodes)) {
      if (kinds == null || kinds.contains(event.getKind())) {
        result.put(event.getVariable(), event);
      }
    }
    return result.build();
  }

  /** Reports whether any of the variables is bound or modified within the given subtrees. */
  public static boolean modifiedIn(
      UnitAnalysis unit, Collection<Variable> vars, List<? extends Node> nodes) {
    for (VarEvent event : eventsWithin(unit, nodes)) {
      VarEventKind kind = event.getKind();
      if (kind != VarEventKind.READ
          && kind != VarEventKind.DELETE
          && vars.contains(event.getVariable())) {
        return true;
      }
    }
    return false;
  }

  /** Returns the definitions of a variable that may reach the start of a location. */
  public static ImmutableList<VarEvent> definitionsAt(
      UnitAnalysis unit, CfgLoc loc, Variable var) {
    return unit.getDefinitionsReaching(loc, var);
  }

  /**
   * Reports whether the variable may be defined on some path that leads from {@code from} to one
   * of the locations {@code to}, counting the target locations themselves but not {@code from}.
   */
  public static boolean isChangedBetween(
      UnitAnalysis unit, Variable var, CfgLoc from, List<CfgLoc> to) {
    for (CfgLoc target : to) {
      for (CfgLoc loc : CfgWalks.predecessors(target, true, l -> l == from)) {
        for (VarEvent event : unit.getEvents(loc)) {
          if (event.getVariable().equals(var) && event.getKind().isDefinition()) {
            return true;
          }
        }
      }
    }
    return false;
  }

  /**
   * Returns the variables used within the statements whose definitions may come from outside
   * them, with those outside definitions.
   */
  public static ImmutableSetMultimap<Variable, VarEvent> varsDefinedBefore(
      UnitAnalysis unit, List<? extends Node> statements) {
    Set<Node> roots = identitySet(statements);
    ImmutableSetMultimap.Builder<Variable, VarEvent> result = ImmutableSetMultimap.builder();
    for (VarEvent event : eventsWithin(unit, statements)) {
      for (VarEvent def : event.getDefinitions()) {
        if (!isWithin(def.getNode(), roots)) {
          result.put(event.getVariable(), def);
        }
      }
    }
    return result.build();
  }

  /**
   * Returns the variables defined within the statements that may be used outside them, with those
   * outside uses. Uses within the statements are not reported, even if the statements are in a
   * loop.
   */
  public static ImmutableSetMultimap<Variable, VarEvent> varsUsedAfter(
      UnitAnalysis unit, List<? extends Node> statements) {
    Set<Node> roots = identitySet(statements);
    ImmutableSetMultimap.Builder<Variable, VarEvent> result = ImmutableSetMultimap.builder();
    for (VarEvent event : eventsWithin(unit, statements)) {
      for (VarEvent use : event.getUses()) {
        if (!isWithin(use.getNode(), roots)) {
          result.put(event.getVariable(), use);
        }
      }
    }
    return result.build();
  }

  /**
   * Returns the jumps within the statements that leave them: every {@code return} and {@code
   * raise}, and each {@code break} or {@code continue} not enclosed by a loop within the
   * statements. Jumps within nested functions and classes are not reported.
   */
  public static ImmutableList<Statement> controlStatements(List<? extends Statement> statements) {
    ImmutableList.Builder<Statement> result = ImmutableList.builder();
    NodeVisitor visitor =
        new NodeVisitor() {
          int loops = 0;

          @Override
          public void visit(ReturnStatement node) {
            result.add(node);
          }

          @Override
          public void visit(RaiseStatement node) {
            result.add(node);
          }

          @Override
          public void visit(FlowStatement node) {
            if (node.isJump() && loops == 0) {
              result.add(node);
            }
          }

          @Override
          public void visit(WhileStatement node) {
            loops++;
            visitBlock(node.getBody());
            loops--;
            if (node.getElseBlock() != null) {
              visitBlock(node.getElseBlock());
            }
          }

          @Override
          public void visit(ForStatement node) {
            loops++;
            visitBlock(node.getBody());
            loops--;
            if (node.getElseBlock() != null) {
              visitBlock(node.getElseBlock());
            }
          }

          @Override
          public void visit(DefStatement node) {}

          @Override
          public void visit(ClassStatement node) {}

          @Override
          public void visit(LambdaExpression node) {}
        };
    visitor.visitAll(statements);
    return result.build();
  }

  private static Set<Node> identitySet(List<? extends Node> nodes) {
    Set<Node> set = Collections.newSetFromMap(new IdentityHashMap<>());
    set.addAll(nodes);
    return set;
  }

  private static boolean isWithin(Node node, Set<Node> roots) {
    for (Node n = node; n != null; n = n.getParent()) {
      if (roots.contains(n)) {
        return true;
      }
    }
    return false;
  }
}

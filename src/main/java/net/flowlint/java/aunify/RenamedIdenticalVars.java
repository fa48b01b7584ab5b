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

package net.flowlint.java.aunify;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.flowlint.java.analysis.DataDependency;
import net.flowlint.java.analysis.UnitAnalysis;
import net.flowlint.java.analysis.VarEvent;
import net.flowlint.java.analysis.Variable;
import net.flowlint.java.syntax.AssignmentStatement;
import net.flowlint.java.syntax.ClassStatement;
import net.flowlint.java.syntax.Comprehension;
import net.flowlint.java.syntax.DefStatement;
import net.flowlint.java.syntax.ForStatement;
import net.flowlint.java.syntax.Identifier;
import net.flowlint.java.syntax.ImportStatement;
import net.flowlint.java.syntax.ListExpression;
import net.flowlint.java.syntax.Node;
import net.flowlint.java.syntax.Parameter;
import net.flowlint.java.syntax.TryStatement;
import net.flowlint.java.syntax.WithStatement;

/**
 * Folds back holes that stand for a variable the fragments merely name differently.
 *
 * <p>A hole bound by an assignment, a loop, a parameter or another binding construct, whose
 * substitutions are plain names, is a renamed variable if, in every fragment, the variable it
 * names is neither defined before the fragment and used within it, nor defined within it and used
 * after it, and every occurrence of the variable within the fragment is generalized by a hole with
 * the same substitutions. All those holes are then spelled with the first fragment's name and are
 * no longer holes.
 */
final class RenamedIdenticalVars {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private RenamedIdenticalVars() {}

  static Generalization remove(Generalization generalization, UnitAnalysis unit) {
    List<Map<Node, AunifyVar>> holeBySub = new ArrayList<>();
    for (int i = 0; i < generalization.size(); i++) {
      Map<Node, AunifyVar> bySub = new IdentityHashMap<>();
      for (AunifyVar hole : generalization.getHoles()) {
        Object sub = hole.getSubs().get(i);
        if (sub instanceof Node) {
          bySub.put((Node) sub, hole);
        }
      }
      holeBySub.add(bySub);
    }

    Set<AunifyVar> renamed = Sets.newIdentityHashSet();
    for (AunifyVar hole : generalization.getHoles()) {
      if (renamed.contains(hole) || !isBindingPosition(hole) || !namesOnly(hole)) {
        continue;
      }
      Set<AunifyVar> group = Sets.newIdentityHashSet();
      if (isRenaming(hole, generalization, unit, holeBySub, group)) {
        renamed.addAll(group);
      }
    }
    if (renamed.isEmpty()) {
      return generalization;
    }
    logger.atFine().log("folding %d renamed holes", renamed.size());

    ImmutableList.Builder<Node> core = ImmutableList.builder();
    for (Node node : generalization.getCore()) {
      core.add(
          (Node)
              SubVariants.rewrite(
                  node, n -> renamed.contains(n) ? ((AunifyVar) n).renamed() : null));
    }
    return new Generalization(
        core.build(), generalization.isBlock(), generalization.getFragments());
  }

  private static boolean isRenaming(
      AunifyVar hole,
      Generalization generalization,
      UnitAnalysis unit,
      List<Map<Node, AunifyVar>> holeBySub,
      Set<AunifyVar> group) {
    group.add(hole);
    for (int i = 0; i < generalization.size(); i++) {
      ImmutableList<VarEvent> events = unit.getEvents((Identifier) hole.getSubs().get(i));
      if (events.isEmpty()) {
        return false;
      }
      Variable var = events.get(0).getVariable();
      ImmutableList<Node> fragment = generalization.getFragment(i);
      if (DataDependency.varsDefinedBefore(unit, fragment).containsKey(var)
          || DataDependency.varsUsedAfter(unit, fragment).containsKey(var)) {
        return false;
      }
      for (VarEvent event : DataDependency.varsIn(unit, fragment).get(var)) {
        AunifyVar other = holeBySub.get(i).get(event.getNode());
        if (other == null || !sameNames(hole, other)) {
          return false;
        }
        group.add(other);
      }
    }
    return true;
  }

  private static boolean namesOnly(AunifyVar hole) {
    for (Object sub : hole.getSubs()) {
      if (!(sub instanceof Identifier)) {
        return false;
      }
    }
    return true;
  }

  private static boolean sameNames(AunifyVar x, AunifyVar y) {
    if (x.getSubs().size() != y.getSubs().size() || !namesOnly(y)) {
      return false;
    }
    for (int i = 0; i < x.getSubs().size(); i++) {
      String xname = ((Identifier) x.getSubs().get(i)).getName();
      String yname = ((Identifier) y.getSubs().get(i)).getName();
      if (!xname.equals(yname)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Reports whether the identifier, whose parents must be linked, is bound by its enclosing
   * construct: an assignment target (possibly within a tuple), a loop or comprehension variable, a
   * {@code with} target, a parameter, a function or class name, an exception name, or an imported
   * name.
   */
  static boolean isBindingPosition(Identifier id) {
    Node node = id;
    Node parent = node.getParent();
    while (parent instanceof ListExpression) {
      node = parent;
      parent = parent.getParent();
    }
    if (parent instanceof AssignmentStatement) {
      return ((AssignmentStatement) parent).getLHS() == node;
    } else if (parent instanceof ForStatement) {
      return ((ForStatement) parent).getVars() == node;
    } else if (parent instanceof Comprehension.For) {
      return ((Comprehension.For) parent).getVars() == node;
    } else if (parent instanceof WithStatement.Item) {
      return ((WithStatement.Item) parent).getTarget() == node;
    }
    // The remaining constructs bind a bare name only.
    if (node != id) {
      return false;
    }
    if (parent instanceof Parameter) {
      return ((Parameter) parent).getIdentifier() == id;
    } else if (parent instanceof DefStatement) {
      return ((DefStatement) parent).getIdentifier() == id;
    } else if (parent instanceof ClassStatement) {
      return ((ClassStatement) parent).getIdentifier() == id;
    } else if (parent instanceof TryStatement.ExceptHandler) {
      return ((TryStatement.ExceptHandler) parent).getName() == id;
    } else if (parent instanceof ImportStatement.Binding) {
      return ((ImportStatement.Binding) parent).getLocalName() == id;
    }
    return false;
  }
}

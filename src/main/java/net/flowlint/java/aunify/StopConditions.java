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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import net.flowlint.java.syntax.AssignmentStatement;
import net.flowlint.java.syntax.CallExpression;
import net.flowlint.java.syntax.DotExpression;
import net.flowlint.java.syntax.IndexExpression;
import net.flowlint.java.syntax.Node;

/**
 * Stop conditions for {@link Antiunifier}: predicates that reject a generalization given its
 * holes.
 */
public final class StopConditions {

  private StopConditions() {}

  /** Rejects holes that stand for blocks or lists of different lengths. */
  public static Predicate<List<AunifyVar>> lengthMismatch() {
    return holes -> {
      for (AunifyVar hole : holes) {
        Object some = hole.getSubs().get(0);
        for (Object sub : hole.getSubs()) {
          if ((some instanceof List) != (sub instanceof List)) {
            return true;
          }
          if (some instanceof List && ((List<?>) some).size() != ((List<?>) sub).size()) {
            return true;
          }
        }
      }
      return false;
    };
  }

  /** Rejects holes whose substitutions are nodes of different classes. */
  public static Predicate<List<AunifyVar>> typeMismatch() {
    return holes -> {
      for (AunifyVar hole : holes) {
        Set<Class<?>> classes = new HashSet<>();
        for (Object sub : hole.getSubs()) {
          classes.add(sub.getClass());
        }
        if (classes.size() > 1) {
          return true;
        }
      }
      return false;
    };
  }

  /**
   * Rejects holes that are attribute names, or that are part of the expression denoting a called
   * function, as in {@code ID_1(x)}, {@code ID_1.f(x)} or {@code ID_1[0](x)}. A hole within the
   * arguments of a call, as in {@code g(ID_1)(x)}, is not part of the called expression.
   */
  public static Predicate<List<AunifyVar>> calledHole() {
    return holes -> {
      for (AunifyVar hole : holes) {
        Node parent = hole.getParent();
        if (parent instanceof DotExpression && ((DotExpression) parent).getField() == hole) {
          return true;
        }
        Node callee = hole;
        while (isObjectOf(callee, callee.getParent())) {
          callee = callee.getParent();
        }
        Node p = callee.getParent();
        if (p instanceof CallExpression && ((CallExpression) p).getFunction() == callee) {
          return true;
        }
      }
      return false;
    };
  }

  private static boolean isObjectOf(Node node, Node parent) {
    return (parent instanceof DotExpression && ((DotExpression) parent).getObject() == node)
        || (parent instanceof IndexExpression && ((IndexExpression) parent).getObject() == node);
  }

  /** Rejects holes that are bound names, or attribute names assigned to. */
  public static Predicate<List<AunifyVar>> assignmentToHole() {
    return holes -> {
      for (AunifyVar hole : holes) {
        if (RenamedIdenticalVars.isBindingPosition(hole)) {
          return true;
        }
        Node parent = hole.getParent();
        if (parent instanceof DotExpression
            && ((DotExpression) parent).getField() == hole
            && parent.getParent() instanceof AssignmentStatement
            && ((AssignmentStatement) parent.getParent()).getLHS() == parent) {
          return true;
        }
      }
      return false;
    };
  }

  /** Rejects generalizations with more than {@code n} holes. */
  public static Predicate<List<AunifyVar>> moreHolesThan(int n) {
    checkArgument(n >= 0, "negative hole count %s", n);
    return holes -> holes.size() > n;
  }
}

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

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import javax.annotation.Nullable;
import net.flowlint.java.syntax.Argument;
import net.flowlint.java.syntax.Expression;
import net.flowlint.java.syntax.ExpressionStatement;
import net.flowlint.java.syntax.Node;
import net.flowlint.java.syntax.Nodes;

/**
 * Reconstructs antiunified fragments from a generalization by substituting each hole with its
 * substitution for one fragment.
 *
 * <p>The reconstruction of fragment {@code i} is structurally equal to that fragment. Renamed
 * variables are substituted too, so they are spelled as in the fragment.
 */
public final class SubVariants {

  private SubVariants() {}

  /** Returns fresh copies of the nodes of the i-th fragment, rebuilt from the core. */
  public static ImmutableList<Node> of(Generalization generalization, int i) {
    checkElementIndex(i, generalization.size());
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node node : generalization.getCore()) {
      Object variant = rewrite(node, n -> substitute(n, i));
      if (variant instanceof List) {
        for (Object elem : (List<?>) variant) {
          result.add((Node) elem);
        }
      } else {
        result.add((Node) variant);
      }
    }
    return result.build();
  }

  // Returns the replacement of a hole, or of the statement or argument wrapping one.
  @Nullable
  private static Object substitute(Node node, int i) {
    if (node instanceof AunifyVar) {
      return copy(((AunifyVar) node).getSubs().get(i));
    }
    Expression wrapped = null;
    if (node instanceof ExpressionStatement) {
      wrapped = ((ExpressionStatement) node).getExpression();
    } else if (node instanceof Argument.Positional) {
      wrapped = ((Argument) node).getValue();
    }
    if (!(wrapped instanceof AunifyVar)) {
      return null;
    }
    Object sub = ((AunifyVar) wrapped).getSubs().get(i);
    // An expression substitution goes inside the wrapper.
    return sub instanceof Expression ? null : copy(sub);
  }

  private static Object copy(Object sub) {
    if (sub instanceof List) {
      ImmutableList.Builder<Node> list = ImmutableList.builder();
      for (Object elem : (List<?>) sub) {
        list.add(Nodes.copy((Node) elem));
      }
      return list.build();
    }
    return Nodes.copy((Node) sub);
  }

  /**
   * Returns a fresh copy of {@code value}, a node, list or scalar field, in which every node for
   * which {@code replace} returns non-null is replaced by the result. A node inside a list may be
   * replaced by a list, which is spliced in its place.
   */
  static Object rewrite(@Nullable Object value, Function<Node, Object> replace) {
    if (value instanceof Node) {
      Node node = (Node) value;
      Object replacement = replace.apply(node);
      if (replacement != null) {
        return replacement;
      }
      List<Object> fields = Nodes.fields(node);
      List<Object> rewritten = new ArrayList<>(fields.size());
      for (Object field : fields) {
        rewritten.add(rewrite(field, replace));
      }
      return Nodes.withFields(node, rewritten);
    } else if (value instanceof List) {
      ImmutableList.Builder<Object> list = ImmutableList.builder();
      for (Object elem : (List<?>) value) {
        Object result = rewrite(elem, replace);
        if (result instanceof List) {
          list.addAll((List<?>) result);
        } else {
          list.add(result);
        }
      }
      return list.build();
    }
    return value;
  }
}

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

package net.flowlint.java.cfg;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import java.util.Map;
import javax.annotation.Nullable;
import net.flowlint.java.syntax.DefStatement;
import net.flowlint.java.syntax.LambdaExpression;
import net.flowlint.java.syntax.Node;
import net.flowlint.java.syntax.Parameter;

/**
 * The control-flow graphs of a syntax tree, one per body of code, and the location of every
 * analyzed node.
 *
 * <p>Locations are kept in a side table rather than on the nodes. A compound statement shares the
 * location of its head: an {@code if} statement maps to the location of its condition, a {@code
 * for} statement to that of its iterable, a {@code try} statement to that of the first statement
 * of its body.
 */
public final class FlowGraphs {

  private final ImmutableMap<Node, ControlFlowGraph> graphs;
  private final Map<Node, CfgLoc> locs; // identity map

  FlowGraphs(ImmutableMap<Node, ControlFlowGraph> graphs, Map<Node, CfgLoc> locs) {
    this.graphs = graphs;
    this.locs = locs;
  }

  /** Returns the graphs, keyed by the node owning each body, outermost first. */
  public ImmutableMap<Node, ControlFlowGraph> getGraphs() {
    return graphs;
  }

  /** Returns the graph of the given SourceFile, DefStatement, ClassStatement or lambda, or null. */
  @Nullable
  public ControlFlowGraph getGraph(Node owner) {
    return graphs.get(owner);
  }

  /** Returns the graph of the root of the tree. */
  public ControlFlowGraph getRootGraph() {
    return Iterables.getFirst(graphs.values(), null);
  }

  /** Returns the location of an analyzed node, or null if the node has none of its own. */
  @Nullable
  public CfgLoc getLoc(Node node) {
    return locs.get(node);
  }

  /**
   * Returns the location at which {@code node} executes: its own location, or that of the nearest
   * enclosing analyzed node. Default values and annotations of parameters execute where their
   * function is defined. Returns null for nodes outside the analyzed tree.
   */
  @Nullable
  public CfgLoc enclosingLoc(Node node) {
    Node child = null;
    for (Node n = node; n != null; child = n, n = n.getParent()) {
      if (n instanceof Parameter && child != null && child != ((Parameter) n).getIdentifier()) {
        // Skip the parameter and its function.
        n = n.getParent();
        if (n == null) {
          return null;
        }
        if (n instanceof DefStatement) {
          return locs.get(n);
        }
        if (n instanceof LambdaExpression) {
          continue;
        }
      }
      CfgLoc loc = locs.get(n);
      if (loc != null) {
        return loc;
      }
    }
    return null;
  }
}

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

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;
import net.flowlint.java.syntax.FlowStatement;
import net.flowlint.java.syntax.Node;
import net.flowlint.java.syntax.RaiseStatement;
import net.flowlint.java.syntax.ReturnStatement;

/**
 * A node in a control flow graph: a maximal sequence of locations guaranteed to execute in order.
 *
 * <p>A block whose last statement is a {@code break}, {@code continue}, {@code return} or {@code
 * raise} is a jump block. Nothing may be appended to it, and ordinary links from it are ignored.
 */
public final class CfgBlock {

  private final ControlFlowGraph graph;
  private final int id;
  private final List<CfgLoc> locs = new ArrayList<>();
  final List<CfgEdge> predecessors = new ArrayList<>();
  final List<CfgEdge> successors = new ArrayList<>();
  private boolean reachable;

  CfgBlock(ControlFlowGraph graph, int id) {
    this.graph = graph;
    this.id = id;
  }

  /** Returns the graph this block belongs to. */
  public ControlFlowGraph getGraph() {
    return graph;
  }

  /** Returns the id of this block, unique within its graph. */
  public int getId() {
    return id;
  }

  public List<CfgLoc> getLocs() {
    return Collections.unmodifiableList(locs);
  }

  /** Returns the in-edges of this block. */
  public List<CfgEdge> getPredecessors() {
    return Collections.unmodifiableList(predecessors);
  }

  /** Returns the out-edges of this block. */
  public List<CfgEdge> getSuccessors() {
    return Collections.unmodifiableList(successors);
  }

  /** Reports whether there is a path from the start of the graph to this block. */
  public boolean isReachable() {
    return reachable;
  }

  void setReachable() {
    this.reachable = true;
  }

  /** Returns the jump statement ending this block, or null. */
  @Nullable
  public Node getJump() {
    if (locs.isEmpty()) {
      return null;
    }
    Node last = Iterables.getLast(locs).getNode();
    if ((last instanceof FlowStatement && ((FlowStatement) last).isJump())
        || last instanceof ReturnStatement
        || last instanceof RaiseStatement) {
      return last;
    }
    return null;
  }

  /** Reports whether the block ends with a statement that transfers control. */
  public boolean isJump() {
    return getJump() != null;
  }

  CfgLoc add(Node node) {
    Preconditions.checkState(!isJump(), "block %s already ends with a jump", id);
    CfgLoc loc = new CfgLoc(this, locs.size(), node);
    locs.add(loc);
    return loc;
  }

  @Override
  public String toString() {
    return locs.isEmpty()
        ? String.format("CfgBlock(%d, empty)", id)
        : String.format("CfgBlock(%d, len=%d, first=%s)", id, locs.size(), locs.get(0).getNode());
  }
}

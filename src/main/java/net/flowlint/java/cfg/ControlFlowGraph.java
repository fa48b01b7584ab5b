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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import net.flowlint.java.syntax.Node;

/**
 * The control-flow graph of one body of code: a module, a function, a class body or a lambda.
 *
 * <p>Execution enters at {@link #getStart} and leaves at {@link #getEnd}, which has no successors.
 * Nested function, class and lambda bodies have graphs of their own, not connected to this one;
 * {@link #getDefiningLoc} is where such a nested body is defined in its enclosing graph.
 */
public final class ControlFlowGraph {

  private final int id;
  private final Node owner;
  @Nullable private final CfgLoc definingLoc;
  private CfgBlock start;
  private final CfgBlock end;
  private int blockCount;
  // Blocks that will never be executed. Helper blocks spliced out of the graph are removed.
  private final Set<CfgBlock> unreachableBlocks = new LinkedHashSet<>();

  ControlFlowGraph(int id, Node owner, @Nullable CfgLoc definingLoc) {
    this.id = id;
    this.owner = owner;
    this.definingLoc = definingLoc;
    this.start = createBlock();
    this.end = createBlock();
  }

  /** Returns the id of this graph, unique among the graphs built from one tree. */
  public int getId() {
    return id;
  }

  /**
   * Returns the node whose body this graph describes: a SourceFile, DefStatement, ClassStatement
   * or LambdaExpression.
   */
  public Node getOwner() {
    return owner;
  }

  /** Returns the location defining this body in the enclosing graph, or null for the root. */
  @Nullable
  public CfgLoc getDefiningLoc() {
    return definingLoc;
  }

  public CfgBlock getStart() {
    return start;
  }

  public CfgBlock getEnd() {
    return end;
  }

  /** Returns the blocks that cannot be reached from the start block. */
  public ImmutableSet<CfgBlock> getUnreachableBlocks() {
    return ImmutableSet.copyOf(unreachableBlocks);
  }

  // ==== construction ====

  CfgBlock createBlock() {
    CfgBlock block = new CfgBlock(this, blockCount++);
    unreachableBlocks.add(block);
    return block;
  }

  /** Creates a block, and links or merges {@code pred} into it. */
  CfgBlock createBlock(CfgBlock pred, @Nullable EdgeLabel label) {
    CfgBlock block = createBlock();
    linkOrMerge(pred, block, label);
    return block;
  }

  /** Links source to target, unless source ends with a jump. */
  void link(CfgBlock source, CfgBlock target, @Nullable EdgeLabel label) {
    if (!source.isJump()) {
      new CfgEdge(source, target, label);
    }
  }

  /** Links source to target regardless of jumps: the edge of a jump or of a raised exception. */
  void addEdge(CfgBlock source, CfgBlock target, @Nullable EdgeLabel label) {
    Preconditions.checkState(source != end, "the end block of graph %s cannot be linked", id);
    new CfgEdge(source, target, label);
  }

  /**
   * Links source to target, or merges source into target if source has no statements.
   *
   * <p>An empty source is a helper block with no counterpart in the program: its in-edges are
   * redirected to target, keeping their labels, and it is dropped from the graph. A source ending
   * with a jump is left alone.
   */
  void linkOrMerge(CfgBlock source, CfgBlock target, @Nullable EdgeLabel label) {
    Preconditions.checkState(source != end, "the end block of graph %s cannot be linked", id);
    if (source.isJump()) {
      return;
    }
    if (source.getLocs().isEmpty()) {
      if (source == start) {
        start = target;
      } else {
        for (CfgEdge edge : source.predecessors) {
          edge.retarget(target);
        }
        source.predecessors.clear();
      }
      unreachableBlocks.remove(source);
    } else {
      new CfgEdge(source, target, label);
    }
  }

  void updateReachability() {
    for (CfgBlock block : getBlocks()) {
      block.setReachable();
      unreachableBlocks.remove(block);
    }
  }

  // ==== traversal ====

  /** Returns all blocks reachable from the start block, in depth-first preorder. */
  public ImmutableList<CfgBlock> getBlocks() {
    ImmutableList.Builder<CfgBlock> result = ImmutableList.builder();
    Deque<Frame> stack = new ArrayDeque<>();
    Set<CfgBlock> visited = new HashSet<>();
    stack.push(new Frame(start));
    visited.add(start);
    result.add(start);
    while (!stack.isEmpty()) {
      Frame top = stack.peek();
      if (top.next >= top.block.successors.size()) {
        stack.pop();
        continue;
      }
      CfgBlock next = top.block.successors.get(top.next++).getTarget();
      if (visited.add(next)) {
        result.add(next);
        stack.push(new Frame(next));
      }
    }
    return result.build();
  }

  // A block on the traversal stack, with the index of its next successor to explore.
  private static final class Frame {
    final CfgBlock block;
    int next;

    Frame(CfgBlock block) {
      this.block = block;
    }
  }

  /** Returns all blocks reachable from the start block, in depth-first postorder. */
  public ImmutableList<CfgBlock> getBlocksPostorder() {
    List<CfgBlock> result = new ArrayList<>();
    postorder(start, new HashSet<>(), result);
    return ImmutableList.copyOf(result);
  }

  private static void postorder(CfgBlock block, Set<CfgBlock> visited, List<CfgBlock> result) {
    if (!visited.add(block)) {
      return;
    }
    for (CfgEdge edge : block.successors) {
      postorder(edge.getTarget(), visited, result);
    }
    result.add(block);
  }

  /** Returns all edges between blocks reachable from the start block. */
  public ImmutableList<CfgEdge> getEdges() {
    ImmutableList.Builder<CfgEdge> result = ImmutableList.builder();
    for (CfgBlock block : getBlocks()) {
      result.addAll(block.successors);
    }
    return result.build();
  }

  @Override
  public String toString() {
    return String.format("ControlFlowGraph(%d, %s)", id, owner.getClass().getSimpleName());
  }
}

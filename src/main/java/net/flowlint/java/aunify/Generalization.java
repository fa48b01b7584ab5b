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
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import net.flowlint.java.analysis.Analyzer;
import net.flowlint.java.analysis.UnitAnalysis;
import net.flowlint.java.syntax.Node;
import net.flowlint.java.syntax.NodePrinter;
import net.flowlint.java.syntax.Nodes;
import net.flowlint.java.syntax.SourceFile;

/**
 * The result of an antiunification: a generalized core tree, the holes in it, and the fragments it
 * generalizes.
 *
 * <p>The core is a single expression or statement when single nodes were antiunified, and a list of
 * statements when blocks were. In both cases it is wrapped in a {@link SourceFile} so that its
 * nodes have parents, and so that it can be analyzed as ordinary code.
 */
public final class Generalization {

  private final ImmutableList<Node> core;
  private final boolean block;
  private final ImmutableList<ImmutableList<Node>> fragments;
  private final SourceFile coreFile;
  private final ImmutableList<AunifyVar> holes;

  @GuardedBy("this")
  @Nullable
  private UnitAnalysis coreAnalysis;

  Generalization(
      ImmutableList<Node> core, boolean block, ImmutableList<ImmutableList<Node>> fragments) {
    this.core = core;
    this.block = block;
    this.fragments = fragments;
    this.coreFile = Antiunifier.wrap(core);
    ImmutableList.Builder<AunifyVar> holes = ImmutableList.builder();
    for (Node node : core) {
      collectHoles(node, holes);
    }
    this.holes = holes.build();
  }

  private static void collectHoles(Node node, ImmutableList.Builder<AunifyVar> holes) {
    if (node instanceof AunifyVar && !((AunifyVar) node).isRenamed()) {
      holes.add((AunifyVar) node);
    }
    for (Node child : Nodes.children(node)) {
      collectHoles(child, holes);
    }
  }

  /** Returns the generalized tree: one node, or the statements of a generalized block. */
  public ImmutableList<Node> getCore() {
    return core;
  }

  /** Reports whether statement blocks, rather than single nodes, were antiunified. */
  public boolean isBlock() {
    return block;
  }

  /** Returns the holes of the core in lexical order. Renamed variables are not holes. */
  public ImmutableList<AunifyVar> getHoles() {
    return holes;
  }

  /** Returns the number of antiunified fragments. */
  public int size() {
    return fragments.size();
  }

  /** Returns the i-th antiunified fragment, as a list of one node unless blocks were given. */
  public ImmutableList<Node> getFragment(int i) {
    return fragments.get(i);
  }

  ImmutableList<ImmutableList<Node>> getFragments() {
    return fragments;
  }

  /** Returns the core statements as a file whose nodes have their parents linked. */
  public SourceFile getCoreFile() {
    return coreFile;
  }

  /**
   * Returns the control-flow graphs and variable events of the core, computed on first use. Holes
   * are analyzed as the names they are spelled with.
   */
  public synchronized UnitAnalysis getCoreAnalysis() {
    if (coreAnalysis == null) {
      coreAnalysis = Analyzer.analyze(coreFile);
    }
    return coreAnalysis;
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    for (Node node : core) {
      buf.append(NodePrinter.print(node));
    }
    return buf.toString();
  }
}

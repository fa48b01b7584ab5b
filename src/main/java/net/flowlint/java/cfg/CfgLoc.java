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

import net.flowlint.java.syntax.Node;

/**
 * A location in a control-flow graph: the {@code position}-th step of a block, executing one
 * analyzed node.
 *
 * <p>The node is a simple statement, or the part of a compound statement that executes at its
 * head: the condition of an {@code if} or {@code while}, the iterable and the targets of a {@code
 * for}, a {@code def} or {@code class} statement (its decorators, defaults and bases, and the name
 * binding), an {@code except} clause, a {@code with} statement (its items), the subject of a {@code
 * match} and each of its cases, a function parameter, and the body of a lambda.
 *
 * <p>Locations compare by identity.
 */
public final class CfgLoc {

  private final CfgBlock block;
  private final int position;
  private final Node node;

  CfgLoc(CfgBlock block, int position, Node node) {
    this.block = block;
    this.position = position;
    this.node = node;
  }

  public CfgBlock getBlock() {
    return block;
  }

  /** Returns the index of this location within its block. */
  public int getPosition() {
    return position;
  }

  public Node getNode() {
    return node;
  }

  @Override
  public String toString() {
    return String.format("CfgLoc(%d:%d, %s)", block.getId(), position, node);
  }
}

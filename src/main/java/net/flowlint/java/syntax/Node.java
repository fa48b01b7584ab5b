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

package net.flowlint.java.syntax;

import com.google.common.base.Preconditions;
import javax.annotation.Nullable;

/**
 * A Node is a node in a syntax tree.
 *
 * <p>Nodes compare by identity. Two nodes from different parses of the same text are distinct; use
 * {@link Nodes#structurallyEqual} to compare shapes.
 *
 * <p>A node is immutable once its tree has been finalized, except that its parent is assigned once,
 * by {@link Nodes#linkParents}, when the enclosing tree is complete.
 */
public abstract class Node {

  final FileLocations locs;

  @Nullable private Node parent;

  Node(FileLocations locs) {
    this.locs = Preconditions.checkNotNull(locs);
  }

  /**
   * Returns the node's start offset, as a char index (zero-based count of UTF-16 codes) from the
   * start of the file.
   */
  public abstract int getStartOffset();

  /** Returns the char offset of the source position immediately after this node. */
  public abstract int getEndOffset();

  /** Returns the location of the start of this syntax node. */
  public final Location getStartLocation() {
    return locs.getLocation(getStartOffset());
  }

  /** Returns the location of the end of this syntax node. */
  public final Location getEndLocation() {
    return locs.getLocation(getEndOffset());
  }

  /** Returns the start location of this node, for use in error messages. */
  public Location getLocation() {
    return getStartLocation();
  }

  /** Returns the name of the file containing this node. */
  public final String getFileName() {
    return locs.file();
  }

  /**
   * Returns the node that syntactically contains this one, or null for the root of a tree or a node
   * whose tree has not been finalized.
   */
  @Nullable
  public final Node getParent() {
    return parent;
  }

  void setParent(Node parent) {
    Preconditions.checkState(
        this.parent == null || this.parent == parent, "node %s already has a parent", this);
    this.parent = parent;
  }

  /** Returns the source text of this node, if it came from a parsed file. */
  public final String getSourceText() {
    return locs.slice(getStartOffset(), getEndOffset());
  }

  /**
   * Print the syntax node in a form useful for debugging.
   *
   * <p>The output is not precisely specified; use {@link NodePrinter} for a rendering that
   * round-trips through the parser.
   */
  @Override
  public String toString() {
    return NodePrinter.print(this).trim();
  }

  /**
   * Implements the double dispatch by calling into the node specific <code>visit</code> method of
   * the {@link NodeVisitor}
   *
   * @param visitor the {@link NodeVisitor} instance to dispatch to.
   */
  public abstract void accept(NodeVisitor visitor);
}

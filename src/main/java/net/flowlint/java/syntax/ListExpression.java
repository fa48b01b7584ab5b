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

import com.google.common.collect.ImmutableList;

/** Syntax node for list and tuple expressions. */
public final class ListExpression extends Expression {

  private final boolean isTuple;
  private final int lbracketOffset; // -1 => unparenthesized non-empty tuple
  private final ImmutableList<Expression> elements;
  private final int rbracketOffset; // -1 => unparenthesized non-empty tuple

  ListExpression(
      FileLocations locs,
      boolean isTuple,
      int lbracketOffset,
      ImmutableList<Expression> elements,
      int rbracketOffset) {
    super(locs, Kind.LIST_EXPR);
    // An unparenthesized tuple must be non-empty.
    if (elements.isEmpty() && (lbracketOffset < 0 || rbracketOffset < 0)) {
      throw new IllegalArgumentException("empty unparenthesized tuple");
    }
    this.isTuple = isTuple;
    this.lbracketOffset = lbracketOffset;
    this.elements = elements;
    this.rbracketOffset = rbracketOffset;
  }

  public ImmutableList<Expression> getElements() {
    return elements;
  }

  /** Reports whether this is a tuple expression. */
  public boolean isTuple() {
    return isTuple;
  }

  /** Reports whether the expression is enclosed in brackets or parentheses. */
  public boolean isParenthesized() {
    return lbracketOffset >= 0;
  }

  int getLbracketOffset() {
    return lbracketOffset;
  }

  int getRbracketOffset() {
    return rbracketOffset;
  }

  @Override
  public int getStartOffset() {
    return lbracketOffset < 0 ? elements.get(0).getStartOffset() : lbracketOffset;
  }

  @Override
  public int getEndOffset() {
    return rbracketOffset < 0
        ? elements.get(elements.size() - 1).getEndOffset()
        : rbracketOffset + 1;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

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
 * Syntax node for an assignment statement ({@code lhs = rhs}), augmented assignment statement
 * ({@code lhs op= rhs}) or annotated assignment ({@code lhs: T = rhs}).
 */
public final class AssignmentStatement extends Statement {

  private final Expression lhs; // = IDENTIFIER | DOT | INDEX | SLICE | LIST_EXPR

  // non-null only when we're not augmented
  @Nullable private final Expression type;

  @Nullable private final TokenKind op;
  private final int opOffset;

  @Nullable private final Expression rhs; // null only for a bare annotation, {@code x: T}

  /**
   * Constructs an assignment statement. For an ordinary assignment ({@code op == null}), the LHS
   * expression must be of the form {@code id}, {@code x.y}, {@code x[i]}, {@code [e, ...]}, or
   * {@code (e, ...)}, where x, i, and e are arbitrary expressions. For an augmented assignment, the
   * list and tuple forms are disallowed.
   */
  AssignmentStatement(
      FileLocations locs,
      Expression lhs,
      @Nullable Expression type,
      @Nullable TokenKind op,
      int opOffset,
      @Nullable Expression rhs) {
    super(locs, Kind.ASSIGNMENT);
    this.lhs = lhs;
    this.type = type;
    this.op = op;
    this.opOffset = opOffset;
    this.rhs = rhs;
    if (type != null) {
      Preconditions.checkState(op == null, "Can't have augmented assignment with type annotation");
    } else {
      Preconditions.checkState(rhs != null, "Only an annotated assignment may omit its value");
    }
  }

  /** Returns the LHS of the assignment. */
  public Expression getLHS() {
    return lhs;
  }

  /** Returns the type expression (if present) of the variable on the LHS. */
  @Nullable
  public Expression getType() {
    return type;
  }

  /** Returns the operator of an augmented assignment, or null for an ordinary assignment. */
  @Nullable
  public TokenKind getOperator() {
    return op;
  }

  /** Returns the location of the assignment operator. */
  public Location getOperatorLocation() {
    return locs.getLocation(opOffset);
  }

  int getOperatorOffset() {
    return opOffset;
  }

  @Override
  public int getStartOffset() {
    return lhs.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    if (rhs != null) {
      return rhs.getEndOffset();
    }
    return type != null ? type.getEndOffset() : lhs.getEndOffset();
  }

  /** Reports whether this is an augmented assignment ({@code getOperator() != null}). */
  public boolean isAugmented() {
    return op != null;
  }

  /** Returns the RHS of the assignment, or null for an annotation without a value. */
  @Nullable
  public Expression getRHS() {
    return rhs;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

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
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** Syntax node for a for loop statement, {@code for vars in iterable: ... [else: ...]}. */
public final class ForStatement extends Statement {

  private final int forOffset;
  private final Expression vars;
  private final Expression iterable;
  private final ImmutableList<Statement> body; // non-empty if well formed
  @Nullable private final ImmutableList<Statement> elseBlock;

  /** Constructs a for loop statement. */
  ForStatement(
      FileLocations locs,
      int forOffset,
      Expression vars,
      Expression iterable,
      ImmutableList<Statement> body,
      @Nullable ImmutableList<Statement> elseBlock) {
    super(locs, Kind.FOR);
    this.forOffset = forOffset;
    this.vars = Preconditions.checkNotNull(vars);
    this.iterable = Preconditions.checkNotNull(iterable);
    this.body = body;
    this.elseBlock = elseBlock;
  }

  /**
   * Returns variables assigned by each iteration. May be a compound target such as {@code (a[b],
   * c.d)}.
   */
  public Expression getVars() {
    return vars;
  }

  /** Returns the iterable value. */
  public Expression getIterable() {
    return iterable;
  }

  /** Returns the statements of the loop body. Non-empty if parsing succeeded. */
  public ImmutableList<Statement> getBody() {
    return body;
  }

  /** Returns the statements run when the iterable is exhausted without a break, or null. */
  @Nullable
  public ImmutableList<Statement> getElseBlock() {
    return elseBlock;
  }

  @Override
  public int getStartOffset() {
    return forOffset;
  }

  @Override
  public int getEndOffset() {
    ImmutableList<Statement> last = elseBlock != null ? elseBlock : body;
    return last.isEmpty()
        ? iterable.getEndOffset() // wrong, but tree is ill formed
        : last.get(last.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

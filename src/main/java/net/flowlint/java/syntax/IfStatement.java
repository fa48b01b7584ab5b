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
import javax.annotation.Nullable;

/**
 * Syntax node for an if or elif statement.
 *
 * <p>An {@code elif} clause is represented as an IfStatement whose token is ELIF, forming the sole
 * statement of the else block of the preceding IfStatement.
 */
public final class IfStatement extends Statement {

  private final TokenKind token; // IF or ELIF
  private final int ifOffset;
  private final Expression condition;
  private final ImmutableList<Statement> thenBlock; // non-empty
  @Nullable private final ImmutableList<Statement> elseBlock; // non-empty if non-null

  IfStatement(
      FileLocations locs,
      TokenKind token,
      int ifOffset,
      Expression condition,
      ImmutableList<Statement> thenBlock,
      @Nullable ImmutableList<Statement> elseBlock) {
    super(locs, Kind.IF);
    this.token = token;
    this.ifOffset = ifOffset;
    this.condition = condition;
    this.thenBlock = thenBlock;
    this.elseBlock = elseBlock;
  }

  /**
   * Reports whether this is an 'elif' statement.
   *
   * <p>An elif statement may appear only as the sole statement in the "else" block of another
   * IfStatement.
   */
  public boolean isElif() {
    return token == TokenKind.ELIF;
  }

  public Expression getCondition() {
    return condition;
  }

  public ImmutableList<Statement> getThenBlock() {
    return thenBlock;
  }

  @Nullable
  public ImmutableList<Statement> getElseBlock() {
    return elseBlock;
  }

  @Override
  public int getStartOffset() {
    return ifOffset;
  }

  @Override
  public int getEndOffset() {
    ImmutableList<Statement> body = elseBlock != null ? elseBlock : thenBlock;
    return body.isEmpty()
        ? condition.getEndOffset() // wrong, but tree is ill formed
        : body.get(body.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

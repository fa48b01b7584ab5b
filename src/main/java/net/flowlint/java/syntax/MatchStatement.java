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
 * Syntax node for a structural pattern matching statement, {@code match subject: case p: ...}.
 *
 * <p>Patterns are represented as expressions. A bare identifier other than {@code _} captures the
 * subject; identifiers nested in list, tuple and class patterns capture the corresponding parts;
 * dotted names are value patterns; {@code p | q} is an alternative.
 */
public final class MatchStatement extends Statement {

  /** Syntax node for a single {@code case pattern [if guard]: body} clause. */
  public static final class Case extends Node {

    private final int caseOffset;
    private final Expression pattern;
    @Nullable private final Expression guard;
    private final ImmutableList<Statement> body;

    Case(
        FileLocations locs,
        int caseOffset,
        Expression pattern,
        @Nullable Expression guard,
        ImmutableList<Statement> body) {
      super(locs);
      this.caseOffset = caseOffset;
      this.pattern = pattern;
      this.guard = guard;
      this.body = body;
    }

    public Expression getPattern() {
      return pattern;
    }

    @Nullable
    public Expression getGuard() {
      return guard;
    }

    public ImmutableList<Statement> getBody() {
      return body;
    }

    /** Reports whether the case matches any subject: an unguarded capture or wildcard. */
    public boolean isIrrefutable() {
      return guard == null && pattern instanceof Identifier;
    }

    @Override
    public int getStartOffset() {
      return caseOffset;
    }

    @Override
    public int getEndOffset() {
      return body.isEmpty() ? pattern.getEndOffset() : body.get(body.size() - 1).getEndOffset();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final int matchOffset;
  private final Expression subject;
  private final ImmutableList<Case> cases;

  MatchStatement(
      FileLocations locs, int matchOffset, Expression subject, ImmutableList<Case> cases) {
    super(locs, Kind.MATCH);
    this.matchOffset = matchOffset;
    this.subject = subject;
    this.cases = cases;
  }

  public Expression getSubject() {
    return subject;
  }

  public ImmutableList<Case> getCases() {
    return cases;
  }

  @Override
  public int getStartOffset() {
    return matchOffset;
  }

  @Override
  public int getEndOffset() {
    return cases.isEmpty()
        ? subject.getEndOffset()
        : cases.get(cases.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

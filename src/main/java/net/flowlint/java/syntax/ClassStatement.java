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

/** Syntax node for a 'class' statement. */
public final class ClassStatement extends Statement {

  private final int classOffset; // first decorator's '@', if decorated
  private final ImmutableList<Expression> decorators;
  private final Identifier identifier;
  private final ImmutableList<Argument> bases; // includes keywords such as metaclass=M
  private final ImmutableList<Statement> body;

  ClassStatement(
      FileLocations locs,
      int classOffset,
      ImmutableList<Expression> decorators,
      Identifier identifier,
      ImmutableList<Argument> bases,
      ImmutableList<Statement> body) {
    super(locs, Kind.CLASS);
    this.classOffset = classOffset;
    this.decorators = decorators;
    this.identifier = identifier;
    this.bases = bases;
    this.body = body;
  }

  public ImmutableList<Expression> getDecorators() {
    return decorators;
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  public ImmutableList<Argument> getBases() {
    return bases;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public int getStartOffset() {
    return classOffset;
  }

  @Override
  public int getEndOffset() {
    return body.isEmpty() ? identifier.getEndOffset() : body.get(body.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

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

/** Syntax node for a {@code try} statement with its handlers and optional else/finally blocks. */
public final class TryStatement extends Statement {

  /** Syntax node for an {@code except [type [as name]]:} clause. */
  public static final class ExceptHandler extends Node {

    private final int exceptOffset;
    @Nullable private final Expression type;
    @Nullable private final Identifier name;
    private final ImmutableList<Statement> body;

    ExceptHandler(
        FileLocations locs,
        int exceptOffset,
        @Nullable Expression type,
        @Nullable Identifier name,
        ImmutableList<Statement> body) {
      super(locs);
      this.exceptOffset = exceptOffset;
      this.type = type;
      this.name = name;
      this.body = body;
    }

    /** Returns the caught exception type, or null for a bare {@code except:}. */
    @Nullable
    public Expression getType() {
      return type;
    }

    /** Returns the name the exception is bound to, or null. */
    @Nullable
    public Identifier getName() {
      return name;
    }

    public ImmutableList<Statement> getBody() {
      return body;
    }

    @Override
    public int getStartOffset() {
      return exceptOffset;
    }

    @Override
    public int getEndOffset() {
      return body.isEmpty()
          ? exceptOffset + "except".length()
          : body.get(body.size() - 1).getEndOffset();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final int tryOffset;
  private final ImmutableList<Statement> body;
  private final ImmutableList<ExceptHandler> handlers;
  @Nullable private final ImmutableList<Statement> elseBlock;
  @Nullable private final ImmutableList<Statement> finallyBlock;

  TryStatement(
      FileLocations locs,
      int tryOffset,
      ImmutableList<Statement> body,
      ImmutableList<ExceptHandler> handlers,
      @Nullable ImmutableList<Statement> elseBlock,
      @Nullable ImmutableList<Statement> finallyBlock) {
    super(locs, Kind.TRY);
    this.tryOffset = tryOffset;
    this.body = body;
    this.handlers = handlers;
    this.elseBlock = elseBlock;
    this.finallyBlock = finallyBlock;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  public ImmutableList<ExceptHandler> getHandlers() {
    return handlers;
  }

  @Nullable
  public ImmutableList<Statement> getElseBlock() {
    return elseBlock;
  }

  @Nullable
  public ImmutableList<Statement> getFinallyBlock() {
    return finallyBlock;
  }

  @Override
  public int getStartOffset() {
    return tryOffset;
  }

  @Override
  public int getEndOffset() {
    if (finallyBlock != null && !finallyBlock.isEmpty()) {
      return finallyBlock.get(finallyBlock.size() - 1).getEndOffset();
    }
    if (elseBlock != null && !elseBlock.isEmpty()) {
      return elseBlock.get(elseBlock.size() - 1).getEndOffset();
    }
    if (!handlers.isEmpty()) {
      return handlers.get(handlers.size() - 1).getEndOffset();
    }
    return body.isEmpty() ? tryOffset + "try".length() : body.get(body.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

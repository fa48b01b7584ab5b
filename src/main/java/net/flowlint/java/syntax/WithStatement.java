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

/** Syntax node for {@code with a as x, b: ...}. */
public final class WithStatement extends Statement {

  /** One context manager of a with statement, {@code expr [as target]}. */
  public static final class Item extends Node {

    private final Expression context;
    @Nullable private final Expression target;

    Item(FileLocations locs, Expression context, @Nullable Expression target) {
      super(locs);
      this.context = context;
      this.target = target;
    }

    public Expression getContext() {
      return context;
    }

    @Nullable
    public Expression getTarget() {
      return target;
    }

    @Override
    public int getStartOffset() {
      return context.getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return target != null ? target.getEndOffset() : context.getEndOffset();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final int withOffset;
  private final ImmutableList<Item> items;
  private final ImmutableList<Statement> body;

  WithStatement(
      FileLocations locs,
      int withOffset,
      ImmutableList<Item> items,
      ImmutableList<Statement> body) {
    super(locs, Kind.WITH);
    this.withOffset = withOffset;
    this.items = items;
    this.body = body;
  }

  public ImmutableList<Item> getItems() {
    return items;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public int getStartOffset() {
    return withOffset;
  }

  @Override
  public int getEndOffset() {
    return body.isEmpty()
        ? items.get(items.size() - 1).getEndOffset()
        : body.get(body.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

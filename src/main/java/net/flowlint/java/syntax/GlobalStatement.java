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

/**
 * Syntax node for a scope declaration, {@code global x, y} or {@code nonlocal x, y}. The
 * identifiers are declarations, neither uses nor bindings.
 */
public final class GlobalStatement extends Statement {

  private final TokenKind token; // GLOBAL | NONLOCAL
  private final int offset;
  private final ImmutableList<Identifier> names;

  GlobalStatement(
      FileLocations locs, TokenKind token, int offset, ImmutableList<Identifier> names) {
    super(locs, Kind.GLOBAL);
    this.token = token;
    this.offset = offset;
    this.names = names;
  }

  /** Reports whether this is a {@code nonlocal} declaration. */
  public boolean isNonlocal() {
    return token == TokenKind.NONLOCAL;
  }

  public TokenKind getToken() {
    return token;
  }

  public ImmutableList<Identifier> getNames() {
    return names;
  }

  @Override
  public int getStartOffset() {
    return offset;
  }

  @Override
  public int getEndOffset() {
    return names.get(names.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

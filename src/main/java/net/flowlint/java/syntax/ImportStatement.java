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
 * Syntax node for an import statement, either {@code import a.b [as c], ...} or {@code from m
 * import x [as y], ...}.
 */
public final class ImportStatement extends Statement {

  /**
   * Binding represents one name imported by the statement. The local name is the identifier bound
   * in the importing scope; the original name is the dotted module or member name as written.
   */
  public static final class Binding extends Node {

    private final Identifier localName;
    private final String originalName;

    Binding(FileLocations locs, Identifier localName, String originalName) {
      super(locs);
      this.localName = localName;
      this.originalName = originalName;
    }

    public Identifier getLocalName() {
      return localName;
    }

    public String getOriginalName() {
      return originalName;
    }

    @Override
    public int getStartOffset() {
      return localName.getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return localName.getEndOffset();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final int importOffset;
  @Nullable private final String module; // non-null for 'from m import ...'
  private final ImmutableList<Binding> bindings; // empty for 'from m import *'
  private final int endOffset;

  ImportStatement(
      FileLocations locs,
      int importOffset,
      @Nullable String module,
      ImmutableList<Binding> bindings,
      int endOffset) {
    super(locs, Kind.IMPORT);
    this.importOffset = importOffset;
    this.module = module;
    this.bindings = bindings;
    this.endOffset = endOffset;
  }

  /** Returns the module of a {@code from} import, such as {@code os.path} or {@code ..pkg}. */
  @Nullable
  public String getModule() {
    return module;
  }

  public ImmutableList<Binding> getBindings() {
    return bindings;
  }

  /** Reports whether this is a wildcard import, {@code from m import *}. */
  public boolean isWildcard() {
    return module != null && bindings.isEmpty();
  }

  @Override
  public int getStartOffset() {
    return importOffset;
  }

  @Override
  public int getEndOffset() {
    return endOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}

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

package net.flowlint.java.analysis;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import net.flowlint.java.syntax.ClassStatement;
import net.flowlint.java.syntax.DefStatement;
import net.flowlint.java.syntax.Node;

/**
 * A lexical scope: the module, or the body of a function, class, lambda or comprehension.
 *
 * <p>Scopes compare by identity.
 */
public final class Scope {

  /** The kinds of scope. */
  public enum Kind {
    MODULE,
    FUNCTION,
    CLASS,
    LAMBDA,
    COMPREHENSION
  }

  private final Kind kind;
  private final Node owner;
  @Nullable private final Scope parent;
  private final List<Scope> children = new ArrayList<>();

  // Names bound in this scope, and names declared global or nonlocal, in order of appearance.
  final Set<String> locals = new LinkedHashSet<>();
  final Set<String> globals = new LinkedHashSet<>();
  final Set<String> nonlocals = new LinkedHashSet<>();

  Scope(Kind kind, Node owner, @Nullable Scope parent) {
    this.kind = kind;
    this.owner = owner;
    this.parent = parent;
    if (parent != null) {
      parent.children.add(this);
    }
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Returns the node that introduces the scope: a SourceFile, DefStatement, ClassStatement,
   * LambdaExpression or Comprehension.
   */
  public Node getOwner() {
    return owner;
  }

  /** Returns the enclosing scope, or null for the module. */
  @Nullable
  public Scope getParent() {
    return parent;
  }

  public ImmutableList<Scope> getChildren() {
    return ImmutableList.copyOf(children);
  }

  /** Returns the names bound in this scope. */
  public Set<String> getLocals() {
    return Collections.unmodifiableSet(locals);
  }

  /** Reports whether {@code other} is this scope or one nested within it. */
  public boolean encloses(Scope other) {
    for (Scope s = other; s != null; s = s.parent) {
      if (s == this) {
        return true;
      }
    }
    return false;
  }

  /** Returns a dotted name for the scope, such as {@code __main__.C.f}. */
  public String getName() {
    if (parent == null) {
      return "__main__";
    }
    String name;
    switch (kind) {
      case FUNCTION:
        name = ((DefStatement) owner).getIdentifier().getName();
        break;
      case CLASS:
        name = ((ClassStatement) owner).getIdentifier().getName();
        break;
      case LAMBDA:
        name = "<lambda>";
        break;
      default:
        name = "<comprehension>";
        break;
    }
    return parent.getName() + "." + name;
  }

  @Override
  public String toString() {
    return kind + " " + getName();
  }
}

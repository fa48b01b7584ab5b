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

package net.flowlint.java.cfg;

import com.google.common.base.Preconditions;
import java.util.Objects;
import javax.annotation.Nullable;
import net.flowlint.java.syntax.Expression;

/**
 * The label of a control-flow edge: the polarity of a branch, the exit of a loop, an exception
 * handler, or the outcome of a {@code case} pattern.
 */
public final class EdgeLabel {

  /** The kinds of labeled edges. */
  public enum Kind {
    /** Condition of an if or while held, or a for loop took another item. */
    TRUE,
    /** Condition of an if or while failed. */
    FALSE,
    /** A for loop ran out of items. */
    EXHAUSTED,
    /** An exception raised in a try body, caught by a handler. */
    EXCEPTION,
    /** A case pattern matched, and its guard held. */
    CASE,
    /** A case pattern did not match. */
    NO_MATCH,
  }

  public static final EdgeLabel TRUE = new EdgeLabel(Kind.TRUE, null);
  public static final EdgeLabel FALSE = new EdgeLabel(Kind.FALSE, null);
  public static final EdgeLabel EXHAUSTED = new EdgeLabel(Kind.EXHAUSTED, null);
  public static final EdgeLabel NO_MATCH = new EdgeLabel(Kind.NO_MATCH, null);

  private final Kind kind;
  @Nullable private final Expression detail; // exception type or case pattern

  private EdgeLabel(Kind kind, @Nullable Expression detail) {
    this.kind = kind;
    this.detail = detail;
  }

  /** Returns the label of an edge into a handler for the given type, or null for a bare except. */
  public static EdgeLabel exception(@Nullable Expression type) {
    return new EdgeLabel(Kind.EXCEPTION, type);
  }

  /** Returns the label of an edge taken when the given pattern matches. */
  public static EdgeLabel matched(Expression pattern) {
    return new EdgeLabel(Kind.CASE, Preconditions.checkNotNull(pattern));
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Returns the exception type of an EXCEPTION label or the pattern of a CASE label. Null for other
   * kinds and for bare {@code except:} clauses.
   */
  @Nullable
  public Expression getDetail() {
    return detail;
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof EdgeLabel)) {
      return false;
    }
    EdgeLabel other = (EdgeLabel) that;
    return kind == other.kind && detail == other.detail;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, System.identityHashCode(detail));
  }

  @Override
  public String toString() {
    switch (kind) {
      case TRUE:
        return "True";
      case FALSE:
        return "False";
      case EXHAUSTED:
        return "exhausted";
      case EXCEPTION:
        return detail == null ? "except" : "except " + detail;
      case CASE:
        return "case " + detail;
      case NO_MATCH:
        return "no match";
    }
    throw new IllegalStateException(kind.toString());
  }
}

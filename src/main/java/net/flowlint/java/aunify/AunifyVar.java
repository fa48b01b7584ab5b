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

package net.flowlint.java.aunify;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;
import net.flowlint.java.cfg.CfgLoc;
import net.flowlint.java.syntax.Identifier;
import net.flowlint.java.syntax.Node;

/**
 * A hole in a generalized tree: a placeholder standing where the antiunified fragments differ.
 *
 * <p>A hole is an identifier, so it may stand wherever a name or an expression is expected; where
 * a statement or an argument is expected, it is wrapped in an expression statement or a positional
 * argument. Its substitutions are the fragments' values at that position, one per fragment: nodes,
 * or lists of nodes where the fragments' lists differ in length.
 *
 * <p>A renamed hole is no longer a hole: it stands for a variable that the fragments merely name
 * differently, and it is spelled with the name used by the first fragment.
 */
public final class AunifyVar extends Identifier {

  private final ImmutableList<Object> subs;
  private final List<CfgLoc> subLocs;
  private final boolean renamed;

  AunifyVar(Node position, String name, List<?> subs, List<CfgLoc> subLocs, boolean renamed) {
    super(position, name);
    this.subs = ImmutableList.copyOf(subs);
    this.subLocs = Collections.unmodifiableList(new ArrayList<>(subLocs));
    this.renamed = renamed;
  }

  /** Returns the values this hole stands for, one per antiunified fragment. */
  public ImmutableList<Object> getSubs() {
    return subs;
  }

  /**
   * Returns the locations of the substitutions in the analyzed unit, parallel to {@link #getSubs};
   * an element is null where the location is unknown.
   */
  public List<CfgLoc> getSubLocs() {
    return subLocs;
  }

  /** Returns the location of the i-th substitution, or null. */
  @Nullable
  public CfgLoc getSubLoc(int i) {
    return subLocs.get(i);
  }

  public boolean isRenamed() {
    return renamed;
  }

  // Returns this hole spelled with the first substitution's name, no longer a hole.
  AunifyVar renamed() {
    return new AunifyVar(this, ((Identifier) subs.get(0)).getName(), subs, subLocs, true);
  }

  @Override
  protected Identifier withName(String name) {
    return new AunifyVar(this, name, subs, subLocs, renamed);
  }

  @Override
  public String toString() {
    return getName();
  }
}

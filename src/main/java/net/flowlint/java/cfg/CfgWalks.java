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

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Walks over the locations of a control-flow graph, in either direction, starting from a given
 * location.
 *
 * <p>A walk lists the rest of the starting block, then the blocks reachable from it depth-first,
 * each block once. The starting block may be listed again in full when a loop leads back to it.
 */
public final class CfgWalks {

  private CfgWalks() {}

  /** Returns the locations that may execute after {@code from}. */
  public static ImmutableList<CfgLoc> successors(CfgLoc from, boolean includeStart) {
    return successors(from, includeStart, loc -> false);
  }

  /**
   * Returns the locations that may execute after {@code from}, not walking past locations that
   * satisfy {@code stopAt}. Stopping locations are not listed.
   */
  public static ImmutableList<CfgLoc> successors(
      CfgLoc from, boolean includeStart, Predicate<CfgLoc> stopAt) {
    return new Walk(true, stopAt).run(from, includeStart);
  }

  /** Returns the locations that may execute before {@code from}, nearest first. */
  public static ImmutableList<CfgLoc> predecessors(CfgLoc from, boolean includeStart) {
    return predecessors(from, includeStart, loc -> false);
  }

  /**
   * Returns the locations that may execute before {@code from}, nearest first, not walking past
   * locations that satisfy {@code stopAt}. Stopping locations are not listed.
   */
  public static ImmutableList<CfgLoc> predecessors(
      CfgLoc from, boolean includeStart, Predicate<CfgLoc> stopAt) {
    return new Walk(false, stopAt).run(from, includeStart);
  }

  private static final class Walk {
    private final boolean forward;
    private final Predicate<CfgLoc> stopAt;
    private final Set<CfgBlock> visited = new HashSet<>();
    private final ImmutableList.Builder<CfgLoc> result = ImmutableList.builder();

    Walk(boolean forward, Predicate<CfgLoc> stopAt) {
      this.forward = forward;
      this.stopAt = stopAt;
    }

    ImmutableList<CfgLoc> run(CfgLoc from, boolean includeStart) {
      if (includeStart) {
        result.add(from);
      }
      int size = from.getBlock().getLocs().size();
      walk(from.getBlock(), forward ? from.getPosition() + 1 : size - from.getPosition());
      return result.build();
    }

    // Lists the locations of block from the nth, counting in the direction of the walk.
    private void walk(CfgBlock block, int nth) {
      List<CfgLoc> locs = block.getLocs();
      for (int i = nth; i < locs.size(); i++) {
        CfgLoc loc = locs.get(forward ? i : locs.size() - 1 - i);
        if (stopAt.test(loc)) {
          return;
        }
        result.add(loc);
      }
      for (CfgEdge edge : forward ? block.getSuccessors() : block.getPredecessors()) {
        CfgBlock next = forward ? edge.getTarget() : edge.getSource();
        if (visited.add(next)) {
          walk(next, 0);
        }
      }
    }
  }
}

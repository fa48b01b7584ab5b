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

import javax.annotation.Nullable;

/** A directed edge of a control-flow graph, optionally labeled. */
public final class CfgEdge {

  private final CfgBlock source;
  private CfgBlock target; // reassigned when an empty target is spliced out
  @Nullable private final EdgeLabel label;

  // Creates the edge and registers it with both ends.
  CfgEdge(CfgBlock source, CfgBlock target, @Nullable EdgeLabel label) {
    this.source = source;
    this.target = target;
    this.label = label;
    source.successors.add(this);
    target.predecessors.add(this);
  }

  public CfgBlock getSource() {
    return source;
  }

  public CfgBlock getTarget() {
    return target;
  }

  @Nullable
  public EdgeLabel getLabel() {
    return label;
  }

  void retarget(CfgBlock newTarget) {
    this.target = newTarget;
    newTarget.predecessors.add(this);
  }

  @Override
  public String toString() {
    return String.format(
        "%d -> %d%s", source.getId(), target.getId(), label == null ? "" : " [" + label + "]");
  }
}

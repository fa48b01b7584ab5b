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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import net.flowlint.java.syntax.ParserInput;
import net.flowlint.java.syntax.SourceFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CfgWalksTest {

  private SourceFile file;
  private FlowGraphs graphs;

  private void build(String... lines) throws Exception {
    file = SourceFile.parseStrict(ParserInput.fromLines(lines));
    graphs = CfgBuilder.build(file);
  }

  private CfgLoc locOf(int stmt) {
    return graphs.getLoc(file.getStatements().get(stmt));
  }

  private static List<String> lines(List<CfgLoc> locs) {
    List<String> result = new ArrayList<>();
    for (CfgLoc loc : locs) {
      result.add(CfgBuilderTest.firstLine(loc.getNode()));
    }
    return result;
  }

  @Test
  public void successorsFollowBranches() throws Exception {
    build(
        "a = 1", //
        "if c:",
        "  b = 2",
        "d = 3");
    assertThat(lines(CfgWalks.successors(locOf(0), false)))
        .containsExactly("c", "b = 2", "d = 3")
        .inOrder();
    assertThat(lines(CfgWalks.successors(locOf(0), true)))
        .containsExactly("a = 1", "c", "b = 2", "d = 3")
        .inOrder();
  }

  @Test
  public void predecessorsAreNearestFirst() throws Exception {
    build(
        "a = 1", //
        "if c:",
        "  b = 2",
        "d = 3");
    assertThat(lines(CfgWalks.predecessors(locOf(2), false)))
        .containsExactly("b = 2", "c", "a = 1")
        .inOrder();
  }

  @Test
  public void walkStopsAtMatchingLocation() throws Exception {
    build(
        "a = 1", //
        "if c:",
        "  b = 2",
        "d = 3");
    CfgLoc cond = locOf(1);
    assertThat(lines(CfgWalks.predecessors(locOf(2), false, loc -> loc == cond)))
        .containsExactly("b = 2");
    assertThat(lines(CfgWalks.successors(locOf(0), false, loc -> loc == cond))).isEmpty();
  }

  @Test
  public void loopRevisitsTheStartingBlock() throws Exception {
    build(
        "while c:", //
        "  x = 1",
        "  y = 2");
    CfgLoc y = graphs.getRootGraph().getStart().getSuccessors().get(0).getTarget().getLocs().get(1);
    assertThat(lines(CfgWalks.successors(y, false))).containsExactly("c", "x = 1", "y = 2");
  }
}

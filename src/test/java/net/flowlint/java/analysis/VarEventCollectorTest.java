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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import net.flowlint.java.syntax.AssignmentStatement;
import net.flowlint.java.syntax.DotExpression;
import net.flowlint.java.syntax.ForStatement;
import net.flowlint.java.syntax.Identifier;
import net.flowlint.java.syntax.ParserInput;
import net.flowlint.java.syntax.SourceFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the variable events collected by {@link Analyzer}. */
@RunWith(JUnit4.class)
public final class VarEventCollectorTest {

  private SourceFile file;
  private UnitAnalysis unit;

  private List<String> events(String... lines) throws Exception {
    file = SourceFile.parseStrict(ParserInput.fromLines(lines));
    unit = Analyzer.analyze(file);
    return describe(unit.getEvents());
  }

  static String describe(VarEvent event) {
    return event.getKind()
        + " "
        + event.getVariable().getName()
        + "@"
        + event.getNode().getStartLocation().line();
  }

  static List<String> describe(List<VarEvent> events) {
    List<String> result = new ArrayList<>();
    for (VarEvent event : events) {
      result.add(describe(event));
    }
    return result;
  }

  @Test
  public void assignmentsReadBeforeBinding() throws Exception {
    assertThat(events("x = 1", "y = x", "x = 2"))
        .containsExactly("ASSIGN x@1", "READ x@2", "ASSIGN y@2", "REASSIGN x@3")
        .inOrder();
  }

  @Test
  public void augmentedAssignmentReadsThenRebinds() throws Exception {
    assertThat(events("x = 0", "x += 1"))
        .containsExactly("ASSIGN x@1", "READ x@2", "REASSIGN x@2")
        .inOrder();
    Identifier x = (Identifier) ((AssignmentStatement) file.getStatements().get(1)).getLHS();
    assertThat(describe(unit.getEvents(x))).containsExactly("READ x@2", "REASSIGN x@2").inOrder();
  }

  @Test
  public void inPlaceChangesModify() throws Exception {
    assertThat(
            events(
                "xs = []", //
                "xs.append(1)",
                "xs[0] = 2",
                "d = {}",
                "d.k = xs",
                "xs.count(1)"))
        .containsExactly(
            "ASSIGN xs@1",
            "MODIFY xs@2",
            "MODIFY xs@3",
            "ASSIGN d@4",
            "READ xs@5",
            "MODIFY d@5",
            "READ xs@6")
        .inOrder();
    VarEvent append = unit.getEvents().get(1);
    assertThat(append.getAccess()).isInstanceOf(DotExpression.class);
    assertThat(append.getAccess().toString()).isEqualTo("xs.append");
  }

  @Test
  public void deletionStartsOver() throws Exception {
    assertThat(events("x = 1", "del x", "x = 2"))
        .containsExactly("ASSIGN x@1", "DELETE x@2", "ASSIGN x@3")
        .inOrder();
  }

  @Test
  public void builtinsAndAnnotationsHaveNoEvents() throws Exception {
    assertThat(events("print(len(undefined))")).isEmpty();
    assertThat(unit.getCallSites()).isEmpty();
    assertThat(events("x: int")).isEmpty();
    assertThat(events("x: int = 1")).containsExactly("ASSIGN x@1");
  }

  @Test
  public void eventsAreAttachedToTheirLocations() throws Exception {
    events(
        "xs = []", //
        "for i in xs:",
        "  print(i)");
    ForStatement loop = (ForStatement) file.getStatements().get(1);
    assertThat(describe(unit.getEvents(unit.getFlowGraphs().getLoc(loop.getIterable()))))
        .containsExactly("READ xs@2");
    assertThat(describe(unit.getEvents(unit.getFlowGraphs().getLoc(loop.getVars()))))
        .containsExactly("ASSIGN i@2");
    assertThat(describe(unit.getEvents(unit.getFlowGraphs().getLoc(loop.getBody().get(0)))))
        .containsExactly("READ i@3");
  }

  @Test
  public void functionsBindTheirNameAndParameters() throws Exception {
    assertThat(
            events(
                "def f(a, b=c):", //
                "  return a",
                "c = 1"))
        .containsExactly(
            "READ c@1", "ASSIGN f@1", "ASSIGN a@1", "ASSIGN b@1", "READ a@2", "ASSIGN c@3")
        .inOrder();
  }

  @Test
  public void outsideScopeEventsAreRecordedPerScope() throws Exception {
    events(
        "x = 1", //
        "def f():",
        "  global y",
        "  y = x",
        "  z = 2");
    assertThat(describe(unit.getOutsideScopeEvents(file.getStatements().get(1))))
        .containsExactly("READ x@4", "ASSIGN y@4")
        .inOrder();
  }

  @Test
  public void callsThroughNamesAreCallSites() throws Exception {
    events(
        "def f():", //
        "  pass",
        "f()",
        "print(f)");
    assertThat(unit.getCallSites()).hasSize(1);
    CallSite site = unit.getCallSites().get(0);
    assertThat(describe(site.getCallee())).isEqualTo("READ f@3");
    assertThat(site.getCaller()).isSameInstanceAs(unit.getResolution().getModuleScope());
    assertThat(site.toString()).isEqualTo("call of f@__main__ in __main__");
  }

  @Test
  public void importsAndHandlersBind() throws Exception {
    assertThat(
            events(
                "import os.path as p", //
                "try:",
                "  p.join()",
                "except OSError as e:",
                "  raise e"))
        .containsExactly("ASSIGN p@1", "READ p@3", "ASSIGN e@4", "READ e@5")
        .inOrder();
  }
}

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
import static net.flowlint.java.analysis.VarEventCollectorTest.describe;

import net.flowlint.java.cfg.CfgLoc;
import net.flowlint.java.syntax.DefStatement;
import net.flowlint.java.syntax.ParserInput;
import net.flowlint.java.syntax.SourceFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the reaching-definitions links made by {@link Analyzer}. */
@RunWith(JUnit4.class)
public final class ReachingDefinitionsTest {

  private SourceFile file;
  private UnitAnalysis unit;

  private void analyze(String... lines) throws Exception {
    analyze(AnalysisOptions.DEFAULT, lines);
  }

  private void analyze(AnalysisOptions options, String... lines) throws Exception {
    file = SourceFile.parseStrict(ParserInput.fromLines(lines));
    unit = Analyzer.analyze(file, options);
  }

  // Returns the event described as, for example, "READ x@3".
  private VarEvent event(String description) {
    VarEvent found = null;
    for (VarEvent event : unit.getEvents()) {
      if (describe(event).equals(description)) {
        assertThat(found).isNull();
        found = event;
      }
    }
    assertThat(found).isNotNull();
    return found;
  }

  @Test
  public void straightLineDefinitionsAreKilled() throws Exception {
    analyze(
        "x = 1", //
        "y = x",
        "x = 2",
        "z = x");
    assertThat(describe(event("READ x@2").getDefinitions())).containsExactly("ASSIGN x@1");
    assertThat(describe(event("READ x@4").getDefinitions())).containsExactly("REASSIGN x@3");
    assertThat(describe(event("ASSIGN x@1").getUses())).containsExactly("READ x@2");
    assertThat(describe(event("REASSIGN x@3").getRedefines())).containsExactly("ASSIGN x@1");
    assertThat(describe(event("ASSIGN x@1").getRedefinedBy())).containsExactly("REASSIGN x@3");
    assertThat(event("ASSIGN z@4").getRedefines()).isEmpty();
  }

  @Test
  public void branchesMerge() throws Exception {
    analyze(
        "if c:", //
        "  x = 1",
        "else:",
        "  x = 2",
        "print(x)");
    assertThat(describe(event("READ x@5").getDefinitions()))
        .containsExactly("ASSIGN x@2", "REASSIGN x@4")
        .inOrder();
    // Neither branch overwrites the other.
    assertThat(event("REASSIGN x@4").getRedefines()).isEmpty();
  }

  @Test
  public void loopBackEdgeCarriesDefinitions() throws Exception {
    analyze(
        "x = 0", //
        "while c:",
        "  x = x + 1",
        "print(x)");
    assertThat(describe(event("READ x@3").getDefinitions()))
        .containsExactly("ASSIGN x@1", "REASSIGN x@3")
        .inOrder();
    assertThat(describe(event("READ x@4").getDefinitions()))
        .containsExactly("ASSIGN x@1", "REASSIGN x@3")
        .inOrder();
    assertThat(describe(event("REASSIGN x@3").getRedefines())).containsExactly("ASSIGN x@1");
  }

  @Test
  public void modificationUsesAndRedefines() throws Exception {
    analyze(
        "xs = []", //
        "xs.append(1)",
        "print(xs)");
    VarEvent append = event("MODIFY xs@2");
    assertThat(describe(append.getDefinitions())).containsExactly("ASSIGN xs@1");
    assertThat(describe(event("READ xs@3").getDefinitions())).containsExactly("MODIFY xs@2");
  }

  @Test
  public void deletionReachesButIsNotLive() throws Exception {
    analyze(
        "x = 1", //
        "del x",
        "print(x)");
    VarEvent read = event("READ x@3");
    assertThat(describe(read.getDefinitions())).containsExactly("DELETE x@2");
    assertThat(read.getLiveDefinitions()).isEmpty();
  }

  @Test
  public void nothingReachesUnreachableCode() throws Exception {
    analyze(
        "x = 1", //
        "def f():",
        "  return",
        "  print(x)");
    assertThat(event("READ x@4").getDefinitions()).isEmpty();
  }

  @Test
  public void handlerSeesTheStateOnEntryToTheTry() throws Exception {
    analyze(
        "x = 0", //
        "try:",
        "  x = int(s)",
        "except ValueError:",
        "  print(x)");
    assertThat(describe(event("READ x@5").getDefinitions()))
        .containsExactly("ASSIGN x@1", "REASSIGN x@3");
  }

  @Test
  public void finallySeesEveryWayOutOfTheTry() throws Exception {
    analyze(
        "def f(h):", //
        "  x = 0",
        "  try:",
        "    x = h.read()",
        "    if x:",
        "      return x",
        "  except E:",
        "    x = 1",
        "  else:",
        "    x = 2",
        "  finally:",
        "    print(x)");
    assertThat(describe(event("READ x@12").getDefinitions()))
        .containsExactly("ASSIGN x@2", "REASSIGN x@4", "REASSIGN x@8", "REASSIGN x@10");
  }

  @Test
  public void finallyRunsAfterReturn() throws Exception {
    analyze(
        "def f(h):", //
        "  try:",
        "    return h.read()",
        "  finally:",
        "    print(h)");
    assertThat(describe(event("READ h@5").getDefinitions())).containsExactly("ASSIGN h@1");
  }

  @Test
  public void nestedFunctionSeesDefinitionsOfItsBlock() throws Exception {
    analyze(
        "x = 1", //
        "def f():",
        "  return x");
    assertThat(describe(event("READ x@3").getDefinitions())).containsExactly("ASSIGN x@1");
  }

  @Test
  public void definitionsReachingALocation() throws Exception {
    analyze(
        "x = 1", //
        "x = 2",
        "y = x");
    Variable x = Variable.of("x", unit.getResolution().getModuleScope());
    assertThat(describe(unit.getDefinitionsReaching(locOf(1), x))).containsExactly("ASSIGN x@1");
    assertThat(describe(unit.getDefinitionsReaching(locOf(2), x)))
        .containsExactly("REASSIGN x@2");
    assertThat(describe(unit.getDefinitionsReaching(locOf(0), x))).isEmpty();
  }

  private CfgLoc locOf(int stmt) {
    return unit.getFlowGraphs().getLoc(file.getStatements().get(stmt));
  }

  @Test
  public void callsPerformTheDefinitionsOfTheCallee() throws Exception {
    String[] program = {
      "x = 1", //
      "def set_x():",
      "  global x",
      "  x = 2",
      "set_x()",
      "print(x)",
    };
    analyze(program);
    // The call may define x; the earlier definition survives.
    assertThat(describe(event("READ x@6").getDefinitions()))
        .containsExactly("ASSIGN x@1", "REASSIGN x@4")
        .inOrder();
    CallSite site = unit.getCallSites().get(0);
    DefStatement def = (DefStatement) file.getStatements().get(1);
    assertThat(unit.getCallTarget(site)).isSameInstanceAs(unit.getResolution().getScope(def));
    assertThat(unit.getCallGraph().get(unit.getResolution().getModuleScope()))
        .containsExactly(unit.getResolution().getScope(def));

    analyze(AnalysisOptions.builder().interproceduralCalls(false).build(), program);
    assertThat(describe(event("READ x@6").getDefinitions())).containsExactly("ASSIGN x@1");
  }

  @Test
  public void callsPerformTheReadsOfTheCallee() throws Exception {
    analyze(
        "def show():", //
        "  print(x)",
        "x = 1",
        "show()",
        "x = 2");
    assertThat(describe(event("ASSIGN x@3").getUses())).containsExactly("READ x@2");
    assertThat(describe(event("READ x@2").getDefinitions()))
        .containsExactly("ASSIGN x@3", "REASSIGN x@5")
        .inOrder();
  }

  @Test
  public void callsOfLambdasAreResolved() throws Exception {
    analyze(
        "n = 0", //
        "inc = lambda: n + 1",
        "inc()");
    CallSite site = unit.getCallSites().get(0);
    assertThat(unit.getCallTarget(site).getKind()).isEqualTo(Scope.Kind.LAMBDA);
  }

  @Test
  public void ambiguousCalleeIsNotResolved() throws Exception {
    analyze(
        "if c:", //
        "  def f():",
        "    pass",
        "else:",
        "  f = print",
        "f()");
    assertThat(unit.getCallTarget(unit.getCallSites().get(0))).isNull();
    assertThat(unit.getCallGraph()).isEmpty();
  }

  @Test
  public void recursionTerminates() throws Exception {
    analyze(
        "def f(n):", //
        "  return f(n - 1)",
        "f(3)");
    Scope f = unit.getResolution().getScope(file.getStatements().get(0));
    assertThat(unit.getCallGraph().get(f)).containsExactly(f);
    assertThat(unit.getCallGraph().get(unit.getResolution().getModuleScope())).containsExactly(f);
  }
}

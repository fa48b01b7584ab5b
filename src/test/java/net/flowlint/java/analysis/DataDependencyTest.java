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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.ArrayList;
import java.util.List;
import net.flowlint.java.cfg.CfgLoc;
import net.flowlint.java.syntax.DefStatement;
import net.flowlint.java.syntax.ForStatement;
import net.flowlint.java.syntax.ParserInput;
import net.flowlint.java.syntax.SourceFile;
import net.flowlint.java.syntax.Statement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DataDependencyTest {

  private SourceFile file;
  private UnitAnalysis unit;

  private void analyze(String... lines) throws Exception {
    file = SourceFile.parseStrict(ParserInput.fromLines(lines));
    unit = Analyzer.analyze(file);
  }

  private List<Statement> stmts(int from, int to) {
    return file.getStatements().subList(from, to);
  }

  private CfgLoc locOf(int stmt) {
    return unit.getFlowGraphs().getLoc(file.getStatements().get(stmt));
  }

  private Variable global(String name) {
    return Variable.of(name, unit.getResolution().getModuleScope());
  }

  private static List<String> names(Iterable<Variable> vars) {
    List<String> result = new ArrayList<>();
    for (Variable var : vars) {
      result.add(var.getName());
    }
    return result;
  }

  @Test
  public void eventsForSubtree() throws Exception {
    analyze("x = 1", "y = x + x");
    assertThat(describe(DataDependency.eventsFor(unit, file.getStatements().get(1))))
        .containsExactly("READ x@2", "READ x@2", "ASSIGN y@2")
        .inOrder();
  }

  @Test
  public void varsInFiltersByKind() throws Exception {
    analyze("x = 1", "y = x", "x = y");
    assertThat(names(DataDependency.varsIn(unit, stmts(1, 3)).keySet()))
        .containsExactly("x", "y")
        .inOrder();
    assertThat(
            names(
                DataDependency.varsIn(unit, stmts(1, 3), ImmutableSet.of(VarEventKind.READ))
                    .keySet()))
        .containsExactly("x", "y");
    assertThat(
            DataDependency.varsIn(unit, stmts(1, 3), ImmutableSet.of(VarEventKind.DELETE)))
        .isEmpty();
  }

  @Test
  public void fragmentInputsAndOutputs() throws Exception {
    analyze(
        "a = 1", //
        "b = a + 1",
        "c = b",
        "print(c)");
    List<Statement> fragment = stmts(1, 3);
    ImmutableSetMultimap<Variable, VarEvent> inputs =
        DataDependency.varsDefinedBefore(unit, fragment);
    assertThat(inputs.keySet()).containsExactly(global("a"));
    assertThat(describe(inputs.get(global("a")).asList())).containsExactly("ASSIGN a@1");
    assertThat(DataDependency.varsUsedAfter(unit, fragment).keySet())
        .containsExactly(global("c"));
  }

  @Test
  public void usesWithinALoopFragmentAreNotOutputs() throws Exception {
    analyze(
        "t = 0", //
        "for x in xs:",
        "  t = t + x",
        "print(t)");
    ForStatement loop = (ForStatement) file.getStatements().get(1);
    ImmutableSetMultimap<Variable, VarEvent> outputs =
        DataDependency.varsUsedAfter(unit, loop.getBody());
    assertThat(outputs.keySet()).containsExactly(global("t"));
    assertThat(describe(outputs.get(global("t")).asList())).containsExactly("READ t@4");
  }

  @Test
  public void modifiedIn() throws Exception {
    analyze(
        "xs = []", //
        "xs.append(1)",
        "y = xs",
        "del y");
    ImmutableSet<Variable> xs = ImmutableSet.of(global("xs"));
    assertThat(DataDependency.modifiedIn(unit, xs, stmts(1, 2))).isTrue();
    assertThat(DataDependency.modifiedIn(unit, xs, stmts(2, 4))).isFalse();
    assertThat(DataDependency.modifiedIn(unit, ImmutableSet.of(global("y")), stmts(3, 4)))
        .isFalse();
  }

  @Test
  public void changedBetweenLocations() throws Exception {
    analyze(
        "x = 1", //
        "y = 2",
        "x = 3",
        "print(x)");
    Variable x = global("x");
    assertThat(DataDependency.isChangedBetween(unit, x, locOf(0), ImmutableList.of(locOf(3))))
        .isTrue();
    assertThat(DataDependency.isChangedBetween(unit, x, locOf(2), ImmutableList.of(locOf(3))))
        .isFalse();
    assertThat(DataDependency.isChangedBetween(unit, x, locOf(1), ImmutableList.of(locOf(2))))
        .isTrue();
    assertThat(describe(DataDependency.definitionsAt(unit, locOf(3), x)))
        .containsExactly("REASSIGN x@3");
  }

  @Test
  public void controlStatementsLeavingTheFragment() throws Exception {
    analyze(
        "def f(xs):", //
        "  for x in xs:",
        "    if x:",
        "      break",
        "    return x",
        "  while True:",
        "    continue",
        "  def g():",
        "    return 1",
        "  raise ValueError()");
    DefStatement f = (DefStatement) file.getStatements().get(0);
    assertThat(kinds(DataDependency.controlStatements(f.getBody())))
        .containsExactly("return", "raise")
        .inOrder();
    ForStatement loop = (ForStatement) f.getBody().get(0);
    assertThat(kinds(DataDependency.controlStatements(loop.getBody())))
        .containsExactly("break", "return")
        .inOrder();
  }

  private static List<String> kinds(List<Statement> stmts) {
    List<String> result = new ArrayList<>();
    for (Statement stmt : stmts) {
      result.add(stmt.toString().split(" ", 2)[0]);
    }
    return result;
  }
}

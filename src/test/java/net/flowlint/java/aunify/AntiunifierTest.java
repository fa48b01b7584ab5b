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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import net.flowlint.java.analysis.Analyzer;
import net.flowlint.java.analysis.UnitAnalysis;
import net.flowlint.java.syntax.DefStatement;
import net.flowlint.java.syntax.Expression;
import net.flowlint.java.syntax.ExpressionStatement;
import net.flowlint.java.syntax.Identifier;
import net.flowlint.java.syntax.Node;
import net.flowlint.java.syntax.Nodes;
import net.flowlint.java.syntax.ParserInput;
import net.flowlint.java.syntax.SourceFile;
import net.flowlint.java.syntax.Statement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Antiunifier}. */
@RunWith(JUnit4.class)
public final class AntiunifierTest {

  private static Expression expr(String source) throws Exception {
    return Expression.parse(ParserInput.fromLines(source));
  }

  private static Generalization antiunify(String... exprs) throws Exception {
    List<Node> fragments = new ArrayList<>();
    for (String source : exprs) {
      fragments.add(expr(source));
    }
    Optional<Generalization> result = Antiunifier.antiunify(fragments, null);
    assertThat(result.isPresent()).isTrue();
    return result.get();
  }

  private static String core(Generalization g) {
    List<String> lines = new ArrayList<>();
    for (Node node : g.getCore()) {
      lines.add(node.toString());
    }
    return String.join("\n", lines);
  }

  private static List<String> subs(AunifyVar hole) {
    List<String> result = new ArrayList<>();
    for (Object sub : hole.getSubs()) {
      result.add(sub.toString());
    }
    return result;
  }

  // Asserts that each fragment is rebuilt from the core.
  private static void assertRoundTrip(Generalization g) {
    for (int i = 0; i < g.size(); i++) {
      assertThat(Nodes.structurallyEqual(SubVariants.of(g, i), g.getFragment(i))).isTrue();
    }
  }

  @Test
  public void equalFragmentsHaveNoHoles() throws Exception {
    Expression x = expr("f(x) + 0x10");
    Generalization g = Antiunifier.antiunify(ImmutableList.of(x, expr("f(x) + 16")), null).get();
    assertThat(g.getHoles()).isEmpty();
    assertThat(Nodes.structurallyEqual(g.getCore().get(0), x)).isTrue();
    assertThat(g.getCore().get(0)).isNotSameInstanceAs(x);
    assertThat(g.isBlock()).isFalse();
    assertRoundTrip(g);
  }

  @Test
  public void differingSubtreesBecomeHoles() throws Exception {
    Generalization g = antiunify("x + y * 2", "a + b * 2", "c + d * 2");
    assertThat(core(g)).isEqualTo("ID_1 + ID_2 * 2");
    assertThat(g.getHoles()).hasSize(2);
    assertThat(subs(g.getHoles().get(0))).containsExactly("x", "a", "c").inOrder();
    assertThat(subs(g.getHoles().get(1))).containsExactly("y", "b", "d").inOrder();
    assertThat(g.size()).isEqualTo(3);
    assertRoundTrip(g);
  }

  @Test
  public void operatorDifferenceGeneralizesTheWholeOperation() throws Exception {
    Generalization g = antiunify("f(x + 1)", "f(x - 1)");
    assertThat(core(g)).isEqualTo("f(ID_1)");
    assertThat(subs(g.getHoles().get(0))).containsExactly("x + 1", "x - 1").inOrder();
    assertRoundTrip(g);
  }

  @Test
  public void differentArgumentCountsHoleTheArgumentList() throws Exception {
    Generalization g = antiunify("f(a, b)", "f(c)");
    assertThat(core(g)).isEqualTo("f(ID_1)");
    AunifyVar hole = g.getHoles().get(0);
    assertThat(hole.getSubs().get(0)).isInstanceOf(List.class);
    assertThat((List<?>) hole.getSubs().get(0)).hasSize(2);
    assertThat((List<?>) hole.getSubs().get(1)).hasSize(1);
    assertRoundTrip(g);
  }

  @Test
  public void eachAntiunificationNumbersHolesFromOne() throws Exception {
    assertThat(core(antiunify("a", "b"))).isEqualTo("ID_1");
    assertThat(core(antiunify("a", "b"))).isEqualTo("ID_1");
  }

  @Test
  public void holesOfEarlierGeneralizationsCollectAllSubstitutions() throws Exception {
    Generalization first = antiunify("x + 1", "y + 1");
    Generalization second = antiunify("a + 1", "b + 1");
    // Both holes are named ID_1, yet they stand for different substitutions.
    List<Node> cores = ImmutableList.of(first.getCore().get(0), second.getCore().get(0));
    Generalization merged = Antiunifier.antiunify(cores, null).get();
    assertThat(core(merged)).isEqualTo("ID_1 + 1");
    assertThat(merged.getHoles()).hasSize(1);
    assertThat(subs(merged.getHoles().get(0))).containsExactly("x", "y", "a", "b").inOrder();
  }

  @Test
  public void holeMergesWithAPlainSubtree() throws Exception {
    Generalization first = antiunify("f(x)", "f(y)");
    Generalization merged =
        Antiunifier.antiunify(ImmutableList.of(first.getCore().get(0), expr("f(z)")), null).get();
    assertThat(core(merged)).isEqualTo("f(ID_1)");
    assertThat(subs(merged.getHoles().get(0))).containsExactly("x", "y", "z").inOrder();
  }

  @Test
  public void mismatchedStatementsBecomeAStatementHole() throws Exception {
    SourceFile file = SourceFile.parseStrict(ParserInput.fromLines("print(x)", "x = 1"));
    Generalization g = Antiunifier.antiunify(file.getStatements(), null).get();
    assertThat(g.getCore().get(0)).isInstanceOf(ExpressionStatement.class);
    assertThat(core(g)).isEqualTo("ID_1");
    assertThat(g.getHoles().get(0).getSubs().get(1)).isInstanceOf(Statement.class);
    assertRoundTrip(g);
    assertThat(
            Antiunifier.antiunify(
                    file.getStatements(), null, StopConditions.typeMismatch(), h -> false)
                .isPresent())
        .isFalse();
  }

  @Test
  public void blocksOfDifferentLengthsShareOneHole() throws Exception {
    SourceFile file = SourceFile.parseStrict(ParserInput.fromLines("a = 1", "b = 2", "c = 3"));
    List<Statement> stmts = file.getStatements();
    ImmutableList<List<Statement>> blocks =
        ImmutableList.of(stmts.subList(0, 2), stmts.subList(2, 3));
    Generalization g = Antiunifier.antiunifyBlocks(blocks, null).get();
    assertThat(g.isBlock()).isTrue();
    assertThat(core(g)).isEqualTo("ID_1");
    assertThat(g.getHoles()).hasSize(1);
    assertThat(SubVariants.of(g, 0)).hasSize(2);
    assertRoundTrip(g);
    assertThat(
            Antiunifier.antiunifyBlocks(blocks, null, StopConditions.lengthMismatch(), h -> false)
                .isPresent())
        .isFalse();
  }

  @Test
  public void stopConditionVetoesGeneralization() throws Exception {
    ImmutableList<Expression> fragments = ImmutableList.of(expr("x + y"), expr("a + b"));
    assertThat(
            Antiunifier.antiunify(fragments, null, StopConditions.moreHolesThan(1), h -> false)
                .isPresent())
        .isFalse();
    assertThat(
            Antiunifier.antiunify(fragments, null, StopConditions.moreHolesThan(2), h -> false)
                .isPresent())
        .isTrue();
  }

  @Test
  public void stopConditionIsTestedOnceWithAllHoles() throws Exception {
    ImmutableList<Expression> fragments = ImmutableList.of(expr("x + y * 2"), expr("a + b * 2"));
    List<List<String>> seen = new ArrayList<>();
    Predicate<List<AunifyVar>> record =
        holes -> {
          List<String> names = new ArrayList<>();
          for (AunifyVar hole : holes) {
            names.add(hole.getName());
          }
          seen.add(names);
          return false;
        };
    assertThat(Antiunifier.antiunify(fragments, null, record, h -> false).isPresent()).isTrue();
    assertThat(seen).containsExactly(ImmutableList.of("ID_1", "ID_2"));
  }

  @Test
  public void needsTwoFragments() throws Exception {
    assertThrows(
        IllegalArgumentException.class,
        () -> Antiunifier.antiunify(ImmutableList.of(expr("x")), null));
  }

  // ==== with an analyzed unit ====

  private static final String[] FUNCTIONS = {
    "def f():", //
    "  x = 1",
    "  print(x)",
    "def g():",
    "  y = 1",
    "  print(y)",
    "def h():",
    "  z = 1",
    "  print(z)",
    "  return z",
  };

  private SourceFile file;
  private UnitAnalysis unit;

  private List<Statement> body(int def, int from, int to) throws Exception {
    if (file == null) {
      file = SourceFile.parseStrict(ParserInput.fromLines(FUNCTIONS));
      unit = Analyzer.analyze(file);
    }
    return ((DefStatement) file.getStatements().get(def)).getBody().subList(from, to);
  }

  @Test
  public void renamedVariablesAreFoldedBack() throws Exception {
    ImmutableList<List<Statement>> blocks = ImmutableList.of(body(0, 0, 2), body(1, 0, 2));

    Generalization plain = Antiunifier.antiunifyBlocks(blocks, null).get();
    assertThat(core(plain)).isEqualTo("ID_1 = 1\nprint(ID_2)");

    Generalization g = Antiunifier.antiunifyBlocks(blocks, unit).get();
    assertThat(core(g)).isEqualTo("x = 1\nprint(x)");
    assertThat(g.getHoles()).isEmpty();
    assertRoundTrip(g);
    assertThat(SubVariants.of(g, 1).get(1).toString()).isEqualTo("print(y)");
  }

  @Test
  public void variableUsedAfterTheFragmentIsNotRenamed() throws Exception {
    // h returns z after the fragment.
    ImmutableList<List<Statement>> blocks = ImmutableList.of(body(0, 0, 2), body(2, 0, 2));
    Generalization g = Antiunifier.antiunifyBlocks(blocks, unit).get();
    assertThat(core(g)).isEqualTo("ID_1 = 1\nprint(ID_2)");
    assertThat(g.getHoles()).hasSize(2);
  }

  @Test
  public void stopConditionAfterRenaming() throws Exception {
    ImmutableList<List<Statement>> blocks = ImmutableList.of(body(0, 0, 2), body(1, 0, 2));
    assertThat(
            Antiunifier.antiunifyBlocks(blocks, unit, StopConditions.moreHolesThan(0), h -> false)
                .isPresent())
        .isFalse();
    assertThat(
            Antiunifier.antiunifyBlocks(blocks, unit, h -> false, StopConditions.moreHolesThan(0))
                .isPresent())
        .isTrue();
  }

  @Test
  public void substitutionsKnowTheirLocations() throws Exception {
    List<Statement> first = body(0, 0, 1);
    List<Statement> second = body(1, 0, 1);
    Generalization g =
        Antiunifier.antiunify(ImmutableList.of(first.get(0), second.get(0)), unit).get();
    AunifyVar hole = g.getHoles().get(0);
    assertThat(hole.getSubLoc(0)).isSameInstanceAs(unit.getFlowGraphs().getLoc(first.get(0)));
    assertThat(hole.getSubLoc(1)).isSameInstanceAs(unit.getFlowGraphs().getLoc(second.get(0)));

    Generalization unlocated =
        Antiunifier.antiunify(ImmutableList.of(first.get(0), second.get(0)), null).get();
    assertThat(unlocated.getHoles().get(0).getSubLocs()).containsExactly(null, null);
  }

  @Test
  public void coreIsAnalyzedOnDemand() throws Exception {
    Generalization g =
        Antiunifier.antiunifyBlocks(ImmutableList.of(body(0, 0, 2), body(1, 0, 2)), null).get();
    UnitAnalysis core = g.getCoreAnalysis();
    assertThat(core).isSameInstanceAs(g.getCoreAnalysis());
    assertThat(core.getSourceFile()).isSameInstanceAs(g.getCoreFile());
    // ID_1 is bound by the core; ID_2 is not.
    assertThat(core.getEvents()).hasSize(1);
    Identifier bound = core.getEvents().get(0).getNode();
    assertThat(bound).isSameInstanceAs(g.getHoles().get(0));
  }
}

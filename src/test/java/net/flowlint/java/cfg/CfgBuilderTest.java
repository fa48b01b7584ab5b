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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.flowlint.java.syntax.ClassStatement;
import net.flowlint.java.syntax.DefStatement;
import net.flowlint.java.syntax.FlowStatement;
import net.flowlint.java.syntax.IfStatement;
import net.flowlint.java.syntax.LambdaExpression;
import net.flowlint.java.syntax.Node;
import net.flowlint.java.syntax.NodePrinter;
import net.flowlint.java.syntax.ParserInput;
import net.flowlint.java.syntax.ReturnStatement;
import net.flowlint.java.syntax.SourceFile;
import net.flowlint.java.syntax.Statement;
import net.flowlint.java.syntax.SyntaxError;
import net.flowlint.java.syntax.TryStatement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link CfgBuilder}. */
@RunWith(JUnit4.class)
public final class CfgBuilderTest {

  private SourceFile file;

  private FlowGraphs build(String... lines) throws SyntaxError.Exception {
    file = SourceFile.parseStrict(ParserInput.fromLines(lines));
    return CfgBuilder.build(file);
  }

  private Statement stmt(int i) {
    return file.getStatements().get(i);
  }

  // Returns the first lines of the block's locations, or "end".
  static String describe(CfgBlock block) {
    if (block == block.getGraph().getEnd()) {
      return "end";
    }
    List<String> lines = new ArrayList<>();
    for (CfgLoc loc : block.getLocs()) {
      lines.add(firstLine(loc.getNode()));
    }
    return String.join("; ", lines);
  }

  static String firstLine(Node node) {
    String printed = NodePrinter.print(node).trim();
    int nl = printed.indexOf('\n');
    return nl < 0 ? printed : printed.substring(0, nl);
  }

  // Returns the labeled successors of the block.
  static List<String> successors(CfgBlock block) {
    List<String> result = new ArrayList<>();
    for (CfgEdge edge : block.getSuccessors()) {
      String target = describe(edge.getTarget());
      result.add(edge.getLabel() == null ? target : edge.getLabel() + " -> " + target);
    }
    return result;
  }

  private static List<String> describeAll(List<CfgBlock> blocks) {
    List<String> result = new ArrayList<>();
    for (CfgBlock block : blocks) {
      result.add(describe(block));
    }
    return result;
  }

  @Test
  public void straightLineCodeIsOneBlock() throws Exception {
    ControlFlowGraph cfg = build("x = 1", "y = x").getRootGraph();
    assertThat(cfg.getOwner()).isSameInstanceAs(file);
    assertThat(describe(cfg.getStart())).isEqualTo("x = 1; y = x");
    assertThat(successors(cfg.getStart())).containsExactly("end");
    assertThat(cfg.getEnd().getSuccessors()).isEmpty();
    assertThat(cfg.getUnreachableBlocks()).isEmpty();
  }

  @Test
  public void ifElseBranchesAndJoins() throws Exception {
    FlowGraphs graphs =
        build(
            "if c:", //
            "  x = 1",
            "else:",
            "  x = 2",
            "print(x)");
    ControlFlowGraph cfg = graphs.getRootGraph();
    CfgBlock start = cfg.getStart();
    assertThat(describe(start)).isEqualTo("c");
    assertThat(successors(start)).containsExactly("True -> x = 1", "False -> x = 2").inOrder();
    CfgBlock thenBlock = start.getSuccessors().get(0).getTarget();
    CfgBlock elseBlock = start.getSuccessors().get(1).getTarget();
    assertThat(successors(thenBlock)).containsExactly("print(x)");
    assertThat(successors(elseBlock)).containsExactly("print(x)");

    IfStatement ifStmt = (IfStatement) stmt(0);
    assertThat(graphs.getLoc(ifStmt)).isSameInstanceAs(graphs.getLoc(ifStmt.getCondition()));
  }

  @Test
  public void ifWithoutElseFallsThrough() throws Exception {
    CfgBlock start = build("if c:", "  x = 1", "y = 2").getRootGraph().getStart();
    assertThat(successors(start)).containsExactly("True -> x = 1", "False -> y = 2").inOrder();
  }

  @Test
  public void whileLoopHasBackEdge() throws Exception {
    ControlFlowGraph cfg =
        build(
                "x = 0", //
                "while c:",
                "  x = x + 1",
                "print(x)")
            .getRootGraph();
    assertThat(describeAll(cfg.getBlocks()))
        .containsExactly("x = 0", "c", "x = x + 1", "print(x)", "end")
        .inOrder();
    CfgBlock header = cfg.getStart().getSuccessors().get(0).getTarget();
    assertThat(successors(header))
        .containsExactly("True -> x = x + 1", "False -> print(x)")
        .inOrder();
    CfgBlock body = header.getSuccessors().get(0).getTarget();
    assertThat(successors(body)).containsExactly("c");
  }

  @Test
  public void forLoopEvaluatesIterableOnce() throws Exception {
    FlowGraphs graphs = build("for i in xs:", "  f(i)");
    ControlFlowGraph cfg = graphs.getRootGraph();
    assertThat(describe(cfg.getStart())).isEqualTo("xs");
    CfgBlock header = cfg.getStart().getSuccessors().get(0).getTarget();
    assertThat(describe(header)).isEqualTo("i");
    assertThat(successors(header)).containsExactly("True -> f(i)", "exhausted -> end").inOrder();
    assertThat(graphs.getLoc(stmt(0))).isSameInstanceAs(cfg.getStart().getLocs().get(0));
  }

  @Test
  public void breakJumpsPastTheLoop() throws Exception {
    ControlFlowGraph cfg =
        build(
                "while c:", //
                "  if d:",
                "    break",
                "  f()",
                "g()")
            .getRootGraph();
    CfgBlock breakBlock = null;
    for (CfgBlock block : cfg.getBlocks()) {
      if (describe(block).equals("break")) {
        breakBlock = block;
      }
    }
    assertThat(breakBlock).isNotNull();
    assertThat(breakBlock.isJump()).isTrue();
    assertThat(breakBlock.getJump()).isInstanceOf(FlowStatement.class);
    assertThat(successors(breakBlock)).containsExactly("g()");
    assertThat(cfg.getUnreachableBlocks()).isEmpty();
  }

  @Test
  public void continueJumpsToTheHeader() throws Exception {
    ControlFlowGraph cfg =
        build(
                "for x in xs:", //
                "  if x:",
                "    continue",
                "  f(x)")
            .getRootGraph();
    for (CfgBlock block : cfg.getBlocks()) {
      if (describe(block).equals("continue")) {
        assertThat(successors(block)).containsExactly("x");
        return;
      }
    }
    throw new AssertionError("no continue block");
  }

  @Test
  public void codeAfterReturnIsUnreachable() throws Exception {
    FlowGraphs graphs = build("def f():", "  return 1", "  x = 2");
    ControlFlowGraph cfg = graphs.getGraph(stmt(0));
    assertThat(successors(cfg.getStart())).containsExactly("end");
    assertThat(cfg.getStart().getJump()).isInstanceOf(ReturnStatement.class);
    assertThat(cfg.getUnreachableBlocks()).hasSize(1);
    CfgBlock dead = cfg.getUnreachableBlocks().iterator().next();
    assertThat(describe(dead)).isEqualTo("x = 2");
    assertThat(dead.isReachable()).isFalse();
    assertThat(cfg.getBlocks()).doesNotContain(dead);
  }

  @Test
  public void tryEntryAndBodyBlocksReachHandlers() throws Exception {
    FlowGraphs graphs =
        build(
            "x = 0", //
            "try:",
            "  a()",
            "  b()",
            "except E as e:",
            "  h()",
            "finally:",
            "  z()");
    CfgBlock start = graphs.getRootGraph().getStart();
    assertThat(describe(start)).isEqualTo("x = 0; try:");
    assertThat(successors(start))
        .containsExactly("a(); b()", "except E -> except E as e:; h()", "except -> z()")
        .inOrder();
    CfgBlock body = start.getSuccessors().get(0).getTarget();
    assertThat(successors(body))
        .containsExactly("except E -> except E as e:; h()", "z()", "except -> z()")
        .inOrder();
    TryStatement tryStmt = (TryStatement) stmt(1);
    assertThat(graphs.getLoc(tryStmt).getBlock()).isSameInstanceAs(start);
  }

  @Test
  public void returnInTryRunsFinallyFirst() throws Exception {
    ControlFlowGraph cfg =
        build(
                "def f(h):", //
                "  try:",
                "    return h.read()",
                "  finally:",
                "    h.close()",
                "  g()")
            .getGraph(stmt(0));
    CfgBlock body = cfg.getStart().getSuccessors().get(0).getTarget();
    assertThat(describe(body)).isEqualTo("return h.read()");
    assertThat(successors(body)).containsExactly("h.close()", "except -> h.close()");
    CfgBlock fin = body.getSuccessors().get(0).getTarget();
    assertThat(fin.isReachable()).isTrue();
    assertThat(successors(fin)).containsExactly("end");
    // The try statement never completes normally.
    assertThat(describeAll(ImmutableList.copyOf(cfg.getUnreachableBlocks()))).contains("g()");
  }

  @Test
  public void breakAndContinueInTryRunFinallyFirst() throws Exception {
    ControlFlowGraph cfg =
        build(
                "while c:", //
                "  try:",
                "    if d:",
                "      break",
                "    continue",
                "  finally:",
                "    z()",
                "done()")
            .getRootGraph();
    CfgBlock fin = null;
    for (CfgBlock block : cfg.getBlocks()) {
      if (describe(block).equals("z()")) {
        fin = block;
      }
    }
    assertThat(fin).isNotNull();
    assertThat(successors(fin)).containsExactly("done()", "c", "end");
    for (CfgBlock block : cfg.getBlocks()) {
      if (block.isJump()) {
        assertThat(successors(block)).contains("z()");
      }
    }
  }

  @Test
  public void jumpsLeaveNestedFinallyClausesInnermostFirst() throws Exception {
    ControlFlowGraph cfg =
        build(
                "def f():", //
                "  try:",
                "    try:",
                "      return 1",
                "    finally:",
                "      inner()",
                "  finally:",
                "    outer()")
            .getGraph(stmt(0));
    CfgBlock ret = null;
    CfgBlock inner = null;
    for (CfgBlock block : cfg.getBlocks()) {
      if (describe(block).equals("return 1")) {
        ret = block;
      } else if (describe(block).equals("inner()")) {
        inner = block;
      }
    }
    assertThat(successors(ret)).contains("inner()");
    assertThat(successors(ret)).doesNotContain("outer()");
    assertThat(successors(inner)).contains("outer()");
    assertThat(successors(inner)).doesNotContain("end");
  }

  @Test
  public void matchCasesAreTestedInOrder() throws Exception {
    ControlFlowGraph cfg =
        build(
                "match p:", //
                "  case 1:",
                "    a()",
                "  case _:",
                "    b()",
                "c()")
            .getRootGraph();
    CfgBlock start = cfg.getStart();
    assertThat(describe(start)).isEqualTo("p");
    CfgBlock first = start.getSuccessors().get(0).getTarget();
    assertThat(describe(first)).isEqualTo("case 1:");
    assertThat(successors(first)).containsExactly("case 1 -> a()", "no match -> case _:").inOrder();
    CfgBlock last = first.getSuccessors().get(1).getTarget();
    // The wildcard case always matches.
    assertThat(successors(last)).containsExactly("case _ -> b()");
  }

  @Test
  public void nestedBodiesGetTheirOwnGraphs() throws Exception {
    FlowGraphs graphs =
        build(
            "def f(x=g()):", //
            "  return lambda y: y + x",
            "class C:",
            "  pass");
    List<Class<?>> owners = new ArrayList<>();
    for (Node owner : graphs.getGraphs().keySet()) {
      owners.add(owner.getClass());
    }
    assertThat(owners)
        .containsExactly(
            SourceFile.class, DefStatement.class, LambdaExpression.class, ClassStatement.class)
        .inOrder();

    DefStatement def = (DefStatement) stmt(0);
    ControlFlowGraph fgraph = graphs.getGraph(def);
    assertThat(fgraph.getDefiningLoc()).isSameInstanceAs(graphs.getLoc(def));
    ReturnStatement ret = (ReturnStatement) def.getBody().get(0);
    // The parameter comes first.
    assertThat(fgraph.getStart().getLocs()).hasSize(2);
    assertThat(fgraph.getStart().getLocs().get(1).getNode()).isSameInstanceAs(ret);
    ControlFlowGraph lgraph = graphs.getGraph(ret.getResult());
    assertThat(lgraph.getDefiningLoc()).isSameInstanceAs(graphs.getLoc(ret));
    assertThat(lgraph.getStart().getLocs()).hasSize(2);

    Node defaultValue = def.getParameters().get(0).getDefaultValue();
    assertThat(graphs.enclosingLoc(defaultValue)).isSameInstanceAs(graphs.getLoc(def));
    assertThat(graphs.getRootGraph().getDefiningLoc()).isNull();
  }
}

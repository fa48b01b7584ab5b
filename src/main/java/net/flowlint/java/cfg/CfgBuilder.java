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

import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.flowlint.java.syntax.Argument;
import net.flowlint.java.syntax.ClassStatement;
import net.flowlint.java.syntax.DefStatement;
import net.flowlint.java.syntax.FlowStatement;
import net.flowlint.java.syntax.ForStatement;
import net.flowlint.java.syntax.IfStatement;
import net.flowlint.java.syntax.LambdaExpression;
import net.flowlint.java.syntax.MatchStatement;
import net.flowlint.java.syntax.Node;
import net.flowlint.java.syntax.NodeVisitor;
import net.flowlint.java.syntax.Parameter;
import net.flowlint.java.syntax.SourceFile;
import net.flowlint.java.syntax.Statement;
import net.flowlint.java.syntax.TokenKind;
import net.flowlint.java.syntax.TryStatement;
import net.flowlint.java.syntax.WhileStatement;
import net.flowlint.java.syntax.WithStatement;

/**
 * Builds the control-flow graphs of a syntax tree.
 *
 * <p>The builder walks each body once with a cursor on the current block. Simple statements are
 * appended to the current block. A branch ends the block: each arm starts a block reached by an
 * edge labeled with the branch taken, and the arms meet again in a fresh join block. Loops get a
 * header block holding the loop condition (or the assignment of the loop targets), with a back
 * edge from the end of the body and a labeled exit edge. A jump ({@code break}, {@code continue},
 * {@code return}, {@code raise}) ends its block, and the statements after it start a block that
 * nothing reaches.
 *
 * <p>Helper blocks left empty by this construction are spliced out as soon as they are linked, so
 * every block of a finished graph except start and end holds at least one location.
 *
 * <p>Exceptions are approximated. The {@code try} keyword gets a location of its own that ends the
 * block before the body, and that block and every block of the body get an edge to every handler,
 * so a handler sees the state on entry to the try as well as any state within the body. A {@code
 * finally} clause is built once. The normal exits, the jumps leaving the try statement and the
 * exceptions raised in its body all enter it, and its end continues to every target they were
 * headed for.
 */
public final class CfgBuilder {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  // Targets of break and continue in an enclosing loop.
  private static final class Loop {
    final CfgBlock header;
    final CfgBlock after;

    Loop(CfgBlock header, CfgBlock after) {
      this.header = header;
      this.after = after;
    }
  }

  // An enclosing try statement with a finally clause, and the targets of the jumps through it.
  private static final class Finally {
    final CfgBlock entry;
    final int loopDepth; // number of loops enclosing the try statement
    final Map<CfgBlock, Integer> exits = new LinkedHashMap<>();

    Finally(CfgBlock entry, int loopDepth) {
      this.entry = entry;
      this.loopDepth = loopDepth;
    }
  }

  private final Map<Node, ControlFlowGraph> graphs = new LinkedHashMap<>();
  private final Map<Node, CfgLoc> locs = new IdentityHashMap<>();

  // State of the body under construction; saved and restored around nested bodies.
  private ControlFlowGraph cfg;
  private CfgBlock current;
  private Deque<Loop> loops = new ArrayDeque<>();
  // Blocks created within each enclosing try body, innermost last.
  private List<List<CfgBlock>> tryBodies = new ArrayList<>();
  private Deque<Finally> finallies = new ArrayDeque<>();

  private CfgBuilder() {}

  /**
   * Builds the graphs of {@code root}, a SourceFile, DefStatement, ClassStatement or
   * LambdaExpression, and of every function, class and lambda nested within it.
   */
  public static FlowGraphs build(Node root) {
    CfgBuilder builder = new CfgBuilder();
    builder.buildGraph(root, null);
    logger.atFine().log(
        "built %d control-flow graphs with %d locations",
        builder.graphs.size(), builder.locs.size());
    return new FlowGraphs(ImmutableMap.copyOf(builder.graphs), builder.locs);
  }

  private void buildGraph(Node owner, @Nullable CfgLoc definingLoc) {
    ControlFlowGraph savedCfg = cfg;
    CfgBlock savedCurrent = current;
    Deque<Loop> savedLoops = loops;
    List<List<CfgBlock>> savedTryBodies = tryBodies;
    Deque<Finally> savedFinallies = finallies;

    cfg = new ControlFlowGraph(graphs.size(), owner, definingLoc);
    graphs.put(owner, cfg);
    current = cfg.getStart();
    loops = new ArrayDeque<>();
    tryBodies = new ArrayList<>();
    finallies = new ArrayDeque<>();

    if (owner instanceof SourceFile) {
      visitBlock(((SourceFile) owner).getStatements());
    } else if (owner instanceof DefStatement) {
      DefStatement def = (DefStatement) owner;
      addParameters(def.getParameters());
      visitBlock(def.getBody());
    } else if (owner instanceof ClassStatement) {
      visitBlock(((ClassStatement) owner).getBody());
    } else if (owner instanceof LambdaExpression) {
      LambdaExpression lambda = (LambdaExpression) owner;
      addParameters(lambda.getParameters());
      add(lambda.getBody(), lambda.getBody());
    } else {
      throw new IllegalArgumentException(
          "cannot build a control-flow graph for " + owner.getClass().getSimpleName());
    }
    cfg.linkOrMerge(current, cfg.getEnd(), null);
    cfg.updateReachability();

    cfg = savedCfg;
    current = savedCurrent;
    loops = savedLoops;
    tryBodies = savedTryBodies;
    finallies = savedFinallies;
  }

  private void addParameters(List<Parameter> params) {
    for (Parameter param : params) {
      if (param.getIdentifier() != null) {
        add(param);
      }
    }
  }

  // ==== blocks and locations ====

  private CfgBlock newBlock() {
    return register(cfg.createBlock());
  }

  private CfgBlock newBlock(CfgBlock pred, @Nullable EdgeLabel label) {
    return register(cfg.createBlock(pred, label));
  }

  private CfgBlock register(CfgBlock block) {
    for (List<CfgBlock> body : tryBodies) {
      body.add(block);
    }
    return block;
  }

  /**
   * Appends a location for {@code node} to the current block. The parts are the subtrees that
   * execute there; lambdas found in them get graphs of their own.
   */
  @CanIgnoreReturnValue
  private CfgLoc add(Node node, Node... parts) {
    CfgLoc loc = current.add(node);
    locs.put(node, loc);
    for (Node part : parts) {
      if (part != null) {
        buildLambdas(part, loc);
      }
    }
    return loc;
  }

  // Adds the location of a compound statement's head, shared by the statement.
  private CfgLoc addHead(Statement stmt, Node head, Node... parts) {
    CfgLoc loc = add(head, parts);
    locs.put(stmt, loc);
    return loc;
  }

  // Builds the graphs of the lambdas in a subtree, but not of lambdas nested within them.
  private void buildLambdas(Node part, CfgLoc loc) {
    List<LambdaExpression> lambdas = new ArrayList<>();
    new NodeVisitor() {
      @Override
      public void visit(LambdaExpression node) {
        lambdas.add(node);
      }
    }.visit(part);
    for (LambdaExpression lambda : lambdas) {
      buildGraph(lambda, loc);
    }
  }

  /**
   * Ends the current block with a jump to target, and continues in a fresh, unreachable block.
   * {@code loopDepth} is the depth of the loop the jump continues or breaks, or zero for a jump
   * out of the body.
   */
  private void jumpTo(CfgBlock target, int loopDepth) {
    route(current, target, loopDepth);
    current = newBlock();
  }

  // Links source to target, through the innermost finally clause the jump leaves.
  private void route(CfgBlock source, CfgBlock target, int loopDepth) {
    Finally fin = finallies.peek();
    if (fin != null && fin.loopDepth >= loopDepth) {
      cfg.addEdge(source, fin.entry, null);
      fin.exits.merge(target, loopDepth, Math::min);
    } else {
      cfg.addEdge(source, target, null);
    }
  }

  // ==== statements ====

  private void visitBlock(List<Statement> statements) {
    for (Statement stmt : statements) {
      visitStatement(stmt);
    }
  }

  private void visitStatement(Statement stmt) {
    switch (stmt.kind()) {
      case ASSERT:
      case ASSIGNMENT:
      case DEL:
      case EXPRESSION:
      case GLOBAL:
      case IMPORT:
        add(stmt, stmt);
        break;

      case RETURN:
      case RAISE:
        add(stmt, stmt);
        jumpTo(cfg.getEnd(), 0);
        break;

      case FLOW:
        visitFlow((FlowStatement) stmt);
        break;

      case DEF:
        {
          DefStatement def = (DefStatement) stmt;
          List<Node> parts = new ArrayList<>(def.getDecorators());
          for (Parameter param : def.getParameters()) {
            parts.add(param.getType());
            parts.add(param.getDefaultValue());
          }
          parts.add(def.getReturnType());
          CfgLoc loc = add(def, parts.toArray(new Node[0]));
          buildGraph(def, loc);
          break;
        }

      case CLASS:
        {
          ClassStatement cls = (ClassStatement) stmt;
          List<Node> parts = new ArrayList<>(cls.getDecorators());
          for (Argument base : cls.getBases()) {
            parts.add(base);
          }
          CfgLoc loc = add(cls, parts.toArray(new Node[0]));
          buildGraph(cls, loc);
          break;
        }

      case IF:
        visitIf((IfStatement) stmt);
        break;

      case WHILE:
        visitWhile((WhileStatement) stmt);
        break;

      case FOR:
        visitFor((ForStatement) stmt);
        break;

      case TRY:
        visitTry((TryStatement) stmt);
        break;

      case WITH:
        {
          WithStatement with = (WithStatement) stmt;
          add(with, with.getItems().toArray(new Node[0]));
          visitBlock(with.getBody());
          break;
        }

      case MATCH:
        visitMatch((MatchStatement) stmt);
        break;
    }
  }

  private void visitFlow(FlowStatement stmt) {
    add(stmt);
    if (stmt.getFlowKind() == TokenKind.PASS) {
      return;
    }
    Loop loop = loops.peek();
    if (loop == null) {
      // A jump outside any loop; it ends the body.
      jumpTo(cfg.getEnd(), 0);
    } else if (stmt.getFlowKind() == TokenKind.BREAK) {
      jumpTo(loop.after, loops.size());
    } else {
      jumpTo(loop.header, loops.size());
    }
  }

  private void visitIf(IfStatement stmt) {
    addHead(stmt, stmt.getCondition(), stmt.getCondition());
    CfgBlock condition = current;
    CfgBlock after = newBlock();

    current = newBlock(condition, EdgeLabel.TRUE);
    visitBlock(stmt.getThenBlock());
    cfg.linkOrMerge(current, after, null);

    if (stmt.getElseBlock() != null) {
      current = newBlock(condition, EdgeLabel.FALSE);
      visitBlock(stmt.getElseBlock());
      cfg.linkOrMerge(current, after, null);
    } else {
      cfg.link(condition, after, EdgeLabel.FALSE);
    }
    current = after;
  }

  private void visitWhile(WhileStatement stmt) {
    CfgBlock header = newBlock(current, null);
    current = header;
    addHead(stmt, stmt.getCondition(), stmt.getCondition());
    CfgBlock after = newBlock();

    loops.push(new Loop(header, after));
    current = newBlock(header, EdgeLabel.TRUE);
    visitBlock(stmt.getBody());
    cfg.linkOrMerge(current, header, null);
    loops.pop();

    visitLoopExit(header, EdgeLabel.FALSE, stmt.getElseBlock(), after);
  }

  private void visitFor(ForStatement stmt) {
    // The iterable is evaluated once, before the loop.
    addHead(stmt, stmt.getIterable(), stmt.getIterable());
    CfgBlock header = newBlock(current, null);
    current = header;
    add(stmt.getVars(), stmt.getVars());
    CfgBlock after = newBlock();

    loops.push(new Loop(header, after));
    current = newBlock(header, EdgeLabel.TRUE);
    visitBlock(stmt.getBody());
    cfg.linkOrMerge(current, header, null);
    loops.pop();

    visitLoopExit(header, EdgeLabel.EXHAUSTED, stmt.getElseBlock(), after);
  }

  // Links the exit of a loop to its else clause, if any, and continues after the loop.
  private void visitLoopExit(
      CfgBlock header, EdgeLabel exit, @Nullable List<Statement> elseBlock, CfgBlock after) {
    if (elseBlock != null) {
      current = newBlock(header, exit);
      visitBlock(elseBlock);
      cfg.linkOrMerge(current, after, null);
    } else {
      cfg.link(header, after, exit);
    }
    current = after;
  }

  private void visitTry(TryStatement stmt) {
    add(stmt);
    CfgBlock entry = current;
    Finally fin = null;
    if (stmt.getFinallyBlock() != null) {
      fin = new Finally(newBlock(), loops.size());
      finallies.push(fin);
    }

    List<CfgBlock> bodyBlocks = new ArrayList<>();
    current = newBlock(entry, null);
    bodyBlocks.add(current);
    tryBodies.add(bodyBlocks);
    visitBlock(stmt.getBody());
    tryBodies.remove(tryBodies.size() - 1);
    bodyBlocks.add(0, entry);
    bodyBlocks.removeIf(block -> block.getLocs().isEmpty());

    CfgBlock endOfBody = current;
    CfgBlock after = newBlock();
    for (TryStatement.ExceptHandler handler : stmt.getHandlers()) {
      CfgBlock handlerBlock = newBlock();
      EdgeLabel label = EdgeLabel.exception(handler.getType());
      for (CfgBlock block : bodyBlocks) {
        cfg.addEdge(block, handlerBlock, label);
      }
      current = handlerBlock;
      add(handler, handler.getType());
      visitBlock(handler.getBody());
      cfg.linkOrMerge(current, after, null);
    }

    current = endOfBody;
    if (stmt.getElseBlock() != null) {
      current = newBlock(current, null);
      visitBlock(stmt.getElseBlock());
    }
    cfg.linkOrMerge(current, after, null);
    current = after;

    if (fin != null) {
      finallies.pop();
      // An exception escaping the handlers runs the finally clause, then leaves the body.
      for (CfgBlock block : bodyBlocks) {
        cfg.addEdge(block, fin.entry, EdgeLabel.exception(null));
      }
      fin.exits.merge(cfg.getEnd(), 0, Math::min);
      boolean normalExit = !after.getPredecessors().isEmpty();
      cfg.linkOrMerge(after, fin.entry, null);
      current = fin.entry;
      visitBlock(stmt.getFinallyBlock());
      visitFinallyExits(fin, normalExit);
    }
  }

  // Continues from the end of a finally clause to the targets of the jumps that entered it.
  private void visitFinallyExits(Finally fin, boolean normalExit) {
    CfgBlock end = current;
    if (end.isJump()) {
      current = newBlock();
      return;
    }
    // An empty end block is spliced out, so the exits leave from the blocks leading into it.
    List<CfgBlock> sources = new ArrayList<>();
    if (end.getLocs().isEmpty()) {
      for (CfgEdge edge : end.getPredecessors()) {
        sources.add(edge.getSource());
      }
    } else {
      sources.add(end);
    }
    for (CfgBlock source : sources) {
      for (Map.Entry<CfgBlock, Integer> exit : fin.exits.entrySet()) {
        route(source, exit.getKey(), exit.getValue());
      }
    }
    current = normalExit || end.getLocs().isEmpty() ? newBlock(end, null) : newBlock();
  }

  private void visitMatch(MatchStatement stmt) {
    addHead(stmt, stmt.getSubject(), stmt.getSubject());
    CfgBlock test = current;
    CfgBlock after = newBlock();
    EdgeLabel into = null;
    for (MatchStatement.Case c : stmt.getCases()) {
      // Cases after an irrefutable one are unreachable.
      current = test != null ? newBlock(test, into) : newBlock();
      CfgBlock caseBlock = current;
      add(c, c.getPattern(), c.getGuard());
      current = newBlock(caseBlock, EdgeLabel.matched(c.getPattern()));
      visitBlock(c.getBody());
      cfg.linkOrMerge(current, after, null);

      test = c.isIrrefutable() ? null : caseBlock;
      into = EdgeLabel.NO_MATCH;
    }
    if (test != null) {
      cfg.link(test, after, into);
    }
    current = after;
  }
}

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

import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import net.flowlint.java.cfg.CfgLoc;
import net.flowlint.java.cfg.FlowGraphs;
import net.flowlint.java.syntax.AssertStatement;
import net.flowlint.java.syntax.AssignmentStatement;
import net.flowlint.java.syntax.CallExpression;
import net.flowlint.java.syntax.ClassStatement;
import net.flowlint.java.syntax.Comprehension;
import net.flowlint.java.syntax.DefStatement;
import net.flowlint.java.syntax.DelStatement;
import net.flowlint.java.syntax.DotExpression;
import net.flowlint.java.syntax.Expression;
import net.flowlint.java.syntax.ExpressionStatement;
import net.flowlint.java.syntax.FlowStatement;
import net.flowlint.java.syntax.ForStatement;
import net.flowlint.java.syntax.GlobalStatement;
import net.flowlint.java.syntax.Identifier;
import net.flowlint.java.syntax.IfStatement;
import net.flowlint.java.syntax.ImportStatement;
import net.flowlint.java.syntax.IndexExpression;
import net.flowlint.java.syntax.LambdaExpression;
import net.flowlint.java.syntax.ListExpression;
import net.flowlint.java.syntax.MatchStatement;
import net.flowlint.java.syntax.Node;
import net.flowlint.java.syntax.NodeVisitor;
import net.flowlint.java.syntax.Parameter;
import net.flowlint.java.syntax.RaiseStatement;
import net.flowlint.java.syntax.ReturnStatement;
import net.flowlint.java.syntax.SliceExpression;
import net.flowlint.java.syntax.SourceFile;
import net.flowlint.java.syntax.TryStatement;
import net.flowlint.java.syntax.WhileStatement;
import net.flowlint.java.syntax.WithStatement;

/**
 * Collects the variable events of a file: one event for each occurrence of a name that denotes a
 * variable, attached to the location at which the occurrence executes.
 *
 * <p>The events of a location are in evaluation order: the values an assignment stores are read
 * before its targets are bound, and a method call modifies its receiver after its arguments are
 * read. An augmented assignment to a name yields two events for the one occurrence, a read
 * followed by a rebinding.
 *
 * <p>A binding is an {@link VarEventKind#ASSIGN} the first time the variable is bound in
 * lexical order, or after a deletion; otherwise it is a {@link VarEventKind#REASSIGN}.
 */
final class VarEventCollector extends NodeVisitor {

  private final FlowGraphs graphs;
  private final ScopeResolver.Resolution resolution;
  private final AnalysisOptions options;

  final List<VarEvent> events = new ArrayList<>();
  final ListMultimap<CfgLoc, VarEvent> eventsByLoc = ArrayListMultimap.create();
  final ListMultimap<Scope, VarEvent> outsideScopeEvents = ArrayListMultimap.create();
  final List<CallSite> callSites = new ArrayList<>();

  private final Set<Variable> bound = new HashSet<>();
  private CfgLoc loc;

  private VarEventCollector(
      FlowGraphs graphs, ScopeResolver.Resolution resolution, AnalysisOptions options) {
    this.graphs = graphs;
    this.resolution = resolution;
    this.options = options;
    this.skipNonSymbolIdentifiers = true;
  }

  static VarEventCollector collect(
      SourceFile file,
      FlowGraphs graphs,
      ScopeResolver.Resolution resolution,
      AnalysisOptions options) {
    VarEventCollector collector = new VarEventCollector(graphs, resolution, options);
    collector.visit(file);
    return collector;
  }

  // Moves to the location of the given node.
  private void at(Node node) {
    loc = Preconditions.checkNotNull(graphs.getLoc(node), "no location for %s", node);
  }

  @CanIgnoreReturnValue
  @Nullable
  private VarEvent event(Identifier id, Expression access, VarEventKind kind) {
    Variable var = resolution.getVariable(id);
    if (var == null) {
      return null; // builtin
    }
    VarEvent event = new VarEvent(var, id, access, kind, loc);
    events.add(event);
    eventsByLoc.put(loc, event);
    for (Scope s = resolution.getEnclosingScope(id);
        s != null && s != var.getScope();
        s = s.getParent()) {
      outsideScopeEvents.put(s, event);
    }
    return event;
  }

  private void bind(Identifier id) {
    Variable var = resolution.getVariable(id);
    if (var != null) {
      event(id, id, bound.add(var) ? VarEventKind.ASSIGN : VarEventKind.REASSIGN);
    }
  }

  @Override
  public void visit(Identifier id) {
    event(id, id, VarEventKind.READ);
  }

  // Visits an assignment target.
  private void assign(Expression target) {
    switch (target.kind()) {
      case IDENTIFIER:
        bind((Identifier) target);
        break;
      case LIST_EXPR:
        for (Expression elem : ((ListExpression) target).getElements()) {
          assign(elem);
        }
        break;
      case DOT:
      case INDEX:
      case SLICE:
        modify(target, target);
        break;
      default:
        visit(target);
    }
  }

  /**
   * Visits an expression whose value is changed in place through {@code access}: the subscripts
   * along the way are read, and then the name at its root, if any, is modified.
   */
  private void modify(Expression e, Expression access) {
    switch (e.kind()) {
      case IDENTIFIER:
        event((Identifier) e, access, VarEventKind.MODIFY);
        break;
      case DOT:
        modify(((DotExpression) e).getObject(), access);
        break;
      case INDEX:
        IndexExpression index = (IndexExpression) e;
        visit(index.getKey());
        modify(index.getObject(), access);
        break;
      case SLICE:
        SliceExpression slice = (SliceExpression) e;
        visitIfPresent(slice.getStart());
        visitIfPresent(slice.getStop());
        visitIfPresent(slice.getStep());
        modify(slice.getObject(), access);
        break;
      default:
        visit(e);
    }
  }

  private void visitIfPresent(@Nullable Expression e) {
    if (e != null) {
      visit(e);
    }
  }

  // Reports whether the expression is a name, or an attribute or subscript chain rooted at one.
  private static boolean isRootedAtName(Expression e) {
    while (true) {
      switch (e.kind()) {
        case IDENTIFIER:
          return true;
        case DOT:
          e = ((DotExpression) e).getObject();
          break;
        case INDEX:
          e = ((IndexExpression) e).getObject();
          break;
        case SLICE:
          e = ((SliceExpression) e).getObject();
          break;
        default:
          return false;
      }
    }
  }

  // ==== statements ====

  @Override
  public void visit(AssertStatement node) {
    at(node);
    super.visit(node);
  }

  @Override
  public void visit(ExpressionStatement node) {
    at(node);
    super.visit(node);
  }

  @Override
  public void visit(ReturnStatement node) {
    at(node);
    super.visit(node);
  }

  @Override
  public void visit(RaiseStatement node) {
    at(node);
    super.visit(node);
  }

  @Override
  public void visit(FlowStatement node) {}

  @Override
  public void visit(GlobalStatement node) {}

  @Override
  public void visit(ImportStatement node) {
    at(node);
    for (ImportStatement.Binding binding : node.getBindings()) {
      bind(binding.getLocalName());
    }
  }

  @Override
  public void visit(DelStatement node) {
    at(node);
    for (Expression target : node.getTargets()) {
      delete(target);
    }
  }

  private void delete(Expression target) {
    switch (target.kind()) {
      case IDENTIFIER:
        VarEvent event = event((Identifier) target, target, VarEventKind.DELETE);
        if (event != null) {
          bound.remove(event.getVariable());
        }
        break;
      case LIST_EXPR:
        for (Expression elem : ((ListExpression) target).getElements()) {
          delete(elem);
        }
        break;
      default:
        modify(target, target);
    }
  }

  @Override
  public void visit(AssignmentStatement node) {
    at(node);
    Expression lhs = node.getLHS();
    if (node.getType() != null) {
      visit(node.getType());
    }
    if (node.isAugmented()) {
      if (lhs instanceof Identifier) {
        visit(lhs);
        visit(node.getRHS());
        bind((Identifier) lhs);
      } else {
        visit(node.getRHS());
        modify(lhs, lhs);
      }
    } else if (node.getRHS() != null) {
      visit(node.getRHS());
      assign(lhs);
    } else if (!(lhs instanceof Identifier)) {
      // An annotation alone binds nothing, but evaluates the target's subexpressions.
      visit(lhs);
    }
  }

  @Override
  public void visit(IfStatement node) {
    at(node.getCondition());
    visit(node.getCondition());
    visitBlock(node.getThenBlock());
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
  }

  @Override
  public void visit(WhileStatement node) {
    at(node.getCondition());
    visit(node.getCondition());
    visitBlock(node.getBody());
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
  }

  @Override
  public void visit(ForStatement node) {
    at(node.getIterable());
    visit(node.getIterable());
    at(node.getVars());
    assign(node.getVars());
    visitBlock(node.getBody());
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
  }

  @Override
  public void visit(DefStatement node) {
    at(node);
    visitAll(node.getDecorators());
    visitParameterExpressions(node.getParameters());
    if (node.getReturnType() != null) {
      visit(node.getReturnType());
    }
    bind(node.getIdentifier());

    bindParameters(node.getParameters());
    visitBlock(node.getBody());
  }

  @Override
  public void visit(ClassStatement node) {
    at(node);
    visitAll(node.getDecorators());
    visitAll(node.getBases());
    bind(node.getIdentifier());
    visitBlock(node.getBody());
  }

  @Override
  public void visit(TryStatement node) {
    visitBlock(node.getBody());
    for (TryStatement.ExceptHandler handler : node.getHandlers()) {
      at(handler);
      if (handler.getType() != null) {
        visit(handler.getType());
      }
      if (handler.getName() != null) {
        bind(handler.getName());
      }
      visitBlock(handler.getBody());
    }
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
    if (node.getFinallyBlock() != null) {
      visitBlock(node.getFinallyBlock());
    }
  }

  @Override
  public void visit(WithStatement node) {
    at(node);
    for (WithStatement.Item item : node.getItems()) {
      visit(item.getContext());
      if (item.getTarget() != null) {
        assign(item.getTarget());
      }
    }
    visitBlock(node.getBody());
  }

  @Override
  public void visit(MatchStatement node) {
    at(node.getSubject());
    visit(node.getSubject());
    for (MatchStatement.Case c : node.getCases()) {
      at(c);
      ScopeResolver.visitPattern(c.getPattern(), this::bind, this::visit);
      if (c.getGuard() != null) {
        visit(c.getGuard());
      }
      visitBlock(c.getBody());
    }
  }

  // ==== expressions ====

  @Override
  public void visit(CallExpression node) {
    Expression fn = node.getFunction();
    if (fn instanceof DotExpression
        && options.isMutatingMethod(((DotExpression) fn).getField().getName())
        && isRootedAtName(((DotExpression) fn).getObject())) {
      visitAll(node.getArguments());
      modify(((DotExpression) fn).getObject(), fn);
      return;
    }
    if (fn instanceof Identifier) {
      VarEvent callee = event((Identifier) fn, fn, VarEventKind.READ);
      if (callee != null) {
        callSites.add(new CallSite(node, callee, resolution.getEnclosingScope((Identifier) fn)));
      }
    } else {
      visit(fn);
    }
    visitAll(node.getArguments());
  }

  @Override
  public void visit(LambdaExpression node) {
    visitParameterExpressions(node.getParameters());
    CfgLoc saved = loc;
    bindParameters(node.getParameters());
    at(node.getBody());
    visit(node.getBody());
    loc = saved;
  }

  private void visitParameterExpressions(List<Parameter> params) {
    for (Parameter param : params) {
      if (param.getType() != null) {
        visit(param.getType());
      }
      if (param.getDefaultValue() != null) {
        visit(param.getDefaultValue());
      }
    }
  }

  private void bindParameters(List<Parameter> params) {
    for (Parameter param : params) {
      if (param.getIdentifier() != null) {
        at(param);
        bind(param.getIdentifier());
      }
    }
  }

  @Override
  public void visit(Comprehension node) {
    for (Comprehension.Clause clause : node.getClauses()) {
      if (clause instanceof Comprehension.For) {
        Comprehension.For forClause = (Comprehension.For) clause;
        visit(forClause.getIterable());
        assign(forClause.getVars());
      } else {
        visit(((Comprehension.If) clause).getCondition());
      }
    }
    visit(node.getBody());
  }
}

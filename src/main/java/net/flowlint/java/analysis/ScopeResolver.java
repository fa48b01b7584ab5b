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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import net.flowlint.java.syntax.Argument;
import net.flowlint.java.syntax.AssignmentStatement;
import net.flowlint.java.syntax.BinaryOperatorExpression;
import net.flowlint.java.syntax.CallExpression;
import net.flowlint.java.syntax.ClassStatement;
import net.flowlint.java.syntax.Comprehension;
import net.flowlint.java.syntax.DefStatement;
import net.flowlint.java.syntax.DelStatement;
import net.flowlint.java.syntax.DictExpression;
import net.flowlint.java.syntax.Expression;
import net.flowlint.java.syntax.ForStatement;
import net.flowlint.java.syntax.GlobalStatement;
import net.flowlint.java.syntax.Identifier;
import net.flowlint.java.syntax.IfStatement;
import net.flowlint.java.syntax.ImportStatement;
import net.flowlint.java.syntax.LambdaExpression;
import net.flowlint.java.syntax.ListExpression;
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
 * The ScopeResolver resolves every occurrence of a name in a file to the variable it denotes,
 * following the static scoping rules of the language.
 *
 * <p>A name bound anywhere in a function body is local to the whole body, unless the body declares
 * it {@code global} or {@code nonlocal}. A name not bound locally is looked up in the enclosing
 * function scopes and then in the module; class bodies are not visible to the functions nested
 * in them. Names that resolve nowhere are builtins (or undefined) and have no variable.
 *
 * <p>Resolution fails with {@link UnknowableLocalsException} if the file calls one of the builtins
 * that expose variables by name, such as {@code locals()}, unless the program rebinds that name.
 */
public final class ScopeResolver extends NodeVisitor {

  /** The result of resolving a file. */
  public static final class Resolution {
    private final Scope module;
    private final ImmutableList<Scope> scopes;
    private final Map<Node, Scope> scopesByOwner; // identity map
    private final Map<Identifier, Variable> variables; // identity map
    private final Map<Identifier, Scope> enclosing; // identity map

    private Resolution(
        Scope module,
        List<Scope> scopes,
        Map<Node, Scope> scopesByOwner,
        Map<Identifier, Variable> variables,
        Map<Identifier, Scope> enclosing) {
      this.module = module;
      this.scopes = ImmutableList.copyOf(scopes);
      this.scopesByOwner = scopesByOwner;
      this.variables = variables;
      this.enclosing = enclosing;
    }

    public Scope getModuleScope() {
      return module;
    }

    /** Returns all scopes, each before the scopes nested within it. */
    public ImmutableList<Scope> getScopes() {
      return scopes;
    }

    /** Returns the scope introduced by the given node, or null if it introduces none. */
    @Nullable
    public Scope getScope(Node owner) {
      return scopesByOwner.get(owner);
    }

    /** Returns the variable denoted by an occurrence of a name, or null for a builtin. */
    @Nullable
    public Variable getVariable(Identifier occurrence) {
      return variables.get(occurrence);
    }

    /** Returns the scope in which an occurrence of a name appears. */
    @Nullable
    public Scope getEnclosingScope(Identifier occurrence) {
      return enclosing.get(occurrence);
    }
  }

  private final AnalysisOptions options;
  private final List<Scope> scopes = new ArrayList<>();
  private final Map<Node, Scope> scopesByOwner = new IdentityHashMap<>();
  private final Map<Identifier, Variable> variables = new IdentityHashMap<>();
  private final Map<Identifier, Scope> enclosing = new IdentityHashMap<>();

  private Scope module;
  private Scope current;
  // The first call that exposes variables by name, if any.
  @Nullable private CallExpression dynamicCall;

  private ScopeResolver(AnalysisOptions options) {
    this.options = options;
    this.skipNonSymbolIdentifiers = true;
  }

  /**
   * Resolves the names of a file.
   *
   * @throws UnknowableLocalsException if the file inspects its variables by name
   */
  public static Resolution resolve(SourceFile file, AnalysisOptions options)
      throws UnknowableLocalsException {
    ScopeResolver r = new ScopeResolver(options);
    r.module = r.pushScope(Scope.Kind.MODULE, file);
    r.createBindingsForBlock(file.getStatements());
    r.visitBlock(file.getStatements());
    r.popScope();
    if (r.dynamicCall != null) {
      throw new UnknowableLocalsException(
          r.dynamicCall, ((Identifier) r.dynamicCall.getFunction()).getName());
    }
    return new Resolution(r.module, r.scopes, r.scopesByOwner, r.variables, r.enclosing);
  }

  private Scope pushScope(Scope.Kind kind, Node owner) {
    Scope scope = new Scope(kind, owner, current);
    scopes.add(scope);
    scopesByOwner.put(owner, scope);
    current = scope;
    return scope;
  }

  private void popScope() {
    Scope scope = current;
    scope.locals.removeAll(scope.globals);
    scope.locals.removeAll(scope.nonlocals);
    current = scope.getParent();
  }

  // ==== first pass: bindings of a block ====

  /**
   * First pass: adds the names bound by a block to the current scope, before any use in the block
   * is resolved. A name may be used in a function before the statement that binds it.
   */
  private void createBindingsForBlock(Iterable<Statement> stmts) {
    for (Statement stmt : stmts) {
      createBindings(stmt);
    }
  }

  private void createBindings(Statement stmt) {
    switch (stmt.kind()) {
      case ASSIGNMENT:
        createBindingsForLHS(((AssignmentStatement) stmt).getLHS());
        break;
      case DEL:
        for (Expression target : ((DelStatement) stmt).getTargets()) {
          createBindingsForLHS(target);
        }
        break;
      case IF:
        IfStatement ifStmt = (IfStatement) stmt;
        createBindingsForBlock(ifStmt.getThenBlock());
        if (ifStmt.getElseBlock() != null) {
          createBindingsForBlock(ifStmt.getElseBlock());
        }
        break;
      case WHILE:
        WhileStatement whileStmt = (WhileStatement) stmt;
        createBindingsForBlock(whileStmt.getBody());
        if (whileStmt.getElseBlock() != null) {
          createBindingsForBlock(whileStmt.getElseBlock());
        }
        break;
      case FOR:
        ForStatement forStmt = (ForStatement) stmt;
        createBindingsForLHS(forStmt.getVars());
        createBindingsForBlock(forStmt.getBody());
        if (forStmt.getElseBlock() != null) {
          createBindingsForBlock(forStmt.getElseBlock());
        }
        break;
      case DEF:
        bind(((DefStatement) stmt).getIdentifier());
        break;
      case CLASS:
        bind(((ClassStatement) stmt).getIdentifier());
        break;
      case IMPORT:
        for (ImportStatement.Binding b : ((ImportStatement) stmt).getBindings()) {
          bind(b.getLocalName());
        }
        break;
      case GLOBAL:
        GlobalStatement global = (GlobalStatement) stmt;
        for (Identifier id : global.getNames()) {
          (global.isNonlocal() ? current.nonlocals : current.globals).add(id.getName());
        }
        break;
      case TRY:
        TryStatement tryStmt = (TryStatement) stmt;
        createBindingsForBlock(tryStmt.getBody());
        for (TryStatement.ExceptHandler handler : tryStmt.getHandlers()) {
          if (handler.getName() != null) {
            bind(handler.getName());
          }
          createBindingsForBlock(handler.getBody());
        }
        if (tryStmt.getElseBlock() != null) {
          createBindingsForBlock(tryStmt.getElseBlock());
        }
        if (tryStmt.getFinallyBlock() != null) {
          createBindingsForBlock(tryStmt.getFinallyBlock());
        }
        break;
      case WITH:
        WithStatement with = (WithStatement) stmt;
        for (WithStatement.Item item : with.getItems()) {
          if (item.getTarget() != null) {
            createBindingsForLHS(item.getTarget());
          }
        }
        createBindingsForBlock(with.getBody());
        break;
      case MATCH:
        for (MatchStatement.Case c : ((MatchStatement) stmt).getCases()) {
          visitPattern(c.getPattern(), this::bind, e -> {});
          createBindingsForBlock(c.getBody());
        }
        break;
      case ASSERT:
      case EXPRESSION:
      case FLOW:
      case RAISE:
      case RETURN:
        // nothing to declare
    }
  }

  private void createBindingsForLHS(Expression lhs) {
    for (Identifier id : Identifier.boundIdentifiers(lhs)) {
      bind(id);
    }
  }

  private void bind(Identifier id) {
    current.locals.add(id.getName());
  }

  /**
   * Visits a match pattern, passing each capture name to {@code capture} and each subexpression
   * evaluated against the subject (class names, constants, mapping keys) to {@code use}. The
   * wildcard {@code _} captures nothing.
   */
  static void visitPattern(
      Expression pattern, Consumer<Identifier> capture, Consumer<Expression> use) {
    switch (pattern.kind()) {
      case IDENTIFIER:
        if (!((Identifier) pattern).getName().equals("_")) {
          capture.accept((Identifier) pattern);
        }
        break;
      case LIST_EXPR:
        for (Expression elem : ((ListExpression) pattern).getElements()) {
          visitPattern(elem, capture, use);
        }
        break;
      case BINARY_OPERATOR:
        BinaryOperatorExpression binop = (BinaryOperatorExpression) pattern;
        if (binop.getOperator() == TokenKind.PIPE) {
          visitPattern(binop.getX(), capture, use);
          visitPattern(binop.getY(), capture, use);
        } else {
          use.accept(pattern);
        }
        break;
      case CALL:
        CallExpression call = (CallExpression) pattern;
        use.accept(call.getFunction());
        for (Argument arg : call.getArguments()) {
          visitPattern(arg.getValue(), capture, use);
        }
        break;
      case DICT_EXPR:
        for (DictExpression.Entry entry : ((DictExpression) pattern).getEntries()) {
          use.accept(entry.getKey());
          visitPattern(entry.getValue(), capture, use);
        }
        break;
      default:
        use.accept(pattern);
    }
  }

  // ==== second pass: uses ====

  @Override
  public void visit(Identifier id) {
    enclosing.put(id, current);
    Scope scope = lookup(current, id.getName());
    if (scope != null) {
      variables.put(id, Variable.of(id.getName(), scope));
    }
  }

  // Returns the scope that binds a name as seen from the given scope, or null for a builtin.
  @Nullable
  private Scope lookup(Scope scope, String name) {
    if (scope.globals.contains(name)) {
      return module;
    }
    if (scope.nonlocals.contains(name)) {
      Scope outer = lookupEnclosing(scope, name);
      return outer != null ? outer : module;
    }
    if (scope.locals.contains(name)) {
      return scope;
    }
    return lookupEnclosing(scope, name);
  }

  // Looks a name up in the scopes enclosing the given one, skipping class bodies.
  @Nullable
  private Scope lookupEnclosing(Scope scope, String name) {
    for (Scope s = scope.getParent(); s != null; s = s.getParent()) {
      if (s.getKind() == Scope.Kind.CLASS) {
        continue;
      }
      if (s.globals.contains(name)) {
        return module;
      }
      if (s.locals.contains(name) && !s.nonlocals.contains(name)) {
        return s;
      }
    }
    return null;
  }

  @Override
  public void visit(CallExpression node) {
    super.visit(node);
    if (dynamicCall == null
        && node.getArguments().isEmpty()
        && node.getFunction() instanceof Identifier) {
      Identifier fn = (Identifier) node.getFunction();
      if (options.dynamicScopeBuiltins().contains(fn.getName()) && variables.get(fn) == null) {
        dynamicCall = node;
      }
    }
  }

  @Override
  public void visit(MatchStatement.Case node) {
    visitPattern(node.getPattern(), this::visit, this::visit);
    if (node.getGuard() != null) {
      visit(node.getGuard());
    }
    visitBlock(node.getBody());
  }

  @Override
  public void visit(DefStatement node) {
    visitAll(node.getDecorators());
    visitParameterExpressions(node.getParameters());
    if (node.getReturnType() != null) {
      visit(node.getReturnType());
    }
    visit(node.getIdentifier());

    pushScope(Scope.Kind.FUNCTION, node);
    bindParameters(node.getParameters());
    createBindingsForBlock(node.getBody());
    visitParameterNames(node.getParameters());
    visitBlock(node.getBody());
    popScope();
  }

  @Override
  public void visit(ClassStatement node) {
    visitAll(node.getDecorators());
    visitAll(node.getBases());
    visit(node.getIdentifier());

    pushScope(Scope.Kind.CLASS, node);
    createBindingsForBlock(node.getBody());
    visitBlock(node.getBody());
    popScope();
  }

  @Override
  public void visit(LambdaExpression node) {
    visitParameterExpressions(node.getParameters());

    pushScope(Scope.Kind.LAMBDA, node);
    bindParameters(node.getParameters());
    visitParameterNames(node.getParameters());
    visit(node.getBody());
    popScope();
  }

  // Default values and annotations are evaluated in the enclosing scope.
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
        bind(param.getIdentifier());
      }
    }
  }

  private void visitParameterNames(List<Parameter> params) {
    for (Parameter param : params) {
      if (param.getIdentifier() != null) {
        visit(param.getIdentifier());
      }
    }
  }

  @Override
  public void visit(Comprehension node) {
    ImmutableList<Comprehension.Clause> clauses = node.getClauses();

    // The first iterable is evaluated in the enclosing scope; all other parts in the
    // comprehension's own scope.
    Comprehension.For for0 = (Comprehension.For) clauses.get(0);
    visit(for0.getIterable());

    pushScope(Scope.Kind.COMPREHENSION, node);
    for (Comprehension.Clause clause : clauses) {
      if (clause instanceof Comprehension.For) {
        createBindingsForLHS(((Comprehension.For) clause).getVars());
      }
    }
    for (int i = 0; i < clauses.size(); i++) {
      Comprehension.Clause clause = clauses.get(i);
      if (clause instanceof Comprehension.For) {
        Comprehension.For forClause = (Comprehension.For) clause;
        if (i > 0) {
          visit(forClause.getIterable());
        }
        visit(forClause.getVars());
      } else {
        visit(((Comprehension.If) clause).getCondition());
      }
    }
    visit(node.getBody());
    popScope();
  }
}

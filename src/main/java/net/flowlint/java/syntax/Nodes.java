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

package net.flowlint.java.syntax;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A uniform, reflective view of syntax nodes.
 *
 * <p>Every node kind has a fixed, ordered list of fields: child nodes, lists of child nodes, and
 * scalar attributes (names, operators, literal values). Absent optional children are null. Field
 * order follows source order, so {@link #children} lists children lexically. Locations are not
 * fields; {@link #withFields} reuses those of its prototype.
 *
 * <p>Per kind:
 *
 * <pre>
 * Identifier            [name]
 * IntLiteral            [value]        FloatLiteral [value]       StringLiteral [value]
 * BinaryOperator        [x, op, y]     UnaryOperator [op, x]
 * Conditional           [then, cond, else]
 * Call                  [function, arguments]
 * Dot                   [object, field]
 * Index                 [object, key]  Slice [object, start, stop, step]
 * ListExpression        [isTuple, elements]
 * DictExpression        [entries]      Entry [key, value]
 * Comprehension         [type, body, clauses]   For [vars, iterable]   If [condition]
 * Lambda                [parameters, body]
 * Argument.Positional   [value]        Keyword [id, value]        Star, StarStar [value]
 * Parameter.Mandatory   [id, type]     Optional [id, type, default]   Star, StarStar [id, type]
 * ExpressionStatement   [expr]
 * Assignment            [lhs, type, op, rhs]
 * Flow                  [kind]         Return [result]
 * If                    [token, cond, then, else]
 * For                   [vars, iterable, body, else]   While [cond, body, else]
 * Def                   [decorators, id, parameters, returnType, body]
 * Class                 [decorators, id, bases, body]
 * Try                   [body, handlers, else, finally]   ExceptHandler [type, name, body]
 * Raise                 [exception, cause]
 * With                  [items, body]  Item [context, target]
 * Del                   [targets]      Global [token, names]
 * Import                [module, bindings]   Binding [localName, originalName]
 * Assert                [cond, msg]
 * Match                 [subject, cases]     Case [pattern, guard, body]
 * SourceFile            [statements]
 * </pre>
 */
public final class Nodes {

  private Nodes() {}

  /** Returns the fields of {@code node}, in the order documented above. */
  public static List<Object> fields(Node node) {
    if (node instanceof Expression) {
      return expressionFields((Expression) node);
    } else if (node instanceof Statement) {
      return statementFields((Statement) node);
    } else if (node instanceof Argument) {
      Argument arg = (Argument) node;
      if (arg instanceof Argument.Keyword) {
        return of(((Argument.Keyword) arg).getIdentifier(), arg.getValue());
      }
      return of(arg.getValue());
    } else if (node instanceof Parameter) {
      Parameter param = (Parameter) node;
      if (param instanceof Parameter.Optional) {
        return of(param.getIdentifier(), param.getType(), param.getDefaultValue());
      }
      return of(param.getIdentifier(), param.getType());
    } else if (node instanceof DictExpression.Entry) {
      DictExpression.Entry entry = (DictExpression.Entry) node;
      return of(entry.getKey(), entry.getValue());
    } else if (node instanceof Comprehension.For) {
      Comprehension.For clause = (Comprehension.For) node;
      return of(clause.getVars(), clause.getIterable());
    } else if (node instanceof Comprehension.If) {
      return of(((Comprehension.If) node).getCondition());
    } else if (node instanceof TryStatement.ExceptHandler) {
      TryStatement.ExceptHandler handler = (TryStatement.ExceptHandler) node;
      return of(handler.getType(), handler.getName(), handler.getBody());
    } else if (node instanceof WithStatement.Item) {
      WithStatement.Item item = (WithStatement.Item) node;
      return of(item.getContext(), item.getTarget());
    } else if (node instanceof ImportStatement.Binding) {
      ImportStatement.Binding binding = (ImportStatement.Binding) node;
      return of(binding.getLocalName(), binding.getOriginalName());
    } else if (node instanceof MatchStatement.Case) {
      MatchStatement.Case c = (MatchStatement.Case) node;
      return of(c.getPattern(), c.getGuard(), c.getBody());
    } else if (node instanceof SourceFile) {
      return of(((SourceFile) node).getStatements());
    }
    throw new IllegalArgumentException("unexpected node: " + node.getClass().getName());
  }

  private static List<Object> expressionFields(Expression expr) {
    switch (expr.kind()) {
      case IDENTIFIER:
        return of(((Identifier) expr).getName());
      case INT_LITERAL:
        return of(((IntLiteral) expr).getValue());
      case FLOAT_LITERAL:
        return of(((FloatLiteral) expr).getValue());
      case STRING_LITERAL:
        return of(((StringLiteral) expr).getValue());
      case BINARY_OPERATOR:
        {
          BinaryOperatorExpression binop = (BinaryOperatorExpression) expr;
          return of(binop.getX(), binop.getOperator(), binop.getY());
        }
      case UNARY_OPERATOR:
        {
          UnaryOperatorExpression unop = (UnaryOperatorExpression) expr;
          return of(unop.getOperator(), unop.getX());
        }
      case CONDITIONAL:
        {
          ConditionalExpression cond = (ConditionalExpression) expr;
          return of(cond.getThenCase(), cond.getCondition(), cond.getElseCase());
        }
      case CALL:
        {
          CallExpression call = (CallExpression) expr;
          return of(call.getFunction(), call.getArguments());
        }
      case DOT:
        {
          DotExpression dot = (DotExpression) expr;
          return of(dot.getObject(), dot.getField());
        }
      case INDEX:
        {
          IndexExpression index = (IndexExpression) expr;
          return of(index.getObject(), index.getKey());
        }
      case SLICE:
        {
          SliceExpression slice = (SliceExpression) expr;
          return of(slice.getObject(), slice.getStart(), slice.getStop(), slice.getStep());
        }
      case LIST_EXPR:
        {
          ListExpression list = (ListExpression) expr;
          return of(list.isTuple(), list.getElements());
        }
      case DICT_EXPR:
        return of(((DictExpression) expr).getEntries());
      case COMPREHENSION:
        {
          Comprehension comp = (Comprehension) expr;
          return of(comp.getType(), comp.getBody(), comp.getClauses());
        }
      case LAMBDA:
        {
          LambdaExpression lambda = (LambdaExpression) expr;
          return of(lambda.getParameters(), lambda.getBody());
        }
    }
    throw new IllegalArgumentException("unexpected expression kind: " + expr.kind());
  }

  private static List<Object> statementFields(Statement stmt) {
    switch (stmt.kind()) {
      case EXPRESSION:
        return of(((ExpressionStatement) stmt).getExpression());
      case ASSIGNMENT:
        {
          AssignmentStatement assign = (AssignmentStatement) stmt;
          return of(assign.getLHS(), assign.getType(), assign.getOperator(), assign.getRHS());
        }
      case FLOW:
        return of(((FlowStatement) stmt).getFlowKind());
      case RETURN:
        return of(((ReturnStatement) stmt).getResult());
      case IF:
        {
          IfStatement ifStmt = (IfStatement) stmt;
          return of(
              ifStmt.isElif() ? TokenKind.ELIF : TokenKind.IF,
              ifStmt.getCondition(),
              ifStmt.getThenBlock(),
              ifStmt.getElseBlock());
        }
      case FOR:
        {
          ForStatement forStmt = (ForStatement) stmt;
          return of(
              forStmt.getVars(),
              forStmt.getIterable(),
              forStmt.getBody(),
              forStmt.getElseBlock());
        }
      case WHILE:
        {
          WhileStatement whileStmt = (WhileStatement) stmt;
          return of(whileStmt.getCondition(), whileStmt.getBody(), whileStmt.getElseBlock());
        }
      case DEF:
        {
          DefStatement def = (DefStatement) stmt;
          return of(
              def.getDecorators(),
              def.getIdentifier(),
              def.getParameters(),
              def.getReturnType(),
              def.getBody());
        }
      case CLASS:
        {
          ClassStatement cls = (ClassStatement) stmt;
          return of(cls.getDecorators(), cls.getIdentifier(), cls.getBases(), cls.getBody());
        }
      case TRY:
        {
          TryStatement tryStmt = (TryStatement) stmt;
          return of(
              tryStmt.getBody(),
              tryStmt.getHandlers(),
              tryStmt.getElseBlock(),
              tryStmt.getFinallyBlock());
        }
      case RAISE:
        {
          RaiseStatement raise = (RaiseStatement) stmt;
          return of(raise.getException(), raise.getCause());
        }
      case WITH:
        {
          WithStatement with = (WithStatement) stmt;
          return of(with.getItems(), with.getBody());
        }
      case DEL:
        return of(((DelStatement) stmt).getTargets());
      case GLOBAL:
        {
          GlobalStatement global = (GlobalStatement) stmt;
          return of(global.getToken(), global.getNames());
        }
      case IMPORT:
        {
          ImportStatement imp = (ImportStatement) stmt;
          return of(imp.getModule(), imp.getBindings());
        }
      case ASSERT:
        {
          AssertStatement assertStmt = (AssertStatement) stmt;
          return of(assertStmt.getCondition(), assertStmt.getMessage());
        }
      case MATCH:
        {
          MatchStatement match = (MatchStatement) stmt;
          return of(match.getSubject(), match.getCases());
        }
    }
    throw new IllegalArgumentException("unexpected statement kind: " + stmt.kind());
  }

  /**
   * Returns a new node of the same class as {@code prototype}, with the given fields and the
   * prototype's locations. Node-valued fields must be fresh, parentless nodes; list-valued fields
   * may be any list of the right element type.
   *
   * @throws IllegalArgumentException if the field count is wrong for the prototype's kind
   * @throws ClassCastException if a field has the wrong type
   */
  public static Node withFields(Node prototype, List<?> fields) {
    int expected = fields(prototype).size();
    if (fields.size() != expected) {
      throw new IllegalArgumentException(
          String.format(
              "%s has %d fields, got %d",
              prototype.getClass().getSimpleName(), expected, fields.size()));
    }
    FileLocations locs = prototype.locs;
    if (prototype instanceof Expression) {
      return expressionWithFields((Expression) prototype, fields);
    } else if (prototype instanceof Statement) {
      return statementWithFields((Statement) prototype, fields);
    } else if (prototype instanceof Argument.Positional) {
      return new Argument.Positional(locs, expr(fields, 0));
    } else if (prototype instanceof Argument.Keyword) {
      return new Argument.Keyword(locs, (Identifier) fields.get(0), expr(fields, 1));
    } else if (prototype instanceof Argument.Star) {
      return new Argument.Star(locs, prototype.getStartOffset(), expr(fields, 0));
    } else if (prototype instanceof Argument.StarStar) {
      return new Argument.StarStar(locs, prototype.getStartOffset(), expr(fields, 0));
    } else if (prototype instanceof Parameter.Mandatory) {
      return new Parameter.Mandatory(locs, (Identifier) fields.get(0), expr(fields, 1));
    } else if (prototype instanceof Parameter.Optional) {
      return new Parameter.Optional(
          locs, (Identifier) fields.get(0), expr(fields, 1), expr(fields, 2));
    } else if (prototype instanceof Parameter.Star) {
      return new Parameter.Star(
          locs, prototype.getStartOffset(), (Identifier) fields.get(0), expr(fields, 1));
    } else if (prototype instanceof Parameter.StarStar) {
      return new Parameter.StarStar(
          locs, prototype.getStartOffset(), (Identifier) fields.get(0), expr(fields, 1));
    } else if (prototype instanceof DictExpression.Entry) {
      return new DictExpression.Entry(
          locs,
          expr(fields, 0),
          ((DictExpression.Entry) prototype).getColonOffset(),
          expr(fields, 1));
    } else if (prototype instanceof Comprehension.For) {
      return new Comprehension.For(
          locs, prototype.getStartOffset(), expr(fields, 0), expr(fields, 1));
    } else if (prototype instanceof Comprehension.If) {
      return new Comprehension.If(locs, prototype.getStartOffset(), expr(fields, 0));
    } else if (prototype instanceof TryStatement.ExceptHandler) {
      return new TryStatement.ExceptHandler(
          locs,
          prototype.getStartOffset(),
          expr(fields, 0),
          (Identifier) fields.get(1),
          list(fields, 2, Statement.class));
    } else if (prototype instanceof WithStatement.Item) {
      return new WithStatement.Item(locs, expr(fields, 0), expr(fields, 1));
    } else if (prototype instanceof ImportStatement.Binding) {
      return new ImportStatement.Binding(
          locs, (Identifier) fields.get(0), (String) fields.get(1));
    } else if (prototype instanceof MatchStatement.Case) {
      return new MatchStatement.Case(
          locs,
          prototype.getStartOffset(),
          expr(fields, 0),
          expr(fields, 1),
          list(fields, 2, Statement.class));
    } else if (prototype instanceof SourceFile) {
      SourceFile file = (SourceFile) prototype;
      return SourceFile.create(
          locs,
          list(fields, 0, Statement.class),
          file.getOptions(),
          file.errors(),
          file.getEndOffset());
    }
    throw new IllegalArgumentException("unexpected node: " + prototype.getClass().getName());
  }

  private static Expression expressionWithFields(Expression proto, List<?> f) {
    FileLocations locs = proto.locs;
    switch (proto.kind()) {
      case IDENTIFIER:
        return ((Identifier) proto).withName((String) f.get(0));
      case INT_LITERAL:
        {
          IntLiteral lit = (IntLiteral) proto;
          Number value = (Number) f.get(0);
          String raw = value.equals(lit.getValue()) ? lit.getRaw() : value.toString();
          return new IntLiteral(locs, raw, lit.getStartOffset(), value);
        }
      case FLOAT_LITERAL:
        {
          FloatLiteral lit = (FloatLiteral) proto;
          double value = (Double) f.get(0);
          String raw = value == lit.getValue() ? lit.getRaw() : Double.toString(value);
          return new FloatLiteral(locs, raw, lit.getStartOffset(), value);
        }
      case STRING_LITERAL:
        return new StringLiteral(
            locs, proto.getStartOffset(), (String) f.get(0), proto.getEndOffset());
      case BINARY_OPERATOR:
        return new BinaryOperatorExpression(
            locs,
            expr(f, 0),
            (TokenKind) f.get(1),
            ((BinaryOperatorExpression) proto).getOperatorOffset(),
            expr(f, 2));
      case UNARY_OPERATOR:
        return new UnaryOperatorExpression(
            locs, (TokenKind) f.get(0), proto.getStartOffset(), expr(f, 1));
      case CONDITIONAL:
        return new ConditionalExpression(locs, expr(f, 0), expr(f, 1), expr(f, 2));
      case CALL:
        return new CallExpression(
            locs, expr(f, 0), list(f, 1, Argument.class), proto.getEndOffset() - 1);
      case DOT:
        return new DotExpression(
            locs,
            expr(f, 0),
            ((DotExpression) proto).getDotOffset(),
            (Identifier) f.get(1));
      case INDEX:
        return new IndexExpression(
            locs,
            expr(f, 0),
            ((IndexExpression) proto).getLbracketOffset(),
            expr(f, 1),
            proto.getEndOffset() - 1);
      case SLICE:
        return new SliceExpression(
            locs,
            expr(f, 0),
            ((SliceExpression) proto).getLbracketOffset(),
            expr(f, 1),
            expr(f, 2),
            expr(f, 3),
            proto.getEndOffset() - 1);
      case LIST_EXPR:
        {
          ListExpression list = (ListExpression) proto;
          return new ListExpression(
              locs,
              (Boolean) f.get(0),
              list.getLbracketOffset(),
              list(f, 1, Expression.class),
              list.getRbracketOffset());
        }
      case DICT_EXPR:
        return new DictExpression(
            locs,
            proto.getStartOffset(),
            list(f, 0, DictExpression.Entry.class),
            proto.getEndOffset() - 1);
      case COMPREHENSION:
        return new Comprehension(
            locs,
            (Comprehension.Type) f.get(0),
            proto.getStartOffset(),
            (Node) f.get(1),
            list(f, 2, Comprehension.Clause.class),
            proto.getEndOffset() - 1);
      case LAMBDA:
        return new LambdaExpression(
            locs, proto.getStartOffset(), list(f, 0, Parameter.class), expr(f, 1));
    }
    throw new IllegalArgumentException("unexpected expression kind: " + proto.kind());
  }

  private static Statement statementWithFields(Statement proto, List<?> f) {
    FileLocations locs = proto.locs;
    int start = proto.getStartOffset();
    switch (proto.kind()) {
      case EXPRESSION:
        return new ExpressionStatement(locs, expr(f, 0));
      case ASSIGNMENT:
        return new AssignmentStatement(
            locs,
            expr(f, 0),
            expr(f, 1),
            (TokenKind) f.get(2),
            ((AssignmentStatement) proto).getOperatorOffset(),
            expr(f, 3));
      case FLOW:
        return new FlowStatement(locs, (TokenKind) f.get(0), start);
      case RETURN:
        return new ReturnStatement(locs, start, expr(f, 0));
      case IF:
        return new IfStatement(
            locs,
            (TokenKind) f.get(0),
            start,
            expr(f, 1),
            list(f, 2, Statement.class),
            list(f, 3, Statement.class));
      case FOR:
        return new ForStatement(
            locs,
            start,
            expr(f, 0),
            expr(f, 1),
            list(f, 2, Statement.class),
            list(f, 3, Statement.class));
      case WHILE:
        return new WhileStatement(
            locs, start, expr(f, 0), list(f, 1, Statement.class), list(f, 2, Statement.class));
      case DEF:
        return new DefStatement(
            locs,
            start,
            list(f, 0, Expression.class),
            (Identifier) f.get(1),
            list(f, 2, Parameter.class),
            expr(f, 3),
            list(f, 4, Statement.class));
      case CLASS:
        return new ClassStatement(
            locs,
            start,
            list(f, 0, Expression.class),
            (Identifier) f.get(1),
            list(f, 2, Argument.class),
            list(f, 3, Statement.class));
      case TRY:
        return new TryStatement(
            locs,
            start,
            list(f, 0, Statement.class),
            list(f, 1, TryStatement.ExceptHandler.class),
            list(f, 2, Statement.class),
            list(f, 3, Statement.class));
      case RAISE:
        return new RaiseStatement(locs, start, expr(f, 0), expr(f, 1));
      case WITH:
        return new WithStatement(
            locs, start, list(f, 0, WithStatement.Item.class), list(f, 1, Statement.class));
      case DEL:
        return new DelStatement(locs, start, list(f, 0, Expression.class));
      case GLOBAL:
        return new GlobalStatement(
            locs, (TokenKind) f.get(0), start, list(f, 1, Identifier.class));
      case IMPORT:
        return new ImportStatement(
            locs,
            start,
            (String) f.get(0),
            list(f, 1, ImportStatement.Binding.class),
            proto.getEndOffset());
      case ASSERT:
        return new AssertStatement(locs, start, expr(f, 0), expr(f, 1));
      case MATCH:
        return new MatchStatement(
            locs, start, expr(f, 0), list(f, 1, MatchStatement.Case.class));
    }
    throw new IllegalArgumentException("unexpected statement kind: " + proto.kind());
  }

  /**
   * Returns a deep copy of the tree rooted at {@code node}. The copy has no parent; its descendants
   * are linked to their new parents only once a {@link SourceFile} is built around them.
   */
  @SuppressWarnings("unchecked")
  public static <N extends Node> N copy(N node) {
    List<Object> fields = fields(node);
    List<Object> copied = new ArrayList<>(fields.size());
    for (Object field : fields) {
      copied.add(copyField(field));
    }
    return (N) withFields(node, copied);
  }

  @Nullable
  private static Object copyField(@Nullable Object field) {
    if (field instanceof Node) {
      return copy((Node) field);
    } else if (field instanceof List) {
      ImmutableList.Builder<Object> list = ImmutableList.builder();
      for (Object elem : (List<?>) field) {
        list.add(copyField(elem));
      }
      return list.build();
    }
    return field;
  }

  /**
   * Reports whether two values, typically nodes, have the same shape: the same node classes with
   * structurally equal fields, ignoring locations. Lists compare element-wise; other values by
   * {@link Object#equals}.
   */
  public static boolean structurallyEqual(@Nullable Object x, @Nullable Object y) {
    if (x == y) {
      return true;
    }
    if (x == null || y == null) {
      return false;
    }
    if (x instanceof Node && y instanceof Node) {
      if (x.getClass() != y.getClass()) {
        return false;
      }
      return structurallyEqual(fields((Node) x), fields((Node) y));
    }
    if (x instanceof List && y instanceof List) {
      List<?> xs = (List<?>) x;
      List<?> ys = (List<?>) y;
      if (xs.size() != ys.size()) {
        return false;
      }
      for (int i = 0; i < xs.size(); i++) {
        if (!structurallyEqual(xs.get(i), ys.get(i))) {
          return false;
        }
      }
      return true;
    }
    return Objects.equals(x, y);
  }

  /** Returns the child nodes of {@code node} in lexical order. */
  public static ImmutableList<Node> children(Node node) {
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    for (Object field : fields(node)) {
      if (field instanceof Node) {
        children.add((Node) field);
      } else if (field instanceof List) {
        for (Object elem : (List<?>) field) {
          children.add((Node) elem);
        }
      }
    }
    return children.build();
  }

  /** Wraps an expression in an expression statement, for use where a statement is required. */
  public static ExpressionStatement asStatement(Expression expr) {
    return new ExpressionStatement(expr.locs, expr);
  }

  /** Wraps an expression in a positional argument. */
  public static Argument asArgument(Expression expr) {
    return new Argument.Positional(expr.locs, expr);
  }

  /** Sets the parent of every node in the tree rooted at {@code root}. */
  static void linkParents(Node root) {
    List<Node> stack = new ArrayList<>();
    stack.add(root);
    while (!stack.isEmpty()) {
      Node node = stack.remove(stack.size() - 1);
      for (Node child : children(node)) {
        child.setParent(node);
        stack.add(child);
      }
    }
  }

  private static List<Object> of(Object... values) {
    return Collections.unmodifiableList(Arrays.asList(values));
  }

  @Nullable
  private static Expression expr(List<?> fields, int i) {
    return (Expression) fields.get(i);
  }

  // Returns null for a null field, as for absent else blocks.
  @Nullable
  private static <T> ImmutableList<T> list(List<?> fields, int i, Class<T> elementType) {
    Object value = fields.get(i);
    if (value == null) {
      return null;
    }
    ImmutableList.Builder<T> list = ImmutableList.builder();
    for (Object elem : (List<?>) value) {
      list.add(elementType.cast(elem));
    }
    return list.build();
  }
}

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

import java.util.List;

/**
 * A printer of syntax trees as source text.
 *
 * <p>The output parses back to a structurally equal tree (see {@link Nodes#structurallyEqual}),
 * though not necessarily to the original text: comments and blank lines are lost, strings are
 * requoted, and tuples nested in larger expressions are always parenthesized.
 */
public final class NodePrinter {

  private static final int INDENT = 4;

  private final StringBuilder buf;
  private int indent;

  private NodePrinter(StringBuilder buf) {
    this.buf = buf;
  }

  /** Returns the source text of a node. Statements are terminated by a newline. */
  public static String print(Node node) {
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf).printNode(node);
    return buf.toString();
  }

  /** Returns the source text of a block of statements. */
  public static String printBlock(List<? extends Statement> statements) {
    StringBuilder buf = new StringBuilder();
    NodePrinter printer = new NodePrinter(buf);
    for (Statement stmt : statements) {
      printer.printStmt(stmt);
    }
    return buf.toString();
  }

  private void printNode(Node n) {
    if (n instanceof Expression) {
      printTopLevel((Expression) n);
    } else if (n instanceof Statement) {
      printStmt((Statement) n);
    } else if (n instanceof SourceFile) {
      for (Statement stmt : ((SourceFile) n).getStatements()) {
        printStmt(stmt);
      }
    } else if (n instanceof Argument) {
      printArgument((Argument) n);
    } else if (n instanceof Parameter) {
      printParameter((Parameter) n, true);
    } else if (n instanceof DictExpression.Entry) {
      printEntry((DictExpression.Entry) n);
    } else if (n instanceof Comprehension.Clause) {
      printClause((Comprehension.Clause) n);
    } else if (n instanceof WithStatement.Item) {
      printItem((WithStatement.Item) n);
    } else if (n instanceof ImportStatement.Binding) {
      printBinding((ImportStatement.Binding) n);
    } else if (n instanceof TryStatement.ExceptHandler) {
      printHandler((TryStatement.ExceptHandler) n);
    } else if (n instanceof MatchStatement.Case) {
      printCase((MatchStatement.Case) n);
    } else {
      throw new IllegalArgumentException("unexpected node: " + n.getClass().getName());
    }
  }

  // ==== statements ====

  private void printIndent() {
    for (int i = 0; i < indent; i++) {
      buf.append(' ');
    }
  }

  private void printSuite(List<Statement> statements) {
    buf.append(":\n");
    indent += INDENT;
    if (statements.isEmpty()) {
      printIndent();
      buf.append("pass\n");
    }
    for (Statement stmt : statements) {
      printStmt(stmt);
    }
    indent -= INDENT;
  }

  private void printStmt(Statement s) {
    printIndent();
    switch (s.kind()) {
      case ASSERT:
        {
          AssertStatement stmt = (AssertStatement) s;
          buf.append("assert ");
          printExpr(stmt.getCondition());
          if (stmt.getMessage() != null) {
            buf.append(", ");
            printExpr(stmt.getMessage());
          }
          buf.append('\n');
          break;
        }

      case ASSIGNMENT:
        {
          AssignmentStatement stmt = (AssignmentStatement) s;
          printTopLevel(stmt.getLHS());
          if (stmt.getType() != null) {
            buf.append(": ");
            printExpr(stmt.getType());
          }
          if (stmt.getRHS() != null) {
            buf.append(' ');
            if (stmt.isAugmented()) {
              buf.append(stmt.getOperator());
            }
            buf.append("= ");
            printTopLevel(stmt.getRHS());
          }
          buf.append('\n');
          break;
        }

      case CLASS:
        {
          ClassStatement stmt = (ClassStatement) s;
          printDecorators(stmt.getDecorators());
          buf.append("class ").append(stmt.getIdentifier().getName());
          if (!stmt.getBases().isEmpty()) {
            buf.append('(');
            printArguments(stmt.getBases());
            buf.append(')');
          }
          printSuite(stmt.getBody());
          break;
        }

      case DEF:
        {
          DefStatement stmt = (DefStatement) s;
          printDecorators(stmt.getDecorators());
          buf.append("def ").append(stmt.getIdentifier().getName()).append('(');
          printParameters(stmt.getParameters(), true);
          buf.append(')');
          if (stmt.getReturnType() != null) {
            buf.append(" -> ");
            printExpr(stmt.getReturnType());
          }
          printSuite(stmt.getBody());
          break;
        }

      case DEL:
        buf.append("del ");
        printExprList(((DelStatement) s).getTargets());
        buf.append('\n');
        break;

      case EXPRESSION:
        printTopLevel(((ExpressionStatement) s).getExpression());
        buf.append('\n');
        break;

      case FLOW:
        buf.append(((FlowStatement) s).getFlowKind()).append('\n');
        break;

      case FOR:
        {
          ForStatement stmt = (ForStatement) s;
          buf.append("for ");
          printTopLevel(stmt.getVars());
          buf.append(" in ");
          printTopLevel(stmt.getIterable());
          printSuite(stmt.getBody());
          printElse(stmt.getElseBlock());
          break;
        }

      case GLOBAL:
        {
          GlobalStatement stmt = (GlobalStatement) s;
          buf.append(stmt.isNonlocal() ? "nonlocal " : "global ");
          printExprList(stmt.getNames());
          buf.append('\n');
          break;
        }

      case IF:
        printIf((IfStatement) s);
        break;

      case IMPORT:
        printImport((ImportStatement) s);
        break;

      case MATCH:
        {
          MatchStatement stmt = (MatchStatement) s;
          buf.append("match ");
          printTopLevel(stmt.getSubject());
          buf.append(":\n");
          indent += INDENT;
          for (MatchStatement.Case c : stmt.getCases()) {
            printIndent();
            printCase(c);
          }
          indent -= INDENT;
          break;
        }

      case RAISE:
        {
          RaiseStatement stmt = (RaiseStatement) s;
          buf.append("raise");
          if (stmt.getException() != null) {
            buf.append(' ');
            printExpr(stmt.getException());
          }
          if (stmt.getCause() != null) {
            buf.append(" from ");
            printExpr(stmt.getCause());
          }
          buf.append('\n');
          break;
        }

      case RETURN:
        {
          ReturnStatement stmt = (ReturnStatement) s;
          buf.append("return");
          if (stmt.getResult() != null) {
            buf.append(' ');
            printTopLevel(stmt.getResult());
          }
          buf.append('\n');
          break;
        }

      case TRY:
        {
          TryStatement stmt = (TryStatement) s;
          buf.append("try");
          printSuite(stmt.getBody());
          for (TryStatement.ExceptHandler handler : stmt.getHandlers()) {
            printIndent();
            printHandler(handler);
          }
          printElse(stmt.getElseBlock());
          if (stmt.getFinallyBlock() != null) {
            printIndent();
            buf.append("finally");
            printSuite(stmt.getFinallyBlock());
          }
          break;
        }

      case WHILE:
        {
          WhileStatement stmt = (WhileStatement) s;
          buf.append("while ");
          printExpr(stmt.getCondition());
          printSuite(stmt.getBody());
          printElse(stmt.getElseBlock());
          break;
        }

      case WITH:
        {
          WithStatement stmt = (WithStatement) s;
          buf.append("with ");
          String sep = "";
          for (WithStatement.Item item : stmt.getItems()) {
            buf.append(sep);
            sep = ", ";
            printItem(item);
          }
          printSuite(stmt.getBody());
          break;
        }
    }
  }

  private void printDecorators(List<Expression> decorators) {
    for (Expression decorator : decorators) {
      buf.append('@');
      printExpr(decorator);
      buf.append('\n');
      printIndent();
    }
  }

  // Prints the if statement, with the indentation already printed.
  private void printIf(IfStatement stmt) {
    buf.append(stmt.isElif() ? "elif " : "if ");
    printExpr(stmt.getCondition());
    printSuite(stmt.getThenBlock());
    List<Statement> elseBlock = stmt.getElseBlock();
    if (elseBlock != null
        && elseBlock.size() == 1
        && elseBlock.get(0) instanceof IfStatement
        && ((IfStatement) elseBlock.get(0)).isElif()) {
      printIndent();
      printIf((IfStatement) elseBlock.get(0));
    } else {
      printElse(elseBlock);
    }
  }

  private void printElse(List<Statement> elseBlock) {
    if (elseBlock != null) {
      printIndent();
      buf.append("else");
      printSuite(elseBlock);
    }
  }

  private void printImport(ImportStatement stmt) {
    if (stmt.getModule() != null) {
      buf.append("from ").append(stmt.getModule()).append(" import ");
      if (stmt.isWildcard()) {
        buf.append('*');
      }
    } else {
      buf.append("import ");
    }
    String sep = "";
    for (ImportStatement.Binding binding : stmt.getBindings()) {
      buf.append(sep);
      sep = ", ";
      printBinding(binding);
    }
    buf.append('\n');
  }

  private void printBinding(ImportStatement.Binding binding) {
    String local = binding.getLocalName().getName();
    String original = binding.getOriginalName();
    buf.append(original);
    // "import a.b" binds a.
    if (!original.equals(local) && !original.startsWith(local + ".")) {
      buf.append(" as ").append(local);
    }
  }

  private void printHandler(TryStatement.ExceptHandler handler) {
    buf.append("except");
    if (handler.getType() != null) {
      buf.append(' ');
      printExpr(handler.getType());
      if (handler.getName() != null) {
        buf.append(" as ").append(handler.getName().getName());
      }
    }
    printSuite(handler.getBody());
  }

  private void printItem(WithStatement.Item item) {
    printExpr(item.getContext());
    if (item.getTarget() != null) {
      buf.append(" as ");
      printExpr(item.getTarget());
    }
  }

  private void printCase(MatchStatement.Case c) {
    buf.append("case ");
    printTopLevel(c.getPattern());
    if (c.getGuard() != null) {
      buf.append(" if ");
      printExpr(c.getGuard());
    }
    printSuite(c.getBody());
  }

  // ==== expressions ====

  // Binding strength of each expression form; operands of lower strength get parentheses.
  private static final int LAMBDA = 0;
  private static final int CONDITIONAL = 1;
  private static final int UNARY = 12;
  private static final int POWER = 13;
  private static final int ATOM = 14;

  private static int precedence(Expression e) {
    switch (e.kind()) {
      case LAMBDA:
        return LAMBDA;
      case CONDITIONAL:
        return CONDITIONAL;
      case UNARY_OPERATOR:
        switch (((UnaryOperatorExpression) e).getOperator()) {
          case YIELD:
            return LAMBDA;
          case NOT:
            return 4;
          default:
            return UNARY;
        }
      case BINARY_OPERATOR:
        return precedence(((BinaryOperatorExpression) e).getOperator());
      case LIST_EXPR:
        // Bare tuples bind loosest of all.
        return ((ListExpression) e).isParenthesized() ? ATOM : -1;
      default:
        return ATOM;
    }
  }

  private static int precedence(TokenKind op) {
    switch (op) {
      case OR:
        return 2;
      case AND:
        return 3;
      case EQUALS_EQUALS:
      case NOT_EQUALS:
      case LESS:
      case LESS_EQUALS:
      case GREATER:
      case GREATER_EQUALS:
      case IN:
      case NOT_IN:
      case IS:
      case IS_NOT:
        return 5;
      case PIPE:
        return 6;
      case CARET:
        return 7;
      case AMPERSAND:
        return 8;
      case LESS_LESS:
      case GREATER_GREATER:
        return 9;
      case PLUS:
      case MINUS:
        return 10;
      case STAR_STAR:
        return POWER;
      default:
        // STAR, SLASH, SLASH_SLASH, PERCENT, AT
        return 11;
    }
  }

  // Prints an expression in a position where a bare tuple is allowed.
  private void printTopLevel(Expression e) {
    if (e instanceof ListExpression && !((ListExpression) e).isParenthesized()) {
      ListExpression tuple = (ListExpression) e;
      printExprList(tuple.getElements());
      if (tuple.getElements().size() == 1) {
        buf.append(',');
      }
    } else {
      printOperand(e, LAMBDA);
    }
  }

  private void printExpr(Expression e) {
    printOperand(e, LAMBDA);
  }

  private void printOperand(Expression e, int minPrecedence) {
    if (precedence(e) < minPrecedence) {
      buf.append('(');
      printBare(e);
      buf.append(')');
    } else {
      printBare(e);
    }
  }

  private void printExprList(List<? extends Expression> list) {
    String sep = "";
    for (Expression e : list) {
      buf.append(sep);
      sep = ", ";
      printExpr(e);
    }
  }

  private void printBare(Expression e) {
    switch (e.kind()) {
      case BINARY_OPERATOR:
        {
          BinaryOperatorExpression binop = (BinaryOperatorExpression) e;
          int prec = precedence(binop.getOperator());
          boolean rightAssoc = binop.getOperator() == TokenKind.STAR_STAR;
          printOperand(binop.getX(), rightAssoc ? prec + 1 : prec);
          buf.append(' ').append(binop.getOperator()).append(' ');
          printOperand(binop.getY(), rightAssoc ? prec : prec + 1);
          break;
        }

      case CALL:
        {
          CallExpression call = (CallExpression) e;
          printOperand(call.getFunction(), ATOM);
          buf.append('(');
          printArguments(call.getArguments());
          buf.append(')');
          break;
        }

      case COMPREHENSION:
        {
          Comprehension comp = (Comprehension) e;
          switch (comp.getType()) {
            case LIST:
              buf.append('[');
              break;
            case DICT:
              buf.append('{');
              break;
            case GENERATOR:
              buf.append('(');
              break;
          }
          if (comp.getBody() instanceof DictExpression.Entry) {
            printEntry((DictExpression.Entry) comp.getBody());
          } else {
            printOperand((Expression) comp.getBody(), CONDITIONAL);
          }
          for (Comprehension.Clause clause : comp.getClauses()) {
            buf.append(' ');
            printClause(clause);
          }
          switch (comp.getType()) {
            case LIST:
              buf.append(']');
              break;
            case DICT:
              buf.append('}');
              break;
            case GENERATOR:
              buf.append(')');
              break;
          }
          break;
        }

      case CONDITIONAL:
        {
          ConditionalExpression cond = (ConditionalExpression) e;
          printOperand(cond.getThenCase(), CONDITIONAL + 1);
          buf.append(" if ");
          printOperand(cond.getCondition(), CONDITIONAL + 1);
          buf.append(" else ");
          printOperand(cond.getElseCase(), CONDITIONAL);
          break;
        }

      case DICT_EXPR:
        {
          buf.append('{');
          String sep = "";
          for (DictExpression.Entry entry : ((DictExpression) e).getEntries()) {
            buf.append(sep);
            sep = ", ";
            printEntry(entry);
          }
          buf.append('}');
          break;
        }

      case DOT:
        {
          DotExpression dot = (DotExpression) e;
          printOperand(dot.getObject(), ATOM);
          buf.append('.').append(dot.getField().getName());
          break;
        }

      case FLOAT_LITERAL:
        buf.append(((FloatLiteral) e).getRaw());
        break;

      case IDENTIFIER:
        buf.append(((Identifier) e).getName());
        break;

      case INDEX:
        {
          IndexExpression index = (IndexExpression) e;
          printOperand(index.getObject(), ATOM);
          buf.append('[');
          printTopLevel(index.getKey());
          buf.append(']');
          break;
        }

      case INT_LITERAL:
        buf.append(((IntLiteral) e).getRaw());
        break;

      case LAMBDA:
        {
          LambdaExpression lambda = (LambdaExpression) e;
          buf.append("lambda");
          if (!lambda.getParameters().isEmpty()) {
            buf.append(' ');
            printParameters(lambda.getParameters(), false);
          }
          buf.append(": ");
          printExpr(lambda.getBody());
          break;
        }

      case LIST_EXPR:
        {
          ListExpression list = (ListExpression) e;
          buf.append(list.isTuple() ? '(' : '[');
          printExprList(list.getElements());
          if (list.isTuple() && list.getElements().size() == 1) {
            buf.append(',');
          }
          buf.append(list.isTuple() ? ')' : ']');
          break;
        }

      case SLICE:
        {
          SliceExpression slice = (SliceExpression) e;
          printOperand(slice.getObject(), ATOM);
          buf.append('[');
          if (slice.getStart() != null) {
            printExpr(slice.getStart());
          }
          buf.append(':');
          if (slice.getStop() != null) {
            printExpr(slice.getStop());
          }
          if (slice.getStep() != null) {
            buf.append(':');
            printExpr(slice.getStep());
          }
          buf.append(']');
          break;
        }

      case STRING_LITERAL:
        appendQuoted(((StringLiteral) e).getValue());
        break;

      case UNARY_OPERATOR:
        {
          UnaryOperatorExpression unop = (UnaryOperatorExpression) e;
          TokenKind op = unop.getOperator();
          buf.append(op);
          if (op == TokenKind.NOT || op == TokenKind.YIELD) {
            buf.append(' ');
          }
          if (op == TokenKind.YIELD) {
            printTopLevel(unop.getX());
          } else {
            printOperand(unop.getX(), op == TokenKind.NOT ? 4 : UNARY);
          }
          break;
        }
    }
  }

  private void printEntry(DictExpression.Entry entry) {
    printExpr(entry.getKey());
    buf.append(": ");
    printExpr(entry.getValue());
  }

  private void printClause(Comprehension.Clause clause) {
    if (clause instanceof Comprehension.For) {
      Comprehension.For forClause = (Comprehension.For) clause;
      buf.append("for ");
      printTopLevel(forClause.getVars());
      buf.append(" in ");
      printOperand(forClause.getIterable(), CONDITIONAL + 1);
    } else {
      buf.append("if ");
      printOperand(((Comprehension.If) clause).getCondition(), CONDITIONAL + 1);
    }
  }

  private void printArguments(List<Argument> arguments) {
    String sep = "";
    for (Argument arg : arguments) {
      buf.append(sep);
      sep = ", ";
      printArgument(arg);
    }
  }

  private void printArgument(Argument arg) {
    if (arg instanceof Argument.Keyword) {
      buf.append(arg.getName()).append('=');
    } else if (arg instanceof Argument.Star) {
      buf.append('*');
    } else if (arg instanceof Argument.StarStar) {
      buf.append("**");
    }
    printExpr(arg.getValue());
  }

  private void printParameters(List<Parameter> parameters, boolean annotated) {
    String sep = "";
    for (Parameter param : parameters) {
      buf.append(sep);
      sep = ", ";
      printParameter(param, annotated);
    }
  }

  private void printParameter(Parameter param, boolean annotated) {
    if (param instanceof Parameter.Star) {
      buf.append('*');
    } else if (param instanceof Parameter.StarStar) {
      buf.append("**");
    }
    if (param.getIdentifier() != null) {
      buf.append(param.getName());
    }
    if (annotated && param.getType() != null) {
      buf.append(": ");
      printExpr(param.getType());
    }
    if (param.getDefaultValue() != null) {
      buf.append(annotated && param.getType() != null ? " = " : "=");
      printExpr(param.getDefaultValue());
    }
  }

  private void appendQuoted(String s) {
    buf.append('"');
    for (int i = 0; i < s.length(); i++) {
      escapeCharacter(s.charAt(i));
    }
    buf.append('"');
  }

  private void escapeCharacter(char c) {
    switch (c) {
      case '"':
      case '\\':
        buf.append('\\').append(c);
        break;
      case '\r':
        buf.append("\\r");
        break;
      case '\n':
        buf.append("\\n");
        break;
      case '\t':
        buf.append("\\t");
        break;
      default:
        if (c < 32) {
          buf.append(String.format("\\x%02x", (int) c));
        } else {
          buf.append(c);
        }
    }
  }
}

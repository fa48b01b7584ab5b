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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Parser is a recursive-descent parser for the analyzed Python subset. */
final class Parser {

  private static final EnumSet<TokenKind> STATEMENT_TERMINATOR_SET =
      EnumSet.of(TokenKind.EOF, TokenKind.NEWLINE, TokenKind.SEMI);

  private static final EnumSet<TokenKind> LIST_TERMINATOR_SET =
      EnumSet.of(TokenKind.EOF, TokenKind.RBRACKET, TokenKind.SEMI);

  private static final EnumSet<TokenKind> DICT_TERMINATOR_SET =
      EnumSet.of(TokenKind.EOF, TokenKind.RBRACE, TokenKind.SEMI);

  private static final EnumSet<TokenKind> EXPR_LIST_TERMINATOR_SET =
      EnumSet.of(
          TokenKind.COLON,
          TokenKind.EOF,
          TokenKind.NEWLINE,
          TokenKind.EQUALS,
          TokenKind.IN,
          TokenKind.RBRACE,
          TokenKind.RBRACKET,
          TokenKind.RPAREN,
          TokenKind.SEMI);

  private static final EnumSet<TokenKind> EXPR_TERMINATOR_SET =
      EnumSet.of(
          TokenKind.COLON,
          TokenKind.COMMA,
          TokenKind.EOF,
          TokenKind.FOR,
          TokenKind.MINUS,
          TokenKind.NEWLINE,
          TokenKind.PERCENT,
          TokenKind.PLUS,
          TokenKind.RBRACKET,
          TokenKind.RPAREN,
          TokenKind.SLASH);

  // Tokens that may begin the subject of a match statement, after the soft keyword.
  private static final EnumSet<TokenKind> MATCH_SUBJECT_START_SET =
      EnumSet.of(
          TokenKind.IDENTIFIER,
          TokenKind.INT,
          TokenKind.FLOAT,
          TokenKind.STRING,
          TokenKind.LBRACE,
          TokenKind.TILDE,
          TokenKind.LAMBDA);

  private static final String MATCH_SOFT_KEYWORD = "match";
  private static final String CASE_SOFT_KEYWORD = "case";

  /** Current lookahead token. May be mutated by the parser. */
  private final Lexer token; // token.kind is a prettier alias for lexer.kind

  private final FileOptions options;

  private final Lexer lexer;
  private final FileLocations locs;
  private final List<SyntaxError> errors;

  // End offset of the most recently consumed token.
  private int lastTokenEnd;

  private static final ImmutableMap<TokenKind, TokenKind> augmentedAssignments =
      new ImmutableMap.Builder<TokenKind, TokenKind>()
          .put(TokenKind.PLUS_EQUALS, TokenKind.PLUS)
          .put(TokenKind.MINUS_EQUALS, TokenKind.MINUS)
          .put(TokenKind.STAR_EQUALS, TokenKind.STAR)
          .put(TokenKind.SLASH_EQUALS, TokenKind.SLASH)
          .put(TokenKind.SLASH_SLASH_EQUALS, TokenKind.SLASH_SLASH)
          .put(TokenKind.PERCENT_EQUALS, TokenKind.PERCENT)
          .put(TokenKind.AMPERSAND_EQUALS, TokenKind.AMPERSAND)
          .put(TokenKind.CARET_EQUALS, TokenKind.CARET)
          .put(TokenKind.PIPE_EQUALS, TokenKind.PIPE)
          .put(TokenKind.GREATER_GREATER_EQUALS, TokenKind.GREATER_GREATER)
          .put(TokenKind.LESS_LESS_EQUALS, TokenKind.LESS_LESS)
          .buildOrThrow();

  /**
   * Highest precedence goes last. Based on:
   * https://docs.python.org/3/reference/expressions.html#operator-precedence
   *
   * <p>Unary minus, plus and tilde, and the power operator, bind tighter than all of these and are
   * handled by {@link #parseUnary}.
   */
  private static final List<EnumSet<TokenKind>> operatorPrecedence =
      ImmutableList.of(
          EnumSet.of(TokenKind.OR),
          EnumSet.of(TokenKind.AND),
          EnumSet.of(TokenKind.NOT),
          EnumSet.of(
              TokenKind.EQUALS_EQUALS,
              TokenKind.NOT_EQUALS,
              TokenKind.LESS,
              TokenKind.LESS_EQUALS,
              TokenKind.GREATER,
              TokenKind.GREATER_EQUALS,
              TokenKind.IN,
              TokenKind.NOT_IN,
              TokenKind.IS,
              TokenKind.IS_NOT),
          EnumSet.of(TokenKind.PIPE),
          EnumSet.of(TokenKind.CARET),
          EnumSet.of(TokenKind.AMPERSAND),
          EnumSet.of(TokenKind.GREATER_GREATER, TokenKind.LESS_LESS),
          EnumSet.of(TokenKind.MINUS, TokenKind.PLUS),
          EnumSet.of(
              TokenKind.SLASH,
              TokenKind.SLASH_SLASH,
              TokenKind.STAR,
              TokenKind.PERCENT,
              TokenKind.AT));

  private int errorsCount;
  private boolean recoveryMode; // stop reporting errors until next statement

  // Intern string literals, as some files contain many literals for the same string.
  private final Map<String, String> stringInterner = new HashMap<>();

  private Parser(Lexer lexer, List<SyntaxError> errors, FileOptions options) {
    this.lexer = lexer;
    this.locs = lexer.locs;
    this.errors = errors;
    this.token = lexer;
    this.options = options;
    nextToken();
  }

  private String intern(String s) {
    String prev = stringInterner.putIfAbsent(s, s);
    return prev != null ? prev : s;
  }

  // Returns a token's string form as used in error messages.
  private static String tokenString(TokenKind kind, @Nullable Object value) {
    return kind == TokenKind.STRING
        ? "\"" + value + "\""
        : value == null ? kind.toString() : value.toString();
  }

  // Main entry point for parsing a file.
  static SourceFile parseFile(ParserInput input, FileOptions options) {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, options, errors);
    Parser parser = new Parser(lexer, errors, options);
    ImmutableList<Statement> statements = parser.parseFileInput();
    return SourceFile.create(
        lexer.locs, statements, options, errors, input.getContent().length);
  }

  /** Parses an expression, possibly preceded or followed by whitespace. */
  static Expression parseExpression(ParserInput input, FileOptions options)
      throws SyntaxError.Exception {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, options, errors);
    Parser parser = new Parser(lexer, errors, options);
    Expression result = null;
    try {
      result = parser.parseExpr();
      while (parser.token.kind == TokenKind.NEWLINE) {
        parser.nextToken();
      }
      parser.expect(TokenKind.EOF);
    } catch (StackOverflowError ex) {
      // See rationale at parseFileInput.
      parser.reportError(
          lexer.end,
          "internal error: stack overflow while parsing expression <<%s>>.\n%s",
          new String(input.getContent()),
          Throwables.getStackTraceAsString(ex));
    }
    if (!errors.isEmpty()) {
      throw new SyntaxError.Exception(errors);
    }
    return result;
  }

  // stmt = simple_stmt
  //      | compound_stmt
  private void parseStatement(ImmutableList.Builder<Statement> list) {
    switch (token.kind) {
      case DEF:
        list.add(parseDefStatement(token.start, ImmutableList.of()));
        break;
      case CLASS:
        list.add(parseClassStatement(token.start, ImmutableList.of()));
        break;
      case AT:
        list.add(parseDecorated());
        break;
      case IF:
        list.add(parseIfStatement());
        break;
      case FOR:
        list.add(parseForStatement());
        break;
      case WHILE:
        list.add(parseWhileStatement());
        break;
      case TRY:
        list.add(parseTryStatement());
        break;
      case WITH:
        list.add(parseWithStatement());
        break;
      case IDENTIFIER:
        if (options.allowMatchStatements() && MATCH_SOFT_KEYWORD.equals(token.value)) {
          int matchOffset = token.start;
          Expression head = parseExpr();
          Expression subject = matchSubject(head);
          if (subject != null) {
            list.add(parseMatchStatementTail(matchOffset, subject));
          } else {
            parseSimpleStatement(list, head);
          }
          break;
        }
        parseSimpleStatement(list, null);
        break;
      default:
        parseSimpleStatement(list, null);
    }
  }

  // Parses every kind of expression, including unparenthesized tuples.
  //
  // In Python the corresponding grammar production is called `expressions` (or previously, in
  // Python 3.8 and older, `testlist`).
  //
  // In many cases we need to use parseTest() in place of parseExpr() to avoid ambiguity, e.g.:
  //
  //   f(x, y)  vs  f((x, y))
  private Expression parseExpr() {
    Expression e = parseTest();
    if (token.kind != TokenKind.COMMA) {
      return e;
    }

    // unparenthesized tuple
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(e);
    parseExprList(elems);
    return new ListExpression(locs, /* isTuple= */ true, -1, elems.build(), -1);
  }

  @FormatMethod
  private void reportError(int offset, String format, Object... args) {
    errorsCount++;
    // Limit the number of reported errors to avoid spamming output.
    if (errorsCount <= 5) {
      Location location = locs.getLocation(offset);
      errors.add(new SyntaxError(location, String.format(format, args)));
    }
  }

  private void syntaxError(String message) {
    syntaxError(token.start, token.kind, token.value, message);
  }

  private void syntaxError(int offset, TokenKind tokenKind, Object tokenValue, String message) {
    if (!recoveryMode) {
      if (tokenKind == TokenKind.INDENT) {
        reportError(offset, "indentation error");
      } else {
        reportError(
            offset, "syntax error at '%s': %s", tokenString(tokenKind, tokenValue), message);
      }
      recoveryMode = true;
    }
  }

  // Consumes the current token and returns its position, like nextToken.
  // Reports a syntax error if the new token is not of the expected kind.
  private int expect(TokenKind kind) {
    if (token.kind != kind) {
      syntaxError("expected " + kind);
    }
    return nextToken();
  }

  // Like expect, but stops recovery mode if the token was expected.
  private int expectAndRecover(TokenKind kind) {
    if (token.kind != kind) {
      syntaxError("expected " + kind);
    } else {
      recoveryMode = false;
    }
    return nextToken();
  }

  // Consumes the soft keyword 'name', an identifier, and returns its position.
  private int expectSoftKeyword(String name) {
    if (token.kind != TokenKind.IDENTIFIER || !name.equals(token.value)) {
      syntaxError("expected '" + name + "'");
    }
    return nextToken();
  }

  // Consumes tokens past the first token belonging to terminatingTokens.
  // It returns the end offset of the terminating token.
  private int syncPast(EnumSet<TokenKind> terminatingTokens) {
    Preconditions.checkState(terminatingTokens.contains(TokenKind.EOF));
    while (!terminatingTokens.contains(token.kind)) {
      nextToken();
    }
    int end = token.end;
    // read past the synchronization token
    nextToken();
    return end;
  }

  /**
   * Consume tokens until we reach the first token that has a kind that is in the set of
   * terminatingTokens.
   *
   * @return the end offset of the last token before the terminating token.
   */
  private int syncTo(EnumSet<TokenKind> terminatingTokens) {
    // EOF must be in the set to prevent an infinite loop
    Preconditions.checkState(terminatingTokens.contains(TokenKind.EOF));
    // read past the problematic token
    int previous = token.end;
    nextToken();
    int current = previous;
    while (!terminatingTokens.contains(token.kind)) {
      nextToken();
      previous = current;
      current = token.end;
    }
    return previous;
  }

  private int nextToken() {
    int prev = token.start;
    lastTokenEnd = token.end;
    if (token.kind != TokenKind.EOF) {
      lexer.nextToken();
    }
    return prev;
  }

  // Returns an "Identifier" whose content is the input from start to end.
  private Identifier makeErrorExpression(int start, int end) {
    // It is convenient for parseIdent to return an Identifier even when it fails.
    return new Identifier(locs, lexer.bufferSlice(start, Math.max(start, end)), start);
  }

  // arg = IDENTIFIER '=' test
  //     | expr
  //     | *args
  //     | **kwargs
  private Argument parseArgument() {
    Expression expr;

    // parse **expr
    if (token.kind == TokenKind.STAR_STAR) {
      int starStarOffset = nextToken();
      expr = parseTest();
      return new Argument.StarStar(locs, starStarOffset, expr);
    }

    // parse *expr
    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      expr = parseTest();
      return new Argument.Star(locs, starOffset, expr);
    }

    // IDENTIFIER  or  IDENTIFIER = test
    expr = parseTest();
    if (expr instanceof Identifier && token.kind == TokenKind.EQUALS) {
      // parse a named argument
      nextToken();
      Expression arg = parseTest();
      return new Argument.Keyword(locs, (Identifier) expr, arg);
    }

    // parse a positional argument
    return new Argument.Positional(locs, expr);
  }

  // param = IDENTIFIER [':' test] [ '=' test ]
  //       | '*' [IDENTIFIER [':' test]]
  //       | '**' IDENTIFIER [':' test]
  // Annotations are only available on def statements (not lambdas).
  private Parameter parseParameter(boolean defStatement) {
    Expression type = null;

    // **kwargs
    if (token.kind == TokenKind.STAR_STAR) {
      int starStarOffset = nextToken();
      Identifier id = parseIdent();
      if (defStatement) {
        type = maybeParseAnnotation();
      }
      return new Parameter.StarStar(locs, starStarOffset, id, type);
    }

    // * or *args
    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      if (token.kind == TokenKind.IDENTIFIER) {
        Identifier id = parseIdent();
        if (defStatement) {
          type = maybeParseAnnotation();
        }
        return new Parameter.Star(locs, starOffset, id, type);
      }
      return new Parameter.Star(locs, starOffset, null, null);
    }

    // name
    Identifier id = parseIdent();

    // name: type
    if (defStatement) {
      type = maybeParseAnnotation();
    }

    // name=default
    if (token.kind == TokenKind.EQUALS) {
      nextToken();
      Expression expr = parseTest();
      return new Parameter.Optional(locs, id, type, expr);
    }

    return new Parameter.Mandatory(locs, id, type);
  }

  @Nullable
  private Expression maybeParseAnnotation() {
    if (token.kind == TokenKind.COLON) {
      nextToken();
      return parseTest();
    }
    return null;
  }

  // call_suffix = '(' arg_list? ')'
  //             | '(' test comprehension_suffix ')'
  private Expression parseCallSuffix(Expression fn) {
    ImmutableList<Argument> args = ImmutableList.of();
    int lparenOffset = expect(TokenKind.LPAREN);
    if (token.kind != TokenKind.RPAREN) {
      args = parseArguments(lparenOffset);
    }
    int rparenOffset = expect(TokenKind.RPAREN);
    return new CallExpression(locs, fn, args, rparenOffset);
  }

  // Parse a list of call arguments.
  //
  // arg_list = ( (arg ',')* arg ','? )?
  private ImmutableList<Argument> parseArguments(int lparenOffset) {
    boolean seenArg = false;
    ImmutableList.Builder<Argument> list = ImmutableList.builder();
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      if (seenArg) {
        expect(TokenKind.COMMA);
        // If nonempty, the list may end with a comma.
        if (token.kind == TokenKind.RPAREN) {
          break;
        }
      }
      Argument arg = parseArgument();
      if (!seenArg && token.kind == TokenKind.FOR && arg instanceof Argument.Positional) {
        // f(expr for vars in expr): a generator expression as the sole argument.
        Expression gen =
            parseComprehensionSuffix(
                lparenOffset, arg.getValue(), TokenKind.RPAREN, Comprehension.Type.GENERATOR);
        return ImmutableList.of(new Argument.Positional(locs, gen));
      }
      list.add(arg);
      seenArg = true;
    }
    return list.build();
  }

  // selector_suffix = '.' IDENTIFIER
  private Expression parseSelectorSuffix(Expression e) {
    int dotOffset = expect(TokenKind.DOT);
    if (token.kind == TokenKind.IDENTIFIER) {
      Identifier id = parseIdent();
      return new DotExpression(locs, e, dotOffset, id);
    }

    syntaxError("expected identifier after dot");
    syncTo(EXPR_TERMINATOR_SET);
    return e;
  }

  // expr_list parses a comma-separated list of expression. It assumes that the
  // first expression was already parsed, so it starts with a comma.
  // It is used to parse tuples and list elements.
  //
  // expr_list = ( ',' expr )* ','?
  private void parseExprList(ImmutableList.Builder<Expression> list) {
    //  terminating tokens for an expression list
    while (token.kind == TokenKind.COMMA) {
      expect(TokenKind.COMMA);
      if (EXPR_LIST_TERMINATOR_SET.contains(token.kind)) {
        break;
      }
      list.add(parseTest());
    }
  }

  // dict_entry_list = ( (dict_entry ',')* dict_entry ','? )?
  private List<DictExpression.Entry> parseDictEntryList() {
    ImmutableList.Builder<DictExpression.Entry> list = ImmutableList.builder();
    // the terminating token for a dict entry list
    while (token.kind != TokenKind.RBRACE) {
      list.add(parseDictEntry());
      if (token.kind == TokenKind.COMMA) {
        nextToken();
      } else {
        break;
      }
    }
    return list.build();
  }

  // dict_entry = test ':' test
  private DictExpression.Entry parseDictEntry() {
    Expression key = parseTest();
    int colonOffset = expect(TokenKind.COLON);
    Expression value = parseTest();
    return new DictExpression.Entry(locs, key, colonOffset, value);
  }

  // expr = STRING+
  // Adjacent string literals are concatenated.
  private StringLiteral parseStringLiteral() {
    Preconditions.checkState(token.kind == TokenKind.STRING);
    int start = token.start;
    StringBuilder value = new StringBuilder((String) token.value);
    int end = token.end;
    nextToken();
    while (token.kind == TokenKind.STRING) {
      value.append((String) token.value);
      end = token.end;
      nextToken();
    }
    return new StringLiteral(locs, start, intern(value.toString()), end);
  }

  //  primary = INT
  //          | FLOAT
  //          | STRING
  //          | IDENTIFIER
  //          | list_expression
  //          | '(' ')'                    // a tuple with zero elements
  //          | '(' expr ')'               // a parenthesized expression
  //          | '(' test comprehension_suffix ')'
  //          | dict_expression
  private Expression parsePrimary() {
    switch (token.kind) {
      case INT:
        {
          IntLiteral literal =
              new IntLiteral(locs, token.raw, token.start, (Number) token.value);
          nextToken();
          return literal;
        }

      case FLOAT:
        {
          FloatLiteral literal =
              new FloatLiteral(locs, token.raw, token.start, (double) token.value);
          nextToken();
          return literal;
        }

      case STRING:
        return parseStringLiteral();

      case IDENTIFIER:
        return parseIdent();

      case LBRACKET: // [...]
        return parseListMaker();

      case LBRACE: // {...}
        return parseDictExpression();

      case LPAREN:
        {
          int lparenOffset = nextToken();

          // empty tuple: ()
          if (token.kind == TokenKind.RPAREN) {
            int rparen = nextToken();
            return new ListExpression(
                locs, /* isTuple= */ true, lparenOffset, ImmutableList.of(), rparen);
          }

          Expression e = token.kind == TokenKind.YIELD ? parseYield() : parseTest();

          // parenthesized expression: (e)
          if (token.kind == TokenKind.RPAREN) {
            nextToken();
            return e;
          }

          // non-empty tuple: (e,) or (e, ..., e)
          if (token.kind == TokenKind.COMMA) {
            ImmutableList.Builder<Expression> elems = ImmutableList.builder();
            elems.add(e);
            parseExprList(elems);
            int rparenOffset = expect(TokenKind.RPAREN);
            return new ListExpression(
                locs, /* isTuple= */ true, lparenOffset, elems.build(), rparenOffset);
          }

          // (expr for vars in expr): generator expression
          if (token.kind == TokenKind.FOR) {
            Expression gen =
                parseComprehensionSuffix(
                    lparenOffset, e, TokenKind.RPAREN, Comprehension.Type.GENERATOR);
            expect(TokenKind.RPAREN);
            return gen;
          }

          expect(TokenKind.RPAREN);
          int end = syncTo(EXPR_TERMINATOR_SET);
          return makeErrorExpression(lparenOffset, end);
        }

      default:
        {
          int start = token.start;
          syntaxError("expected expression");
          int end = syncTo(EXPR_TERMINATOR_SET);
          return makeErrorExpression(start, end);
        }
    }
  }

  // primary_with_suffix = primary (selector_suffix | slice_suffix | call_suffix)*
  private Expression parsePrimaryWithSuffix() {
    Expression e = parsePrimary();
    while (true) {
      if (token.kind == TokenKind.DOT) {
        e = parseSelectorSuffix(e);
      } else if (token.kind == TokenKind.LBRACKET) {
        e = parseSliceSuffix(e);
      } else if (token.kind == TokenKind.LPAREN) {
        e = parseCallSuffix(e);
      } else {
        return e;
      }
    }
  }

  // unary = ('-' | '+' | '~') unary
  //       | primary_with_suffix ['**' unary]
  private Expression parseUnary() {
    if (token.kind == TokenKind.MINUS
        || token.kind == TokenKind.PLUS
        || token.kind == TokenKind.TILDE) {
      TokenKind op = token.kind;
      int offset = nextToken();
      Expression x = parseUnary();
      return new UnaryOperatorExpression(locs, op, offset, x);
    }
    Expression x = parsePrimaryWithSuffix();
    if (token.kind == TokenKind.STAR_STAR) {
      int opOffset = nextToken();
      Expression y = parseUnary();
      return new BinaryOperatorExpression(locs, x, TokenKind.STAR_STAR, opOffset, y);
    }
    return x;
  }

  // slice_suffix = '[' expr? ':' expr?  ':' expr? ']'
  //              | '[' expr? ':' expr? ']'
  //              | '[' expr ']'
  private Expression parseSliceSuffix(Expression e) {
    int lbracketOffset = expect(TokenKind.LBRACKET);
    Expression start = null;
    Expression end = null;
    Expression step = null;

    if (token.kind != TokenKind.COLON) {
      start = parseExpr();

      // index x[i]
      if (token.kind == TokenKind.RBRACKET) {
        int rbracketOffset = expect(TokenKind.RBRACKET);
        return new IndexExpression(locs, e, lbracketOffset, start, rbracketOffset);
      }
    }

    // slice or substring x[i:j] or x[i:j:k]
    expect(TokenKind.COLON);
    if (token.kind != TokenKind.COLON && token.kind != TokenKind.RBRACKET) {
      end = parseTest();
    }
    if (token.kind == TokenKind.COLON) {
      expect(TokenKind.COLON);
      if (token.kind != TokenKind.RBRACKET) {
        step = parseTest();
      }
    }
    int rbracketOffset = expect(TokenKind.RBRACKET);
    return new SliceExpression(locs, e, lbracketOffset, start, end, step, rbracketOffset);
  }

  // Equivalent to 'exprlist' rule in Python grammar.
  // loop_variables = primary_with_suffix ( ',' primary_with_suffix )* ','?
  private Expression parseForLoopVariables() {
    // We cannot reuse parseExpr because it would parse the 'in' operator.
    // e.g.  "for i in e: pass"  -> we want to parse only "i" here.
    Expression e1 = parsePrimaryWithSuffix();
    if (token.kind != TokenKind.COMMA) {
      return e1;
    }

    // unparenthesized tuple
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(e1);
    while (token.kind == TokenKind.COMMA) {
      expect(TokenKind.COMMA);
      if (EXPR_LIST_TERMINATOR_SET.contains(token.kind)) {
        break;
      }
      elems.add(parsePrimaryWithSuffix());
    }
    return new ListExpression(locs, /* isTuple= */ true, -1, elems.build(), -1);
  }

  // comprehension_suffix = 'FOR' loop_variables 'IN' expr comprehension_suffix
  //                      | 'IF' expr comprehension_suffix
  //                      | ']' | '}' | ')'
  private Expression parseComprehensionSuffix(
      int loffset, Node body, TokenKind closingBracket, Comprehension.Type type) {
    ImmutableList.Builder<Comprehension.Clause> clauses = ImmutableList.builder();
    while (true) {
      if (token.kind == TokenKind.FOR) {
        int forOffset = nextToken();
        Expression vars = parseForLoopVariables();
        expect(TokenKind.IN);
        // The expression cannot be a ternary expression ('x if y else z') due to
        // conflicts in Python grammar ('if' is used by the comprehension).
        Expression seq = parseTest(0);
        clauses.add(new Comprehension.For(locs, forOffset, vars, seq));
      } else if (token.kind == TokenKind.IF) {
        int ifOffset = nextToken();
        // [x for x in li if 1, 2]  # parse error
        // [x for x in li if (1, 2)]  # ok
        Expression cond = parseTestNoCond();
        clauses.add(new Comprehension.If(locs, ifOffset, cond));
      } else if (token.kind == closingBracket) {
        break;
      } else {
        syntaxError("expected '" + closingBracket + "', 'for' or 'if'");
        int end = syncPast(LIST_TERMINATOR_SET);
        return makeErrorExpression(loffset, end);
      }
    }

    if (type == Comprehension.Type.GENERATOR) {
      // The closing parenthesis is consumed by the caller, which may be a call.
      return new Comprehension(locs, type, loffset, body, clauses.build(), token.start);
    }
    int roffset = expect(closingBracket);
    return new Comprehension(locs, type, loffset, body, clauses.build(), roffset);
  }

  // list_maker = '[' ']'
  //            | '[' expr ']'
  //            | '[' expr expr_list ']'
  //            | '[' expr comprehension_suffix ']'
  private Expression parseListMaker() {
    int lbracketOffset = expect(TokenKind.LBRACKET);
    if (token.kind == TokenKind.RBRACKET) { // empty List
      int rbracketOffset = nextToken();
      return new ListExpression(
          locs, /* isTuple= */ false, lbracketOffset, ImmutableList.of(), rbracketOffset);
    }

    Expression expression = parseTest();
    switch (token.kind) {
      case RBRACKET:
        // [e], singleton list
        {
          int rbracketOffset = nextToken();
          return new ListExpression(
              locs,
              /* isTuple= */ false,
              lbracketOffset,
              ImmutableList.of(expression),
              rbracketOffset);
        }

      case FOR:
        // [e for x in y], list comprehension
        return parseComprehensionSuffix(
            lbracketOffset, expression, TokenKind.RBRACKET, Comprehension.Type.LIST);

      case COMMA:
        // [e, ...], list expression
        {
          ImmutableList.Builder<Expression> elems = ImmutableList.builder();
          elems.add(expression);
          parseExprList(elems);
          if (token.kind == TokenKind.RBRACKET) {
            int rbracketOffset = nextToken();
            return new ListExpression(
                locs, /* isTuple= */ false, lbracketOffset, elems.build(), rbracketOffset);
          }

          expect(TokenKind.RBRACKET);
          int end = syncPast(LIST_TERMINATOR_SET);
          return makeErrorExpression(lbracketOffset, end);
        }

      default:
        {
          syntaxError("expected ',', 'for' or ']'");
          int end = syncPast(LIST_TERMINATOR_SET);
          return makeErrorExpression(lbracketOffset, end);
        }
    }
  }

  // dict_expression = '{' '}'
  //                 | '{' dict_entry_list '}'
  //                 | '{' dict_entry comprehension_suffix '}'
  private Expression parseDictExpression() {
    int lbraceOffset = expect(TokenKind.LBRACE);
    if (token.kind == TokenKind.RBRACE) { // empty Dict
      int rbraceOffset = nextToken();
      return new DictExpression(locs, lbraceOffset, ImmutableList.of(), rbraceOffset);
    }

    DictExpression.Entry entry = parseDictEntry();
    if (token.kind == TokenKind.FOR) {
      // Dict comprehension
      return parseComprehensionSuffix(
          lbraceOffset, entry, TokenKind.RBRACE, Comprehension.Type.DICT);
    }

    ImmutableList.Builder<DictExpression.Entry> entries = ImmutableList.builder();
    entries.add(entry);
    if (token.kind == TokenKind.COMMA) {
      expect(TokenKind.COMMA);
      entries.addAll(parseDictEntryList());
    }
    if (token.kind == TokenKind.RBRACE) {
      int rbraceOffset = nextToken();
      return new DictExpression(locs, lbraceOffset, entries.build(), rbraceOffset);
    }

    expect(TokenKind.RBRACE);
    int end = syncPast(DICT_TERMINATOR_SET);
    return makeErrorExpression(lbraceOffset, end);
  }

  private Identifier parseIdent() {
    if (token.kind != TokenKind.IDENTIFIER) {
      int start = token.start;
      int end = expect(TokenKind.IDENTIFIER);
      return makeErrorExpression(start, end);
    }

    String name = (String) token.value;
    int offset = nextToken();
    return new Identifier(locs, name, offset);
  }

  // binop_expression = binop_expression OP binop_expression
  //                  | parseUnary
  // This function takes care of precedence between operators (see operatorPrecedence for
  // the order), and it assumes left-to-right associativity. Comparison chains such as
  // 'a < b < c' are kept as nested binary operations.
  private Expression parseBinOpExpression(int prec) {
    Expression x = parseTest(prec + 1);
    // The loop is not strictly needed, but it prevents risks of stack overflow. Depth is
    // limited to number of different precedence levels (operatorPrecedence.size()).
    for (; ; ) {
      if (token.kind == TokenKind.NOT) {
        // If NOT appears when we expect a binary operator, it must be followed by IN.
        // Since the code expects every operator to be a single token, we push a NOT_IN token.
        expect(TokenKind.NOT);
        if (token.kind != TokenKind.IN) {
          syntaxError("expected 'in'");
        }
        token.kind = TokenKind.NOT_IN;
      }

      TokenKind op = token.kind;
      if (!operatorPrecedence.get(prec).contains(op)) {
        return x;
      }

      int opOffset = nextToken();
      if (op == TokenKind.IS && token.kind == TokenKind.NOT) {
        op = TokenKind.IS_NOT;
        nextToken();
      }
      Expression y = parseTest(prec + 1);
      x = new BinaryOperatorExpression(locs, x, op, opOffset, y);
    }
  }

  // Parses any expression except for an unparenthesized tuple.
  //
  // In Python the corresponding grammar production is called `expression` (or previously, in
  // Python 3.8 and older, `test`).
  private Expression parseTest() {
    int start = token.start;
    if (token.kind == TokenKind.LAMBDA) {
      return parseLambda(/* allowCond= */ true);
    }

    Expression expr = parseTest(0);
    if (token.kind == TokenKind.IF) {
      nextToken();
      Expression condition = parseTest(0);
      if (token.kind == TokenKind.ELSE) {
        nextToken();
        Expression elseClause = parseTest();
        return new ConditionalExpression(locs, expr, condition, elseClause);
      } else {
        reportError(start, "missing else clause in conditional expression or semicolon before if");
        return expr; // Try to recover from error: drop the if and the expression after it.
      }
    }
    return expr;
  }

  private Expression parseTest(int prec) {
    if (prec >= operatorPrecedence.size()) {
      return parseUnary();
    }
    if (token.kind == TokenKind.NOT && operatorPrecedence.get(prec).contains(TokenKind.NOT)) {
      return parseNotExpression(prec);
    }
    return parseBinOpExpression(prec);
  }

  // parseLambda parses a lambda expression.
  // The allowCond flag allows the body to be an 'a if b else c' conditional.
  private LambdaExpression parseLambda(boolean allowCond) {
    int lambdaOffset = expect(TokenKind.LAMBDA);
    ImmutableList<Parameter> params = parseParameters(/* defStatement= */ false);
    expect(TokenKind.COLON);
    Expression body = allowCond ? parseTest() : parseTestNoCond();
    return new LambdaExpression(locs, lambdaOffset, params, body);
  }

  // parseTestNoCond parses a single-component expression without
  // consuming a trailing 'if expr else expr'.
  private Expression parseTestNoCond() {
    if (token.kind == TokenKind.LAMBDA) {
      return parseLambda(/* allowCond= */ false);
    }
    return parseTest(0);
  }

  // not_expr = 'not' expr
  private Expression parseNotExpression(int prec) {
    int notOffset = expect(TokenKind.NOT);
    Expression x = parseTest(prec);
    return new UnaryOperatorExpression(locs, TokenKind.NOT, notOffset, x);
  }

  // yield_expr = 'yield' expr
  private Expression parseYield() {
    int yieldOffset = expect(TokenKind.YIELD);
    if (STATEMENT_TERMINATOR_SET.contains(token.kind) || token.kind == TokenKind.RPAREN) {
      syntaxError("a yield expression requires a value");
      return makeErrorExpression(yieldOffset, lastTokenEnd);
    }
    Expression x = parseExpr();
    return new UnaryOperatorExpression(locs, TokenKind.YIELD, yieldOffset, x);
  }

  // file_input = ('\n' | stmt)* EOF
  // The terminating newline is injected by the lexer even if not present in the input.
  private ImmutableList<Statement> parseFileInput() {
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    try {
      while (token.kind != TokenKind.EOF) {
        if (token.kind == TokenKind.NEWLINE) {
          expectAndRecover(TokenKind.NEWLINE);
        } else if (recoveryMode) {
          // If there was a parse error, we want to recover here
          // before starting a new top-level statement.
          syncTo(STATEMENT_TERMINATOR_SET);
          recoveryMode = false;
        } else {
          parseStatement(list);
        }
      }
    } catch (StackOverflowError ex) {
      // JVM threads have very limited stack, and deeply nested inputs can
      // easily cause the parser to consume all available stack. It is hard
      // to anticipate all the possible recursions in the parser, especially
      // when considering error recovery.
      //
      // So, for robustness, the parser treats StackOverflowError as a parse
      // error.
      reportError(
          token.end,
          "internal error: stack overflow in parser while reading %s.\n%s",
          locs.file(),
          Throwables.getStackTraceAsString(ex));
    }
    return list.build();
  }

  // simple_stmt = small_stmt (';' small_stmt)* ';'? NEWLINE
  private void parseSimpleStatement(
      ImmutableList.Builder<Statement> list, @Nullable Expression head) {
    list.add(parseSmallStatement(head));

    while (token.kind == TokenKind.SEMI) {
      nextToken();
      if (token.kind == TokenKind.NEWLINE) {
        break;
      }
      list.add(parseSmallStatement(null));
    }
    expectAndRecover(TokenKind.NEWLINE);
  }

  //     small_stmt = assign_stmt
  //                | expr
  //                | return_stmt | raise_stmt | del_stmt | assert_stmt
  //                | global_stmt | import_stmt
  //                | BREAK | CONTINUE | PASS
  //
  //     assign_stmt = expr ('=' | augassign) expr
  //                 | expr ':' test ['=' expr]
  //
  //     augassign = '+=' | '-=' | '*=' | '/=' | '%=' | '//=' | '&=' | '|=' | '^=' |'<<=' | '>>='
  //
  // If head is non-null, it is the already parsed first expression of the statement.
  private Statement parseSmallStatement(@Nullable Expression head) {
    if (head == null) {
      switch (token.kind) {
        case RETURN:
          return parseReturnStatement();
        case BREAK:
        case CONTINUE:
        case PASS:
          {
            TokenKind kind = token.kind;
            int offset = nextToken();
            return new FlowStatement(locs, kind, offset);
          }
        case RAISE:
          return parseRaiseStatement();
        case DEL:
          return parseDelStatement();
        case ASSERT:
          return parseAssertStatement();
        case GLOBAL:
        case NONLOCAL:
          return parseGlobalStatement();
        case IMPORT:
          return parseImportStatement();
        case FROM:
          return parseFromImportStatement();
        default:
          break;
      }
    }

    Expression lhs = head;
    if (lhs == null) {
      lhs = token.kind == TokenKind.YIELD ? parseYield() : parseExpr();
    }

    // lhs: type [= rhs]
    if (token.kind == TokenKind.COLON) {
      int colonOffset = nextToken();
      Expression type = parseTest();
      if (token.kind == TokenKind.EQUALS) {
        int opOffset = nextToken();
        Expression rhs = parseAssignmentValue();
        return new AssignmentStatement(locs, lhs, type, null, opOffset, rhs);
      }
      return new AssignmentStatement(locs, lhs, type, null, colonOffset, null);
    }

    // lhs = rhs  or  lhs += rhs
    TokenKind op = augmentedAssignments.get(token.kind);
    if (token.kind == TokenKind.EQUALS || op != null) {
      int opOffset = nextToken();
      Expression rhs = parseAssignmentValue();
      if (token.kind == TokenKind.EQUALS) {
        syntaxError("chained assignment is not supported");
      }
      // op == null for ordinary assignment.
      return new AssignmentStatement(locs, lhs, null, op, opOffset, rhs);
    } else {
      return new ExpressionStatement(locs, lhs);
    }
  }

  private Expression parseAssignmentValue() {
    return token.kind == TokenKind.YIELD ? parseYield() : parseExpr();
  }

  // return_stmt = RETURN [expr]
  private ReturnStatement parseReturnStatement() {
    int returnOffset = expect(TokenKind.RETURN);

    Expression result = null;
    if (!STATEMENT_TERMINATOR_SET.contains(token.kind)) {
      result = parseExpr();
    }
    return new ReturnStatement(locs, returnOffset, result);
  }

  // raise_stmt = RAISE [test ['from' test]]
  private RaiseStatement parseRaiseStatement() {
    int raiseOffset = expect(TokenKind.RAISE);
    Expression exception = null;
    Expression cause = null;
    if (!STATEMENT_TERMINATOR_SET.contains(token.kind)) {
      exception = parseTest();
      if (token.kind == TokenKind.FROM) {
        nextToken();
        cause = parseTest();
      }
    }
    return new RaiseStatement(locs, raiseOffset, exception, cause);
  }

  // del_stmt = DEL test (',' test)* ','?
  private DelStatement parseDelStatement() {
    int delOffset = expect(TokenKind.DEL);
    ImmutableList.Builder<Expression> targets = ImmutableList.builder();
    targets.add(parseTest());
    parseExprList(targets);
    return new DelStatement(locs, delOffset, targets.build());
  }

  // assert_stmt = ASSERT test [',' test]
  private AssertStatement parseAssertStatement() {
    int assertOffset = expect(TokenKind.ASSERT);
    Expression condition = parseTest();
    Expression message = null;
    if (token.kind == TokenKind.COMMA) {
      nextToken();
      message = parseTest();
    }
    return new AssertStatement(locs, assertOffset, condition, message);
  }

  // global_stmt = (GLOBAL | NONLOCAL) IDENTIFIER (',' IDENTIFIER)*
  private GlobalStatement parseGlobalStatement() {
    TokenKind kind = token.kind;
    int offset = nextToken();
    ImmutableList.Builder<Identifier> names = ImmutableList.builder();
    names.add(parseIdent());
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      names.add(parseIdent());
    }
    return new GlobalStatement(locs, kind, offset, names.build());
  }

  // import_stmt = IMPORT dotted_name [AS IDENTIFIER] (',' dotted_name [AS IDENTIFIER])*
  private ImportStatement parseImportStatement() {
    int importOffset = expect(TokenKind.IMPORT);
    ImmutableList.Builder<ImportStatement.Binding> bindings = ImmutableList.builder();
    do {
      if (token.kind == TokenKind.COMMA) {
        nextToken();
      }
      Identifier first = parseIdent();
      List<String> parts = new ArrayList<>();
      parts.add(first.getName());
      while (token.kind == TokenKind.DOT) {
        nextToken();
        parts.add(parseIdent().getName());
      }
      String original = Joiner.on('.').join(parts);
      // 'import a.b' binds 'a'; 'import a.b as c' binds 'c'.
      Identifier local = first;
      if (token.kind == TokenKind.AS) {
        nextToken();
        local = parseIdent();
      }
      bindings.add(new ImportStatement.Binding(locs, local, intern(original)));
    } while (token.kind == TokenKind.COMMA);
    return new ImportStatement(locs, importOffset, null, bindings.build(), lastTokenEnd);
  }

  // from_stmt = FROM ('.'* dotted_name | '.'+) IMPORT ('*' | import_as_names
  //                                                  | '(' import_as_names ','? ')')
  // import_as_names = IDENTIFIER [AS IDENTIFIER] (',' IDENTIFIER [AS IDENTIFIER])*
  private ImportStatement parseFromImportStatement() {
    int fromOffset = expect(TokenKind.FROM);
    StringBuilder module = new StringBuilder();
    while (token.kind == TokenKind.DOT) {
      module.append('.');
      nextToken();
    }
    if (token.kind == TokenKind.IDENTIFIER) {
      module.append(parseIdent().getName());
      while (token.kind == TokenKind.DOT) {
        nextToken();
        module.append('.').append(parseIdent().getName());
      }
    }
    if (module.length() == 0) {
      syntaxError("expected module name");
    }
    expect(TokenKind.IMPORT);

    ImmutableList.Builder<ImportStatement.Binding> bindings = ImmutableList.builder();
    if (token.kind == TokenKind.STAR) {
      nextToken();
      return new ImportStatement(
          locs, fromOffset, intern(module.toString()), bindings.build(), lastTokenEnd);
    }
    boolean parenthesized = token.kind == TokenKind.LPAREN;
    if (parenthesized) {
      nextToken();
    }
    while (true) {
      Identifier original = parseIdent();
      Identifier local = original;
      if (token.kind == TokenKind.AS) {
        nextToken();
        local = parseIdent();
      }
      bindings.add(new ImportStatement.Binding(locs, local, original.getName()));
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
      if (parenthesized && token.kind == TokenKind.RPAREN) {
        break;
      }
    }
    if (parenthesized) {
      expect(TokenKind.RPAREN);
    }
    return new ImportStatement(
        locs, fromOffset, intern(module.toString()), bindings.build(), lastTokenEnd);
  }

  // decorated = ('@' test NEWLINE)+ (def_stmt | class_stmt)
  private Statement parseDecorated() {
    int startOffset = token.start;
    ImmutableList.Builder<Expression> decorators = ImmutableList.builder();
    while (token.kind == TokenKind.AT) {
      nextToken();
      decorators.add(parseTest());
      expectAndRecover(TokenKind.NEWLINE);
    }
    if (token.kind == TokenKind.CLASS) {
      return parseClassStatement(startOffset, decorators.build());
    }
    if (token.kind != TokenKind.DEF) {
      syntaxError("expected 'def' or 'class' after decorator");
    }
    return parseDefStatement(startOffset, decorators.build());
  }

  // if_stmt = IF expr ':' suite [ELIF expr ':' suite]* [ELSE ':' suite]?
  private IfStatement parseIfStatement() {
    int ifOffset = expect(TokenKind.IF);
    return parseIfStatementTail(TokenKind.IF, ifOffset);
  }

  // An 'elif' clause becomes an IfStatement, with token ELIF, that is the sole statement of the
  // else block of the preceding clause.
  private IfStatement parseIfStatementTail(TokenKind kind, int offset) {
    Expression cond = parseTest();
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList<Statement> elseBlock = null;
    if (token.kind == TokenKind.ELIF) {
      int elifOffset = expect(TokenKind.ELIF);
      elseBlock = ImmutableList.of(parseIfStatementTail(TokenKind.ELIF, elifOffset));
    } else if (token.kind == TokenKind.ELSE) {
      expect(TokenKind.ELSE);
      expect(TokenKind.COLON);
      elseBlock = parseSuite();
    }
    return new IfStatement(locs, kind, offset, cond, body, elseBlock);
  }

  @Nullable
  private ImmutableList<Statement> parseOptionalElse() {
    if (token.kind != TokenKind.ELSE) {
      return null;
    }
    expect(TokenKind.ELSE);
    expect(TokenKind.COLON);
    return parseSuite();
  }

  // for_stmt = FOR loop_variables IN expr ':' suite [ELSE ':' suite]
  private ForStatement parseForStatement() {
    int forOffset = expect(TokenKind.FOR);
    Expression vars = parseForLoopVariables();
    expect(TokenKind.IN);
    Expression collection = parseExpr();
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList<Statement> elseBlock = parseOptionalElse();
    return new ForStatement(locs, forOffset, vars, collection, body, elseBlock);
  }

  // while_stmt = WHILE test ':' suite [ELSE ':' suite]
  private WhileStatement parseWhileStatement() {
    int whileOffset = expect(TokenKind.WHILE);
    Expression condition = parseTest();
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList<Statement> elseBlock = parseOptionalElse();
    return new WhileStatement(locs, whileOffset, condition, body, elseBlock);
  }

  // def_stmt = DEF IDENTIFIER '(' parameters ')' ['->' test] ':' suite
  private DefStatement parseDefStatement(
      int startOffset, ImmutableList<Expression> decorators) {
    expect(TokenKind.DEF);
    Identifier ident = parseIdent();
    expect(TokenKind.LPAREN);
    ImmutableList<Parameter> params = parseParameters(/* defStatement= */ true);
    expect(TokenKind.RPAREN);
    Expression returnType = null;
    if (token.kind == TokenKind.ARROW) {
      nextToken();
      returnType = parseTest();
    }
    expect(TokenKind.COLON);
    ImmutableList<Statement> block = parseSuite();
    return new DefStatement(locs, startOffset, decorators, ident, params, returnType, block);
  }

  // class_stmt = CLASS IDENTIFIER ['(' arg_list ')'] ':' suite
  private ClassStatement parseClassStatement(
      int startOffset, ImmutableList<Expression> decorators) {
    expect(TokenKind.CLASS);
    Identifier ident = parseIdent();
    ImmutableList<Argument> bases = ImmutableList.of();
    if (token.kind == TokenKind.LPAREN) {
      int lparenOffset = nextToken();
      if (token.kind != TokenKind.RPAREN) {
        bases = parseArguments(lparenOffset);
      }
      expect(TokenKind.RPAREN);
    }
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    return new ClassStatement(locs, startOffset, decorators, ident, bases, body);
  }

  // try_stmt = TRY ':' suite
  //            (EXCEPT [test [AS IDENTIFIER]] ':' suite)*
  //            [ELSE ':' suite]
  //            [FINALLY ':' suite]
  private TryStatement parseTryStatement() {
    int tryOffset = expect(TokenKind.TRY);
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList.Builder<TryStatement.ExceptHandler> handlers = ImmutableList.builder();
    boolean hasHandler = false;
    while (token.kind == TokenKind.EXCEPT) {
      int exceptOffset = nextToken();
      Expression type = null;
      Identifier name = null;
      if (token.kind != TokenKind.COLON) {
        type = parseTest();
        if (token.kind == TokenKind.AS) {
          nextToken();
          name = parseIdent();
        }
      }
      expect(TokenKind.COLON);
      ImmutableList<Statement> handlerBody = parseSuite();
      handlers.add(new TryStatement.ExceptHandler(locs, exceptOffset, type, name, handlerBody));
      hasHandler = true;
    }
    ImmutableList<Statement> elseBlock = hasHandler ? parseOptionalElse() : null;
    ImmutableList<Statement> finallyBlock = null;
    if (token.kind == TokenKind.FINALLY) {
      nextToken();
      expect(TokenKind.COLON);
      finallyBlock = parseSuite();
    }
    if (!hasHandler && finallyBlock == null) {
      syntaxError("expected 'except' or 'finally'");
    }
    return new TryStatement(
        locs, tryOffset, body, handlers.build(), elseBlock, finallyBlock);
  }

  // with_stmt = WITH with_item (',' with_item)* ':' suite
  // with_item = test [AS primary_with_suffix]
  private WithStatement parseWithStatement() {
    int withOffset = expect(TokenKind.WITH);
    ImmutableList.Builder<WithStatement.Item> items = ImmutableList.builder();
    do {
      if (token.kind == TokenKind.COMMA) {
        nextToken();
      }
      Expression context = parseTest();
      Expression target = null;
      if (token.kind == TokenKind.AS) {
        nextToken();
        target = parsePrimaryWithSuffix();
      }
      items.add(new WithStatement.Item(locs, context, target));
    } while (token.kind == TokenKind.COMMA);
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    return new WithStatement(locs, withOffset, items.build(), body);
  }

  // Returns the subject of a match statement whose head expression, starting with the soft
  // keyword, has been parsed, or null if the head is an ordinary expression.
  //
  // 'match x:' stops after the identifier; 'match (x):' and 'match [x, y]:' parse as a call and
  // an index expression whose function or object is the soft keyword.
  @Nullable
  private Expression matchSubject(Expression head) {
    if (head instanceof Identifier
        && ((Identifier) head).getName().equals(MATCH_SOFT_KEYWORD)
        && MATCH_SUBJECT_START_SET.contains(token.kind)) {
      return parseExpr();
    }
    if (token.kind != TokenKind.COLON) {
      return null;
    }
    if (head instanceof CallExpression) {
      CallExpression call = (CallExpression) head;
      if (isMatchKeyword(call.getFunction())
          && call.getArguments().size() == 1
          && call.getArguments().get(0) instanceof Argument.Positional) {
        return call.getArguments().get(0).getValue();
      }
    } else if (head instanceof IndexExpression) {
      IndexExpression index = (IndexExpression) head;
      if (isMatchKeyword(index.getObject())) {
        ImmutableList<Expression> elems =
            index.getKey() instanceof ListExpression && ((ListExpression) index.getKey()).isTuple()
                ? ((ListExpression) index.getKey()).getElements()
                : ImmutableList.of(index.getKey());
        return new ListExpression(
            locs,
            /* isTuple= */ false,
            index.getStartOffset() + MATCH_SOFT_KEYWORD.length() + 1,
            elems,
            index.getEndOffset() - 1);
      }
    }
    return null;
  }

  private static boolean isMatchKeyword(Expression e) {
    return e instanceof Identifier && ((Identifier) e).getName().equals(MATCH_SOFT_KEYWORD);
  }

  // match_stmt = 'match' expr ':' NEWLINE INDENT case_block+ OUTDENT
  // case_block = 'case' pattern [IF test] ':' suite
  private MatchStatement parseMatchStatementTail(int matchOffset, Expression subject) {
    expect(TokenKind.COLON);
    ImmutableList.Builder<MatchStatement.Case> cases = ImmutableList.builder();
    expect(TokenKind.NEWLINE);
    if (token.kind != TokenKind.INDENT) {
      reportError(token.start, "expected an indented block");
      return new MatchStatement(locs, matchOffset, subject, cases.build());
    }
    expect(TokenKind.INDENT);
    while (token.kind != TokenKind.OUTDENT && token.kind != TokenKind.EOF) {
      int caseOffset = expectSoftKeyword(CASE_SOFT_KEYWORD);
      Expression pattern = parsePattern();
      Expression guard = null;
      if (token.kind == TokenKind.IF) {
        nextToken();
        guard = parseTest();
      }
      expect(TokenKind.COLON);
      ImmutableList<Statement> body = parseSuite();
      cases.add(new MatchStatement.Case(locs, caseOffset, pattern, guard, body));
    }
    expectAndRecover(TokenKind.OUTDENT);
    return new MatchStatement(locs, matchOffset, subject, cases.build());
  }

  // Patterns are parsed as expressions without conditionals: a capture is an identifier, a
  // class pattern is a call, alternatives are joined by '|'.
  // pattern = test_nocond (',' test_nocond)* ','?
  private Expression parsePattern() {
    Expression p = parseTest(0);
    if (token.kind != TokenKind.COMMA) {
      return p;
    }
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(p);
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (token.kind == TokenKind.COLON || token.kind == TokenKind.IF) {
        break;
      }
      elems.add(parseTest(0));
    }
    return new ListExpression(locs, /* isTuple= */ true, -1, elems.build(), -1);
  }

  // Parse a list of function parameters.
  private ImmutableList<Parameter> parseParameters(boolean defStatement) {
    boolean hasParam = false;
    ImmutableList.Builder<Parameter> list = ImmutableList.builder();

    while (token.kind != TokenKind.RPAREN
        && token.kind != TokenKind.COLON
        && token.kind != TokenKind.EOF) {
      if (hasParam) {
        expect(TokenKind.COMMA);
        // The list may end with a comma.
        if (token.kind == TokenKind.RPAREN || token.kind == TokenKind.COLON) {
          break;
        }
      }
      Parameter param = parseParameter(defStatement);
      hasParam = true;
      list.add(param);
    }
    return list.build();
  }

  // suite is typically what follows a colon (e.g. after def or for).
  // suite = simple_stmt
  //       | NEWLINE INDENT stmt+ OUTDENT
  private ImmutableList<Statement> parseSuite() {
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    if (token.kind == TokenKind.NEWLINE) {
      expect(TokenKind.NEWLINE);
      if (token.kind != TokenKind.INDENT) {
        reportError(token.start, "expected an indented block");
        return list.build();
      }
      expect(TokenKind.INDENT);
      while (token.kind != TokenKind.OUTDENT && token.kind != TokenKind.EOF) {
        parseStatement(list);
      }
      expectAndRecover(TokenKind.OUTDENT);
    } else {
      parseSimpleStatement(list, null);
    }
    return list.build();
  }
}

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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of tokenization behavior of the {@link Lexer}. */
@RunWith(JUnit4.class)
public class LexerTest {

  private final List<SyntaxError> errors = new ArrayList<>();

  // Reassign in test case to inject non-default options to the Lexer.
  private FileOptions options = FileOptions.DEFAULT;

  private Lexer createLexer(String input) {
    errors.clear();
    return new Lexer(ParserInput.fromString(input, ""), options, errors);
  }

  // Returns the names of the tokens of the input with their values, if any.
  private String tokens(String input) {
    Lexer lexer = createLexer(input);
    StringBuilder buf = new StringBuilder();
    do {
      lexer.nextToken();
      if (buf.length() > 0) {
        buf.append(' ');
      }
      buf.append(lexer.kind.name());
      if (lexer.value != null) {
        buf.append('(').append(lexer.value).append(')');
      }
    } while (lexer.kind != TokenKind.EOF);
    return buf.toString();
  }

  // Returns the line number of each token of the input.
  private String linenums(String input) {
    Lexer lexer = createLexer(input);
    StringBuilder buf = new StringBuilder();
    do {
      lexer.nextToken();
      if (buf.length() > 0) {
        buf.append(' ');
      }
      buf.append(lexer.locs.getLocation(lexer.start).line());
    } while (lexer.kind != TokenKind.EOF);
    return buf.toString();
  }

  private void check(String src, String wantTokens) {
    assertThat(tokens(src)).isEqualTo(wantTokens);
    assertThat(errors).isEmpty();
  }

  // Errors are formatted with a caret ^ under the errant column.
  private void checkErrors(String src, String wantTokens, String... wantErrors) {
    assertThat(tokens(src)).isEqualTo(wantTokens);
    List<String> gotErrors = new ArrayList<>();
    for (SyntaxError err : errors) {
      String msg = " ".repeat(err.location().column() - 1) + "^ " + err.message();
      if (err.location().line() != 1) {
        msg = String.format("%s (line %d)", msg, err.location().line());
      }
      gotErrors.add(msg);
    }
    assertThat(gotErrors).isEqualTo(Arrays.asList(wantErrors));
  }

  @Test
  public void testAssignment() {
    check("x = 1", "IDENTIFIER(x) EQUALS INT(1) NEWLINE EOF");
    check("x += y", "IDENTIFIER(x) PLUS_EQUALS IDENTIFIER(y) NEWLINE EOF");
    check(
        "a //= b >>= c != d",
        "IDENTIFIER(a) SLASH_SLASH_EQUALS IDENTIFIER(b) GREATER_GREATER_EQUALS IDENTIFIER(c)"
            + " NOT_EQUALS IDENTIFIER(d) NEWLINE EOF");
  }

  @Test
  public void testKeywords() {
    check(
        "def f(a, *b, **c) -> x:",
        "DEF IDENTIFIER(f) LPAREN IDENTIFIER(a) COMMA STAR IDENTIFIER(b) COMMA STAR_STAR"
            + " IDENTIFIER(c) RPAREN ARROW IDENTIFIER(x) COLON NEWLINE EOF");
    check("nonlocal x; global y", "NONLOCAL IDENTIFIER(x) SEMI GLOBAL IDENTIFIER(y) NEWLINE EOF");
    check("with a as b", "WITH IDENTIFIER(a) AS IDENTIFIER(b) NEWLINE EOF");
    check("try: del x", "TRY COLON DEL IDENTIFIER(x) NEWLINE EOF");
  }

  @Test
  public void testSoftKeywordsAreIdentifiers() {
    check("match x", "IDENTIFIER(match) IDENTIFIER(x) NEWLINE EOF");
    check("case _", "IDENTIFIER(case) IDENTIFIER(_) NEWLINE EOF");
  }

  @Test
  public void testComments() {
    check("123#456\n789", "INT(123) NEWLINE INT(789) NEWLINE EOF");
    check("123 #456\n789", "INT(123) NEWLINE INT(789) NEWLINE EOF");
    check("123#456\n 789", "INT(123) NEWLINE INDENT INT(789) NEWLINE OUTDENT NEWLINE EOF");
    check("# foo", "NEWLINE EOF");
  }

  @Test
  public void testNumbers() {
    check("", "NEWLINE EOF");
    check("1 2 3 4", "INT(1) INT(2) INT(3) INT(4) NEWLINE EOF");
    check("1.234", "FLOAT(1.234) NEWLINE EOF");
    check("0", "INT(0) NEWLINE EOF");
    check("0O77", "INT(63) NEWLINE EOF");
    check("0x12345f-", "INT(1193055) MINUS NEWLINE EOF");
    check(".0", "FLOAT(0.0) NEWLINE EOF");
    check("1e1", "FLOAT(10.0) NEWLINE EOF");
    check(".abc", "DOT IDENTIFIER(abc) NEWLINE EOF");
    check("foo.bcd", "IDENTIFIER(foo) DOT IDENTIFIER(bcd) NEWLINE EOF");
  }

  @Test
  public void testStrings() {
    check("\"foo\"", "STRING(foo) NEWLINE EOF");
    check("'foo\\'bar'", "STRING(foo'bar) NEWLINE EOF");
    check("\"\"\"ab\ncd\"\"\"", "STRING(ab\ncd) NEWLINE EOF");
    check("r'a\\tb'", "STRING(a\\tb) NEWLINE EOF");
  }

  @Test
  public void testStringPrefixes() {
    check("b'x'", "STRING(x) NEWLINE EOF");
    check("f'{y}'", "STRING({y}) NEWLINE EOF");
    check("rb'x'", "STRING(x) NEWLINE EOF");
    check("r'ab'r", "STRING(ab) IDENTIFIER(r) NEWLINE EOF");
  }

  @Test
  public void testIndentation() {
    check("1\n2\n3", "INT(1) NEWLINE INT(2) NEWLINE INT(3) NEWLINE EOF");
    check(
        "if x:\n  y\nz",
        "IF IDENTIFIER(x) COLON NEWLINE INDENT IDENTIFIER(y) NEWLINE OUTDENT IDENTIFIER(z)"
            + " NEWLINE EOF");
    check(
        "1\n  2\n    3\n  4\n5",
        "INT(1) NEWLINE INDENT INT(2) NEWLINE INDENT INT(3) NEWLINE "
            + "OUTDENT INT(4) NEWLINE OUTDENT INT(5) NEWLINE EOF");
    checkErrors(
        "1\n  2\n    3\n   4\n5",
        "INT(1) NEWLINE INDENT INT(2) NEWLINE INDENT INT(3) NEWLINE "
            + "OUTDENT INT(4) NEWLINE OUTDENT INT(5) NEWLINE EOF",
        "  ^ indentation error (line 4)");
  }

  @Test
  public void testIndentationInsideParens() {
    check("1 (\n  2\n    3\n  4\n5", "INT(1) LPAREN INT(2) INT(3) INT(4) INT(5) NEWLINE EOF");
    check("1 [\n  2\n    3\n  4\n5", "INT(1) LBRACKET INT(2) INT(3) INT(4) INT(5) NEWLINE EOF");
  }

  @Test
  public void testTabsInIndentation() {
    check(
        "def x():\n\tpass",
        "DEF IDENTIFIER(x) LPAREN RPAREN COLON NEWLINE INDENT PASS NEWLINE OUTDENT NEWLINE EOF");
    options = FileOptions.builder().allowTabsInIndentation(false).build();
    checkErrors(
        "def x():\n\tpass",
        "DEF IDENTIFIER(x) LPAREN RPAREN COLON NEWLINE INDENT PASS NEWLINE OUTDENT NEWLINE EOF",
        " ^ Tab characters are not allowed for indentation. Use spaces instead. (line 2)");
  }

  @Test
  public void testLineContinuation() {
    check("a\\\nb", "IDENTIFIER(a) IDENTIFIER(b) NEWLINE EOF");
    check("a\\ b", "IDENTIFIER(a) ILLEGAL(\\) IDENTIFIER(b) NEWLINE EOF");
  }

  @Test
  public void testLineNumbers() {
    assertThat(linenums("foo = 1\nbar = 2\n\nwiz = 3")).isEqualTo("1 1 1 1 2 2 2 2 4 4 4 4 4");
  }

  @Test
  public void testErrors() {
    checkErrors(
        "f$o", //
        "IDENTIFIER(f) IDENTIFIER(o) NEWLINE EOF",
        " ^ invalid character: '$'");
    checkErrors(
        "+ 'unterminated", "PLUS STRING(unterminated) NEWLINE EOF", "  ^ unclosed string literal");
  }

  /**
   * Returns the first error whose string form contains the specified substring, or throws an
   * informative AssertionError if there is none.
   */
  static SyntaxError assertContainsError(List<SyntaxError> errors, String substr) {
    for (SyntaxError error : errors) {
      if (error.toString().contains(substr)) {
        return error;
      }
    }
    if (errors.isEmpty()) {
      throw new AssertionError("no errors, want '" + substr + "'");
    } else {
      throw new AssertionError(
          "error '" + substr + "' not found, but got these:\n" + SyntaxError.toString(errors));
    }
  }
}

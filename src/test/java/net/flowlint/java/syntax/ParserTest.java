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
import static net.flowlint.java.syntax.LexerTest.assertContainsError;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of parsing. */
@RunWith(JUnit4.class)
public final class ParserTest {

  private FileOptions options = FileOptions.DEFAULT;

  // Parses the lines, and returns the file, which may contain errors.
  private SourceFile parseFileWithErrors(String... lines) {
    return SourceFile.parse(ParserInput.fromLines(lines), options);
  }

  private SourceFile parseFile(String... lines) throws SyntaxError.Exception {
    SourceFile file = parseFileWithErrors(lines);
    if (!file.ok()) {
      throw new SyntaxError.Exception(file.errors());
    }
    return file;
  }

  private Statement parseStatement(String... lines) throws SyntaxError.Exception {
    return parseFile(lines).getStatements().get(0);
  }

  private Expression parseExpression(String source) throws SyntaxError.Exception {
    return Expression.parse(ParserInput.fromLines(source), options);
  }

  private static List<String> names(List<? extends Parameter> params) {
    List<String> names = new ArrayList<>();
    for (Parameter param : params) {
      names.add(param.getClass().getSimpleName() + ":" + param.getName());
    }
    return names;
  }

  @Test
  public void testAssignments() throws Exception {
    AssignmentStatement plain = (AssignmentStatement) parseStatement("x = 1");
    assertThat(plain.isAugmented()).isFalse();
    assertThat(((Identifier) plain.getLHS()).getName()).isEqualTo("x");

    AssignmentStatement aug = (AssignmentStatement) parseStatement("x += 1");
    assertThat(aug.isAugmented()).isTrue();
    assertThat(aug.getOperator()).isEqualTo(TokenKind.PLUS);

    AssignmentStatement annotated = (AssignmentStatement) parseStatement("x: int = 1");
    assertThat(annotated.getType().toString()).isEqualTo("int");
    assertThat(annotated.getRHS().toString()).isEqualTo("1");

    AssignmentStatement declaration = (AssignmentStatement) parseStatement("x: int");
    assertThat(declaration.getRHS()).isNull();
  }

  @Test
  public void testTupleAssignment() throws Exception {
    AssignmentStatement stmt = (AssignmentStatement) parseStatement("a, (b, c) = f()");
    ListExpression lhs = (ListExpression) stmt.getLHS();
    assertThat(lhs.isTuple()).isTrue();
    assertThat(lhs.getElements()).hasSize(2);
    assertThat(Identifier.boundIdentifiers(lhs).toString()).isEqualTo("[a, b, c]");
  }

  @Test
  public void testChainedAssignmentIsAnError() {
    SourceFile file = parseFileWithErrors("x = y = 1");
    assertContainsError(file.errors(), "chained assignment is not supported");
  }

  @Test
  public void testIfElifElse() throws Exception {
    IfStatement stmt =
        (IfStatement)
            parseStatement(
                "if a:", //
                "  x = 1",
                "elif b:",
                "  x = 2",
                "else:",
                "  x = 3");
    assertThat(stmt.isElif()).isFalse();
    assertThat(stmt.getThenBlock()).hasSize(1);
    IfStatement elif = (IfStatement) stmt.getElseBlock().get(0);
    assertThat(elif.isElif()).isTrue();
    assertThat(elif.getCondition().toString()).isEqualTo("b");
    assertThat(elif.getElseBlock()).hasSize(1);
  }

  @Test
  public void testLoopsWithElse() throws Exception {
    ForStatement loop =
        (ForStatement)
            parseStatement(
                "for i, j in pairs:", //
                "  break",
                "else:",
                "  pass");
    assertThat(loop.getVars().toString()).isEqualTo("i, j");
    assertThat(loop.getElseBlock()).hasSize(1);

    WhileStatement wloop = (WhileStatement) parseStatement("while x:", "  x -= 1");
    assertThat(wloop.getElseBlock()).isNull();
  }

  @Test
  public void testDef() throws Exception {
    DefStatement def =
        (DefStatement)
            parseStatement(
                "@decorator", //
                "def f(a, b: int = 1, *args, c, **kwargs) -> str:",
                "  return a");
    assertThat(def.getIdentifier().getName()).isEqualTo("f");
    assertThat(def.getDecorators()).hasSize(1);
    assertThat(names(def.getParameters()))
        .containsExactly(
            "Mandatory:a", "Optional:b", "Star:args", "Mandatory:c", "StarStar:kwargs")
        .inOrder();
    assertThat(def.getParameters().get(1).getDefaultValue().toString()).isEqualTo("1");
    assertThat(def.getReturnType().toString()).isEqualTo("str");
    assertThat(def.getBody().get(0)).isInstanceOf(ReturnStatement.class);
  }

  @Test
  public void testClass() throws Exception {
    ClassStatement cls =
        (ClassStatement)
            parseStatement(
                "class C(Base, metaclass=M):", //
                "  x = 1",
                "  def m(self):",
                "    pass");
    assertThat(cls.getIdentifier().getName()).isEqualTo("C");
    assertThat(cls.getBases()).hasSize(2);
    assertThat(cls.getBases().get(1).getName()).isEqualTo("metaclass");
    assertThat(cls.getBody()).hasSize(2);
  }

  @Test
  public void testTry() throws Exception {
    TryStatement stmt =
        (TryStatement)
            parseStatement(
                "try:", //
                "  f()",
                "except ValueError as e:",
                "  g(e)",
                "except:",
                "  pass",
                "else:",
                "  h()",
                "finally:",
                "  done()");
    assertThat(stmt.getHandlers()).hasSize(2);
    assertThat(stmt.getHandlers().get(0).getName().getName()).isEqualTo("e");
    assertThat(stmt.getHandlers().get(1).getType()).isNull();
    assertThat(stmt.getElseBlock()).hasSize(1);
    assertThat(stmt.getFinallyBlock()).hasSize(1);
  }

  @Test
  public void testTryWithoutHandlerIsAnError() {
    SourceFile file = parseFileWithErrors("try:", "  f()", "x = 1");
    assertContainsError(file.errors(), "expected 'except' or 'finally'");
  }

  @Test
  public void testWith() throws Exception {
    WithStatement stmt = (WithStatement) parseStatement("with open(f) as a, lock:", "  pass");
    assertThat(stmt.getItems()).hasSize(2);
    assertThat(stmt.getItems().get(0).getTarget().toString()).isEqualTo("a");
    assertThat(stmt.getItems().get(1).getTarget()).isNull();
  }

  @Test
  public void testImports() throws Exception {
    ImportStatement imp = (ImportStatement) parseStatement("import a.b as c, d.e");
    assertThat(imp.getModule()).isNull();
    ImmutableList<ImportStatement.Binding> bindings = imp.getBindings();
    assertThat(bindings.get(0).getLocalName().getName()).isEqualTo("c");
    assertThat(bindings.get(0).getOriginalName()).isEqualTo("a.b");
    assertThat(bindings.get(1).getLocalName().getName()).isEqualTo("d");
    assertThat(bindings.get(1).getOriginalName()).isEqualTo("d.e");

    ImportStatement from =
        (ImportStatement) parseStatement("from os.path import (join, sep as s,)");
    assertThat(from.getModule()).isEqualTo("os.path");
    assertThat(from.getBindings().get(1).getLocalName().getName()).isEqualTo("s");
    assertThat(from.getBindings().get(1).getOriginalName()).isEqualTo("sep");

    ImportStatement star = (ImportStatement) parseStatement("from . import *");
    assertThat(star.getModule()).isEqualTo(".");
    assertThat(star.isWildcard()).isTrue();
  }

  @Test
  public void testGlobalAndNonlocal() throws Exception {
    GlobalStatement global = (GlobalStatement) parseStatement("global a, b");
    assertThat(global.isNonlocal()).isFalse();
    assertThat(global.getNames()).hasSize(2);
    assertThat(((GlobalStatement) parseStatement("nonlocal a")).isNonlocal()).isTrue();
  }

  @Test
  public void testMatch() throws Exception {
    MatchStatement stmt =
        (MatchStatement)
            parseStatement(
                "match command:", //
                "  case [x, y] if x > y:",
                "    pass",
                "  case Point(x=0) | None:",
                "    pass",
                "  case _:",
                "    pass");
    assertThat(stmt.getSubject().toString()).isEqualTo("command");
    assertThat(stmt.getCases()).hasSize(3);
    assertThat(stmt.getCases().get(0).getGuard().toString()).isEqualTo("x > y");
    assertThat(stmt.getCases().get(1).getGuard()).isNull();
    assertThat(stmt.getCases().get(2).isIrrefutable()).isTrue();
  }

  @Test
  public void testMatchAsOrdinaryName() throws Exception {
    assertThat(parseStatement("match = 1")).isInstanceOf(AssignmentStatement.class);
    assertThat(parseStatement("match(x)")).isInstanceOf(ExpressionStatement.class);
  }

  @Test
  public void testExpressions() throws Exception {
    assertThat(parseExpression("a if b else c")).isInstanceOf(ConditionalExpression.class);
    LambdaExpression lambda = (LambdaExpression) parseExpression("lambda x, y=1: x + y");
    assertThat(lambda.getParameters()).hasSize(2);
    assertThat(lambda.getBody().toString()).isEqualTo("x + y");

    BinaryOperatorExpression notIn = (BinaryOperatorExpression) parseExpression("a not in b");
    assertThat(notIn.getOperator()).isEqualTo(TokenKind.NOT_IN);
    BinaryOperatorExpression isNot = (BinaryOperatorExpression) parseExpression("a is not b");
    assertThat(isNot.getOperator()).isEqualTo(TokenKind.IS_NOT);
  }

  @Test
  public void testComprehensions() throws Exception {
    Comprehension list = (Comprehension) parseExpression("[x for x in xs if x]");
    assertThat(list.getType()).isEqualTo(Comprehension.Type.LIST);
    assertThat(list.getClauses()).hasSize(2);
    assertThat(list.getClauses().get(1)).isInstanceOf(Comprehension.If.class);

    Comprehension dict = (Comprehension) parseExpression("{k: v for k, v in items}");
    assertThat(dict.getType()).isEqualTo(Comprehension.Type.DICT);
    assertThat(dict.getBody()).isInstanceOf(DictExpression.Entry.class);

    Comprehension gen = (Comprehension) parseExpression("(x for x in xs)");
    assertThat(gen.getType()).isEqualTo(Comprehension.Type.GENERATOR);

    CallExpression call = (CallExpression) parseExpression("sum(x for x in xs)");
    assertThat(call.getArguments().get(0).getValue()).isInstanceOf(Comprehension.class);
  }

  @Test
  public void testDecoratorMustPrecedeDefinition() {
    SourceFile file = parseFileWithErrors("@d", "x = 1");
    assertContainsError(file.errors(), "expected 'def' or 'class' after decorator");
  }

  @Test
  public void testParseStrictThrows() {
    SyntaxError.Exception e =
        assertThrows(
            SyntaxError.Exception.class,
            () -> SourceFile.parseStrict(ParserInput.fromLines("x = = 1")));
    assertThat(e.errors()).isNotEmpty();
  }

  @Test
  public void testMissingIndentedBlock() {
    SourceFile file = parseFileWithErrors("if x:", "y = 1");
    assertContainsError(file.errors(), "expected an indented block");
  }

  @Test
  public void testLocations() throws Exception {
    SourceFile file = parseFile("x = 1", "if x:", "  y = x");
    Statement ifStmt = file.getStatements().get(1);
    assertThat(ifStmt.getStartLocation().line()).isEqualTo(2);
    Statement inner = ((IfStatement) ifStmt).getThenBlock().get(0);
    assertThat(inner.getStartLocation().column()).isEqualTo(3);
    assertThat(inner.getParent()).isSameInstanceAs(ifStmt);
    assertThat(ifStmt.getParent()).isSameInstanceAs(file);
  }
}

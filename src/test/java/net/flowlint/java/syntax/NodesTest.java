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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the generic field access in {@link Nodes}. */
@RunWith(JUnit4.class)
public final class NodesTest {

  private static Statement parseStatement(String... lines) throws SyntaxError.Exception {
    return SourceFile.parseStrict(ParserInput.fromLines(lines)).getStatements().get(0);
  }

  private static Expression parseExpression(String source) throws SyntaxError.Exception {
    return Expression.parse(ParserInput.fromLines(source));
  }

  @Test
  public void testFields() throws Exception {
    List<Object> fields = Nodes.fields(parseExpression("a + b"));
    assertThat(fields).hasSize(3);
    assertThat(fields.get(1)).isEqualTo(TokenKind.PLUS);

    List<Object> call = Nodes.fields(parseExpression("f(x, y=1)"));
    assertThat(call.get(0).toString()).isEqualTo("f");
    assertThat((List<?>) call.get(1)).hasSize(2);

    List<Object> ifFields = Nodes.fields(parseStatement("if x:", "  pass"));
    assertThat(ifFields.get(0)).isEqualTo(TokenKind.IF);
    assertThat(ifFields.get(3)).isNull();
  }

  @Test
  public void testStructuralEqualityIgnoresLocations() throws Exception {
    Statement x = parseStatement("y = f(a, [1, 2])");
    Statement y = parseStatement("y   =   f( a , [1,2] )");
    assertThat(Nodes.structurallyEqual(x, y)).isTrue();
    assertThat(Nodes.structurallyEqual(x, parseStatement("y = f(a, [1, 3])"))).isFalse();
    assertThat(Nodes.structurallyEqual(x, parseStatement("y = f(a, (1, 2))"))).isFalse();
  }

  @Test
  public void testStructuralEqualityOfLiterals() throws Exception {
    assertThat(Nodes.structurallyEqual(parseExpression("0x10"), parseExpression("16"))).isTrue();
    assertThat(Nodes.structurallyEqual(parseExpression("'a'"), parseExpression("\"a\"")))
        .isTrue();
    assertThat(Nodes.structurallyEqual(parseExpression("1"), parseExpression("1.0"))).isFalse();
  }

  @Test
  public void testCopyIsDeepAndFresh() throws Exception {
    Statement original = parseStatement("for i in range(n):", "  total += i");
    Statement copy = Nodes.copy(original);
    assertThat(copy).isNotSameInstanceAs(original);
    assertThat(copy.getParent()).isNull();
    assertThat(Nodes.structurallyEqual(copy, original)).isTrue();
    ForStatement loop = (ForStatement) copy;
    assertThat(loop.getBody().get(0))
        .isNotSameInstanceAs(((ForStatement) original).getBody().get(0));
  }

  @Test
  public void testWithFieldsReplacesChildren() throws Exception {
    Expression call = parseExpression("f(x)");
    List<Object> fields = new ArrayList<>(Nodes.fields(Nodes.copy(call)));
    fields.set(0, Nodes.copy(parseExpression("g")));
    Node rebuilt = Nodes.withFields(call, fields);
    assertThat(rebuilt.toString()).isEqualTo("g(x)");
    assertThat(rebuilt).isInstanceOf(CallExpression.class);
  }

  @Test
  public void testWithFieldsRejectsWrongArity() throws Exception {
    Expression call = parseExpression("f(x)");
    assertThrows(
        IllegalArgumentException.class, () -> Nodes.withFields(call, ImmutableList.of()));
  }

  @Test
  public void testChildrenInLexicalOrder() throws Exception {
    Statement def = parseStatement("@d", "def f(a=1) -> int:", "  return a");
    List<String> kinds = new ArrayList<>();
    for (Node child : Nodes.children(def)) {
      kinds.add(child.getClass().getSimpleName());
    }
    assertThat(kinds)
        .containsExactly("Identifier", "Identifier", "Optional", "Identifier", "ReturnStatement")
        .inOrder();
  }

  @Test
  public void testWrapLinksParents() throws Exception {
    Statement stmt = Nodes.copy(parseStatement("x = y"));
    SourceFile file = SourceFile.wrap(ImmutableList.of(stmt));
    assertThat(stmt.getParent()).isSameInstanceAs(file);
    assertThat(((AssignmentStatement) stmt).getRHS().getParent()).isSameInstanceAs(stmt);
  }

  @Test
  public void testAsStatementAndArgument() throws Exception {
    Expression e = Nodes.copy(parseExpression("x"));
    assertThat(Nodes.asStatement(e).getExpression()).isSameInstanceAs(e);
    assertThat(Nodes.asArgument(Nodes.copy(e)).getValue().toString()).isEqualTo("x");
  }
}

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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import net.flowlint.java.syntax.AssignmentStatement;
import net.flowlint.java.syntax.BinaryOperatorExpression;
import net.flowlint.java.syntax.CallExpression;
import net.flowlint.java.syntax.ClassStatement;
import net.flowlint.java.syntax.Comprehension;
import net.flowlint.java.syntax.DefStatement;
import net.flowlint.java.syntax.ExpressionStatement;
import net.flowlint.java.syntax.Identifier;
import net.flowlint.java.syntax.LambdaExpression;
import net.flowlint.java.syntax.NodeVisitor;
import net.flowlint.java.syntax.ParserInput;
import net.flowlint.java.syntax.ReturnStatement;
import net.flowlint.java.syntax.SourceFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link ScopeResolver}. */
@RunWith(JUnit4.class)
public final class ScopeResolverTest {

  private SourceFile file;

  private ScopeResolver.Resolution resolve(String... lines) throws Exception {
    file = SourceFile.parseStrict(ParserInput.fromLines(lines));
    return ScopeResolver.resolve(file, AnalysisOptions.DEFAULT);
  }

  // Returns the last occurrence of the name in the file.
  private Identifier lastOccurrence(String name) {
    Identifier[] found = new Identifier[1];
    new NodeVisitor() {
      @Override
      public void visit(Identifier id) {
        if (id.getName().equals(name)) {
          found[0] = id;
        }
      }
    }.visit(file);
    assertThat(found[0]).isNotNull();
    return found[0];
  }

  @Test
  public void functionLocalsAndModuleGlobals() throws Exception {
    ScopeResolver.Resolution r =
        resolve(
            "x = 1", //
            "def f(a):",
            "  b = a + x",
            "  return b");
    Scope module = r.getModuleScope();
    assertThat(module.getKind()).isEqualTo(Scope.Kind.MODULE);
    assertThat(module.getLocals()).containsExactly("x", "f").inOrder();

    Scope f = r.getScope(file.getStatements().get(1));
    assertThat(f.getKind()).isEqualTo(Scope.Kind.FUNCTION);
    assertThat(f.getParent()).isSameInstanceAs(module);
    assertThat(f.getLocals()).containsExactly("a", "b").inOrder();
    assertThat(r.getVariable(lastOccurrence("x"))).isEqualTo(Variable.of("x", module));
    assertThat(r.getVariable(lastOccurrence("b"))).isEqualTo(Variable.of("b", f));
    assertThat(r.getEnclosingScope(lastOccurrence("x"))).isSameInstanceAs(f);
    assertThat(r.getScopes()).containsExactly(module, f).inOrder();
  }

  @Test
  public void nameBoundLaterInFunctionIsLocal() throws Exception {
    ScopeResolver.Resolution r =
        resolve(
            "x = 1", //
            "def f():",
            "  print(x)",
            "  x = 2");
    DefStatement def = (DefStatement) file.getStatements().get(1);
    ExpressionStatement print = (ExpressionStatement) def.getBody().get(0);
    CallExpression call = (CallExpression) print.getExpression();
    Identifier x = (Identifier) call.getArguments().get(0).getValue();
    assertThat(r.getVariable(x).getScope()).isSameInstanceAs(r.getScope(def));
  }

  @Test
  public void builtinsHaveNoVariable() throws Exception {
    ScopeResolver.Resolution r = resolve("print(len(undefined))");
    assertThat(r.getVariable(lastOccurrence("print"))).isNull();
    assertThat(r.getVariable(lastOccurrence("undefined"))).isNull();
    assertThat(r.getModuleScope().getLocals()).isEmpty();
  }

  @Test
  public void nonlocalAndGlobalDeclarations() throws Exception {
    ScopeResolver.Resolution r =
        resolve(
            "def f():", //
            "  x = 1",
            "  def g():",
            "    nonlocal x",
            "    global y",
            "    x = 2",
            "    y = 3",
            "  return g");
    DefStatement f = (DefStatement) file.getStatements().get(0);
    DefStatement g = (DefStatement) f.getBody().get(1);
    assertThat(r.getScope(g).getLocals()).isEmpty();
    assertThat(r.getVariable(lastOccurrence("x")).getScope()).isSameInstanceAs(r.getScope(f));
    assertThat(r.getVariable(lastOccurrence("y")).getScope())
        .isSameInstanceAs(r.getModuleScope());
  }

  @Test
  public void classBodiesAreNotVisibleToMethods() throws Exception {
    ScopeResolver.Resolution r =
        resolve(
            "class C:", //
            "  y = 1",
            "  def m(self):",
            "    return y");
    ClassStatement cls = (ClassStatement) file.getStatements().get(0);
    DefStatement m = (DefStatement) cls.getBody().get(1);
    assertThat(r.getScope(cls).getLocals()).containsExactly("y", "m");
    assertThat(r.getVariable(lastOccurrence("y"))).isNull();
    assertThat(r.getScope(m).getName()).isEqualTo("__main__.C.m");
    assertThat(r.getScope(m).toString()).isEqualTo("FUNCTION __main__.C.m");
  }

  @Test
  public void comprehensionHasItsOwnScope() throws Exception {
    ScopeResolver.Resolution r =
        resolve(
            "xs = [1]", //
            "ys = [x * 2 for x in xs]");
    AssignmentStatement assign = (AssignmentStatement) file.getStatements().get(1);
    Comprehension comp = (Comprehension) assign.getRHS();
    Scope scope = r.getScope(comp);
    assertThat(scope.getKind()).isEqualTo(Scope.Kind.COMPREHENSION);
    assertThat(scope.getLocals()).containsExactly("x");
    Identifier x = (Identifier) ((BinaryOperatorExpression) comp.getBody()).getX();
    assertThat(r.getVariable(x).getScope()).isSameInstanceAs(scope);
    // The first iterable is evaluated outside the comprehension.
    assertThat(r.getEnclosingScope(lastOccurrence("xs"))).isSameInstanceAs(r.getModuleScope());
    assertThat(r.getModuleScope().getLocals()).containsExactly("xs", "ys");
  }

  @Test
  public void lambdaParametersAreLocal() throws Exception {
    ScopeResolver.Resolution r =
        resolve(
            "def f(a):", //
            "  return lambda b: a + b");
    DefStatement def = (DefStatement) file.getStatements().get(0);
    LambdaExpression lambda =
        (LambdaExpression) ((ReturnStatement) def.getBody().get(0)).getResult();
    Scope scope = r.getScope(lambda);
    assertThat(scope.getKind()).isEqualTo(Scope.Kind.LAMBDA);
    assertThat(r.getVariable(lastOccurrence("b")).getScope()).isSameInstanceAs(scope);
    assertThat(r.getVariable(lastOccurrence("a")).getScope()).isSameInstanceAs(r.getScope(def));
    assertThat(r.getScope(def).encloses(scope)).isTrue();
    assertThat(scope.encloses(r.getScope(def))).isFalse();
  }

  @Test
  public void matchPatternsBindCaptures() throws Exception {
    ScopeResolver.Resolution r =
        resolve(
            "match p:", //
            "  case [a, _]:",
            "    pass",
            "  case b:",
            "    pass");
    assertThat(r.getModuleScope().getLocals()).containsExactly("a", "b");
  }

  @Test
  public void namedScopeInspectionIsUnknowable() throws Exception {
    UnknowableLocalsException ex =
        assertThrows(
            UnknowableLocalsException.class,
            () ->
                resolve(
                    "def f():", //
                    "  x = 1",
                    "  return locals()"));
    assertThat(ex).hasMessageThat().contains("call of locals() makes local variables unknowable");
    assertThat(ex.getCallLocation().line()).isEqualTo(3);
  }

  @Test
  public void reboundOrArgumentCallIsNotDynamic() throws Exception {
    resolve("vars = dict", "vars()");
    resolve("x = 1", "print(vars(x))");
    AnalysisOptions options =
        AnalysisOptions.builder().dynamicScopeBuiltins(ImmutableSet.of()).build();
    file = SourceFile.parseStrict(ParserInput.fromLines("locals()"));
    assertThat(ScopeResolver.resolve(file, options).getScopes()).hasSize(1);
  }
}

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

package net.flowlint.java.aunify;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.List;
import net.flowlint.java.syntax.ParserInput;
import net.flowlint.java.syntax.SourceFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StopConditionsTest {

  // Returns the holes of the generalization of the two statements.
  private static List<AunifyVar> holes(String first, String second) throws Exception {
    SourceFile file = SourceFile.parseStrict(ParserInput.fromLines(first, second));
    return Antiunifier.antiunify(file.getStatements(), null).get().getHoles();
  }

  @Test
  public void calledHole() throws Exception {
    assertThat(StopConditions.calledHole().test(holes("f(1)", "g(1)"))).isTrue();
    assertThat(StopConditions.calledHole().test(holes("a.f()", "a.g()"))).isTrue();
    assertThat(StopConditions.calledHole().test(holes("a.f(1)", "b.f(1)"))).isTrue();
    assertThat(StopConditions.calledHole().test(holes("f(a)", "f(b)"))).isFalse();
    assertThat(StopConditions.calledHole().test(holes("y = a.f", "y = a.g"))).isTrue();
    assertThat(StopConditions.calledHole().test(holes("a[0](1)", "b[0](1)"))).isTrue();
    assertThat(StopConditions.calledHole().test(holes("g(a)(x)", "g(b)(x)"))).isFalse();
    assertThat(StopConditions.calledHole().test(holes("g(a.f)(x)", "g(b.f)(x)"))).isFalse();
  }

  @Test
  public void assignmentToHole() throws Exception {
    assertThat(StopConditions.assignmentToHole().test(holes("x = 1", "y = 1"))).isTrue();
    assertThat(StopConditions.assignmentToHole().test(holes("x, a = 1", "y, a = 1"))).isTrue();
    assertThat(StopConditions.assignmentToHole().test(holes("o.x = 1", "o.y = 1"))).isTrue();
    List<AunifyVar> loopVar = holes("for x in a: pass", "for y in a: pass");
    assertThat(StopConditions.assignmentToHole().test(loopVar)).isTrue();
    assertThat(StopConditions.assignmentToHole().test(holes("y = x", "y = z"))).isFalse();
    assertThat(StopConditions.assignmentToHole().test(holes("o[x] = 1", "o[y] = 1"))).isFalse();
  }

  @Test
  public void typeMismatch() throws Exception {
    assertThat(StopConditions.typeMismatch().test(holes("y = x", "y = 1"))).isTrue();
    assertThat(StopConditions.typeMismatch().test(holes("y = x", "y = z"))).isFalse();
  }

  @Test
  public void lengthMismatch() throws Exception {
    assertThat(StopConditions.lengthMismatch().test(holes("f(a, b)", "f(a)"))).isTrue();
    assertThat(StopConditions.lengthMismatch().test(holes("f(a, b)", "f(c, d)"))).isFalse();
  }

  @Test
  public void moreHolesThan() throws Exception {
    List<AunifyVar> two = holes("x + y", "a + b");
    assertThat(StopConditions.moreHolesThan(1).test(two)).isTrue();
    assertThat(StopConditions.moreHolesThan(2).test(two)).isFalse();
    assertThrows(IllegalArgumentException.class, () -> StopConditions.moreHolesThan(-1));
  }
}

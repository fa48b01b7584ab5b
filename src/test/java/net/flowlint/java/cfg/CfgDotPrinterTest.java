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

package net.flowlint.java.cfg;

import static com.google.common.truth.Truth.assertThat;

import net.flowlint.java.syntax.ParserInput;
import net.flowlint.java.syntax.SourceFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CfgDotPrinterTest {

  private static String print(String... lines) throws Exception {
    SourceFile file = SourceFile.parseStrict(ParserInput.fromLines(lines));
    return CfgDotPrinter.print(CfgBuilder.build(file));
  }

  @Test
  public void printsClustersAndLabeledEdges() throws Exception {
    String dot =
        print(
            "x = 1", //
            "if x:",
            "  y = \"a\"");
    assertThat(dot).startsWith("digraph cfg {\n");
    assertThat(dot).endsWith("}\n");
    assertThat(dot).contains("subgraph cluster_0 {");
    assertThat(dot).contains("label=\"__main__\";");
    assertThat(dot).contains("g0_0 [label=\"x = 1\\lx\\l\"];");
    assertThat(dot).contains("y = \\\"a\\\"\\l");
    assertThat(dot).contains("[label=\"True\"]");
    assertThat(dot).contains("[label=\"False\"]");
    assertThat(dot).contains("[label=\"end\\l\"]");
  }

  @Test
  public void namesNestedBodies() throws Exception {
    String dot =
        print(
            "class C:", //
            "  def m(self):",
            "    return lambda: 1");
    assertThat(dot).contains("label=\"C\";");
    assertThat(dot).contains("label=\"C.m\";");
    assertThat(dot).contains("label=\"C.m.<lambda:3>\";");
    assertThat(dot).contains("subgraph cluster_3 {");
  }

  @Test
  public void dashesUnreachableBlocks() throws Exception {
    String dot =
        print(
            "def f():", //
            "  return",
            "  g()");
    assertThat(dot).contains("g()\\l\", style=dashed];");
  }
}

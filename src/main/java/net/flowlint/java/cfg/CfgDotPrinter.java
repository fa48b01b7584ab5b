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

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.flowlint.java.syntax.ClassStatement;
import net.flowlint.java.syntax.DefStatement;
import net.flowlint.java.syntax.LambdaExpression;
import net.flowlint.java.syntax.Node;
import net.flowlint.java.syntax.NodePrinter;
import net.flowlint.java.syntax.SourceFile;

/**
 * Renders control-flow graphs in the Graphviz DOT language.
 *
 * <p>Each graph becomes a cluster labeled with the name of its body. Blocks are boxes listing the
 * first line of each of their locations; unreachable blocks are dashed.
 */
public final class CfgDotPrinter {

  private final StringBuilder buf = new StringBuilder();

  private CfgDotPrinter() {}

  /** Returns a DOT digraph holding all the given graphs. */
  public static String print(FlowGraphs graphs) {
    return print(graphs.getGraphs().values());
  }

  /** Returns a DOT digraph holding the given graphs. */
  public static String print(Iterable<ControlFlowGraph> graphs) {
    CfgDotPrinter printer = new CfgDotPrinter();
    printer.buf.append("digraph cfg {\n");
    printer.buf.append("  node [shape=box, fontname=\"Courier New\"];\n");
    for (ControlFlowGraph cfg : graphs) {
      printer.printGraph(cfg);
    }
    printer.buf.append("}\n");
    return printer.buf.toString();
  }

  private void printGraph(ControlFlowGraph cfg) {
    buf.append("  subgraph cluster_").append(cfg.getId()).append(" {\n");
    buf.append("    label=").append(quote(graphName(cfg.getOwner()))).append(";\n");
    buf.append("    fontname=\"Courier New\";\n");
    Set<CfgBlock> blocks = new LinkedHashSet<>(cfg.getBlocks());
    blocks.addAll(cfg.getUnreachableBlocks());
    List<CfgEdge> edges = new ArrayList<>();
    for (CfgBlock block : blocks) {
      printBlock(cfg, block);
      edges.addAll(block.getSuccessors());
    }
    for (CfgEdge edge : edges) {
      buf.append("    ")
          .append(blockId(cfg, edge.getSource()))
          .append(" -> ")
          .append(blockId(cfg, edge.getTarget()));
      if (edge.getLabel() != null) {
        buf.append(" [label=").append(quote(edge.getLabel().toString())).append(']');
      }
      buf.append(";\n");
    }
    buf.append("  }\n");
  }

  private void printBlock(ControlFlowGraph cfg, CfgBlock block) {
    StringBuilder label = new StringBuilder();
    if (block == cfg.getStart() && block.getLocs().isEmpty()) {
      label.append("start\\l");
    } else if (block == cfg.getEnd()) {
      label.append("end\\l");
    }
    for (CfgLoc loc : block.getLocs()) {
      label.append(escape(firstLine(loc.getNode()))).append("\\l");
    }
    buf.append("    ").append(blockId(cfg, block));
    buf.append(" [label=\"").append(label).append('"');
    if (!block.isReachable()) {
      buf.append(", style=dashed");
    }
    buf.append("];\n");
  }

  private static String blockId(ControlFlowGraph cfg, CfgBlock block) {
    return "g" + cfg.getId() + "_" + block.getId();
  }

  private static String firstLine(Node node) {
    return Splitter.on('\n').split(NodePrinter.print(node).trim()).iterator().next();
  }

  // Returns the dotted name of a body: __main__ for a module, Outer.method for a method.
  private static String graphName(Node owner) {
    if (owner instanceof SourceFile) {
      return "__main__";
    }
    List<String> names = new ArrayList<>();
    for (Node n = owner; n != null && !(n instanceof SourceFile); n = n.getParent()) {
      if (n instanceof DefStatement) {
        names.add(0, ((DefStatement) n).getIdentifier().getName());
      } else if (n instanceof ClassStatement) {
        names.add(0, ((ClassStatement) n).getIdentifier().getName());
      } else if (n == owner && n instanceof LambdaExpression) {
        names.add(0, "<lambda:" + n.getStartLocation().line() + ">");
      }
    }
    return String.join(".", names);
  }

  private static String quote(String s) {
    return '"' + escape(s) + '"';
  }

  private static String escape(String s) {
    return s.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}

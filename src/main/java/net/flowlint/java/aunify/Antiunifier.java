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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import javax.annotation.Nullable;
import net.flowlint.java.analysis.UnitAnalysis;
import net.flowlint.java.cfg.CfgLoc;
import net.flowlint.java.syntax.Argument;
import net.flowlint.java.syntax.Expression;
import net.flowlint.java.syntax.Node;
import net.flowlint.java.syntax.Nodes;
import net.flowlint.java.syntax.SourceFile;
import net.flowlint.java.syntax.Statement;

/**
 * Computes the most specific common generalization of several syntax fragments.
 *
 * <p>The fragments are walked simultaneously, position by position. Where they agree, the
 * generalization holds a copy of the shared subtree; where they disagree, it holds an {@link
 * AunifyVar} whose substitutions are the fragments' subtrees at that position. A hole can only
 * stand where an expression, a statement or a call argument is expected. A disagreement at any
 * other position, such as a parameter or an operator, is generalized at the nearest enclosing
 * position that can hold a hole.
 *
 * <p>The inputs are never modified; the generalized tree consists of fresh nodes only.
 *
 * <p>An antiunification is disallowed, and yields {@link Optional#empty}, when the fragments have
 * no common generalization at all, or when a caller-supplied stop condition rejects its holes. A
 * stop condition is a predicate over the list of holes of the generalized tree, whose parents are
 * linked, so conditions may inspect the position of each hole. See {@link StopConditions}.
 */
public final class Antiunifier {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  // Marks a position the fragments disagree on that cannot hold a hole.
  private static final Object MISMATCH = new Object();

  private static final Predicate<List<AunifyVar>> NEVER = holes -> false;

  private final HoleNameGenerator names = new HoleNameGenerator();
  @Nullable private final UnitAnalysis unit;

  private Antiunifier(@Nullable UnitAnalysis unit) {
    this.unit = unit;
  }

  /** Antiunifies single-node fragments, accepting any generalization. */
  public static Optional<Generalization> antiunify(
      List<? extends Node> fragments, @Nullable UnitAnalysis unit) {
    return antiunify(fragments, unit, NEVER, NEVER);
  }

  /**
   * Antiunifies single-node fragments, such as expressions or statements.
   *
   * @param fragments at least two expressions, or at least two statements
   * @param unit the analysis of the unit containing the fragments, or null. It supplies the
   *     locations of substitutions, and the dataflow facts needed to recognize variables that the
   *     fragments merely name differently; without it no hole is renamed.
   * @param stopOn rejects the generalization given all its holes. It is tested once, on the
   *     finished generalization, rather than each time a hole is created. The two agree for
   *     monotone conditions, those that stay true once more holes are added, which every
   *     condition in {@link StopConditions} is.
   * @param stopOnAfterRenamedIdentical rejects the generalization given the holes that remain
   *     after renamed variables are folded back into names
   */
  public static Optional<Generalization> antiunify(
      List<? extends Node> fragments,
      @Nullable UnitAnalysis unit,
      Predicate<? super List<AunifyVar>> stopOn,
      Predicate<? super List<AunifyVar>> stopOnAfterRenamedIdentical) {
    checkArgument(fragments.size() >= 2, "need at least two fragments, got %s", fragments.size());
    ImmutableList.Builder<ImmutableList<Node>> inputs = ImmutableList.builder();
    for (Node fragment : fragments) {
      checkArgument(
          fragment instanceof Expression || fragment instanceof Statement,
          "not an expression or statement: %s",
          fragment);
      inputs.add(ImmutableList.of(fragment));
    }
    Object core = new Antiunifier(unit).generalize(new ArrayList<Object>(fragments));
    if (core == MISMATCH) {
      return Optional.empty();
    }
    return finish(
        ImmutableList.of((Node) core), false, inputs.build(), unit, stopOn,
        stopOnAfterRenamedIdentical);
  }

  /** Antiunifies statement blocks, accepting any generalization. */
  public static Optional<Generalization> antiunifyBlocks(
      List<? extends List<? extends Statement>> blocks, @Nullable UnitAnalysis unit) {
    return antiunifyBlocks(blocks, unit, NEVER, NEVER);
  }

  /**
   * Antiunifies statement blocks. Blocks of different lengths are generalized by a single hole
   * standing for the whole blocks; otherwise statements are generalized pairwise.
   *
   * @see #antiunify(List, UnitAnalysis, Predicate, Predicate)
   */
  public static Optional<Generalization> antiunifyBlocks(
      List<? extends List<? extends Statement>> blocks,
      @Nullable UnitAnalysis unit,
      Predicate<? super List<AunifyVar>> stopOn,
      Predicate<? super List<AunifyVar>> stopOnAfterRenamedIdentical) {
    checkArgument(blocks.size() >= 2, "need at least two blocks, got %s", blocks.size());
    ImmutableList.Builder<ImmutableList<Node>> inputs = ImmutableList.builder();
    List<Object> values = new ArrayList<>();
    for (List<? extends Statement> block : blocks) {
      inputs.add(ImmutableList.<Node>copyOf(block));
      values.add(block);
    }
    Object core = new Antiunifier(unit).generalize(values);
    if (core == MISMATCH) {
      return Optional.empty();
    }
    ImmutableList.Builder<Node> statements = ImmutableList.builder();
    for (Object stmt : (List<?>) core) {
      statements.add((Node) stmt);
    }
    return finish(
        statements.build(), true, inputs.build(), unit, stopOn, stopOnAfterRenamedIdentical);
  }

  private static Optional<Generalization> finish(
      ImmutableList<Node> core,
      boolean block,
      ImmutableList<ImmutableList<Node>> fragments,
      @Nullable UnitAnalysis unit,
      Predicate<? super List<AunifyVar>> stopOn,
      Predicate<? super List<AunifyVar>> stopOnAfterRenamedIdentical) {
    Generalization result = new Generalization(core, block, fragments);
    if (stopOn.test(result.getHoles())) {
      logger.atFine().log("generalization vetoed with holes %s", result.getHoles());
      return Optional.empty();
    }
    if (unit != null && unit.isDataflowAvailable()) {
      result = RenamedIdenticalVars.remove(result, unit);
      if (stopOnAfterRenamedIdentical.test(result.getHoles())) {
        logger.atFine().log("generalization vetoed after renaming, holes %s", result.getHoles());
        return Optional.empty();
      }
    }
    return Optional.of(result);
  }

  /**
   * Returns the generalization of corresponding values of the fragments: nodes, lists of nodes,
   * scalars or nulls. Returns {@link #MISMATCH} if the values differ and cannot be replaced by a
   * hole at this position.
   */
  private Object generalize(List<?> values) {
    // Holes of earlier generalizations are merged, even when they look alike.
    for (Object value : values) {
      if (value instanceof AunifyVar) {
        return mergeHoles(values);
      }
    }
    Object first = values.get(0);
    boolean allEqual = true;
    for (Object value : values) {
      if (!Nodes.structurallyEqual(first, value)) {
        allEqual = false;
        break;
      }
    }
    if (allEqual) {
      return copyValue(first);
    }
    if (first instanceof List) {
      return generalizeLists(values);
    }
    if (first instanceof Node && sameClass(values)) {
      List<Object> fields = new ArrayList<>();
      List<List<Object>> columns = fieldColumns(values);
      for (List<Object> column : columns) {
        Object field = generalize(column);
        if (field == MISMATCH) {
          return hole(values);
        }
        fields.add(field);
      }
      return Nodes.withFields((Node) first, fields);
    }
    return hole(values);
  }

  private Object generalizeLists(List<?> values) {
    int size = -1;
    for (Object value : values) {
      if (!(value instanceof List)) {
        return MISMATCH;
      }
      int n = ((List<?>) value).size();
      if (size != -1 && n != size) {
        return listHole(values);
      }
      size = n;
    }
    ImmutableList.Builder<Object> result = ImmutableList.builder();
    for (int i = 0; i < size; i++) {
      List<Object> column = new ArrayList<>(values.size());
      for (Object value : values) {
        column.add(((List<?>) value).get(i));
      }
      Object elem = generalize(column);
      if (elem == MISMATCH) {
        return listHole(values);
      }
      result.add(elem);
    }
    return result.build();
  }

  // Replaces unequal nodes by a hole wrapped to fit their common category.
  private Object hole(List<?> values) {
    Category category = Category.of(values);
    if (category == null) {
      return MISMATCH;
    }
    return category.wrap(newHole(values, firstNode(values)));
  }

  // Replaces lists that cannot be generalized elementwise by a single hole standing for them.
  private Object listHole(List<?> values) {
    List<Object> elements = new ArrayList<>();
    for (Object value : values) {
      elements.addAll((List<?>) value);
    }
    Category category = Category.of(elements);
    if (category == null || elements.isEmpty()) {
      return MISMATCH;
    }
    List<Object> subs = new ArrayList<>();
    for (Object value : values) {
      subs.add(ImmutableList.copyOf((List<?>) value));
    }
    return ImmutableList.of(category.wrap(newHole(subs, (Node) elements.get(0))));
  }

  private Object mergeHoles(List<?> values) {
    List<Object> subs = new ArrayList<>();
    List<CfgLoc> locs = new ArrayList<>();
    for (Object value : values) {
      if (value instanceof AunifyVar) {
        subs.addAll(((AunifyVar) value).getSubs());
        locs.addAll(((AunifyVar) value).getSubLocs());
      } else if (value instanceof Node) {
        subs.add(value);
        locs.add(locOf(value));
      } else {
        return MISMATCH;
      }
    }
    return new AunifyVar(firstNode(values), names.next(), subs, locs, false);
  }

  private AunifyVar newHole(List<?> subs, Node position) {
    List<CfgLoc> locs = new ArrayList<>(subs.size());
    for (Object sub : subs) {
      locs.add(locOf(sub));
    }
    return new AunifyVar(position, names.next(), subs, locs, false);
  }

  @Nullable
  private CfgLoc locOf(Object sub) {
    if (unit == null) {
      return null;
    }
    if (sub instanceof List) {
      List<?> list = (List<?>) sub;
      return list.isEmpty() ? null : locOf(list.get(0));
    }
    return unit.getFlowGraphs().enclosingLoc((Node) sub);
  }

  private static Object copyValue(@Nullable Object value) {
    if (value instanceof Node) {
      return Nodes.copy((Node) value);
    } else if (value instanceof List) {
      ImmutableList.Builder<Object> list = ImmutableList.builder();
      for (Object elem : (List<?>) value) {
        list.add(copyValue(elem));
      }
      return list.build();
    }
    return value;
  }

  private static boolean sameClass(List<?> values) {
    Class<?> cls = values.get(0).getClass();
    for (Object value : values) {
      if (value == null || value.getClass() != cls) {
        return false;
      }
    }
    return true;
  }

  private static List<List<Object>> fieldColumns(List<?> nodes) {
    List<List<Object>> columns = new ArrayList<>();
    for (Object node : nodes) {
      List<Object> fields = Nodes.fields((Node) node);
      for (int i = 0; i < fields.size(); i++) {
        if (columns.size() <= i) {
          columns.add(new ArrayList<>());
        }
        columns.get(i).add(fields.get(i));
      }
    }
    return columns;
  }

  private static Node firstNode(List<?> values) {
    for (Object value : values) {
      if (value instanceof Node) {
        return (Node) value;
      }
    }
    throw new IllegalArgumentException("no node among " + values);
  }

  /** The syntactic positions a hole can stand in. */
  private enum Category {
    EXPRESSION,
    STATEMENT,
    ARGUMENT;

    /** Returns the category common to all values, or null if there is none. */
    @Nullable
    static Category of(List<?> values) {
      Category result = null;
      for (Object value : values) {
        Category category;
        if (value instanceof Expression) {
          category = EXPRESSION;
        } else if (value instanceof Statement) {
          category = STATEMENT;
        } else if (value instanceof Argument.Positional) {
          // Keyword and star arguments differ from positional ones in more than their value.
          category = ARGUMENT;
        } else {
          return null;
        }
        if (result != null && result != category) {
          return null;
        }
        result = category;
      }
      return result;
    }

    Node wrap(AunifyVar hole) {
      switch (this) {
        case EXPRESSION:
          return hole;
        case STATEMENT:
          return Nodes.asStatement(hole);
        case ARGUMENT:
          return Nodes.asArgument(hole);
      }
      throw new IllegalStateException(name());
    }
  }

  /** Returns the core nodes wrapped in a file, with parents linked. */
  static SourceFile wrap(ImmutableList<Node> core) {
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    for (Node node : core) {
      if (node instanceof Statement) {
        statements.add((Statement) node);
      } else if (node instanceof Expression) {
        statements.add(Nodes.asStatement((Expression) node));
      } else {
        throw new IllegalArgumentException("cannot wrap " + node.getClass().getSimpleName());
      }
    }
    return SourceFile.wrap(statements.build());
  }
}

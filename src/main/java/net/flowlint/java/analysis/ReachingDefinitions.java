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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.flowlint.java.cfg.CfgBlock;
import net.flowlint.java.cfg.CfgEdge;
import net.flowlint.java.cfg.CfgLoc;
import net.flowlint.java.cfg.ControlFlowGraph;
import net.flowlint.java.cfg.FlowGraphs;
import net.flowlint.java.syntax.AssignmentStatement;
import net.flowlint.java.syntax.ClassStatement;
import net.flowlint.java.syntax.DefStatement;
import net.flowlint.java.syntax.Identifier;
import net.flowlint.java.syntax.LambdaExpression;
import net.flowlint.java.syntax.Node;

/**
 * Reaching-definitions analysis over the variable events of a unit.
 *
 * <p>Each definition (a binding, modification or deletion) of the unit is a bit. For every
 * reachable block, the analysis computes by iteration to a fixpoint the set of definitions that
 * may reach its entry:
 *
 * <pre>
 * IN[b]  = union of OUT[p] for each reachable predecessor p of b
 * OUT[b] = (IN[b] - KILL[b]) | GEN[b]
 * </pre>
 *
 * where KILL[b] holds every definition of a variable that b defines, and GEN[b] the last
 * definition of each such variable in b. Graphs are solved outermost first; a nested function,
 * class or lambda starts from the definitions leaving the block in which it is defined.
 *
 * <p>Calls are spliced in: where the name of a function is read and its only reaching definition
 * is a def statement (or the assignment of a lambda), the call also performs, at the call site,
 * the uses and definitions of outer variables made by the function and by the functions it calls
 * in turn. A class statement likewise performs those of its body. Definitions made through a call
 * may happen, so they add to the reaching set without killing. Recursive calls are not spliced.
 */
final class ReachingDefinitions {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final FlowGraphs graphs;
  private final ListMultimap<CfgLoc, VarEvent> eventsByLoc;
  private final ListMultimap<Scope, VarEvent> outsideScopeEvents;
  private final ScopeResolver.Resolution resolution;

  // The definitions of the unit, indexed by bit.
  private final List<VarEvent> defs = new ArrayList<>();
  private final Map<VarEvent, Integer> bits = new IdentityHashMap<>();
  private final Map<Variable, BitSet> defsOf = new HashMap<>();

  // Events performed by a call, keyed by the event that triggers them.
  private Map<VarEvent, List<VarEvent>> callEffects = Collections.emptyMap();

  private final Map<CfgBlock, BitSet> in = new IdentityHashMap<>();
  private final Map<CfgBlock, BitSet> out = new IdentityHashMap<>();

  // Results.
  final Map<CallSite, Scope> callTargets = new LinkedHashMap<>();
  ImmutableSetMultimap<Scope, Scope> callGraph = ImmutableSetMultimap.of();

  private ReachingDefinitions(
      FlowGraphs graphs,
      List<VarEvent> events,
      ListMultimap<CfgLoc, VarEvent> eventsByLoc,
      ListMultimap<Scope, VarEvent> outsideScopeEvents,
      ScopeResolver.Resolution resolution) {
    this.graphs = graphs;
    this.eventsByLoc = eventsByLoc;
    this.outsideScopeEvents = outsideScopeEvents;
    this.resolution = resolution;
    for (VarEvent event : events) {
      if (event.getKind().isDefinition()) {
        int bit = defs.size();
        defs.add(event);
        bits.put(event, bit);
        defsOf.computeIfAbsent(event.getVariable(), v -> new BitSet()).set(bit);
      }
    }
  }

  /**
   * Links the events of a unit: every use to the definitions that may reach it, and every
   * definition to the earlier definitions it may overwrite.
   */
  static ReachingDefinitions collect(
      FlowGraphs graphs,
      List<VarEvent> events,
      ListMultimap<CfgLoc, VarEvent> eventsByLoc,
      ListMultimap<Scope, VarEvent> outsideScopeEvents,
      List<CallSite> callSites,
      ScopeResolver.Resolution resolution,
      AnalysisOptions options) {
    ReachingDefinitions rd =
        new ReachingDefinitions(graphs, events, eventsByLoc, outsideScopeEvents, resolution);
    rd.solve();
    rd.resolveCalls(callSites);
    if (options.interproceduralCalls() && !rd.callTargets.isEmpty()) {
      // Solve again, now that the functions called are known.
      for (VarEvent event : events) {
        event.clearLinks();
      }
      rd.callEffects = rd.computeCallEffects();
      rd.solve();
    }

    Map<VarEvent, Integer> order = new IdentityHashMap<>();
    for (VarEvent event : events) {
      order.put(event, order.size());
    }
    Comparator<VarEvent> byOrder = Comparator.comparingInt(order::get);
    for (VarEvent event : events) {
      event.sortLinks(byOrder);
    }
    return rd;
  }

  private void solve() {
    in.clear();
    out.clear();
    for (ControlFlowGraph graph : graphs.getGraphs().values()) {
      BitSet seed = new BitSet();
      CfgLoc definingLoc = graph.getDefiningLoc();
      if (definingLoc != null && out.containsKey(definingLoc.getBlock())) {
        seed.or(out.get(definingLoc.getBlock()));
      }
      solve(graph, seed);
      for (CfgBlock block : graph.getBlocks()) {
        link(block);
      }
    }
  }

  // Computes IN and OUT of the reachable blocks of a graph.
  private void solve(ControlFlowGraph graph, BitSet seed) {
    ImmutableList<CfgBlock> blocks = graph.getBlocks();
    Map<CfgBlock, BitSet> gen = new IdentityHashMap<>();
    Map<CfgBlock, BitSet> kill = new IdentityHashMap<>();
    for (CfgBlock block : blocks) {
      BitSet g = new BitSet();
      BitSet k = new BitSet();
      transfer(block, g, k);
      gen.put(block, g);
      kill.put(block, k);
    }

    Deque<CfgBlock> worklist = new ArrayDeque<>(blocks);
    Set<CfgBlock> queued = Collections.newSetFromMap(new IdentityHashMap<>());
    queued.addAll(blocks);
    int visits = 0;
    while (!worklist.isEmpty()) {
      CfgBlock block = worklist.poll();
      queued.remove(block);
      visits++;

      BitSet entry = new BitSet();
      if (block == graph.getStart()) {
        entry.or(seed);
      }
      for (CfgEdge edge : block.getPredecessors()) {
        BitSet predOut = out.get(edge.getSource());
        if (edge.getSource().isReachable() && predOut != null) {
          entry.or(predOut);
        }
      }
      in.put(block, entry);

      BitSet exit = (BitSet) entry.clone();
      exit.andNot(kill.get(block));
      exit.or(gen.get(block));
      if (!exit.equals(out.get(block))) {
        out.put(block, exit);
        for (CfgEdge edge : block.getSuccessors()) {
          CfgBlock succ = edge.getTarget();
          if (succ.isReachable() && queued.add(succ)) {
            worklist.add(succ);
          }
        }
      }
    }
    logger.atFine().log(
        "reaching definitions of %s stable after %d visits of %d blocks",
        graph, visits, blocks.size());
  }

  // Computes the definitions generated and killed by a block.
  private void transfer(CfgBlock block, BitSet gen, BitSet kill) {
    for (CfgLoc loc : block.getLocs()) {
      for (VarEvent event : eventsByLoc.get(loc)) {
        if (event.getKind().isDefinition()) {
          BitSet all = defsOf.get(event.getVariable());
          kill.or(all);
          gen.andNot(all);
          gen.set(bits.get(event));
        }
        for (VarEvent effect : effectsOf(event)) {
          if (effect.getKind().isDefinition()) {
            gen.set(bits.get(effect));
          }
        }
      }
    }
  }

  // Links the events of a block, replaying its transfer from IN.
  private void link(CfgBlock block) {
    BitSet reaching = (BitSet) in.get(block).clone();
    for (CfgLoc loc : block.getLocs()) {
      for (VarEvent event : eventsByLoc.get(loc)) {
        if (event.getKind().isUse()) {
          linkUses(reaching, event);
        }
        if (event.getKind().isDefinition()) {
          BitSet earlier = reachingDefsOf(reaching, event.getVariable());
          for (int i = earlier.nextSetBit(0); i >= 0; i = earlier.nextSetBit(i + 1)) {
            if (defs.get(i) != event) {
              VarEvent.linkRedefinition(defs.get(i), event);
            }
          }
          reaching.andNot(defsOf.get(event.getVariable()));
          reaching.set(bits.get(event));
        }
        for (VarEvent effect : effectsOf(event)) {
          if (effect.getKind().isUse()) {
            linkUses(reaching, effect);
          }
          if (effect.getKind().isDefinition()) {
            reaching.set(bits.get(effect));
          }
        }
      }
    }
  }

  /**
   * Returns the definitions of a variable that may reach the start of a location, in order of
   * appearance. Nothing reaches an unreachable location.
   */
  ImmutableList<VarEvent> definitionsReaching(CfgLoc target, Variable var) {
    BitSet entry = in.get(target.getBlock());
    if (entry == null) {
      return ImmutableList.of();
    }
    BitSet reaching = (BitSet) entry.clone();
    for (CfgLoc loc : target.getBlock().getLocs()) {
      if (loc == target) {
        break;
      }
      for (VarEvent event : eventsByLoc.get(loc)) {
        if (event.getKind().isDefinition()) {
          reaching.andNot(defsOf.get(event.getVariable()));
          reaching.set(bits.get(event));
        }
        for (VarEvent effect : effectsOf(event)) {
          if (effect.getKind().isDefinition()) {
            reaching.set(bits.get(effect));
          }
        }
      }
    }
    BitSet found = reachingDefsOf(reaching, var);
    ImmutableList.Builder<VarEvent> result = ImmutableList.builder();
    for (int i = found.nextSetBit(0); i >= 0; i = found.nextSetBit(i + 1)) {
      result.add(defs.get(i));
    }
    return result.build();
  }

  private void linkUses(BitSet reaching, VarEvent use) {
    BitSet found = reachingDefsOf(reaching, use.getVariable());
    for (int i = found.nextSetBit(0); i >= 0; i = found.nextSetBit(i + 1)) {
      VarEvent.linkUse(defs.get(i), use);
    }
  }

  // Returns the definitions of a variable among the reaching ones.
  private BitSet reachingDefsOf(BitSet reaching, Variable var) {
    BitSet result = (BitSet) reaching.clone();
    BitSet all = defsOf.get(var);
    if (all == null) {
      result.clear(); // never defined
    } else {
      result.and(all);
    }
    return result;
  }

  private List<VarEvent> effectsOf(VarEvent event) {
    List<VarEvent> effects = callEffects.get(event);
    return effects != null ? effects : ImmutableList.of();
  }

  // ==== calls ====

  // Finds the function called at each site, from the only definition reaching its name.
  private void resolveCalls(List<CallSite> callSites) {
    ImmutableSetMultimap.Builder<Scope, Scope> graph = ImmutableSetMultimap.builder();
    for (CallSite site : callSites) {
      List<VarEvent> reaching = site.getCallee().getDefinitions();
      if (reaching.size() != 1) {
        continue;
      }
      Scope target = definedFunction(reaching.get(0));
      if (target != null) {
        callTargets.put(site, target);
        graph.put(site.getCaller(), target);
      }
    }
    callGraph = graph.build();
  }

  // Returns the scope of the function or lambda bound by a definition, or null.
  @Nullable
  private Scope definedFunction(VarEvent def) {
    Identifier name = def.getNode();
    Node parent = name.getParent();
    if (def.getKind() == VarEventKind.ASSIGN || def.getKind() == VarEventKind.REASSIGN) {
      if (parent instanceof DefStatement && ((DefStatement) parent).getIdentifier() == name) {
        return resolution.getScope(parent);
      }
      if (parent instanceof AssignmentStatement) {
        AssignmentStatement assign = (AssignmentStatement) parent;
        if (assign.getLHS() == name && assign.getRHS() instanceof LambdaExpression) {
          return resolution.getScope(assign.getRHS());
        }
      }
    }
    return null;
  }

  private Map<VarEvent, List<VarEvent>> computeCallEffects() {
    Map<Scope, List<VarEvent>> summaries = new IdentityHashMap<>();
    Map<VarEvent, List<VarEvent>> effects = new IdentityHashMap<>();
    for (Map.Entry<CallSite, Scope> e : callTargets.entrySet()) {
      CallSite site = e.getKey();
      Scope target = e.getValue();
      if (target.encloses(site.getCaller())) {
        continue; // recursive
      }
      List<VarEvent> summary = summarize(target, summaries, new ArrayDeque<>());
      if (!summary.isEmpty()) {
        effects.put(site.getCallee(), summary);
      }
    }
    // A class body runs where the class is defined.
    for (Scope scope : resolution.getScopes()) {
      if (scope.getKind() == Scope.Kind.CLASS) {
        List<VarEvent> summary = summarize(scope, summaries, new ArrayDeque<>());
        VarEvent binding = bindingOf(((ClassStatement) scope.getOwner()).getIdentifier());
        if (binding != null && !summary.isEmpty()) {
          effects.put(binding, summary);
        }
      }
    }
    return ImmutableMap.copyOf(effects);
  }

  @Nullable
  private VarEvent bindingOf(Identifier name) {
    CfgLoc loc = graphs.getLoc(name.getParent());
    if (loc != null) {
      for (VarEvent event : eventsByLoc.get(loc)) {
        if (event.getNode() == name) {
          return event;
        }
      }
    }
    return null;
  }

  /**
   * Returns the events of a function on variables outside it: its own, and those of the functions
   * it calls. A function already on the stack contributes nothing.
   */
  private List<VarEvent> summarize(
      Scope function, Map<Scope, List<VarEvent>> summaries, Deque<Scope> stack) {
    List<VarEvent> summary = summaries.get(function);
    if (summary != null) {
      return summary;
    }
    if (stack.contains(function)) {
      return ImmutableList.of();
    }
    stack.push(function);
    List<VarEvent> result = new ArrayList<>();
    for (VarEvent event : outsideScopeEvents.get(function)) {
      if (runsWith(resolution.getEnclosingScope(event.getNode()), function)) {
        result.add(event);
      }
    }
    for (Map.Entry<CallSite, Scope> e : callTargets.entrySet()) {
      if (!runsWith(e.getKey().getCaller(), function) || e.getValue().encloses(function)) {
        continue;
      }
      for (VarEvent event : summarize(e.getValue(), summaries, stack)) {
        if (!function.encloses(event.getVariable().getScope()) && !result.contains(event)) {
          result.add(event);
        }
      }
    }
    stack.pop();
    summary = ImmutableList.copyOf(result);
    summaries.put(function, summary);
    return summary;
  }

  // Reports whether code in scope inner runs when the given function runs: inner is the function
  // itself or a comprehension within it. Nested functions run only when called.
  private static boolean runsWith(@Nullable Scope inner, Scope function) {
    Scope s = inner;
    while (s != null && s != function && s.getKind() == Scope.Kind.COMPREHENSION) {
      s = s.getParent();
    }
    return s == function;
  }
}

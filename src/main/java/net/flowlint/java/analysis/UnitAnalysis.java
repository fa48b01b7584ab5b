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
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.flowlint.java.cfg.CfgLoc;
import net.flowlint.java.cfg.FlowGraphs;
import net.flowlint.java.syntax.Identifier;
import net.flowlint.java.syntax.Node;
import net.flowlint.java.syntax.SourceFile;

/**
 * The analysis of one unit of code: its control-flow graphs and, unless the unit inspects its
 * variables by name, its scopes and linked variable events.
 *
 * <p>The event queries of a unit without dataflow facts throw {@link IllegalStateException}.
 */
public final class UnitAnalysis {

  private final SourceFile file;
  private final FlowGraphs graphs;
  @Nullable private final UnknowableLocalsException unknowable;

  // The remaining fields are null (or empty) when dataflow is unavailable.
  @Nullable private final ScopeResolver.Resolution resolution;
  private final ImmutableList<VarEvent> events;
  private final ImmutableListMultimap<CfgLoc, VarEvent> eventsByLoc;
  private final ImmutableListMultimap<Scope, VarEvent> outsideScopeEvents;
  private final ImmutableList<CallSite> callSites;
  private final ImmutableMap<CallSite, Scope> callTargets;
  private final ImmutableSetMultimap<Scope, Scope> callGraph;
  @Nullable private final ReachingDefinitions reachingDefinitions;
  private final Map<Identifier, List<VarEvent>> eventsByNode = new IdentityHashMap<>();

  private UnitAnalysis(
      SourceFile file,
      FlowGraphs graphs,
      @Nullable UnknowableLocalsException unknowable,
      @Nullable ScopeResolver.Resolution resolution,
      @Nullable VarEventCollector collector,
      @Nullable ReachingDefinitions reachingDefinitions) {
    this.file = file;
    this.graphs = graphs;
    this.unknowable = unknowable;
    this.resolution = resolution;
    this.reachingDefinitions = reachingDefinitions;
    if (collector != null) {
      this.events = ImmutableList.copyOf(collector.events);
      this.eventsByLoc = ImmutableListMultimap.copyOf(collector.eventsByLoc);
      this.outsideScopeEvents = ImmutableListMultimap.copyOf(collector.outsideScopeEvents);
      this.callSites = ImmutableList.copyOf(collector.callSites);
      for (VarEvent event : events) {
        eventsByNode.computeIfAbsent(event.getNode(), n -> new ArrayList<>()).add(event);
      }
    } else {
      this.events = ImmutableList.of();
      this.eventsByLoc = ImmutableListMultimap.of();
      this.outsideScopeEvents = ImmutableListMultimap.of();
      this.callSites = ImmutableList.of();
    }
    if (reachingDefinitions != null) {
      this.callTargets = ImmutableMap.copyOf(reachingDefinitions.callTargets);
      this.callGraph = reachingDefinitions.callGraph;
    } else {
      this.callTargets = ImmutableMap.of();
      this.callGraph = ImmutableSetMultimap.of();
    }
  }

  static UnitAnalysis of(
      SourceFile file,
      FlowGraphs graphs,
      ScopeResolver.Resolution resolution,
      VarEventCollector collector,
      ReachingDefinitions reachingDefinitions) {
    return new UnitAnalysis(file, graphs, null, resolution, collector, reachingDefinitions);
  }

  static UnitAnalysis unknowable(
      SourceFile file, FlowGraphs graphs, UnknowableLocalsException reason) {
    return new UnitAnalysis(file, graphs, reason, null, null, null);
  }

  public SourceFile getSourceFile() {
    return file;
  }

  public FlowGraphs getFlowGraphs() {
    return graphs;
  }

  /** Reports whether the unit has scopes and variable events. */
  public boolean isDataflowAvailable() {
    return unknowable == null;
  }

  /** Returns why the unit has no dataflow facts, or null if it has them. */
  @Nullable
  public UnknowableLocalsException getUnknowableReason() {
    return unknowable;
  }

  private void checkAvailable() {
    if (unknowable != null) {
      throw new IllegalStateException("no dataflow facts: " + unknowable.getMessage());
    }
  }

  public ScopeResolver.Resolution getResolution() {
    checkAvailable();
    return resolution;
  }

  /** Returns all events of the unit, in the order they were collected. */
  public ImmutableList<VarEvent> getEvents() {
    checkAvailable();
    return events;
  }

  /** Returns the events of a location, in evaluation order. */
  public ImmutableList<VarEvent> getEvents(CfgLoc loc) {
    checkAvailable();
    return eventsByLoc.get(loc);
  }

  /** Returns the events of one occurrence of a name: none for a builtin, two for {@code x += 1}. */
  public ImmutableList<VarEvent> getEvents(Identifier occurrence) {
    checkAvailable();
    List<VarEvent> result = eventsByNode.get(occurrence);
    return result == null ? ImmutableList.of() : ImmutableList.copyOf(result);
  }

  /**
   * Returns the events within the function, class, lambda or comprehension introduced by {@code
   * owner}, or within its nested scopes, on variables of enclosing scopes.
   */
  public ImmutableList<VarEvent> getOutsideScopeEvents(Node owner) {
    checkAvailable();
    Scope scope = resolution.getScope(owner);
    return scope == null ? ImmutableList.of() : outsideScopeEvents.get(scope);
  }

  /** Returns the calls made through names, in order of appearance. */
  public ImmutableList<CallSite> getCallSites() {
    checkAvailable();
    return callSites;
  }

  /** Returns the function or lambda scope that a call invokes, or null if it is not known. */
  @Nullable
  public Scope getCallTarget(CallSite site) {
    checkAvailable();
    return callTargets.get(site);
  }

  /** Returns the known calls between scopes, keyed by caller. */
  public ImmutableSetMultimap<Scope, Scope> getCallGraph() {
    checkAvailable();
    return callGraph;
  }

  /** Returns the definitions of a variable that may reach the start of a location. */
  public ImmutableList<VarEvent> getDefinitionsReaching(CfgLoc loc, Variable var) {
    checkAvailable();
    return reachingDefinitions.definitionsReaching(loc, var);
  }
}

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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import javax.annotation.Nullable;
import net.flowlint.java.cfg.CfgBuilder;
import net.flowlint.java.cfg.FlowGraphs;
import net.flowlint.java.syntax.ParserInput;
import net.flowlint.java.syntax.SourceFile;
import net.flowlint.java.syntax.SyntaxError;

/**
 * The entry point of the analyses: builds the control-flow graphs of a unit, resolves its names,
 * collects its variable events and links them by reaching definitions.
 */
public final class Analyzer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private Analyzer() {}

  /** The outcome of analyzing one of several units: an analysis, or the exception it raised. */
  public static final class Result {
    private final SourceFile unit;
    @Nullable private final UnitAnalysis analysis;
    @Nullable private final Throwable failure;

    private Result(SourceFile unit, @Nullable UnitAnalysis analysis, @Nullable Throwable failure) {
      this.unit = unit;
      this.analysis = analysis;
      this.failure = failure;
    }

    public SourceFile getUnit() {
      return unit;
    }

    public boolean succeeded() {
      return analysis != null;
    }

    /** Returns the analysis of the unit; fails if the analysis raised an exception. */
    public UnitAnalysis getAnalysis() {
      Preconditions.checkState(analysis != null, "analysis of %s failed", unit.getFileName());
      return analysis;
    }

    @Nullable
    public Throwable getFailure() {
      return failure;
    }
  }

  public static UnitAnalysis analyze(SourceFile file) {
    return analyze(file, AnalysisOptions.DEFAULT);
  }

  /**
   * Analyzes a parsed unit. A unit that inspects its variables by name is analyzed only for control
   * flow; see {@link UnitAnalysis#isDataflowAvailable}.
   */
  public static UnitAnalysis analyze(SourceFile file, AnalysisOptions options) {
    FlowGraphs graphs = CfgBuilder.build(file);
    ScopeResolver.Resolution resolution;
    try {
      resolution = ScopeResolver.resolve(file, options);
    } catch (UnknowableLocalsException ex) {
      logger.atInfo().log("%s: no dataflow facts: %s", file.getFileName(), ex.getMessage());
      return UnitAnalysis.unknowable(file, graphs, ex);
    }
    logger.atFine().log(
        "%s: resolved %d scopes", file.getFileName(), resolution.getScopes().size());

    VarEventCollector collector = VarEventCollector.collect(file, graphs, resolution, options);
    logger.atFine().log("%s: collected %d events", file.getFileName(), collector.events.size());

    ReachingDefinitions reachingDefinitions =
        ReachingDefinitions.collect(
            graphs,
            collector.events,
            collector.eventsByLoc,
            collector.outsideScopeEvents,
            collector.callSites,
            resolution,
            options);
    return UnitAnalysis.of(file, graphs, resolution, collector, reachingDefinitions);
  }

  /**
   * Parses and analyzes source text.
   *
   * @throws SyntaxError.Exception if the text does not parse
   */
  public static UnitAnalysis analyze(ParserInput input, AnalysisOptions options)
      throws SyntaxError.Exception {
    SourceFile file = SourceFile.parse(input, options.fileOptions());
    if (!file.ok()) {
      throw new SyntaxError.Exception(file.errors());
    }
    return analyze(file, options);
  }

  /**
   * Analyzes independent units concurrently. The results are in the order of the units; a unit
   * whose analysis fails does not affect the others.
   *
   * @throws InterruptedException if the calling thread is interrupted while waiting; the analyses
   *     still outstanding are cancelled
   */
  public static ImmutableList<Result> analyzeAll(
      List<SourceFile> units, AnalysisOptions options, ListeningExecutorService executor)
      throws InterruptedException {
    List<ListenableFuture<UnitAnalysis>> futures = new ArrayList<>();
    for (SourceFile unit : units) {
      futures.add(executor.submit(() -> analyze(unit, options)));
    }
    ImmutableList.Builder<Result> results = ImmutableList.builder();
    for (int i = 0; i < units.size(); i++) {
      SourceFile unit = units.get(i);
      try {
        results.add(new Result(unit, futures.get(i).get(), null));
      } catch (ExecutionException ex) {
        logger.atWarning().withCause(ex.getCause()).log(
            "analysis of %s failed", unit.getFileName());
        results.add(new Result(unit, null, ex.getCause()));
      } catch (InterruptedException ex) {
        for (ListenableFuture<UnitAnalysis> future : futures) {
          future.cancel(true);
        }
        throw ex;
      }
    }
    return results.build();
  }
}

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

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ForwardingListeningExecutorService;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import net.flowlint.java.syntax.FileOptions;
import net.flowlint.java.syntax.ParserInput;
import net.flowlint.java.syntax.SourceFile;
import net.flowlint.java.syntax.SyntaxError;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AnalyzerTest {

  @Test
  public void unitWithNamedScopeInspectionHasOnlyControlFlow() throws Exception {
    SourceFile file =
        SourceFile.parseStrict(
            ParserInput.fromLines(
                "def f():", //
                "  x = 1",
                "  return locals()"));
    UnitAnalysis unit = Analyzer.analyze(file);
    assertThat(unit.isDataflowAvailable()).isFalse();
    assertThat(unit.getUnknowableReason().getCallLocation().line()).isEqualTo(3);
    assertThat(unit.getFlowGraphs().getGraphs()).hasSize(2);
    IllegalStateException ex = assertThrows(IllegalStateException.class, unit::getEvents);
    assertThat(ex).hasMessageThat().startsWith("no dataflow facts: ");
  }

  @Test
  public void analyzeSourceText() throws Exception {
    UnitAnalysis unit =
        Analyzer.analyze(ParserInput.fromLines("x = 1", "print(x)"), AnalysisOptions.DEFAULT);
    assertThat(unit.isDataflowAvailable()).isTrue();
    assertThat(unit.getUnknowableReason()).isNull();
    assertThat(unit.getEvents()).hasSize(2);
    assertThat(unit.getSourceFile().getStatements()).hasSize(2);
  }

  @Test
  public void analyzeRejectsSyntaxErrors() throws Exception {
    SyntaxError.Exception ex =
        assertThrows(
            SyntaxError.Exception.class,
            () -> Analyzer.analyze(ParserInput.fromLines("x = = 1"), AnalysisOptions.DEFAULT));
    assertThat(ex.errors()).isNotEmpty();
  }

  @Test
  public void parsingFollowsTheFileOptions() throws Exception {
    AnalysisOptions options =
        AnalysisOptions.builder()
            .fileOptions(FileOptions.builder().allowTabsInIndentation(false).build())
            .build();
    assertThrows(
        SyntaxError.Exception.class,
        () -> Analyzer.analyze(ParserInput.fromLines("if x:", "\ty = 1"), options));
    Analyzer.analyze(ParserInput.fromLines("if x:", "\ty = 1"), AnalysisOptions.DEFAULT);
  }

  @Test
  public void analyzeAllKeepsTheOrderOfUnits() throws Exception {
    ImmutableList<SourceFile> units =
        ImmutableList.of(
            SourceFile.parseStrict(ParserInput.fromLines("a = 1")),
            SourceFile.parseStrict(ParserInput.fromLines("vars()")),
            SourceFile.parseStrict(ParserInput.fromLines("b = 1", "c = b")));
    ListeningExecutorService executor =
        MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(2));
    try {
      ImmutableList<Analyzer.Result> results =
          Analyzer.analyzeAll(units, AnalysisOptions.DEFAULT, executor);
      assertThat(results).hasSize(3);
      for (int i = 0; i < 3; i++) {
        assertThat(results.get(i).getUnit()).isSameInstanceAs(units.get(i));
        assertThat(results.get(i).succeeded()).isTrue();
        assertThat(results.get(i).getFailure()).isNull();
      }
      assertThat(results.get(0).getAnalysis().getEvents()).hasSize(1);
      assertThat(results.get(1).getAnalysis().isDataflowAvailable()).isFalse();
      assertThat(results.get(2).getAnalysis().getEvents()).hasSize(3);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void interruptedAnalyzeAllCancelsOutstandingUnits() throws Exception {
    ImmutableList<SourceFile> units =
        ImmutableList.of(
            SourceFile.parseStrict(ParserInput.fromLines("a = 1")),
            SourceFile.parseStrict(ParserInput.fromLines("b = 1")));
    ListeningExecutorService delegate =
        MoreExecutors.listeningDecorator(Executors.newSingleThreadExecutor());
    List<Future<?>> submitted = new ArrayList<>();
    ListeningExecutorService executor =
        new ForwardingListeningExecutorService() {
          @Override
          protected ListeningExecutorService delegate() {
            return delegate;
          }

          @Override
          public <T> ListenableFuture<T> submit(Callable<T> task) {
            ListenableFuture<T> future = super.submit(task);
            submitted.add(future);
            return future;
          }
        };
    CountDownLatch release = new CountDownLatch(1);
    try {
      // Occupies the only thread, so the units stay queued.
      ListenableFuture<?> unused =
          delegate.submit(
              () -> {
                release.await();
                return null;
              });
      Thread.currentThread().interrupt();
      assertThrows(
          InterruptedException.class,
          () -> Analyzer.analyzeAll(units, AnalysisOptions.DEFAULT, executor));
      assertThat(submitted).hasSize(2);
      for (Future<?> future : submitted) {
        assertThat(future.isCancelled()).isTrue();
      }
    } finally {
      Thread.interrupted();
      release.countDown();
      delegate.shutdownNow();
    }
  }
}

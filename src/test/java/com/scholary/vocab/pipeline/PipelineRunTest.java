package com.scholary.vocab.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.vocab.term.Term;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PipelineRunTest {

  private PipelineRun run;

  @BeforeEach
  void setUp() {
    run = new PipelineRun("run-1", new RunRequest(Path.of("in.txt"), Path.of("out.csv")));
    run.setTerms(List.of(new Term("Каша"), new Term("Мир")));
  }

  @Test
  void setTerms_shouldStartEveryTermPending() {
    assertThat(run.getTermState(0)).isEqualTo(TermState.PENDING);
    assertThat(run.getTermStateCounts()).containsEntry(TermState.PENDING, 2).hasSize(1);
  }

  @Test
  void transition_shouldNotLeaveTerminalState() {
    assertThat(run.transition(0, TermState.TRANSLATING)).isTrue();
    assertThat(run.transition(0, TermState.FAILED)).isTrue();

    assertThat(run.transition(0, TermState.RESOLVED)).isFalse();
    assertThat(run.getTermState(0)).isEqualTo(TermState.FAILED);
  }

  @Test
  void cancel_shouldOnlySucceedOnce() {
    assertThat(run.cancel()).isTrue();
    assertThat(run.cancel()).isFalse();
    assertThat(run.isCancelled()).isTrue();
    assertThat(run.shouldStop()).isTrue();
  }

  @Test
  void cancel_shouldBeRefusedAfterCompletion() {
    run.complete(RunReport.failed("run-1", "boom", List.of()));

    assertThat(run.cancel()).isFalse();
    assertThat(run.getPhase()).isEqualTo(RunPhase.FAILED);
    assertThat(run.getReport()).map(RunReport::error).contains("boom");
  }

  @Test
  void abort_shouldStopWithoutMarkingCancelled() {
    run.abort();

    assertThat(run.shouldStop()).isTrue();
    assertThat(run.isCancelled()).isFalse();
  }

  @Test
  void getReport_shouldBeEmptyWhileRunning() {
    assertThat(run.getReport()).isEmpty();
    assertThat(run.completion()).isNotDone();
  }
}

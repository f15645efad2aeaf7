package com.scholary.vocab.api;

import com.scholary.vocab.pipeline.PipelineRun;
import com.scholary.vocab.pipeline.RunPhase;
import com.scholary.vocab.pipeline.RunReport;
import com.scholary.vocab.pipeline.TermState;
import java.util.Map;

/**
 * Response for a run status query.
 *
 * <p>Shows the current phase and per-state term counts, and the report once the run is finished.
 */
public record JobStatusResponse(
    String runId,
    RunPhase phase,
    boolean cancelRequested,
    int totalTerms,
    Map<TermState, Integer> termStates,
    RunReport report) {

  static JobStatusResponse of(PipelineRun run) {
    return new JobStatusResponse(
        run.getRunId(),
        run.getPhase(),
        run.isCancelled(),
        run.getTerms().size(),
        run.getTermStateCounts(),
        run.getReport().orElse(null));
  }
}

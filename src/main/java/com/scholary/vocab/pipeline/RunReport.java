package com.scholary.vocab.pipeline;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a pipeline run.
 *
 * @param output the table written, or null when the run ended without writing one
 * @param audioFilenames filenames assigned in this run, in table order
 * @param error message of the fatal error for a FAILED run, otherwise null
 */
public record RunReport(
    String runId,
    RunPhase phase,
    Path output,
    int recordsWritten,
    List<TermFailure> failures,
    List<String> audioFilenames,
    long translationCacheHits,
    long audioCacheHits,
    String error) {

  public RunReport {
    failures = List.copyOf(failures);
    audioFilenames = List.copyOf(audioFilenames);
  }

  static RunReport failed(String runId, String error, List<TermFailure> failures) {
    return new RunReport(runId, RunPhase.FAILED, null, 0, failures, List.of(), 0, 0, error);
  }
}

package com.scholary.vocab.pipeline;

import com.scholary.vocab.term.Term;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReferenceArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle on a pipeline run: phase, per-term states, cancellation and the final report.
 *
 * <p>Safe to read from any thread while the run is in progress.
 */
public class PipelineRun {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineRun.class);

  private final String runId;
  private final RunRequest request;
  private final Instant createdAt;
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final AtomicBoolean aborted = new AtomicBoolean();
  private final CompletableFuture<RunReport> completion = new CompletableFuture<>();

  private volatile RunPhase phase = RunPhase.PARSING;
  private volatile List<Term> terms = List.of();
  private volatile AtomicReferenceArray<TermState> states = new AtomicReferenceArray<>(0);

  public PipelineRun(String runId, RunRequest request) {
    this.runId = runId;
    this.request = request;
    this.createdAt = Instant.now();
  }

  public String getRunId() {
    return runId;
  }

  public RunRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public RunPhase getPhase() {
    return phase;
  }

  public List<Term> getTerms() {
    return terms;
  }

  public TermState getTermState(int index) {
    return states.get(index);
  }

  /** Number of terms in each state. */
  public Map<TermState, Integer> getTermStateCounts() {
    Map<TermState, Integer> counts = new EnumMap<>(TermState.class);
    AtomicReferenceArray<TermState> current = states;
    for (int i = 0; i < current.length(); i++) {
      counts.merge(current.get(i), 1, Integer::sum);
    }
    return counts;
  }

  /**
   * Request cancellation. Terms that have not started yet fail as CANCELLED, requests already in
   * flight run to completion or timeout, and no table is written.
   *
   * @return false if the run had already finished or was already cancelled
   */
  public boolean cancel() {
    if (phase.isTerminal()) {
      return false;
    }
    boolean first = cancelled.compareAndSet(false, true);
    if (first) {
      LOGGER.info("Cancellation requested: runId={}", runId);
    }
    return first;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** The final report, once the run has finished. */
  public Optional<RunReport> getReport() {
    return Optional.ofNullable(completion.getNow(null));
  }

  /** Block until the run finishes. */
  public RunReport await() {
    return completion.join();
  }

  public CompletableFuture<RunReport> completion() {
    return completion;
  }

  boolean shouldStop() {
    return cancelled.get() || aborted.get();
  }

  /** Stop starting new work after a fatal error in one term. */
  void abort() {
    aborted.set(true);
  }

  void setPhase(RunPhase phase) {
    this.phase = phase;
  }

  void setTerms(List<Term> terms) {
    AtomicReferenceArray<TermState> initial = new AtomicReferenceArray<>(terms.size());
    for (int i = 0; i < terms.size(); i++) {
      initial.set(i, TermState.PENDING);
    }
    this.terms = List.copyOf(terms);
    this.states = initial;
  }

  /**
   * Move a term to a new state unless it already reached a terminal one. A term that timed out
   * stays FAILED even if its worker finishes later.
   */
  boolean transition(int index, TermState next) {
    while (true) {
      TermState current = states.get(index);
      if (current.isTerminal()) {
        return false;
      }
      if (states.compareAndSet(index, current, next)) {
        return true;
      }
    }
  }

  void complete(RunReport report) {
    this.phase = report.phase();
    completion.complete(report);
  }
}

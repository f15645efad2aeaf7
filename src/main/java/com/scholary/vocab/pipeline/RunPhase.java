package com.scholary.vocab.pipeline;

/** Where a pipeline run is. DONE, FAILED and CANCELLED are terminal. */
public enum RunPhase {
  PARSING,
  RESOLVING,
  ASSEMBLING,
  WRITING,
  DONE,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED || this == CANCELLED;
  }
}

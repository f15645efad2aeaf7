package com.scholary.vocab.pipeline;

/**
 * Progress of a single term through a run.
 *
 * <pre>
 * PENDING -> TRANSLATING -> SYNTHESIZING -> RESOLVED -> ASSEMBLED
 *    \___________\______________\_____________\-------> FAILED
 * </pre>
 */
public enum TermState {
  PENDING,
  TRANSLATING,
  SYNTHESIZING,
  RESOLVED,
  ASSEMBLED,
  FAILED;

  public boolean isTerminal() {
    return this == ASSEMBLED || this == FAILED;
  }
}

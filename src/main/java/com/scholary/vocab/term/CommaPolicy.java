package com.scholary.vocab.term;

/** How a comma inside an input line is interpreted. */
public enum CommaPolicy {
  /** Every comma-separated variant becomes its own flashcard. */
  SPLIT,
  /** The whole line is one term, commas included. */
  SINGLE
}

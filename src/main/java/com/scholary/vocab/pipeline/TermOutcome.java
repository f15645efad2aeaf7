package com.scholary.vocab.pipeline;

import com.scholary.vocab.script.PronunciationScript;
import com.scholary.vocab.term.Term;
import com.scholary.vocab.translation.TranslationResult;

/** Result of resolving one term: its translation and audio, a failure, or a fatal error. */
record TermOutcome(
    int index,
    Term term,
    TranslationResult translation,
    PronunciationScript script,
    byte[] audio,
    TermFailure failure,
    RuntimeException fatal) {

  static TermOutcome resolved(
      int index, Term term, TranslationResult translation, PronunciationScript script, byte[] audio) {
    return new TermOutcome(index, term, translation, script, audio, null, null);
  }

  static TermOutcome failed(int index, Term term, TermFailure failure) {
    return new TermOutcome(index, term, null, null, null, failure, null);
  }

  static TermOutcome fatal(int index, Term term, RuntimeException error) {
    return new TermOutcome(index, term, null, null, null, null, error);
  }

  boolean isFailed() {
    return failure != null;
  }

  boolean isFatal() {
    return fatal != null;
  }
}

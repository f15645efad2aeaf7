package com.scholary.vocab.pipeline;

import com.scholary.vocab.record.IncompleteRecordException;
import com.scholary.vocab.speech.SynthesisRejectedException;
import com.scholary.vocab.speech.SynthesisUnavailableException;
import com.scholary.vocab.table.UnsafeFieldValueException;
import com.scholary.vocab.translation.TranslationRejectedException;
import com.scholary.vocab.translation.TranslationUnavailableException;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/** Why a term was left out of the table. */
public enum FailureKind {
  TRANSLATION_UNAVAILABLE,
  TRANSLATION_REJECTED,
  SYNTHESIS_UNAVAILABLE,
  SYNTHESIS_REJECTED,
  INCOMPLETE_RECORD,
  UNSAFE_FIELD,
  TIMEOUT,
  CANCELLED;

  /**
   * Classify a per-term error.
   *
   * @return the kind, or empty when the error is not one a single term may fail with
   */
  static Optional<FailureKind> of(Throwable error) {
    if (error instanceof TranslationUnavailableException) {
      return Optional.of(TRANSLATION_UNAVAILABLE);
    }
    if (error instanceof TranslationRejectedException) {
      return Optional.of(TRANSLATION_REJECTED);
    }
    if (error instanceof SynthesisUnavailableException) {
      return Optional.of(SYNTHESIS_UNAVAILABLE);
    }
    if (error instanceof SynthesisRejectedException) {
      return Optional.of(SYNTHESIS_REJECTED);
    }
    if (error instanceof IncompleteRecordException) {
      return Optional.of(INCOMPLETE_RECORD);
    }
    if (error instanceof UnsafeFieldValueException) {
      return Optional.of(UNSAFE_FIELD);
    }
    if (error instanceof TimeoutException) {
      return Optional.of(TIMEOUT);
    }
    if (error instanceof CancellationException) {
      return Optional.of(CANCELLED);
    }
    return Optional.empty();
  }
}

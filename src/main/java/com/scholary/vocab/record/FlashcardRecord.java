package com.scholary.vocab.record;

import com.scholary.vocab.term.Term;
import com.scholary.vocab.translation.TranslationResult;

/** One row of the flashcard table. */
public record FlashcardRecord(
    Term term, TranslationResult translation, String audioFilename, String notes) {

  public FlashcardRecord {
    if (term == null || translation == null) {
      throw new IncompleteRecordException("Record requires a term and its translation");
    }
    if (audioFilename == null || audioFilename.isBlank()) {
      throw new IncompleteRecordException("Record requires an audio filename: " + term.text());
    }
    notes = notes == null ? "" : notes;
  }
}

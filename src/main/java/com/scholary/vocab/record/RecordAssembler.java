package com.scholary.vocab.record;

import com.scholary.vocab.audio.AudioAsset;
import com.scholary.vocab.term.Term;
import com.scholary.vocab.translation.TranslationResult;
import org.springframework.stereotype.Component;

/** Combines the resolved parts of a term into a flashcard record. */
@Component
public class RecordAssembler {

  /**
   * @param notes notes for the card; falls back to the term's own notes when null
   * @throws IncompleteRecordException if the translation or the audio is missing
   */
  public FlashcardRecord assemble(
      Term term, TranslationResult translation, AudioAsset audio, String notes) {
    checkComplete(term, translation, audio == null ? null : audio.audio());
    return new FlashcardRecord(
        term, translation, audio.filename(), notes == null ? term.notes() : notes);
  }

  /**
   * Check that a term has everything a record needs, before a filename is spent on it.
   *
   * @throws IncompleteRecordException if the translation or the audio is missing or empty
   */
  public void checkComplete(Term term, TranslationResult translation, byte[] audio) {
    if (term == null) {
      throw new IncompleteRecordException("Cannot assemble a record without a term");
    }
    if (translation == null) {
      throw new IncompleteRecordException("Missing translation for: " + term.text());
    }
    if (audio == null || audio.length == 0) {
      throw new IncompleteRecordException("Missing audio for: " + term.text());
    }
  }
}

package com.scholary.vocab.term;

/**
 * A single vocabulary unit to be turned into a flashcard.
 *
 * <p>Identity is the exact source text, so {@code "Мир"} and {@code "мир"} are different terms.
 * Notes never take part in equality checks done by the parser; the first occurrence of a text
 * decides its notes.
 */
public record Term(String text, String notes) {

  public Term {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Term text cannot be blank");
    }
    text = text.strip();
    notes = notes == null ? "" : notes.strip();
  }

  public Term(String text) {
    this(text, "");
  }
}

package com.scholary.vocab.translation;

/**
 * Translation of one term.
 *
 * @param romanized Latin transliteration of the source text; empty when romanization is off
 * @param translated the text in the target language
 */
public record TranslationResult(String romanized, String translated) {

  public TranslationResult {
    romanized = romanized == null ? "" : romanized;
    if (translated == null || translated.isBlank()) {
      throw new IllegalArgumentException("Translated text cannot be blank");
    }
  }
}

package com.scholary.vocab.cache;

import com.scholary.vocab.translation.TranslationResult;
import java.util.Optional;

/**
 * Cache of translation results, so re-runs over the same vocabulary skip the service.
 *
 * <p>Cache keys combine the language pair, whether romanization was requested and the exact term
 * text, so switching romanization on does not serve results that lack it.
 */
public interface TranslationCache {

  /**
   * Store a translation.
   *
   * @param cacheKey key from {@link #generateKey}
   * @param result the translation to cache
   */
  void put(String cacheKey, TranslationResult result);

  /**
   * Retrieve a cached translation.
   *
   * @param cacheKey key from {@link #generateKey}
   * @return the cached translation, or empty if not found
   */
  Optional<TranslationResult> get(String cacheKey);

  /** Persist the cache contents if the cache is backed by storage; otherwise a no-op. */
  void flush();

  /**
   * Generate a cache key for a term.
   *
   * @param sourceLanguage source language code
   * @param targetLanguage target language code
   * @param romanize whether the result carries a romanization
   * @param text exact term text
   * @return a unique cache key
   */
  static String generateKey(
      String sourceLanguage, String targetLanguage, boolean romanize, String text) {
    return String.format("%s>%s:%s:%s", sourceLanguage, targetLanguage, romanize ? "r" : "-", text);
  }
}

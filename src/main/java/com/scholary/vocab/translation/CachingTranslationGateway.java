package com.scholary.vocab.translation;

import com.scholary.vocab.cache.CacheStatistics;
import com.scholary.vocab.cache.TranslationCache;
import com.scholary.vocab.term.Term;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translation gateway that consults a {@link TranslationCache} before the delegate.
 *
 * <p>Only successful results are cached; a rejected or unavailable term is asked again next run.
 */
public class CachingTranslationGateway implements TranslationGateway, CacheStatistics {

  private static final Logger LOGGER = LoggerFactory.getLogger(CachingTranslationGateway.class);

  private final TranslationGateway delegate;
  private final TranslationCache cache;
  private final String sourceLanguage;
  private final String targetLanguage;
  private final boolean romanize;
  private final AtomicLong hits = new AtomicLong();

  public CachingTranslationGateway(
      TranslationGateway delegate,
      TranslationCache cache,
      String sourceLanguage,
      String targetLanguage,
      boolean romanize) {
    this.delegate = delegate;
    this.cache = cache;
    this.sourceLanguage = sourceLanguage;
    this.targetLanguage = targetLanguage;
    this.romanize = romanize;
  }

  @Override
  public TranslationResult translate(Term term) {
    String key = TranslationCache.generateKey(sourceLanguage, targetLanguage, romanize, term.text());

    Optional<TranslationResult> cached = cache.get(key);
    if (cached.isPresent()) {
      hits.incrementAndGet();
      return cached.get();
    }

    TranslationResult result = delegate.translate(term);
    cache.put(key, result);
    LOGGER.debug("Translated and cached: {} -> {}", term.text(), result.translated());
    return result;
  }

  @Override
  public long hitCount() {
    return hits.get();
  }
}

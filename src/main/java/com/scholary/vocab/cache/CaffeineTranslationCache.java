package com.scholary.vocab.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.vocab.translation.TranslationResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caffeine-backed translation cache with optional JSON persistence.
 *
 * <p>When a cache directory is configured, {@code translations.json} in that directory is loaded
 * at startup and rewritten on {@link #flush()}. A run interrupted part-way therefore resumes
 * without paying for the translations it already obtained.
 */
public class CaffeineTranslationCache implements TranslationCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaffeineTranslationCache.class);

  static final String FILE_NAME = "translations.json";

  private static final TypeReference<Map<String, TranslationResult>> ENTRIES =
      new TypeReference<>() {};

  private final Cache<String, TranslationResult> cache;
  private final Path file;
  private final ObjectMapper objectMapper;

  public CaffeineTranslationCache(int maxSize, Path cacheDir, ObjectMapper objectMapper) {
    this.cache = Caffeine.newBuilder().maximumSize(maxSize).build();
    this.file = cacheDir == null ? null : cacheDir.resolve(FILE_NAME);
    this.objectMapper = objectMapper;

    load();
    LOGGER.info(
        "Initialized translation cache: maxSize={}, file={}, entries={}",
        maxSize,
        file,
        cache.estimatedSize());
  }

  @Override
  public void put(String cacheKey, TranslationResult result) {
    cache.put(cacheKey, result);
    LOGGER.debug("Cached translation: key={}", cacheKey);
  }

  @Override
  public Optional<TranslationResult> get(String cacheKey) {
    TranslationResult result = cache.getIfPresent(cacheKey);
    if (result != null) {
      LOGGER.debug("Cache hit: key={}", cacheKey);
      return Optional.of(result);
    } else {
      LOGGER.debug("Cache miss: key={}", cacheKey);
      return Optional.empty();
    }
  }

  @Override
  public synchronized void flush() {
    if (file == null) {
      return;
    }
    // Sorted so the file diff stays readable between runs
    Map<String, TranslationResult> snapshot = new TreeMap<>(cache.asMap());
    try {
      Files.createDirectories(file.getParent());
      Path temp = Files.createTempFile(file.getParent(), FILE_NAME, ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      LOGGER.debug("Persisted {} translations to {}", snapshot.size(), file);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to persist translation cache: " + file, e);
    }
  }

  private void load() {
    if (file == null || !Files.isRegularFile(file)) {
      return;
    }
    try {
      Map<String, TranslationResult> entries = objectMapper.readValue(file.toFile(), ENTRIES);
      cache.putAll(entries);
      LOGGER.info("Loaded {} cached translations from {}", entries.size(), file);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load translation cache: " + file, e);
    }
  }
}

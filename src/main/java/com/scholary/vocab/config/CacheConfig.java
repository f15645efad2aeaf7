package com.scholary.vocab.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.vocab.cache.AudioCache;
import com.scholary.vocab.cache.CaffeineAudioCache;
import com.scholary.vocab.cache.CaffeineTranslationCache;
import com.scholary.vocab.cache.TranslationCache;
import com.scholary.vocab.speech.SpeechProperties;
import com.scholary.vocab.translation.TranslationProperties;
import java.nio.file.Path;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the translation and audio caches.
 *
 * <p>Both are persisted under {@code pipeline.cacheDir}; a blank value keeps them in memory only.
 */
@Configuration
public class CacheConfig {

  @Bean
  public TranslationCache translationCache(
      TranslationProperties translationProperties,
      PipelineProperties pipelineProperties,
      ObjectMapper objectMapper) {
    return new CaffeineTranslationCache(
        translationProperties.cacheMaxSize(), cacheDir(pipelineProperties), objectMapper);
  }

  @Bean
  public AudioCache audioCache(
      SpeechProperties speechProperties, PipelineProperties pipelineProperties) {
    Path cacheDir = cacheDir(pipelineProperties);
    return new CaffeineAudioCache(
        speechProperties.cacheMaxMegabytes(), cacheDir == null ? null : cacheDir.resolve("audio"));
  }

  private static Path cacheDir(PipelineProperties properties) {
    String cacheDir = properties.cacheDir();
    return cacheDir == null || cacheDir.isBlank() ? null : Path.of(cacheDir);
  }
}

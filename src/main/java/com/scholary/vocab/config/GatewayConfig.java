package com.scholary.vocab.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.vocab.cache.AudioCache;
import com.scholary.vocab.cache.TranslationCache;
import com.scholary.vocab.gateway.AccessTokenProvider;
import com.scholary.vocab.gateway.FileAccessTokenProvider;
import com.scholary.vocab.speech.CachingSpeechGateway;
import com.scholary.vocab.speech.GoogleSpeechClient;
import com.scholary.vocab.speech.SpeechGateway;
import com.scholary.vocab.speech.SpeechProperties;
import com.scholary.vocab.speech.SsmlRenderer;
import com.scholary.vocab.translation.CachingTranslationGateway;
import com.scholary.vocab.translation.GoogleTranslationClient;
import com.scholary.vocab.translation.TranslationGateway;
import com.scholary.vocab.translation.TranslationProperties;
import java.nio.file.Path;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the external service gateways.
 *
 * <p>Each gateway is the Google client wrapped in its cache. Credentials come from the token files
 * named in the properties; a missing file only fails once a request needs the token.
 */
@Configuration
public class GatewayConfig {

  @Bean
  public TranslationGateway translationGateway(
      TranslationProperties translationProperties,
      PipelineProperties pipelineProperties,
      TranslationCache translationCache,
      ObjectMapper objectMapper) {

    GoogleTranslationClient client =
        new GoogleTranslationClient(
            translationProperties,
            tokenProvider(translationProperties.tokenFile(), objectMapper),
            objectMapper,
            pipelineProperties.romanize());

    return new CachingTranslationGateway(
        client,
        translationCache,
        translationProperties.sourceLanguageCode(),
        translationProperties.targetLanguageCode(),
        pipelineProperties.romanize());
  }

  @Bean
  public SpeechGateway speechGateway(
      SpeechProperties speechProperties,
      AudioCache audioCache,
      SsmlRenderer ssmlRenderer,
      ObjectMapper objectMapper) {

    GoogleSpeechClient client =
        new GoogleSpeechClient(
            speechProperties,
            tokenProvider(speechProperties.tokenFile(), objectMapper),
            objectMapper,
            ssmlRenderer);

    return new CachingSpeechGateway(client, audioCache);
  }

  private static AccessTokenProvider tokenProvider(String tokenFile, ObjectMapper objectMapper) {
    Path path = tokenFile == null || tokenFile.isBlank() ? null : Path.of(tokenFile);
    return new FileAccessTokenProvider(path, objectMapper);
  }
}

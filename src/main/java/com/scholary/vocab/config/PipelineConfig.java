package com.scholary.vocab.config;

import com.scholary.vocab.script.VoiceConfig;
import com.scholary.vocab.speech.SpeechProperties;
import com.scholary.vocab.translation.TranslationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for pipeline beans.
 *
 * <p>Enables the property records to be loaded from application.yml and turns the voice settings
 * into the drill configuration.
 */
@Configuration
@EnableConfigurationProperties({
  PipelineProperties.class,
  VoiceProperties.class,
  TranslationProperties.class,
  SpeechProperties.class
})
public class PipelineConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineConfig.class);

  @Bean
  public VoiceConfig voiceConfig(VoiceProperties voiceProperties) {
    VoiceConfig config = voiceProperties.toVoiceConfig();
    LOGGER.info(
        "Drill voices: {} / {} / {}, gaps {}ms / {}ms / {}ms",
        config.nativeA().name(),
        config.nativeB().name(),
        config.target().name(),
        config.leadInGap().toMillis(),
        config.repeatGap().toMillis(),
        config.translationGap().toMillis());
    return config;
  }
}

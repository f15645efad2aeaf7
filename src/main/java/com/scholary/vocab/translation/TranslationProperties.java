package com.scholary.vocab.translation;

import com.scholary.vocab.gateway.HttpGatewayProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Cloud Translation client.
 *
 * <p>The token file path usually comes from the {@code TRANSLATE_TOKEN_FILE} environment
 * variable, see application.yml.
 */
@ConfigurationProperties(prefix = "translation")
@Validated
public record TranslationProperties(
    @NotBlank String baseUrl,
    @NotBlank String projectId,
    @NotBlank String location,
    @NotBlank String sourceLanguageCode,
    @NotBlank String targetLanguageCode,
    String tokenFile,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Positive long backoffMillis,
    @Positive int cacheMaxSize)
    implements HttpGatewayProperties {}

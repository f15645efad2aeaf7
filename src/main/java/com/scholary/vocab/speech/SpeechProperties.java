package com.scholary.vocab.speech;

import com.scholary.vocab.gateway.HttpGatewayProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Text-to-Speech client.
 *
 * <p>The token file path usually comes from the {@code TTS_TOKEN_FILE} environment variable.
 */
@ConfigurationProperties(prefix = "speech")
@Validated
public record SpeechProperties(
    @NotBlank String baseUrl,
    String projectId,
    String tokenFile,
    @NotNull AudioEncoding audioEncoding,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Positive long backoffMillis,
    @Positive int cacheMaxMegabytes)
    implements HttpGatewayProperties {}

package com.scholary.vocab.config;

import com.scholary.vocab.term.CommaPolicy;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the flashcard pipeline.
 *
 * <p>Controls naming of audio files, where output goes, input parsing and how much work runs in
 * parallel. Paths submitted over REST must lie inside {@code workDir}.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotBlank String soundfilePrefix,
    boolean romanize,
    @NotBlank String audioDir,
    String cacheDir,
    @PositiveOrZero int baseIndex,
    @Positive int indexWidth,
    @NotNull CommaPolicy commaPolicy,
    boolean sectionNotes,
    @Positive int workerThreads,
    @Positive int workerQueueSize,
    @Positive int termTimeoutSeconds,
    String noteType,
    String deck,
    @NotBlank String workDir) {}

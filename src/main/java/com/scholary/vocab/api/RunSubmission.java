package com.scholary.vocab.api;

import com.scholary.vocab.pipeline.RunRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import java.nio.file.Path;

/**
 * Request body for starting a run.
 *
 * <p>Paths are resolved against the server's work directory. Relative and absolute paths are both
 * accepted as long as they stay inside it.
 */
public record RunSubmission(
    @NotBlank String input,
    @NotBlank String output,
    @PositiveOrZero Integer startIndex,
    String previousInput,
    String deck,
    String noteType) {

  /**
   * @throws IllegalArgumentException if a path points outside {@code workDir}
   */
  RunRequest toRunRequest(Path workDir) {
    Path base = workDir.toAbsolutePath().normalize();
    return new RunRequest(
        confine(base, input),
        confine(base, output),
        startIndex,
        previousInput == null || previousInput.isBlank() ? null : confine(base, previousInput),
        deck,
        noteType);
  }

  private static Path confine(Path base, String value) {
    Path resolved = base.resolve(value).normalize();
    if (!resolved.startsWith(base)) {
      throw new IllegalArgumentException("Path escapes the work directory: " + value);
    }
    return resolved;
  }
}

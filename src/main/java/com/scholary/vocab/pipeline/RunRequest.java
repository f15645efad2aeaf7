package com.scholary.vocab.pipeline;

import java.nio.file.Path;

/**
 * Parameters of one pipeline run.
 *
 * @param input vocabulary file
 * @param output table file to write
 * @param startIndex first audio index, or null to continue after the files already in the audio
 *     directory
 * @param previousInput earlier version of the input; terms it contains are skipped. May be null or
 *     point to a file that does not exist yet
 * @param deck Anki deck for the import header, or null for the configured default
 * @param noteType Anki note type for the import header, or null for the configured default
 */
public record RunRequest(
    Path input, Path output, Integer startIndex, Path previousInput, String deck, String noteType) {

  public RunRequest {
    if (input == null) {
      throw new IllegalArgumentException("Input file is required");
    }
    if (output == null) {
      throw new IllegalArgumentException("Output file is required");
    }
    if (startIndex != null && startIndex < 0) {
      throw new IllegalArgumentException("Start index cannot be negative: " + startIndex);
    }
  }

  public RunRequest(Path input, Path output) {
    this(input, output, null, null, null, null);
  }
}

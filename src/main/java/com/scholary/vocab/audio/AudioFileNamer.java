package com.scholary.vocab.audio;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out sequential audio filenames for one run.
 *
 * <p>Filenames look like {@code RT_VOCAB0042.mp3}: prefix, zero-padded index, extension. The
 * counter never goes backwards, so no index is handed out twice by the same namer, even across
 * threads.
 */
public class AudioFileNamer {

  private final AtomicInteger nextIndex;
  private final int width;
  private final String extension;

  /**
   * @param startIndex index of the first filename
   * @param width minimum number of digits, left-padded with zeros
   * @param extension appended as-is, e.g. {@code ".mp3"}; may be empty
   */
  public AudioFileNamer(int startIndex, int width, String extension) {
    if (startIndex < 0) {
      throw new IllegalArgumentException("Start index cannot be negative: " + startIndex);
    }
    if (width < 1) {
      throw new IllegalArgumentException("Index width must be at least 1: " + width);
    }
    this.nextIndex = new AtomicInteger(startIndex);
    this.width = width;
    this.extension = extension == null ? "" : extension;
  }

  public String next(String prefix) {
    if (prefix == null || prefix.isBlank()) {
      throw new IllegalArgumentException("Filename prefix cannot be blank");
    }
    int index = nextIndex.getAndIncrement();
    return prefix + String.format("%0" + width + "d", index) + extension;
  }
}

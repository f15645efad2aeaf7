package com.scholary.vocab.script;

import java.time.Duration;

/**
 * One spoken unit of a pronunciation script.
 *
 * @param startOffset silence between the end of the previous segment (or the start of the audio,
 *     for the first segment) and the start of this one
 */
public record VoiceSegment(
    VoiceRole role,
    String voiceName,
    String languageCode,
    String text,
    Prosody prosody,
    Duration startOffset) {

  public VoiceSegment {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Segment text cannot be blank");
    }
    if (startOffset == null || startOffset.isNegative()) {
      throw new IllegalArgumentException("Segment start offset cannot be negative");
    }
    if (prosody == null) {
      prosody = Prosody.DEFAULT;
    }
  }
}

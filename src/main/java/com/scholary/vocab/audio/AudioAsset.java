package com.scholary.vocab.audio;

import com.scholary.vocab.script.PronunciationScript;

/** Named audio ready to be written next to the flashcard table. */
public record AudioAsset(String filename, byte[] audio, PronunciationScript script) {

  public AudioAsset {
    if (filename == null || filename.isBlank()) {
      throw new IllegalArgumentException("Audio filename cannot be blank");
    }
    if (audio == null || audio.length == 0) {
      throw new IllegalArgumentException("Audio content cannot be empty: " + filename);
    }
  }
}

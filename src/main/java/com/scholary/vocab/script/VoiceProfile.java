package com.scholary.vocab.script;

/**
 * A synthesizer voice and the language it speaks.
 *
 * @param name the service voice name, e.g. {@code ru-RU-Wavenet-A}
 * @param languageCode BCP-47 language code, e.g. {@code ru-RU}
 * @param prosody per-voice override, or {@code null} to use the script-wide prosody
 */
public record VoiceProfile(String name, String languageCode, Prosody prosody) {

  public VoiceProfile {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Voice name cannot be blank");
    }
    if (languageCode == null || languageCode.isBlank()) {
      throw new IllegalArgumentException("Voice language code cannot be blank");
    }
  }

  public VoiceProfile(String name, String languageCode) {
    this(name, languageCode, null);
  }
}

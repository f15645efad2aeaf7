package com.scholary.vocab.script;

import java.time.Duration;

/**
 * Voices, gaps and prosody for the pronunciation drill.
 *
 * <p>The two native voices must differ from each other and from the target voice, otherwise the
 * drill would repeat the same speaker.
 */
public record VoiceConfig(
    VoiceProfile nativeA,
    VoiceProfile nativeB,
    VoiceProfile target,
    Duration leadInGap,
    Duration repeatGap,
    Duration translationGap,
    Prosody prosody) {

  public static final Duration DEFAULT_LEAD_IN_GAP = Duration.ofMillis(1200);
  public static final Duration DEFAULT_REPEAT_GAP = Duration.ofMillis(650);
  public static final Duration DEFAULT_TRANSLATION_GAP = Duration.ofMillis(1200);

  public VoiceConfig {
    if (nativeA == null || nativeB == null || target == null) {
      throw new IllegalArgumentException("All three voices are required");
    }
    if (nativeA.name().equals(nativeB.name())
        || nativeA.name().equals(target.name())
        || nativeB.name().equals(target.name())) {
      throw new IllegalArgumentException("Drill voices must be distinct");
    }
    requireNonNegative(leadInGap, "lead-in gap");
    requireNonNegative(repeatGap, "repeat gap");
    requireNonNegative(translationGap, "translation gap");
    if (prosody == null) {
      prosody = Prosody.DEFAULT;
    }
  }

  /** Default Russian/English drill with the standard gaps. */
  public static VoiceConfig russianToEnglish(Prosody prosody) {
    return new VoiceConfig(
        new VoiceProfile("ru-RU-Wavenet-A", "ru-RU"),
        new VoiceProfile("ru-RU-Wavenet-B", "ru-RU"),
        new VoiceProfile("en-US-Standard-C", "en-US"),
        DEFAULT_LEAD_IN_GAP,
        DEFAULT_REPEAT_GAP,
        DEFAULT_TRANSLATION_GAP,
        prosody);
  }

  /** Prosody for a voice: its own override if present, else the script-wide setting. */
  public Prosody prosodyFor(VoiceProfile voice) {
    return voice.prosody() != null ? voice.prosody() : prosody;
  }

  private static void requireNonNegative(Duration gap, String name) {
    if (gap == null || gap.isNegative()) {
      throw new IllegalArgumentException("The " + name + " must be zero or positive");
    }
  }
}

package com.scholary.vocab.script;

/**
 * Prosody settings applied to a spoken segment.
 *
 * <p>Every field is optional; {@code null} leaves the synthesizer's default in place. Ranges follow
 * the speech service limits:
 *
 * <ul>
 *   <li>speaking rate: 0.25 to 4.0 (1.0 is normal speed)
 *   <li>pitch: -20 to +20 semitones
 *   <li>volume gain: -96 to +16 dB
 * </ul>
 */
public record Prosody(Double speakingRate, Double pitch, Double volumeGainDb) {

  public static final Prosody DEFAULT = new Prosody(null, null, null);

  public Prosody {
    if (speakingRate != null && (speakingRate < 0.25 || speakingRate > 4.0)) {
      throw new IllegalArgumentException("Speaking rate must be in [0.25, 4.0]: " + speakingRate);
    }
    if (pitch != null && (pitch < -20.0 || pitch > 20.0)) {
      throw new IllegalArgumentException("Pitch must be in [-20.0, 20.0]: " + pitch);
    }
    if (volumeGainDb != null && (volumeGainDb < -96.0 || volumeGainDb > 16.0)) {
      throw new IllegalArgumentException("Volume gain must be in [-96.0, 16.0]: " + volumeGainDb);
    }
  }

  public boolean isDefault() {
    return speakingRate == null && pitch == null && volumeGainDb == null;
  }
}

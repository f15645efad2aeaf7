package com.scholary.vocab.config;

import com.scholary.vocab.script.Prosody;
import com.scholary.vocab.script.VoiceConfig;
import com.scholary.vocab.script.VoiceProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the pronunciation drill voices.
 *
 * <p>{@code speakingRate}, {@code pitch} and {@code volumeGainDb} apply to every segment; a voice
 * may override them with its own values.
 */
@ConfigurationProperties(prefix = "voice")
@Validated
public record VoiceProperties(
    @Valid @NotNull Voice nativeA,
    @Valid @NotNull Voice nativeB,
    @Valid @NotNull Voice target,
    @NotNull Duration leadInGap,
    @NotNull Duration repeatGap,
    @NotNull Duration translationGap,
    Double speakingRate,
    Double pitch,
    Double volumeGainDb) {

  public record Voice(
      @NotBlank String name,
      @NotBlank String languageCode,
      Double speakingRate,
      Double pitch,
      Double volumeGainDb) {

    VoiceProfile toProfile() {
      Prosody override =
          speakingRate == null && pitch == null && volumeGainDb == null
              ? null
              : new Prosody(speakingRate, pitch, volumeGainDb);
      return new VoiceProfile(name, languageCode, override);
    }
  }

  /**
   * Build the drill configuration.
   *
   * @throws IllegalArgumentException if prosody is out of range or voices are not distinct
   */
  public VoiceConfig toVoiceConfig() {
    return new VoiceConfig(
        nativeA.toProfile(),
        nativeB.toProfile(),
        target.toProfile(),
        leadInGap,
        repeatGap,
        translationGap,
        new Prosody(speakingRate, pitch, volumeGainDb));
  }
}

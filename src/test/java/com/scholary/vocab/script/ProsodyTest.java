package com.scholary.vocab.script;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ProsodyTest {

  @Test
  void constructor_shouldAcceptRangeLimits() {
    Prosody low = new Prosody(0.25, -20.0, -96.0);
    Prosody high = new Prosody(4.0, 20.0, 16.0);

    assertThat(low.isDefault()).isFalse();
    assertThat(high.isDefault()).isFalse();
  }

  @Test
  void constructor_shouldRejectSpeakingRateOutOfRange() {
    assertThatThrownBy(() -> new Prosody(0.2, null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Speaking rate");
    assertThatThrownBy(() -> new Prosody(4.5, null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_shouldRejectPitchOutOfRange() {
    assertThatThrownBy(() -> new Prosody(null, 20.5, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Pitch");
  }

  @Test
  void constructor_shouldRejectVolumeOutOfRange() {
    assertThatThrownBy(() -> new Prosody(null, null, 16.1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Volume");
    assertThatThrownBy(() -> new Prosody(null, null, -97.0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void isDefault_shouldBeTrueWhenNothingIsSet() {
    assertThat(Prosody.DEFAULT.isDefault()).isTrue();
  }
}

package com.scholary.vocab.script;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.vocab.term.Term;
import com.scholary.vocab.translation.TranslationResult;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class PronunciationScriptTest {

  private final AudioScriptBuilder builder = new AudioScriptBuilder();

  @Test
  void fingerprint_shouldChangeWithTranslation() {
    VoiceConfig config = VoiceConfig.russianToEnglish(Prosody.DEFAULT);
    Term term = new Term("Мир");

    String peace = builder.build(term, new TranslationResult("", "Peace"), config).fingerprint();
    String world = builder.build(term, new TranslationResult("", "World"), config).fingerprint();

    assertThat(peace).isNotEqualTo(world);
  }

  @Test
  void fingerprint_shouldChangeWithGapsAndProsody() {
    Term term = new Term("Мир");
    TranslationResult translation = new TranslationResult("", "Peace");
    VoiceConfig standard = VoiceConfig.russianToEnglish(Prosody.DEFAULT);
    VoiceConfig slower = VoiceConfig.russianToEnglish(new Prosody(0.8, null, null));
    VoiceConfig longerPause =
        new VoiceConfig(
            standard.nativeA(),
            standard.nativeB(),
            standard.target(),
            standard.leadInGap(),
            Duration.ofMillis(900),
            standard.translationGap(),
            Prosody.DEFAULT);

    String base = builder.build(term, translation, standard).fingerprint();

    assertThat(builder.build(term, translation, slower).fingerprint()).isNotEqualTo(base);
    assertThat(builder.build(term, translation, longerPause).fingerprint()).isNotEqualTo(base);
  }

  @Test
  void fingerprint_shouldBeHexDigest() {
    String fingerprint =
        builder
            .build(
                new Term("Каша"),
                new TranslationResult("", "Porridge"),
                VoiceConfig.russianToEnglish(Prosody.DEFAULT))
            .fingerprint();

    assertThat(fingerprint).matches("[0-9a-f]{32}");
  }
}

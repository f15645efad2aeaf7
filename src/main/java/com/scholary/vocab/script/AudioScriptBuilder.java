package com.scholary.vocab.script;

import com.scholary.vocab.term.Term;
import com.scholary.vocab.translation.TranslationResult;
import java.time.Duration;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds the pronunciation drill for a term.
 *
 * <p>The drill is always three segments:
 *
 * <pre>
 *   [lead-in gap] NATIVE_A: term
 *   [repeat gap]  NATIVE_B: term
 *   [translation gap] TARGET: translation
 * </pre>
 *
 * <p>Pure function of its inputs: no I/O, and the same arguments always give an equal script.
 */
@Component
public class AudioScriptBuilder {

  public PronunciationScript build(Term term, TranslationResult translation, VoiceConfig config) {
    if (translation == null || translation.translated().isBlank()) {
      throw new IllegalArgumentException("A translation is required to build the drill for " + term);
    }

    VoiceSegment first =
        segment(VoiceRole.NATIVE_A, config.nativeA(), term.text(), config, config.leadInGap());
    VoiceSegment second =
        segment(VoiceRole.NATIVE_B, config.nativeB(), term.text(), config, config.repeatGap());
    VoiceSegment third =
        segment(
            VoiceRole.TARGET,
            config.target(),
            translation.translated(),
            config,
            config.translationGap());

    return new PronunciationScript(term, List.of(first, second, third));
  }

  private static VoiceSegment segment(
      VoiceRole role,
      VoiceProfile voice,
      String text,
      VoiceConfig config,
      Duration offset) {
    return new VoiceSegment(
        role, voice.name(), voice.languageCode(), text, config.prosodyFor(voice), offset);
  }
}

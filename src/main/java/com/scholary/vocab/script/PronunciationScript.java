package com.scholary.vocab.script;

import com.scholary.vocab.term.Term;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.util.DigestUtils;

/**
 * Ordered, timed sequence of voice segments for one term.
 *
 * <p>Segments play strictly one after another: each begins {@link VoiceSegment#startOffset()}
 * after the previous one ends. The script is not yet a service request; {@code SsmlRenderer}
 * turns it into one.
 */
public record PronunciationScript(Term term, List<VoiceSegment> segments) {

  public PronunciationScript {
    if (term == null) {
      throw new IllegalArgumentException("Script term is required");
    }
    if (segments == null || segments.isEmpty()) {
      throw new IllegalArgumentException("Script must have at least one segment");
    }
    segments = List.copyOf(segments);
  }

  public VoiceSegment segment(VoiceRole role) {
    return segments.stream()
        .filter(segment -> segment.role() == role)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("No segment for role " + role));
  }

  /**
   * Stable hash of everything that affects the rendered audio.
   *
   * <p>Two scripts with the same fingerprint render to equivalent audio, so it doubles as the audio
   * cache key.
   */
  public String fingerprint() {
    StringBuilder canonical = new StringBuilder();
    for (VoiceSegment segment : segments) {
      Prosody prosody = segment.prosody();
      canonical
          .append(segment.role())
          .append('|')
          .append(segment.voiceName())
          .append('|')
          .append(segment.languageCode())
          .append('|')
          .append(segment.text())
          .append('|')
          .append(prosody.speakingRate())
          .append('|')
          .append(prosody.pitch())
          .append('|')
          .append(prosody.volumeGainDb())
          .append('|')
          .append(segment.startOffset().toMillis())
          .append('\n');
    }
    return DigestUtils.md5DigestAsHex(canonical.toString().getBytes(StandardCharsets.UTF_8));
  }
}

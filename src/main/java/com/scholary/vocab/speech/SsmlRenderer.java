package com.scholary.vocab.speech;

import com.scholary.vocab.script.PronunciationScript;
import com.scholary.vocab.script.Prosody;
import com.scholary.vocab.script.VoiceSegment;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Renders a pronunciation script as SSML for a single synthesis request.
 *
 * <p>Segments become {@code <media>} elements inside a {@code <seq>}. The first begins at its own
 * offset, each later one at {@code <previous id>.end+<offset>ms}, so the service lays them out
 * back to back with the scripted silences in between:
 *
 * <pre>{@code
 * <speak><seq>
 *   <media xml:id="seg0" begin="1200ms"><speak><voice name="ru-RU-Wavenet-A">Каша</voice></speak></media>
 *   <media xml:id="seg1" begin="seg0.end+650ms">...</media>
 *   <media xml:id="seg2" begin="seg1.end+1200ms">...</media>
 * </seq></speak>
 * }</pre>
 */
@Component
public class SsmlRenderer {

  public String render(PronunciationScript script) {
    List<VoiceSegment> segments = script.segments();
    StringBuilder ssml = new StringBuilder("<speak><seq>");

    for (int i = 0; i < segments.size(); i++) {
      VoiceSegment segment = segments.get(i);
      long offsetMs = segment.startOffset().toMillis();
      String begin = i == 0 ? offsetMs + "ms" : mediaId(i - 1) + ".end+" + offsetMs + "ms";

      ssml.append("<media xml:id=\"")
          .append(mediaId(i))
          .append("\" begin=\"")
          .append(begin)
          .append("\"><speak>");

      String prosodyAttributes = prosodyAttributes(segment.prosody());
      if (!prosodyAttributes.isEmpty()) {
        ssml.append("<prosody").append(prosodyAttributes).append('>');
      }
      ssml.append("<voice name=\"")
          .append(escape(segment.voiceName()))
          .append("\">")
          .append(escape(segment.text()))
          .append("</voice>");
      if (!prosodyAttributes.isEmpty()) {
        ssml.append("</prosody>");
      }
      ssml.append("</speak></media>");
    }

    return ssml.append("</seq></speak>").toString();
  }

  private static String mediaId(int index) {
    return "seg" + index;
  }

  /** Attribute string with a leading space per attribute, or empty when nothing is set. */
  static String prosodyAttributes(Prosody prosody) {
    StringBuilder attributes = new StringBuilder();
    if (prosody.speakingRate() != null) {
      attributes.append(" rate=\"").append(Math.round(100 * prosody.speakingRate())).append("%\"");
    }
    if (prosody.pitch() != null) {
      attributes.append(" pitch=\"").append(signed(prosody.pitch())).append("st\"");
    }
    if (prosody.volumeGainDb() != null) {
      attributes.append(" volume=\"").append(signed(prosody.volumeGainDb())).append("dB\"");
    }
    return attributes.toString();
  }

  private static String signed(double value) {
    String number = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    return value >= 0 ? "+" + number : number;
  }

  private static String escape(String text) {
    return HtmlUtils.htmlEscape(text, "UTF-8");
  }
}

package com.scholary.vocab.speech;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.vocab.cache.CaffeineAudioCache;
import com.scholary.vocab.script.AudioScriptBuilder;
import com.scholary.vocab.script.PronunciationScript;
import com.scholary.vocab.script.Prosody;
import com.scholary.vocab.script.VoiceConfig;
import com.scholary.vocab.term.Term;
import com.scholary.vocab.translation.TranslationResult;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CachingSpeechGatewayTest {

  @Mock private SpeechGateway delegate;

  @TempDir Path tempDir;

  private final AudioScriptBuilder builder = new AudioScriptBuilder();

  @Test
  void synthesize_shouldReuseAudioForSameScript() {
    CachingSpeechGateway gateway =
        new CachingSpeechGateway(delegate, new CaffeineAudioCache(1, (Path) null));
    PronunciationScript script = script("Каша", "Porridge");
    when(delegate.synthesize(script)).thenReturn(new byte[] {1, 2, 3});

    gateway.synthesize(script);
    byte[] again = gateway.synthesize(script);

    assertThat(again).containsExactly(1, 2, 3);
    verify(delegate, times(1)).synthesize(any());
    assertThat(gateway.hitCount()).isEqualTo(1);
  }

  @Test
  void synthesize_shouldRenderAgainWhenTranslationChanges() {
    CachingSpeechGateway gateway =
        new CachingSpeechGateway(delegate, new CaffeineAudioCache(1, (Path) null));
    when(delegate.synthesize(any())).thenReturn(new byte[] {1});

    gateway.synthesize(script("Мир", "Peace"));
    gateway.synthesize(script("Мир", "World"));

    verify(delegate, times(2)).synthesize(any());
  }

  @Test
  void synthesize_shouldServeAudioPersistedByAnEarlierRun() {
    PronunciationScript script = script("Земля", "Earth");
    when(delegate.synthesize(script)).thenReturn(new byte[] {7, 7});
    new CachingSpeechGateway(delegate, new CaffeineAudioCache(1, tempDir)).synthesize(script);

    SpeechGateway untouched = mock(SpeechGateway.class);
    byte[] audio =
        new CachingSpeechGateway(untouched, new CaffeineAudioCache(1, tempDir)).synthesize(script);

    assertThat(audio).containsExactly(7, 7);
    verify(untouched, never()).synthesize(any());
  }

  private PronunciationScript script(String text, String translation) {
    return builder.build(
        new Term(text),
        new TranslationResult("", translation),
        VoiceConfig.russianToEnglish(Prosody.DEFAULT));
  }
}

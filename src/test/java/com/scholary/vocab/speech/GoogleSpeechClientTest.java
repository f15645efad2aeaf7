package com.scholary.vocab.speech;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.vocab.gateway.GatewayAuthenticationException;
import com.scholary.vocab.gateway.StubHttpServer;
import com.scholary.vocab.script.AudioScriptBuilder;
import com.scholary.vocab.script.PronunciationScript;
import com.scholary.vocab.script.Prosody;
import com.scholary.vocab.script.VoiceConfig;
import com.scholary.vocab.term.Term;
import com.scholary.vocab.translation.TranslationResult;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GoogleSpeechClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final PronunciationScript script =
      new AudioScriptBuilder()
          .build(
              new Term("Каша"),
              new TranslationResult("Kasha", "Porridge"),
              VoiceConfig.russianToEnglish(Prosody.DEFAULT));

  private StubHttpServer server;

  @BeforeEach
  void setUp() throws Exception {
    server = new StubHttpServer();
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  @Test
  void synthesize_shouldSendSsmlAndDecodeAudio() throws Exception {
    byte[] audio = "ID3-fake-mp3".getBytes(StandardCharsets.UTF_8);
    server.reply(
        200, "{\"audioContent\":\"" + Base64.getEncoder().encodeToString(audio) + "\"}");

    byte[] result = client(AudioEncoding.MP3).synthesize(script);

    assertThat(result).isEqualTo(audio);
    assertThat(server.requests()).hasSize(1);
    assertThat(server.requests().get(0).path()).isEqualTo("/v1/text:synthesize");

    JsonNode body = objectMapper.readTree(server.requests().get(0).body());
    assertThat(body.at("/input/ssml").asText()).startsWith("<speak><seq>").contains("Porridge");
    assertThat(body.at("/voice/languageCode").asText()).isEqualTo("ru-RU");
    assertThat(body.at("/audioConfig/audioEncoding").asText()).isEqualTo("MP3");
  }

  @Test
  void synthesize_shouldRequestConfiguredEncoding() throws Exception {
    server.reply(200, "{\"audioContent\":\"AAAA\"}");

    client(AudioEncoding.OGG_OPUS).synthesize(script);

    JsonNode body = objectMapper.readTree(server.requests().get(0).body());
    assertThat(body.at("/audioConfig/audioEncoding").asText()).isEqualTo("OGG_OPUS");
  }

  @Test
  void synthesize_shouldRetryUnavailableService() {
    server.reply(503, "{}").reply(200, "{\"audioContent\":\"AAAA\"}");

    assertThat(client(AudioEncoding.MP3).synthesize(script)).hasSize(3);
    assertThat(server.requests()).hasSize(2);
  }

  @Test
  void synthesize_shouldFailAfterRetries() {
    server.reply(502, "{}").reply(502, "{}").reply(502, "{}");

    assertThatThrownBy(() -> client(AudioEncoding.MP3).synthesize(script))
        .isInstanceOf(SynthesisUnavailableException.class);
  }

  @Test
  void synthesize_shouldRejectInvalidSsml() {
    server.reply(400, "{\"error\":\"Invalid SSML\"}");

    assertThatThrownBy(() -> client(AudioEncoding.MP3).synthesize(script))
        .isInstanceOf(SynthesisRejectedException.class)
        .hasMessageContaining("Invalid SSML");
  }

  @Test
  void synthesize_shouldRejectMissingAudio() {
    server.reply(200, "{}");

    assertThatThrownBy(() -> client(AudioEncoding.MP3).synthesize(script))
        .isInstanceOf(SynthesisRejectedException.class);
  }

  @Test
  void synthesize_shouldFailOnForbidden() {
    server.reply(403, "{\"error\":\"permission denied\"}");

    assertThatThrownBy(() -> client(AudioEncoding.MP3).synthesize(script))
        .isInstanceOf(GatewayAuthenticationException.class);
  }

  private GoogleSpeechClient client(AudioEncoding encoding) {
    SpeechProperties properties =
        new SpeechProperties(server.baseUrl(), "", null, encoding, 2, 5, 3, 1, 16);
    return new GoogleSpeechClient(properties, () -> "test-token", objectMapper, new SsmlRenderer());
  }
}

package com.scholary.vocab.speech;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.vocab.gateway.AccessTokenProvider;
import com.scholary.vocab.gateway.GatewayException;
import com.scholary.vocab.gateway.GoogleApiClient;
import com.scholary.vocab.script.PronunciationScript;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cloud Text-to-Speech v1 client.
 *
 * <p>Each script goes out as one {@code text:synthesize} request carrying the rendered SSML. The
 * request names only the language of the first segment; the voices themselves are selected by the
 * {@code <voice>} elements in the SSML.
 */
public class GoogleSpeechClient extends GoogleApiClient implements SpeechGateway {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoogleSpeechClient.class);

  private final SpeechProperties properties;
  private final SsmlRenderer renderer;

  public GoogleSpeechClient(
      SpeechProperties properties,
      AccessTokenProvider tokenProvider,
      ObjectMapper objectMapper,
      SsmlRenderer renderer) {
    super(properties, tokenProvider, objectMapper);
    this.properties = properties;
    this.renderer = renderer;

    LOGGER.info(
        "Initialized speech client: baseUrl={}, encoding={}",
        properties.baseUrl(),
        properties.audioEncoding());
  }

  @Override
  public byte[] synthesize(PronunciationScript script) {
    String ssml = renderer.render(script);
    LOGGER.debug("SSML for '{}': {}", script.term().text(), ssml);

    SynthesizeSpeechRequest request =
        new SynthesizeSpeechRequest(
            new SynthesizeSpeechRequest.Input(ssml),
            new SynthesizeSpeechRequest.Voice(script.segments().get(0).languageCode()),
            new SynthesizeSpeechRequest.AudioConfig(properties.audioEncoding()));

    SynthesizeSpeechResponse response =
        postJson(
            "/v1/text:synthesize",
            request,
            SynthesizeSpeechResponse.class,
            "synthesize",
            script.term().text());

    if (response.audioContent() == null || response.audioContent().isEmpty()) {
      throw new SynthesisRejectedException("No audio returned for: " + script.term().text());
    }
    try {
      return Base64.getDecoder().decode(response.audioContent());
    } catch (IllegalArgumentException e) {
      throw new SynthesisRejectedException(
          "Audio for '" + script.term().text() + "' is not valid base64: " + e.getMessage());
    }
  }

  @Override
  protected GatewayException unavailable(String message, Throwable cause) {
    return new SynthesisUnavailableException(message, cause);
  }

  @Override
  protected GatewayException rejected(String message) {
    return new SynthesisRejectedException(message);
  }
}

package com.scholary.vocab.translation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.vocab.gateway.AccessTokenProvider;
import com.scholary.vocab.gateway.GatewayException;
import com.scholary.vocab.gateway.GoogleApiClient;
import com.scholary.vocab.term.Term;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.HtmlUtils;

/**
 * Cloud Translation v3 client.
 *
 * <p>One {@code translateText} call per term, plus one {@code romanizeText} call when
 * romanization is enabled. Translations come back HTML-escaped (an apostrophe arrives as {@code
 * &#39;}), so they are unescaped before use.
 */
public class GoogleTranslationClient extends GoogleApiClient implements TranslationGateway {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoogleTranslationClient.class);

  private final TranslationProperties properties;
  private final boolean romanize;
  private final String parent;

  public GoogleTranslationClient(
      TranslationProperties properties,
      AccessTokenProvider tokenProvider,
      ObjectMapper objectMapper,
      boolean romanize) {
    super(properties, tokenProvider, objectMapper);
    this.properties = properties;
    this.romanize = romanize;
    this.parent =
        String.format("/v3/projects/%s/locations/%s", properties.projectId(), properties.location());

    LOGGER.info(
        "Initialized translation client: baseUrl={}, {} -> {}, romanize={}",
        properties.baseUrl(),
        properties.sourceLanguageCode(),
        properties.targetLanguageCode(),
        romanize);
  }

  @Override
  public TranslationResult translate(Term term) {
    String translated = translateText(term);
    String romanized = romanize ? romanizeText(term) : "";
    return new TranslationResult(romanized, translated);
  }

  @Override
  public String romanize(Term term) {
    return romanize ? romanizeText(term) : "";
  }

  private String translateText(Term term) {
    TranslateTextRequest request =
        new TranslateTextRequest(
            List.of(term.text()),
            properties.sourceLanguageCode(),
            properties.targetLanguageCode(),
            "text/html");

    TranslateTextResponse response =
        postJson(
            parent + ":translateText",
            request,
            TranslateTextResponse.class,
            "translateText",
            term.text());

    if (response.translations() == null || response.translations().isEmpty()) {
      throw new TranslationRejectedException("No translation returned for: " + term.text());
    }
    String translated = response.translations().get(0).translatedText();
    if (translated == null || translated.isBlank()) {
      throw new TranslationRejectedException("Empty translation returned for: " + term.text());
    }
    return HtmlUtils.htmlUnescape(translated).strip();
  }

  private String romanizeText(Term term) {
    RomanizeTextRequest request =
        new RomanizeTextRequest(List.of(term.text()), properties.sourceLanguageCode());

    RomanizeTextResponse response =
        postJson(
            parent + ":romanizeText", request, RomanizeTextResponse.class, "romanizeText", term.text());

    if (response.romanizations() == null || response.romanizations().isEmpty()) {
      throw new TranslationRejectedException("No romanization returned for: " + term.text());
    }
    String romanized = response.romanizations().get(0).romanizedText();
    return romanized == null ? "" : romanized.strip();
  }

  @Override
  protected GatewayException unavailable(String message, Throwable cause) {
    return new TranslationUnavailableException(message, cause);
  }

  @Override
  protected GatewayException rejected(String message) {
    return new TranslationRejectedException(message);
  }
}

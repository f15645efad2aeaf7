package com.scholary.vocab.translation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Response of the v3 {@code romanizeText} call. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RomanizeTextResponse(List<Romanization> romanizations) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Romanization(String romanizedText, String detectedLanguageCode) {}
}

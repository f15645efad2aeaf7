package com.scholary.vocab.translation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Response of the v3 {@code translateText} call, one translation per input string. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranslateTextResponse(List<Translation> translations) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Translation(String translatedText) {}
}

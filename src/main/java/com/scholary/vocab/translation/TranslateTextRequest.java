package com.scholary.vocab.translation;

import java.util.List;

/** Body of the v3 {@code translateText} call. */
public record TranslateTextRequest(
    List<String> contents, String sourceLanguageCode, String targetLanguageCode, String mimeType) {}

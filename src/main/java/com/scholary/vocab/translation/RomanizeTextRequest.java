package com.scholary.vocab.translation;

import java.util.List;

/** Body of the v3 {@code romanizeText} call. */
public record RomanizeTextRequest(List<String> contents, String sourceLanguageCode) {}

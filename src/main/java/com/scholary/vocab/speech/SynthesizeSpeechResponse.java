package com.scholary.vocab.speech;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response of {@code text:synthesize}.
 *
 * @param audioContent base64-encoded audio
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SynthesizeSpeechResponse(String audioContent) {}

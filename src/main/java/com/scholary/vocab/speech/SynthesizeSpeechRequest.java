package com.scholary.vocab.speech;

/** Body of {@code text:synthesize}. Voice names travel inside the SSML. */
public record SynthesizeSpeechRequest(Input input, Voice voice, AudioConfig audioConfig) {

  public record Input(String ssml) {}

  public record Voice(String languageCode) {}

  public record AudioConfig(AudioEncoding audioEncoding) {}
}

package com.scholary.vocab.speech;

/** Audio encodings the speech service can return, with the file extension each one gets. */
public enum AudioEncoding {
  MP3(".mp3"),
  LINEAR16(".wav"),
  OGG_OPUS(".ogg");

  private final String extension;

  AudioEncoding(String extension) {
    this.extension = extension;
  }

  public String extension() {
    return extension;
  }
}

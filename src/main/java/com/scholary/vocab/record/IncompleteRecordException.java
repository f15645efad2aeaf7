package com.scholary.vocab.record;

/** A term reached assembly without its translation or its audio. */
public class IncompleteRecordException extends RuntimeException {

  public IncompleteRecordException(String message) {
    super(message);
  }
}

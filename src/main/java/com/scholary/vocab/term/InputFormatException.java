package com.scholary.vocab.term;

/**
 * Thrown when a vocabulary source cannot be read or decoded as UTF-8 text.
 *
 * <p>This is fatal for a pipeline run: without the term list there is nothing to build.
 */
public class InputFormatException extends RuntimeException {

  public InputFormatException(String message) {
    super(message);
  }

  public InputFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}

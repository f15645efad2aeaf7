package com.scholary.vocab.translation;

import com.scholary.vocab.gateway.GatewayException;

/** Translation service unreachable, throttled or failing, after all retries. */
public class TranslationUnavailableException extends GatewayException {

  public TranslationUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.scholary.vocab.translation;

import com.scholary.vocab.gateway.GatewayException;

/** The translation service cannot process a term. Retrying will not help. */
public class TranslationRejectedException extends GatewayException {

  public TranslationRejectedException(String message) {
    super(message);
  }
}

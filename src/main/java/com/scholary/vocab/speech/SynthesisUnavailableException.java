package com.scholary.vocab.speech;

import com.scholary.vocab.gateway.GatewayException;

/** Speech service unreachable, timed out or overloaded, after all retries. */
public class SynthesisUnavailableException extends GatewayException {

  public SynthesisUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.scholary.vocab.speech;

import com.scholary.vocab.gateway.GatewayException;

/** Speech service refused the request, or answered without audio. */
public class SynthesisRejectedException extends GatewayException {

  public SynthesisRejectedException(String message) {
    super(message);
  }
}

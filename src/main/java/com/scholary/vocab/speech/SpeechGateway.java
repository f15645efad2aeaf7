package com.scholary.vocab.speech;

import com.scholary.vocab.script.PronunciationScript;

/** Interface to the external speech-synthesis service. */
public interface SpeechGateway {

  /**
   * Render a pronunciation script into encoded audio.
   *
   * @return audio bytes in the configured encoding
   * @throws SynthesisUnavailableException if the service stays unreachable after retries
   * @throws SynthesisRejectedException if the service refuses the script
   * @throws com.scholary.vocab.gateway.GatewayAuthenticationException if credentials are refused
   */
  byte[] synthesize(PronunciationScript script);
}

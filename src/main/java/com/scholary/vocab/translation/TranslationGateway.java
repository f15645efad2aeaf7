package com.scholary.vocab.translation;

import com.scholary.vocab.term.Term;

/**
 * Interface to the external translation and romanization service.
 *
 * <p>Lets the orchestrator run against the Google client, a caching wrapper, or a test double.
 */
public interface TranslationGateway {

  /**
   * Translate a term, romanizing it too when romanization is enabled.
   *
   * @throws TranslationUnavailableException if the service stays unreachable after retries
   * @throws TranslationRejectedException if the service refuses this term
   * @throws com.scholary.vocab.gateway.GatewayAuthenticationException if credentials are refused
   */
  TranslationResult translate(Term term);

  /** Latin transliteration of the term; empty when romanization is disabled. */
  default String romanize(Term term) {
    return translate(term).romanized();
  }
}

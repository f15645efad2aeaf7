package com.scholary.vocab.gateway;

/** Supplies the bearer token sent with each service request. */
@FunctionalInterface
public interface AccessTokenProvider {

  /**
   * Current access token.
   *
   * @throws GatewayAuthenticationException if no token can be obtained
   */
  String accessToken();
}

package com.scholary.vocab.gateway;

/**
 * Thrown when a service rejects our credentials (HTTP 401/403) or no usable credentials exist.
 *
 * <p>Retrying other terms would fail the same way, so this aborts the run.
 */
public class GatewayAuthenticationException extends GatewayException {

  public GatewayAuthenticationException(String message) {
    super(message);
  }

  public GatewayAuthenticationException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.scholary.vocab.gateway;

/**
 * Base class for failures of an external service call.
 *
 * <p>Subclasses tell the orchestrator whether the failure is transient (retried, then the term
 * fails), permanent for one term, or fatal for the whole run.
 */
public abstract class GatewayException extends RuntimeException {

  protected GatewayException(String message) {
    super(message);
  }

  protected GatewayException(String message, Throwable cause) {
    super(message, cause);
  }
}

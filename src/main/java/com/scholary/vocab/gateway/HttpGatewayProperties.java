package com.scholary.vocab.gateway;

/** Connection settings shared by the HTTP service clients. */
public interface HttpGatewayProperties {

  String baseUrl();

  /** Google Cloud project billed for the calls; sent as the quota project header when set. */
  String projectId();

  /** Path of the access token file, or blank when unset. */
  String tokenFile();

  /** Connect timeout in seconds. */
  int connectTimeout();

  /** Per-request timeout in seconds. */
  int readTimeout();

  /** Total attempts for a transient failure, first attempt included. */
  int maxRetries();

  /** Backoff unit: attempt n waits 2^n units plus up to one unit of jitter. */
  long backoffMillis();
}

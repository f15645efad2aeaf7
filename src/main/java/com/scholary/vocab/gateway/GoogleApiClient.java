package com.scholary.vocab.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.vocab.logging.StructuredLogger;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-over-HTTPS plumbing for the Google Cloud REST APIs.
 *
 * <p>Handles bearer authentication, timeouts, status classification and retries. Status handling:
 *
 * <ul>
 *   <li>2xx: parsed into the response type
 *   <li>401, 403: {@link GatewayAuthenticationException}, never retried
 *   <li>429, 5xx, network errors, timeouts: retried with exponential backoff, then {@link
 *       #unavailable}
 *   <li>any other status: {@link #rejected}, never retried
 * </ul>
 */
public abstract class GoogleApiClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoogleApiClient.class);

  protected final ObjectMapper objectMapper;

  private final HttpClient httpClient;
  private final HttpGatewayProperties properties;
  private final AccessTokenProvider tokenProvider;
  private final StructuredLogger structuredLogger;

  protected GoogleApiClient(
      HttpGatewayProperties properties,
      AccessTokenProvider tokenProvider,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.tokenProvider = tokenProvider;
    this.objectMapper = objectMapper;
    this.structuredLogger = new StructuredLogger(LoggerFactory.getLogger(getClass()));

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();
  }

  /** Exception for a transient failure that survived every retry. */
  protected abstract GatewayException unavailable(String message, Throwable cause);

  /** Exception for a request the service refuses to process. */
  protected abstract GatewayException rejected(String message);

  /**
   * POST a JSON body and parse the JSON response, retrying transient failures.
   *
   * @param path path appended to the configured base URL
   * @param body request object, serialized with Jackson
   * @param responseType response class
   * @param operation short name for logs, e.g. "translateText"
   * @param subject the text being processed, for logs
   */
  protected <T> T postJson(
      String path, Object body, Class<T> responseType, String operation, String subject) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptPost(path, body, responseType, operation);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long unit = properties.backoffMillis();
          long backoffMs = (long) (Math.pow(2, attempt) * unit + Math.random() * unit);
          structuredLogger.logGatewayRetry(
              operation,
              subject,
              attempt,
              properties.maxRetries(),
              e.getClass().getSimpleName(),
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw unavailable(operation + " interrupted", ie);
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw unavailable(operation + " interrupted", e);
      }
    }

    structuredLogger.logGatewayFailed(
        operation,
        subject,
        properties.maxRetries(),
        lastException == null ? "none" : lastException.getClass().getSimpleName(),
        lastException == null ? "" : lastException.getMessage());
    throw unavailable(
        String.format("%s failed after %d attempts", operation, properties.maxRetries()),
        lastException);
  }

  private <T> T attemptPost(String path, Object body, Class<T> responseType, String operation)
      throws IOException, InterruptedException {

    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + path))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json; charset=utf-8")
            .header("Authorization", "Bearer " + tokenProvider.accessToken())
            .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(body), StandardCharsets.UTF_8));
    if (properties.projectId() != null && !properties.projectId().isBlank()) {
      builder.header("x-goog-user-project", properties.projectId());
    }
    HttpRequest request = builder.build();

    LOGGER.debug("Sending {} request to {}", operation, request.uri());

    HttpResponse<String> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

    int status = response.statusCode();
    if (status / 100 == 2) {
      // a malformed success body will not parse on retry either
      try {
        return objectMapper.readValue(response.body(), responseType);
      } catch (JsonProcessingException e) {
        throw rejected(
            String.format(
                "%s returned an unreadable response (status %d): %s",
                operation, status, e.getOriginalMessage()));
      }
    }
    if (status == 401 || status == 403) {
      throw new GatewayAuthenticationException(
          String.format("%s not authorized (status %d): %s", operation, status, response.body()));
    }
    if (status == 429 || status >= 500) {
      throw new RetryableStatusException(
          String.format("%s returned status %d: %s", operation, status, response.body()));
    }
    throw rejected(
        String.format("%s rejected (status %d): %s", operation, status, response.body()));
  }

  /** Status codes worth retrying travel the same path as network errors. */
  private static class RetryableStatusException extends IOException {
    RetryableStatusException(String message) {
      super(message);
    }
  }
}

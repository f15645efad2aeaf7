package com.scholary.vocab.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields in the MDC for the duration of one log call, so a JSON log encoder
 * or the console pattern can pick them up.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log term resolution started. */
  public void logTermStarted(int termIndex, String term) {
    try {
      MDC.put("event_type", "term_started");
      MDC.put("term_index", String.valueOf(termIndex));
      MDC.put("term", term);

      logger.debug("Term started: index={}, term={}", termIndex, term);
    } finally {
      clearEventFields();
    }
  }

  /** Log term resolved: translation and audio are both available. */
  public void logTermResolved(int termIndex, String term, long resolveMs, int audioBytes) {
    try {
      MDC.put("event_type", "term_resolved");
      MDC.put("term_index", String.valueOf(termIndex));
      MDC.put("term", term);
      MDC.put("resolveMs", String.valueOf(resolveMs));
      MDC.put("audioBytes", String.valueOf(audioBytes));

      logger.debug(
          "Term resolved: index={}, term={}, resolve={}ms, audio={} bytes",
          termIndex,
          term,
          resolveMs,
          audioBytes);
    } finally {
      clearEventFields();
    }
  }

  /** Log a term dropped from the output. */
  public void logTermFailed(int termIndex, String term, String failureKind, String message) {
    try {
      MDC.put("event_type", "term_failed");
      MDC.put("term_index", String.valueOf(termIndex));
      MDC.put("term", term);
      MDC.put("failureKind", failureKind);

      logger.warn(
          "Term failed: index={}, term={}, kind={}, message={}",
          termIndex,
          term,
          failureKind,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log gateway retry event. */
  public void logGatewayRetry(
      String operation, String subject, int attempt, int maxRetries, String errorType, String message) {
    try {
      MDC.put("event_type", "gateway_retry");
      MDC.put("operation", operation);
      MDC.put("term", subject);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("errorType", errorType);

      logger.warn(
          "Gateway retry: operation={}, term={}, attempt={}/{}, error={}, message={}",
          operation,
          subject,
          attempt,
          maxRetries,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log gateway failure after all retries. */
  public void logGatewayFailed(
      String operation, String subject, int maxRetries, String errorType, String message) {
    try {
      MDC.put("event_type", "gateway_failed");
      MDC.put("operation", operation);
      MDC.put("term", subject);
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("errorType", errorType);

      logger.error(
          "Gateway failed: operation={}, term={}, maxRetries={}, error={}, message={}",
          operation,
          subject,
          maxRetries,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log run progress event. */
  public void logRunProgress(String runId, String phase, int settled, int total, int failed) {
    try {
      MDC.put("event_type", "run_progress");
      MDC.put("phase", phase);
      MDC.put("settled", String.valueOf(settled));
      MDC.put("total", String.valueOf(total));
      MDC.put("failed", String.valueOf(failed));

      int percent = total == 0 ? 100 : (settled * 100) / total;
      logger.info(
          "Run progress: runId={}, phase={}, terms={}/{}, failed={}, progress={}%",
          runId,
          phase,
          settled,
          total,
          failed,
          percent);
    } finally {
      clearEventFields();
    }
  }

  /** Log run summary event. */
  public void logRunSummary(String runId, String phase, int written, int failed, String output) {
    try {
      MDC.put("event_type", "run_summary");
      MDC.put("phase", phase);
      MDC.put("written", String.valueOf(written));
      MDC.put("failed", String.valueOf(failed));

      logger.info(
          "Run finished: runId={}, phase={}, records={}, failed={}, output={}",
          runId,
          phase,
          written,
          failed,
          output);
    } finally {
      clearEventFields();
    }
  }

  /** Set run context in MDC. */
  public static void setRunContext(String runId, String input) {
    MDC.put("runId", runId);
    MDC.put("input", input);
  }

  /** Clear run context from MDC. */
  public static void clearRunContext() {
    MDC.remove("runId");
    MDC.remove("input");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("term_index");
    MDC.remove("term");
    MDC.remove("resolveMs");
    MDC.remove("audioBytes");
    MDC.remove("failureKind");
    MDC.remove("operation");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
    MDC.remove("errorType");
    MDC.remove("phase");
    MDC.remove("settled");
    MDC.remove("total");
    MDC.remove("failed");
    MDC.remove("written");
  }
}

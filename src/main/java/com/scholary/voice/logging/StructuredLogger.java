package com.scholary.voice.logging;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into MDC for exactly one log line so they can be queried in the
 * log backend. Tokens are never passed in here.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log session started event. */
  public void logSessionStarted(String sessionId, List<String> targetLanguages, String sourceLanguage) {
    try {
      MDC.put("event_type", "session_started");
      MDC.put("targetLanguages", String.join(",", targetLanguages));
      MDC.put("sourceLanguage", sourceLanguage);

      logger.info(
          "Session started: sessionId={}, source={}, targets={}",
          sessionId,
          sourceLanguage,
          targetLanguages);
    } finally {
      clearEventFields();
    }
  }

  /** Log state transition event. */
  public void logStateChange(String from, String to) {
    try {
      MDC.put("event_type", "state_change");
      MDC.put("fromState", from);
      MDC.put("toState", to);

      logger.debug("Session state: {} -> {}", from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log reconnect attempt event. */
  public void logReconnectAttempt(int attempt, int maxAttempts) {
    try {
      MDC.put("event_type", "reconnect_attempt");
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));

      logger.warn("Connection closed unexpectedly, reconnecting: attempt={}/{}", attempt, maxAttempts);
    } finally {
      clearEventFields();
    }
  }

  /** Log session completed event. */
  public void logSessionCompleted(
      int sourceSegments, int targetCount, int reconnects, int chunksSent, long durationMs) {
    try {
      MDC.put("event_type", "session_completed");
      MDC.put("sourceSegments", String.valueOf(sourceSegments));
      MDC.put("targetCount", String.valueOf(targetCount));
      MDC.put("reconnects", String.valueOf(reconnects));
      MDC.put("chunksSent", String.valueOf(chunksSent));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Session completed: sourceSegments={}, targets={}, reconnects={}, chunks={}, duration={}ms",
          sourceSegments,
          targetCount,
          reconnects,
          chunksSent,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log session failure event. */
  public void logSessionFailed(String errorType, String message, long durationMs) {
    try {
      MDC.put("event_type", "session_failed");
      MDC.put("errorType", errorType);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.error(
          "Session failed: error={}, message={}, duration={}ms", errorType, message, durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set session context in MDC. */
  public static void setSessionContext(String sessionId) {
    if (sessionId != null) {
      MDC.put("sessionId", sessionId);
    }
  }

  /** Clear session context from MDC. */
  public static void clearSessionContext() {
    MDC.remove("sessionId");
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String path) {
    MDC.put("jobId", jobId);
    MDC.put("path", path);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("path");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("targetLanguages");
    MDC.remove("sourceLanguage");
    MDC.remove("fromState");
    MDC.remove("toState");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("sourceSegments");
    MDC.remove("targetCount");
    MDC.remove("reconnects");
    MDC.remove("chunksSent");
    MDC.remove("durationMs");
    MDC.remove("errorType");
  }
}

package com.scholary.voice.client;

/**
 * Exception thrown when a voice streaming session cannot be set up or cannot continue.
 *
 * <p>The {@link Reason} tells callers which part of the exchange failed without having to parse
 * the message. Some reasons carry a suggestion that is safe to show to an end user.
 */
public class VoiceException extends RuntimeException {

  /** What went wrong. */
  public enum Reason {
    ACCESS_DENIED,
    INVALID_REQUEST,
    QUOTA_EXCEEDED,
    RATE_LIMITED,
    API_ERROR,
    NETWORK_ERROR,
    INVALID_STREAMING_URL,
    CONNECTION_FAILED,
    CLOSED_UNEXPECTEDLY,
    SERVER_ERROR,
    INTERRUPTED
  }

  private final Reason reason;
  private final String suggestion;

  public VoiceException(Reason reason, String message) {
    this(reason, message, null, null);
  }

  public VoiceException(Reason reason, String message, Throwable cause) {
    this(reason, message, null, cause);
  }

  public VoiceException(Reason reason, String message, String suggestion, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.suggestion = suggestion;
  }

  public Reason getReason() {
    return reason;
  }

  public String getSuggestion() {
    return suggestion;
  }
}

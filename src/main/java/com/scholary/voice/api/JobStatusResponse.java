package com.scholary.voice.api;

import com.scholary.voice.session.SessionState;
import com.scholary.voice.session.VoiceSessionResult;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the result if completed.
 * On failure the error is shown along with a suggestion when the voice API gave one.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    SessionState sessionState,
    int reconnectAttempts,
    VoiceSessionResult result,
    String error,
    String suggestion) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isFinished() {
      return this == COMPLETED || this == FAILED;
    }
  }
}

package com.scholary.voice.job;

import com.scholary.voice.api.JobStatusResponse.Status;
import com.scholary.voice.api.VoiceTranslationRequest;
import com.scholary.voice.session.VoiceSession;
import com.scholary.voice.session.VoiceSessionResult;
import java.nio.file.Path;

/**
 * Represents an async voice translation job.
 *
 * <p>Tracks the job's state, its running session and the result. Written by the job runner and read
 * by status and cancel requests, so every mutable field is volatile.
 */
public class VoiceJob {

  private final String jobId;
  private final VoiceTranslationRequest request;
  private final Path audioFile;

  private volatile Status status;
  private volatile VoiceSession session;
  private volatile boolean cancelRequested;
  private volatile VoiceSessionResult result;
  private volatile String error;
  private volatile String suggestion;

  public VoiceJob(String jobId, VoiceTranslationRequest request, Path audioFile) {
    this.jobId = jobId;
    this.request = request;
    this.audioFile = audioFile;
    this.status = Status.PENDING;
  }

  public String getJobId() {
    return jobId;
  }

  public VoiceTranslationRequest getRequest() {
    return request;
  }

  /** The audio file to stream, already resolved inside the audio directory. */
  public Path getAudioFile() {
    return audioFile;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public VoiceSession getSession() {
    return session;
  }

  public void setSession(VoiceSession session) {
    this.session = session;
  }

  public boolean isCancelRequested() {
    return cancelRequested;
  }

  /**
   * Ask the job to stop early. If the session is already running it is cancelled right away,
   * otherwise the runner cancels it as soon as it exists.
   */
  public void requestCancel() {
    cancelRequested = true;
    VoiceSession current = session;
    if (current != null) {
      current.cancel();
    }
  }

  public VoiceSessionResult getResult() {
    return result;
  }

  public void setResult(VoiceSessionResult result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }

  public String getSuggestion() {
    return suggestion;
  }

  public void setSuggestion(String suggestion) {
    this.suggestion = suggestion;
  }
}

package com.scholary.voice.session;

import com.scholary.voice.protocol.SourceTranscriptUpdate;
import com.scholary.voice.protocol.StreamError;
import com.scholary.voice.protocol.TargetTranscriptUpdate;

/**
 * Optional observer of a running session.
 *
 * <p>All methods default to no-ops. They are called on the thread that invoked {@link
 * VoiceSession#run}, in the order the server sent the corresponding messages, and only for the
 * currently active connection.
 */
public interface VoiceStreamCallbacks {

  VoiceStreamCallbacks NONE = new VoiceStreamCallbacks() {};

  default void onSourceTranscript(SourceTranscriptUpdate update) {}

  default void onTargetTranscript(TargetTranscriptUpdate update) {}

  default void onEndOfSourceTranscript() {}

  default void onEndOfTargetTranscript(String language) {}

  default void onEndOfStream() {}

  default void onError(StreamError error) {}

  /** Called before each reconnect attempt, numbered from 1. */
  default void onReconnecting(int attempt) {}
}

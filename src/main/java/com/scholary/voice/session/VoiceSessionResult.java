package com.scholary.voice.session;

import java.util.List;

/**
 * Outcome of a successfully completed session.
 *
 * <p>Targets are in the order the target languages were declared in the options.
 */
public record VoiceSessionResult(
    String sessionId, VoiceTranscript source, List<VoiceTranscript> targets) {

  public VoiceSessionResult {
    targets = List.copyOf(targets);
  }
}

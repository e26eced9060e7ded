package com.scholary.voice.session;

import com.scholary.voice.protocol.TranscriptSegment;
import java.util.List;

/** Final transcript of one language. */
public record VoiceTranscript(String lang, String text, List<TranscriptSegment> segments) {

  public VoiceTranscript {
    segments = List.copyOf(segments);
  }
}

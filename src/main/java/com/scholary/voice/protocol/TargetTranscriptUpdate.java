package com.scholary.voice.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Incremental update of the transcript for one target language. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TargetTranscriptUpdate(
    String language, List<TranscriptSegment> concluded, List<TranscriptSegment> tentative)
    implements ServerEvent {

  public TargetTranscriptUpdate {
    concluded = concluded == null ? List.of() : List.copyOf(concluded);
    tentative = tentative == null ? List.of() : List.copyOf(tentative);
  }
}

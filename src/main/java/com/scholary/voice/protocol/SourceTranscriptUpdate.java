package com.scholary.voice.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Incremental update of the source-language transcript. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceTranscriptUpdate(
    List<TranscriptSegment> concluded, List<TranscriptSegment> tentative) implements ServerEvent {

  public SourceTranscriptUpdate {
    concluded = concluded == null ? List.of() : List.copyOf(concluded);
    tentative = tentative == null ? List.of() : List.copyOf(tentative);
  }
}

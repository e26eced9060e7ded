package com.scholary.voice.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single piece of transcribed or translated speech.
 *
 * <p>Concluded segments are final; tentative segments may still change in a later update. The
 * language tag is optional and only present when the service reports it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranscriptSegment(
    String text,
    String language,
    @JsonProperty("start_time") double startTime,
    @JsonProperty("end_time") double endTime) {

  public boolean hasLanguage() {
    return language != null && !language.isBlank();
  }
}

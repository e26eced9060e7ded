package com.scholary.voice.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Body of {@code POST /v3/voice/realtime}.
 *
 * <p>Optional fields are omitted from the JSON when null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionRequest(
    @JsonProperty("source_language") String sourceLanguage,
    @JsonProperty("source_language_mode") String sourceLanguageMode,
    @JsonProperty("target_languages") List<String> targetLanguages,
    @JsonProperty("source_media_content_type") String sourceMediaContentType,
    @JsonProperty("formality") String formality,
    @JsonProperty("glossary_id") String glossaryId) {

  public SessionRequest {
    if (targetLanguages == null || targetLanguages.isEmpty()) {
      throw new IllegalArgumentException("At least one target language is required");
    }
    if (sourceMediaContentType == null || sourceMediaContentType.isBlank()) {
      throw new IllegalArgumentException("Source media content type is required");
    }
    targetLanguages = List.copyOf(targetLanguages);
  }
}

package com.scholary.voice.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;

/**
 * Request to translate a local audio file.
 *
 * <p>Optional fields fall back to the configured defaults; the content type falls back to
 * detection from the file extension.
 */
public record VoiceTranslationRequest(
    @NotBlank String path,
    @NotEmpty List<@NotBlank String> targetLanguages,
    String sourceLanguage,
    String contentType,
    String formality,
    String glossaryId,
    Boolean reconnect,
    @PositiveOrZero @Max(10) Integer maxReconnectAttempts) {}

package com.scholary.voice.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Caller-supplied settings of one streaming session.
 *
 * <p>Target languages keep their declaration order; that order is the order of the result's
 * targets. A null source language means automatic detection.
 */
public record VoiceStreamOptions(
    List<String> targetLanguages,
    String sourceLanguage,
    String sourceLanguageMode,
    String formality,
    String glossaryId,
    String contentType,
    int chunkSize,
    Duration chunkInterval,
    boolean reconnect,
    int maxReconnectAttempts) {

  public static final String AUTO_DETECT = "auto";

  public static final int DEFAULT_CHUNK_SIZE = 6400;
  public static final Duration DEFAULT_CHUNK_INTERVAL = Duration.ofMillis(200);
  public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 3;

  public VoiceStreamOptions {
    if (targetLanguages == null || targetLanguages.isEmpty()) {
      throw new IllegalArgumentException("At least one target language is required.");
    }
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
    }
    if (chunkInterval == null || chunkInterval.isNegative()) {
      throw new IllegalArgumentException("Chunk interval must not be negative");
    }
    if (maxReconnectAttempts < 0) {
      throw new IllegalArgumentException(
          "Max reconnect attempts must not be negative: " + maxReconnectAttempts);
    }
    targetLanguages = List.copyOf(targetLanguages);
  }

  /** @return the source language, or {@value #AUTO_DETECT} if none was requested */
  public String sourceLanguageOrAuto() {
    return sourceLanguage == null || sourceLanguage.isBlank() ? AUTO_DETECT : sourceLanguage;
  }

  public static Builder builder(List<String> targetLanguages) {
    return new Builder(targetLanguages);
  }

  public static Builder builder(String... targetLanguages) {
    return new Builder(List.of(targetLanguages));
  }

  public Builder toBuilder() {
    return new Builder(targetLanguages)
        .sourceLanguage(sourceLanguage)
        .sourceLanguageMode(sourceLanguageMode)
        .formality(formality)
        .glossaryId(glossaryId)
        .contentType(contentType)
        .chunkSize(chunkSize)
        .chunkInterval(chunkInterval)
        .reconnect(reconnect)
        .maxReconnectAttempts(maxReconnectAttempts);
  }

  /** Builder with the documented defaults. */
  public static final class Builder {

    private final List<String> targetLanguages;
    private String sourceLanguage;
    private String sourceLanguageMode;
    private String formality;
    private String glossaryId;
    private String contentType;
    private int chunkSize = DEFAULT_CHUNK_SIZE;
    private Duration chunkInterval = DEFAULT_CHUNK_INTERVAL;
    private boolean reconnect = true;
    private int maxReconnectAttempts = DEFAULT_MAX_RECONNECT_ATTEMPTS;

    private Builder(List<String> targetLanguages) {
      this.targetLanguages = targetLanguages == null ? List.of() : new ArrayList<>(targetLanguages);
    }

    public Builder sourceLanguage(String sourceLanguage) {
      this.sourceLanguage = sourceLanguage;
      return this;
    }

    public Builder sourceLanguageMode(String sourceLanguageMode) {
      this.sourceLanguageMode = sourceLanguageMode;
      return this;
    }

    public Builder formality(String formality) {
      this.formality = formality;
      return this;
    }

    public Builder glossaryId(String glossaryId) {
      this.glossaryId = glossaryId;
      return this;
    }

    public Builder contentType(String contentType) {
      this.contentType = contentType;
      return this;
    }

    public Builder chunkSize(int chunkSize) {
      this.chunkSize = chunkSize;
      return this;
    }

    public Builder chunkInterval(Duration chunkInterval) {
      this.chunkInterval = chunkInterval;
      return this;
    }

    public Builder reconnect(boolean reconnect) {
      this.reconnect = reconnect;
      return this;
    }

    public Builder maxReconnectAttempts(int maxReconnectAttempts) {
      this.maxReconnectAttempts = maxReconnectAttempts;
      return this;
    }

    public VoiceStreamOptions build() {
      return new VoiceStreamOptions(
          targetLanguages,
          sourceLanguage,
          sourceLanguageMode,
          formality,
          glossaryId,
          contentType,
          chunkSize,
          chunkInterval,
          reconnect,
          maxReconnectAttempts);
    }
  }
}

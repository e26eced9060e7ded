package com.scholary.voice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the voice streaming client.
 *
 * <p>Covers where the service lives and how patient the REST calls are, plus the flow-control and
 * reconnect defaults applied to every session unless a request overrides them. Jobs may only read
 * audio files below {@code audioDir}.
 */
@ConfigurationProperties(prefix = "voice")
@Validated
public record VoiceProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String streamingDomain,
    @NotBlank String audioDir,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @PositiveOrZero int maxRetries,
    @Positive long highWaterMarkBytes,
    @Positive long backpressurePauseMillis,
    @Positive int backpressureMaxWaits,
    @Positive long closeGraceMillis,
    @NotNull @Valid Defaults defaults) {

  /** Per-session defaults. */
  public record Defaults(
      @Positive int chunkSize,
      @PositiveOrZero long chunkIntervalMillis,
      @PositiveOrZero int maxReconnectAttempts,
      boolean reconnect,
      @Positive int maxTargetLanguages) {}
}

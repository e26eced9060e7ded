package com.scholary.voice.service;

import com.scholary.voice.client.VoiceException;
import com.scholary.voice.client.VoiceException.Reason;
import com.scholary.voice.client.VoiceTransport;
import com.scholary.voice.config.VoiceProperties;
import com.scholary.voice.protocol.SessionDescriptor;
import com.scholary.voice.protocol.SessionRequest;
import com.scholary.voice.session.InputStreamChunkSource;
import com.scholary.voice.session.VoiceSession;
import com.scholary.voice.session.VoiceSessionResult;
import com.scholary.voice.session.VoiceStreamCallbacks;
import com.scholary.voice.session.VoiceStreamOptions;
import com.scholary.voice.streaming.BackpressureController;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Translates recorded or live audio through the real-time voice API.
 *
 * <p>Validates options, works out the media type, provisions the session and hands the audio to a
 * {@link VoiceSession}.
 */
@Service
public class VoiceTranslationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(VoiceTranslationService.class);

  static final Map<String, String> EXTENSION_CONTENT_TYPES =
      Map.of(
          ".ogg", "audio/opus;container=ogg",
          ".opus", "audio/opus;container=ogg",
          ".webm", "audio/opus;container=webm",
          ".mka", "audio/opus;container=matroska",
          ".flac", "audio/flac",
          ".mp3", "audio/mpeg",
          ".pcm", "audio/pcm;encoding=s16le;rate=16000",
          ".raw", "audio/pcm;encoding=s16le;rate=16000");

  private final VoiceTransport transport;
  private final VoiceProperties properties;
  private final BackpressureController backpressureController;
  private final Executor senderExecutor;

  public VoiceTranslationService(
      VoiceTransport transport,
      VoiceProperties properties,
      BackpressureController backpressureController,
      @Qualifier("audioSenderExecutor") Executor senderExecutor) {
    this.transport = transport;
    this.properties = properties;
    this.backpressureController = backpressureController;
    this.senderExecutor = senderExecutor;
  }

  /**
   * Start options with the configured defaults.
   *
   * @param targetLanguages target languages in result order
   * @return a builder pre-filled from {@code voice.defaults}
   */
  public VoiceStreamOptions.Builder defaultOptions(List<String> targetLanguages) {
    VoiceProperties.Defaults defaults = properties.defaults();
    return VoiceStreamOptions.builder(targetLanguages)
        .chunkSize(defaults.chunkSize())
        .chunkInterval(Duration.ofMillis(defaults.chunkIntervalMillis()))
        .reconnect(defaults.reconnect())
        .maxReconnectAttempts(defaults.maxReconnectAttempts());
  }

  /**
   * Check the target language count.
   *
   * @throws VoiceException with {@link Reason#INVALID_REQUEST} if there are too many targets
   */
  public void validateOptions(VoiceStreamOptions options) {
    int max = properties.defaults().maxTargetLanguages();
    if (options.targetLanguages().size() > max) {
      throw new VoiceException(
          Reason.INVALID_REQUEST,
          String.format(
              "Maximum %d target languages allowed, got %d.", max, options.targetLanguages().size()));
    }
  }

  /**
   * Guess the media type from the file extension.
   *
   * @return the content type, or empty for unknown extensions
   */
  public Optional<String> detectContentType(Path file) {
    String name = file.getFileName() == null ? "" : file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    if (dot < 0) {
      return Optional.empty();
    }
    return Optional.ofNullable(EXTENSION_CONTENT_TYPES.get(name.substring(dot).toLowerCase(Locale.ROOT)));
  }

  /**
   * Fill in the content type for a file and make sure the file exists.
   *
   * @throws VoiceException if the format cannot be detected and none was given
   * @throws NoSuchFileException if the file does not exist
   */
  public VoiceStreamOptions resolveFileOptions(Path file, VoiceStreamOptions options)
      throws NoSuchFileException {
    validateOptions(options);

    String contentType = options.contentType();
    if (contentType == null) {
      contentType =
          detectContentType(file)
              .orElseThrow(
                  () ->
                      new VoiceException(
                          Reason.INVALID_REQUEST,
                          String.format(
                              "Cannot detect audio format for \"%s\". Specify the content type explicitly.",
                              file)));
    }

    if (!Files.isRegularFile(file)) {
      throw new NoSuchFileException(file.toString());
    }

    return options.toBuilder().contentType(contentType).build();
  }

  /**
   * Provision a session on the service. The returned session has not started streaming yet.
   *
   * @throws VoiceException if the options are invalid or the service refuses the session
   */
  public VoiceSession openSession(VoiceStreamOptions options, VoiceStreamCallbacks callbacks) {
    validateOptions(options);
    if (options.contentType() == null || options.contentType().isBlank()) {
      throw new VoiceException(Reason.INVALID_REQUEST, "Content type is required.");
    }

    SessionDescriptor descriptor = transport.createSession(toSessionRequest(options));
    return new VoiceSession(
        transport,
        descriptor,
        options,
        callbacks,
        backpressureController,
        senderExecutor,
        Duration.ofMillis(properties.closeGraceMillis()));
  }

  /** Translate an audio file, detecting its format from the extension unless one is given. */
  public VoiceSessionResult translateFile(
      Path file, VoiceStreamOptions options, VoiceStreamCallbacks callbacks) throws IOException {
    VoiceStreamOptions resolved = resolveFileOptions(file, options);
    VoiceSession session = openSession(resolved, callbacks);
    return streamFile(session, file, resolved.chunkSize());
  }

  /** Run an already provisioned session over the contents of a file. */
  public VoiceSessionResult streamFile(VoiceSession session, Path file, int chunkSize)
      throws IOException {
    LOGGER.info("Streaming file {} in chunks of {} bytes", file.getFileName(), chunkSize);
    try (InputStreamChunkSource source =
        new InputStreamChunkSource(Files.newInputStream(file), chunkSize)) {
      return session.run(source);
    }
  }

  /**
   * Translate a live stream such as standard input. The stream is read until it ends and is not
   * closed.
   *
   * @throws VoiceException if no content type was given; it cannot be detected from a stream
   */
  public VoiceSessionResult translateStream(
      InputStream input, VoiceStreamOptions options, VoiceStreamCallbacks callbacks)
      throws IOException {
    validateOptions(options);
    if (options.contentType() == null) {
      throw new VoiceException(
          Reason.INVALID_REQUEST,
          "Content type is required when reading from a stream. Specify the audio format explicitly.");
    }

    VoiceSession session = openSession(options, callbacks);
    return session.run(new InputStreamChunkSource(input, options.chunkSize()));
  }

  static SessionRequest toSessionRequest(VoiceStreamOptions options) {
    return new SessionRequest(
        options.sourceLanguage(),
        options.sourceLanguageMode(),
        options.targetLanguages(),
        options.contentType(),
        options.formality(),
        options.glossaryId());
  }
}

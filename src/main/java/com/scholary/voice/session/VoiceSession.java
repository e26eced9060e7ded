package com.scholary.voice.session;

import com.scholary.voice.client.ConnectionListener;
import com.scholary.voice.client.VoiceConnection;
import com.scholary.voice.client.VoiceException;
import com.scholary.voice.client.VoiceException.Reason;
import com.scholary.voice.client.VoiceTransport;
import com.scholary.voice.logging.StructuredLogger;
import com.scholary.voice.protocol.EndOfSourceTranscript;
import com.scholary.voice.protocol.EndOfStream;
import com.scholary.voice.protocol.EndOfTargetTranscript;
import com.scholary.voice.protocol.ServerEvent;
import com.scholary.voice.protocol.SessionDescriptor;
import com.scholary.voice.protocol.SourceTranscriptUpdate;
import com.scholary.voice.protocol.StreamError;
import com.scholary.voice.protocol.TargetTranscriptUpdate;
import com.scholary.voice.session.SessionSignal.Closed;
import com.scholary.voice.session.SessionSignal.ConnectionFailed;
import com.scholary.voice.session.SessionSignal.Opened;
import com.scholary.voice.session.SessionSignal.Received;
import com.scholary.voice.session.SessionSignal.SenderFailed;
import com.scholary.voice.streaming.BackpressureController;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * One real-time translation session: uploads audio, collects transcripts, survives drops.
 *
 * <p>Two lines of work share a session:
 *
 * <ul>
 *   <li>the <b>event path</b>, running on the thread that calls {@link #run}: it consumes a queue
 *       of connection signals, updates the transcripts, drives the state machine and reconnects;
 *   <li>the <b>audio sender</b>, running on the sender executor: it pulls chunks from the caller's
 *       source and writes them to whatever connection is active, pausing when the connection's
 *       send buffer is above its high-water mark.
 * </ul>
 *
 * <p>Only the event path touches the transcripts. The active connection is the only state the two
 * share; it is replaced atomically on reconnect and every send uses the reference it read once.
 * Signals from a superseded connection are dropped.
 *
 * <p>Chunks already handed to a connection that later drops are not sent again after reconnect.
 *
 * <p>A session runs once. {@link #cancel()} may be called from any thread.
 */
public class VoiceSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(VoiceSession.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final long OPEN_WAIT_MILLIS = 50;

  private final VoiceTransport transport;
  private final VoiceStreamOptions options;
  private final VoiceStreamCallbacks callbacks;
  private final BackpressureController backpressure;
  private final Executor senderExecutor;
  private final Duration closeGrace;

  private final TranscriptAccumulator source;
  private final Map<String, TranscriptAccumulator> targets = new LinkedHashMap<>();

  private final BlockingQueue<SessionSignal> signals = new LinkedBlockingQueue<>();
  private final AtomicReference<VoiceConnection> activeConnection = new AtomicReference<>();
  private final AtomicReference<VoiceConnection> endOfSourceSentOn = new AtomicReference<>();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final AtomicInteger chunksSent = new AtomicInteger();
  private final Object connectionMonitor = new Object();

  private volatile SessionState state = SessionState.CONNECTING;
  private volatile boolean endOfSourceRequested;
  private volatile boolean finished;
  private volatile int reconnectAttempts;

  // event path only
  private SessionDescriptor descriptor;
  private AudioChunkSource chunkSource;
  private int generation;
  private boolean currentOpened;
  private boolean senderStarted;
  private boolean streamEnded;

  public VoiceSession(
      VoiceTransport transport,
      SessionDescriptor descriptor,
      VoiceStreamOptions options,
      VoiceStreamCallbacks callbacks,
      BackpressureController backpressure,
      Executor senderExecutor,
      Duration closeGrace) {
    this.transport = transport;
    this.descriptor = descriptor;
    this.options = options;
    this.callbacks = callbacks == null ? VoiceStreamCallbacks.NONE : callbacks;
    this.backpressure = backpressure;
    this.senderExecutor = senderExecutor;
    this.closeGrace = closeGrace;

    this.source = new TranscriptAccumulator(options.sourceLanguageOrAuto());
    for (String language : options.targetLanguages()) {
      targets.putIfAbsent(language, new TranscriptAccumulator(language));
    }
  }

  /**
   * Stream the audio and block until the session completes or fails.
   *
   * @param chunkSource the audio to upload
   * @return the final transcripts
   * @throws IOException if the chunk source fails; the exception is the one the source threw
   * @throws VoiceException if the session cannot be opened, the server reports an error, or the
   *     connection drops more often than reconnection allows
   */
  public VoiceSessionResult run(AudioChunkSource chunkSource) throws IOException {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("A voice session can only be run once");
    }
    this.chunkSource = chunkSource;
    long startedAt = System.currentTimeMillis();

    StructuredLogger.setSessionContext(descriptor.sessionId());
    structuredLogger.logSessionStarted(
        descriptor.sessionId(), options.targetLanguages(), options.sourceLanguageOrAuto());

    try {
      connect();
      VoiceSessionResult result = awaitResult();
      structuredLogger.logSessionCompleted(
          source.segmentCount(),
          targets.size(),
          reconnectAttempts,
          chunksSent.get(),
          System.currentTimeMillis() - startedAt);
      return result;

    } catch (IOException | RuntimeException | Error e) {
      fail(e, startedAt);
      throw e;
    } finally {
      finished = true;
      wakeSender();
      StructuredLogger.clearSessionContext();
    }
  }

  /**
   * Ask the server to finish early.
   *
   * <p>Sends the end-of-source sentinel on the active connection and stops the upload. The session
   * still completes through the server's end-of-stream (or the following close). No-op once the
   * session has finished.
   */
  public void cancel() {
    if (finished || state.isTerminal()) {
      LOGGER.debug("Ignoring cancel, session already finished");
      return;
    }
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }

    LOGGER.info("Cancellation requested, asking the server to finish");
    endOfSourceRequested = true;
    VoiceConnection connection = activeConnection.get();
    if (connection != null && connection.isOpen()) {
      sendEndOfSourceOnce(connection);
    }
    wakeSender();
  }

  public SessionState getState() {
    return state;
  }

  public int getReconnectAttempts() {
    return reconnectAttempts;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public String getSessionId() {
    return descriptor.sessionId();
  }

  // ---------------------------------------------------------------------------------------------
  // Event path

  private VoiceSessionResult awaitResult() throws IOException {
    while (true) {
      SessionSignal signal = nextSignal();

      if (signal == null) {
        LOGGER.warn(
            "Connection did not close within {}ms after end of stream, completing",
            closeGrace.toMillis());
        return complete();
      }

      if (signal.generation() != SessionSignal.ANY_GENERATION
          && signal.generation() != generation) {
        LOGGER.debug(
            "Dropping {} from superseded connection {}",
            signal.getClass().getSimpleName(),
            signal.generation());
        continue;
      }

      VoiceSessionResult result = handle(signal);
      if (result != null) {
        return result;
      }
    }
  }

  private SessionSignal nextSignal() {
    try {
      if (streamEnded) {
        return signals.poll(closeGrace.toMillis(), TimeUnit.MILLISECONDS);
      }
      return signals.take();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new VoiceException(Reason.INTERRUPTED, "Voice session interrupted", e);
    }
  }

  /** @return the result when the session completed, otherwise null */
  private VoiceSessionResult handle(SessionSignal signal) throws IOException {
    if (signal instanceof Opened) {
      onOpened();
      return null;
    }
    if (signal instanceof Received) {
      onServerEvent(((Received) signal).event());
      return null;
    }
    if (signal instanceof Closed) {
      Closed closed = (Closed) signal;
      return onClosed(closed.statusCode(), closed.reason());
    }
    if (signal instanceof ConnectionFailed) {
      return onConnectionFailed(((ConnectionFailed) signal).error());
    }
    if (signal instanceof SenderFailed) {
      rethrow(((SenderFailed) signal).error());
    }
    throw new IllegalStateException("Unknown session signal: " + signal);
  }

  private void onOpened() {
    currentOpened = true;
    transition(SessionState.STREAMING);
    wakeSender();

    if (!senderStarted) {
      senderStarted = true;
      Map<String, String> logContext = MDC.getCopyOfContextMap();
      senderExecutor.execute(
          () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (logContext != null) {
              MDC.setContextMap(logContext);
            }
            try {
              sendChunks();
            } finally {
              if (previous != null) {
                MDC.setContextMap(previous);
              } else {
                MDC.clear();
              }
            }
          });
    } else if (endOfSourceRequested) {
      // the previous connection may have dropped before the server saw the sentinel
      sendEndOfSourceOnce(activeConnection.get());
    }
  }

  private void onServerEvent(ServerEvent event) {
    if (event instanceof SourceTranscriptUpdate) {
      SourceTranscriptUpdate update = (SourceTranscriptUpdate) event;
      source.append(update.concluded());
      callbacks.onSourceTranscript(update);

    } else if (event instanceof TargetTranscriptUpdate) {
      TargetTranscriptUpdate update = (TargetTranscriptUpdate) event;
      TranscriptAccumulator target = targets.get(update.language());
      if (target != null) {
        target.append(update.concluded());
      } else {
        LOGGER.debug("Transcript update for undeclared target language {}", update.language());
      }
      callbacks.onTargetTranscript(update);

    } else if (event instanceof EndOfSourceTranscript) {
      source.freeze();
      callbacks.onEndOfSourceTranscript();

    } else if (event instanceof EndOfTargetTranscript) {
      String language = ((EndOfTargetTranscript) event).language();
      TranscriptAccumulator target = targets.get(language);
      if (target != null) {
        target.freeze();
      }
      callbacks.onEndOfTargetTranscript(language);

    } else if (event instanceof EndOfStream) {
      streamEnded = true;
      callbacks.onEndOfStream();
      LOGGER.debug("End of stream received, closing connection");
      closeActiveConnection();

    } else if (event instanceof StreamError) {
      StreamError error = (StreamError) event;
      callbacks.onError(error);
      throw new VoiceException(
          Reason.SERVER_ERROR,
          String.format("Voice streaming error: %s (%d)", error.errorMessage(), error.errorCode()));
    }
  }

  private VoiceSessionResult onClosed(int statusCode, String reason) {
    if (streamEnded) {
      return complete();
    }
    if (cancelled.get()) {
      LOGGER.info(
          "Connection closed after cancellation before end of stream (status={}), completing",
          statusCode);
      return complete();
    }
    LOGGER.warn(
        "Connection closed before end of stream: status={}, reason={}", statusCode, reason);
    reconnectOrFail();
    return null;
  }

  private VoiceSessionResult onConnectionFailed(Throwable error) {
    if (streamEnded) {
      return complete();
    }
    if (!currentOpened) {
      throw new VoiceException(
          Reason.CONNECTION_FAILED, "WebSocket connection failed: " + error.getMessage(), error);
    }
    if (cancelled.get()) {
      return complete();
    }
    LOGGER.warn("Connection error while streaming: {}", error.getMessage());
    reconnectOrFail();
    return null;
  }

  private void reconnectOrFail() {
    if (!options.reconnect() || reconnectAttempts >= options.maxReconnectAttempts()) {
      throw new VoiceException(Reason.CLOSED_UNEXPECTEDLY, "WebSocket closed unexpectedly");
    }

    transition(SessionState.RECONNECTING);
    reconnectAttempts++;
    structuredLogger.logReconnectAttempt(reconnectAttempts, options.maxReconnectAttempts());
    callbacks.onReconnecting(reconnectAttempts);

    SessionDescriptor fresh = transport.reconnectSession(descriptor.token());
    descriptor = descriptor.withCredentialsFrom(fresh);
    connect();
  }

  private void connect() {
    generation++;
    currentOpened = false;
    int connectionGeneration = generation;

    VoiceConnection connection =
        transport.openConnection(
            descriptor.streamingUrl(), descriptor.token(), new SignalingListener(connectionGeneration));

    VoiceConnection previous = activeConnection.getAndSet(connection);
    if (previous != null) {
      previous.close();
    }
    wakeSender();
  }

  private VoiceSessionResult complete() {
    transition(SessionState.COMPLETED);
    finished = true;
    wakeSender();

    List<VoiceTranscript> targetTranscripts = new ArrayList<>(targets.size());
    for (TranscriptAccumulator target : targets.values()) {
      targetTranscripts.add(target.toTranscript(target.getLanguage()));
    }
    return new VoiceSessionResult(
        descriptor.sessionId(), source.toTranscript(source.resolvedLanguage()), targetTranscripts);
  }

  private void fail(Throwable error, long startedAt) {
    if (!state.isTerminal()) {
      transition(SessionState.FAILED);
    }
    finished = true;
    closeActiveConnection();

    String errorType =
        error instanceof VoiceException
            ? ((VoiceException) error).getReason().name()
            : error.getClass().getSimpleName();
    structuredLogger.logSessionFailed(
        errorType, error.getMessage(), System.currentTimeMillis() - startedAt);
  }

  private void transition(SessionState next) {
    SessionState previous = state;
    if (previous != next) {
      state = next;
      structuredLogger.logStateChange(previous.name(), next.name());
    }
  }

  private void closeActiveConnection() {
    VoiceConnection connection = activeConnection.get();
    if (connection != null) {
      connection.close();
    }
  }

  private static void rethrow(Throwable error) throws IOException {
    if (error instanceof IOException) {
      throw (IOException) error;
    }
    if (error instanceof RuntimeException) {
      throw (RuntimeException) error;
    }
    if (error instanceof Error) {
      throw (Error) error;
    }
    throw new IllegalStateException(error);
  }

  // ---------------------------------------------------------------------------------------------
  // Audio sender

  private void sendChunks() {
    try {
      while (!cancelled.get() && !finished) {
        Optional<byte[]> chunk = chunkSource.nextChunk();
        if (chunk.isEmpty()) {
          LOGGER.debug("Audio source exhausted after {} chunks", chunksSent.get());
          break;
        }
        if (cancelled.get()) {
          break;
        }

        VoiceConnection connection = awaitOpenConnection();
        if (connection == null) {
          return;
        }

        boolean belowHighWaterMark = transport.sendAudioChunk(connection, chunk.get());
        chunksSent.incrementAndGet();
        if (!belowHighWaterMark) {
          backpressure.waitForDrain(connection);
        }
        pace();
      }

      if (finished) {
        return;
      }
      endOfSourceRequested = true;
      VoiceConnection connection = activeConnection.get();
      if (connection != null && connection.isOpen()) {
        sendEndOfSourceOnce(connection);
      }

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      signals.add(
          new SenderFailed(
              new VoiceException(Reason.INTERRUPTED, "Audio upload interrupted", e)));
    } catch (IOException | RuntimeException | Error e) {
      LOGGER.warn("Audio source failed after {} chunks: {}", chunksSent.get(), e.toString());
      signals.add(new SenderFailed(e));
    }
  }

  private VoiceConnection awaitOpenConnection() throws InterruptedException {
    synchronized (connectionMonitor) {
      while (!finished) {
        VoiceConnection connection = activeConnection.get();
        if (connection != null && connection.isOpen()) {
          return connection;
        }
        connectionMonitor.wait(OPEN_WAIT_MILLIS);
      }
      return null;
    }
  }

  private void pace() throws InterruptedException {
    long intervalMillis = options.chunkInterval().toMillis();
    if (intervalMillis > 0) {
      Thread.sleep(intervalMillis);
    }
  }

  private void sendEndOfSourceOnce(VoiceConnection connection) {
    if (connection == null) {
      return;
    }
    if (endOfSourceSentOn.getAndSet(connection) != connection) {
      transport.sendEndOfSource(connection);
    }
  }

  private void wakeSender() {
    synchronized (connectionMonitor) {
      connectionMonitor.notifyAll();
    }
  }

  /** Turns one connection's callbacks into queued signals tagged with its generation. */
  private final class SignalingListener implements ConnectionListener {

    private final int connectionGeneration;

    private SignalingListener(int connectionGeneration) {
      this.connectionGeneration = connectionGeneration;
    }

    @Override
    public void onOpen() {
      signals.add(new Opened(connectionGeneration));
    }

    @Override
    public void onServerEvent(ServerEvent event) {
      signals.add(new Received(connectionGeneration, event));
    }

    @Override
    public void onClose(int statusCode, String reason) {
      signals.add(new Closed(connectionGeneration, statusCode, reason));
    }

    @Override
    public void onConnectionError(Throwable error) {
      signals.add(new ConnectionFailed(connectionGeneration, error));
    }
  }
}

package com.scholary.voice.client;

import java.io.ByteArrayOutputStream;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VoiceConnection} backed by the JDK WebSocket client.
 *
 * <p>The JDK client allows only one outstanding send per socket, so sends are chained: each frame
 * is written after the previous one completed. The number of characters waiting in that chain is
 * the buffered amount used for flow control. All outbound frames are JSON with base64 payloads, so
 * characters and bytes are the same.
 *
 * <p>Inbound frames may arrive in parts; parts are collected until the last one and the whole
 * frame is handed to the {@link ServerMessageParser}.
 */
class WebSocketVoiceConnection implements VoiceConnection, WebSocket.Listener {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketVoiceConnection.class);

  private final ConnectionListener listener;
  private final ServerMessageParser parser;
  private final long highWaterMarkBytes;

  private final AtomicLong bufferedBytes = new AtomicLong();
  private final AtomicBoolean closeRequested = new AtomicBoolean();
  private final StringBuilder textFrame = new StringBuilder();
  private final ByteArrayOutputStream binaryFrame = new ByteArrayOutputStream();

  private volatile WebSocket webSocket;
  private volatile boolean open;

  // guarded by this
  private CompletableFuture<?> sendChain = CompletableFuture.completedFuture(null);

  WebSocketVoiceConnection(
      ConnectionListener listener, ServerMessageParser parser, long highWaterMarkBytes) {
    this.listener = listener;
    this.parser = parser;
    this.highWaterMarkBytes = highWaterMarkBytes;
  }

  /** Report handshake failures, which the JDK client does not pass to {@link #onError}. */
  void attach(CompletableFuture<WebSocket> handshake) {
    handshake.whenComplete(
        (ws, error) -> {
          if (error != null) {
            open = false;
            listener.onConnectionError(unwrap(error));
          }
        });
  }

  @Override
  public boolean isOpen() {
    return open && !closeRequested.get();
  }

  @Override
  public void send(String text) {
    if (!isOpen()) {
      LOGGER.debug("Dropping frame, connection is not open");
      return;
    }

    long size = text.length();
    bufferedBytes.addAndGet(size);
    synchronized (this) {
      sendChain =
          sendChain
              .thenCompose(ignored -> webSocket.sendText(text, true))
              .whenComplete(
                  (ws, error) -> {
                    bufferedBytes.addAndGet(-size);
                    if (error != null) {
                      LOGGER.debug("Frame send failed: {}", unwrap(error).getMessage());
                    }
                  });
    }
  }

  @Override
  public long bufferedBytes() {
    return bufferedBytes.get();
  }

  @Override
  public boolean isCongested() {
    return bufferedBytes.get() >= highWaterMarkBytes;
  }

  @Override
  public void close() {
    if (!closeRequested.compareAndSet(false, true)) {
      return;
    }
    WebSocket ws = webSocket;
    if (ws == null) {
      return;
    }
    synchronized (this) {
      sendChain =
          sendChain
              .exceptionally(error -> null)
              .thenCompose(ignored -> ws.sendClose(WebSocket.NORMAL_CLOSURE, ""))
              .whenComplete(
                  (result, error) -> {
                    if (error != null) {
                      LOGGER.debug("Close handshake failed, aborting: {}", unwrap(error).getMessage());
                      ws.abort();
                    }
                  });
    }
  }

  @Override
  public void onOpen(WebSocket ws) {
    this.webSocket = ws;
    if (closeRequested.get()) {
      ws.abort();
      return;
    }
    open = true;
    listener.onOpen();
    ws.request(1);
  }

  @Override
  public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
    textFrame.append(data);
    if (last) {
      String frame = textFrame.toString();
      textFrame.setLength(0);
      dispatch(frame);
    }
    ws.request(1);
    return null;
  }

  @Override
  public CompletionStage<?> onBinary(WebSocket ws, ByteBuffer data, boolean last) {
    byte[] bytes = new byte[data.remaining()];
    data.get(bytes);
    binaryFrame.write(bytes, 0, bytes.length);
    if (last) {
      String frame = binaryFrame.toString(StandardCharsets.UTF_8);
      binaryFrame.reset();
      dispatch(frame);
    }
    ws.request(1);
    return null;
  }

  @Override
  public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
    open = false;
    listener.onClose(statusCode, reason);
    return null;
  }

  @Override
  public void onError(WebSocket ws, Throwable error) {
    open = false;
    listener.onConnectionError(error);
  }

  private void dispatch(String frame) {
    parser.parse(frame).ifPresent(listener::onServerEvent);
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}

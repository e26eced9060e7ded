package com.scholary.voice.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.voice.client.ConnectionListener;
import com.scholary.voice.client.ServerMessageParser;
import com.scholary.voice.client.VoiceConnection;
import com.scholary.voice.client.VoiceTransport;
import com.scholary.voice.protocol.EndOfStream;
import com.scholary.voice.protocol.ServerEvent;
import com.scholary.voice.protocol.SessionDescriptor;
import com.scholary.voice.protocol.SessionRequest;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.MDC;

/**
 * In-memory transport whose connections follow a script, one script per opened connection.
 *
 * <p>Listener callbacks are invoked synchronously, the way a real socket's reader thread would.
 */
class FakeVoiceTransport implements VoiceTransport {

  private static final ServerMessageParser PARSER = new ServerMessageParser(new ObjectMapper());

  final List<FakeConnection> connections = new CopyOnWriteArrayList<>();
  final List<String> reconnectTokens = new CopyOnWriteArrayList<>();
  final CountDownLatch firstChunk = new CountDownLatch(1);
  final List<String> senderSessionIds = new CopyOnWriteArrayList<>();

  private final Deque<Script> scripts = new ArrayDeque<>();
  private final AtomicInteger reconnects = new AtomicInteger();
  private RuntimeException reconnectFailure;

  FakeVoiceTransport script(Script... connectionScripts) {
    Collections.addAll(scripts, connectionScripts);
    return this;
  }

  FakeVoiceTransport failReconnectWith(RuntimeException failure) {
    this.reconnectFailure = failure;
    return this;
  }

  @Override
  public SessionDescriptor createSession(SessionRequest request) {
    return new SessionDescriptor("wss://api.deepl.com/stream/1", "tok-1", "sess-1");
  }

  @Override
  public SessionDescriptor reconnectSession(String token) {
    reconnectTokens.add(token);
    if (reconnectFailure != null) {
      throw reconnectFailure;
    }
    int n = reconnects.incrementAndGet() + 1;
    return new SessionDescriptor("wss://api.deepl.com/stream/" + n, "tok-" + n, null);
  }

  @Override
  public VoiceConnection openConnection(
      String streamingUrl, String token, ConnectionListener listener) {
    Script script;
    synchronized (scripts) {
      script = scripts.isEmpty() ? Script.completing() : scripts.poll();
    }
    FakeConnection connection = new FakeConnection(streamingUrl, token, listener, script);
    connections.add(connection);

    if (script.refuse) {
      listener.onConnectionError(new IOException("connection refused"));
      return connection;
    }
    connection.open = true;
    listener.onOpen();
    script.afterOpen.accept(connection);
    return connection;
  }

  @Override
  public boolean sendAudioChunk(VoiceConnection connection, byte[] data) {
    FakeConnection fake = (FakeConnection) connection;
    if (!fake.open) {
      return false;
    }
    fake.chunks.incrementAndGet();
    fake.sentAtNanos.add(System.nanoTime());
    senderSessionIds.add(String.valueOf(MDC.get("sessionId")));
    firstChunk.countDown();
    return fake.congestedPolls.get() == 0;
  }

  @Override
  public void sendEndOfSource(VoiceConnection connection) {
    FakeConnection fake = (FakeConnection) connection;
    if (!fake.open) {
      return;
    }
    fake.endOfSourceFrames.incrementAndGet();
    fake.script.onEndOfSource.accept(fake);
  }

  int endOfSourceFrames() {
    return connections.stream().mapToInt(c -> c.endOfSourceFrames.get()).sum();
  }

  /** Scripted connection. Closing it while open echoes a normal close unless told otherwise. */
  static final class FakeConnection implements VoiceConnection {

    final String streamingUrl;
    final String token;
    final ConnectionListener listener;
    final Script script;
    final AtomicInteger chunks = new AtomicInteger();
    final AtomicInteger endOfSourceFrames = new AtomicInteger();
    final AtomicInteger closeCalls = new AtomicInteger();
    final AtomicInteger congestedPolls;
    final List<Long> sentAtNanos = new CopyOnWriteArrayList<>();
    volatile boolean open;

    FakeConnection(String streamingUrl, String token, ConnectionListener listener, Script script) {
      this.streamingUrl = streamingUrl;
      this.token = token;
      this.listener = listener;
      this.script = script;
      this.congestedPolls = new AtomicInteger(script.congestedPolls);
    }

    /** Feed raw text frames through the real parser, dropping the ones it rejects. */
    void emitRaw(String... frames) {
      for (String frame : frames) {
        PARSER.parse(frame).ifPresent(listener::onServerEvent);
      }
    }

    void emit(ServerEvent... events) {
      for (ServerEvent event : events) {
        listener.onServerEvent(event);
      }
    }

    void drop(int statusCode) {
      open = false;
      listener.onClose(statusCode, "dropped");
    }

    @Override
    public boolean isOpen() {
      return open;
    }

    @Override
    public void send(String text) {
      throw new UnsupportedOperationException("frames go through the transport");
    }

    @Override
    public long bufferedBytes() {
      return 0;
    }

    @Override
    public boolean isCongested() {
      return congestedPolls.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }

    @Override
    public void close() {
      closeCalls.incrementAndGet();
      if (open) {
        open = false;
        if (script.echoClose) {
          listener.onClose(1000, "");
        }
      }
    }
  }

  /** What one connection does. */
  static final class Script {

    interface Step {
      void accept(FakeConnection connection);
    }

    private Step afterOpen = connection -> {};
    private Step onEndOfSource = connection -> connection.emit(new EndOfStream());
    private boolean refuse;
    private boolean echoClose = true;
    private int congestedPolls;

    /** Answers end of source with end of stream. */
    static Script completing() {
      return new Script();
    }

    /** Drops right after opening. */
    static Script dropping() {
      return new Script().afterOpen(connection -> connection.drop(1006));
    }

    /** Handshake fails. */
    static Script refusing() {
      Script script = new Script();
      script.refuse = true;
      return script;
    }

    Script afterOpen(Step step) {
      this.afterOpen = step;
      return this;
    }

    Script onEndOfSource(Step step) {
      this.onEndOfSource = step;
      return this;
    }

    /** Reports a full send buffer until it has been polled this many times. */
    Script congested(int drainPolls) {
      this.congestedPolls = drainPolls;
      return this;
    }

    Script withoutCloseEcho() {
      this.echoClose = false;
      return this;
    }
  }
}

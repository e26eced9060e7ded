package com.scholary.voice.session;

import com.scholary.voice.protocol.ServerEvent;

/**
 * Everything the session's event path reacts to, in one queue.
 *
 * <p>Connection signals carry the generation of the connection they came from; the session drops
 * those whose generation is not the current one. Signals from the audio sender are not tied to a
 * connection.
 */
interface SessionSignal {

  int ANY_GENERATION = -1;

  int generation();

  record Opened(int generation) implements SessionSignal {}

  record Received(int generation, ServerEvent event) implements SessionSignal {}

  record Closed(int generation, int statusCode, String reason) implements SessionSignal {}

  record ConnectionFailed(int generation, Throwable error) implements SessionSignal {}

  record SenderFailed(Throwable error) implements SessionSignal {
    @Override
    public int generation() {
      return ANY_GENERATION;
    }
  }
}

package com.scholary.voice.client;

import com.scholary.voice.protocol.ServerEvent;

/**
 * Receives everything that happens on one streaming connection.
 *
 * <p>Callbacks for a given connection are invoked one at a time, in the order the transport
 * delivers them.
 */
public interface ConnectionListener {

  /** The WebSocket handshake completed. */
  void onOpen();

  /** A well-formed server message arrived. Malformed frames never reach this method. */
  void onServerEvent(ServerEvent event);

  /** The connection closed, by either side. */
  void onClose(int statusCode, String reason);

  /** The socket failed: handshake error, I/O error, or protocol violation below JSON level. */
  void onConnectionError(Throwable error);
}

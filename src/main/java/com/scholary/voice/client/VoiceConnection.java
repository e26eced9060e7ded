package com.scholary.voice.client;

/**
 * Handle on one open (or opening) streaming connection.
 *
 * <p>Sends are queued in order. The connection keeps count of bytes handed to it that the socket
 * has not yet written, which is what flow control looks at.
 */
public interface VoiceConnection {

  /** @return true once the handshake completed and until the connection is closed */
  boolean isOpen();

  /**
   * Queue a text frame. Ignored if the connection is not open.
   *
   * @param text the frame payload
   */
  void send(String text);

  /** @return bytes queued but not yet written to the socket */
  long bufferedBytes();

  /** @return true while the buffered bytes are at or above the high-water mark */
  boolean isCongested();

  /** Start a normal close. Safe to call more than once. */
  void close();
}

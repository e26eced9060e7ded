package com.scholary.voice.client;

import com.scholary.voice.protocol.SessionDescriptor;
import com.scholary.voice.protocol.SessionRequest;

/**
 * Transport for real-time voice translation.
 *
 * <p>Covers the two REST calls that hand out streaming credentials and the WebSocket connection
 * they unlock. Sessions only talk to the service through this interface, which keeps them testable
 * without a network.
 */
public interface VoiceTransport {

  /**
   * Provision a new streaming session.
   *
   * @param request languages and media type of the session
   * @return URL, token and id of the new session
   * @throws VoiceException with {@code ACCESS_DENIED} when the plan has no streaming access, or
   *     {@code INVALID_REQUEST} when the request is rejected
   */
  SessionDescriptor createSession(SessionRequest request);

  /**
   * Exchange a (possibly stale) token for fresh streaming credentials of the same session.
   *
   * @param token the most recent token of the session
   * @return new URL and token; the session id is not included
   */
  SessionDescriptor reconnectSession(String token);

  /**
   * Open a WebSocket to the streaming URL. Returns immediately; the listener learns whether the
   * handshake succeeded.
   *
   * @throws VoiceException with {@code INVALID_STREAMING_URL} if the URL is not a secure
   *     WebSocket URL on the expected domain; no connection is attempted in that case
   */
  VoiceConnection openConnection(String streamingUrl, String token, ConnectionListener listener);

  /**
   * Send one chunk of audio.
   *
   * @return true if the connection's send buffer is still below the high-water mark; false means
   *     the caller should slow down, or that the connection is not open
   */
  boolean sendAudioChunk(VoiceConnection connection, byte[] data);

  /** Tell the server no more audio will follow. Ignored if the connection is not open. */
  void sendEndOfSource(VoiceConnection connection);
}

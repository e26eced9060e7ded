package com.scholary.voice.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Credentials needed to open or resume a streaming connection.
 *
 * <p>Returned by session creation (all three fields) and by reconnection (URL and token only). A
 * reconnect replaces URL and token while the session id stays the same.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionDescriptor(
    @JsonProperty("streaming_url") String streamingUrl,
    @JsonProperty("token") String token,
    @JsonProperty("session_id") String sessionId) {

  /**
   * Take the fresh URL and token from a reconnect response, keeping this session's id.
   *
   * @param reconnected descriptor returned by the reconnect call
   * @return the descriptor to use from now on
   */
  public SessionDescriptor withCredentialsFrom(SessionDescriptor reconnected) {
    return new SessionDescriptor(reconnected.streamingUrl(), reconnected.token(), sessionId);
  }

  @Override
  public String toString() {
    return "SessionDescriptor[streamingUrl=" + streamingUrl + ", sessionId=" + sessionId + "]";
  }
}

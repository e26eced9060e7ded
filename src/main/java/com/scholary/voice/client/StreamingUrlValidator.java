package com.scholary.voice.client;

import com.scholary.voice.client.VoiceException.Reason;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Checks streaming URLs before any token is attached to them.
 *
 * <p>Only the secure WebSocket scheme is accepted, and the host must be the expected domain or one
 * of its subdomains. A URL handed out by a compromised or misconfigured endpoint would otherwise
 * receive the session token.
 */
public class StreamingUrlValidator {

  private static final String SECURE_WEBSOCKET_SCHEME = "wss";

  private final String expectedDomain;

  public StreamingUrlValidator(String expectedDomain) {
    if (expectedDomain == null || expectedDomain.isBlank()) {
      throw new IllegalArgumentException("Expected streaming domain must not be blank");
    }
    this.expectedDomain = expectedDomain.toLowerCase(Locale.ROOT);
  }

  /**
   * Validate and parse a streaming URL.
   *
   * @param streamingUrl the URL returned by the session endpoint
   * @return the parsed URI
   * @throws VoiceException with {@link Reason#INVALID_STREAMING_URL} if the URL is rejected
   */
  public URI validate(String streamingUrl) {
    if (streamingUrl == null || streamingUrl.isBlank()) {
      throw new VoiceException(Reason.INVALID_STREAMING_URL, "Invalid streaming URL: empty URL");
    }

    URI uri;
    try {
      uri = new URI(streamingUrl);
    } catch (URISyntaxException e) {
      throw new VoiceException(
          Reason.INVALID_STREAMING_URL, "Invalid streaming URL: unable to parse URL", e);
    }

    String scheme = uri.getScheme();
    if (scheme == null || !SECURE_WEBSOCKET_SCHEME.equals(scheme.toLowerCase(Locale.ROOT))) {
      throw new VoiceException(
          Reason.INVALID_STREAMING_URL, "Invalid streaming URL: scheme must be wss://");
    }

    String host = uri.getHost();
    if (host == null || !isExpectedHost(host.toLowerCase(Locale.ROOT))) {
      throw new VoiceException(
          Reason.INVALID_STREAMING_URL,
          "Invalid streaming URL: hostname must be under " + expectedDomain);
    }

    return uri;
  }

  private boolean isExpectedHost(String host) {
    return host.equals(expectedDomain) || host.endsWith("." + expectedDomain);
  }
}

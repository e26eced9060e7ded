package com.scholary.voice.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.voice.client.VoiceException.Reason;
import com.scholary.voice.config.VoiceProperties;
import com.scholary.voice.protocol.SessionDescriptor;
import com.scholary.voice.protocol.SessionRequest;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Client for the real-time voice translation API.
 *
 * <p>REST calls go through the Java 11+ HttpClient with retry on rate limiting, server errors and
 * I/O failures. Client errors (4xx) are never retried. The streaming connection uses the same
 * HttpClient's WebSocket support.
 *
 * <p>Outbound frames:
 *
 * <pre>
 * {"source_media_chunk": {"data": "&lt;base64&gt;"}}
 * {"end_of_source_media": {}}
 * </pre>
 */
@Component
public class VoiceClient implements VoiceTransport {

  private static final Logger LOGGER = LoggerFactory.getLogger(VoiceClient.class);

  static final String SESSION_PATH = "/v3/voice/realtime";

  private static final long RETRY_INITIAL_DELAY_MS = 1000;
  private static final long RETRY_MAX_DELAY_MS = 10000;
  private static final long RETRY_AFTER_MAX_SECONDS = 60;

  private final HttpClient httpClient;
  private final VoiceProperties properties;
  private final ObjectMapper objectMapper;
  private final ServerMessageParser parser;
  private final StreamingUrlValidator urlValidator;

  @Autowired
  public VoiceClient(VoiceProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build(),
        properties,
        objectMapper);
  }

  VoiceClient(HttpClient httpClient, VoiceProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.parser = new ServerMessageParser(objectMapper);
    this.urlValidator = new StreamingUrlValidator(properties.streamingDomain());

    LOGGER.info(
        "Initialized voice client: baseUrl={}, streamingDomain={}",
        properties.baseUrl(),
        properties.streamingDomain());
  }

  @Override
  public SessionDescriptor createSession(SessionRequest request) {
    LOGGER.info(
        "Creating voice session: targets={}, source={}, contentType={}",
        request.targetLanguages(),
        request.sourceLanguage() == null ? "auto" : request.sourceLanguage(),
        request.sourceMediaContentType());

    String body;
    try {
      body = objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new VoiceException(Reason.INVALID_REQUEST, "Unable to serialize session request", e);
    }

    HttpRequest httpRequest =
        newRequest(URI.create(properties.baseUrl() + SESSION_PATH))
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(body))
            .build();

    SessionDescriptor descriptor = readDescriptor(execute(httpRequest));
    LOGGER.info("Voice session created: sessionId={}", descriptor.sessionId());
    return descriptor;
  }

  @Override
  public SessionDescriptor reconnectSession(String token) {
    LOGGER.info("Requesting fresh streaming credentials");

    HttpRequest httpRequest =
        newRequest(
                URI.create(
                    properties.baseUrl()
                        + SESSION_PATH
                        + "?token="
                        + URLEncoder.encode(token, StandardCharsets.UTF_8)))
            .GET()
            .build();

    return readDescriptor(execute(httpRequest));
  }

  @Override
  public VoiceConnection openConnection(
      String streamingUrl, String token, ConnectionListener listener) {
    URI validated = urlValidator.validate(streamingUrl);
    URI withToken = appendToken(validated, token);

    LOGGER.info("Opening streaming connection: host={}, path={}", validated.getHost(), validated.getPath());

    WebSocketVoiceConnection connection =
        new WebSocketVoiceConnection(listener, parser, properties.highWaterMarkBytes());
    CompletableFuture<WebSocket> handshake =
        httpClient
            .newWebSocketBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .buildAsync(withToken, connection);
    connection.attach(handshake);
    return connection;
  }

  @Override
  public boolean sendAudioChunk(VoiceConnection connection, byte[] data) {
    if (!connection.isOpen()) {
      return false;
    }
    ObjectNode frame = objectMapper.createObjectNode();
    frame.putObject("source_media_chunk").put("data", Base64.getEncoder().encodeToString(data));
    connection.send(frame.toString());
    return !connection.isCongested();
  }

  @Override
  public void sendEndOfSource(VoiceConnection connection) {
    if (!connection.isOpen()) {
      LOGGER.debug("Not sending end of source, connection is not open");
      return;
    }
    ObjectNode frame = objectMapper.createObjectNode();
    frame.putObject("end_of_source_media");
    connection.send(frame.toString());
    LOGGER.debug("Sent end of source media");
  }

  private HttpRequest.Builder newRequest(URI uri) {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(uri)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Accept", "application/json");
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("Authorization", "DeepL-Auth-Key " + properties.apiKey());
    }
    return builder;
  }

  /**
   * Send a request, retrying rate limits, server errors and I/O failures with exponential backoff.
   *
   * @return the successful response
   * @throws VoiceException if the request fails for good
   */
  private HttpResponse<String> execute(HttpRequest request) {
    int attempt = 0;
    while (true) {
      try {
        HttpResponse<String> response =
            httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();

        if (status >= 200 && status < 300) {
          return response;
        }

        if ((status == 429 || status >= 500) && attempt < properties.maxRetries()) {
          long delayMs =
              status == 429 ? retryAfterOrBackoff(response, attempt) : backoff(attempt);
          LOGGER.warn(
              "Voice API returned status {}, retrying in {}ms (attempt {}/{})",
              status,
              delayMs,
              attempt + 1,
              properties.maxRetries());
          sleep(delayMs);
          attempt++;
          continue;
        }

        throw toException(status, response.body());

      } catch (IOException e) {
        if (attempt >= properties.maxRetries()) {
          throw new VoiceException(
              Reason.NETWORK_ERROR, "Network error: " + e.getMessage(), e);
        }
        long delayMs = backoff(attempt);
        LOGGER.warn(
            "Voice API request failed, retrying in {}ms (attempt {}/{}): {}",
            delayMs,
            attempt + 1,
            properties.maxRetries(),
            e.getMessage());
        sleep(delayMs);
        attempt++;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new VoiceException(Reason.INTERRUPTED, "Voice API request interrupted", e);
      }
    }
  }

  private VoiceException toException(int status, String body) {
    String message = extractMessage(body);
    switch (status) {
      case 400:
        return new VoiceException(
            Reason.INVALID_REQUEST,
            "Voice session creation failed: " + (message == null ? "Bad request" : message));
      case 403:
        return new VoiceException(
            Reason.ACCESS_DENIED,
            "Voice API access denied. Your plan may not include Voice API access.",
            "The Voice API requires a Pro or Enterprise plan.",
            null);
      case 429:
        return new VoiceException(
            Reason.RATE_LIMITED, "Rate limit exceeded: Too many requests");
      case 456:
        return new VoiceException(
            Reason.QUOTA_EXCEEDED, "Quota exceeded: Character limit reached");
      default:
        if (status >= 500) {
          return new VoiceException(
              Reason.API_ERROR,
              String.format("Server error (%d): %s", status, message == null ? "" : message));
        }
        return new VoiceException(
            Reason.API_ERROR,
            String.format("Voice API returned status %d: %s", status, message == null ? "" : message));
    }
  }

  private String extractMessage(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      JsonNode node = objectMapper.readTree(body);
      if (node != null && node.hasNonNull("message")) {
        return node.get("message").asText();
      }
    } catch (JsonProcessingException e) {
      LOGGER.debug("Error body is not JSON: {}", e.getOriginalMessage());
    }
    return body;
  }

  private SessionDescriptor readDescriptor(HttpResponse<String> response) {
    SessionDescriptor descriptor;
    try {
      descriptor = objectMapper.readValue(response.body(), SessionDescriptor.class);
    } catch (JsonProcessingException e) {
      throw new VoiceException(Reason.API_ERROR, "Unable to parse voice session response", e);
    }
    if (descriptor.streamingUrl() == null || descriptor.token() == null) {
      throw new VoiceException(
          Reason.API_ERROR, "Voice session response is missing streaming_url or token");
    }
    return descriptor;
  }

  private static URI appendToken(URI uri, String token) {
    String encoded = URLEncoder.encode(token, StandardCharsets.UTF_8);
    String base = uri.toString();
    String separator = uri.getRawQuery() == null ? "?" : "&";
    return URI.create(base + separator + "token=" + encoded);
  }

  private long retryAfterOrBackoff(HttpResponse<String> response, int attempt) {
    return response
        .headers()
        .firstValue("Retry-After")
        .map(VoiceClient::parseRetryAfterSeconds)
        .filter(seconds -> seconds >= 0 && seconds <= RETRY_AFTER_MAX_SECONDS)
        .map(seconds -> seconds * 1000)
        .orElseGet(() -> backoff(attempt));
  }

  private static long parseRetryAfterSeconds(String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  private static long backoff(int attempt) {
    return Math.min(RETRY_INITIAL_DELAY_MS * (1L << attempt), RETRY_MAX_DELAY_MS);
  }

  private static void sleep(long delayMs) {
    try {
      Thread.sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new VoiceException(Reason.INTERRUPTED, "Voice API retry interrupted", e);
    }
  }
}

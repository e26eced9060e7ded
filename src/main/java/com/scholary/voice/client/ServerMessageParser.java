package com.scholary.voice.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.voice.protocol.EndOfSourceTranscript;
import com.scholary.voice.protocol.EndOfStream;
import com.scholary.voice.protocol.EndOfTargetTranscript;
import com.scholary.voice.protocol.ServerEvent;
import com.scholary.voice.protocol.SourceTranscriptUpdate;
import com.scholary.voice.protocol.StreamError;
import com.scholary.voice.protocol.TargetTranscriptUpdate;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns inbound text frames into typed server events.
 *
 * <p>Frames are JSON objects discriminated by their top-level key. When a frame carries more than
 * one known key, the first one in this order wins:
 *
 * <ol>
 *   <li>{@code source_transcript_update}
 *   <li>{@code target_transcript_update}
 *   <li>{@code end_of_source_transcript}
 *   <li>{@code end_of_target_transcript}
 *   <li>{@code end_of_stream}
 *   <li>{@code error}
 * </ol>
 *
 * <p>Anything that is not JSON, not an object, or has none of these keys yields an empty result.
 * Unknown messages must never break a running session.
 */
public class ServerMessageParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(ServerMessageParser.class);

  static final String SOURCE_TRANSCRIPT_UPDATE = "source_transcript_update";
  static final String TARGET_TRANSCRIPT_UPDATE = "target_transcript_update";
  static final String END_OF_SOURCE_TRANSCRIPT = "end_of_source_transcript";
  static final String END_OF_TARGET_TRANSCRIPT = "end_of_target_transcript";
  static final String END_OF_STREAM = "end_of_stream";
  static final String ERROR = "error";

  private final ObjectMapper objectMapper;

  public ServerMessageParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parse one text frame.
   *
   * @param frame raw frame text
   * @return the event, or empty if the frame is malformed or of an unknown kind
   */
  public Optional<ServerEvent> parse(String frame) {
    if (frame == null) {
      return Optional.empty();
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(frame);
    } catch (JsonProcessingException e) {
      LOGGER.debug(
          "Discarding unparseable frame ({} chars): {}", frame.length(), e.getOriginalMessage());
      return Optional.empty();
    }

    if (root == null || !root.isObject()) {
      LOGGER.debug("Discarding non-object frame");
      return Optional.empty();
    }

    try {
      if (root.has(SOURCE_TRANSCRIPT_UPDATE)) {
        return Optional.ofNullable(
            objectMapper.treeToValue(root.get(SOURCE_TRANSCRIPT_UPDATE), SourceTranscriptUpdate.class));
      }
      if (root.has(TARGET_TRANSCRIPT_UPDATE)) {
        return Optional.ofNullable(
            objectMapper.treeToValue(root.get(TARGET_TRANSCRIPT_UPDATE), TargetTranscriptUpdate.class));
      }
      if (root.has(END_OF_SOURCE_TRANSCRIPT)) {
        return Optional.of(new EndOfSourceTranscript());
      }
      if (root.has(END_OF_TARGET_TRANSCRIPT)) {
        return Optional.ofNullable(
            objectMapper.treeToValue(root.get(END_OF_TARGET_TRANSCRIPT), EndOfTargetTranscript.class));
      }
      if (root.has(END_OF_STREAM)) {
        return Optional.of(new EndOfStream());
      }
      if (root.has(ERROR)) {
        return Optional.ofNullable(objectMapper.treeToValue(root.get(ERROR), StreamError.class));
      }
    } catch (JsonProcessingException | IllegalArgumentException e) {
      LOGGER.debug("Discarding frame with malformed payload: {}", e.getMessage());
      return Optional.empty();
    }

    LOGGER.debug("Ignoring frame without a known message key");
    return Optional.empty();
  }
}

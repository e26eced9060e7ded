package com.scholary.voice.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class SessionRequestTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void serialize_shouldUseWireNamesAndOmitNulls() throws Exception {
    SessionRequest request =
        new SessionRequest(null, null, List.of("de", "fr"), "audio/flac", "more", null);

    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(request));

    assertThat(json.path("target_languages").toString()).isEqualTo("[\"de\",\"fr\"]");
    assertThat(json.path("source_media_content_type").asText()).isEqualTo("audio/flac");
    assertThat(json.path("formality").asText()).isEqualTo("more");
    assertThat(json.has("source_language")).isFalse();
    assertThat(json.has("glossary_id")).isFalse();
  }

  @Test
  void constructor_shouldRequireTargetsAndContentType() {
    assertThatThrownBy(() -> new SessionRequest(null, null, List.of(), "audio/flac", null, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SessionRequest(null, null, List.of("de"), " ", null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void descriptor_shouldKeepSessionIdWhenCredentialsAreRefreshed() throws Exception {
    SessionDescriptor created =
        objectMapper.readValue(
            "{\"streaming_url\":\"wss://a.deepl.com/1\",\"token\":\"t1\",\"session_id\":\"s\"}",
            SessionDescriptor.class);
    SessionDescriptor reconnected = new SessionDescriptor("wss://b.deepl.com/2", "t2", null);

    SessionDescriptor merged = created.withCredentialsFrom(reconnected);

    assertThat(merged.streamingUrl()).isEqualTo("wss://b.deepl.com/2");
    assertThat(merged.token()).isEqualTo("t2");
    assertThat(merged.sessionId()).isEqualTo("s");
    assertThat(merged.toString()).doesNotContain("t2");
  }
}

package com.scholary.voice.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.voice.client.VoiceException.Reason;
import java.net.URI;
import org.junit.jupiter.api.Test;

class StreamingUrlValidatorTest {

  private final StreamingUrlValidator validator = new StreamingUrlValidator("deepl.com");

  @Test
  void validate_shouldAcceptSubdomainOverWss() {
    URI uri = validator.validate("wss://api.deepl.com/v3/voice/realtime/connect");

    assertThat(uri.getHost()).isEqualTo("api.deepl.com");
    assertThat(uri.getPath()).isEqualTo("/v3/voice/realtime/connect");
  }

  @Test
  void validate_shouldAcceptBareDomainIgnoringCase() {
    assertThat(validator.validate("WSS://DeepL.com/stream").getHost()).isEqualTo("DeepL.com");
  }

  @Test
  void validate_shouldRejectEmptyUrl() {
    assertThatThrownBy(() -> validator.validate(" "))
        .isInstanceOf(VoiceException.class)
        .hasMessage("Invalid streaming URL: empty URL");
  }

  @Test
  void validate_shouldRejectPlainWebSocket() {
    assertThatThrownBy(() -> validator.validate("ws://api.deepl.com/stream"))
        .isInstanceOf(VoiceException.class)
        .hasMessageContaining("scheme must be wss://")
        .extracting(e -> ((VoiceException) e).getReason())
        .isEqualTo(Reason.INVALID_STREAMING_URL);
  }

  @Test
  void validate_shouldRejectHttps() {
    assertThatThrownBy(() -> validator.validate("https://api.deepl.com/stream"))
        .hasMessageContaining("scheme must be wss://");
  }

  @Test
  void validate_shouldRejectForeignHost() {
    assertThatThrownBy(() -> validator.validate("wss://evil.example.com/stream"))
        .isInstanceOf(VoiceException.class)
        .hasMessageContaining("hostname must be under deepl.com");
  }

  @Test
  void validate_shouldRejectLookalikeHost() {
    assertThatThrownBy(() -> validator.validate("wss://notdeepl.com/stream"))
        .hasMessageContaining("hostname must be under deepl.com");
    assertThatThrownBy(() -> validator.validate("wss://deepl.com.evil.net/stream"))
        .hasMessageContaining("hostname must be under deepl.com");
  }

  @Test
  void validate_shouldRejectUnparseableUrl() {
    assertThatThrownBy(() -> validator.validate("wss://api.deepl.com/a b"))
        .isInstanceOf(VoiceException.class)
        .hasMessage("Invalid streaming URL: unable to parse URL");
  }

  @Test
  void constructor_shouldRejectBlankDomain() {
    assertThatThrownBy(() -> new StreamingUrlValidator(""))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

package com.scholary.voice.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class VoiceStreamOptionsTest {

  @Test
  void builder_shouldApplyDefaults() {
    VoiceStreamOptions options = VoiceStreamOptions.builder("de", "fr").build();

    assertThat(options.targetLanguages()).containsExactly("de", "fr");
    assertThat(options.chunkSize()).isEqualTo(VoiceStreamOptions.DEFAULT_CHUNK_SIZE);
    assertThat(options.chunkInterval()).isEqualTo(Duration.ofMillis(200));
    assertThat(options.reconnect()).isTrue();
    assertThat(options.maxReconnectAttempts()).isEqualTo(3);
    assertThat(options.sourceLanguageOrAuto()).isEqualTo("auto");
  }

  @Test
  void constructor_shouldRejectMissingTargets() {
    assertThatThrownBy(() -> VoiceStreamOptions.builder(List.of()).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("At least one target language is required.");
  }

  @Test
  void constructor_shouldRejectNegativeReconnectAttempts() {
    assertThatThrownBy(() -> VoiceStreamOptions.builder("de").maxReconnectAttempts(-1).build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void toBuilder_shouldCopyEveryField() {
    VoiceStreamOptions original =
        VoiceStreamOptions.builder("de")
            .sourceLanguage("en")
            .formality("more")
            .glossaryId("g-1")
            .contentType("audio/flac")
            .chunkSize(100)
            .chunkInterval(Duration.ZERO)
            .reconnect(false)
            .maxReconnectAttempts(0)
            .build();

    assertThat(original.toBuilder().build()).isEqualTo(original);
    assertThat(original.sourceLanguageOrAuto()).isEqualTo("en");
  }
}

package com.scholary.voice.config;

import com.scholary.voice.service.AudioPathResolver;
import com.scholary.voice.streaming.BackpressureController;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the voice client.
 *
 * <p>Enables VoiceProperties to be loaded from application.yml and builds the flow-control helper
 * from them.
 */
@Configuration
@EnableConfigurationProperties(VoiceProperties.class)
public class VoiceConfig {

  @Bean
  public BackpressureController backpressureController(VoiceProperties properties) {
    return new BackpressureController(
        Duration.ofMillis(properties.backpressurePauseMillis()), properties.backpressureMaxWaits());
  }

  @Bean
  public AudioPathResolver audioPathResolver(VoiceProperties properties) {
    return new AudioPathResolver(Path.of(properties.audioDir()));
  }
}

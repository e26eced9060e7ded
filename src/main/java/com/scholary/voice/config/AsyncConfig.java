package com.scholary.voice.config;

import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Two bounded pools: one runs translation jobs started through the REST API (each job blocks a
 * thread for the whole session), the other runs the audio upload loop of every active session.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(
      @Value("${voice.async.jobThreads}") int threads,
      @Value("${voice.async.jobQueueSize}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("voice-job-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "audioSenderExecutor")
  public Executor audioSenderExecutor(@Value("${voice.async.senderThreads}") int threads) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    // a queued sender would stall its session, so fail fast instead
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("voice-sender-");
    executor.initialize();
    return executor;
  }
}

package com.scholary.voice.job;

import com.scholary.voice.api.JobStatusResponse.Status;
import com.scholary.voice.api.VoiceTranslationRequest;
import com.scholary.voice.client.VoiceException;
import com.scholary.voice.logging.StructuredLogger;
import com.scholary.voice.service.VoiceTranslationService;
import com.scholary.voice.session.VoiceSession;
import com.scholary.voice.session.VoiceSessionResult;
import com.scholary.voice.session.VoiceStreamCallbacks;
import com.scholary.voice.session.VoiceStreamOptions;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Runs voice translation jobs on the async executor.
 *
 * <p>Lives in its own bean so that calls from the controller go through Spring's async proxy.
 */
@Component
public class VoiceJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(VoiceJobRunner.class);

  private final VoiceTranslationService translationService;
  private final JobRepository jobRepository;

  public VoiceJobRunner(VoiceTranslationService translationService, JobRepository jobRepository) {
    this.translationService = translationService;
    this.jobRepository = jobRepository;
  }

  /**
   * Process a job asynchronously.
   *
   * <p>The job status is updated as processing progresses. Failures end up in the job, never in
   * the caller.
   */
  @Async
  public void runAsync(VoiceJob job) {
    run(job);
  }

  void run(VoiceJob job) {
    VoiceTranslationRequest request = job.getRequest();
    StructuredLogger.setJobContext(job.getJobId(), request.path());
    LOGGER.info("Starting voice translation job: {}", job.getJobId());

    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      Path file = job.getAudioFile();
      VoiceStreamOptions options = translationService.resolveFileOptions(file, toOptions(request));
      VoiceSession session = translationService.openSession(options, VoiceStreamCallbacks.NONE);
      job.setSession(session);
      if (job.isCancelRequested()) {
        session.cancel();
      }

      VoiceSessionResult result = translationService.streamFile(session, file, options.chunkSize());

      job.setResult(result);
      job.setStatus(Status.COMPLETED);
      jobRepository.save(job);
      LOGGER.info("Completed voice translation job: {}", job.getJobId());

    } catch (Exception e) {
      LOGGER.error("Voice translation job failed: {}", job.getJobId(), e);
      job.setError(e.getMessage());
      if (e instanceof VoiceException) {
        job.setSuggestion(((VoiceException) e).getSuggestion());
      }
      job.setStatus(Status.FAILED);
      jobRepository.save(job);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private VoiceStreamOptions toOptions(VoiceTranslationRequest request) {
    VoiceStreamOptions.Builder builder =
        translationService
            .defaultOptions(request.targetLanguages())
            .sourceLanguage(request.sourceLanguage())
            .contentType(request.contentType())
            .formality(request.formality())
            .glossaryId(request.glossaryId());
    if (request.reconnect() != null) {
      builder.reconnect(request.reconnect());
    }
    if (request.maxReconnectAttempts() != null) {
      builder.maxReconnectAttempts(request.maxReconnectAttempts());
    }
    return builder.build();
  }
}

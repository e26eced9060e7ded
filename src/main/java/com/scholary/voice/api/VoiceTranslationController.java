package com.scholary.voice.api;

import com.scholary.voice.api.JobStatusResponse.Status;
import com.scholary.voice.job.JobRepository;
import com.scholary.voice.job.VoiceJob;
import com.scholary.voice.job.VoiceJobRunner;
import com.scholary.voice.service.AudioPathResolver;
import com.scholary.voice.session.SessionState;
import com.scholary.voice.session.VoiceSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for real-time voice translation of audio files.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a translation job (returns job ID immediately)
 *   <li>Job status polling
 *   <li>Cancelling a running session
 * </ul>
 */
@RestController
@RequestMapping("/api/voice")
@Tag(name = "Voice translation", description = "Real-time speech translation API")
public class VoiceTranslationController {

  private static final Logger LOGGER = LoggerFactory.getLogger(VoiceTranslationController.class);

  private final JobRepository jobRepository;
  private final VoiceJobRunner jobRunner;
  private final AudioPathResolver audioPathResolver;

  public VoiceTranslationController(
      JobRepository jobRepository, VoiceJobRunner jobRunner, AudioPathResolver audioPathResolver) {
    this.jobRepository = jobRepository;
    this.jobRunner = jobRunner;
    this.audioPathResolver = audioPathResolver;
  }

  @PostMapping("/translate")
  @Operation(
      summary = "Start voice translation",
      description =
          "Stream an audio file from the audio directory to the voice API and return a job ID for"
              + " status polling")
  public ResponseEntity<AsyncJobResponse> translate(
      @Valid @RequestBody VoiceTranslationRequest request) {
    Optional<Path> audioFile = audioPathResolver.resolve(request.path());
    if (audioFile.isEmpty()) {
      LOGGER.warn(
          "Rejected audio path outside {}: {}", audioPathResolver.getBaseDir(), request.path());
      return ResponseEntity.badRequest().build();
    }

    String jobId = UUID.randomUUID().toString();
    LOGGER.info(
        "Voice translation request: path={}, targets={}", request.path(), request.targetLanguages());

    VoiceJob job = new VoiceJob(jobId, request, audioFile.get());
    jobRepository.save(job);
    jobRunner.runAsync(job);

    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
  }

  @GetMapping("/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a voice translation job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(toStatus(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  @PostMapping("/jobs/{id}/cancel")
  @Operation(
      summary = "Cancel job",
      description = "Ask the voice API to finish early; the job completes with what was translated")
  public ResponseEntity<JobStatusResponse> cancel(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job -> {
              if (job.getStatus().isFinished()) {
                return ResponseEntity.status(HttpStatus.CONFLICT).body(toStatus(job));
              }
              LOGGER.info("Cancelling voice translation job: {}", id);
              job.requestCancel();
              return ResponseEntity.accepted().body(toStatus(job));
            })
        .orElse(ResponseEntity.notFound().build());
  }

  private static JobStatusResponse toStatus(VoiceJob job) {
    VoiceSession session = job.getSession();
    SessionState state = session == null ? null : session.getState();
    int reconnects = session == null ? 0 : session.getReconnectAttempts();
    Status status = job.getStatus();
    return new JobStatusResponse(
        job.getJobId(),
        status,
        state,
        reconnects,
        job.getResult(),
        job.getError(),
        job.getSuggestion());
  }
}

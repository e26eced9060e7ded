package com.scholary.voice.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.voice.api.JobStatusResponse.Status;
import com.scholary.voice.api.VoiceTranslationRequest;
import com.scholary.voice.client.VoiceException;
import com.scholary.voice.client.VoiceException.Reason;
import com.scholary.voice.service.VoiceTranslationService;
import com.scholary.voice.session.VoiceSession;
import com.scholary.voice.session.VoiceSessionResult;
import com.scholary.voice.session.VoiceStreamOptions;
import com.scholary.voice.session.VoiceTranscript;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VoiceJobRunnerTest {

  @Mock private VoiceTranslationService translationService;

  private static final Path AUDIO_FILE = Path.of("/srv/audio/talk.flac");

  private final JobRepository jobRepository = new JobRepository(10, 5);

  private VoiceJobRunner runner;

  @BeforeEach
  void setUp() {
    runner = new VoiceJobRunner(translationService, jobRepository);
    when(translationService.defaultOptions(any()))
        .thenAnswer(invocation -> VoiceStreamOptions.builder(invocation.<List<String>>getArgument(0)));
  }

  @Test
  void run_shouldCompleteJobWithSessionResult() throws Exception {
    VoiceJob job = new VoiceJob("job-1", request(null, 1), AUDIO_FILE);
    VoiceSession session = mock(VoiceSession.class);
    VoiceSessionResult result =
        new VoiceSessionResult(
            "sess-1",
            new VoiceTranscript("en", "Hello", List.of()),
            List.of(new VoiceTranscript("de", "Hallo", List.of())));
    when(translationService.resolveFileOptions(eq(AUDIO_FILE), any()))
        .thenAnswer(invocation -> invocation.<VoiceStreamOptions>getArgument(1));
    when(translationService.openSession(any(), any())).thenReturn(session);
    when(translationService.streamFile(eq(session), eq(AUDIO_FILE), anyInt()))
        .thenReturn(result);

    runner.run(job);

    assertThat(job.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(job.getResult()).isSameAs(result);
    assertThat(job.getSession()).isSameAs(session);
    assertThat(jobRepository.findById("job-1")).containsSame(job);
    verify(session, never()).cancel();

    ArgumentCaptor<VoiceStreamOptions> captor = ArgumentCaptor.forClass(VoiceStreamOptions.class);
    verify(translationService).resolveFileOptions(any(), captor.capture());
    assertThat(captor.getValue().targetLanguages()).containsExactly("de");
    assertThat(captor.getValue().maxReconnectAttempts()).isEqualTo(1);
    assertThat(captor.getValue().sourceLanguage()).isEqualTo("en");
  }

  @Test
  void run_shouldRecordFailure() throws Exception {
    VoiceJob job = new VoiceJob("job-2", request(null, null), AUDIO_FILE);
    when(translationService.resolveFileOptions(any(), any()))
        .thenThrow(new NoSuchFileException("/srv/audio/talk.flac"));

    runner.run(job);

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError()).isEqualTo("/srv/audio/talk.flac");
    assertThat(job.getSuggestion()).isNull();
    assertThat(job.getResult()).isNull();
  }

  @Test
  void run_shouldKeepSuggestionFromVoiceApiFailure() throws Exception {
    VoiceJob job = new VoiceJob("job-4", request(null, null), AUDIO_FILE);
    when(translationService.resolveFileOptions(any(), any()))
        .thenAnswer(invocation -> invocation.<VoiceStreamOptions>getArgument(1));
    when(translationService.openSession(any(), any()))
        .thenThrow(
            new VoiceException(
                Reason.ACCESS_DENIED,
                "Voice API access denied",
                "The Voice API requires a Pro or Enterprise plan.",
                null));

    runner.run(job);

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError()).isEqualTo("Voice API access denied");
    assertThat(job.getSuggestion()).isEqualTo("The Voice API requires a Pro or Enterprise plan.");
    assertThat(jobRepository.findById("job-4")).containsSame(job);
  }

  @Test
  void run_shouldCancelSessionWhenCancelArrivedEarly() throws Exception {
    VoiceJob job = new VoiceJob("job-3", request(false, null), AUDIO_FILE);
    job.requestCancel();
    VoiceSession session = mock(VoiceSession.class);
    when(translationService.resolveFileOptions(any(), any()))
        .thenAnswer(invocation -> invocation.<VoiceStreamOptions>getArgument(1));
    when(translationService.openSession(any(), any())).thenReturn(session);
    when(translationService.streamFile(eq(session), any(), anyInt()))
        .thenReturn(new VoiceSessionResult("sess-1", new VoiceTranscript("en", "", List.of()), List.of()));

    runner.run(job);

    verify(session).cancel();
    assertThat(job.getStatus()).isEqualTo(Status.COMPLETED);
  }

  private static VoiceTranslationRequest request(Boolean reconnect, Integer maxReconnectAttempts) {
    return new VoiceTranslationRequest(
        "/audio/talk.flac", List.of("de"), "en", null, null, null, reconnect, maxReconnectAttempts);
  }
}

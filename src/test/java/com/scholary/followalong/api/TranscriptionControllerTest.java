package com.scholary.followalong.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.followalong.backend.BackendPreference;
import com.scholary.followalong.backend.EngineContextManager;
import com.scholary.followalong.backend.EngineStatus;
import com.scholary.followalong.job.JobKind;
import com.scholary.followalong.job.JobOrchestrator;
import com.scholary.followalong.job.JobStatus;
import com.scholary.followalong.job.TranscriptionJob;
import com.scholary.followalong.service.RecognitionService;
import com.scholary.followalong.service.TranscriptionSummary;
import com.scholary.followalong.settings.EngineSettings;
import com.scholary.followalong.settings.SettingsService;
import com.scholary.followalong.transcript.TimedSentence;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class TranscriptionControllerTest {

  @Mock private JobOrchestrator orchestrator;
  @Mock private RecognitionService recognitionService;
  @Mock private EngineContextManager engineContextManager;
  @Mock private SettingsService settingsService;

  @InjectMocks private TranscriptionController controller;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
            .build();
  }

  private static TranscriptionJob job(String id, JobStatus status, int progress) {
    Instant now = Instant.now();
    return new TranscriptionJob(
        id, JobKind.TRANSCRIPTION, 1L, status, progress, "Transcribing", null, now, now, null);
  }

  @Test
  void start_returnsAcceptedJob() throws Exception {
    when(recognitionService.summary(1L)).thenReturn(new TranscriptionSummary(3, 0));
    when(orchestrator.startJob(JobKind.TRANSCRIPTION, 1L))
        .thenReturn(TranscriptionJob.pending("job-1", JobKind.TRANSCRIPTION, 1L));

    mockMvc
        .perform(post("/api/transcription/books/1/start"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-1"))
        .andExpect(jsonPath("$.status").value("PENDING"));
  }

  @Test
  void start_bookWithoutChapters_returns404() throws Exception {
    when(recognitionService.summary(9L)).thenReturn(new TranscriptionSummary(0, 0));

    mockMvc
        .perform(post("/api/transcription/books/9/start"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.status").value(404))
        .andExpect(jsonPath("$.path").value("/api/transcription/books/9/start"));
    verify(orchestrator, never()).startJob(any(), anyLong());
  }

  @Test
  void status_reportsLatestJobAndCoverage() throws Exception {
    when(recognitionService.summary(1L)).thenReturn(new TranscriptionSummary(4, 2));
    when(orchestrator.latestForSubject(JobKind.TRANSCRIPTION, 1L))
        .thenReturn(Optional.of(job("job-1", JobStatus.TRANSCRIBING, 50)));

    mockMvc
        .perform(get("/api/transcription/books/1/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.job.progress").value(50))
        .andExpect(jsonPath("$.chapterCount").value(4))
        .andExpect(jsonPath("$.transcribedCount").value(2))
        .andExpect(jsonPath("$.hasTranscription").value(false));
  }

  @Test
  void data_returnsGlobalSentences() throws Exception {
    when(recognitionService.summary(1L)).thenReturn(new TranscriptionSummary(1, 1));
    when(recognitionService.bookSentences(1L))
        .thenReturn(List.of(new TimedSentence("Call me Ishmael.", 1.0, 2.5, 0, 1.0, 2.5)));

    mockMvc
        .perform(get("/api/transcription/books/1/data"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sentences[0].text").value("Call me Ishmael."))
        .andExpect(jsonPath("$.sentences[0].globalEnd").value(2.5));
  }

  @Test
  void data_nothingTranscribed_returns404() throws Exception {
    when(recognitionService.summary(1L)).thenReturn(new TranscriptionSummary(1, 0));

    mockMvc.perform(get("/api/transcription/books/1/data")).andExpect(status().isNotFound());
  }

  @Test
  void cancel_withoutActiveJob_returns404() throws Exception {
    when(orchestrator.cancelActive(JobKind.TRANSCRIPTION, 1L)).thenReturn(Optional.empty());

    mockMvc
        .perform(post("/api/transcription/books/1/cancel"))
        .andExpect(status().isNotFound());
  }

  @Test
  void delete_whileJobActive_returns409() throws Exception {
    when(orchestrator.latestForSubject(JobKind.TRANSCRIPTION, 1L))
        .thenReturn(Optional.of(job("job-1", JobStatus.TRANSCRIBING, 20)));

    mockMvc.perform(delete("/api/transcription/books/1")).andExpect(status().isConflict());
    verify(recognitionService, never()).invalidate(1L);
  }

  @Test
  void delete_removesCachedTranscripts() throws Exception {
    when(orchestrator.latestForSubject(JobKind.TRANSCRIPTION, 1L))
        .thenReturn(Optional.of(job("job-1", JobStatus.COMPLETED, 100)));
    when(recognitionService.invalidate(1L)).thenReturn(3);

    mockMvc
        .perform(delete("/api/transcription/books/1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("Deleted 3 cached chapter transcripts"));
  }

  @Test
  void engine_returnsStatus() throws Exception {
    when(engineContextManager.status())
        .thenReturn(
            new EngineStatus(
                true,
                "metal",
                true,
                null,
                "auto-detected (macOS Apple Silicon)",
                "base.en",
                true,
                "/models/ggml-base.en.bin",
                "darwin-arm64"));

    mockMvc
        .perform(get("/api/transcription/engine"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.backend").value("metal"))
        .andExpect(jsonPath("$.gpu").value(true));
  }

  @Test
  void updateSettings_appliesRequest() throws Exception {
    when(settingsService.update("cpu", null, "de"))
        .thenReturn(new EngineSettings(BackendPreference.CPU, "base.en", "de"));

    mockMvc
        .perform(
            put("/api/transcription/settings")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"backend\": \"cpu\", \"language\": \"de\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.backend").value("cpu"))
        .andExpect(jsonPath("$.language").value("de"));
  }

  @Test
  void updateSettings_invalidBackend_returns400() throws Exception {
    mockMvc
        .perform(
            put("/api/transcription/settings")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"backend\": \"opencl\"}"))
        .andExpect(status().isBadRequest());
    verify(settingsService, never()).update(any(), any(), any());
  }
}

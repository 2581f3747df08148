package com.scholary.followalong.api;

import com.scholary.followalong.backend.EngineContextManager;
import com.scholary.followalong.backend.EngineStatus;
import com.scholary.followalong.common.NotFoundException;
import com.scholary.followalong.job.JobKind;
import com.scholary.followalong.job.JobOrchestrator;
import com.scholary.followalong.job.TranscriptionJob;
import com.scholary.followalong.service.RecognitionService;
import com.scholary.followalong.service.TranscriptionSummary;
import com.scholary.followalong.settings.SettingsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for book transcription.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting, polling and cancelling transcription jobs
 *   <li>Reading and deleting the cached transcript of a book
 *   <li>Inspecting the engine and changing its settings
 * </ul>
 */
@RestController
@RequestMapping("/api/transcription")
@Tag(name = "Transcription", description = "Audiobook transcription API")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  private final JobOrchestrator orchestrator;
  private final RecognitionService recognitionService;
  private final EngineContextManager engineContextManager;
  private final SettingsService settingsService;

  public TranscriptionController(
      JobOrchestrator orchestrator,
      RecognitionService recognitionService,
      EngineContextManager engineContextManager,
      SettingsService settingsService) {
    this.orchestrator = orchestrator;
    this.recognitionService = recognitionService;
    this.engineContextManager = engineContextManager;
    this.settingsService = settingsService;
  }

  @PostMapping("/books/{bookId}/start")
  @Operation(
      summary = "Start transcription",
      description = "Queue a transcription job for a book, or return the job already active")
  public ResponseEntity<JobResponse> start(@PathVariable long bookId) {
    if (recognitionService.summary(bookId).chapterCount() == 0) {
      throw new NotFoundException("Book not found or has no chapters: " + bookId);
    }
    TranscriptionJob job = orchestrator.startJob(JobKind.TRANSCRIPTION, bookId);
    LOGGER.info("Transcription requested: book={}, job={}", bookId, job.getId());
    return ResponseEntity.accepted().body(JobResponse.from(job));
  }

  @GetMapping("/books/{bookId}/status")
  @Operation(summary = "Transcription status", description = "Latest job and cached chapters")
  public ResponseEntity<TranscriptionStatusResponse> status(@PathVariable long bookId) {
    TranscriptionSummary summary = recognitionService.summary(bookId);
    JobResponse job =
        orchestrator
            .latestForSubject(JobKind.TRANSCRIPTION, bookId)
            .map(JobResponse::from)
            .orElse(null);
    return ResponseEntity.ok(
        new TranscriptionStatusResponse(
            job, summary.chapterCount(), summary.transcribedCount(), summary.hasTranscription()));
  }

  @GetMapping("/books/{bookId}/data")
  @Operation(
      summary = "Transcript data",
      description = "Cached sentences of a book with book-wide timestamps")
  public ResponseEntity<TranscriptDataResponse> data(@PathVariable long bookId) {
    if (recognitionService.summary(bookId).transcribedCount() == 0) {
      throw new NotFoundException("No transcription found for book " + bookId);
    }
    return ResponseEntity.ok(
        new TranscriptDataResponse(bookId, recognitionService.bookSentences(bookId)));
  }

  @PostMapping("/books/{bookId}/cancel")
  @Operation(summary = "Cancel transcription", description = "Cancel the active job of a book")
  public ResponseEntity<JobResponse> cancel(@PathVariable long bookId) {
    TranscriptionJob job =
        orchestrator
            .cancelActive(JobKind.TRANSCRIPTION, bookId)
            .orElseThrow(
                () -> new NotFoundException("No active transcription job for book " + bookId));
    return ResponseEntity.accepted().body(JobResponse.from(job));
  }

  @DeleteMapping("/books/{bookId}")
  @Operation(
      summary = "Delete transcript",
      description = "Remove all cached chapter transcripts of a book")
  public ResponseEntity<MessageResponse> delete(@PathVariable long bookId) {
    boolean active =
        orchestrator
            .latestForSubject(JobKind.TRANSCRIPTION, bookId)
            .map(job -> !job.getStatus().isTerminal())
            .orElse(false);
    if (active) {
      throw new IllegalStateException("A transcription job is active for book " + bookId);
    }
    int removed = recognitionService.invalidate(bookId);
    return ResponseEntity.ok(
        new MessageResponse(String.format("Deleted %d cached chapter transcripts", removed)));
  }

  @GetMapping("/engine")
  @Operation(summary = "Engine status", description = "Backend, model and engine availability")
  public ResponseEntity<EngineStatus> engine() {
    return ResponseEntity.ok(engineContextManager.status());
  }

  @GetMapping("/settings")
  @Operation(summary = "Engine settings", description = "Backend, model and language in effect")
  public ResponseEntity<SettingsResponse> settings() {
    return ResponseEntity.ok(SettingsResponse.from(settingsService.current()));
  }

  @PutMapping("/settings")
  @Operation(
      summary = "Update engine settings",
      description = "Change backend, model or language; the engine is rebuilt on next use")
  public ResponseEntity<SettingsResponse> updateSettings(
      @Valid @RequestBody SettingsUpdateRequest request) {
    return ResponseEntity.ok(
        SettingsResponse.from(
            settingsService.update(request.backend(), request.model(), request.language())));
  }
}

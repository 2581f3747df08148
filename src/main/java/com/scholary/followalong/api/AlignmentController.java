package com.scholary.followalong.api;

import com.scholary.followalong.alignment.AlignmentRepository;
import com.scholary.followalong.alignment.AlignmentResult;
import com.scholary.followalong.common.NotFoundException;
import com.scholary.followalong.job.JobKind;
import com.scholary.followalong.job.JobOrchestrator;
import com.scholary.followalong.job.TranscriptionJob;
import com.scholary.followalong.library.Document;
import com.scholary.followalong.library.DocumentCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST API for aligning uploaded documents to their audiobook. */
@RestController
@RequestMapping("/api/alignment/documents")
@Tag(name = "Alignment", description = "Document-to-audio alignment API")
public class AlignmentController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlignmentController.class);

  private final JobOrchestrator orchestrator;
  private final DocumentCatalog documentCatalog;
  private final AlignmentRepository alignmentRepository;

  public AlignmentController(
      JobOrchestrator orchestrator,
      DocumentCatalog documentCatalog,
      AlignmentRepository alignmentRepository) {
    this.orchestrator = orchestrator;
    this.documentCatalog = documentCatalog;
    this.alignmentRepository = alignmentRepository;
  }

  @PostMapping("/{documentId}/start")
  @Operation(
      summary = "Start alignment",
      description = "Queue an alignment job for a document, or return the job already active")
  public ResponseEntity<JobResponse> start(@PathVariable long documentId) {
    requireDocument(documentId);
    TranscriptionJob job = orchestrator.startJob(JobKind.ALIGNMENT, documentId);
    LOGGER.info("Alignment requested: document={}, job={}", documentId, job.getId());
    return ResponseEntity.accepted().body(JobResponse.from(job));
  }

  @GetMapping("/{documentId}/status")
  @Operation(summary = "Alignment status", description = "Latest job and stored alignment summary")
  public ResponseEntity<AlignmentStatusResponse> status(@PathVariable long documentId) {
    Document document = requireDocument(documentId);
    JobResponse job =
        orchestrator
            .latestForSubject(JobKind.ALIGNMENT, documentId)
            .map(JobResponse::from)
            .orElse(null);
    Optional<Integer> quality = alignmentRepository.qualityFor(documentId);
    return ResponseEntity.ok(
        new AlignmentStatusResponse(
            job,
            document.pageCount(),
            document.scanned(),
            quality.isPresent(),
            quality.orElse(null)));
  }

  @GetMapping("/{documentId}")
  @Operation(summary = "Get alignment", description = "The stored alignment of a document")
  public ResponseEntity<AlignmentResult> get(@PathVariable long documentId) {
    return alignmentRepository
        .findByDocument(documentId)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new NotFoundException("No alignment found for document " + documentId));
  }

  @PostMapping("/{documentId}/cancel")
  @Operation(summary = "Cancel alignment", description = "Cancel the active job of a document")
  public ResponseEntity<JobResponse> cancel(@PathVariable long documentId) {
    TranscriptionJob job =
        orchestrator
            .cancelActive(JobKind.ALIGNMENT, documentId)
            .orElseThrow(
                () -> new NotFoundException("No active alignment job for document " + documentId));
    return ResponseEntity.accepted().body(JobResponse.from(job));
  }

  private Document requireDocument(long documentId) {
    return documentCatalog
        .findById(documentId)
        .orElseThrow(() -> new NotFoundException("Document not found: " + documentId));
  }
}

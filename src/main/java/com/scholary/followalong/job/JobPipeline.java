package com.scholary.followalong.job;

import com.scholary.followalong.alignment.AlignmentEngine;
import com.scholary.followalong.alignment.AlignmentRepository;
import com.scholary.followalong.alignment.AlignmentResult;
import com.scholary.followalong.common.CancellationToken;
import com.scholary.followalong.common.NotFoundException;
import com.scholary.followalong.document.ExtractedDocument;
import com.scholary.followalong.document.TextExtractor;
import com.scholary.followalong.document.UnsupportedDocumentException;
import com.scholary.followalong.library.Document;
import com.scholary.followalong.library.DocumentCatalog;
import com.scholary.followalong.logging.StructuredLogger;
import com.scholary.followalong.service.ProgressListener;
import com.scholary.followalong.service.RecognitionService;
import com.scholary.followalong.transcript.BookTranscript;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The stage sequence of a job.
 *
 * <p>Alignment jobs run extract, transcribe and align. Transcription jobs run only transcribe.
 * Each stage transition is written to the job record before the stage starts, and the
 * cancellation token is checked between stages. The final check also commits the job, so it can no
 * longer be cancelled while its result is written. Completion is recorded by the caller.
 */
@Component
public class JobPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobPipeline.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String SCANNED_DOCUMENT_MESSAGE =
      "Document appears to be scanned or image-based; no extractable text was found";

  private final JobRepository jobRepository;
  private final RecognitionService recognitionService;
  private final TextExtractor textExtractor;
  private final AlignmentEngine alignmentEngine;
  private final AlignmentRepository alignmentRepository;
  private final DocumentCatalog documentCatalog;

  public JobPipeline(
      JobRepository jobRepository,
      RecognitionService recognitionService,
      TextExtractor textExtractor,
      AlignmentEngine alignmentEngine,
      AlignmentRepository alignmentRepository,
      DocumentCatalog documentCatalog) {
    this.jobRepository = jobRepository;
    this.recognitionService = recognitionService;
    this.textExtractor = textExtractor;
    this.alignmentEngine = alignmentEngine;
    this.alignmentRepository = alignmentRepository;
    this.documentCatalog = documentCatalog;
  }

  /**
   * Run every stage of a job.
   *
   * @return the completion message
   * @throws com.scholary.followalong.common.JobCancelledException at a stage boundary after
   *     cancellation
   */
  public String run(TranscriptionJob job, CancellationToken token) {
    if (job.getKind() == JobKind.ALIGNMENT) {
      return runAlignment(job, token);
    }
    return runTranscription(job, token);
  }

  private String runTranscription(TranscriptionJob job, CancellationToken token) {
    long bookId = job.getSubjectId();
    token.throwIfCancelled();
    stage(job, JobStatus.TRANSCRIBING, 5, "Preparing transcription");

    BookTranscript transcript =
        recognitionService.transcribeBook(bookId, scaled(job, token, 5, 90), token);
    token.beginCommit();

    return String.format(
        "Transcribed %d sentences from %d chapters",
        transcript.sentences().size(), transcript.chapters().size());
  }

  private String runAlignment(TranscriptionJob job, CancellationToken token) {
    long documentId = job.getSubjectId();
    Document document =
        documentCatalog
            .findById(documentId)
            .orElseThrow(() -> new NotFoundException("Document not found: " + documentId));

    token.throwIfCancelled();
    stage(job, JobStatus.EXTRACTING, 10, "Extracting document text");
    ExtractedDocument extracted = extract(Path.of(document.filePath()));
    documentCatalog.updatePageCount(documentId, extracted.pageCount());
    if (!extracted.hasText()) {
      documentCatalog.markScanned(documentId);
      throw new UnsupportedDocumentException(SCANNED_DOCUMENT_MESSAGE);
    }

    token.throwIfCancelled();
    stage(
        job,
        JobStatus.EXTRACTING,
        30,
        String.format(
            "Extracted %d sentences from %d pages",
            extracted.sentenceCount(), extracted.pageCount()));

    token.throwIfCancelled();
    stage(job, JobStatus.TRANSCRIBING, 40, "Preparing transcription");
    BookTranscript transcript =
        recognitionService.transcribeBook(document.bookId(), scaled(job, token, 40, 30), token);

    token.throwIfCancelled();
    stage(
        job,
        JobStatus.ALIGNING,
        75,
        String.format("Aligning %d sentences", extracted.sentenceCount()));
    AlignmentResult result = alignmentEngine.align(documentId, extracted, transcript);

    token.beginCommit();
    stage(job, JobStatus.ALIGNING, 90, "Saving alignment");
    alignmentRepository.save(result);

    return String.format("Alignment complete: %d%% quality", result.quality());
  }

  private ExtractedDocument extract(Path path) {
    try {
      return textExtractor.extract(path);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read document " + path.getFileName(), e);
    }
  }

  private void stage(TranscriptionJob job, JobStatus status, int progress, String message) {
    jobRepository.updateStage(job.getId(), status, progress, message);
    STRUCTURED_LOGGER.logStageEntered(job.getId(), status.name(), progress, message);
  }

  /** Maps transcription progress into {@code [base, base + span]} of the job's progress. */
  private ProgressListener scaled(
      TranscriptionJob job, CancellationToken token, int base, int span) {
    return (fraction, message) -> {
      if (!token.isCancelled()) {
        jobRepository.updateStage(
            job.getId(), JobStatus.TRANSCRIBING, base + (int) Math.round(fraction * span), message);
      }
    };
  }
}

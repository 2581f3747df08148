package com.scholary.followalong.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Logs pipeline events with MDC fields so they can be filtered in a log aggregator.
 *
 * <p>Event fields are set for the single log call and removed afterwards. Job context fields stay
 * in place for the whole run of a job.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log that a job moved to a new stage. */
  public void logStageEntered(String jobId, String stage, int progress, String message) {
    try {
      MDC.put("event_type", "stage_entered");
      MDC.put("stage", stage);
      MDC.put("progress", String.valueOf(progress));

      logger.info("Job {} entered {} at {}%: {}", jobId, stage, progress, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a chapter transcription, real or synthetic. */
  public void logChapterTranscribed(
      long bookId, int chapterIndex, int sentenceCount, boolean synthetic, long transcribeMs) {
    try {
      MDC.put("event_type", "chapter_transcribed");
      MDC.put("chapter_index", String.valueOf(chapterIndex));
      MDC.put("sentenceCount", String.valueOf(sentenceCount));
      MDC.put("synthetic", String.valueOf(synthetic));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));

      logger.info(
          "Chapter transcribed: book={}, chapter={}, sentences={}, synthetic={}, took={}ms",
          bookId,
          chapterIndex,
          sentenceCount,
          synthetic,
          transcribeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a chapter served from the transcript cache. */
  public void logChapterCached(long bookId, int chapterIndex, int sentenceCount) {
    try {
      MDC.put("event_type", "chapter_cached");
      MDC.put("chapter_index", String.valueOf(chapterIndex));
      MDC.put("sentenceCount", String.valueOf(sentenceCount));

      logger.info(
          "Using cached transcript: book={}, chapter={}, sentences={}",
          bookId,
          chapterIndex,
          sentenceCount);
    } finally {
      clearEventFields();
    }
  }

  /** Log the fallback to a placeholder transcript. */
  public void logSyntheticFallback(
      long bookId, int chapterIndex, String errorType, String message) {
    try {
      MDC.put("event_type", "synthetic_fallback");
      MDC.put("chapter_index", String.valueOf(chapterIndex));
      MDC.put("errorType", errorType);

      logger.warn(
          "Falling back to synthetic transcript: book={}, chapter={}, error={}, message={}",
          bookId,
          chapterIndex,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of an alignment pass. */
  public void logAlignmentFinished(
      long documentId, int matched, int interpolated, int total, int quality, String type) {
    try {
      MDC.put("event_type", "alignment_finished");
      MDC.put("matched", String.valueOf(matched));
      MDC.put("interpolated", String.valueOf(interpolated));
      MDC.put("total", String.valueOf(total));
      MDC.put("quality", String.valueOf(quality));

      logger.info(
          "Alignment finished: document={}, matched={}/{}, interpolated={}, quality={}%, type={}",
          documentId,
          matched,
          total,
          interpolated,
          quality,
          type);
    } finally {
      clearEventFields();
    }
  }

  /** Log a job reaching a terminal state. */
  public void logJobFinished(String jobId, String status, long elapsedMs, String error) {
    try {
      MDC.put("event_type", "job_finished");
      MDC.put("status", status);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      if (error == null) {
        logger.info("Job {} finished: status={}, took={}ms", jobId, status, elapsedMs);
      } else {
        logger.error(
            "Job {} finished: status={}, took={}ms, error={}", jobId, status, elapsedMs, error);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String kind, long subjectId) {
    MDC.put("jobId", jobId);
    MDC.put("jobKind", kind);
    MDC.put("subjectId", String.valueOf(subjectId));
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("jobKind");
    MDC.remove("subjectId");
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("progress");
    MDC.remove("chapter_index");
    MDC.remove("sentenceCount");
    MDC.remove("synthetic");
    MDC.remove("transcribeMs");
    MDC.remove("errorType");
    MDC.remove("matched");
    MDC.remove("interpolated");
    MDC.remove("total");
    MDC.remove("quality");
    MDC.remove("status");
    MDC.remove("elapsedMs");
  }
}

package com.scholary.followalong.job;

import java.time.Instant;

/**
 * A queued or finished pipeline run for one subject.
 *
 * <p>Instances are snapshots read from the {@code jobs} table; state changes go through {@link
 * JobRepository}.
 */
public class TranscriptionJob {

  private final String id;
  private final JobKind kind;
  private final long subjectId;
  private final JobStatus status;
  private final int progress; // 0-100
  private final String statusMessage;
  private final String errorMessage;
  private final Instant createdAt;
  private final Instant updatedAt;
  private final Instant completedAt;

  public TranscriptionJob(
      String id,
      JobKind kind,
      long subjectId,
      JobStatus status,
      int progress,
      String statusMessage,
      String errorMessage,
      Instant createdAt,
      Instant updatedAt,
      Instant completedAt) {
    this.id = id;
    this.kind = kind;
    this.subjectId = subjectId;
    this.status = status;
    this.progress = progress;
    this.statusMessage = statusMessage;
    this.errorMessage = errorMessage;
    this.createdAt = createdAt;
    this.updatedAt = updatedAt;
    this.completedAt = completedAt;
  }

  /** A new pending job. */
  public static TranscriptionJob pending(String id, JobKind kind, long subjectId) {
    Instant now = Instant.now();
    return new TranscriptionJob(
        id, kind, subjectId, JobStatus.PENDING, 0, null, null, now, now, null);
  }

  public String getId() {
    return id;
  }

  public JobKind getKind() {
    return kind;
  }

  public long getSubjectId() {
    return subjectId;
  }

  public JobStatus getStatus() {
    return status;
  }

  public int getProgress() {
    return progress;
  }

  public String getStatusMessage() {
    return statusMessage;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }
}

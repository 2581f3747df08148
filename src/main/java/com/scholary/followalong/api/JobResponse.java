package com.scholary.followalong.api;

import com.scholary.followalong.job.JobKind;
import com.scholary.followalong.job.JobStatus;
import com.scholary.followalong.job.TranscriptionJob;
import java.time.Instant;

/** Job status as returned to API callers. */
public record JobResponse(
    String jobId,
    JobKind kind,
    long subjectId,
    JobStatus status,
    int progress,
    String statusMessage,
    String error,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt) {

  public static JobResponse from(TranscriptionJob job) {
    return new JobResponse(
        job.getId(),
        job.getKind(),
        job.getSubjectId(),
        job.getStatus(),
        job.getProgress(),
        job.getStatusMessage(),
        job.getErrorMessage(),
        job.getCreatedAt(),
        job.getUpdatedAt(),
        job.getCompletedAt());
  }
}

package com.scholary.followalong.job;

/** Lifecycle of a job. Statuses only move forward, and a terminal status is final. */
public enum JobStatus {
  PENDING,
  EXTRACTING,
  TRANSCRIBING,
  ALIGNING,
  COMPLETED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }
}

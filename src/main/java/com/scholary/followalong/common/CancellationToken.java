package com.scholary.followalong.common;

/**
 * Cooperative cancellation flag handed to each stage of a job.
 *
 * <p>Stages never observe cancellation mid-unit. They call {@link #throwIfCancelled()} between
 * units of work (between pipeline stages and between chapters), so a unit that has started always
 * runs to completion.
 *
 * <p>Once a job calls {@link #beginCommit()} it will finish, and later cancel requests are refused.
 */
public final class CancellationToken {

  private boolean cancelled;
  private boolean committing;

  /** A token that is never cancelled, for callers outside the job worker. */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  /**
   * Request cancellation.
   *
   * @return false if the job has already started committing its result
   */
  public synchronized boolean cancel() {
    if (committing) {
      return false;
    }
    cancelled = true;
    return true;
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  public synchronized boolean isCommitting() {
    return committing;
  }

  public synchronized void throwIfCancelled() {
    if (cancelled) {
      throw new JobCancelledException("Cancelled by user");
    }
  }

  /**
   * Last cancellation check before a job writes its result.
   *
   * @throws JobCancelledException if cancellation was requested before this call
   */
  public synchronized void beginCommit() {
    throwIfCancelled();
    committing = true;
  }
}

package com.scholary.followalong.common;

/** Thrown at a stage boundary when the running job has been cancelled. */
public class JobCancelledException extends RuntimeException {

  public JobCancelledException(String message) {
    super(message);
  }
}

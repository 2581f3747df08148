package com.scholary.followalong.backend;

/** Thrown when a model artifact cannot be fetched from the registry. */
public class ModelDownloadException extends RuntimeException {

  public ModelDownloadException(String message) {
    super(message);
  }

  public ModelDownloadException(String message, Throwable cause) {
    super(message, cause);
  }
}

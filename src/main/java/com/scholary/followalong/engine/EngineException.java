package com.scholary.followalong.engine;

/**
 * Exception thrown when the recognition engine fails to start or to transcribe.
 *
 * <p>This could be a missing binary, a model the engine cannot load, a GPU runtime that is not
 * present, or a non-zero exit from a transcription run.
 */
public class EngineException extends RuntimeException {

  public EngineException(String message) {
    super(message);
  }

  public EngineException(String message, Throwable cause) {
    super(message, cause);
  }
}

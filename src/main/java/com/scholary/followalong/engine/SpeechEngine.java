package com.scholary.followalong.engine;

/** Entry point to a speech-recognition engine implementation. */
public interface SpeechEngine {

  /** Whether the engine is installed at all. When false callers use synthetic transcripts. */
  boolean isInstalled();

  /**
   * Load the engine for a model and backend.
   *
   * @throws EngineException if the engine cannot start on the requested backend
   */
  EngineContext initialize(EngineOptions options);
}

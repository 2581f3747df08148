package com.scholary.followalong.service;

/** Receives fractional progress (0.0 to 1.0) from long-running transcription work. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (fraction, message) -> {};

  void onProgress(double fraction, String message);
}

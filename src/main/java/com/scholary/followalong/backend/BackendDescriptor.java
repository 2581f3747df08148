package com.scholary.followalong.backend;

/**
 * The backend chosen for the engine and why.
 *
 * @param backend the selected backend
 * @param reason human-readable explanation, e.g. {@code auto-detected (CUDA available)}
 */
public record BackendDescriptor(Backend backend, String reason) {

  public boolean gpu() {
    return backend.isGpu();
  }

  public String variant() {
    return backend.variant();
  }
}

package com.scholary.followalong.backend;

import java.util.Locale;

/** Compute backends the recognition engine can run on. */
public enum Backend {
  METAL(true, null),
  CUDA(true, "cuda"),
  VULKAN(true, "vulkan"),
  CPU(false, null);

  private final boolean gpu;
  private final String variant;

  Backend(boolean gpu, String variant) {
    this.gpu = gpu;
    this.variant = variant;
  }

  public boolean isGpu() {
    return gpu;
  }

  /** Name of the separately built engine binary, or null when the default binary is used. */
  public String variant() {
    return variant;
  }

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}

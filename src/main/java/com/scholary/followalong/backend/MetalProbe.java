package com.scholary.followalong.backend;

/** Metal is built into the default binary and usable on Apple Silicon only. */
public class MetalProbe implements BackendProbe {

  @Override
  public Backend backend() {
    return Backend.METAL;
  }

  @Override
  public boolean isAvailable(Platform platform) {
    return platform.isAppleSilicon();
  }

  @Override
  public String reason(Platform platform) {
    return "macOS Apple Silicon";
  }
}

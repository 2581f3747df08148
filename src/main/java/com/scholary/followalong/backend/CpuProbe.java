package com.scholary.followalong.backend;

/** CPU is always available and is the last resort of automatic detection. */
public class CpuProbe implements BackendProbe {

  @Override
  public Backend backend() {
    return Backend.CPU;
  }

  @Override
  public boolean isAvailable(Platform platform) {
    return true;
  }

  @Override
  public String reason(Platform platform) {
    if (platform.isDarwin()) {
      return "macOS Intel - no Metal";
    }
    if (platform.isWindows() || platform.isLinux()) {
      return "no GPU variant found";
    }
    return "unknown platform";
  }
}

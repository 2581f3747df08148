package com.scholary.followalong.backend;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Probe for a GPU backend that ships as a separately built engine binary.
 *
 * <p>Available on Windows and Linux when the variant binary is configured and present on disk.
 */
public class VariantBinaryProbe implements BackendProbe {

  private final Backend backend;
  private final String binary;

  public VariantBinaryProbe(Backend backend, String binary) {
    this.backend = backend;
    this.binary = binary;
  }

  @Override
  public Backend backend() {
    return backend;
  }

  @Override
  public boolean isAvailable(Platform platform) {
    if (!platform.isWindows() && !platform.isLinux()) {
      return false;
    }
    return binary != null && !binary.isBlank() && Files.isRegularFile(Path.of(binary));
  }

  @Override
  public String reason(Platform platform) {
    return backend.id().toUpperCase(Locale.ROOT) + " available";
  }
}

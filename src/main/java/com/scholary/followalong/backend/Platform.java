package com.scholary.followalong.backend;

import java.util.Locale;

/**
 * Operating system and CPU architecture of the host, normalized to short identifiers.
 *
 * @param os one of {@code darwin}, {@code windows}, {@code linux}, or the raw lowercased name
 * @param arch {@code arm64}, {@code x64}, or the raw lowercased architecture
 */
public record Platform(String os, String arch) {

  public static Platform current() {
    return of(System.getProperty("os.name", ""), System.getProperty("os.arch", ""));
  }

  /** Normalize JVM-reported os.name and os.arch values. */
  public static Platform of(String osName, String osArch) {
    String os = osName.toLowerCase(Locale.ROOT);
    if (os.contains("mac") || os.contains("darwin")) {
      os = "darwin";
    } else if (os.contains("win")) {
      os = "windows";
    } else if (os.contains("linux")) {
      os = "linux";
    }
    String arch = osArch.toLowerCase(Locale.ROOT);
    if (arch.equals("aarch64") || arch.equals("arm64")) {
      arch = "arm64";
    } else if (arch.equals("amd64") || arch.equals("x86_64") || arch.equals("x64")) {
      arch = "x64";
    }
    return new Platform(os, arch);
  }

  public boolean isDarwin() {
    return "darwin".equals(os);
  }

  public boolean isWindows() {
    return "windows".equals(os);
  }

  public boolean isLinux() {
    return "linux".equals(os);
  }

  public boolean isAppleSilicon() {
    return isDarwin() && "arm64".equals(arch);
  }

  @Override
  public String toString() {
    return os + "-" + arch;
  }
}

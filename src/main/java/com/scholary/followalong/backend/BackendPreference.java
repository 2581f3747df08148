package com.scholary.followalong.backend;

import java.util.Locale;
import java.util.Optional;

/** The user's backend choice: automatic detection or one forced backend. */
public enum BackendPreference {
  AUTO,
  METAL,
  CUDA,
  VULKAN,
  CPU;

  /**
   * Parse a stored or submitted preference, case-insensitively.
   *
   * @throws IllegalArgumentException if the value names no known preference
   */
  public static BackendPreference parse(String value) {
    if (value == null || value.isBlank()) {
      return AUTO;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown backend '" + value + "'. Expected one of auto, metal, cuda, vulkan, cpu", e);
    }
  }

  /** The forced backend, or empty for {@link #AUTO}. */
  public Optional<Backend> manualBackend() {
    return this == AUTO ? Optional.empty() : Optional.of(Backend.valueOf(name()));
  }

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}

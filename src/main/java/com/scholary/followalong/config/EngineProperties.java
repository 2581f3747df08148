package com.scholary.followalong.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the speech-recognition engine.
 *
 * <p>The backend, model and language values are defaults only. A preference saved through the
 * settings API takes precedence over them.
 */
@ConfigurationProperties(prefix = "engine")
@Validated
public record EngineProperties(
    @NotBlank String binary,
    @Valid VariantBinaries variantBinaries,
    @NotBlank String ffmpegPath,
    @NotBlank String modelsPath,
    @NotBlank String registryUrl,
    @NotBlank String defaultModel,
    @NotBlank String defaultLanguage,
    @NotBlank String defaultBackend,
    @Positive int threads,
    @Positive int timeoutMinutes,
    @Positive int downloadTimeoutMinutes,
    @NotBlank String tempDir) {

  /** Engine binaries built against a specific GPU API. Blank when that build is not installed. */
  public record VariantBinaries(String cuda, String vulkan) {}
}

package com.scholary.followalong.api;

import jakarta.validation.constraints.Pattern;

/** Partial update of the engine settings; null fields are left unchanged. */
public record SettingsUpdateRequest(
    @Pattern(
            regexp = "(?i)auto|metal|cuda|vulkan|cpu",
            message = "must be one of auto, metal, cuda, vulkan, cpu")
        String backend,
    @Pattern(regexp = "[A-Za-z0-9._-]+", message = "must be a model name such as base.en")
        String model,
    @Pattern(regexp = "auto|[a-z]{2,3}", message = "must be an ISO language code or auto")
        String language) {}

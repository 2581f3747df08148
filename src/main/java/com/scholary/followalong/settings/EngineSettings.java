package com.scholary.followalong.settings;

import com.scholary.followalong.backend.BackendPreference;

/**
 * The engine settings in effect: saved user preferences layered over configured defaults.
 *
 * @param backend backend preference, {@code AUTO} for detection
 * @param model model artifact name, e.g. {@code base.en}
 * @param language ISO language code or {@code auto}
 */
public record EngineSettings(BackendPreference backend, String model, String language) {}

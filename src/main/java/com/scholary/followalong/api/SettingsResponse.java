package com.scholary.followalong.api;

import com.scholary.followalong.settings.EngineSettings;

/** Engine settings in effect. */
public record SettingsResponse(String backend, String model, String language) {

  public static SettingsResponse from(EngineSettings settings) {
    return new SettingsResponse(settings.backend().id(), settings.model(), settings.language());
  }
}

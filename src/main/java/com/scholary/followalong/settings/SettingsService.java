package com.scholary.followalong.settings;

import com.scholary.followalong.backend.BackendPreference;
import com.scholary.followalong.backend.EngineContextManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Updates engine preferences and makes the engine pick them up. */
@Service
public class SettingsService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);

  private final EngineSettingsStore store;
  private final EngineContextManager engineContextManager;

  public SettingsService(EngineSettingsStore store, EngineContextManager engineContextManager) {
    this.store = store;
    this.engineContextManager = engineContextManager;
  }

  public EngineSettings current() {
    return store.current();
  }

  /**
   * Apply a partial update. Null arguments keep the current value.
   *
   * @throws IllegalArgumentException if the backend name is unknown
   */
  public EngineSettings update(String backend, String model, String language) {
    EngineSettings current = store.current();
    EngineSettings updated =
        new EngineSettings(
            backend == null ? current.backend() : BackendPreference.parse(backend),
            model == null ? current.model() : model,
            language == null ? current.language() : language);
    if (updated.equals(current)) {
      return current;
    }
    store.save(updated);
    LOGGER.info(
        "Engine settings updated: backend={}, model={}, language={}",
        updated.backend().id(),
        updated.model(),
        updated.language());
    engineContextManager.resetBackendDetection();
    return updated;
  }
}

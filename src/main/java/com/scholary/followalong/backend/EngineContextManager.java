package com.scholary.followalong.backend;

import com.scholary.followalong.engine.EngineContext;
import com.scholary.followalong.engine.EngineException;
import com.scholary.followalong.engine.EngineOptions;
import com.scholary.followalong.engine.SpeechEngine;
import com.scholary.followalong.settings.EngineSettings;
import com.scholary.followalong.settings.EngineSettingsStore;
import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the long-lived engine handle.
 *
 * <p>The handle is built on first use and reused across jobs and chapters. It is rebuilt when the
 * model setting changes, and dropped by {@link #resetBackendDetection()}. A GPU backend that fails
 * to initialize is retried once on CPU, and CPU then stays selected until the next reset.
 */
@Component
public class EngineContextManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(EngineContextManager.class);

  private final BackendSelector backendSelector;
  private final ModelStore modelStore;
  private final SpeechEngine engine;
  private final EngineSettingsStore settings;

  private EngineContext context;
  private String contextModel;

  public EngineContextManager(
      BackendSelector backendSelector,
      ModelStore modelStore,
      SpeechEngine engine,
      EngineSettingsStore settings) {
    this.backendSelector = backendSelector;
    this.modelStore = modelStore;
    this.engine = engine;
    this.settings = settings;
  }

  public boolean isEngineAvailable() {
    return engine.isInstalled();
  }

  /**
   * Returns the shared engine handle, building it if needed.
   *
   * @throws com.scholary.followalong.backend.ModelDownloadException if the model cannot be fetched
   * @throws EngineException if the engine fails on CPU, including after a GPU fallback
   */
  public synchronized EngineContext getEngineContext() {
    String model = settings.current().model();
    if (context != null && model.equals(contextModel)) {
      return context;
    }
    if (context != null) {
      LOGGER.info("Model changed from {} to {}, rebuilding engine", contextModel, model);
      releaseContext();
    }

    Path modelPath = modelStore.ensureModel(model);
    BackendDescriptor backend = backendSelector.detect();
    try {
      context = engine.initialize(new EngineOptions(modelPath, backend));
    } catch (EngineException e) {
      if (!backend.gpu()) {
        throw e;
      }
      LOGGER.warn(
          "Engine initialization on {} failed, retrying on cpu: {}",
          backend.backend().id(),
          e.getMessage());
      BackendDescriptor cpu = backendSelector.fallbackToCpu();
      context = engine.initialize(new EngineOptions(modelPath, cpu));
      LOGGER.info("CPU fallback successful");
    }
    contextModel = model;
    return context;
  }

  /** Forgets the detected backend and releases the engine handle. */
  public synchronized void resetBackendDetection() {
    LOGGER.info("Resetting backend detection");
    backendSelector.invalidate();
    releaseContext();
  }

  public EngineStatus status() {
    EngineSettings current = settings.current();
    BackendDescriptor backend = backendSelector.detect();
    return new EngineStatus(
        engine.isInstalled(),
        backend.backend().id(),
        backend.gpu(),
        backend.variant(),
        backend.reason(),
        current.model(),
        modelStore.isDownloaded(current.model()),
        modelStore.modelPath(current.model()).toString(),
        backendSelector.platform().toString());
  }

  @PreDestroy
  public synchronized void shutdown() {
    releaseContext();
  }

  private void releaseContext() {
    if (context == null) {
      return;
    }
    try {
      context.release();
    } catch (EngineException e) {
      LOGGER.warn("Failed to release engine context: {}", e.getMessage());
    }
    context = null;
    contextModel = null;
  }
}

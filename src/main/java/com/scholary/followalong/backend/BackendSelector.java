package com.scholary.followalong.backend;

import com.scholary.followalong.settings.EngineSettingsStore;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Chooses the compute backend for the recognition engine.
 *
 * <p>The choice is memoized for the life of the process. A manual preference is taken as is.
 * Otherwise the probes are asked in order and the first available one wins. After a GPU
 * initialization failure the selection is pinned to CPU until {@link #invalidate()}.
 */
@Component
public class BackendSelector {

  private static final Logger LOGGER = LoggerFactory.getLogger(BackendSelector.class);

  static final String FALLBACK_REASON = "fallback after GPU failure";

  private final Platform platform;
  private final List<BackendProbe> probes;
  private final EngineSettingsStore settings;

  private BackendDescriptor selected;

  public BackendSelector(
      Platform platform, List<BackendProbe> probes, EngineSettingsStore settings) {
    this.platform = platform;
    this.probes = List.copyOf(probes);
    this.settings = settings;
  }

  /** Returns the memoized backend, detecting it on first use. */
  public synchronized BackendDescriptor detect() {
    if (selected == null) {
      selected = select(settings.current().backend());
      LOGGER.info(
          "Selected backend {} on {}: {}",
          selected.backend().id(),
          platform,
          selected.reason());
    }
    return selected;
  }

  /** Pins the selection to CPU after the GPU backend failed to initialize. */
  public synchronized BackendDescriptor fallbackToCpu() {
    selected = new BackendDescriptor(Backend.CPU, FALLBACK_REASON);
    LOGGER.warn("Backend pinned to cpu: {}", FALLBACK_REASON);
    return selected;
  }

  /** Forgets the memoized choice; the next {@link #detect()} runs again. */
  public synchronized void invalidate() {
    selected = null;
  }

  public Platform platform() {
    return platform;
  }

  private BackendDescriptor select(BackendPreference preference) {
    Optional<Backend> manual = preference.manualBackend();
    if (manual.isPresent()) {
      return new BackendDescriptor(manual.get(), "manual selection");
    }
    for (BackendProbe probe : probes) {
      if (probe.isAvailable(platform)) {
        return new BackendDescriptor(
            probe.backend(), "auto-detected (" + probe.reason(platform) + ")");
      }
      LOGGER.debug("Backend {} not available on {}", probe.backend().id(), platform);
    }
    return new BackendDescriptor(Backend.CPU, "auto-detected (no usable probe)");
  }
}

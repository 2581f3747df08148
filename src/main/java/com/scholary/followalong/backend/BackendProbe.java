package com.scholary.followalong.backend;

/**
 * Decides whether one backend can be used on a platform.
 *
 * <p>Probes are consulted in priority order during automatic detection. The first available probe
 * wins.
 */
public interface BackendProbe {

  Backend backend();

  boolean isAvailable(Platform platform);

  /** Explanation recorded when this probe wins automatic detection. */
  String reason(Platform platform);
}

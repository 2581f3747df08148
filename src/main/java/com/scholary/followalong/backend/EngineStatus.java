package com.scholary.followalong.backend;

/** Snapshot of the engine configuration, returned by the engine status endpoint. */
public record EngineStatus(
    boolean available,
    String backend,
    boolean gpu,
    String variant,
    String reason,
    String model,
    boolean modelDownloaded,
    String modelPath,
    String platform) {}

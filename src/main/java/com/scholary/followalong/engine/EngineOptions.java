package com.scholary.followalong.engine;

import com.scholary.followalong.backend.BackendDescriptor;
import java.nio.file.Path;

/** What an engine handle is bound to: one model file on one backend. */
public record EngineOptions(Path modelPath, BackendDescriptor backend) {}

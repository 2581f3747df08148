package com.scholary.followalong.engine.whisper;

import com.scholary.followalong.config.EngineProperties;
import com.scholary.followalong.engine.EngineContext;
import com.scholary.followalong.engine.EngineException;
import com.scholary.followalong.engine.EngineOptions;
import com.scholary.followalong.engine.ProcessResult;
import com.scholary.followalong.engine.ProcessRunner;
import com.scholary.followalong.engine.SpeechEngine;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Speech engine backed by the whisper.cpp command-line program.
 *
 * <p>Metal and CPU use the default binary. CUDA and Vulkan use binaries built for that API, which
 * are configured separately. Initialization checks that the chosen binary starts at all, which is
 * where a missing GPU runtime shows up.
 */
@Component
public class WhisperCliEngine implements SpeechEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperCliEngine.class);

  private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(30);

  private final EngineProperties properties;
  private final ProcessRunner processRunner;
  private final AudioConverter audioConverter;
  private final WhisperJsonParser parser;

  public WhisperCliEngine(
      EngineProperties properties,
      ProcessRunner processRunner,
      AudioConverter audioConverter,
      WhisperJsonParser parser) {
    this.properties = properties;
    this.processRunner = processRunner;
    this.audioConverter = audioConverter;
    this.parser = parser;
  }

  @Override
  public boolean isInstalled() {
    return Files.isRegularFile(Path.of(properties.binary()));
  }

  @Override
  public EngineContext initialize(EngineOptions options) {
    Path binary = binaryFor(options.backend().variant());
    if (!Files.isRegularFile(binary)) {
      throw new EngineException(
          String.format(
              "Engine binary for backend %s not found: %s",
              options.backend().backend().id(), binary));
    }
    if (!Files.isRegularFile(options.modelPath())) {
      throw new EngineException("Model file not found: " + options.modelPath());
    }

    ProcessResult probe = processRunner.run(List.of(binary.toString(), "--help"), PROBE_TIMEOUT);
    if (!probe.succeeded()) {
      throw new EngineException(
          String.format(
              "Engine failed to start on %s (exit %d): %s",
              options.backend().backend().id(), probe.exitCode(), probe.output().trim()));
    }

    LOGGER.info(
        "Engine ready: binary={}, model={}, backend={}",
        binary,
        options.modelPath().getFileName(),
        options.backend().backend().id());
    return new WhisperCliContext(
        binary,
        options,
        properties.threads(),
        Duration.ofMinutes(properties.timeoutMinutes()),
        Path.of(properties.tempDir()),
        processRunner,
        audioConverter,
        parser);
  }

  private Path binaryFor(String variant) {
    if (variant == null || properties.variantBinaries() == null) {
      return Path.of(properties.binary());
    }
    String path = null;
    if ("cuda".equals(variant)) {
      path = properties.variantBinaries().cuda();
    } else if ("vulkan".equals(variant)) {
      path = properties.variantBinaries().vulkan();
    }
    if (path == null || path.isBlank()) {
      throw new EngineException("No engine binary configured for variant " + variant);
    }
    return Path.of(path);
  }
}

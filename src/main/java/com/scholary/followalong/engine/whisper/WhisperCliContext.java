package com.scholary.followalong.engine.whisper;

import com.scholary.followalong.backend.BackendDescriptor;
import com.scholary.followalong.engine.EngineContext;
import com.scholary.followalong.engine.EngineException;
import com.scholary.followalong.engine.EngineOptions;
import com.scholary.followalong.engine.ProcessResult;
import com.scholary.followalong.engine.ProcessRunner;
import com.scholary.followalong.engine.TimedFragment;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** One loaded whisper-cli configuration. Each transcription is a separate process run. */
class WhisperCliContext implements EngineContext {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperCliContext.class);

  private final Path binary;
  private final EngineOptions options;
  private final int threads;
  private final Duration timeout;
  private final Path tempDir;
  private final ProcessRunner processRunner;
  private final AudioConverter audioConverter;
  private final WhisperJsonParser parser;

  private volatile boolean released;

  WhisperCliContext(
      Path binary,
      EngineOptions options,
      int threads,
      Duration timeout,
      Path tempDir,
      ProcessRunner processRunner,
      AudioConverter audioConverter,
      WhisperJsonParser parser) {
    this.binary = binary;
    this.options = options;
    this.threads = threads;
    this.timeout = timeout;
    this.tempDir = tempDir;
    this.processRunner = processRunner;
    this.audioConverter = audioConverter;
    this.parser = parser;
  }

  @Override
  public List<TimedFragment> transcribe(Path audioFile, String language) {
    if (released) {
      throw new EngineException("Engine context has been released");
    }
    Path workDir = null;
    try {
      Files.createDirectories(tempDir);
      workDir = Files.createTempDirectory(tempDir, "whisper-");
      Path wav = workDir.resolve("input.wav");
      audioConverter.toWav(audioFile, wav);

      Path outputPrefix = workDir.resolve("output");
      ProcessResult result = processRunner.run(command(wav, outputPrefix, language), timeout);
      if (!result.succeeded()) {
        throw new EngineException(
            String.format(
                "whisper-cli failed on %s (exit %d): %s",
                audioFile.getFileName(), result.exitCode(), result.output().trim()));
      }

      Path json = workDir.resolve("output.json");
      if (!Files.isRegularFile(json)) {
        throw new EngineException("whisper-cli produced no JSON output for " + audioFile);
      }
      return parser.parse(Files.readString(json, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new EngineException("Transcription I/O failure for " + audioFile, e);
    } finally {
      deleteRecursively(workDir);
    }
  }

  List<String> command(Path wav, Path outputPrefix, String language) {
    List<String> command = new ArrayList<>();
    command.add(binary.toString());
    command.add("-m");
    command.add(options.modelPath().toString());
    command.add("-f");
    command.add(wav.toString());
    command.add("-l");
    command.add(language == null || language.isBlank() ? "auto" : language);
    command.add("-t");
    command.add(String.valueOf(threads));
    command.add("-oj");
    command.add("-of");
    command.add(outputPrefix.toString());
    if (!options.backend().gpu()) {
      command.add("-ng");
    }
    return command;
  }

  @Override
  public BackendDescriptor backend() {
    return options.backend();
  }

  @Override
  public void release() {
    released = true;
  }

  private static void deleteRecursively(Path dir) {
    if (dir == null) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(WhisperCliContext::deleteQuietly);
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up {}: {}", dir, e.getMessage());
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}: {}", path, e.getMessage());
    }
  }
}

package com.scholary.followalong.engine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs external programs (ffmpeg, whisper-cli) with a timeout.
 *
 * <p>Output goes to a temporary log file rather than a pipe so a chatty process can never block on
 * a full buffer while we wait for it.
 */
@Component
public class ProcessRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);

  /**
   * Run a command to completion.
   *
   * <p>An interrupted wait kills the process and leaves the thread's interrupt flag set.
   *
   * @throws EngineException if the process cannot be started, times out, or is interrupted
   */
  public ProcessResult run(List<String> command, Duration timeout) {
    LOGGER.debug("Running command: {}", String.join(" ", command));
    Path log = null;
    Process process = null;
    try {
      log = Files.createTempFile("process-", ".log");
      ProcessBuilder pb = new ProcessBuilder(command);
      pb.redirectErrorStream(true);
      pb.redirectOutput(log.toFile());
      process = pb.start();

      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new EngineException(
            String.format("%s timed out after %s", command.get(0), timeout));
      }
      String output = Files.readString(log, StandardCharsets.UTF_8);
      return new ProcessResult(process.exitValue(), output);
    } catch (IOException e) {
      throw new EngineException("Failed to run " + command.get(0), e);
    } catch (InterruptedException e) {
      if (process != null) {
        process.destroyForcibly();
      }
      Thread.currentThread().interrupt();
      throw new EngineException(command.get(0) + " interrupted", e);
    } finally {
      if (log != null) {
        try {
          Files.deleteIfExists(log);
        } catch (IOException e) {
          LOGGER.warn("Failed to delete process log {}", log, e);
        }
      }
    }
  }
}

package com.scholary.followalong.engine.whisper;

import com.scholary.followalong.config.EngineProperties;
import com.scholary.followalong.engine.EngineException;
import com.scholary.followalong.engine.ProcessResult;
import com.scholary.followalong.engine.ProcessRunner;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.springframework.stereotype.Component;

/** Converts chapter audio to the 16 kHz mono PCM WAV that whisper.cpp reads. */
@Component
public class AudioConverter {

  private final ProcessRunner processRunner;
  private final String ffmpegPath;
  private final Duration timeout;

  public AudioConverter(ProcessRunner processRunner, EngineProperties properties) {
    this.processRunner = processRunner;
    this.ffmpegPath = properties.ffmpegPath();
    this.timeout = Duration.ofMinutes(properties.timeoutMinutes());
  }

  public void toWav(Path input, Path output) {
    List<String> command =
        List.of(
            ffmpegPath,
            "-y",
            "-hide_banner",
            "-loglevel",
            "error",
            "-i",
            input.toString(),
            "-ar",
            "16000",
            "-ac",
            "1",
            "-c:a",
            "pcm_s16le",
            output.toString());
    ProcessResult result = processRunner.run(command, timeout);
    if (!result.succeeded()) {
      throw new EngineException(
          String.format(
              "ffmpeg failed to convert %s (exit %d): %s",
              input.getFileName(), result.exitCode(), result.output().trim()));
    }
  }
}

package com.scholary.followalong.engine;

import com.scholary.followalong.backend.BackendDescriptor;
import java.nio.file.Path;
import java.util.List;

/** A loaded engine, reusable across chapters until released. */
public interface EngineContext {

  /**
   * Transcribe one audio file.
   *
   * @param audioFile the audio file, in any format ffmpeg can read
   * @param language ISO language code or {@code auto}
   * @return fragments in playback order
   * @throws EngineException if the run fails
   */
  List<TimedFragment> transcribe(Path audioFile, String language);

  BackendDescriptor backend();

  void release();
}

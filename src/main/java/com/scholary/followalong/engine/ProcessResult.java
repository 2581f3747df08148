package com.scholary.followalong.engine;

/** Exit code and combined stdout/stderr of a finished process. */
public record ProcessResult(int exitCode, String output) {

  public boolean succeeded() {
    return exitCode == 0;
  }
}

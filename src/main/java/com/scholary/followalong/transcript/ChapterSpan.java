package com.scholary.followalong.transcript;

/** Where a chapter sits on the book timeline. */
public record ChapterSpan(int chapterIndex, double offset, double duration, boolean synthetic) {

  public double end() {
    return offset + duration;
  }
}

package com.scholary.followalong.transcript;

/**
 * A transcribed sentence with chapter-relative timing in seconds.
 *
 * <p>This is the unit stored in the chapter transcript cache.
 */
public record Sentence(String text, double start, double end) {

  public Sentence {
    if (text == null) {
      throw new IllegalArgumentException("text must not be null");
    }
    if (start < 0) {
      throw new IllegalArgumentException("start must not be negative: " + start);
    }
    if (end < start) {
      throw new IllegalArgumentException(
          String.format("end (%.3f) must not precede start (%.3f)", end, start));
    }
  }
}

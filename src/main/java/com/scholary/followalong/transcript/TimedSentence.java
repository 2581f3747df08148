package com.scholary.followalong.transcript;

/**
 * A sentence placed on the book-wide timeline.
 *
 * <p>{@code globalStart} and {@code globalEnd} are the chapter-relative times plus the total
 * duration of all preceding chapters.
 */
public record TimedSentence(
    String text,
    double start,
    double end,
    int chapterIndex,
    double globalStart,
    double globalEnd) {

  public static TimedSentence of(Sentence sentence, int chapterIndex, double chapterOffset) {
    return new TimedSentence(
        sentence.text(),
        sentence.start(),
        sentence.end(),
        chapterIndex,
        sentence.start() + chapterOffset,
        sentence.end() + chapterOffset);
  }
}

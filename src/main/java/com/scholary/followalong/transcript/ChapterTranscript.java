package com.scholary.followalong.transcript;

import java.util.ArrayList;
import java.util.List;

/**
 * The sentences of one chapter, keyed by book and chapter index.
 *
 * @param duration seconds covered by the transcript
 * @param synthetic true for a placeholder generated without the recognition engine
 */
public record ChapterTranscript(
    long bookId, int chapterIndex, List<Sentence> sentences, double duration, boolean synthetic) {

  public static final double SYNTHETIC_SENTENCE_SECONDS = 3.0;
  public static final double DEFAULT_SYNTHETIC_DURATION = 300.0;

  public ChapterTranscript {
    sentences = List.copyOf(sentences);
  }

  /**
   * Placeholder transcript that spreads evenly spaced pseudo-sentences over the chapter.
   *
   * @param knownDuration the chapter duration in seconds; zero or less when unknown
   */
  public static ChapterTranscript synthetic(long bookId, int chapterIndex, double knownDuration) {
    double duration = knownDuration > 0 ? knownDuration : DEFAULT_SYNTHETIC_DURATION;
    int count = (int) Math.floor(duration / SYNTHETIC_SENTENCE_SECONDS);
    List<Sentence> sentences = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      sentences.add(
          new Sentence(
              "[Sentence " + (i + 1) + " - transcription pending]",
              i * SYNTHETIC_SENTENCE_SECONDS,
              (i + 1) * SYNTHETIC_SENTENCE_SECONDS));
    }
    return new ChapterTranscript(bookId, chapterIndex, sentences, duration, true);
  }
}

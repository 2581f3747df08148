package com.scholary.followalong.transcript;

import java.util.List;

/**
 * All sentences of a book on one continuous timeline.
 *
 * <p>The book counts as synthetic only when every chapter is. A partly synthetic book is aligned
 * against its real chapters.
 */
public record BookTranscript(
    long bookId, double totalDuration, List<TimedSentence> sentences, List<ChapterSpan> chapters) {

  public BookTranscript {
    sentences = List.copyOf(sentences);
    chapters = List.copyOf(chapters);
  }

  public boolean isSynthetic() {
    return !chapters.isEmpty() && chapters.stream().allMatch(ChapterSpan::synthetic);
  }

  public boolean isSyntheticChapter(int chapterIndex) {
    return chapters.stream()
        .anyMatch(span -> span.chapterIndex() == chapterIndex && span.synthetic());
  }

  /** Index of the chapter playing at a global time; the last chapter for times past the end. */
  public int chapterAt(double globalTime) {
    if (chapters.isEmpty()) {
      return 0;
    }
    for (ChapterSpan span : chapters) {
      if (globalTime < span.end()) {
        return span.chapterIndex();
      }
    }
    return chapters.get(chapters.size() - 1).chapterIndex();
  }
}

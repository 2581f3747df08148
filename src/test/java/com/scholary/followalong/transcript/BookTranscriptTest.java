package com.scholary.followalong.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class BookTranscriptTest {

  private static BookTranscript book(boolean firstSynthetic, boolean secondSynthetic) {
    return new BookTranscript(
        1L,
        300.0,
        List.of(),
        List.of(
            new ChapterSpan(0, 0.0, 100.0, firstSynthetic),
            new ChapterSpan(1, 100.0, 200.0, secondSynthetic)));
  }

  @Test
  void isSynthetic_onlyWhenEveryChapterIs() {
    assertThat(book(true, true).isSynthetic()).isTrue();
    assertThat(book(true, false).isSynthetic()).isFalse();
    assertThat(book(false, false).isSynthetic()).isFalse();
  }

  @Test
  void isSyntheticChapter_looksUpByIndex() {
    BookTranscript transcript = book(true, false);

    assertThat(transcript.isSyntheticChapter(0)).isTrue();
    assertThat(transcript.isSyntheticChapter(1)).isFalse();
    assertThat(transcript.isSyntheticChapter(5)).isFalse();
  }

  @Test
  void chapterAt_mapsGlobalTimeToChapter() {
    BookTranscript transcript = book(false, false);

    assertThat(transcript.chapterAt(0.0)).isZero();
    assertThat(transcript.chapterAt(99.9)).isZero();
    assertThat(transcript.chapterAt(100.0)).isEqualTo(1);
    assertThat(transcript.chapterAt(1000.0)).isEqualTo(1);
  }

  @Test
  void timedSentence_addsChapterOffset() {
    TimedSentence sentence = TimedSentence.of(new Sentence("Hi.", 1.5, 2.0), 3, 120.0);

    assertThat(sentence.chapterIndex()).isEqualTo(3);
    assertThat(sentence.globalStart()).isEqualTo(121.5);
    assertThat(sentence.globalEnd()).isEqualTo(122.0);
  }
}

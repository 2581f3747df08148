package com.scholary.followalong.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.followalong.engine.TimedFragment;
import java.util.List;
import org.junit.jupiter.api.Test;

class SentenceSegmenterTest {

  private final SentenceSegmenter segmenter = new SentenceSegmenter();

  @Test
  void segment_joinsFragmentsUntilTerminalPunctuation() {
    List<Sentence> sentences =
        segmenter.segment(
            List.of(
                new TimedFragment(" It was the best of times,", 0, 1800),
                new TimedFragment(" it was the worst of times.", 1800, 3500),
                new TimedFragment(" Reader, I married him!", 3600, 5200)));

    assertThat(sentences)
        .containsExactly(
            new Sentence("It was the best of times, it was the worst of times.", 0.0, 3.5),
            new Sentence("Reader, I married him!", 3.6, 5.2));
  }

  @Test
  void segment_skipsBlankFragments() {
    List<Sentence> sentences =
        segmenter.segment(
            List.of(
                new TimedFragment("   ", 0, 400),
                new TimedFragment(" Hello there.", 400, 1200),
                new TimedFragment("", 1200, 1300)));

    assertThat(sentences).containsExactly(new Sentence("Hello there.", 0.4, 1.2));
  }

  @Test
  void segment_flushesTrailingTextWithoutPunctuation() {
    List<Sentence> sentences =
        segmenter.segment(
            List.of(
                new TimedFragment(" Who is there?", 0, 1000),
                new TimedFragment(" and then silence", 1000, 2500)));

    assertThat(sentences).hasSize(2);
    assertThat(sentences.get(1)).isEqualTo(new Sentence("and then silence", 1.0, 2.5));
  }

  @Test
  void segment_emptyInput_returnsNoSentences() {
    assertThat(segmenter.segment(List.of())).isEmpty();
  }

  @Test
  void isSentenceEnd_acceptsClosingQuoteAfterPunctuation() {
    assertThat(SentenceSegmenter.isSentenceEnd("\"Stop.\"")).isTrue();
    assertThat(SentenceSegmenter.isSentenceEnd("(see above.)")).isTrue();
    assertThat(SentenceSegmenter.isSentenceEnd("Really?  ")).isTrue();
    assertThat(SentenceSegmenter.isSentenceEnd("Mr")).isFalse();
    assertThat(SentenceSegmenter.isSentenceEnd("one, two,")).isFalse();
  }
}

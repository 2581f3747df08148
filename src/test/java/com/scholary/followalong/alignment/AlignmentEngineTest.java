package com.scholary.followalong.alignment;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.followalong.alignment.AlignmentResult.AlignedSentence;
import com.scholary.followalong.alignment.AlignmentResult.AudioSpan;
import com.scholary.followalong.config.AlignmentProperties;
import com.scholary.followalong.document.DocumentPage;
import com.scholary.followalong.document.DocumentSentence;
import com.scholary.followalong.document.ExtractedDocument;
import com.scholary.followalong.transcript.BookTranscript;
import com.scholary.followalong.transcript.ChapterSpan;
import com.scholary.followalong.transcript.ChapterTranscript;
import com.scholary.followalong.transcript.Sentence;
import com.scholary.followalong.transcript.TimedSentence;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AlignmentEngineTest {

  private static final List<String> HEARD =
      List.of(
          "Call me Ishmael.",
          "Some years ago I went to sea.",
          "Having little money in my purse, I sailed.",
          "It is a way I have of driving off the spleen.",
          "Whenever I find myself growing grim about the mouth, I go.",
          "This is my substitute for pistol and ball.",
          "There is nothing surprising in this.",
          "Circumambulate the city of a dreamy Sabbath afternoon.",
          "Look at the crowds of water-gazers there.",
          "Posted like silent sentinels all around the town.",
          "But look! here come more crowds.",
          "Nothing will content them but the extremest limit.");

  private final AlignmentProperties properties = AlignmentProperties.defaults();
  private final TextNormalizer normalizer = new TextNormalizer();
  private final AlignmentEngine engine =
      new AlignmentEngine(
          properties, normalizer, new PositionEstimator(), new TimestampInterpolator(properties));

  /** One real chapter; sentence i is heard from 5i to 5i+4 seconds. */
  private static BookTranscript realTranscript(List<String> texts) {
    List<TimedSentence> sentences = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      sentences.add(new TimedSentence(texts.get(i), i * 5.0, i * 5.0 + 4, 0, i * 5.0, i * 5.0 + 4));
    }
    double duration = texts.size() * 5.0;
    return new BookTranscript(
        1L, duration, sentences, List.of(new ChapterSpan(0, 0, duration, false)));
  }

  private static ExtractedDocument document(List<String> texts) {
    List<DocumentSentence> sentences = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      sentences.add(new DocumentSentence(1, i, texts.get(i)));
    }
    return new ExtractedDocument(
        1,
        true,
        List.of(
            new DocumentPage(1, DocumentPage.LETTER_WIDTH, DocumentPage.LETTER_HEIGHT, sentences)));
  }

  private static List<AlignedSentence> firstPage(AlignmentResult result) {
    return result.pages().get(0).sentences();
  }

  @Test
  void align_matchesSentencesAndInterpolatesGaps() {
    List<String> printed = new ArrayList<>(HEARD.subList(0, 10));
    printed.set(3, "A paragraph the narrator skipped entirely.");
    printed.set(6, "Footnote text that was never read aloud.");

    AlignmentResult result = engine.align(42L, document(printed), realTranscript(HEARD));

    assertThat(result.subjectId()).isEqualTo(42L);
    assertThat(result.quality()).isEqualTo(80);
    assertThat(result.metadata().matchedCount()).isEqualTo(8);
    assertThat(result.metadata().interpolatedCount()).isEqualTo(2);
    assertThat(result.metadata().totalCount()).isEqualTo(10);
    assertThat(result.metadata().documentSentenceCount()).isEqualTo(10);
    assertThat(result.metadata().audioSentenceCount()).isEqualTo(12);
    assertThat(result.metadata().averageConfidence()).isEqualTo(1.0);
    assertThat(result.metadata().alignmentType()).isNull();

    List<AlignedSentence> sentences = firstPage(result);
    assertThat(sentences.get(0).id()).isEqualTo("p1s1");
    assertThat(sentences.get(0).audio()).isEqualTo(new AudioSpan(0, 0.0, 4.0, false));
    assertThat(sentences.get(3).audio()).isEqualTo(new AudioSpan(0, 14.0, 20.0, true));
    assertThat(sentences.get(3).confidence()).isEqualTo(0.5);
    assertThat(sentences.get(6).audio()).isEqualTo(new AudioSpan(0, 29.0, 35.0, true));
    assertThat(sentences.get(9).audio().globalStart()).isEqualTo(45.0);
  }

  @Test
  void align_keyMissLeavesSentenceForInterpolation() {
    List<String> printed =
        List.of(HEARD.get(0), "Years ago, some of us went to sea.", HEARD.get(2));

    List<AlignedSentence> sentences =
        firstPage(engine.align(1L, document(printed), realTranscript(HEARD)));

    assertThat(sentences.get(1).audio().interpolated()).isTrue();
  }

  @Test
  void align_closeWordingStillMatchesBelowFullConfidence() {
    List<String> printed = List.of("Call me Ishmael, friend.");

    AlignmentResult result = engine.align(1L, document(printed), realTranscript(HEARD));

    AlignedSentence sentence = firstPage(result).get(0);
    assertThat(sentence.audio()).isEqualTo(new AudioSpan(0, 0.0, 4.0, false));
    assertThat(sentence.confidence()).isBetween(0.7, 0.999);
  }

  @Test
  void align_eachTranscriptSentenceIsUsedOnce() {
    List<String> printed = List.of("Call me Ishmael.", "Call me Ishmael.");

    AlignmentResult result =
        engine.align(1L, document(printed), realTranscript(List.of("Call me Ishmael.")));

    assertThat(firstPage(result).get(0).audio()).isNotNull();
    assertThat(firstPage(result).get(1).audio()).isNull();
    assertThat(result.quality()).isEqualTo(50);
  }

  @Test
  void align_veryShortSentencesAreNotMatched() {
    AlignmentResult result =
        engine.align(1L, document(List.of("Hi.", "No.")), realTranscript(List.of("Hi.", "No.")));

    assertThat(firstPage(result)).allSatisfy(s -> assertThat(s.audio()).isNull());
    assertThat(result.quality()).isZero();
  }

  @Test
  void align_syntheticTranscript_spreadsSentencesOverDuration() {
    List<TimedSentence> placeholder = new ArrayList<>();
    for (Sentence sentence : ChapterTranscript.synthetic(1L, 0, 60.0).sentences()) {
      placeholder.add(TimedSentence.of(sentence, 0, 0));
    }
    BookTranscript transcript =
        new BookTranscript(
            1L,
            90.0,
            placeholder,
            List.of(new ChapterSpan(0, 0, 60.0, true), new ChapterSpan(1, 60.0, 30.0, true)));

    AlignmentResult result =
        engine.align(7L, document(List.of("One.", "Two words.", "Three is here.")), transcript);

    assertThat(result.quality()).isZero();
    assertThat(result.metadata().alignmentType()).isEqualTo(AlignmentResult.TIME_BASED);
    assertThat(result.metadata().matchedCount()).isZero();
    List<AlignedSentence> sentences = firstPage(result);
    assertThat(sentences.get(0).audio()).isEqualTo(new AudioSpan(0, 0.0, 30.0, false));
    assertThat(sentences.get(1).audio()).isEqualTo(new AudioSpan(0, 30.0, 60.0, false));
    assertThat(sentences.get(2).audio()).isEqualTo(new AudioSpan(1, 60.0, 90.0, false));
    assertThat(sentences).allSatisfy(s -> assertThat(s.confidence()).isEqualTo(0.3));
  }

  @Test
  void align_partlySyntheticTranscript_ignoresPlaceholderText() {
    List<TimedSentence> sentences = new ArrayList<>();
    sentences.add(new TimedSentence("[Sentence 1 - transcription pending]", 0, 3, 0, 0, 3));
    sentences.add(new TimedSentence("Call me Ishmael.", 0, 2, 1, 30, 32));
    BookTranscript transcript =
        new BookTranscript(
            1L,
            60.0,
            sentences,
            List.of(new ChapterSpan(0, 0, 30.0, true), new ChapterSpan(1, 30.0, 30.0, false)));

    AlignmentResult result =
        engine.align(
            1L,
            document(List.of("Sentence 1 - transcription pending.", "Call me Ishmael.")),
            transcript);

    assertThat(result.metadata().alignmentType()).isNull();
    assertThat(firstPage(result).get(0).audio()).isNull();
    assertThat(firstPage(result).get(1).audio()).isEqualTo(new AudioSpan(1, 30.0, 32.0, false));
  }

  @Test
  void quality_roundsAndHandlesEmptyDocument() {
    assertThat(AlignmentEngine.quality(0, 0)).isZero();
    assertThat(AlignmentEngine.quality(2, 3)).isEqualTo(67);
    assertThat(AlignmentEngine.quality(3, 3)).isEqualTo(100);
  }
}

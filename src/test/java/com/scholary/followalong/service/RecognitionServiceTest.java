package com.scholary.followalong.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.followalong.backend.EngineContextManager;
import com.scholary.followalong.cache.JdbcChapterTranscriptCache;
import com.scholary.followalong.common.CancellationToken;
import com.scholary.followalong.common.JobCancelledException;
import com.scholary.followalong.common.NotFoundException;
import com.scholary.followalong.engine.EngineContext;
import com.scholary.followalong.engine.EngineException;
import com.scholary.followalong.engine.TimedFragment;
import com.scholary.followalong.library.Chapter;
import com.scholary.followalong.library.ChapterCatalog;
import com.scholary.followalong.settings.EngineSettingsStore;
import com.scholary.followalong.testutil.TestDatabase;
import com.scholary.followalong.testutil.TestProperties;
import com.scholary.followalong.transcript.BookTranscript;
import com.scholary.followalong.transcript.ChapterTranscript;
import com.scholary.followalong.transcript.SentenceSegmenter;
import com.scholary.followalong.transcript.TimedSentence;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RecognitionServiceTest {

  private static final long BOOK_ID = 1L;

  @Mock private EngineContextManager engineContextManager;
  @Mock private EngineContext engineContext;

  @TempDir Path tempDir;

  private TestDatabase database;
  private JdbcChapterTranscriptCache cache;
  private RecognitionService service;

  @BeforeEach
  void setUp() {
    database = new TestDatabase();
    cache = new JdbcChapterTranscriptCache(database.jdbcTemplate(), new ObjectMapper(), 10);
    service =
        new RecognitionService(
            engineContextManager,
            new ChapterCatalog(database.jdbcTemplate()),
            cache,
            new EngineSettingsStore(database.jdbcTemplate(), TestProperties.engine(tempDir)),
            new SentenceSegmenter());
  }

  @AfterEach
  void tearDown() {
    database.close();
  }

  private Path addChapter(int index, double duration) throws Exception {
    Path audio = Files.writeString(tempDir.resolve("chapter" + index + ".mp3"), "audio");
    database.insertChapter(BOOK_ID, index, audio.toString(), duration);
    return audio;
  }

  @Test
  void transcribeBook_placesSentencesOnGlobalTimeline() throws Exception {
    Path first = addChapter(0, 60.0);
    Path second = addChapter(1, 45.0);
    when(engineContextManager.isEngineAvailable()).thenReturn(true);
    when(engineContextManager.getEngineContext()).thenReturn(engineContext);
    when(engineContext.transcribe(first, "en"))
        .thenReturn(List.of(new TimedFragment(" Chapter one begins.", 1000, 3000)));
    when(engineContext.transcribe(second, "en"))
        .thenReturn(List.of(new TimedFragment(" Chapter two begins.", 2000, 4000)));

    BookTranscript transcript =
        service.transcribeBook(BOOK_ID, ProgressListener.NONE, CancellationToken.none());

    assertThat(transcript.totalDuration()).isEqualTo(105.0);
    assertThat(transcript.isSynthetic()).isFalse();
    assertThat(transcript.sentences())
        .containsExactly(
            new TimedSentence("Chapter one begins.", 1.0, 3.0, 0, 1.0, 3.0),
            new TimedSentence("Chapter two begins.", 2.0, 4.0, 1, 62.0, 64.0));
    assertThat(service.summary(BOOK_ID).hasTranscription()).isTrue();
  }

  @Test
  void transcribeBook_secondRunServesCacheWithoutEngine() throws Exception {
    addChapter(0, 30.0);
    cache.put(ChapterTranscript.synthetic(BOOK_ID, 0, 30.0));

    BookTranscript transcript =
        service.transcribeBook(BOOK_ID, ProgressListener.NONE, CancellationToken.none());

    assertThat(transcript.sentences()).hasSize(10);
    verifyNoInteractions(engineContextManager);
  }

  @Test
  void transcribeBook_engineNotInstalled_producesSyntheticTranscript() throws Exception {
    addChapter(0, 12.0);
    when(engineContextManager.isEngineAvailable()).thenReturn(false);

    BookTranscript transcript =
        service.transcribeBook(BOOK_ID, ProgressListener.NONE, CancellationToken.none());

    assertThat(transcript.isSynthetic()).isTrue();
    assertThat(transcript.sentences())
        .extracting(TimedSentence::text)
        .containsExactly(
            "[Sentence 1 - transcription pending]",
            "[Sentence 2 - transcription pending]",
            "[Sentence 3 - transcription pending]",
            "[Sentence 4 - transcription pending]");
    assertThat(cache.get(BOOK_ID, 0)).hasValueSatisfying(t -> assertThat(t.synthetic()).isTrue());
    verify(engineContextManager, never()).getEngineContext();
  }

  @Test
  void transcribeChapter_engineFailureAtRuntime_fallsBackToSynthetic() throws Exception {
    Path audio = addChapter(0, 9.0);
    when(engineContextManager.isEngineAvailable()).thenReturn(true);
    when(engineContextManager.getEngineContext()).thenReturn(engineContext);
    when(engineContext.transcribe(eq(audio), any()))
        .thenThrow(new EngineException("whisper-cli failed"));

    ChapterTranscript transcript =
        service.transcribeChapter(new Chapter(BOOK_ID, 0, audio.toString(), 9.0));

    assertThat(transcript.synthetic()).isTrue();
    assertThat(transcript.sentences()).hasSize(3);
  }

  @Test
  void transcribeChapter_interruptedEngine_rethrowsWithoutDegrading() throws Exception {
    Path audio = addChapter(0, 9.0);
    when(engineContextManager.isEngineAvailable()).thenReturn(true);
    when(engineContextManager.getEngineContext()).thenReturn(engineContext);
    when(engineContext.transcribe(eq(audio), any()))
        .thenThrow(new EngineException("whisper-cli interrupted", new InterruptedException()));

    assertThatThrownBy(
            () -> service.transcribeBook(BOOK_ID, ProgressListener.NONE, CancellationToken.none()))
        .isInstanceOf(EngineException.class)
        .hasMessage("whisper-cli interrupted");

    assertThat(cache.get(BOOK_ID, 0)).isEmpty();
  }

  @Test
  void transcribeChapter_failureOnInterruptedThread_isNotCached() throws Exception {
    Path audio = addChapter(0, 9.0);
    when(engineContextManager.isEngineAvailable()).thenReturn(true);
    when(engineContextManager.getEngineContext()).thenReturn(engineContext);
    when(engineContext.transcribe(eq(audio), any()))
        .thenAnswer(
            invocation -> {
              Thread.currentThread().interrupt();
              throw new EngineException("ffmpeg exited with code 255");
            });

    assertThatThrownBy(
            () -> service.transcribeChapter(new Chapter(BOOK_ID, 0, audio.toString(), 9.0)))
        .isInstanceOf(EngineException.class);

    assertThat(Thread.interrupted()).isTrue();
    assertThat(cache.get(BOOK_ID, 0)).isEmpty();
  }

  @Test
  void transcribeChapter_engineInitFailure_propagates() throws Exception {
    Path audio = addChapter(0, 9.0);
    when(engineContextManager.isEngineAvailable()).thenReturn(true);
    when(engineContextManager.getEngineContext())
        .thenThrow(new EngineException("CPU initialization failed"));

    assertThatThrownBy(
            () -> service.transcribeChapter(new Chapter(BOOK_ID, 0, audio.toString(), 9.0)))
        .isInstanceOf(EngineException.class)
        .hasMessage("CPU initialization failed");
  }

  @Test
  void transcribeChapter_missingAudio_throws() {
    Chapter chapter = new Chapter(BOOK_ID, 0, tempDir.resolve("gone.mp3").toString(), 10.0);

    assertThatThrownBy(() -> service.transcribeChapter(chapter))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Audio file not found");
    verifyNoInteractions(engineContextManager);
  }

  @Test
  void transcribeBook_noChapters_throwsNotFound() {
    assertThatThrownBy(
            () -> service.transcribeBook(BOOK_ID, ProgressListener.NONE, CancellationToken.none()))
        .isInstanceOf(NotFoundException.class)
        .hasMessage("No chapters found for this book");
  }

  @Test
  void transcribeBook_unknownDuration_advancesByTranscriptDuration() throws Exception {
    Path first = addChapter(0, 0.0);
    Path second = addChapter(1, 0.0);
    when(engineContextManager.isEngineAvailable()).thenReturn(true);
    when(engineContextManager.getEngineContext()).thenReturn(engineContext);
    when(engineContext.transcribe(first, "en"))
        .thenReturn(List.of(new TimedFragment("Short.", 0, 8000)));
    when(engineContext.transcribe(second, "en"))
        .thenReturn(List.of(new TimedFragment("Next.", 500, 1500)));

    BookTranscript transcript =
        service.transcribeBook(BOOK_ID, ProgressListener.NONE, CancellationToken.none());

    assertThat(transcript.sentences().get(1).globalStart()).isEqualTo(8.5);
    assertThat(transcript.totalDuration()).isEqualTo(9.5);
  }

  @Test
  void transcribeBook_reportsProgressPerChapter() throws Exception {
    addChapter(0, 3.0);
    addChapter(1, 3.0);
    when(engineContextManager.isEngineAvailable()).thenReturn(false);
    List<String> messages = new ArrayList<>();
    List<Double> fractions = new ArrayList<>();

    service.transcribeBook(
        BOOK_ID,
        (fraction, message) -> {
          fractions.add(fraction);
          messages.add(message);
        },
        CancellationToken.none());

    assertThat(fractions).containsExactly(0.0, 0.5, 1.0);
    assertThat(messages)
        .containsExactly(
            "Transcribing chapter 1 of 2", "Transcribing chapter 2 of 2", "Transcription complete");
  }

  @Test
  void transcribeBook_cancelledBetweenChapters_stopsAndKeepsFinishedChapters() throws Exception {
    addChapter(0, 3.0);
    addChapter(1, 3.0);
    when(engineContextManager.isEngineAvailable()).thenReturn(false);
    CancellationToken token = new CancellationToken();

    assertThatThrownBy(
            () ->
                service.transcribeBook(
                    BOOK_ID,
                    (fraction, message) -> token.cancel(),
                    token))
        .isInstanceOf(JobCancelledException.class);

    assertThat(cache.countForBook(BOOK_ID)).isEqualTo(1);
    verify(engineContextManager, times(1)).isEngineAvailable();
  }

  @Test
  void invalidate_clearsCachedChapters() throws Exception {
    addChapter(0, 3.0);
    cache.put(ChapterTranscript.synthetic(BOOK_ID, 0, 3.0));

    assertThat(service.invalidate(BOOK_ID)).isEqualTo(1);

    assertThat(service.summary(BOOK_ID).transcribedCount()).isZero();
  }

  @Test
  void bookSentences_assemblesFromCacheOnly() throws Exception {
    addChapter(0, 10.0);
    addChapter(1, 10.0);
    cache.put(ChapterTranscript.synthetic(BOOK_ID, 1, 3.0));

    List<TimedSentence> sentences = service.bookSentences(BOOK_ID);

    assertThat(sentences).hasSize(1);
    assertThat(sentences.get(0).globalStart()).isEqualTo(10.0);
    verifyNoInteractions(engineContextManager);
  }
}

package com.scholary.followalong.service;

import com.scholary.followalong.backend.EngineContextManager;
import com.scholary.followalong.cache.ChapterTranscriptCache;
import com.scholary.followalong.common.CancellationToken;
import com.scholary.followalong.common.NotFoundException;
import com.scholary.followalong.engine.EngineContext;
import com.scholary.followalong.engine.EngineException;
import com.scholary.followalong.engine.TimedFragment;
import com.scholary.followalong.library.Chapter;
import com.scholary.followalong.library.ChapterCatalog;
import com.scholary.followalong.logging.StructuredLogger;
import com.scholary.followalong.settings.EngineSettingsStore;
import com.scholary.followalong.transcript.BookTranscript;
import com.scholary.followalong.transcript.ChapterSpan;
import com.scholary.followalong.transcript.ChapterTranscript;
import com.scholary.followalong.transcript.Sentence;
import com.scholary.followalong.transcript.SentenceSegmenter;
import com.scholary.followalong.transcript.TimedSentence;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns chapter audio into time-coded sentences.
 *
 * <p>Per chapter the flow is:
 *
 * <ol>
 *   <li>Serve the cached transcript if there is one
 *   <li>Otherwise run the engine and segment its fragments into sentences
 *   <li>If the engine is not installed or fails at runtime, generate a synthetic transcript
 *   <li>Store the new transcript in the cache
 * </ol>
 *
 * <p>Book transcripts place every sentence on one timeline by adding the running total of the
 * preceding chapters' durations.
 */
@Service
public class RecognitionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecognitionService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final EngineContextManager engineContextManager;
  private final ChapterCatalog chapterCatalog;
  private final ChapterTranscriptCache transcriptCache;
  private final EngineSettingsStore settings;
  private final SentenceSegmenter segmenter;

  public RecognitionService(
      EngineContextManager engineContextManager,
      ChapterCatalog chapterCatalog,
      ChapterTranscriptCache transcriptCache,
      EngineSettingsStore settings,
      SentenceSegmenter segmenter) {
    this.engineContextManager = engineContextManager;
    this.chapterCatalog = chapterCatalog;
    this.transcriptCache = transcriptCache;
    this.settings = settings;
    this.segmenter = segmenter;
  }

  /**
   * Transcribe one chapter with the engine, falling back to a synthetic transcript.
   *
   * <p>Errors obtaining the engine itself (model download, CPU initialization) are not recovered
   * here and fail the calling job. An interrupted transcription is rethrown, not degraded.
   *
   * @throws IllegalArgumentException if the chapter's audio file does not exist
   */
  public ChapterTranscript transcribeChapter(Chapter chapter) {
    Path audio = Path.of(chapter.filePath());
    if (!Files.isRegularFile(audio)) {
      throw new IllegalArgumentException("Audio file not found: " + audio);
    }
    long startTime = System.currentTimeMillis();

    if (!engineContextManager.isEngineAvailable()) {
      STRUCTURED_LOGGER.logSyntheticFallback(
          chapter.bookId(), chapter.orderIndex(), "EngineUnavailable", "engine not installed");
      return synthetic(chapter);
    }

    EngineContext context = engineContextManager.getEngineContext();
    try {
      List<TimedFragment> fragments = context.transcribe(audio, settings.current().language());
      List<Sentence> sentences = segmenter.segment(fragments);
      double duration = sentences.isEmpty() ? 0 : sentences.get(sentences.size() - 1).end();
      STRUCTURED_LOGGER.logChapterTranscribed(
          chapter.bookId(),
          chapter.orderIndex(),
          sentences.size(),
          false,
          System.currentTimeMillis() - startTime);
      return new ChapterTranscript(
          chapter.bookId(), chapter.orderIndex(), sentences, duration, false);
    } catch (EngineException e) {
      if (isInterruption(e)) {
        throw e;
      }
      STRUCTURED_LOGGER.logSyntheticFallback(
          chapter.bookId(), chapter.orderIndex(), e.getClass().getSimpleName(), e.getMessage());
      return synthetic(chapter);
    }
  }

  /**
   * Transcribe every chapter of a book, reusing cached chapters.
   *
   * @param listener receives progress before each chapter and once at the end
   * @param token checked before each chapter
   * @throws NotFoundException if the book has no chapters
   */
  public BookTranscript transcribeBook(
      long bookId, ProgressListener listener, CancellationToken token) {
    List<Chapter> chapters = chapterCatalog.findByBook(bookId);
    if (chapters.isEmpty()) {
      throw new NotFoundException("No chapters found for this book");
    }
    LOGGER.info("Transcribing book {}: {} chapters", bookId, chapters.size());

    List<TimedSentence> sentences = new ArrayList<>();
    List<ChapterSpan> spans = new ArrayList<>();
    double offset = 0;
    int total = chapters.size();

    for (int i = 0; i < total; i++) {
      token.throwIfCancelled();
      Chapter chapter = chapters.get(i);
      listener.onProgress(
          (double) i / total, String.format("Transcribing chapter %d of %d", i + 1, total));

      ChapterTranscript transcript = cachedOrTranscribe(chapter);
      for (Sentence sentence : transcript.sentences()) {
        sentences.add(TimedSentence.of(sentence, chapter.orderIndex(), offset));
      }
      double duration = chapterDuration(chapter, transcript);
      spans.add(new ChapterSpan(chapter.orderIndex(), offset, duration, transcript.synthetic()));
      offset += duration;
    }

    listener.onProgress(1.0, "Transcription complete");
    LOGGER.info(
        "Book {} transcribed: {} sentences, {}s total", bookId, sentences.size(), offset);
    return new BookTranscript(bookId, offset, sentences, spans);
  }

  /** Global sentences of a book assembled from the cache, without running the engine. */
  public List<TimedSentence> bookSentences(long bookId) {
    Map<Integer, ChapterTranscript> cached = new HashMap<>();
    for (ChapterTranscript transcript : transcriptCache.findByBook(bookId)) {
      cached.put(transcript.chapterIndex(), transcript);
    }
    List<TimedSentence> sentences = new ArrayList<>();
    double offset = 0;
    for (Chapter chapter : chapterCatalog.findByBook(bookId)) {
      ChapterTranscript transcript = cached.get(chapter.orderIndex());
      if (transcript != null) {
        for (Sentence sentence : transcript.sentences()) {
          sentences.add(TimedSentence.of(sentence, chapter.orderIndex(), offset));
        }
      }
      offset += chapterDuration(chapter, transcript);
    }
    return sentences;
  }

  public TranscriptionSummary summary(long bookId) {
    return new TranscriptionSummary(
        chapterCatalog.countByBook(bookId), transcriptCache.countForBook(bookId));
  }

  /** Drop all cached chapter transcripts of a book. */
  public int invalidate(long bookId) {
    return transcriptCache.evictBook(bookId);
  }

  private ChapterTranscript cachedOrTranscribe(Chapter chapter) {
    Optional<ChapterTranscript> cached =
        transcriptCache.get(chapter.bookId(), chapter.orderIndex());
    if (cached.isPresent()) {
      STRUCTURED_LOGGER.logChapterCached(
          chapter.bookId(), chapter.orderIndex(), cached.get().sentences().size());
      return cached.get();
    }
    ChapterTranscript transcript = transcribeChapter(chapter);
    if (!transcriptCache.put(transcript)) {
      // Another writer got there first; the stored transcript is authoritative.
      return transcriptCache.get(chapter.bookId(), chapter.orderIndex()).orElse(transcript);
    }
    return transcript;
  }

  private static boolean isInterruption(EngineException e) {
    return Thread.currentThread().isInterrupted() || e.getCause() instanceof InterruptedException;
  }

  private ChapterTranscript synthetic(Chapter chapter) {
    return ChapterTranscript.synthetic(
        chapter.bookId(), chapter.orderIndex(), chapter.durationSeconds());
  }

  private static double chapterDuration(Chapter chapter, ChapterTranscript transcript) {
    if (chapter.durationSeconds() > 0) {
      return chapter.durationSeconds();
    }
    return transcript == null ? 0 : transcript.duration();
  }
}

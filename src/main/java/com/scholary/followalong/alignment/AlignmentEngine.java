package com.scholary.followalong.alignment;

import com.scholary.followalong.alignment.AlignmentResult.AlignedPage;
import com.scholary.followalong.alignment.AlignmentResult.AlignedSentence;
import com.scholary.followalong.alignment.AlignmentResult.AudioSpan;
import com.scholary.followalong.alignment.AlignmentResult.Metadata;
import com.scholary.followalong.config.AlignmentProperties;
import com.scholary.followalong.document.DocumentPage;
import com.scholary.followalong.document.DocumentSentence;
import com.scholary.followalong.document.ExtractedDocument;
import com.scholary.followalong.logging.StructuredLogger;
import com.scholary.followalong.transcript.BookTranscript;
import com.scholary.followalong.transcript.TimedSentence;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Aligns document sentences to transcript sentences.
 *
 * <p>Real transcripts are matched sentence by sentence:
 *
 * <ul>
 *   <li>Candidates share the first three normalized words with the document sentence
 *   <li>The most similar unused candidate at or above the threshold is taken, and then used up
 *   <li>Gaps between matches on a page are interpolated
 * </ul>
 *
 * <p>A synthetic transcript holds no real text, so document sentences are instead spread evenly
 * across the book's duration at a fixed low confidence.
 */
@Component
public class AlignmentEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlignmentEngine.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final int MIN_NORMALIZED_LENGTH = 3;

  private final AlignmentProperties properties;
  private final TextNormalizer normalizer;
  private final PositionEstimator positionEstimator;
  private final TimestampInterpolator interpolator;
  private final JaroWinklerSimilarity similarity = new JaroWinklerSimilarity();

  public AlignmentEngine(
      AlignmentProperties properties,
      TextNormalizer normalizer,
      PositionEstimator positionEstimator,
      TimestampInterpolator interpolator) {
    this.properties = properties;
    this.normalizer = normalizer;
    this.positionEstimator = positionEstimator;
    this.interpolator = interpolator;
  }

  public AlignmentResult align(
      long subjectId, ExtractedDocument document, BookTranscript transcript) {
    AlignmentResult result =
        transcript.isSynthetic()
            ? alignByTime(subjectId, document, transcript)
            : alignByText(subjectId, document, transcript);
    Metadata metadata = result.metadata();
    STRUCTURED_LOGGER.logAlignmentFinished(
        subjectId,
        metadata.matchedCount(),
        metadata.interpolatedCount(),
        metadata.totalCount(),
        result.quality(),
        metadata.alignmentType() == null ? "text" : metadata.alignmentType());
    return result;
  }

  private AlignmentResult alignByText(
      long subjectId, ExtractedDocument document, BookTranscript transcript) {
    TranscriptIndex index = TranscriptIndex.build(transcript, normalizer);
    LOGGER.debug(
        "Indexed {} transcript sentences under {} keys", index.size(), index.keyCount());
    boolean[] consumed = new boolean[index.size()];

    int total = document.sentenceCount();
    int matched = 0;
    int interpolated = 0;
    double confidenceSum = 0;
    List<AlignedPage> pages = new ArrayList<>();

    for (DocumentPage page : document.pages()) {
      List<DocumentSentence> sentences = page.sentences();
      List<AlignedSentence> aligned = new ArrayList<>(sentences.size());
      for (DocumentSentence sentence : sentences) {
        AlignedSentence record = positioned(sentence, page);
        Match match = findBestMatch(sentence.text(), index, consumed);
        if (match != null) {
          consumed[match.index()] = true;
          TimedSentence heard = index.sentence(match.index());
          record =
              record.withAudio(
                  new AudioSpan(
                      heard.chapterIndex(), heard.globalStart(), heard.globalEnd(), false),
                  match.score());
          matched++;
          confidenceSum += match.score();
        }
        aligned.add(record);
      }

      List<AlignedSentence> filled = interpolator.interpolate(aligned, transcript);
      for (AlignedSentence sentence : filled) {
        if (sentence.audio() != null && sentence.audio().interpolated()) {
          interpolated++;
        }
      }
      pages.add(new AlignedPage(page.pageNumber(), filled));
    }

    double averageConfidence = matched == 0 ? 0 : confidenceSum / matched;
    Metadata metadata =
        new Metadata(
            total,
            transcript.sentences().size(),
            matched,
            interpolated,
            total,
            averageConfidence,
            null);
    return new AlignmentResult(subjectId, pages, metadata, quality(matched, total));
  }

  private AlignmentResult alignByTime(
      long subjectId, ExtractedDocument document, BookTranscript transcript) {
    int total = document.sentenceCount();
    double slot = total == 0 ? 0 : transcript.totalDuration() / total;
    double confidence = properties.syntheticConfidence();
    LOGGER.info(
        "Transcript of book {} is synthetic; distributing {} sentences over {}s",
        transcript.bookId(),
        total,
        transcript.totalDuration());

    List<AlignedPage> pages = new ArrayList<>();
    int position = 0;
    for (DocumentPage page : document.pages()) {
      List<AlignedSentence> aligned = new ArrayList<>(page.sentences().size());
      for (DocumentSentence sentence : page.sentences()) {
        double start = position * slot;
        double end = (position + 1) * slot;
        AudioSpan span = new AudioSpan(transcript.chapterAt(start), start, end, false);
        aligned.add(positioned(sentence, page).withAudio(span, confidence));
        position++;
      }
      pages.add(new AlignedPage(page.pageNumber(), aligned));
    }

    Metadata metadata =
        new Metadata(
            total,
            transcript.sentences().size(),
            0,
            0,
            total,
            confidence,
            AlignmentResult.TIME_BASED);
    return new AlignmentResult(subjectId, pages, metadata, 0);
  }

  /** The best unused candidate, or null when none reaches the threshold. */
  private Match findBestMatch(String text, TranscriptIndex index, boolean[] consumed) {
    String normalized = normalizer.normalize(text);
    if (normalized.length() < MIN_NORMALIZED_LENGTH) {
      return null;
    }
    String key = normalizer.leadingWords(normalized, TranscriptIndex.KEY_WORDS);
    int best = -1;
    double bestScore = 0;
    for (int candidate : index.candidates(key)) {
      if (consumed[candidate]) {
        continue;
      }
      double score = similarity.apply(normalized, index.normalizedText(candidate));
      if (score > bestScore && score >= properties.matchThreshold()) {
        best = candidate;
        bestScore = score;
      }
    }
    return best < 0 ? null : new Match(best, bestScore);
  }

  private AlignedSentence positioned(DocumentSentence sentence, DocumentPage page) {
    return new AlignedSentence(
        sentence.id(),
        sentence.text(),
        positionEstimator.estimate(
            sentence.indexInPage(), page.sentences().size(), page.width(), page.height()),
        null,
        0);
  }

  private record Match(int index, double score) {}

  static int quality(int matched, int total) {
    if (total == 0) {
      return 0;
    }
    long rounded = Math.round(matched * 100.0 / total);
    return (int) Math.max(0, Math.min(100, rounded));
  }
}

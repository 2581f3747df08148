package com.scholary.followalong.alignment;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * A document aligned to its audiobook.
 *
 * @param subjectId the document id
 * @param quality matched share of document sentences, 0 to 100
 */
public record AlignmentResult(
    long subjectId, List<AlignedPage> pages, Metadata metadata, int quality) {

  public static final String TIME_BASED = "time-based";

  public AlignmentResult {
    pages = List.copyOf(pages);
  }

  public record AlignedPage(int pageNumber, List<AlignedSentence> sentences) {

    public AlignedPage {
      sentences = List.copyOf(sentences);
    }
  }

  /**
   * One document sentence and where it is heard.
   *
   * @param audio null when the sentence could not be placed
   */
  public record AlignedSentence(
      String id, String text, Position position, AudioSpan audio, double confidence) {

    public AlignedSentence withAudio(AudioSpan audio, double confidence) {
      return new AlignedSentence(id, text, position, audio, confidence);
    }
  }

  public record AudioSpan(
      int chapterIndex, double globalStart, double globalEnd, boolean interpolated) {}

  /** Estimated bounding box on the page, in PDF points from the bottom-left corner. */
  public record Position(double x, double y, double width, double height) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Metadata(
      int documentSentenceCount,
      int audioSentenceCount,
      int matchedCount,
      int interpolatedCount,
      int totalCount,
      double averageConfidence,
      String alignmentType) {}
}

package com.scholary.followalong.service;

/** How much of a book has been transcribed. */
public record TranscriptionSummary(int chapterCount, int transcribedCount) {

  public boolean hasTranscription() {
    return chapterCount > 0 && transcribedCount >= chapterCount;
  }
}

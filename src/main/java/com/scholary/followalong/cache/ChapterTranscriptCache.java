package com.scholary.followalong.cache;

import com.scholary.followalong.transcript.ChapterTranscript;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of chapter transcripts, keyed by (bookId, chapterIndex).
 *
 * <p>Entries are write-once. A second {@link #put} for an existing key keeps the first transcript.
 * Entries leave the cache only through {@link #evictBook}.
 */
public interface ChapterTranscriptCache {

  Optional<ChapterTranscript> get(long bookId, int chapterIndex);

  /**
   * Store a transcript unless one already exists for its key.
   *
   * @return true if this call stored it
   */
  boolean put(ChapterTranscript transcript);

  /** All cached transcripts of a book, in chapter order. */
  List<ChapterTranscript> findByBook(long bookId);

  int countForBook(long bookId);

  /**
   * Delete every cached transcript of a book.
   *
   * @return the number of chapters removed
   */
  int evictBook(long bookId);
}

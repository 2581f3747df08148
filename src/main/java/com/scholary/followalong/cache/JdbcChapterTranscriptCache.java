package com.scholary.followalong.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.followalong.transcript.ChapterTranscript;
import com.scholary.followalong.transcript.Sentence;
import java.io.UncheckedIOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Chapter transcript cache stored in the {@code chapter_transcripts} table.
 *
 * <p>Sentences are kept as a JSON array. A Caffeine cache sits in front of the table so repeated
 * book transcriptions do not re-read and re-parse every chapter.
 */
@Component
public class JdbcChapterTranscriptCache implements ChapterTranscriptCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcChapterTranscriptCache.class);

  private static final TypeReference<List<Sentence>> SENTENCE_LIST = new TypeReference<>() {};

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final Cache<String, ChapterTranscript> nearCache;

  public JdbcChapterTranscriptCache(
      JdbcTemplate jdbcTemplate,
      ObjectMapper objectMapper,
      @Value("${transcript-cache.maxSize:500}") int maxSize) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
    this.nearCache = Caffeine.newBuilder().maximumSize(maxSize).build();

    LOGGER.info("Initialized chapter transcript cache: nearCacheSize={}", maxSize);
  }

  @Override
  public Optional<ChapterTranscript> get(long bookId, int chapterIndex) {
    String key = key(bookId, chapterIndex);
    ChapterTranscript cached = nearCache.getIfPresent(key);
    if (cached != null) {
      return Optional.of(cached);
    }
    List<ChapterTranscript> rows =
        jdbcTemplate.query(
            "SELECT book_id, chapter_index, sentences, duration_seconds, is_synthetic"
                + " FROM chapter_transcripts WHERE book_id = ? AND chapter_index = ?",
            this::mapRow,
            bookId,
            chapterIndex);
    if (rows.isEmpty()) {
      LOGGER.debug("Cache miss: book={}, chapter={}", bookId, chapterIndex);
      return Optional.empty();
    }
    ChapterTranscript transcript = rows.get(0);
    nearCache.put(key, transcript);
    return Optional.of(transcript);
  }

  @Override
  public boolean put(ChapterTranscript transcript) {
    try {
      jdbcTemplate.update(
          "INSERT INTO chapter_transcripts"
              + " (book_id, chapter_index, sentences, duration_seconds, is_synthetic, created_at)"
              + " VALUES (?, ?, ?, ?, ?, ?)",
          transcript.bookId(),
          transcript.chapterIndex(),
          toJson(transcript.sentences()),
          transcript.duration(),
          transcript.synthetic(),
          Timestamp.from(Instant.now()));
    } catch (DuplicateKeyException e) {
      LOGGER.debug(
          "Transcript already cached: book={}, chapter={}; keeping existing",
          transcript.bookId(),
          transcript.chapterIndex());
      return false;
    }
    nearCache.put(key(transcript.bookId(), transcript.chapterIndex()), transcript);
    LOGGER.debug(
        "Cached transcript: book={}, chapter={}, sentences={}, synthetic={}",
        transcript.bookId(),
        transcript.chapterIndex(),
        transcript.sentences().size(),
        transcript.synthetic());
    return true;
  }

  @Override
  public List<ChapterTranscript> findByBook(long bookId) {
    return jdbcTemplate.query(
        "SELECT book_id, chapter_index, sentences, duration_seconds, is_synthetic"
            + " FROM chapter_transcripts WHERE book_id = ? ORDER BY chapter_index",
        this::mapRow,
        bookId);
  }

  @Override
  public int countForBook(long bookId) {
    Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM chapter_transcripts WHERE book_id = ?", Integer.class, bookId);
    return count == null ? 0 : count;
  }

  @Override
  public int evictBook(long bookId) {
    int deleted = jdbcTemplate.update("DELETE FROM chapter_transcripts WHERE book_id = ?", bookId);
    String prefix = bookId + ":";
    nearCache.asMap().keySet().removeIf(k -> k.startsWith(prefix));
    LOGGER.info("Evicted {} cached chapter transcripts for book {}", deleted, bookId);
    return deleted;
  }

  private ChapterTranscript mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ChapterTranscript(
        rs.getLong("book_id"),
        rs.getInt("chapter_index"),
        fromJson(rs.getString("sentences")),
        rs.getDouble("duration_seconds"),
        rs.getBoolean("is_synthetic"));
  }

  private String toJson(List<Sentence> sentences) {
    try {
      return objectMapper.writeValueAsString(sentences);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to serialize transcript sentences", e);
    }
  }

  private List<Sentence> fromJson(String json) {
    try {
      return objectMapper.readValue(json, SENTENCE_LIST);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Corrupt cached transcript", e);
    }
  }

  private static String key(long bookId, int chapterIndex) {
    return bookId + ":" + chapterIndex;
  }
}

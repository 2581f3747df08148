package com.scholary.followalong.alignment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Stores one alignment per document as a JSON document in the {@code alignments} table. */
@Repository
public class AlignmentRepository {

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public AlignmentRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  /** Replace any previous alignment of the same document. */
  @Transactional
  public void save(AlignmentResult result) {
    String json;
    try {
      json = objectMapper.writeValueAsString(result);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to serialize alignment", e);
    }
    jdbcTemplate.update("DELETE FROM alignments WHERE document_id = ?", result.subjectId());
    jdbcTemplate.update(
        "INSERT INTO alignments (document_id, alignment_data, quality, created_at)"
            + " VALUES (?, ?, ?, ?)",
        result.subjectId(),
        json,
        result.quality(),
        Timestamp.from(Instant.now()));
  }

  public Optional<AlignmentResult> findByDocument(long documentId) {
    List<String> rows =
        jdbcTemplate.queryForList(
            "SELECT alignment_data FROM alignments WHERE document_id = ?",
            String.class,
            documentId);
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(rows.get(0), AlignmentResult.class));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Corrupt alignment for document " + documentId, e);
    }
  }

  public Optional<Integer> qualityFor(long documentId) {
    List<Integer> rows =
        jdbcTemplate.queryForList(
            "SELECT quality FROM alignments WHERE document_id = ?", Integer.class, documentId);
    return rows.stream().findFirst();
  }
}

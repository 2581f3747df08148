package com.scholary.followalong.library;

import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/** Read access to the chapters registered by the library scanner. */
@Repository
public class ChapterCatalog {

  private final JdbcTemplate jdbcTemplate;

  public ChapterCatalog(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /** Chapters of a book in playback order. */
  public List<Chapter> findByBook(long bookId) {
    return jdbcTemplate.query(
        "SELECT book_id, order_index, file_path, duration_seconds FROM chapters"
            + " WHERE book_id = ? ORDER BY order_index",
        (rs, rowNum) ->
            new Chapter(
                rs.getLong("book_id"),
                rs.getInt("order_index"),
                rs.getString("file_path"),
                rs.getDouble("duration_seconds")),
        bookId);
  }

  public int countByBook(long bookId) {
    Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM chapters WHERE book_id = ?", Integer.class, bookId);
    return count == null ? 0 : count;
  }
}

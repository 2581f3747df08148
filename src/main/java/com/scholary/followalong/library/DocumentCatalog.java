package com.scholary.followalong.library;

import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/** Access to uploaded documents; the alignment job records page count and scan status here. */
@Repository
public class DocumentCatalog {

  private final JdbcTemplate jdbcTemplate;

  public DocumentCatalog(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public Optional<Document> findById(long documentId) {
    List<Document> rows =
        jdbcTemplate.query(
            "SELECT id, book_id, file_path, page_count, is_scanned FROM documents WHERE id = ?",
            (rs, rowNum) ->
                new Document(
                    rs.getLong("id"),
                    rs.getLong("book_id"),
                    rs.getString("file_path"),
                    rs.getObject("page_count", Integer.class),
                    rs.getBoolean("is_scanned")),
            documentId);
    return rows.stream().findFirst();
  }

  public void updatePageCount(long documentId, int pageCount) {
    jdbcTemplate.update("UPDATE documents SET page_count = ? WHERE id = ?", pageCount, documentId);
  }

  public void markScanned(long documentId) {
    jdbcTemplate.update("UPDATE documents SET is_scanned = TRUE WHERE id = ?", documentId);
  }
}

package com.scholary.followalong.job;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Durable job records in the {@code jobs} table.
 *
 * <p>Every update statement excludes jobs that are already terminal, so a job reaches a terminal
 * status once and keeps it. Each call commits on its own, which makes every stage transition
 * durable before the next stage starts.
 */
@Repository
public class JobRepository {

  private static final String COLUMNS =
      "id, kind, subject_id, status, progress, status_message, error_message,"
          + " created_at, updated_at, completed_at";

  private static final String NOT_TERMINAL = "status NOT IN ('COMPLETED', 'FAILED', 'CANCELLED')";

  // Column widths in schema.sql.
  static final int STATUS_MESSAGE_LENGTH = 1024;
  static final int ERROR_MESSAGE_LENGTH = 4096;

  private final JdbcTemplate jdbcTemplate;

  public JobRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public void save(TranscriptionJob job) {
    jdbcTemplate.update(
        "INSERT INTO jobs (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
        job.getId(),
        job.getKind().name(),
        job.getSubjectId(),
        job.getStatus().name(),
        job.getProgress(),
        job.getStatusMessage(),
        job.getErrorMessage(),
        toTimestamp(job.getCreatedAt()),
        toTimestamp(job.getUpdatedAt()),
        toTimestamp(job.getCompletedAt()));
  }

  public Optional<TranscriptionJob> findById(String jobId) {
    return jdbcTemplate
        .query("SELECT " + COLUMNS + " FROM jobs WHERE id = ?", this::mapRow, jobId)
        .stream()
        .findFirst();
  }

  /** The non-terminal job of a subject, if any. */
  public Optional<TranscriptionJob> findActive(JobKind kind, long subjectId) {
    return jdbcTemplate
        .query(
            "SELECT " + COLUMNS + " FROM jobs WHERE kind = ? AND subject_id = ? AND "
                + NOT_TERMINAL
                + " ORDER BY seq DESC",
            this::mapRow,
            kind.name(),
            subjectId)
        .stream()
        .findFirst();
  }

  /** The most recently created job of a subject, whatever its status. */
  public Optional<TranscriptionJob> findLatest(JobKind kind, long subjectId) {
    return jdbcTemplate
        .query(
            "SELECT " + COLUMNS + " FROM jobs WHERE kind = ? AND subject_id = ? ORDER BY seq DESC",
            this::mapRow,
            kind.name(),
            subjectId)
        .stream()
        .findFirst();
  }

  /** Jobs that never reached a terminal status, oldest first. */
  public List<TranscriptionJob> findNonTerminal() {
    return jdbcTemplate.query(
        "SELECT " + COLUMNS + " FROM jobs WHERE " + NOT_TERMINAL + " ORDER BY seq", this::mapRow);
  }

  /**
   * Move a job to a stage.
   *
   * @return false if the job is unknown or already terminal
   */
  public boolean updateStage(String jobId, JobStatus status, int progress, String message) {
    return jdbcTemplate.update(
            "UPDATE jobs SET status = ?, progress = ?, status_message = ?, updated_at = ?"
                + " WHERE id = ? AND "
                + NOT_TERMINAL,
            status.name(),
            progress,
            truncate(message, STATUS_MESSAGE_LENGTH),
            now(),
            jobId)
        > 0;
  }

  public boolean markCompleted(String jobId, String message) {
    return finish(jobId, JobStatus.COMPLETED, 100, message, null);
  }

  public boolean markFailed(String jobId, String error) {
    return finish(jobId, JobStatus.FAILED, null, null, error);
  }

  public boolean markCancelled(String jobId, String message) {
    return finish(jobId, JobStatus.CANCELLED, null, message, null);
  }

  /** Put an interrupted job back to the start of its pipeline. */
  public boolean resetToPending(String jobId) {
    return jdbcTemplate.update(
            "UPDATE jobs SET status = 'PENDING', progress = 0, status_message = NULL,"
                + " error_message = NULL, updated_at = ? WHERE id = ? AND "
                + NOT_TERMINAL,
            now(),
            jobId)
        > 0;
  }

  private boolean finish(
      String jobId, JobStatus status, Integer progress, String message, String error) {
    Timestamp now = now();
    StringBuilder sql = new StringBuilder("UPDATE jobs SET status = ?");
    List<Object> args = new ArrayList<>();
    args.add(status.name());
    if (progress != null) {
      sql.append(", progress = ?");
      args.add(progress);
    }
    if (message != null) {
      sql.append(", status_message = ?");
      args.add(truncate(message, STATUS_MESSAGE_LENGTH));
    }
    sql.append(", error_message = ?, updated_at = ?, completed_at = ? WHERE id = ? AND ");
    sql.append(NOT_TERMINAL);
    args.add(truncate(error, ERROR_MESSAGE_LENGTH));
    args.add(now);
    args.add(now);
    args.add(jobId);
    return jdbcTemplate.update(sql.toString(), args.toArray()) > 0;
  }

  private TranscriptionJob mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new TranscriptionJob(
        rs.getString("id"),
        JobKind.valueOf(rs.getString("kind")),
        rs.getLong("subject_id"),
        JobStatus.valueOf(rs.getString("status")),
        rs.getInt("progress"),
        rs.getString("status_message"),
        rs.getString("error_message"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")),
        toInstant(rs.getTimestamp("completed_at")));
  }

  private static String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength - 3) + "...";
  }

  private static Timestamp now() {
    return Timestamp.from(Instant.now());
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}

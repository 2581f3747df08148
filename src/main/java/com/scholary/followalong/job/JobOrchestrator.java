package com.scholary.followalong.job;

import com.scholary.followalong.common.CancellationToken;
import com.scholary.followalong.common.JobCancelledException;
import com.scholary.followalong.config.JobProperties;
import com.scholary.followalong.logging.StructuredLogger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Single-worker job queue.
 *
 * <p>Jobs wait in an in-memory FIFO and run one at a time on the job executor. The durable job
 * record is the source of truth for status. On startup every job left in a non-terminal status is
 * reset and queued again.
 *
 * <p>Cancelling a queued job removes it and marks it cancelled at once. Cancelling the running
 * job sets its token; the pipeline stops at the next stage or chapter boundary. A job that is
 * already writing its result cannot be cancelled.
 *
 * <p>A job interrupted by executor shutdown is left in its current status for the next startup to
 * resume.
 */
@Service
public class JobOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobOrchestrator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String CANCELLED_MESSAGE = "Cancelled by user";

  private final JobRepository jobRepository;
  private final JobPipeline pipeline;
  private final Executor executor;
  private final JobProperties properties;

  private final Deque<String> queue = new ArrayDeque<>();
  private String runningJobId;
  private CancellationToken runningToken;

  public JobOrchestrator(
      JobRepository jobRepository,
      JobPipeline pipeline,
      @Qualifier("jobExecutor") Executor executor,
      JobProperties properties) {
    this.jobRepository = jobRepository;
    this.pipeline = pipeline;
    this.executor = executor;
    this.properties = properties;
  }

  /**
   * Start a job for a subject, or return the one already active for it.
   *
   * @return the active job, new or existing
   */
  public synchronized TranscriptionJob startJob(JobKind kind, long subjectId) {
    Optional<TranscriptionJob> active = jobRepository.findActive(kind, subjectId);
    if (active.isPresent()) {
      LOGGER.info(
          "{} job {} already active for subject {}", kind, active.get().getId(), subjectId);
      return active.get();
    }
    TranscriptionJob job = TranscriptionJob.pending(UUID.randomUUID().toString(), kind, subjectId);
    jobRepository.save(job);
    LOGGER.info("Created {} job {} for subject {}", kind, job.getId(), subjectId);
    enqueue(job);
    return job;
  }

  /** Append a job to the queue and start the worker if it is idle. */
  public synchronized void enqueue(TranscriptionJob job) {
    String jobId = job.getId();
    if (jobId.equals(runningJobId) || queue.contains(jobId)) {
      LOGGER.debug("Job {} already queued", jobId);
      return;
    }
    queue.addLast(jobId);
    LOGGER.info("Queued job {} (queue length {})", jobId, queue.size());
    processNext();
  }

  /**
   * Cancel a queued or running job.
   *
   * @return false if the job is neither queued nor running, or is already writing its result
   */
  public synchronized boolean cancel(String jobId) {
    if (queue.remove(jobId)) {
      jobRepository.markCancelled(jobId, CANCELLED_MESSAGE);
      LOGGER.info("Cancelled queued job {}", jobId);
      return true;
    }
    if (jobId.equals(runningJobId)) {
      if (!runningToken.cancel()) {
        LOGGER.info("Job {} is already saving its result, not cancelled", jobId);
        return false;
      }
      LOGGER.info("Cancellation requested for running job {}", jobId);
      return true;
    }
    return false;
  }

  /**
   * Cancel the active job of a subject.
   *
   * @throws IllegalStateException if the job is already writing its result
   */
  public synchronized Optional<TranscriptionJob> cancelActive(JobKind kind, long subjectId) {
    Optional<TranscriptionJob> active = jobRepository.findActive(kind, subjectId);
    if (active.isPresent()) {
      String jobId = active.get().getId();
      if (!cancel(jobId) && jobId.equals(runningJobId)) {
        throw new IllegalStateException("Job " + jobId + " is already finishing");
      }
    }
    return active;
  }

  public Optional<TranscriptionJob> status(String jobId) {
    return jobRepository.findById(jobId);
  }

  public Optional<TranscriptionJob> latestForSubject(JobKind kind, long subjectId) {
    return jobRepository.findLatest(kind, subjectId);
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (properties.resumeOnStartup()) {
      resumePendingJobs();
    }
  }

  /**
   * Reset every non-terminal job to pending and queue it again, oldest first.
   *
   * @return the number of jobs resumed
   */
  public synchronized int resumePendingJobs() {
    List<TranscriptionJob> interrupted = jobRepository.findNonTerminal();
    int resumed = 0;
    for (TranscriptionJob job : interrupted) {
      if (job.getId().equals(runningJobId) || queue.contains(job.getId())) {
        continue;
      }
      if (jobRepository.resetToPending(job.getId())) {
        LOGGER.info("Resuming job {} (was {})", job.getId(), job.getStatus());
        enqueue(job);
        resumed++;
      }
    }
    if (resumed > 0) {
      LOGGER.info("Resumed {} interrupted jobs", resumed);
    }
    return resumed;
  }

  synchronized void processNext() {
    if (runningJobId != null || queue.isEmpty()) {
      return;
    }
    String jobId = queue.pollFirst();
    CancellationToken token = new CancellationToken();
    runningJobId = jobId;
    runningToken = token;
    executor.execute(() -> runJob(jobId, token));
  }

  private void runJob(String jobId, CancellationToken token) {
    long startTime = System.currentTimeMillis();
    try {
      Optional<TranscriptionJob> job = jobRepository.findById(jobId);
      if (job.isEmpty()) {
        LOGGER.warn("Job {} disappeared before it could run", jobId);
        return;
      }
      StructuredLogger.setJobContext(
          jobId, job.get().getKind().name(), job.get().getSubjectId());

      String message = pipeline.run(job.get(), token);
      jobRepository.markCompleted(jobId, message);
      STRUCTURED_LOGGER.logJobFinished(
          jobId, JobStatus.COMPLETED.name(), System.currentTimeMillis() - startTime, null);
    } catch (JobCancelledException e) {
      jobRepository.markCancelled(jobId, CANCELLED_MESSAGE);
      STRUCTURED_LOGGER.logJobFinished(
          jobId, JobStatus.CANCELLED.name(), System.currentTimeMillis() - startTime, null);
    } catch (Exception e) {
      if (Thread.currentThread().isInterrupted()) {
        LOGGER.warn("Job {} interrupted, left for resume on next startup", jobId, e);
        return;
      }
      String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
      LOGGER.error("Job {} failed", jobId, e);
      markFailed(jobId, error);
      STRUCTURED_LOGGER.logJobFinished(
          jobId, JobStatus.FAILED.name(), System.currentTimeMillis() - startTime, error);
    } finally {
      StructuredLogger.clearJobContext();
      synchronized (this) {
        runningJobId = null;
        runningToken = null;
        if (!Thread.currentThread().isInterrupted()) {
          processNext();
        }
      }
    }
  }

  private void markFailed(String jobId, String error) {
    try {
      jobRepository.markFailed(jobId, error);
    } catch (DataAccessException e) {
      LOGGER.error("Could not record failure of job {}", jobId, e);
    }
  }
}

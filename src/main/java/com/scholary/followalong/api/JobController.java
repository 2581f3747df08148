package com.scholary.followalong.api;

import com.scholary.followalong.common.NotFoundException;
import com.scholary.followalong.job.JobOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/** Job lookup and cancellation by job id. */
@RestController
@Tag(name = "Jobs", description = "Job status API")
public class JobController {

  private final JobOrchestrator orchestrator;

  public JobController(JobOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @GetMapping("/api/jobs/{jobId}")
  @Operation(summary = "Get job status", description = "Poll the status of a job")
  public ResponseEntity<JobResponse> status(@PathVariable String jobId) {
    return orchestrator
        .status(jobId)
        .map(job -> ResponseEntity.ok(JobResponse.from(job)))
        .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
  }

  @PostMapping("/api/jobs/{jobId}/cancel")
  @Operation(summary = "Cancel job", description = "Cancel a queued or running job")
  public ResponseEntity<MessageResponse> cancel(@PathVariable String jobId) {
    if (orchestrator.status(jobId).isEmpty()) {
      throw new NotFoundException("Job not found: " + jobId);
    }
    if (!orchestrator.cancel(jobId)) {
      throw new IllegalStateException("Job " + jobId + " is not queued or running");
    }
    return ResponseEntity.accepted().body(new MessageResponse("Cancellation requested"));
  }
}

package com.scholary.synthjobs.api;

import com.scholary.synthjobs.admission.AdmissionKey;
import com.scholary.synthjobs.error.JobConfigurationException;
import com.scholary.synthjobs.job.JobHandle;
import com.scholary.synthjobs.job.JobPayload;
import com.scholary.synthjobs.job.JobSnapshot;
import com.scholary.synthjobs.orchestrator.JobOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for generation jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a job, either returning a handle at once or waiting a bounded time for the result
 *   <li>Querying a job's status by handle
 *   <li>Cancelling a job
 * </ul>
 */
@RestController
@RequestMapping("/api/jobs")
@Tag(name = "Jobs", description = "Rate-limited generation jobs against the external provider")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  private final JobOrchestrator orchestrator;
  private final CallerIdentity callerIdentity;

  public JobController(
      JobOrchestrator orchestrator,
      @Value("${admission.trustProxyHeaders:false}") boolean trustProxyHeaders) {
    this.orchestrator = orchestrator;
    this.callerIdentity = new CallerIdentity(trustProxyHeaders);
  }

  /**
   * Start a job.
   *
   * <p>In {@code async} mode (the default) this returns 202 with the job ID right after admission.
   * In {@code sync} mode it waits for the job up to the configured bound: 200 with the outcome if
   * the job finished, otherwise 202 with the job ID so the caller can continue polling.
   */
  @PostMapping
  @Operation(
      summary = "Start a generation job",
      description =
          "Admits the request against the caller's budget for the operation class and submits it "
              + "to the provider. Over-budget callers get 429 with Retry-After. "
              + "mode=sync waits a bounded time for the result before falling back to a handle.")
  public ResponseEntity<?> createJob(
      @Valid @RequestBody JobRequest request,
      @RequestParam(name = "mode", defaultValue = "async") String mode,
      HttpServletRequest httpRequest) {
    boolean sync = isSync(mode);
    AdmissionKey key =
        AdmissionKey.of(callerIdentity.resolve(httpRequest), request.operationClass());
    JobPayload payload = new JobPayload(request.payload());
    Duration deadline =
        request.deadlineSeconds() == null ? null : Duration.ofSeconds(request.deadlineSeconds());

    LOGGER.info(
        "Job request: key={}, mode={}, deadlineSeconds={}", key, mode, request.deadlineSeconds());

    if (!sync) {
      JobHandle handle = orchestrator.requestJob(key, payload, deadline);
      return ResponseEntity.accepted().body(AsyncJobResponse.forJob(handle.jobId()));
    }

    JobSnapshot snapshot = orchestrator.runAndWait(key, payload, deadline);
    if (snapshot.isTerminal()) {
      return ResponseEntity.ok(JobStatusResponse.from(snapshot));
    }
    return ResponseEntity.accepted().body(AsyncJobResponse.forJob(snapshot.jobId()));
  }

  /** Get job status. A finished job is returned once and then forgotten. */
  @GetMapping("/{jobId}")
  @Operation(
      summary = "Get job status",
      description =
          "Returns the job's state, plus its result or error once finished. "
              + "A finished job can be read once; later reads return 404.")
  public ResponseEntity<JobStatusResponse> getJob(@PathVariable String jobId) {
    JobSnapshot snapshot = orchestrator.getStatus(JobHandle.of(jobId));
    return ResponseEntity.ok(JobStatusResponse.from(snapshot));
  }

  @DeleteMapping("/{jobId}")
  @Operation(
      summary = "Cancel a job",
      description =
          "Stops tracking the job. The provider is asked to stop on a best-effort basis. "
              + "Always acknowledged, including for unknown or finished jobs.")
  public ResponseEntity<Void> cancelJob(@PathVariable String jobId) {
    orchestrator.cancelJob(JobHandle.of(jobId));
    return ResponseEntity.accepted().build();
  }

  private static boolean isSync(String mode) {
    if ("sync".equalsIgnoreCase(mode)) {
      return true;
    }
    if ("async".equalsIgnoreCase(mode)) {
      return false;
    }
    throw new JobConfigurationException("Unknown mode: " + mode + " (expected async or sync)");
  }
}

package com.scholary.synthjobs.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.scholary.synthjobs.admission.AdmissionDecision;
import com.scholary.synthjobs.admission.AdmissionGate;
import com.scholary.synthjobs.admission.AdmissionKey;
import com.scholary.synthjobs.error.AdmissionDeniedException;
import com.scholary.synthjobs.error.JobConfigurationException;
import com.scholary.synthjobs.error.JobNotFoundException;
import com.scholary.synthjobs.error.OrchestratorSaturatedException;
import com.scholary.synthjobs.job.ErrorKind;
import com.scholary.synthjobs.job.JobError;
import com.scholary.synthjobs.job.JobHandle;
import com.scholary.synthjobs.job.JobPayload;
import com.scholary.synthjobs.job.JobResult;
import com.scholary.synthjobs.job.JobSnapshot;
import com.scholary.synthjobs.job.JobState;
import com.scholary.synthjobs.orchestrator.JobOrchestrator;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(
    controllers = {JobController.class, AdmissionController.class},
    properties = "admission.trustProxyHeaders=true")
class JobControllerTest {

  private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
  private static final String BODY =
      "{\"operationClass\":\"audio-gen\",\"payload\":{\"prompt\":\"lofi\"},\"deadlineSeconds\":60}";

  @Autowired private MockMvc mockMvc;

  @MockBean private JobOrchestrator orchestrator;
  @MockBean private AdmissionGate admissionGate;

  @Test
  void createJob_shouldReturnHandleInAsyncMode() throws Exception {
    when(orchestrator.requestJob(any(), any(), any())).thenReturn(JobHandle.of("job-1"));

    mockMvc
        .perform(
            post("/api/jobs")
                .header("X-User-Id", "42")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-1"))
        .andExpect(jsonPath("$.statusUrl").value("/api/jobs/job-1"));

    JobPayload expected =
        new JobPayload(JsonNodeFactory.instance.objectNode().put("prompt", "lofi"));
    verify(orchestrator)
        .requestJob(
            eq(AdmissionKey.of("user:42", "audio-gen")), eq(expected), eq(Duration.ofSeconds(60)));
  }

  @Test
  void createJob_shouldKeyAnonymousCallersByIp() throws Exception {
    when(orchestrator.requestJob(any(), any(), any())).thenReturn(JobHandle.of("job-1"));

    mockMvc
        .perform(
            post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"operationClass\":\"audio-gen\",\"payload\":{}}"))
        .andExpect(status().isAccepted());

    verify(orchestrator)
        .requestJob(eq(AdmissionKey.of("ip:127.0.0.1", "audio-gen")), any(), isNull());
  }

  @Test
  void createJob_shouldUseFirstForwardedAddress() throws Exception {
    when(orchestrator.requestJob(any(), any(), any())).thenReturn(JobHandle.of("job-1"));

    mockMvc
        .perform(
            post("/api/jobs")
                .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isAccepted());

    verify(orchestrator)
        .requestJob(eq(AdmissionKey.of("ip:203.0.113.7", "audio-gen")), any(), any());
  }

  @Test
  void createJob_shouldReturnResultInSyncModeWhenFinished() throws Exception {
    JobSnapshot done =
        snapshot(
            JobState.SUCCEEDED,
            new JobResult(JsonNodeFactory.instance.textNode("https://cdn/track.mp3")),
            null);
    when(orchestrator.runAndWait(any(), any(), any())).thenReturn(done);

    mockMvc
        .perform(
            post("/api/jobs")
                .param("mode", "sync")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("SUCCEEDED"))
        .andExpect(jsonPath("$.result").value("https://cdn/track.mp3"))
        .andExpect(jsonPath("$.error").doesNotExist());
  }

  @Test
  void createJob_shouldFallBackToHandleInSyncModeWhenStillRunning() throws Exception {
    when(orchestrator.runAndWait(any(), any(), any()))
        .thenReturn(snapshot(JobState.POLLING, null, null));

    mockMvc
        .perform(
            post("/api/jobs")
                .param("mode", "sync")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-1"));
  }

  @Test
  void createJob_shouldReturn429WithRetryAfterWhenDenied() throws Exception {
    when(orchestrator.requestJob(any(), any(), any()))
        .thenThrow(new AdmissionDeniedException("user:42:audio-gen", Duration.ofMillis(57_200)));

    mockMvc
        .perform(
            post("/api/jobs")
                .header("X-User-Id", "42")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isTooManyRequests())
        .andExpect(header().string("Retry-After", "58"))
        .andExpect(jsonPath("$.retryAfterSeconds").value(58))
        .andExpect(
            jsonPath("$.message").value("Too many generation requests. Please try again later."));
  }

  @Test
  void createJob_shouldReturn400ForConfigurationError() throws Exception {
    when(orchestrator.requestJob(any(), any(), any()))
        .thenThrow(new JobConfigurationException("deadline 3600s exceeds the maximum of 1800s"));

    mockMvc
        .perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("deadline 3600s exceeds the maximum of 1800s"));
  }

  @Test
  void createJob_shouldReturn400ForMissingOperationClass() throws Exception {
    mockMvc
        .perform(
            post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"payload\":{\"prompt\":\"lofi\"}}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(orchestrator);
  }

  @Test
  void createJob_shouldReturn400ForUnknownMode() throws Exception {
    mockMvc
        .perform(
            post("/api/jobs")
                .param("mode", "later")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(orchestrator);
  }

  @Test
  void createJob_shouldReturn503WhenSaturated() throws Exception {
    when(orchestrator.requestJob(any(), any(), any()))
        .thenThrow(new OrchestratorSaturatedException("Too many tracked jobs (limit: 1)"));

    mockMvc
        .perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isServiceUnavailable());
  }

  @Test
  void getJob_shouldReturnStatusView() throws Exception {
    when(orchestrator.getStatus(JobHandle.of("job-1")))
        .thenReturn(snapshot(JobState.TIMED_OUT, null, JobError.deadlineExceeded()));

    mockMvc
        .perform(get("/api/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.jobId").value("job-1"))
        .andExpect(jsonPath("$.state").value("TIMED_OUT"))
        .andExpect(jsonPath("$.externalRef").value("ext-1"))
        .andExpect(jsonPath("$.attempts").value(3))
        .andExpect(jsonPath("$.error.kind").value(ErrorKind.DEADLINE_EXCEEDED.name()))
        .andExpect(jsonPath("$.result").doesNotExist());
  }

  @Test
  void getJob_shouldReturn404ForUnknownJob() throws Exception {
    when(orchestrator.getStatus(JobHandle.of("gone"))).thenThrow(new JobNotFoundException("gone"));

    mockMvc.perform(get("/api/jobs/gone")).andExpect(status().isNotFound());
  }

  @Test
  void cancelJob_shouldAcknowledge() throws Exception {
    mockMvc.perform(delete("/api/jobs/job-1")).andExpect(status().isAccepted());

    verify(orchestrator).cancelJob(JobHandle.of("job-1"));
  }

  @Test
  void checkAdmission_shouldReturnDecision() throws Exception {
    when(admissionGate.tryAdmit(AdmissionKey.of("user:42", "write"), 5))
        .thenReturn(new AdmissionDecision(true, Duration.ZERO, 95, NOW.plusSeconds(900)));

    mockMvc
        .perform(
            post("/api/admission/check")
                .header("X-User-Id", "42")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"operationClass\":\"write\",\"cost\":5}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.allowed").value(true))
        .andExpect(jsonPath("$.remaining").value(95));
  }

  @Test
  void checkAdmission_shouldReturn429WhenDenied() throws Exception {
    when(admissionGate.tryAdmit(AdmissionKey.of("user:42", "write")))
        .thenReturn(new AdmissionDecision(false, Duration.ofSeconds(30), 0, NOW.plusSeconds(30)));

    mockMvc
        .perform(
            post("/api/admission/check")
                .header("X-User-Id", "42")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"operationClass\":\"write\"}"))
        .andExpect(status().isTooManyRequests())
        .andExpect(header().string("Retry-After", "30"))
        .andExpect(jsonPath("$.allowed").value(false));
  }

  private static JobSnapshot snapshot(JobState state, JobResult result, JobError error) {
    return new JobSnapshot(
        "job-1",
        "user:42:audio-gen",
        state,
        "ext-1",
        result,
        error,
        3,
        NOW,
        NOW.plusSeconds(30),
        NOW.plusSeconds(300));
  }
}

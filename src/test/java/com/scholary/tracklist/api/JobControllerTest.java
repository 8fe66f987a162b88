package com.scholary.tracklist.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.tracklist.api.JobStatusResponse.Status;
import com.scholary.tracklist.config.ConfigurationException;
import com.scholary.tracklist.job.IdentificationJob;
import com.scholary.tracklist.job.JobRepository;
import com.scholary.tracklist.job.JobRunner;
import com.scholary.tracklist.monitoring.KibanaUrlGenerator;
import com.scholary.tracklist.pipeline.CancellationToken;
import com.scholary.tracklist.service.TracklistService;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = {TracklistController.class, JobController.class})
class JobControllerTest {

  private static final String BODY =
      "{\"bucket\":\"mixes\",\"key\":\"set.pcm\",\"timeBudgetSeconds\":600}";

  @Autowired private MockMvc mockMvc;

  @MockBean private TracklistService tracklistService;
  @MockBean private JobRepository jobRepository;
  @MockBean private JobRunner jobRunner;
  @MockBean private KibanaUrlGenerator kibanaUrlGenerator;

  @Test
  void submit_shouldStartJobAndReturnItsId() throws Exception {
    when(kibanaUrlGenerator.generateJobUrl(anyString())).thenReturn("http://kibana/job");

    mockMvc
        .perform(post("/v1/jobs").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").isNotEmpty())
        .andExpect(jsonPath("$.kibanaUrl").value("http://kibana/job"));

    ArgumentCaptor<IdentificationJob> job = ArgumentCaptor.forClass(IdentificationJob.class);
    verify(jobRunner).run(job.capture());
    verify(jobRepository).save(job.getValue());
    assertThat(job.getValue().getRequest().timeBudgetSeconds()).isEqualTo(600L);
    assertThat(job.getValue().getStatus()).isEqualTo(Status.PENDING);
  }

  @Test
  void submit_shouldRejectInvalidOptionsUpFront() throws Exception {
    when(tracklistService.settingsFor(any(TracklistRequest.class)))
        .thenThrow(new ConfigurationException(List.of("maxConcurrentSegments must be >= 1")));

    mockMvc
        .perform(post("/v1/jobs").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.details[0]").value("maxConcurrentSegments must be >= 1"));
    verifyNoInteractions(jobRunner);
  }

  @Test
  void status_shouldReturnJobState() throws Exception {
    IdentificationJob job = job("job-1");
    job.setStatus(Status.PROCESSING);
    job.setProgress(40);
    when(jobRepository.findById("job-1")).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/v1/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PROCESSING"))
        .andExpect(jsonPath("$.progress").value(40));
  }

  @Test
  void status_shouldReturnNotFoundForUnknownJob() throws Exception {
    when(jobRepository.findById("nope")).thenReturn(Optional.empty());

    mockMvc.perform(get("/v1/jobs/nope")).andExpect(status().isNotFound());
  }

  @Test
  void cancel_shouldCancelRunningJob() throws Exception {
    IdentificationJob job = job("job-2");
    job.setStatus(Status.PROCESSING);
    when(jobRepository.findById("job-2")).thenReturn(Optional.of(job));

    mockMvc.perform(delete("/v1/jobs/job-2")).andExpect(status().isAccepted());

    assertThat(job.getCancellation().isCancelled()).isTrue();
  }

  @Test
  void cancel_shouldLeaveFinishedJobAlone() throws Exception {
    IdentificationJob job = job("job-3");
    job.setStatus(Status.COMPLETED);
    when(jobRepository.findById("job-3")).thenReturn(Optional.of(job));

    mockMvc
        .perform(delete("/v1/jobs/job-3"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.status").value("COMPLETED"));

    assertThat(job.getCancellation().isCancelled()).isFalse();
  }

  private static IdentificationJob job(String id) {
    return new IdentificationJob(
        id,
        new TracklistRequest("mixes", "set.pcm", null, null, null),
        CancellationToken.create());
  }
}

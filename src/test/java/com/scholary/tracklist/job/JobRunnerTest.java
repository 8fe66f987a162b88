package com.scholary.tracklist.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.tracklist.api.JobStatusResponse.Status;
import com.scholary.tracklist.api.TracklistRequest;
import com.scholary.tracklist.api.TracklistResponse;
import com.scholary.tracklist.audio.AudioSourceException;
import com.scholary.tracklist.matching.MatchDecision;
import com.scholary.tracklist.pipeline.CancellationToken;
import com.scholary.tracklist.pipeline.PipelineDiagnostics;
import com.scholary.tracklist.pipeline.PipelineListener;
import com.scholary.tracklist.service.TracklistService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobRunnerTest {

  @Mock private TracklistService tracklistService;

  private final JobRepository jobRepository = new JobRepository(100, 60);
  private JobRunner jobRunner;
  private IdentificationJob job;

  @BeforeEach
  void setUp() {
    jobRunner = new JobRunner(tracklistService, jobRepository);
    job =
        new IdentificationJob(
            "job-1",
            new TracklistRequest("mixes", "set.pcm", null, null, null),
            CancellationToken.create());
    jobRepository.save(job);
  }

  @Test
  void run_shouldCompleteJobWithResult() {
    TracklistResponse response = response(false);
    when(tracklistService.identify(eq(job.getRequest()), eq("job-1"), any(), any()))
        .thenReturn(response);

    jobRunner.run(job);

    IdentificationJob stored = jobRepository.findById("job-1").orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(stored.getProgress()).isEqualTo(100);
    assertThat(stored.getResult()).isSameAs(response);
  }

  @Test
  void run_shouldMarkPartialResultAsCancelled() {
    when(tracklistService.identify(any(), any(), any(), any())).thenReturn(response(true));

    jobRunner.run(job);

    assertThat(job.getStatus()).isEqualTo(Status.CANCELLED);
    assertThat(job.getResult().partial()).isTrue();
  }

  @Test
  void run_shouldRecordFailure() {
    when(tracklistService.identify(any(), any(), any(), any()))
        .thenThrow(new AudioSourceException("Cannot open audio object s3://mixes/set.pcm", null));

    jobRunner.run(job);

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError()).contains("s3://mixes/set.pcm");
    assertThat(job.getResult()).isNull();
  }

  @Test
  void run_shouldSkipJobCancelledBeforeStart() {
    job.cancel();

    jobRunner.run(job);

    assertThat(job.getStatus()).isEqualTo(Status.CANCELLED);
    verifyNoInteractions(tracklistService);
  }

  @Test
  void run_shouldReportProgressBelowHundredUntilDone() {
    List<Integer> progress = new ArrayList<>();
    when(tracklistService.identify(any(), any(), any(), any()))
        .thenAnswer(
            invocation -> {
              PipelineListener listener = invocation.getArgument(3);
              for (int delivered = 1; delivered <= 4; delivered++) {
                listener.onSegmentDelivered(delivered - 1, delivered, 4, MatchDecision.NEW);
                progress.add(job.getProgress());
              }
              assertThat(job.getStatus()).isEqualTo(Status.PROCESSING);
              return response(false);
            });

    jobRunner.run(job);

    assertThat(progress).containsExactly(25, 50, 75, 99);
    assertThat(job.getProgress()).isEqualTo(100);
  }

  private static TracklistResponse response(boolean partial) {
    return new TracklistResponse(
        "job-1",
        "s3://mixes/set.pcm",
        List.of(),
        partial,
        new PipelineDiagnostics(
            4, partial ? 2 : 4, 0, 4, 0, 0, Map.of(), Map.of(), partial, 10));
  }
}

package com.scholary.tracklist.job;

import com.scholary.tracklist.api.JobStatusResponse.Status;
import com.scholary.tracklist.api.TracklistResponse;
import com.scholary.tracklist.logging.StructuredLogger;
import com.scholary.tracklist.matching.MatchDecision;
import com.scholary.tracklist.pipeline.PipelineListener;
import com.scholary.tracklist.service.TracklistService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs identification jobs on the job executor.
 *
 * <p>Separate from the controller so that the {@code @Async} proxy applies.
 */
@Service
public class JobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRunner.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final TracklistService tracklistService;
  private final JobRepository jobRepository;

  public JobRunner(TracklistService tracklistService, JobRepository jobRepository) {
    this.tracklistService = tracklistService;
    this.jobRepository = jobRepository;
  }

  /**
   * Process a job asynchronously.
   *
   * <p>The job status is updated as processing progresses. A job cancelled before it started
   * finishes as CANCELLED without a result.
   */
  @Async("taskExecutor")
  public void run(IdentificationJob job) {
    if (job.getCancellation().isCancelled()) {
      LOGGER.info("Job {} cancelled before it started", job.getJobId());
      job.setStatus(Status.CANCELLED);
      jobRepository.save(job);
      return;
    }

    LOGGER.info("Starting async processing for job: {}", job.getJobId());
    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      TracklistResponse result =
          tracklistService.identify(
              job.getRequest(), job.getJobId(), job.getCancellation(), new ProgressListener(job));

      job.setResult(result);
      if (result.partial()) {
        job.setStatus(Status.CANCELLED);
      } else {
        job.setProgress(100);
        job.setStatus(Status.COMPLETED);
      }
      jobRepository.save(job);
      STRUCTURED_LOGGER.logJobProgress(
          job.getJobId(),
          result.diagnostics().segmentsProcessed(),
          result.diagnostics().segmentsTotal(),
          job.getProgress(),
          job.getStatus().name());
      LOGGER.info("Finished async processing for job: {} ({})", job.getJobId(), job.getStatus());

    } catch (RuntimeException e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    }
  }

  /** Updates job progress, logging every tenth of the way. */
  private static final class ProgressListener implements PipelineListener {

    private final IdentificationJob job;
    private int lastLoggedDecile = -1;

    ProgressListener(IdentificationJob job) {
      this.job = job;
    }

    @Override
    public void onSegmentDelivered(
        int segmentIndex, int delivered, int total, MatchDecision decision) {
      int percent = total == 0 ? 100 : (int) Math.min(99, (delivered * 100L) / total);
      job.setProgress(percent);
      int decile = percent / 10;
      if (decile != lastLoggedDecile) {
        lastLoggedDecile = decile;
        STRUCTURED_LOGGER.logJobProgress(job.getJobId(), delivered, total, percent, "IDENTIFYING");
      }
    }
  }
}

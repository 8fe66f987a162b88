package com.scholary.tracklist.api;

import com.scholary.tracklist.api.JobStatusResponse.Status;
import com.scholary.tracklist.job.IdentificationJob;
import com.scholary.tracklist.job.JobRepository;
import com.scholary.tracklist.job.JobRunner;
import com.scholary.tracklist.monitoring.KibanaUrlGenerator;
import com.scholary.tracklist.service.TracklistService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for asynchronous tracklist identification.
 *
 * <ul>
 *   <li>POST starts a job and returns its ID immediately
 *   <li>GET polls status, progress and, once available, the result
 *   <li>DELETE cancels; the job keeps the tracks found so far
 * </ul>
 */
@RestController
@RequestMapping("/v1/jobs")
@Tag(name = "Jobs", description = "Asynchronous tracklist identification")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  private final TracklistService tracklistService;
  private final JobRepository jobRepository;
  private final JobRunner jobRunner;
  private final KibanaUrlGenerator kibanaUrlGenerator;

  public JobController(
      TracklistService tracklistService,
      JobRepository jobRepository,
      JobRunner jobRunner,
      KibanaUrlGenerator kibanaUrlGenerator) {
    this.tracklistService = tracklistService;
    this.jobRepository = jobRepository;
    this.jobRunner = jobRunner;
    this.kibanaUrlGenerator = kibanaUrlGenerator;
  }

  @PostMapping
  @Operation(
      summary = "Start identification",
      description = "Start an asynchronous identification job and return its ID for polling")
  public ResponseEntity<AsyncJobResponse> submit(@Valid @RequestBody TracklistRequest request) {
    // Reject bad options now rather than in a FAILED job.
    tracklistService.settingsFor(request);

    String jobId = UUID.randomUUID().toString();
    IdentificationJob job =
        new IdentificationJob(jobId, request, TracklistService.cancellationFor(request));
    jobRepository.save(job);
    LOGGER.info(
        "Created identification job: {} (bucket={}, key={})",
        jobId,
        request.bucket(),
        request.key());

    jobRunner.run(job);
    return ResponseEntity.accepted()
        .body(new AsyncJobResponse(jobId, kibanaUrlGenerator.generateJobUrl(jobId)));
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an identification job")
  public ResponseEntity<JobStatusResponse> status(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(toStatus(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  @DeleteMapping("/{id}")
  @Operation(
      summary = "Cancel a job",
      description =
          "Stop starting new segments. Segments in flight finish and the job ends as CANCELLED "
              + "with the tracks found so far.")
  public ResponseEntity<JobStatusResponse> cancel(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job -> {
              if (!job.getStatus().isTerminal()) {
                LOGGER.info("Cancelling job: {}", id);
                job.cancel();
              }
              return ResponseEntity.accepted().body(toStatus(job));
            })
        .orElse(ResponseEntity.notFound().build());
  }

  private JobStatusResponse toStatus(IdentificationJob job) {
    Status status = job.getStatus();
    return new JobStatusResponse(
        job.getJobId(),
        status,
        job.getProgress(),
        job.getResult(),
        job.getError(),
        kibanaUrlGenerator.generateJobUrl(job.getJobId()));
  }
}

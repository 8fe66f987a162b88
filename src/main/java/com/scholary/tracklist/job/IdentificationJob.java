package com.scholary.tracklist.job;

import com.scholary.tracklist.api.JobStatusResponse.Status;
import com.scholary.tracklist.api.TracklistRequest;
import com.scholary.tracklist.api.TracklistResponse;
import com.scholary.tracklist.pipeline.CancellationToken;
import java.time.Instant;

/**
 * Represents an async identification job.
 *
 * <p>Tracks the job's state, progress, and result. Written by the job thread and read by status
 * requests, hence the volatile fields.
 */
public class IdentificationJob {

  private final String jobId;
  private final TracklistRequest request;
  private final Instant createdAt;
  private final CancellationToken cancellation;

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile TracklistResponse result;
  private volatile String error;

  public IdentificationJob(String jobId, TracklistRequest request, CancellationToken cancellation) {
    this.jobId = jobId;
    this.request = request;
    this.cancellation = cancellation;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public TracklistRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public CancellationToken getCancellation() {
    return cancellation;
  }

  /** Ask the job to stop. It keeps the tracks found so far. */
  public void cancel() {
    cancellation.cancel();
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public TracklistResponse getResult() {
    return result;
  }

  public void setResult(TracklistResponse result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}

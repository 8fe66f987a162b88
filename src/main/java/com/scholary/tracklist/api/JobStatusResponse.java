package com.scholary.tracklist.api;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the result once it has one. Cancelled
 * jobs that got past the first segment carry a partial result.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    Integer progress,
    TracklistResponse result,
    String error,
    String kibanaUrl) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
      return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
  }
}

package com.scholary.tracklist.provider;

/** Why a recognition call failed. Drives the retry decision. */
public enum ErrorKind {
  RATE_LIMITED(true),
  TIMEOUT(true),
  AUTH_ERROR(false),
  MALFORMED_REQUEST(false),
  UNKNOWN(true);

  private final boolean transientFailure;

  ErrorKind(boolean transientFailure) {
    this.transientFailure = transientFailure;
  }

  /**
   * Whether another attempt can reasonably succeed.
   *
   * @return false for failures that repeat identically on every attempt
   */
  public boolean isTransient() {
    return transientFailure;
  }
}

package com.scholary.tracklist.api;

import java.time.Instant;
import java.util.List;

/** Error body returned by every endpoint. */
public record ApiError(String errorCode, String message, List<String> details, Instant timestamp) {

  public static ApiError of(String errorCode, String message, List<String> details) {
    return new ApiError(errorCode, message, List.copyOf(details), Instant.now());
  }
}

package com.scholary.tracklist.cache;

/** The cache store could not be read or written. Callers treat it as a miss. */
public class CacheUnavailableException extends RuntimeException {

  public CacheUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}

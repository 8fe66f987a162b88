package com.scholary.tracklist.audio;

/**
 * Exception thrown when audio cannot be read from its source.
 *
 * <p>Raised for missing objects, truncated streams and storage outages.
 */
public class AudioSourceException extends RuntimeException {

  public AudioSourceException(String message) {
    super(message);
  }

  public AudioSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.scholary.tracklist.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Runtime exception: callers either translate it (audio source, cache backend) or let it reach
 * the REST boundary.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}

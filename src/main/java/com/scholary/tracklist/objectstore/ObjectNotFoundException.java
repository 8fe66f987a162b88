package com.scholary.tracklist.objectstore;

/** The requested bucket/key does not exist. */
public class ObjectNotFoundException extends ObjectStoreException {

  public ObjectNotFoundException(String bucket, String key, Throwable cause) {
    super(String.format("Object not found: bucket=%s, key=%s", bucket, key), cause);
  }
}

package com.scholary.tracklist.objectstore;

/**
 * Abstraction for the object storage we read mixes from and, optionally, persist cached
 * identification results to.
 *
 * <p>Keeps the AWS SDK out of the audio and cache layers, and lets tests mock storage.
 */
public interface ObjectStoreClient {

  /**
   * Read a whole object into memory.
   *
   * <p>Only meant for small objects (cache entries), never for audio.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return the object's bytes
   * @throws ObjectNotFoundException if the object does not exist
   * @throws ObjectStoreException if retrieval fails
   */
  byte[] readObject(String bucket, String key);

  /**
   * Store a small object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the object content
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void writeObject(String bucket, String key, byte[] data, String contentType);

  /**
   * Get object metadata without downloading the content.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return object metadata
   * @throws ObjectNotFoundException if the object does not exist
   * @throws ObjectStoreException if retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /**
   * Read a byte range of an object.
   *
   * <p>Lets us fetch one segment of a multi-hour mix without downloading the rest.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param startByte the starting byte position (inclusive)
   * @param endByte the ending byte position (inclusive)
   * @return the bytes of the range
   * @throws ObjectNotFoundException if the object does not exist
   * @throws ObjectStoreException if retrieval fails
   */
  byte[] readRange(String bucket, String key, long startByte, long endByte);

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}

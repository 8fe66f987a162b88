package com.scholary.tracklist.audio;

import com.scholary.tracklist.objectstore.ObjectStoreClient;
import com.scholary.tracklist.objectstore.ObjectStoreException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audio source reading headerless PCM straight out of object storage.
 *
 * <p>Each {@link #readRange(double, double)} is one ranged GET, so a multi-hour mix is never held
 * in memory. The object length is fetched once, on construction.
 */
public class ObjectStoreAudioSource implements AudioSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreAudioSource.class);

  private final ObjectStoreClient objectStoreClient;
  private final String bucket;
  private final String key;
  private final PcmFormat format;
  private final long contentLength;

  public ObjectStoreAudioSource(
      ObjectStoreClient objectStoreClient, String bucket, String key, PcmFormat format) {
    this.objectStoreClient = Objects.requireNonNull(objectStoreClient, "objectStoreClient");
    this.bucket = Objects.requireNonNull(bucket, "bucket");
    this.key = Objects.requireNonNull(key, "key");
    this.format = Objects.requireNonNull(format, "format");
    try {
      this.contentLength = objectStoreClient.getObjectMetadata(bucket, key).contentLength();
    } catch (ObjectStoreException e) {
      throw new AudioSourceException("Cannot open audio object " + sourceId(), e);
    }
    LOGGER.info(
        "Opened audio source: {} ({} bytes, {}s)",
        sourceId(),
        contentLength,
        String.format("%.1f", durationSeconds()));
  }

  @Override
  public String sourceId() {
    return "s3://" + bucket + "/" + key;
  }

  @Override
  public PcmFormat format() {
    return format;
  }

  @Override
  public double durationSeconds() {
    return format.secondsFor(contentLength);
  }

  @Override
  public byte[] readRange(double startSeconds, double durationSeconds) {
    long startByte = Math.min(format.byteOffset(Math.max(0, startSeconds)), contentLength);
    long endExclusive = Math.min(format.byteOffset(startSeconds + durationSeconds), contentLength);
    if (endExclusive <= startByte) {
      return new byte[0];
    }
    try {
      return objectStoreClient.readRange(bucket, key, startByte, endExclusive - 1);
    } catch (ObjectStoreException e) {
      throw new AudioSourceException(
          String.format("Failed to read %s at %.1fs", sourceId(), startSeconds), e);
    }
  }
}

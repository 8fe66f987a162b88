package com.scholary.tracklist.audio;

import java.util.Arrays;
import java.util.Objects;

/** Audio source backed by a PCM byte array. */
public class InMemoryAudioSource implements AudioSource {

  private final String sourceId;
  private final PcmFormat format;
  private final byte[] pcm;

  public InMemoryAudioSource(String sourceId, PcmFormat format, byte[] pcm) {
    this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
    this.format = Objects.requireNonNull(format, "format");
    this.pcm = Objects.requireNonNull(pcm, "pcm");
  }

  @Override
  public String sourceId() {
    return sourceId;
  }

  @Override
  public PcmFormat format() {
    return format;
  }

  @Override
  public double durationSeconds() {
    return format.secondsFor(pcm.length);
  }

  @Override
  public byte[] readRange(double startSeconds, double durationSeconds) {
    int from = (int) Math.min(format.byteOffset(Math.max(0, startSeconds)), pcm.length);
    int to = (int) Math.min(format.byteOffset(startSeconds + durationSeconds), pcm.length);
    if (to <= from) {
      return new byte[0];
    }
    return Arrays.copyOfRange(pcm, from, to);
  }
}

package com.scholary.tracklist.segment;

import com.scholary.tracklist.audio.PcmFormat;

/**
 * A time-bounded slice of a recording, ready to be sent to a recognition service.
 *
 * <p>{@code index} is dense and 0-based. {@code samples} is raw PCM in {@code format}; it may be
 * empty for sources that cannot be read ahead of identification. Nobody writes to the array after
 * the segmenter hands it out.
 */
public record AudioSegment(
    int index,
    String sourceId,
    double startOffsetSeconds,
    double durationSeconds,
    PcmFormat format,
    byte[] samples) {

  public double endOffsetSeconds() {
    return startOffsetSeconds + durationSeconds;
  }

  public boolean hasSamples() {
    return samples != null && samples.length > 0;
  }
}

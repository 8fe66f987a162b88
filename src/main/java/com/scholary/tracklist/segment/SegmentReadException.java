package com.scholary.tracklist.segment;

import com.scholary.tracklist.audio.AudioSourceException;

/**
 * The audio of one segment could not be read.
 *
 * <p>Carries the segment's position so the caller can skip it and keep iterating; the iterator
 * has already moved past it.
 */
public class SegmentReadException extends AudioSourceException {

  private final AudioSegment segment;

  public SegmentReadException(AudioSegment segment, AudioSourceException cause) {
    super(
        String.format(
            "Cannot read segment %d (%ss - %ss) of %s: %s",
            segment.index(),
            segment.startOffsetSeconds(),
            segment.endOffsetSeconds(),
            segment.sourceId(),
            cause.getMessage()),
        cause);
    this.segment = segment;
  }

  /** The segment that failed, without samples. */
  public AudioSegment getSegment() {
    return segment;
  }
}

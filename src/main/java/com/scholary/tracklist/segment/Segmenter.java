package com.scholary.tracklist.segment;

import com.scholary.tracklist.audio.AudioSource;
import com.scholary.tracklist.audio.AudioSourceException;
import com.scholary.tracklist.config.ConfigurationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fixed-length segmentation with optional overlap.
 *
 * <p>Segment {@code i} starts at {@code i * (length - overlap)}. The last segment is truncated to
 * what is left of the recording and is the first one whose end reaches the end of the source.
 *
 * <p>Example with 60s segments and 10s overlap over a 150s mix:
 *
 * <pre>
 * Segment 0:   0s -  60s
 * Segment 1:  50s - 110s
 * Segment 2: 100s - 150s (truncated)
 * </pre>
 *
 * <p>The returned {@link Iterable} is lazy (audio is read as the iterator advances) and can be
 * iterated again with the same result. A failed read surfaces from {@code next()} as a {@link
 * SegmentReadException}; iteration can continue with the following segment.
 */
@Component
public class Segmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(Segmenter.class);
  private static final double EPSILON = 1e-9;

  public Iterable<AudioSegment> segment(
      AudioSource source, double segmentLengthSeconds, double overlapSeconds) {
    validate(segmentLengthSeconds, overlapSeconds);
    LOGGER.info(
        "Segmenting {}: duration={}s, segmentLength={}s, overlap={}s",
        source.sourceId(),
        source.durationSeconds(),
        segmentLengthSeconds,
        overlapSeconds);
    return () -> new SegmentIterator(source, segmentLengthSeconds, overlapSeconds);
  }

  /**
   * Number of segments {@link #segment} will produce for a recording of the given duration.
   *
   * @param durationSeconds total duration of the recording
   * @param segmentLengthSeconds segment length
   * @param overlapSeconds overlap between consecutive segments
   * @return the segment count, 0 for an empty recording
   */
  public int countSegments(
      double durationSeconds, double segmentLengthSeconds, double overlapSeconds) {
    validate(segmentLengthSeconds, overlapSeconds);
    if (durationSeconds <= EPSILON) {
      return 0;
    }
    if (durationSeconds <= segmentLengthSeconds + EPSILON) {
      return 1;
    }
    double step = segmentLengthSeconds - overlapSeconds;
    return (int) Math.ceil((durationSeconds - segmentLengthSeconds) / step - EPSILON) + 1;
  }

  private static void validate(double segmentLengthSeconds, double overlapSeconds) {
    if (segmentLengthSeconds <= 0) {
      throw new ConfigurationException(
          "segmentLengthSeconds must be positive, got " + segmentLengthSeconds);
    }
    if (overlapSeconds < 0) {
      throw new ConfigurationException(
          "overlapSeconds must not be negative, got " + overlapSeconds);
    }
    if (overlapSeconds >= segmentLengthSeconds) {
      throw new ConfigurationException(
          String.format(
              "overlapSeconds (%s) must be less than segmentLengthSeconds (%s)",
              overlapSeconds, segmentLengthSeconds));
    }
  }

  private static final class SegmentIterator implements Iterator<AudioSegment> {

    private final AudioSource source;
    private final double length;
    private final double step;
    private final double totalDuration;
    private int nextIndex;
    private boolean reachedEnd;

    SegmentIterator(AudioSource source, double length, double overlap) {
      this.source = source;
      this.length = length;
      this.step = length - overlap;
      this.totalDuration = source.durationSeconds();
    }

    @Override
    public boolean hasNext() {
      return !reachedEnd && nextIndex * step < totalDuration - EPSILON;
    }

    @Override
    public AudioSegment next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      int index = nextIndex++;
      double start = index * step;
      double duration = Math.min(length, totalDuration - start);
      if (start + duration >= totalDuration - EPSILON) {
        reachedEnd = true;
      }

      byte[] samples;
      try {
        samples = source.readRange(start, duration);
      } catch (AudioSourceException e) {
        throw new SegmentReadException(
            new AudioSegment(index, source.sourceId(), start, duration, source.format(), null),
            e);
      }
      LOGGER.debug(
          "Segment {}: {}s - {}s ({} bytes)", index, start, start + duration, samples.length);
      return new AudioSegment(
          index, source.sourceId(), start, duration, source.format(), samples);
    }
  }
}

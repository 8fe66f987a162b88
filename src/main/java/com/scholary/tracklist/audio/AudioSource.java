package com.scholary.tracklist.audio;

/**
 * Readable handle on an already-normalized audio recording.
 *
 * <p>Implementations wrap wherever the audio actually lives (memory, object storage). Sample rate
 * and channel layout are fixed by {@link #format()}; conversion happens upstream.
 */
public interface AudioSource {

  /**
   * Stable identifier of the recording, used for logging and as a cache-key fallback.
   *
   * @return the source id
   */
  String sourceId();

  /**
   * PCM layout of the bytes returned by {@link #readRange(double, double)}.
   *
   * @return the PCM format
   */
  PcmFormat format();

  /**
   * Total duration of the recording.
   *
   * @return duration in seconds
   */
  double durationSeconds();

  /**
   * Read raw PCM for a time window.
   *
   * <p>The window is clamped to the end of the recording. Offsets are aligned to whole frames.
   *
   * @param startSeconds window start in seconds
   * @param durationSeconds window length in seconds
   * @return the PCM bytes, possibly empty when the window lies past the end
   * @throws AudioSourceException if the underlying storage cannot be read
   */
  byte[] readRange(double startSeconds, double durationSeconds);
}

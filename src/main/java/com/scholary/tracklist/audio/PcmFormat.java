package com.scholary.tracklist.audio;

/**
 * Layout of signed little-endian PCM audio.
 *
 * <p>Used to turn time offsets into byte offsets when reading ranges of a recording.
 */
public record PcmFormat(int sampleRate, int channels, int bitsPerSample) {

  /** 44.1 kHz, stereo, 16 bit. What recognition services expect by default. */
  public static final PcmFormat CD_QUALITY = new PcmFormat(44100, 2, 16);

  public PcmFormat {
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("Sample rate must be positive");
    }
    if (channels <= 0) {
      throw new IllegalArgumentException("Channel count must be positive");
    }
    if (bitsPerSample <= 0 || bitsPerSample % 8 != 0) {
      throw new IllegalArgumentException("Bits per sample must be a positive multiple of 8");
    }
  }

  public int frameSize() {
    return channels * (bitsPerSample / 8);
  }

  public long bytesPerSecond() {
    return (long) sampleRate * frameSize();
  }

  /**
   * Convert a time offset to a byte offset aligned to a frame boundary.
   *
   * @param seconds offset in seconds
   * @return byte offset, rounded down to a whole frame
   */
  public long byteOffset(double seconds) {
    long frames = (long) Math.floor(seconds * sampleRate);
    return frames * frameSize();
  }

  public double secondsFor(long byteCount) {
    return (double) (byteCount / frameSize()) / sampleRate;
  }
}

package com.scholary.tracklist.cache;

import com.scholary.tracklist.audio.PcmFormat;
import com.scholary.tracklist.segment.AudioSegment;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Deterministic cache key for a segment.
 *
 * <p>Segments with samples are keyed by a SHA-256 of the PCM format and bytes, so identical audio
 * hits the same entry whichever mix or offset it came from. Segments without samples fall back to
 * {@code sourceId|offset|duration}.
 */
public final class SegmentFingerprint {

  private SegmentFingerprint() {}

  public static String of(AudioSegment segment) {
    MessageDigest digest = sha256();
    if (segment.hasSamples()) {
      PcmFormat format = segment.format();
      digest.update(
          ByteBuffer.allocate(12)
              .putInt(format.sampleRate())
              .putInt(format.channels())
              .putInt(format.bitsPerSample())
              .array());
      digest.update(segment.samples());
      return "pcm-" + HexFormat.of().formatHex(digest.digest());
    }
    String position =
        String.format(
            Locale.ROOT,
            "%s|%.3f|%.3f",
            segment.sourceId(),
            segment.startOffsetSeconds(),
            segment.durationSeconds());
    byte[] hash = digest.digest(position.getBytes(StandardCharsets.UTF_8));
    return "pos-" + HexFormat.of().formatHex(hash);
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }
}

package com.scholary.tracklist.audio;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * Wraps raw PCM in a minimal RIFF/WAVE container.
 *
 * <p>Recognition services accept WAV uploads; the segments we hold are headerless PCM.
 */
public final class WavEncoder {

  private static final int HEADER_SIZE = 44;

  private WavEncoder() {}

  public static byte[] encode(byte[] pcm, PcmFormat format) {
    Objects.requireNonNull(pcm, "pcm must not be null");
    Objects.requireNonNull(format, "format must not be null");

    ByteArrayOutputStream out = new ByteArrayOutputStream(HEADER_SIZE + pcm.length);
    out.writeBytes(new byte[] {'R', 'I', 'F', 'F'});
    writeLeInt(out, 36 + pcm.length);
    out.writeBytes(new byte[] {'W', 'A', 'V', 'E'});

    out.writeBytes(new byte[] {'f', 'm', 't', ' '});
    writeLeInt(out, 16);
    writeLeShort(out, 1); // PCM
    writeLeShort(out, format.channels());
    writeLeInt(out, format.sampleRate());
    writeLeInt(out, (int) format.bytesPerSecond());
    writeLeShort(out, format.frameSize());
    writeLeShort(out, format.bitsPerSample());

    out.writeBytes(new byte[] {'d', 'a', 't', 'a'});
    writeLeInt(out, pcm.length);
    out.writeBytes(pcm);
    return out.toByteArray();
  }

  private static void writeLeShort(ByteArrayOutputStream out, int v) {
    out.write(v & 0xFF);
    out.write((v >>> 8) & 0xFF);
  }

  private static void writeLeInt(ByteArrayOutputStream out, int v) {
    out.write(v & 0xFF);
    out.write((v >>> 8) & 0xFF);
    out.write((v >>> 16) & 0xFF);
    out.write((v >>> 24) & 0xFF);
  }
}

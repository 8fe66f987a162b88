package com.scholary.tracklist.audio;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class WavEncoderTest {

  @Test
  void encode_shouldWriteCanonicalHeader() {
    byte[] pcm = new byte[400];
    byte[] wav = WavEncoder.encode(pcm, PcmFormat.CD_QUALITY);

    ByteBuffer header = ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN);
    assertThat(wav).hasSize(444);
    assertThat(new String(wav, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("RIFF");
    assertThat(header.getInt(4)).isEqualTo(436);
    assertThat(new String(wav, 8, 4, StandardCharsets.US_ASCII)).isEqualTo("WAVE");
    assertThat(header.getShort(20)).isEqualTo((short) 1);
    assertThat(header.getShort(22)).isEqualTo((short) 2);
    assertThat(header.getInt(24)).isEqualTo(44100);
    assertThat(header.getInt(28)).isEqualTo(176400);
    assertThat(header.getShort(32)).isEqualTo((short) 4);
    assertThat(header.getShort(34)).isEqualTo((short) 16);
    assertThat(new String(wav, 36, 4, StandardCharsets.US_ASCII)).isEqualTo("data");
    assertThat(header.getInt(40)).isEqualTo(400);
  }
}

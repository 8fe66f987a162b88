package com.scholary.tracklist.audio;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class InMemoryAudioSourceTest {

  private final PcmFormat format = new PcmFormat(10, 1, 8);
  private final byte[] pcm = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14};
  private final InMemoryAudioSource source = new InMemoryAudioSource("mem://mix", format, pcm);

  @Test
  void durationSeconds_shouldFollowFromByteCount() {
    assertThat(source.durationSeconds()).isEqualTo(1.5);
  }

  @Test
  void readRange_shouldReturnBytesOfTheRange() {
    assertThat(source.readRange(0.5, 0.3)).containsExactly(5, 6, 7);
  }

  @Test
  void readRange_shouldClampToEndOfSource() {
    assertThat(source.readRange(1.0, 10.0)).containsExactly(10, 11, 12, 13, 14);
  }

  @Test
  void readRange_shouldReturnEmptyPastTheEnd() {
    assertThat(source.readRange(2.0, 1.0)).isEmpty();
  }
}

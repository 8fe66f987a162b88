package com.scholary.tracklist.segment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.tracklist.audio.AudioSourceException;
import com.scholary.tracklist.audio.InMemoryAudioSource;
import com.scholary.tracklist.audio.TestAudio;
import com.scholary.tracklist.config.ConfigurationException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.Test;

class SegmenterTest {

  private final Segmenter segmenter = new Segmenter();

  @Test
  void segment_shouldSplitWithOverlapAndTruncateLastSegment() {
    InMemoryAudioSource source = TestAudio.noise("mix", 150);

    List<AudioSegment> segments = collect(segmenter.segment(source, 60, 10));

    assertThat(segments).extracting(AudioSegment::index).containsExactly(0, 1, 2);
    assertThat(segments)
        .extracting(AudioSegment::startOffsetSeconds)
        .containsExactly(0.0, 50.0, 100.0);
    assertThat(segments)
        .extracting(AudioSegment::durationSeconds)
        .containsExactly(60.0, 60.0, 50.0);
    assertThat(segments.get(2).samples()).hasSize(5000);
  }

  @Test
  void segment_shouldCoverWholeDurationWithoutGaps() {
    InMemoryAudioSource source = TestAudio.noise("mix", 1234.5);

    List<AudioSegment> segments = collect(segmenter.segment(source, 45, 5));

    assertThat(segments.get(0).startOffsetSeconds()).isZero();
    for (int i = 1; i < segments.size(); i++) {
      AudioSegment previous = segments.get(i - 1);
      AudioSegment current = segments.get(i);
      assertThat(current.startOffsetSeconds()).isGreaterThan(previous.startOffsetSeconds());
      assertThat(current.startOffsetSeconds()).isLessThanOrEqualTo(previous.endOffsetSeconds());
    }
    assertThat(segments.get(segments.size() - 1).endOffsetSeconds()).isEqualTo(1234.5);
    assertThat(segments).hasSize(segmenter.countSegments(1234.5, 45, 5));
  }

  @Test
  void segment_shouldKeepShortFinalSegment() {
    InMemoryAudioSource source = TestAudio.noise("mix", 121);

    List<AudioSegment> segments = collect(segmenter.segment(source, 60, 0));

    assertThat(segments).hasSize(3);
    assertThat(segments.get(2).durationSeconds()).isEqualTo(1.0);
  }

  @Test
  void segment_shouldYieldSingleSegmentForShortSource() {
    InMemoryAudioSource source = TestAudio.noise("mix", 20);

    List<AudioSegment> segments = collect(segmenter.segment(source, 60, 10));

    assertThat(segments).hasSize(1);
    assertThat(segments.get(0).durationSeconds()).isEqualTo(20.0);
  }

  @Test
  void segment_shouldYieldNothingForEmptySource() {
    InMemoryAudioSource source = TestAudio.noise("mix", 0);

    assertThat(collect(segmenter.segment(source, 60, 0))).isEmpty();
    assertThat(segmenter.countSegments(0, 60, 0)).isZero();
  }

  @Test
  void segment_shouldBeRestartable() {
    Iterable<AudioSegment> segments = segmenter.segment(TestAudio.noise("mix", 200), 60, 15);

    List<AudioSegment> first = collect(segments);
    List<AudioSegment> second = collect(segments);

    assertThat(second).hasSameSizeAs(first);
    for (int i = 0; i < first.size(); i++) {
      assertThat(second.get(i).startOffsetSeconds()).isEqualTo(first.get(i).startOffsetSeconds());
      assertThat(second.get(i).samples()).isEqualTo(first.get(i).samples());
    }
  }

  @Test
  void segment_shouldRejectOverlapNotShorterThanSegment() {
    InMemoryAudioSource source = TestAudio.noise("mix", 100);

    assertThatThrownBy(() -> segmenter.segment(source, 30, 30))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("overlapSeconds");
  }

  @Test
  void segment_shouldRejectNegativeOverlap() {
    assertThatThrownBy(() -> segmenter.segment(TestAudio.noise("mix", 100), 30, -1))
        .isInstanceOf(ConfigurationException.class);
  }

  private static List<AudioSegment> collect(Iterable<AudioSegment> segments) {
    List<AudioSegment> list = new ArrayList<>();
    segments.forEach(list::add);
    return list;
  }

  @Test
  void segment_shouldReportFailedReadAndContinueWithNextSegment() {
    InMemoryAudioSource audio = TestAudio.noise("mix", 150);
    InMemoryAudioSource flaky =
        new InMemoryAudioSource("mix", audio.format(), audio.readRange(0, 150)) {
          @Override
          public byte[] readRange(double startSeconds, double durationSeconds) {
            if (startSeconds == 60.0) {
              throw new AudioSourceException("connection reset");
            }
            return super.readRange(startSeconds, durationSeconds);
          }
        };

    Iterator<AudioSegment> iterator = segmenter.segment(flaky, 60, 0).iterator();
    AudioSegment first = iterator.next();

    assertThatThrownBy(iterator::next)
        .isInstanceOfSatisfying(
            SegmentReadException.class,
            e -> {
              assertThat(e.getSegment().index()).isEqualTo(1);
              assertThat(e.getSegment().startOffsetSeconds()).isEqualTo(60.0);
              assertThat(e.getSegment().hasSamples()).isFalse();
              assertThat(e.getCause()).hasMessage("connection reset");
            });
    AudioSegment third = iterator.next();

    assertThat(first.index()).isZero();
    assertThat(third.index()).isEqualTo(2);
    assertThat(third.durationSeconds()).isEqualTo(30.0);
    assertThat(iterator.hasNext()).isFalse();
  }
}

package com.scholary.tracklist.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import com.scholary.tracklist.objectstore.ObjectNotFoundException;
import com.scholary.tracklist.objectstore.ObjectStoreClient;
import com.scholary.tracklist.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.tracklist.objectstore.ObjectStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ObjectStoreAudioSourceTest {

  private static final PcmFormat FORMAT = new PcmFormat(100, 1, 16);

  @Mock private ObjectStoreClient objectStoreClient;

  @Test
  void durationSeconds_shouldFollowFromObjectLength() {
    when(objectStoreClient.getObjectMetadata("mixes", "set.pcm"))
        .thenReturn(new ObjectMetadata(30_000, "application/octet-stream"));

    ObjectStoreAudioSource source =
        new ObjectStoreAudioSource(objectStoreClient, "mixes", "set.pcm", FORMAT);

    assertThat(source.durationSeconds()).isEqualTo(150.0);
    assertThat(source.sourceId()).isEqualTo("s3://mixes/set.pcm");
  }

  @Test
  void readRange_shouldIssueOneRangedReadClampedToObject() {
    when(objectStoreClient.getObjectMetadata("mixes", "set.pcm"))
        .thenReturn(new ObjectMetadata(30_000, "application/octet-stream"));
    when(objectStoreClient.readRange("mixes", "set.pcm", 24_000, 29_999))
        .thenReturn(new byte[6_000]);
    ObjectStoreAudioSource source =
        new ObjectStoreAudioSource(objectStoreClient, "mixes", "set.pcm", FORMAT);

    byte[] bytes = source.readRange(120.0, 60.0);

    assertThat(bytes).hasSize(6_000);
    verify(objectStoreClient).getObjectMetadata("mixes", "set.pcm");
    verify(objectStoreClient).readRange("mixes", "set.pcm", 24_000, 29_999);
    verifyNoMoreInteractions(objectStoreClient);
  }

  @Test
  void readRange_shouldNotCallStorePastTheEnd() {
    when(objectStoreClient.getObjectMetadata("mixes", "set.pcm"))
        .thenReturn(new ObjectMetadata(200, "application/octet-stream"));
    ObjectStoreAudioSource source =
        new ObjectStoreAudioSource(objectStoreClient, "mixes", "set.pcm", FORMAT);

    assertThat(source.readRange(5.0, 1.0)).isEmpty();
  }

  @Test
  void constructor_shouldWrapMissingObject() {
    when(objectStoreClient.getObjectMetadata("mixes", "gone.pcm"))
        .thenThrow(new ObjectNotFoundException("mixes", "gone.pcm", null));

    assertThatThrownBy(
            () -> new ObjectStoreAudioSource(objectStoreClient, "mixes", "gone.pcm", FORMAT))
        .isInstanceOf(AudioSourceException.class)
        .hasCauseInstanceOf(ObjectNotFoundException.class);
  }

  @Test
  void readRange_shouldWrapStoreFailures() {
    when(objectStoreClient.getObjectMetadata("mixes", "set.pcm"))
        .thenReturn(new ObjectMetadata(30_000, "application/octet-stream"));
    when(objectStoreClient.readRange(eq("mixes"), eq("set.pcm"), anyLong(), anyLong()))
        .thenThrow(new ObjectStoreException("reset"));
    ObjectStoreAudioSource source =
        new ObjectStoreAudioSource(objectStoreClient, "mixes", "set.pcm", FORMAT);

    assertThatThrownBy(() -> source.readRange(0, 60))
        .isInstanceOf(AudioSourceException.class)
        .hasMessageContaining("s3://mixes/set.pcm");
  }
}

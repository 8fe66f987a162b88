package com.scholary.tracklist.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;

/** Runs the S3 client against a real MinIO. Skipped when Docker is not available. */
@Testcontainers(disabledWithoutDocker = true)
class S3ObjectStoreClientIntegrationTest {

  private static final String ACCESS_KEY = "minioadmin";
  private static final String SECRET_KEY = "minioadmin";
  private static final String BUCKET = "mixes";

  @Container
  static GenericContainer<?> minio =
      new GenericContainer<>("minio/minio:latest")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  private static S3ObjectStoreClient client;

  @BeforeAll
  static void setUp() {
    String endpoint = String.format("http://%s:%d", minio.getHost(), minio.getMappedPort(9000));
    S3Client s3 =
        S3Client.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(ACCESS_KEY, SECRET_KEY)))
            .endpointOverride(URI.create(endpoint))
            .forcePathStyle(true)
            .build();
    s3.createBucket(CreateBucketRequest.builder().bucket(BUCKET).build());
    client = new S3ObjectStoreClient(s3);
  }

  @AfterAll
  static void tearDown() {
    if (client != null) {
      client.close();
    }
  }

  @Test
  void writeAndRead_shouldRoundTripSmallObject() {
    client.writeObject(BUCKET, "cache/pcm-1.json", "{\"a\":1}".getBytes(), "application/json");

    assertThat(new String(client.readObject(BUCKET, "cache/pcm-1.json"))).isEqualTo("{\"a\":1}");
    assertThat(client.getObjectMetadata(BUCKET, "cache/pcm-1.json").contentLength()).isEqualTo(7);
  }

  @Test
  void readRange_shouldReturnOnlyRequestedBytes() {
    byte[] pcm = new byte[1000];
    for (int i = 0; i < pcm.length; i++) {
      pcm[i] = (byte) i;
    }
    client.writeObject(BUCKET, "set.pcm", pcm, "application/octet-stream");

    byte[] range = client.readRange(BUCKET, "set.pcm", 300, 303);

    assertThat(range).containsExactly((byte) 300, (byte) 301, (byte) 302, (byte) 303);
  }

  @Test
  void getObjectMetadata_shouldReportMissingObject() {
    assertThatThrownBy(() -> client.getObjectMetadata(BUCKET, "nope.pcm"))
        .isInstanceOf(ObjectNotFoundException.class);
  }
}

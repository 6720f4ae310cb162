package com.scholary.dubber.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
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

/**
 * Round trip against a real MinIO server.
 *
 * <p>Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class S3ObjectStoreClientMinioTest {

  private static final String ACCESS_KEY = "minioadmin";
  private static final String SECRET_KEY = "minioadmin";
  private static final String BUCKET = "audio-test";

  @Container
  static GenericContainer<?> minioContainer =
      new GenericContainer<>("minio/minio:RELEASE.2024-01-16T16-07-38Z")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  private static S3ObjectStoreClient client;

  @BeforeAll
  static void setUp() {
    String endpoint =
        String.format("http://%s:%d", minioContainer.getHost(), minioContainer.getMappedPort(9000));
    ObjectStoreProperties properties =
        new ObjectStoreProperties(
            endpoint, ACCESS_KEY, SECRET_KEY, BUCKET, "us-east-1", true, false, "dubbed");
    try (S3Client admin =
        S3Client.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(ACCESS_KEY, SECRET_KEY)))
            .endpointOverride(URI.create(endpoint))
            .forcePathStyle(true)
            .build()) {
      admin.createBucket(CreateBucketRequest.builder().bucket(BUCKET).build());
    }
    client = new S3ObjectStoreClient(properties);
  }

  @AfterAll
  static void tearDown() {
    if (client != null) {
      client.close();
    }
  }

  @Test
  void putObject_shouldBeReadableBack() throws Exception {
    byte[] content = "1\n00:00:00,000 --> 00:00:01,000\nHola\n".getBytes(StandardCharsets.UTF_8);

    client.putObject(
        BUCKET,
        "dubbed/job-1/es/job-1-es-captions.srt",
        new ByteArrayInputStream(content),
        content.length,
        "application/x-subrip");

    try (InputStream stream =
        client.getObjectStream(BUCKET, "dubbed/job-1/es/job-1-es-captions.srt")) {
      assertThat(stream.readAllBytes()).isEqualTo(content);
    }
  }

  @Test
  void getObjectStream_shouldFailForMissingKey() {
    assertThatThrownBy(() -> client.getObjectStream(BUCKET, "in/missing.wav"))
        .isInstanceOf(ObjectStoreException.class);
  }
}

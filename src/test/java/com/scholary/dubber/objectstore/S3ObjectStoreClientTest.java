package com.scholary.dubber.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

@ExtendWith(MockitoExtension.class)
class S3ObjectStoreClientTest {

  @Mock private S3Client s3Client;

  private S3ObjectStoreClient client;

  @BeforeEach
  void setUp() {
    client = new S3ObjectStoreClient(s3Client);
  }

  @Test
  void getObjectStream_shouldReturnObjectContent() throws Exception {
    byte[] content = "RIFF".getBytes(StandardCharsets.US_ASCII);
    when(s3Client.getObject(any(GetObjectRequest.class)))
        .thenReturn(
            new ResponseInputStream<>(
                GetObjectResponse.builder().build(),
                AbortableInputStream.create(new ByteArrayInputStream(content))));

    try (InputStream stream = client.getObjectStream("audio", "in/voice.wav")) {
      assertThat(stream.readAllBytes()).isEqualTo(content);
    }
  }

  @Test
  void getObjectStream_shouldThrowExceptionForNonExistentObject() {
    when(s3Client.getObject(any(GetObjectRequest.class)))
        .thenThrow(NoSuchKeyException.builder().message("missing").build());

    assertThatThrownBy(() -> client.getObjectStream("audio", "in/missing.wav"))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageContaining("Object not found")
        .hasMessageContaining("in/missing.wav");
  }

  @Test
  void putObject_shouldSendKeyContentTypeAndLength() {
    byte[] content = "hello".getBytes(StandardCharsets.UTF_8);

    client.putObject(
        "audio", "dubbed/job-1/es/captions.srt", new ByteArrayInputStream(content), 5, "text/srt");

    ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
    PutObjectRequest request = captor.getValue();
    assertThat(request.bucket()).isEqualTo("audio");
    assertThat(request.key()).isEqualTo("dubbed/job-1/es/captions.srt");
    assertThat(request.contentType()).isEqualTo("text/srt");
    assertThat(request.contentLength()).isEqualTo(5L);
  }

  @Test
  void putObject_shouldWrapServiceErrors() {
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenThrow(S3Exception.builder().statusCode(403).message("denied").build());

    assertThatThrownBy(
            () ->
                client.putObject(
                    "audio", "k", new ByteArrayInputStream(new byte[1]), 1, "audio/wav"))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageContaining("statusCode=403");
  }

  @Test
  void close_shouldCloseUnderlyingClient() {
    client.close();

    verify(s3Client).close();
  }
}

package com.scholary.dubber.provider;

import com.scholary.dubber.logging.StructuredLogger;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Blocking HTTP client shared by the provider adapters.
 *
 * <p>Transient failures (I/O errors, HTTP 429 and 5xx) are retried with exponential backoff and
 * jitter. Other non-2xx responses fail immediately since repeating them cannot succeed. Response
 * bodies are returned as raw bytes; adapters decide whether they hold JSON or audio.
 */
@Component
public class ProviderHttpClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProviderHttpClient.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final int MAX_ERROR_BODY_CHARS = 300;

  private final HttpClient httpClient;
  private final ProviderProperties.Http properties;

  public ProviderHttpClient(ProviderProperties properties) {
    this.properties = properties.http();
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(this.properties.connectTimeout()))
            .build();
  }

  /** Per-request timeout to set on requests built by adapters. */
  public Duration requestTimeout() {
    return Duration.ofSeconds(properties.readTimeout());
  }

  /**
   * Send a request, retrying transient failures.
   *
   * @param provider provider name for logs and error messages
   * @param request the request; it is resent unchanged on retry
   * @return the response body
   * @throws ProviderCallException when the call fails permanently or retries are exhausted
   */
  public byte[] send(String provider, HttpRequest request) {
    int maxRetries = properties.maxRetries();
    int attempt = 0;
    Exception lastException = null;

    while (attempt < maxRetries) {
      try {
        HttpResponse<byte[]> response =
            httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
          return response.body();
        }

        String message =
            String.format("%s returned status %d: %s", provider, status, snippet(response.body()));
        if (status != 429 && status < 500) {
          STRUCTURED_LOGGER.logProviderFailed(provider, attempt + 1, "HttpStatus", message);
          throw new ProviderCallException(message, status);
        }
        lastException = new IOException(message);

      } catch (IOException e) {
        lastException = e;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ProviderCallException(provider + " call interrupted", e);
      }

      attempt++;
      if (attempt < maxRetries) {
        // Exponential backoff with jitter
        long base = properties.backoffBaseMillis();
        long backoffMs = (long) (Math.pow(2, attempt) * base + Math.random() * base);
        STRUCTURED_LOGGER.logProviderRetry(
            provider,
            attempt,
            maxRetries,
            lastException.getClass().getSimpleName(),
            lastException.getMessage());
        try {
          Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new ProviderCallException(provider + " call interrupted", ie);
        }
      }
    }

    STRUCTURED_LOGGER.logProviderFailed(
        provider,
        maxRetries,
        lastException == null ? "Unknown" : lastException.getClass().getSimpleName(),
        lastException == null ? "" : lastException.getMessage());
    throw new ProviderCallException(
        String.format("%s call failed after %d attempts", provider, maxRetries), lastException);
  }

  private static String snippet(byte[] body) {
    String text = new String(body, StandardCharsets.UTF_8);
    return text.length() <= MAX_ERROR_BODY_CHARS ? text : text.substring(0, MAX_ERROR_BODY_CHARS);
  }
}

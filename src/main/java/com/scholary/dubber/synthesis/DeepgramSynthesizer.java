package com.scholary.dubber.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubber.provider.ProviderCallException;
import com.scholary.dubber.provider.ProviderHttpClient;
import com.scholary.dubber.provider.ProviderProperties;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.springframework.stereotype.Component;

/** {@link Synthesizer} backed by Deepgram's Aura speak endpoint. */
@Component
public class DeepgramSynthesizer implements Synthesizer {

  private static final String PROVIDER = "deepgram-tts";

  private final ProviderHttpClient httpClient;
  private final ProviderProperties.Deepgram properties;
  private final ObjectMapper objectMapper;

  public DeepgramSynthesizer(
      ProviderHttpClient httpClient, ProviderProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties.deepgram();
    this.objectMapper = objectMapper;
  }

  @Override
  public byte[] generateSpeech(String text, String targetLanguage, String voiceId) {
    String uri =
        String.format(
            "%s/v1/speak?model=%s&encoding=%s",
            properties.baseUrl(),
            URLEncoder.encode(voiceId, StandardCharsets.UTF_8),
            URLEncoder.encode(properties.ttsEncoding(), StandardCharsets.UTF_8));
    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(uri))
              .timeout(httpClient.requestTimeout())
              .header("Authorization", "Token " + properties.apiKey())
              .header("Content-Type", "application/json")
              .POST(
                  HttpRequest.BodyPublishers.ofByteArray(
                      objectMapper.writeValueAsBytes(Map.of("text", text))))
              .build();

      byte[] audio = httpClient.send(PROVIDER, request);
      if (audio.length == 0) {
        throw new SynthesisException("Speech synthesis returned no audio");
      }
      return audio;

    } catch (ProviderCallException e) {
      throw new SynthesisException("Speech synthesis request failed", e);
    } catch (JsonProcessingException e) {
      throw new SynthesisException("Speech synthesis request could not be built", e);
    }
  }
}

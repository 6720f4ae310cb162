package com.scholary.dubber.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubber.provider.ProviderCallException;
import com.scholary.dubber.provider.ProviderHttpClient;
import com.scholary.dubber.provider.ProviderProperties;
import java.net.URI;
import java.net.http.HttpRequest;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * {@link Synthesizer} backed by the OpenAI speech endpoint.
 *
 * <p>Used for languages the Aura voices do not cover. The configured voice is always used; the
 * per-speaker voice id is ignored.
 */
@Component
public class OpenAiSynthesizer implements Synthesizer {

  private static final String PROVIDER = "openai-tts";

  private final ProviderHttpClient httpClient;
  private final ProviderProperties.OpenAi properties;
  private final ObjectMapper objectMapper;

  public OpenAiSynthesizer(
      ProviderHttpClient httpClient, ProviderProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties.openai();
    this.objectMapper = objectMapper;
  }

  @Override
  public byte[] generateSpeech(String text, String targetLanguage, String voiceId) {
    Map<String, Object> payload =
        Map.of(
            "model", properties.ttsModel(),
            "voice", properties.ttsVoice(),
            "input", text,
            "response_format", "mp3");
    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/v1/audio/speech"))
              .timeout(httpClient.requestTimeout())
              .header("Authorization", "Bearer " + properties.apiKey())
              .header("Content-Type", "application/json")
              .POST(HttpRequest.BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(payload)))
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

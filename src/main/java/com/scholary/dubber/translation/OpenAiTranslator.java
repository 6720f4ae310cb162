package com.scholary.dubber.translation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubber.provider.ProviderCallException;
import com.scholary.dubber.provider.ProviderHttpClient;
import com.scholary.dubber.provider.ProviderProperties;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link Translator} backed by the OpenAI chat completions endpoint.
 *
 * <p>The system prompt names both languages and asks for the translated text only, so the reply
 * can be used verbatim.
 */
@Component
public class OpenAiTranslator implements Translator {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiTranslator.class);
  private static final String PROVIDER = "openai-translate";

  private final ProviderHttpClient httpClient;
  private final ProviderProperties.OpenAi properties;
  private final ObjectMapper objectMapper;

  public OpenAiTranslator(
      ProviderHttpClient httpClient, ProviderProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties.openai();
    this.objectMapper = objectMapper;
  }

  @Override
  public String translate(String text, String targetLanguage, String sourceLanguage) {
    String systemPrompt =
        String.format(
            "You are a professional translator. Translate the following text from %s to %s."
                + " Maintain the original tone, style, and meaning. Return only the translated"
                + " text.",
            LanguageNames.nameOf(sourceLanguage),
            LanguageNames.nameOf(targetLanguage));

    Map<String, Object> payload =
        Map.of(
            "model", properties.translationModel(),
            "temperature", properties.temperature(),
            "max_tokens", properties.maxTokens(),
            "messages",
                List.of(
                    Map.of("role", "system", "content", systemPrompt),
                    Map.of("role", "user", "content", text)));

    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/v1/chat/completions"))
              .timeout(httpClient.requestTimeout())
              .header("Authorization", "Bearer " + properties.apiKey())
              .header("Content-Type", "application/json")
              .POST(HttpRequest.BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(payload)))
              .build();

      JsonNode root = objectMapper.readTree(httpClient.send(PROVIDER, request));
      String translated = root.path("choices").path(0).path("message").path("content").asText("");
      if (translated.isBlank()) {
        throw new TranslationException("Translation response was empty");
      }

      LOGGER.debug(
          "Translated {} chars {} -> {}: {} chars",
          text.length(),
          sourceLanguage,
          targetLanguage,
          translated.length());
      return translated.trim();

    } catch (ProviderCallException e) {
      throw new TranslationException("Translation request failed", e);
    } catch (IOException e) {
      throw new TranslationException("Translation response could not be parsed", e);
    }
  }
}

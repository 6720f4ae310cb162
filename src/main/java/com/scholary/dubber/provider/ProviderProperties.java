package com.scholary.dubber.provider;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the external speech and language providers.
 *
 * <p>API keys are read from the environment through placeholders in application.yml and are never
 * logged.
 */
@ConfigurationProperties(prefix = "providers")
@Validated
public record ProviderProperties(
    @Valid @NotNull Http http, @Valid @NotNull Deepgram deepgram, @Valid @NotNull OpenAi openai) {

  /** Timeouts in seconds and retry policy shared by every provider call. */
  public record Http(
      @Positive int connectTimeout,
      @Positive int readTimeout,
      @Positive int maxRetries,
      @PositiveOrZero long backoffBaseMillis) {}

  public record Deepgram(
      @NotBlank String baseUrl,
      String apiKey,
      @NotBlank String sttModel,
      @NotBlank String ttsEncoding) {}

  public record OpenAi(
      @NotBlank String baseUrl,
      String apiKey,
      @NotBlank String translationModel,
      @PositiveOrZero double temperature,
      @Positive int maxTokens,
      @NotBlank String ttsModel,
      @NotBlank String ttsVoice) {}
}

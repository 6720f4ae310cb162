package com.scholary.dubber.voice;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Voice catalogs per target language, bound from the "voices.*" keys in application.yml.
 *
 * <p>Languages are keyed by code ({@code es}, {@code zh-CN}). {@code fallbackVoice} is used for
 * languages without an entry.
 */
@ConfigurationProperties(prefix = "voices")
@Validated
public record VoiceCatalogProperties(
    @NotBlank String fallbackVoice, Map<String, @Valid LanguageVoices> languages) {

  public VoiceCatalogProperties {
    languages = languages == null ? Map.of() : Map.copyOf(languages);
  }

  public record LanguageVoices(@NotBlank String defaultVoice, List<VoiceCatalogEntry> voices) {

    public LanguageVoices {
      voices = voices == null ? List.of() : List.copyOf(voices);
    }
  }
}

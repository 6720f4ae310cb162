package com.scholary.dubber.voice;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Read-only lookup of the voices available per target language.
 *
 * <p>A regional code falls back to its base language, so {@code es-MX} uses the {@code es}
 * catalog unless it has one of its own.
 */
@Component
public class VoiceCatalog {

  private final VoiceCatalogProperties properties;

  public VoiceCatalog(VoiceCatalogProperties properties) {
    this.properties = properties;
  }

  /** Voices for a language ordered by ascending pitch, empty when the language has no catalog. */
  public List<VoiceCatalogEntry> voicesFor(String language) {
    VoiceCatalogProperties.LanguageVoices voices = lookup(language);
    if (voices == null) {
      return List.of();
    }
    List<VoiceCatalogEntry> sorted = new ArrayList<>(voices.voices());
    sorted.sort(Comparator.comparingDouble(VoiceCatalogEntry::pitchHz));
    return List.copyOf(sorted);
  }

  /** Voice for speakers that cannot be matched by pitch. */
  public String defaultVoice(String language) {
    VoiceCatalogProperties.LanguageVoices voices = lookup(language);
    return voices == null ? properties.fallbackVoice() : voices.defaultVoice();
  }

  private VoiceCatalogProperties.LanguageVoices lookup(String language) {
    if (language == null) {
      return null;
    }
    VoiceCatalogProperties.LanguageVoices exact = properties.languages().get(language);
    if (exact != null) {
      return exact;
    }
    int dash = language.indexOf('-');
    String base = (dash > 0 ? language.substring(0, dash) : language).toLowerCase(Locale.ROOT);
    return properties.languages().get(base);
  }
}

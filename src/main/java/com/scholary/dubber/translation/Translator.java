package com.scholary.dubber.translation;

/** Machine translation service. */
public interface Translator {

  /**
   * Translate text.
   *
   * @param text source text
   * @param targetLanguage target language code
   * @param sourceLanguage source language code
   * @return the translated text only, without commentary
   * @throws TranslationException if translation fails
   */
  String translate(String text, String targetLanguage, String sourceLanguage);
}

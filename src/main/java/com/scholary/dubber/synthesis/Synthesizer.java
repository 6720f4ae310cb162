package com.scholary.dubber.synthesis;

/** Text-to-speech service. */
public interface Synthesizer {

  /**
   * Synthesize speech.
   *
   * @param text text to speak
   * @param targetLanguage language of the text
   * @param voiceId provider voice to use
   * @return encoded audio bytes in a format the audio tools can decode
   * @throws SynthesisException if synthesis fails
   */
  byte[] generateSpeech(String text, String targetLanguage, String voiceId);
}

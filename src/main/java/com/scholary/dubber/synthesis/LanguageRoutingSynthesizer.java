package com.scholary.dubber.synthesis;

import java.util.Locale;
import java.util.Set;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/** Routes Chinese to the OpenAI speech endpoint and every other language to Deepgram. */
@Component
@Primary
public class LanguageRoutingSynthesizer implements Synthesizer {

  private static final Set<String> OPENAI_LANGUAGES = Set.of("zh", "zh-cn", "zh-tw");

  private final DeepgramSynthesizer deepgram;
  private final OpenAiSynthesizer openAi;

  public LanguageRoutingSynthesizer(DeepgramSynthesizer deepgram, OpenAiSynthesizer openAi) {
    this.deepgram = deepgram;
    this.openAi = openAi;
  }

  @Override
  public byte[] generateSpeech(String text, String targetLanguage, String voiceId) {
    return routesToOpenAi(targetLanguage)
        ? openAi.generateSpeech(text, targetLanguage, voiceId)
        : deepgram.generateSpeech(text, targetLanguage, voiceId);
  }

  static boolean routesToOpenAi(String language) {
    return language != null && OPENAI_LANGUAGES.contains(language.toLowerCase(Locale.ROOT));
  }
}

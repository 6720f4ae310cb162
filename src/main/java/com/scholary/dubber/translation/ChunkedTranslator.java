package com.scholary.dubber.translation;

import com.scholary.dubber.text.TextChunker;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Translates text of any length by splitting it into chunks the provider accepts.
 *
 * <p>Chunks are translated strictly in order and the translations joined with a single space. A
 * failing chunk fails the whole text.
 */
@Component
public class ChunkedTranslator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedTranslator.class);

  private final Translator translator;
  private final TextChunker chunker;
  private final int maxChunkLength;

  public ChunkedTranslator(
      Translator translator,
      TextChunker chunker,
      @Value("${dubbing.chunking.maxChunkLength}") int maxChunkLength) {
    this.translator = translator;
    this.chunker = chunker;
    this.maxChunkLength = maxChunkLength;
  }

  /**
   * Translate text, chunking it when it exceeds the configured length.
   *
   * @throws TranslationException if any chunk fails
   */
  public String translate(String text, String targetLanguage, String sourceLanguage) {
    List<String> chunks = chunker.splitForProcessing(text, maxChunkLength);
    if (chunks.isEmpty()) {
      throw new TranslationException("Nothing to translate");
    }
    if (chunks.size() > 1) {
      LOGGER.info("Translating {} chars in {} chunks", text.length(), chunks.size());
    }

    List<String> translations = new ArrayList<>(chunks.size());
    for (String chunk : chunks) {
      translations.add(translator.translate(chunk, targetLanguage, sourceLanguage));
    }
    return String.join(" ", translations);
  }
}

package com.scholary.dubber.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Splits long text into provider-sized chunks.
 *
 * <p>Sentence boundaries are preferred; a sentence longer than the limit is split at word
 * boundaries. A word is never cut, so a single word longer than the limit becomes a chunk of its
 * own. Whitespace is collapsed to single spaces, which makes joining the chunks with one space
 * reproduce the normalized input exactly.
 *
 * <p>Text within the limit is returned as a one-element list, the same shape the chunked path
 * produces.
 */
@Component
public class TextChunker {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

  /**
   * Split text for processing.
   *
   * @param text input text
   * @param maxChunkLength maximum characters per chunk
   * @return ordered chunks; empty when the text is blank
   */
  public List<String> splitForProcessing(String text, int maxChunkLength) {
    if (maxChunkLength <= 0) {
      throw new IllegalArgumentException("maxChunkLength must be positive: " + maxChunkLength);
    }

    String normalized = normalize(text);
    if (normalized.isEmpty()) {
      return List.of();
    }
    if (normalized.length() <= maxChunkLength) {
      return List.of(normalized);
    }

    List<String> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String sentence : SENTENCE_BOUNDARY.split(normalized)) {
      if (sentence.length() > maxChunkLength) {
        flush(current, chunks);
        splitByWords(sentence, maxChunkLength, chunks);
        continue;
      }
      if (current.length() > 0 && current.length() + 1 + sentence.length() > maxChunkLength) {
        flush(current, chunks);
      }
      if (current.length() > 0) {
        current.append(' ');
      }
      current.append(sentence);
    }
    flush(current, chunks);
    return chunks;
  }

  /** Collapse whitespace runs and trim. */
  public static String normalize(String text) {
    if (text == null) {
      return "";
    }
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  private static void splitByWords(String sentence, int maxChunkLength, List<String> chunks) {
    StringBuilder current = new StringBuilder();
    for (String word : sentence.split(" ")) {
      if (current.length() > 0 && current.length() + 1 + word.length() > maxChunkLength) {
        flush(current, chunks);
      }
      if (current.length() > 0) {
        current.append(' ');
      }
      current.append(word);
    }
    flush(current, chunks);
  }

  private static void flush(StringBuilder current, List<String> chunks) {
    if (current.length() > 0) {
      chunks.add(current.toString());
      current.setLength(0);
    }
  }
}

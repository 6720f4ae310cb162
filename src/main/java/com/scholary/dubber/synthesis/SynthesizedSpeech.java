package com.scholary.dubber.synthesis;

import java.nio.file.Path;
import java.util.List;

/**
 * Synthesized audio for a piece of text.
 *
 * @param audio canonical audio file holding every chunk in order
 * @param chunks the chunks the text was spoken in, used for caption timing
 */
public record SynthesizedSpeech(Path audio, List<SpeechChunk> chunks) {

  public SynthesizedSpeech {
    chunks = List.copyOf(chunks);
  }

  public double durationSeconds() {
    return chunks.stream().mapToDouble(SpeechChunk::durationSeconds).sum();
  }
}

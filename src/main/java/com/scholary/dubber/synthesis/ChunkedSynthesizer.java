package com.scholary.dubber.synthesis;

import com.scholary.dubber.audio.AudioToolRunner;
import com.scholary.dubber.text.TextChunker;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Synthesizes text of any length by splitting it into chunks the provider accepts.
 *
 * <p>Each chunk is synthesized in order, normalized to the canonical format and measured. Multiple
 * chunks are concatenated with the same primitive the timeline reconstruction uses.
 */
@Component
public class ChunkedSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedSynthesizer.class);

  private final Synthesizer synthesizer;
  private final TextChunker chunker;
  private final AudioToolRunner audioTools;
  private final int maxChunkLength;

  public ChunkedSynthesizer(
      Synthesizer synthesizer,
      TextChunker chunker,
      AudioToolRunner audioTools,
      @Value("${dubbing.chunking.maxChunkLength}") int maxChunkLength) {
    this.synthesizer = synthesizer;
    this.chunker = chunker;
    this.audioTools = audioTools;
    this.maxChunkLength = maxChunkLength;
  }

  /**
   * Synthesize text into {@code workDir}.
   *
   * @param baseName file name prefix, unique within {@code workDir}
   * @throws SynthesisException if a chunk cannot be synthesized or stored
   * @throws com.scholary.dubber.audio.AudioToolException if a chunk cannot be decoded
   */
  public SynthesizedSpeech synthesize(
      String text, String targetLanguage, String voiceId, Path workDir, String baseName) {
    List<String> texts = chunker.splitForProcessing(text, maxChunkLength);
    if (texts.isEmpty()) {
      throw new SynthesisException("Nothing to synthesize");
    }

    List<Path> files = new ArrayList<>(texts.size());
    List<SpeechChunk> chunks = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      byte[] encoded = synthesizer.generateSpeech(texts.get(i), targetLanguage, voiceId);
      if (encoded == null || encoded.length == 0) {
        throw new SynthesisException("Speech synthesis returned no audio");
      }

      Path raw = workDir.resolve(String.format("%s_chunk%03d.mp3", baseName, i));
      Path wav = workDir.resolve(String.format("%s_chunk%03d.wav", baseName, i));
      try {
        Files.write(raw, encoded);
      } catch (IOException e) {
        throw new SynthesisException("Synthesized audio could not be stored", e);
      }
      audioTools.normalize(raw, wav);

      files.add(wav);
      chunks.add(new SpeechChunk(texts.get(i), audioTools.durationOf(wav)));
    }

    Path audio;
    if (files.size() == 1) {
      audio = files.get(0);
    } else {
      audio = workDir.resolve(baseName + "_speech.wav");
      audioTools.concatenate(files, audio);
      LOGGER.debug("Concatenated {} speech chunks into {}", files.size(), audio.getFileName());
    }
    return new SynthesizedSpeech(audio, chunks);
  }
}

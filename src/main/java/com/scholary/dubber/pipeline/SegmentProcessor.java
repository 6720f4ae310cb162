package com.scholary.dubber.pipeline;

import com.scholary.dubber.PipelineStage;
import com.scholary.dubber.alignment.DurationMatch;
import com.scholary.dubber.alignment.DurationMatcher;
import com.scholary.dubber.audio.AudioToolException;
import com.scholary.dubber.audio.AudioToolRunner;
import com.scholary.dubber.logging.StructuredLogger;
import com.scholary.dubber.synthesis.ChunkedSynthesizer;
import com.scholary.dubber.synthesis.SynthesisException;
import com.scholary.dubber.synthesis.SynthesizedSpeech;
import com.scholary.dubber.timeline.ProcessedSegmentAudio;
import com.scholary.dubber.timeline.ReconstructionException;
import com.scholary.dubber.timeline.Segment;
import com.scholary.dubber.translation.ChunkedTranslator;
import com.scholary.dubber.translation.TranslationException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-segment work of a language run.
 *
 * <p>Translation and rendering return a {@link SegmentOutcome}: provider and tool failures of a
 * single segment are expected, and the caller turns them into silence of the segment's duration.
 * Only failures that leave no way to produce audio at all (silence generation itself failing) are
 * thrown.
 */
@Component
public class SegmentProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentProcessor.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final ChunkedTranslator translator;
  private final ChunkedSynthesizer synthesizer;
  private final DurationMatcher durationMatcher;
  private final AudioToolRunner audioTools;

  public SegmentProcessor(
      ChunkedTranslator translator,
      ChunkedSynthesizer synthesizer,
      DurationMatcher durationMatcher,
      AudioToolRunner audioTools) {
    this.translator = translator;
    this.synthesizer = synthesizer;
    this.durationMatcher = durationMatcher;
    this.audioTools = audioTools;
  }

  /** Translated speech for one segment, ready to be placed on the timeline. */
  public record RenderedSegment(
      ProcessedSegmentAudio audio, SynthesizedSpeech speech, DurationMatch match) {}

  /** Translate the text of a speech segment. */
  public SegmentOutcome<String> translate(
      int index, Segment segment, String targetLanguage, String sourceLanguage) {
    try {
      return SegmentOutcome.success(
          translator.translate(segment.text(), targetLanguage, sourceLanguage));
    } catch (TranslationException e) {
      STRUCTURED_LOGGER.logSegmentFallback(
          index, PipelineStage.TRANSLATION.name(), e.getClass().getSimpleName(), e.getMessage());
      return SegmentOutcome.failure(PipelineStage.TRANSLATION, e.getMessage());
    }
  }

  /** Synthesize translated text with the segment's voice and fit it to the segment duration. */
  public SegmentOutcome<RenderedSegment> render(
      int index, Segment segment, String translatedText, String targetLanguage, Path workDir) {
    String baseName = String.format("seg%04d", index);

    SynthesizedSpeech speech;
    try {
      speech =
          synthesizer.synthesize(
              translatedText, targetLanguage, segment.voiceId(), workDir, baseName);
    } catch (SynthesisException | AudioToolException e) {
      STRUCTURED_LOGGER.logSegmentFallback(
          index, PipelineStage.SYNTHESIS.name(), e.getClass().getSimpleName(), e.getMessage());
      return SegmentOutcome.failure(PipelineStage.SYNTHESIS, e.getMessage());
    }

    DurationMatch match;
    try {
      match =
          durationMatcher.matchDuration(
              speech.audio(), segment.duration(), workDir.resolve(baseName + "_timed.wav"));
    } catch (AudioToolException e) {
      STRUCTURED_LOGGER.logSegmentFallback(
          index,
          PipelineStage.DURATION_MATCHING.name(),
          e.getClass().getSimpleName(),
          e.getMessage());
      return SegmentOutcome.failure(PipelineStage.DURATION_MATCHING, e.getMessage());
    }

    STRUCTURED_LOGGER.logSegmentProcessed(
        index,
        segment.speakerId(),
        segment.voiceId(),
        match.strategy().name(),
        segment.duration(),
        match.outputDuration());
    return SegmentOutcome.success(
        new RenderedSegment(
            new ProcessedSegmentAudio(index, match.output(), match.outputDuration()),
            speech,
            match));
  }

  /**
   * Silence of the segment's exact duration.
   *
   * @throws ReconstructionException if even silence cannot be generated
   */
  public ProcessedSegmentAudio silence(int index, Segment segment, Path workDir) {
    Path output = workDir.resolve(String.format("seg%04d_silence.wav", index));
    try {
      audioTools.generateSilence(segment.duration(), output);
    } catch (AudioToolException e) {
      throw new ReconstructionException("Silence for segment " + index + " could not be made", e);
    }
    return new ProcessedSegmentAudio(index, output, segment.duration());
  }
}

package com.scholary.dubber.pipeline;

import com.scholary.dubber.DubbingException;
import com.scholary.dubber.PipelineStage;
import com.scholary.dubber.alignment.MatchStrategy;
import com.scholary.dubber.export.CaptionCue;
import com.scholary.dubber.export.ExportResult;
import com.scholary.dubber.export.Exporter;
import com.scholary.dubber.export.TranscriptDocument;
import com.scholary.dubber.logging.StructuredLogger;
import com.scholary.dubber.mixing.MixSettings;
import com.scholary.dubber.mixing.Mixer;
import com.scholary.dubber.mixing.MixingException;
import com.scholary.dubber.pipeline.SegmentProcessor.RenderedSegment;
import com.scholary.dubber.synthesis.SpeechChunk;
import com.scholary.dubber.timeline.ProcessedSegmentAudio;
import com.scholary.dubber.timeline.Segment;
import com.scholary.dubber.timeline.TimelineReconstructor;
import com.scholary.dubber.voice.SpeakerVoiceAssigner;
import com.scholary.dubber.voice.VoiceCatalog;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Dubs one target language from the shared timeline.
 *
 * <p>Stages, each reported to the progress listener:
 *
 * <ol>
 *   <li>Assign a voice to every speaker
 *   <li>Translate every speech segment (40%)
 *   <li>Synthesize and re-time every segment; failed segments become silence (70%)
 *   <li>Concatenate the segments and mix with the background (90%)
 *   <li>Export the deliverables (100%)
 * </ol>
 *
 * <p>Segments are processed strictly in order. A failure that prevents producing audio for the
 * language is returned as a failed {@link PipelineResult}; it never affects other languages.
 */
@Component
public class LanguagePipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(LanguagePipeline.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final int TRANSLATED_PERCENT = 40;
  static final int SYNTHESIZED_PERCENT = 70;
  static final int MIXED_PERCENT = 90;
  static final int EXPORTED_PERCENT = 100;

  private final SpeakerVoiceAssigner voiceAssigner;
  private final VoiceCatalog voiceCatalog;
  private final SegmentProcessor segmentProcessor;
  private final TimelineReconstructor reconstructor;
  private final Mixer mixer;
  private final MixSettings mixSettings;
  private final Exporter exporter;

  public LanguagePipeline(
      SpeakerVoiceAssigner voiceAssigner,
      VoiceCatalog voiceCatalog,
      SegmentProcessor segmentProcessor,
      TimelineReconstructor reconstructor,
      Mixer mixer,
      MixSettings mixSettings,
      Exporter exporter) {
    this.voiceAssigner = voiceAssigner;
    this.voiceCatalog = voiceCatalog;
    this.segmentProcessor = segmentProcessor;
    this.reconstructor = reconstructor;
    this.mixer = mixer;
    this.mixSettings = mixSettings;
    this.exporter = exporter;
  }

  /** Run every stage for one language. Never throws for failures of this language. */
  public PipelineResult run(LanguageRun run) {
    String language = run.targetLanguage();
    PipelineStage stage = PipelineStage.VOICE_ASSIGNMENT;
    try {
      List<Segment> segments = assignVoices(run);

      stage = PipelineStage.TRANSLATION;
      List<SegmentOutcome<String>> translations = new ArrayList<>(segments.size());
      for (int i = 0; i < segments.size(); i++) {
        Segment segment = segments.get(i);
        translations.add(
            segment.silence()
                ? null
                : segmentProcessor.translate(i, segment, language, run.sourceLanguage()));
      }
      report(run, PipelineStage.TRANSLATION, TRANSLATED_PERCENT, "Translation complete");

      stage = PipelineStage.SYNTHESIS;
      List<ProcessedSegmentAudio> rendered = new ArrayList<>(segments.size());
      List<CaptionCue> cues = new ArrayList<>();
      List<TranscriptDocument.Entry> entries = new ArrayList<>(segments.size());
      List<String> translatedTexts = new ArrayList<>();
      int failedSegments = 0;

      for (int i = 0; i < segments.size(); i++) {
        Segment segment = segments.get(i);
        if (segment.silence()) {
          rendered.add(segmentProcessor.silence(i, segment, run.workDir()));
          entries.add(entry(i, segment, null, false));
          continue;
        }

        SegmentOutcome<String> translation = translations.get(i);
        SegmentOutcome<RenderedSegment> outcome =
            translation.isSuccess()
                ? segmentProcessor.render(i, segment, translation.value(), language, run.workDir())
                : SegmentOutcome.failure(translation.failedStage(), translation.error());

        if (outcome.isSuccess()) {
          rendered.add(outcome.value().audio());
          cues.addAll(captionCues(segment, outcome.value()));
          translatedTexts.add(translation.value());
          entries.add(entry(i, segment, translation.value(), false));
        } else {
          failedSegments++;
          rendered.add(segmentProcessor.silence(i, segment, run.workDir()));
          entries.add(
              entry(i, segment, translation.isSuccess() ? translation.value() : null, true));
          if (translation.isSuccess()) {
            translatedTexts.add(translation.value());
          }
        }
      }
      report(run, PipelineStage.SYNTHESIS, SYNTHESIZED_PERCENT, "Speech synthesis complete");

      stage = PipelineStage.RECONSTRUCTION;
      Path voiceTrack =
          reconstructor.reconstruct(rendered, run.workDir().resolve("voice_track.wav"));

      stage = PipelineStage.MIXING;
      Path finalMix = run.workDir().resolve("final_mix.wav");
      boolean mixedWithBackground = false;
      if (run.background() != null) {
        try {
          mixer.mix(voiceTrack, run.background(), finalMix, mixSettings);
          mixedWithBackground = true;
        } catch (MixingException e) {
          LOGGER.warn("Mixing failed, falling back to voice only: {}", e.getMessage());
          finalMix = voiceOnlyMix(voiceTrack, finalMix);
        }
      } else {
        finalMix = voiceOnlyMix(voiceTrack, finalMix);
      }
      report(run, PipelineStage.MIXING, MIXED_PERCENT, "Mixing complete");

      stage = PipelineStage.EXPORT;
      String translatedText = String.join(" ", translatedTexts);
      TranscriptDocument document =
          new TranscriptDocument(
              run.jobId(),
              run.sourceLanguage(),
              language,
              run.transcript(),
              translatedText,
              entries);
      ExportResult export =
          exporter.export(run.jobId(), language, finalMix, voiceTrack, cues, document);
      report(run, PipelineStage.EXPORT, EXPORTED_PERCENT, "Export complete");

      if (failedSegments > 0) {
        LOGGER.warn(
            "Language {} finished with {} of {} speech segments replaced by silence",
            language,
            failedSegments,
            translations.stream().filter(t -> t != null).count());
      }
      return new PipelineResult(
          language,
          export.finalAudio(),
          run.transcript(),
          translatedText,
          export.voiceOnly(),
          export.captions(),
          export.transcript(),
          export.bundle(),
          mixedWithBackground,
          failedSegments,
          null);

    } catch (DubbingException e) {
      LOGGER.error("Language {} failed at {}: {}", language, e.getStage(), e.getMessage(), e);
      return PipelineResult.failed(
          language,
          run.transcript(),
          new PipelineFailure(e.getStage() == null ? stage : e.getStage(), e.getMessage()));
    } catch (RuntimeException e) {
      LOGGER.error("Language {} failed unexpectedly at {}", language, stage, e);
      return PipelineResult.failed(
          language, run.transcript(), new PipelineFailure(stage, "Unexpected processing error"));
    }
  }

  private List<Segment> assignVoices(LanguageRun run) {
    Set<String> speakerIds = new LinkedHashSet<>();
    for (Segment segment : run.segments()) {
      if (!segment.silence() && segment.speakerId() != null) {
        speakerIds.add(segment.speakerId());
      }
    }

    String defaultVoice = voiceCatalog.defaultVoice(run.targetLanguage());
    Map<String, String> voices =
        voiceAssigner.assign(
            run.speakerProfiles(),
            voiceCatalog.voicesFor(run.targetLanguage()),
            defaultVoice,
            speakerIds);

    List<Segment> segments = new ArrayList<>(run.segments().size());
    for (Segment segment : run.segments()) {
      segments.add(
          segment.silence()
              ? segment
              : segment.withVoice(voices.getOrDefault(segment.speakerId(), defaultVoice)));
    }
    return segments;
  }

  private Path voiceOnlyMix(Path voiceTrack, Path finalMix) {
    try {
      return mixer.mix(voiceTrack, null, finalMix, mixSettings);
    } catch (MixingException e) {
      LOGGER.warn("Voice gain could not be applied, using the raw voice track: {}", e.getMessage());
      return voiceTrack;
    }
  }

  /**
   * Captions for one rendered segment, one cue per synthesis chunk.
   *
   * <p>Chunk timing is spread over the span the speech actually occupies (the original speech
   * length when it was padded, the whole segment otherwise) in proportion to each chunk's
   * synthesized duration.
   */
  static List<CaptionCue> captionCues(Segment segment, RenderedSegment rendered) {
    List<SpeechChunk> chunks = rendered.speech().chunks();
    double span =
        rendered.match().strategy() == MatchStrategy.PAD
            ? Math.min(segment.duration(), rendered.match().inputDuration())
            : segment.duration();

    double total = 0.0;
    for (SpeechChunk chunk : chunks) {
      total += chunk.durationSeconds();
    }

    List<CaptionCue> cues = new ArrayList<>(chunks.size());
    double cursor = segment.start();
    for (int i = 0; i < chunks.size(); i++) {
      SpeechChunk chunk = chunks.get(i);
      double share = total > 0 ? chunk.durationSeconds() / total : 1.0 / chunks.size();
      double end = i == chunks.size() - 1 ? segment.start() + span : cursor + share * span;
      cues.add(new CaptionCue(cursor, end, chunk.text()));
      cursor = end;
    }
    return cues;
  }

  private static TranscriptDocument.Entry entry(
      int index, Segment segment, String translatedText, boolean fallback) {
    return new TranscriptDocument.Entry(
        index,
        segment.start(),
        segment.end(),
        segment.silence(),
        segment.speakerId(),
        segment.voiceId(),
        segment.text(),
        translatedText,
        fallback);
  }

  private static void report(LanguageRun run, PipelineStage stage, int percent, String message) {
    STRUCTURED_LOGGER.logStageProgress(run.jobId(), run.targetLanguage(), stage.name(), percent);
    run.listener().onProgress(new ProgressEvent(run.targetLanguage(), stage, percent, message));
  }
}

package com.scholary.dubber.pipeline;

import com.scholary.dubber.DubbingException;
import com.scholary.dubber.PipelineStage;
import com.scholary.dubber.audio.MediaInfo;
import com.scholary.dubber.config.AsyncConfig;
import com.scholary.dubber.logging.StructuredLogger;
import com.scholary.dubber.media.MediaProbe;
import com.scholary.dubber.timeline.Segment;
import com.scholary.dubber.timeline.TimelineSegmenter;
import com.scholary.dubber.transcription.Transcriber;
import com.scholary.dubber.transcription.TranscriptionException;
import com.scholary.dubber.transcription.TranscriptionResult;
import com.scholary.dubber.translation.LanguageNames;
import com.scholary.dubber.voice.SpeakerProfile;
import com.scholary.dubber.voice.SpeakerProfiler;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Entry point of the dubbing engine.
 *
 * <p>The stages shared by every target language run once, on the calling thread:
 *
 * <ol>
 *   <li>Probe the source and extract the audio track of video inputs
 *   <li>Transcribe with diarization
 *   <li>Segment the timeline into speech and silence
 *   <li>Estimate each speaker's pitch
 * </ol>
 *
 * <p>A failure in any of these aborts the job with a {@link PipelineException}, since no language
 * could be produced. The target languages then run concurrently on the bounded language executor;
 * each gets its own scratch directory and its failures stay in its own {@link PipelineResult}.
 * A target code that is not a well-formed language code fails only that language, without
 * touching the filesystem.
 *
 * <p>All scratch files live under a job working directory that is deleted before this method
 * returns, whatever the outcome. Deliverables are written to the output directory by the
 * exporter.
 */
@Component
public class DubbingPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(DubbingPipeline.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final int TRANSCRIBED_PERCENT = 20;

  private final MediaProbe mediaProbe;
  private final Transcriber transcriber;
  private final TimelineSegmenter segmenter;
  private final SpeakerProfiler speakerProfiler;
  private final LanguagePipeline languagePipeline;
  private final Executor languageExecutor;
  private final Path tempRoot;

  public DubbingPipeline(
      MediaProbe mediaProbe,
      Transcriber transcriber,
      TimelineSegmenter segmenter,
      SpeakerProfiler speakerProfiler,
      LanguagePipeline languagePipeline,
      @Qualifier(AsyncConfig.LANGUAGE_EXECUTOR) Executor languageExecutor,
      @Value("${dubbing.tempDir}") String tempDir) {
    this.mediaProbe = mediaProbe;
    this.transcriber = transcriber;
    this.segmenter = segmenter;
    this.speakerProfiler = speakerProfiler;
    this.languagePipeline = languagePipeline;
    this.languageExecutor = languageExecutor;
    this.tempRoot = Paths.get(tempDir);
  }

  /**
   * Dub a recording into every target language.
   *
   * @param jobId identifier used for logging, scratch and output locations
   * @param voicePath source voice recording (audio or video)
   * @param backgroundPath background bed to mix under the dubbed voice, or null
   * @param sourceLanguage language spoken in the recording
   * @param targetLanguages languages to produce; duplicates are ignored
   * @param listener progress callback, called from several threads
   * @return one result per target language, in request order
   * @throws PipelineException if probing, transcription or segmentation fails
   * @throws IllegalArgumentException if no target is given or the source code is malformed
   */
  public Map<String, PipelineResult> runPipeline(
      String jobId,
      Path voicePath,
      Path backgroundPath,
      String sourceLanguage,
      List<String> targetLanguages,
      ProgressListener listener) {
    if (targetLanguages == null || targetLanguages.isEmpty()) {
      throw new IllegalArgumentException("At least one target language is required");
    }
    if (!LanguageNames.isValidCode(sourceLanguage)) {
      throw new IllegalArgumentException("Invalid source language code: " + sourceLanguage);
    }
    ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
    List<String> languages = new ArrayList<>(new LinkedHashSet<>(targetLanguages));

    StructuredLogger.setJobContext(jobId);
    long startedAt = System.currentTimeMillis();
    LOGGER.info(
        "Starting dubbing: jobId={}, source={}, targets={}, background={}",
        jobId,
        sourceLanguage,
        languages,
        backgroundPath != null);

    try (WorkingDirectory work = createWorkingDirectory(jobId)) {
      Path sourceAudio = voicePath;
      MediaInfo info = probe(jobId, voicePath);
      if (info.hasVideo()) {
        LOGGER.info("Source is a video, extracting its audio track");
        sourceAudio = extractSourceAudio(jobId, voicePath, work);
        info = probe(jobId, sourceAudio);
      }
      Path background = prepareBackground(backgroundPath, work);

      TranscriptionResult transcription = transcribe(jobId, sourceAudio, sourceLanguage);
      List<Segment> segments =
          segmenter.segment(transcription.utterances(), info.durationSeconds());
      if (segments.isEmpty()) {
        throw new PipelineException(
            jobId, PipelineStage.SEGMENTATION, "Source audio has no duration", null);
      }
      report(jobId, progress, PipelineStage.TRANSCRIPTION, "Transcription complete");

      List<SpeakerProfile> profiles =
          speakerProfiler.profileSpeakers(sourceAudio, transcription.utterances(), work.path());

      Map<String, PipelineResult> results =
          runLanguages(
              jobId,
              sourceLanguage,
              languages,
              transcription.transcript(),
              segments,
              profiles,
              background,
              work.path(),
              progress);

      long succeeded = results.values().stream().filter(PipelineResult::isSuccess).count();
      LOGGER.info(
          "Dubbing finished: jobId={}, languages={}/{} succeeded, took={}ms",
          jobId,
          succeeded,
          results.size(),
          System.currentTimeMillis() - startedAt);
      return results;

    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private WorkingDirectory createWorkingDirectory(String jobId) {
    try {
      return WorkingDirectory.create(tempRoot, "job-" + jobId);
    } catch (IOException e) {
      throw new PipelineException(
          jobId, PipelineStage.PROBE, "Working directory could not be created", e);
    }
  }

  private MediaInfo probe(String jobId, Path path) {
    try {
      return mediaProbe.probe(path);
    } catch (DubbingException e) {
      throw new PipelineException(jobId, e.getStage(), e.getMessage(), e);
    }
  }

  private Path extractSourceAudio(String jobId, Path voicePath, WorkingDirectory work) {
    try {
      return mediaProbe.extractAudioTrack(voicePath, work.resolve("source_audio.wav"), "wav");
    } catch (DubbingException e) {
      throw new PipelineException(jobId, e.getStage(), e.getMessage(), e);
    }
  }

  /** The background is optional: if it cannot be read, languages are mixed voice-only. */
  private Path prepareBackground(Path backgroundPath, WorkingDirectory work) {
    if (backgroundPath == null) {
      return null;
    }
    try {
      MediaInfo info = mediaProbe.probe(backgroundPath);
      if (!info.hasVideo()) {
        return backgroundPath;
      }
      return mediaProbe.extractAudioTrack(
          backgroundPath, work.resolve("background_audio.wav"), "wav");
    } catch (DubbingException e) {
      LOGGER.warn("Background unusable, continuing without it: {}", e.getMessage());
      return null;
    }
  }

  private TranscriptionResult transcribe(String jobId, Path sourceAudio, String sourceLanguage) {
    try {
      return transcriber.transcribe(sourceAudio, sourceLanguage, true);
    } catch (TranscriptionException e) {
      throw new PipelineException(jobId, PipelineStage.TRANSCRIPTION, e.getMessage(), e);
    }
  }

  private Map<String, PipelineResult> runLanguages(
      String jobId,
      String sourceLanguage,
      List<String> languages,
      String transcript,
      List<Segment> segments,
      List<SpeakerProfile> profiles,
      Path background,
      Path jobDir,
      ProgressListener progress) {

    Map<String, CompletableFuture<PipelineResult>> futures = new LinkedHashMap<>();
    for (String language : languages) {
      if (!LanguageNames.isValidCode(language)) {
        LOGGER.warn("Skipping malformed target language code '{}'", language);
        futures.put(
            language,
            CompletableFuture.completedFuture(
                PipelineResult.failed(
                    language,
                    transcript,
                    new PipelineFailure(PipelineStage.TRANSLATION, "Unsupported language code"))));
        continue;
      }
      CompletableFuture<PipelineResult> future;
      try {
        future =
            CompletableFuture.supplyAsync(
                () ->
                    runLanguage(
                        jobId,
                        sourceLanguage,
                        language,
                        transcript,
                        segments,
                        profiles,
                        background,
                        jobDir,
                        progress),
                languageExecutor);
      } catch (RejectedExecutionException e) {
        LOGGER.error("Language {} could not be scheduled", language, e);
        future =
            CompletableFuture.completedFuture(
                PipelineResult.failed(
                    language,
                    transcript,
                    new PipelineFailure(PipelineStage.TRANSLATION, "Server is busy, try later")));
      }
      futures.put(language, future);
    }

    Map<String, PipelineResult> results = new LinkedHashMap<>();
    for (Map.Entry<String, CompletableFuture<PipelineResult>> entry : futures.entrySet()) {
      results.put(entry.getKey(), entry.getValue().join());
    }
    return results;
  }

  private PipelineResult runLanguage(
      String jobId,
      String sourceLanguage,
      String language,
      String transcript,
      List<Segment> segments,
      List<SpeakerProfile> profiles,
      Path background,
      Path jobDir,
      ProgressListener progress) {
    StructuredLogger.setJobContext(jobId);
    StructuredLogger.setLanguageContext(language);
    try (WorkingDirectory work = WorkingDirectory.create(jobDir, "lang-" + language)) {
      return languagePipeline.run(
          new LanguageRun(
              jobId,
              sourceLanguage,
              language,
              transcript,
              segments,
              profiles,
              background,
              work.path(),
              progress));
    } catch (IOException e) {
      LOGGER.error("Working directory for {} could not be created", language, e);
      return PipelineResult.failed(
          language,
          transcript,
          new PipelineFailure(PipelineStage.TRANSLATION, "Working directory could not be created"));
    } catch (RuntimeException e) {
      // Anything escaping here would fail the join in runLanguages and lose every other
      // language's result, so it is turned into this language's failure instead.
      LOGGER.error("Language {} failed unexpectedly", language, e);
      return PipelineResult.failed(
          language,
          transcript,
          new PipelineFailure(PipelineStage.TRANSLATION, "Unexpected processing error"));
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private static void report(
      String jobId, ProgressListener listener, PipelineStage stage, String message) {
    STRUCTURED_LOGGER.logStageProgress(jobId, null, stage.name(), TRANSCRIBED_PERCENT);
    listener.onProgress(new ProgressEvent(null, stage, TRANSCRIBED_PERCENT, message));
  }
}

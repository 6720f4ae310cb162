package com.scholary.dubber.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubber.PipelineStage;
import com.scholary.dubber.alignment.DurationMatcher;
import com.scholary.dubber.audio.FfmpegProperties;
import com.scholary.dubber.audio.PcmAudio;
import com.scholary.dubber.audio.Tones;
import com.scholary.dubber.audio.WavAudioToolRunner;
import com.scholary.dubber.export.CaptionWriter;
import com.scholary.dubber.export.Exporter;
import com.scholary.dubber.media.MediaProbe;
import com.scholary.dubber.mixing.MixSettings;
import com.scholary.dubber.mixing.Mixer;
import com.scholary.dubber.synthesis.ChunkedSynthesizer;
import com.scholary.dubber.synthesis.SynthesisException;
import com.scholary.dubber.synthesis.Synthesizer;
import com.scholary.dubber.text.TextChunker;
import com.scholary.dubber.timeline.TimelineReconstructor;
import com.scholary.dubber.timeline.TimelineSegmenter;
import com.scholary.dubber.transcription.Transcriber;
import com.scholary.dubber.transcription.TranscriptionException;
import com.scholary.dubber.transcription.TranscriptionResult;
import com.scholary.dubber.transcription.Utterance;
import com.scholary.dubber.translation.ChunkedTranslator;
import com.scholary.dubber.translation.Translator;
import com.scholary.dubber.voice.Gender;
import com.scholary.dubber.voice.SpeakerProfiler;
import com.scholary.dubber.voice.SpeakerVoiceAssigner;
import com.scholary.dubber.voice.VoiceCatalog;
import com.scholary.dubber.voice.VoiceCatalogEntry;
import com.scholary.dubber.voice.VoiceCatalogProperties;
import com.scholary.dubber.voice.YinPitchEstimator;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Runs the whole engine over a synthetic two-speaker recording.
 *
 * <p>Only the remote providers are mocked; audio work goes through {@link WavAudioToolRunner}.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DubbingPipelineIntegrationTest {

  private static final int RATE = 16000;

  @TempDir Path tempDir;

  @Mock private Transcriber transcriber;
  @Mock private Translator translator;
  @Mock private Synthesizer synthesizer;

  private final WavAudioToolRunner audioTools = new WavAudioToolRunner(RATE, 1);
  private final List<ProgressEvent> events = new CopyOnWriteArrayList<>();

  private DubbingPipeline pipeline;
  private Path source;

  @BeforeEach
  void setUp() {
    // speaker 0 at 200 Hz over 0-4s, speaker 1 at 100 Hz over 5-9s
    source =
        Tones.writeTo(
            Tones.concat(
                Tones.sine(200.0, 4.0, 0.5f, RATE),
                Tones.sine(200.0, 1.0, 0.0f, RATE),
                Tones.sine(100.0, 4.0, 0.5f, RATE),
                Tones.sine(100.0, 1.0, 0.0f, RATE)),
            tempDir.resolve("source.wav"));

    when(transcriber.transcribe(eq(source), eq("es"), anyBoolean()))
        .thenReturn(
            new TranscriptionResult(
                "Hola. Buenos días.",
                0.95,
                10.0,
                List.of(
                    new Utterance(0.0, 4.0, "Hola.", "0", 0.9),
                    new Utterance(5.0, 9.0, "Buenos días.", "1", 0.9))));
    when(translator.translate(anyString(), anyString(), eq("es")))
        .thenAnswer(inv -> "[" + inv.getArgument(1) + "] " + inv.getArgument(0));
    when(synthesizer.generateSpeech(anyString(), anyString(), anyString()))
        .thenAnswer(inv -> speech(3.5));

    TextChunker chunker = new TextChunker();
    VoiceCatalog catalog =
        new VoiceCatalog(
            new VoiceCatalogProperties(
                "fallback",
                Map.of(
                    "en",
                    new VoiceCatalogProperties.LanguageVoices(
                        "high",
                        List.of(
                            new VoiceCatalogEntry("high", 220.0, Gender.FEMALE),
                            new VoiceCatalogEntry("low", 120.0, Gender.MALE))))));
    MixSettings mixSettings = new MixSettings(0.8, 0.3, true, 0.1, 0.3, 100, 0.95);
    FfmpegProperties ffmpeg =
        new FfmpegProperties("ffmpeg", "ffprobe", RATE, 1, 30, 300, 120, "wav", "192k");

    SegmentProcessor segmentProcessor =
        new SegmentProcessor(
            new ChunkedTranslator(translator, chunker, 1000),
            new ChunkedSynthesizer(synthesizer, chunker, audioTools, 1000),
            new DurationMatcher(audioTools, 0.05, 1.35),
            audioTools);
    LanguagePipeline languagePipeline =
        new LanguagePipeline(
            new SpeakerVoiceAssigner(),
            catalog,
            segmentProcessor,
            new TimelineReconstructor(audioTools),
            new Mixer(audioTools),
            mixSettings,
            new Exporter(
                audioTools,
                new CaptionWriter(new ObjectMapper()),
                ffmpeg,
                tempDir.resolve("out").toString()));

    pipeline =
        new DubbingPipeline(
            new MediaProbe(audioTools),
            transcriber,
            new TimelineSegmenter(0.1, 0.05),
            new SpeakerProfiler(audioTools, new YinPitchEstimator(), 0.5),
            languagePipeline,
            Runnable::run,
            tempDir.resolve("tmp").toString());
  }

  @Test
  void runPipeline_shouldProduceFullLengthDubWithPitchMatchedVoices() throws Exception {
    Map<String, PipelineResult> results =
        pipeline.runPipeline("job-1", source, null, "es", List.of("en"), events::add);

    PipelineResult result = results.get("en");
    assertThat(result.isSuccess()).isTrue();
    assertThat(result.failedSegments()).isZero();
    assertThat(result.mixedWithBackground()).isFalse();
    assertThat(result.transcriptText()).isEqualTo("Hola. Buenos días.");
    assertThat(result.translatedText()).isEqualTo("[en] Hola. [en] Buenos días.");

    PcmAudio output = PcmAudio.read(result.finalAudioPath());
    assertThat(output.durationSeconds()).isCloseTo(10.0, within(0.1));
    assertThat(PcmAudio.read(result.voiceOnlyPath()).durationSeconds())
        .isCloseTo(10.0, within(0.1));

    // the lower speaker gets the lower voice
    verify(synthesizer).generateSpeech("[en] Hola.", "en", "high");
    verify(synthesizer).generateSpeech("[en] Buenos días.", "en", "low");

    String captions = Files.readString(result.captionsPath());
    assertThat(captions).contains("00:00:00,000 --> ").contains("[en] Hola.");
    assertThat(captions).contains("00:00:05,000 --> ").contains("[en] Buenos días.");
    assertThat(result.bundlePath()).isRegularFile();
  }

  @Test
  void runPipeline_shouldReportProgressAndCleanUpScratchFiles() {
    pipeline.runPipeline("job-1", source, null, "es", List.of("en"), events::add);

    assertThat(events.get(0).language()).isNull();
    assertThat(events.get(0).percent()).isEqualTo(DubbingPipeline.TRANSCRIBED_PERCENT);
    assertThat(events.subList(1, events.size()))
        .extracting(ProgressEvent::percent)
        .containsExactly(
            LanguagePipeline.TRANSLATED_PERCENT,
            LanguagePipeline.SYNTHESIZED_PERCENT,
            LanguagePipeline.MIXED_PERCENT,
            LanguagePipeline.EXPORTED_PERCENT);
    assertThat(tempDir.resolve("tmp")).isEmptyDirectory();
  }

  @Test
  void runPipeline_shouldReplaceFailedSegmentWithSilenceOfSameDuration() throws Exception {
    when(synthesizer.generateSpeech(
            argThat(text -> text.contains("Buenos")), anyString(), anyString()))
        .thenThrow(new SynthesisException("Speech synthesis failed with status 500"));

    PipelineResult result =
        pipeline.runPipeline("job-1", source, null, "es", List.of("en"), null).get("en");

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.failedSegments()).isEqualTo(1);
    assertThat(PcmAudio.read(result.finalAudioPath()).durationSeconds())
        .isCloseTo(10.0, within(0.1));
    assertThat(Files.readString(result.captionsPath())).doesNotContain("Buenos");
  }

  @Test
  void runPipeline_shouldMixBackgroundUnderVoice() throws Exception {
    Path background =
        Tones.writeTo(Tones.sine(440.0, 3.0, 0.5f, RATE), tempDir.resolve("background.wav"));

    PipelineResult result =
        pipeline.runPipeline("job-1", source, background, "es", List.of("en"), null).get("en");

    assertThat(result.mixedWithBackground()).isTrue();
    PcmAudio output = PcmAudio.read(result.finalAudioPath());
    assertThat(output.durationSeconds()).isCloseTo(10.0, within(0.1));
    float peak = 0f;
    for (float sample : output.samples()) {
      peak = Math.max(peak, Math.abs(sample));
    }
    assertThat(peak).isLessThanOrEqualTo(1.0f);
  }

  @Test
  void runPipeline_shouldKeepOtherLanguagesWhenOneFails() throws Exception {
    // a regular file where the language output directory should go makes the export fail
    Files.createDirectories(tempDir.resolve("out").resolve("job-1"));
    Files.writeString(tempDir.resolve("out").resolve("job-1").resolve("fr"), "blocked");

    Map<String, PipelineResult> results =
        pipeline.runPipeline("job-1", source, null, "es", List.of("en", "fr", "en"), null);

    assertThat(results).containsOnlyKeys("en", "fr");
    assertThat(results.keySet()).containsExactly("en", "fr");
    assertThat(results.get("en").isSuccess()).isTrue();
    assertThat(results.get("fr").isSuccess()).isFalse();
    assertThat(results.get("fr").failure().stage()).isEqualTo(PipelineStage.EXPORT);
    assertThat(results.get("fr").finalAudioPath()).isNull();
    // no catalog for fr: every speaker gets the fallback voice
    verify(synthesizer).generateSpeech("[fr] Hola.", "fr", "fallback");
  }

  @Test
  void runPipeline_shouldFailOnlyMalformedLanguageCodes() throws Exception {
    Map<String, PipelineResult> results =
        pipeline.runPipeline("job-1", source, null, "es", List.of("en", "x/y", ".."), null);

    assertThat(results.keySet()).containsExactly("en", "x/y", "..");
    assertThat(results.get("en").isSuccess()).isTrue();
    assertThat(Files.exists(results.get("en").finalAudioPath())).isTrue();
    for (String code : List.of("x/y", "..")) {
      assertThat(results.get(code).isSuccess()).isFalse();
      assertThat(results.get(code).failure().message()).isEqualTo("Unsupported language code");
    }
    // nothing was written outside the job's own output directory
    try (var entries = Files.list(tempDir.resolve("out"))) {
      assertThat(entries).containsExactly(tempDir.resolve("out").resolve("job-1"));
    }
    verify(translator, never()).translate(anyString(), eq("x/y"), anyString());
  }

  @Test
  void runPipeline_shouldKeepOtherLanguagesWhenOneThrowsUnexpectedly() {
    LanguagePipeline languagePipeline = mock(LanguagePipeline.class);
    when(languagePipeline.run(argThat(run -> run != null && "fr".equals(run.targetLanguage()))))
        .thenThrow(new IllegalStateException("boom"));
    when(languagePipeline.run(argThat(run -> run != null && "en".equals(run.targetLanguage()))))
        .thenReturn(
            PipelineResult.failed(
                "en", "t", new PipelineFailure(PipelineStage.EXPORT, "disk full")));
    DubbingPipeline isolated =
        new DubbingPipeline(
            new MediaProbe(audioTools),
            transcriber,
            new TimelineSegmenter(0.1, 0.05),
            new SpeakerProfiler(audioTools, new YinPitchEstimator(), 0.5),
            languagePipeline,
            Runnable::run,
            tempDir.resolve("tmp").toString());

    Map<String, PipelineResult> results =
        isolated.runPipeline("job-1", source, null, "es", List.of("fr", "en"), null);

    assertThat(results.keySet()).containsExactly("fr", "en");
    assertThat(results.get("fr").failure().message()).isEqualTo("Unexpected processing error");
    assertThat(results.get("en").failure().message()).isEqualTo("disk full");
  }

  @Test
  void runPipeline_shouldRejectMalformedSourceLanguage() {
    assertThatThrownBy(
            () -> pipeline.runPipeline("job-1", source, null, "../es", List.of("en"), null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("source language");
  }

  @Test
  void runPipeline_shouldAbortWhenTranscriptionFails() {
    when(transcriber.transcribe(any(Path.class), eq("es"), anyBoolean()))
        .thenThrow(new TranscriptionException("Transcription failed with status 401"));

    assertThatThrownBy(
            () -> pipeline.runPipeline("job-1", source, null, "es", List.of("en"), null))
        .isInstanceOf(PipelineException.class)
        .extracting(e -> ((PipelineException) e).getStage())
        .isEqualTo(PipelineStage.TRANSCRIPTION);
    assertThat(tempDir.resolve("tmp")).isEmptyDirectory();
  }

  @Test
  void runPipeline_shouldAbortWhenSourceIsMissing() {
    assertThatThrownBy(
            () ->
                pipeline.runPipeline(
                    "job-1", tempDir.resolve("missing.wav"), null, "es", List.of("en"), null))
        .isInstanceOf(PipelineException.class)
        .hasMessage("Media file not found");
  }

  @Test
  void runPipeline_shouldRejectEmptyTargetList() {
    assertThatThrownBy(() -> pipeline.runPipeline("job-1", source, null, "es", List.of(), null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private byte[] speech(double seconds) {
    return Tones.wavBytes(Tones.sine(180.0, seconds, 0.4f, RATE), tempDir);
  }
}

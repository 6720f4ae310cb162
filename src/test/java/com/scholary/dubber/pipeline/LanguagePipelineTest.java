package com.scholary.dubber.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.scholary.dubber.alignment.DurationMatch;
import com.scholary.dubber.alignment.MatchStrategy;
import com.scholary.dubber.export.CaptionCue;
import com.scholary.dubber.pipeline.SegmentProcessor.RenderedSegment;
import com.scholary.dubber.synthesis.SpeechChunk;
import com.scholary.dubber.synthesis.SynthesizedSpeech;
import com.scholary.dubber.timeline.ProcessedSegmentAudio;
import com.scholary.dubber.timeline.Segment;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class LanguagePipelineTest {

  private static final Path AUDIO = Path.of("seg.wav");

  private static RenderedSegment rendered(MatchStrategy strategy, double input, SpeechChunk... c) {
    return new RenderedSegment(
        new ProcessedSegmentAudio(0, AUDIO, 4.0),
        new SynthesizedSpeech(AUDIO, List.of(c)),
        new DurationMatch(AUDIO, input, 4.0, strategy));
  }

  @Test
  void captionCues_shouldSplitStretchedSegmentInProportionToChunkDuration() {
    Segment segment = Segment.speech(10.0, 14.0, "text", "0");

    List<CaptionCue> cues =
        LanguagePipeline.captionCues(
            segment,
            rendered(
                MatchStrategy.STRETCH,
                5.0,
                new SpeechChunk("First part.", 3.0),
                new SpeechChunk("Second.", 1.0)));

    assertThat(cues).hasSize(2);
    assertThat(cues.get(0).start()).isEqualTo(10.0);
    assertThat(cues.get(0).end()).isCloseTo(13.0, within(1e-9));
    assertThat(cues.get(0).text()).isEqualTo("First part.");
    assertThat(cues.get(1).start()).isCloseTo(13.0, within(1e-9));
    assertThat(cues.get(1).end()).isEqualTo(14.0);
  }

  @Test
  void captionCues_shouldEndAtSpeechEndWhenPadded() {
    Segment segment = Segment.speech(2.0, 6.0, "text", "0");

    List<CaptionCue> cues =
        LanguagePipeline.captionCues(
            segment, rendered(MatchStrategy.PAD, 2.5, new SpeechChunk("Short.", 2.5)));

    assertThat(cues).containsExactly(new CaptionCue(2.0, 4.5, "Short."));
  }

  @Test
  void captionCues_shouldShareEquallyWhenChunkDurationsAreUnknown() {
    Segment segment = Segment.speech(0.0, 2.0, "text", "0");

    List<CaptionCue> cues =
        LanguagePipeline.captionCues(
            segment,
            rendered(
                MatchStrategy.PASS_THROUGH,
                2.0,
                new SpeechChunk("a", 0.0),
                new SpeechChunk("b", 0.0)));

    assertThat(cues).containsExactly(new CaptionCue(0.0, 1.0, "a"), new CaptionCue(1.0, 2.0, "b"));
  }
}

package com.scholary.dubber.timeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.scholary.dubber.audio.PcmAudio;
import com.scholary.dubber.audio.Tones;
import com.scholary.dubber.audio.WavAudioToolRunner;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TimelineReconstructorTest {

  private static final int RATE = 8000;

  @TempDir Path tempDir;

  private final WavAudioToolRunner audioTools = new WavAudioToolRunner(RATE, 1);
  private final TimelineReconstructor reconstructor = new TimelineReconstructor(audioTools);

  @Test
  void reconstruct_shouldConcatenateInIndexOrder() throws Exception {
    Path loud = Tones.writeTo(Tones.sine(200, 1.0, 0.5f, RATE), tempDir.resolve("loud.wav"));
    Path quiet = Tones.writeTo(PcmAudio.silence(RATE / 2, RATE, 1), tempDir.resolve("quiet.wav"));

    Path output =
        reconstructor.reconstruct(
            List.of(
                new ProcessedSegmentAudio(1, loud, 1.0),
                new ProcessedSegmentAudio(0, quiet, 0.5)),
            tempDir.resolve("track.wav"));

    PcmAudio track = PcmAudio.read(output);
    assertThat(track.durationSeconds()).isCloseTo(1.5, within(0.001));
    float[] samples = track.samples();
    float firstHalfPeak = 0f;
    for (int i = 0; i < RATE / 2; i++) {
      firstHalfPeak = Math.max(firstHalfPeak, Math.abs(samples[i]));
    }
    assertThat(firstHalfPeak).isZero();
  }

  @Test
  void reconstruct_shouldFailOnMissingSegmentAudio() {
    assertThatThrownBy(
            () ->
                reconstructor.reconstruct(
                    List.of(new ProcessedSegmentAudio(0, tempDir.resolve("nope.wav"), 1.0)),
                    tempDir.resolve("track.wav")))
        .isInstanceOf(ReconstructionException.class)
        .hasMessageContaining("segment 0");
  }

  @Test
  void reconstruct_shouldFailWithoutSegments() {
    assertThatThrownBy(() -> reconstructor.reconstruct(List.of(), tempDir.resolve("t.wav")))
        .isInstanceOf(ReconstructionException.class);
  }
}

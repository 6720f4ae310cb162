package com.scholary.dubber.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FfmpegAudioToolRunnerTest {

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private FfmpegAudioToolRunner runner(String ffmpegPath, String ffprobePath) {
    return new FfmpegAudioToolRunner(
        new FfmpegProperties(ffmpegPath, ffprobePath, 44100, 2, 30, 300, 120, "m4a", "192k"),
        objectMapper);
  }

  private ObjectNode report(double duration, String formatName) {
    ObjectNode root = objectMapper.createObjectNode();
    root.putObject("format")
        .put("duration", String.valueOf(duration))
        .put("format_name", formatName);
    root.putArray("streams");
    return root;
  }

  private static ObjectNode audioStream(ArrayNode streams) {
    return streams
        .addObject()
        .put("codec_type", "audio")
        .put("codec_name", "aac")
        .put("sample_rate", "48000")
        .put("channels", 2);
  }

  @Test
  void parseProbeOutput_shouldReadFirstAudioStream() {
    ObjectNode root = report(12.5, "mov,mp4,m4a,3gp,3g2,mj2");
    audioStream((ArrayNode) root.get("streams"));

    MediaInfo info = runner("ffmpeg", "ffprobe").parseProbeOutput(root);

    assertThat(info)
        .isEqualTo(new MediaInfo(12.5, true, false, 48000, 2, "aac", "mov,mp4,m4a,3gp,3g2,mj2"));
  }

  @Test
  void parseProbeOutput_shouldDetectVideoStream() {
    ObjectNode root = report(30.0, "mov,mp4,m4a,3gp,3g2,mj2");
    ArrayNode streams = (ArrayNode) root.get("streams");
    streams.addObject().put("codec_type", "video").put("codec_name", "h264");
    audioStream(streams);

    MediaInfo info = runner("ffmpeg", "ffprobe").parseProbeOutput(root);

    assertThat(info.hasVideo()).isTrue();
    assertThat(info.hasAudio()).isTrue();
  }

  @Test
  void parseProbeOutput_shouldNotTreatCoverArtAsVideo() {
    ObjectNode root = report(180.0, "mp3");
    ArrayNode streams = (ArrayNode) root.get("streams");
    audioStream(streams);
    streams
        .addObject()
        .put("codec_type", "video")
        .put("codec_name", "mjpeg")
        .putObject("disposition")
        .put("attached_pic", 1);

    MediaInfo info = runner("ffmpeg", "ffprobe").parseProbeOutput(root);

    assertThat(info.hasVideo()).isFalse();
  }

  @Test
  void parseProbeOutput_shouldReportMissingAudio() {
    ObjectNode root = report(5.0, "image2");
    ((ArrayNode) root.get("streams")).addObject().put("codec_type", "video");

    MediaInfo info = runner("ffmpeg", "ffprobe").parseProbeOutput(root);

    assertThat(info.hasAudio()).isFalse();
    assertThat(info.codec()).isNull();
  }

  @Test
  void parseProbeOutput_shouldFallBackToStreamDuration() {
    ObjectNode root = objectMapper.createObjectNode();
    root.putObject("format").put("format_name", "wav");
    audioStream(root.putArray("streams")).put("duration", "3.25");

    MediaInfo info = runner("ffmpeg", "ffprobe").parseProbeOutput(root);

    assertThat(info.durationSeconds()).isEqualTo(3.25);
  }

  @Test
  void probe_shouldFailWhenToolCannotBeStarted() {
    FfmpegAudioToolRunner runner =
        runner(
            tempDir.resolve("missing-ffmpeg").toString(),
            tempDir.resolve("missing-ffprobe").toString());

    assertThatThrownBy(() -> runner.probe(tempDir.resolve("input.wav")))
        .isInstanceOf(AudioToolException.class)
        .hasMessage("probe could not be executed");
  }

  @Test
  void concatenate_shouldRejectEmptyInput() {
    FfmpegAudioToolRunner runner = runner("ffmpeg", "ffprobe");

    assertThatThrownBy(() -> runner.concatenate(List.of(), tempDir.resolve("out.wav")))
        .isInstanceOf(AudioToolException.class);
  }
}

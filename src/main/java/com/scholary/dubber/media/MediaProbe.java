package com.scholary.dubber.media;

import com.scholary.dubber.PipelineStage;
import com.scholary.dubber.audio.AudioToolException;
import com.scholary.dubber.audio.AudioToolRunner;
import com.scholary.dubber.audio.AudioToolTimeoutException;
import com.scholary.dubber.audio.MediaInfo;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Inspects source media and pulls the audio track out of video inputs.
 *
 * <p>Inputs are never modified. Extraction writes exactly one new file at the requested location.
 */
@Component
public class MediaProbe {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaProbe.class);

  private final AudioToolRunner audioTools;

  public MediaProbe(AudioToolRunner audioTools) {
    this.audioTools = audioTools;
  }

  /**
   * Probe a media file.
   *
   * @throws MediaNotFoundException if the path does not point to a readable file
   * @throws UnsupportedFormatException if the file cannot be decoded or has no audio stream
   * @throws ProbeTimeoutException if probing takes longer than the configured timeout
   */
  public MediaInfo probe(Path path) {
    requireReadable(path);

    MediaInfo info;
    try {
      info = audioTools.probe(path);
    } catch (AudioToolTimeoutException e) {
      throw new ProbeTimeoutException(PipelineStage.PROBE, "Media probe timed out", e);
    } catch (AudioToolException e) {
      throw new UnsupportedFormatException(
          PipelineStage.PROBE, "Media file could not be decoded", e);
    }

    if (!info.hasAudio()) {
      throw new UnsupportedFormatException(PipelineStage.PROBE, "Media file has no audio stream");
    }

    LOGGER.info(
        "Probed media: file={}, duration={}s, format={}, codec={}, sampleRate={}, channels={},"
            + " video={}",
        path.getFileName(),
        info.durationSeconds(),
        info.formatName(),
        info.codec(),
        info.sampleRate(),
        info.channels(),
        info.hasVideo());
    return info;
  }

  /**
   * Extract the audio track of a (video) file into {@code outPath}.
   *
   * @param format {@code wav}, {@code mp3}, or any other value for a stream copy
   * @return {@code outPath}
   */
  public Path extractAudioTrack(Path videoPath, Path outPath, String format) {
    requireReadable(videoPath);

    LOGGER.info("Extracting audio track: file={}, format={}", videoPath.getFileName(), format);
    try {
      audioTools.extractAudio(videoPath, outPath, format);
    } catch (AudioToolTimeoutException e) {
      throw new ProbeTimeoutException(PipelineStage.EXTRACTION, "Audio extraction timed out", e);
    } catch (AudioToolException e) {
      throw new UnsupportedFormatException(
          PipelineStage.EXTRACTION, "Audio track could not be extracted", e);
    }

    if (!Files.isRegularFile(outPath)) {
      throw new UnsupportedFormatException(
          PipelineStage.EXTRACTION, "Audio extraction produced no output");
    }
    return outPath;
  }

  private static void requireReadable(Path path) {
    if (path == null || !Files.isRegularFile(path) || !Files.isReadable(path)) {
      throw new MediaNotFoundException("Media file not found");
    }
  }
}

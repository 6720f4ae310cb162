package com.scholary.dubber.export;

import com.scholary.dubber.PipelineStage;
import com.scholary.dubber.audio.AudioToolException;
import com.scholary.dubber.audio.AudioToolRunner;
import com.scholary.dubber.audio.FfmpegProperties;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Writes the deliverables of one dubbed language to the output directory.
 *
 * <p>Layout under {@code <outputDir>/<jobId>/<language>/}:
 *
 * <ul>
 *   <li>{@code <jobId>-<language>-full_mix.<ext>}
 *   <li>{@code <jobId>-<language>-voice_only.<ext>}
 *   <li>{@code <jobId>-<language>-captions.srt}
 *   <li>{@code <jobId>-<language>-transcript.json}
 *   <li>{@code <jobId>-<language>-bundle.zip} holding the four files above
 * </ul>
 *
 * <p>{@code <ext>} is the configured export format. With {@code wav} the canonical files are
 * copied as they are; other formats are encoded at the configured bitrate.
 */
@Component
public class Exporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(Exporter.class);

  private final AudioToolRunner audioTools;
  private final CaptionWriter captionWriter;
  private final Path outputRoot;
  private final String format;
  private final String bitrate;

  public Exporter(
      AudioToolRunner audioTools,
      CaptionWriter captionWriter,
      FfmpegProperties ffmpegProperties,
      @Value("${dubbing.outputDir}") String outputDir) {
    this.audioTools = audioTools;
    this.captionWriter = captionWriter;
    this.outputRoot = Paths.get(outputDir);
    this.format = ffmpegProperties.exportFormat().toLowerCase(Locale.ROOT);
    this.bitrate = ffmpegProperties.exportBitrate();
  }

  /**
   * Export one language.
   *
   * @param finalMix canonical final mix
   * @param voiceTrack canonical voice-only track
   * @throws ExportException if any file cannot be written
   */
  public ExportResult export(
      String jobId,
      String language,
      Path finalMix,
      Path voiceTrack,
      List<CaptionCue> cues,
      TranscriptDocument transcript) {
    String prefix = jobId + "-" + language;
    try {
      Path dir = Files.createDirectories(outputRoot.resolve(jobId).resolve(language));

      Path finalAudio = dir.resolve(prefix + "-full_mix." + format);
      Path voiceOnly = dir.resolve(prefix + "-voice_only." + format);
      deliver(finalMix, finalAudio);
      deliver(voiceTrack, voiceOnly);

      Path captions = dir.resolve(prefix + "-captions.srt");
      Files.write(captions, captionWriter.writeSrt(cues));

      Path transcriptJson = dir.resolve(prefix + "-transcript.json");
      Files.write(transcriptJson, captionWriter.writeJson(transcript));

      Path bundle = dir.resolve(prefix + "-bundle.zip");
      zip(bundle, List.of(finalAudio, voiceOnly, captions, transcriptJson));

      LOGGER.info("Exported {} to {}", prefix, dir);
      return new ExportResult(finalAudio, voiceOnly, captions, transcriptJson, bundle);

    } catch (IOException | AudioToolException e) {
      throw new ExportException(PipelineStage.EXPORT, "Deliverables could not be written", e);
    }
  }

  private void deliver(Path canonical, Path target) throws IOException {
    if ("wav".equals(format)) {
      Files.copy(canonical, target, StandardCopyOption.REPLACE_EXISTING);
    } else {
      audioTools.encode(canonical, target, format, bitrate);
    }
  }

  private static void zip(Path archive, List<Path> files) throws IOException {
    try (OutputStream out = Files.newOutputStream(archive);
        ZipOutputStream zip = new ZipOutputStream(out)) {
      for (Path file : files) {
        zip.putNextEntry(new ZipEntry(file.getFileName().toString()));
        Files.copy(file, zip);
        zip.closeEntry();
      }
    }
  }
}

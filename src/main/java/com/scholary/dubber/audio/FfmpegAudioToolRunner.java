package com.scholary.dubber.audio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link AudioToolRunner} backed by the ffmpeg and ffprobe binaries.
 *
 * <p>Each call starts one subprocess with an explicit argument list (no shell), captures its
 * combined output into a scratch log file and waits for it with a timeout. On timeout the process
 * is destroyed forcibly. The tail of the log is attached to the exception on a non-zero exit so
 * failures can be diagnosed from the application log.
 */
@Component
public class FfmpegAudioToolRunner implements AudioToolRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioToolRunner.class);

  private static final int LOG_TAIL_LINES = 5;

  private final FfmpegProperties properties;
  private final ObjectMapper objectMapper;

  public FfmpegAudioToolRunner(FfmpegProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public MediaInfo probe(Path input) {
    List<String> command =
        List.of(
            properties.ffprobePath(),
            "-v",
            "quiet",
            "-print_format",
            "json",
            "-show_format",
            "-show_streams",
            input.toString());

    String output = run(command, properties.probeTimeoutSeconds(), "probe", false);
    try {
      return parseProbeOutput(objectMapper.readTree(output));
    } catch (IOException e) {
      throw new AudioToolException("Unreadable ffprobe output", e);
    }
  }

  /**
   * Map ffprobe's JSON report to a {@link MediaInfo}.
   *
   * <p>Embedded cover art shows up as a video stream flagged {@code attached_pic}; it does not make
   * the file a video.
   */
  MediaInfo parseProbeOutput(JsonNode root) {
    JsonNode format = root.path("format");
    double duration = format.path("duration").asDouble(0.0);
    String formatName = format.path("format_name").asText(null);

    boolean hasVideo = false;
    JsonNode audioStream = null;
    for (JsonNode stream : root.path("streams")) {
      String codecType = stream.path("codec_type").asText("");
      if ("audio".equals(codecType) && audioStream == null) {
        audioStream = stream;
      } else if ("video".equals(codecType)
          && stream.path("disposition").path("attached_pic").asInt(0) == 0) {
        hasVideo = true;
      }
    }

    if (audioStream == null) {
      return new MediaInfo(duration, false, hasVideo, 0, 0, null, formatName);
    }
    if (duration <= 0.0) {
      duration = audioStream.path("duration").asDouble(0.0);
    }
    return new MediaInfo(
        duration,
        true,
        hasVideo,
        audioStream.path("sample_rate").asInt(0),
        audioStream.path("channels").asInt(0),
        audioStream.path("codec_name").asText(null),
        formatName);
  }

  @Override
  public void extractAudio(Path input, Path output, String format) {
    List<String> command = ffmpeg("-i", input.toString(), "-vn");
    switch (format.toLowerCase(Locale.ROOT)) {
      case "wav" -> command.addAll(canonicalCodecArgs());
      case "mp3" -> command.addAll(List.of("-acodec", "libmp3lame", "-q:a", "2"));
      default -> command.addAll(List.of("-acodec", "copy"));
    }
    command.add(output.toString());
    run(command, properties.extractTimeoutSeconds(), "extract audio", true);
  }

  @Override
  public void normalize(Path input, Path output) {
    List<String> command = ffmpeg("-i", input.toString(), "-vn");
    command.addAll(canonicalCodecArgs());
    command.add(output.toString());
    run(command, properties.processTimeoutSeconds(), "normalize", true);
  }

  @Override
  public void extractClip(Path input, double startSeconds, double durationSeconds, Path output) {
    List<String> command =
        ffmpeg(
            "-ss",
            seconds(startSeconds),
            "-t",
            seconds(durationSeconds),
            "-i",
            input.toString(),
            "-vn");
    command.addAll(canonicalCodecArgs());
    command.add(output.toString());
    run(command, properties.processTimeoutSeconds(), "extract clip", true);
  }

  @Override
  public void stretchTempo(Path input, double factor, Path output) {
    List<String> command =
        ffmpeg(
            "-i",
            input.toString(),
            "-filter:a",
            String.format(Locale.ROOT, "atempo=%.4f", factor));
    command.addAll(canonicalCodecArgs());
    command.add(output.toString());
    run(command, properties.processTimeoutSeconds(), "stretch tempo", true);
  }

  @Override
  public void padToDuration(Path input, double durationSeconds, Path output) {
    List<String> command =
        ffmpeg(
            "-i",
            input.toString(),
            "-af",
            "apad=whole_dur=" + seconds(durationSeconds),
            "-t",
            seconds(durationSeconds));
    command.addAll(canonicalCodecArgs());
    command.add(output.toString());
    run(command, properties.processTimeoutSeconds(), "pad", true);
  }

  @Override
  public void trimToDuration(Path input, double durationSeconds, Path output) {
    List<String> command = ffmpeg("-i", input.toString(), "-t", seconds(durationSeconds));
    command.addAll(canonicalCodecArgs());
    command.add(output.toString());
    run(command, properties.processTimeoutSeconds(), "trim", true);
  }

  @Override
  public void generateSilence(double durationSeconds, Path output) {
    String layout = properties.channels() == 1 ? "mono" : "stereo";
    List<String> command =
        ffmpeg(
            "-f",
            "lavfi",
            "-i",
            "anullsrc=r=" + properties.sampleRate() + ":cl=" + layout,
            "-t",
            seconds(durationSeconds));
    command.addAll(canonicalCodecArgs());
    command.add(output.toString());
    run(command, properties.processTimeoutSeconds(), "silence", true);
  }

  @Override
  public void concatenate(List<Path> inputs, Path output) {
    if (inputs.isEmpty()) {
      throw new AudioToolException("Nothing to concatenate");
    }

    Path listFile = output.resolveSibling(output.getFileName() + ".concat.txt");
    try {
      StringBuilder list = new StringBuilder();
      for (Path input : inputs) {
        // concat demuxer quoting: close the quote, escape, reopen
        String escaped = input.toAbsolutePath().toString().replace("'", "'\\''");
        list.append("file '").append(escaped).append("'\n");
      }
      Files.writeString(listFile, list.toString(), StandardCharsets.UTF_8);

      List<String> command =
          ffmpeg("-f", "concat", "-safe", "0", "-i", listFile.toString(), "-vn");
      command.addAll(canonicalCodecArgs());
      command.add(output.toString());
      run(command, properties.extractTimeoutSeconds(), "concatenate", true);
    } catch (IOException e) {
      throw new AudioToolException("Failed to write concat list", e);
    } finally {
      deleteQuietly(listFile);
    }
  }

  @Override
  public void encode(Path input, Path output, String format, String bitrate) {
    List<String> command = ffmpeg("-i", input.toString(), "-vn");
    switch (format.toLowerCase(Locale.ROOT)) {
      case "m4a", "aac" -> command.addAll(List.of("-c:a", "aac", "-b:a", bitrate));
      case "mp3" -> command.addAll(List.of("-c:a", "libmp3lame", "-b:a", bitrate));
      case "wav" -> command.addAll(List.of("-c:a", "pcm_s16le"));
      default -> throw new AudioToolException("Unsupported export format: " + format);
    }
    command.addAll(
        List.of(
            "-ar",
            String.valueOf(properties.sampleRate()),
            "-ac",
            String.valueOf(properties.channels())));
    command.add(output.toString());
    run(command, properties.extractTimeoutSeconds(), "encode " + format, true);
  }

  private List<String> ffmpeg(String... args) {
    List<String> command = new ArrayList<>();
    command.add(properties.ffmpegPath());
    command.add("-y");
    command.add("-hide_banner");
    command.addAll(Arrays.asList(args));
    return command;
  }

  private List<String> canonicalCodecArgs() {
    return List.of(
        "-ar",
        String.valueOf(properties.sampleRate()),
        "-ac",
        String.valueOf(properties.channels()),
        "-c:a",
        "pcm_s16le");
  }

  private static String seconds(double value) {
    return String.format(Locale.ROOT, "%.3f", value);
  }

  /**
   * Run one tool invocation.
   *
   * @param mergeStderr merge stderr into the captured output; ffprobe keeps them apart so its JSON
   *     stays parseable
   * @return the captured output
   */
  private String run(
      List<String> command, int timeoutSeconds, String operation, boolean mergeStderr) {
    LOGGER.debug("Executing {}: {}", operation, String.join(" ", command));
    long startedAt = System.currentTimeMillis();

    Path log = null;
    Process process = null;
    try {
      log = Files.createTempFile("audio-tool-", ".log");
      ProcessBuilder builder = new ProcessBuilder(command).redirectOutput(log.toFile());
      if (mergeStderr) {
        builder.redirectErrorStream(true);
      } else {
        builder.redirectError(ProcessBuilder.Redirect.DISCARD);
      }
      process = builder.start();

      boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
      if (!finished) {
        process.destroyForcibly();
        process.waitFor(5, TimeUnit.SECONDS);
        throw new AudioToolTimeoutException(
            String.format("%s timed out after %ds", operation, timeoutSeconds));
      }

      String output = Files.readString(log, StandardCharsets.UTF_8);
      int exitCode = process.exitValue();
      if (exitCode != 0) {
        throw new AudioToolException(
            String.format("%s failed with exit code %d: %s", operation, exitCode, tail(output)));
      }

      LOGGER.debug("{} finished in {}ms", operation, System.currentTimeMillis() - startedAt);
      return output;

    } catch (IOException e) {
      throw new AudioToolException(operation + " could not be executed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (process != null) {
        process.destroyForcibly();
      }
      throw new AudioToolException(operation + " interrupted", e);
    } finally {
      if (log != null) {
        deleteQuietly(log);
      }
    }
  }

  private static String tail(String output) {
    String[] lines = output.strip().split("\\R");
    int from = Math.max(0, lines.length - LOG_TAIL_LINES);
    return String.join(" | ", Arrays.copyOfRange(lines, from, lines.length));
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete scratch file {}: {}", path, e.getMessage());
    }
  }
}

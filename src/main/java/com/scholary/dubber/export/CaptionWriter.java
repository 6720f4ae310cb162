package com.scholary.dubber.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Writes captions and transcripts.
 *
 * <p>Supports SRT (SubRip, for players and subtitle editors) and JSON (machine-readable).
 */
@Component
public class CaptionWriter {

  private final ObjectMapper objectMapper;

  public CaptionWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Write captions as SRT.
   *
   * <p>Format:
   *
   * <pre>
   * 1
   * 00:00:00,000 --> 00:00:05,200
   * Hola mundo
   *
   * 2
   * 00:00:05,200 --> 00:00:10,300
   * Esto es una prueba
   * </pre>
   */
  public byte[] writeSrt(List<CaptionCue> cues) {
    StringBuilder srt = new StringBuilder();

    for (int i = 0; i < cues.size(); i++) {
      CaptionCue cue = cues.get(i);

      srt.append(i + 1).append("\n");
      srt.append(formatSrtTime(cue.start()))
          .append(" --> ")
          .append(formatSrtTime(cue.end()))
          .append("\n");
      srt.append(cue.text()).append("\n");
      srt.append("\n");
    }

    return srt.toString().getBytes(StandardCharsets.UTF_8);
  }

  /** Write the transcript document as pretty-printed JSON. */
  public byte[] writeJson(TranscriptDocument document) throws IOException {
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
  }

  /**
   * Format a time in seconds as SRT timecode.
   *
   * <p>Format: HH:MM:SS,mmm (hours:minutes:seconds,milliseconds)
   */
  static String formatSrtTime(double seconds) {
    long totalMillis = Math.round(Math.max(0.0, seconds) * 1000);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis % 3_600_000) / 60_000;
    long secs = (totalMillis % 60_000) / 1000;
    long millis = totalMillis % 1000;

    return String.format("%02d:%02d:%02d,%03d", hours, minutes, secs, millis);
  }
}

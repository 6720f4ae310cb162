package com.scholary.dubber.timeline;

import com.scholary.dubber.audio.AudioToolException;
import com.scholary.dubber.audio.AudioToolRunner;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Concatenates rendered segments, in timeline order, into one continuous voice track. */
@Component
public class TimelineReconstructor {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimelineReconstructor.class);

  private final AudioToolRunner audioTools;

  public TimelineReconstructor(AudioToolRunner audioTools) {
    this.audioTools = audioTools;
  }

  /**
   * Assemble the voice track.
   *
   * @param segments rendered segments, one per timeline slot
   * @param output where to write the canonical track
   * @return {@code output}
   * @throws ReconstructionException if a segment file is missing or concatenation fails
   */
  public Path reconstruct(List<ProcessedSegmentAudio> segments, Path output) {
    if (segments.isEmpty()) {
      throw new ReconstructionException("No segments to reconstruct");
    }

    List<ProcessedSegmentAudio> ordered = new ArrayList<>(segments);
    ordered.sort(Comparator.comparingInt(ProcessedSegmentAudio::segmentIndex));

    List<Path> files = new ArrayList<>(ordered.size());
    double expectedDuration = 0.0;
    for (ProcessedSegmentAudio segment : ordered) {
      if (!Files.isRegularFile(segment.filePath())) {
        throw new ReconstructionException(
            "Audio for segment " + segment.segmentIndex() + " is missing");
      }
      files.add(segment.filePath());
      expectedDuration += segment.actualDuration();
    }

    try {
      audioTools.concatenate(files, output);
    } catch (AudioToolException e) {
      throw new ReconstructionException("Voice track could not be assembled", e);
    }

    LOGGER.info(
        "Reconstructed voice track: {} segments, expected duration={}s",
        files.size(),
        String.format("%.3f", expectedDuration));
    return output;
  }
}

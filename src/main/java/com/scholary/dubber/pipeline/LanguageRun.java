package com.scholary.dubber.pipeline;

import com.scholary.dubber.timeline.Segment;
import com.scholary.dubber.voice.SpeakerProfile;
import java.nio.file.Path;
import java.util.List;

/**
 * Everything one target language needs, computed once per job by the shared stages.
 *
 * @param background background bed, or null for a voice-only mix
 * @param workDir scratch directory owned by this run
 */
public record LanguageRun(
    String jobId,
    String sourceLanguage,
    String targetLanguage,
    String transcript,
    List<Segment> segments,
    List<SpeakerProfile> speakerProfiles,
    Path background,
    Path workDir,
    ProgressListener listener) {

  public LanguageRun {
    segments = List.copyOf(segments);
    speakerProfiles = List.copyOf(speakerProfiles);
  }
}

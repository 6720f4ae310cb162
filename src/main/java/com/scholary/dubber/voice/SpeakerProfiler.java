package com.scholary.dubber.voice;

import com.scholary.dubber.audio.AudioToolException;
import com.scholary.dubber.audio.AudioToolRunner;
import com.scholary.dubber.transcription.Utterance;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds a pitch profile for each diarized speaker.
 *
 * <p>The representative sample of a speaker is their longest utterance lasting at least {@code
 * minSampleDuration}. It is cut from the source audio and handed to the {@link PitchEstimator}.
 * Speakers without a qualifying utterance, or whose sample could not be cut, get no profile and
 * fall back to the language's default voice.
 */
@Component
public class SpeakerProfiler {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpeakerProfiler.class);

  private final AudioToolRunner audioTools;
  private final PitchEstimator pitchEstimator;
  private final double minSampleDuration;

  public SpeakerProfiler(
      AudioToolRunner audioTools,
      PitchEstimator pitchEstimator,
      @Value("${dubbing.speakers.minSampleDuration}") double minSampleDuration) {
    this.audioTools = audioTools;
    this.pitchEstimator = pitchEstimator;
    this.minSampleDuration = minSampleDuration;
  }

  /**
   * Profile the speakers of a recording.
   *
   * @param sourceAudio the audio the utterances were transcribed from
   * @param utterances diarized utterances
   * @param workDir directory for sample clips
   * @return profiles in order of each speaker's first appearance
   */
  public List<SpeakerProfile> profileSpeakers(
      Path sourceAudio, List<Utterance> utterances, Path workDir) {
    Map<String, Utterance> longest = selectSamples(utterances);

    List<SpeakerProfile> profiles = new ArrayList<>();
    for (Map.Entry<String, Utterance> entry : longest.entrySet()) {
      String speakerId = entry.getKey();
      Utterance sample = entry.getValue();
      Path clip = workDir.resolve("speaker_" + sanitize(speakerId) + "_sample.wav");
      try {
        audioTools.extractClip(sourceAudio, sample.start(), sample.duration(), clip);
      } catch (AudioToolException e) {
        LOGGER.warn("Sample for speaker {} could not be cut: {}", speakerId, e.getMessage());
        continue;
      }

      double pitch = pitchEstimator.estimatePitch(clip);
      LOGGER.info(
          "Speaker profile: speaker={}, sample=[{}-{}], pitch={}Hz",
          speakerId,
          sample.start(),
          sample.end(),
          String.format("%.1f", pitch));
      profiles.add(new SpeakerProfile(speakerId, pitch));
    }
    return profiles;
  }

  /** Longest utterance of at least the minimum sample duration, per speaker. */
  Map<String, Utterance> selectSamples(List<Utterance> utterances) {
    Map<String, Utterance> longest = new LinkedHashMap<>();
    for (Utterance utterance : utterances) {
      if (utterance.speakerId() == null || utterance.duration() < minSampleDuration) {
        continue;
      }
      Utterance current = longest.get(utterance.speakerId());
      if (current == null || utterance.duration() > current.duration()) {
        longest.put(utterance.speakerId(), utterance);
      }
    }
    return longest;
  }

  private static String sanitize(String speakerId) {
    return speakerId.replaceAll("[^A-Za-z0-9_-]", "_");
  }
}

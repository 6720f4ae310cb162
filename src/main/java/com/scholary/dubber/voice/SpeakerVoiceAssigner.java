package com.scholary.dubber.voice;

import com.scholary.dubber.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps speakers to catalog voices by pitch rank.
 *
 * <p>Speakers and voices are both sorted by ascending pitch; the i-th speaker gets voice {@code i
 * mod catalogSize}. This is rank matching, not nearest-pitch matching: with more speakers than
 * voices the assignment wraps around. Sorting is stable, so speakers with equal pitch keep their
 * input order and the result is deterministic.
 */
@Component
public class SpeakerVoiceAssigner {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpeakerVoiceAssigner.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  /**
   * Assign voices.
   *
   * @param profiles pitch profiles of the speakers that have a usable sample
   * @param catalog voices available for the target language
   * @param defaultVoice voice for speakers without a profile, or for every speaker when the
   *     catalog is empty
   * @param speakerIds every speaker appearing on the timeline
   * @return speaker id to voice name, covering all {@code speakerIds} and profiled speakers
   */
  public Map<String, String> assign(
      List<SpeakerProfile> profiles,
      List<VoiceCatalogEntry> catalog,
      String defaultVoice,
      Collection<String> speakerIds) {

    List<SpeakerProfile> speakers = new ArrayList<>(profiles);
    speakers.sort(Comparator.comparingDouble(SpeakerProfile::estimatedPitchHz));

    List<VoiceCatalogEntry> voices = new ArrayList<>(catalog);
    voices.sort(Comparator.comparingDouble(VoiceCatalogEntry::pitchHz));

    Map<String, String> assignments = new LinkedHashMap<>();
    for (int i = 0; i < speakers.size(); i++) {
      SpeakerProfile speaker = speakers.get(i);
      String voice = voices.isEmpty() ? defaultVoice : voices.get(i % voices.size()).voiceName();
      assignments.put(speaker.speakerId(), voice);
      STRUCTURED_LOGGER.logVoiceAssigned(speaker.speakerId(), speaker.estimatedPitchHz(), voice);
    }

    for (String speakerId : speakerIds) {
      if (!assignments.containsKey(speakerId)) {
        assignments.put(speakerId, defaultVoice);
        LOGGER.info("Speaker {} has no usable sample, using default {}", speakerId, defaultVoice);
      }
    }
    return assignments;
  }
}

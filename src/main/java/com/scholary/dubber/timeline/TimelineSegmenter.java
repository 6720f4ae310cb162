package com.scholary.dubber.timeline;

import com.scholary.dubber.transcription.Utterance;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns diarized utterances into a gap-free timeline of speech and silence segments.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Walk utterances in start order, keeping a cursor at the end of the last segment
 *   <li>A gap of at least {@code silenceGapThreshold} before an utterance becomes a silence segment
 *   <li>A shorter gap is absorbed by moving the speech segment's start back to the cursor
 *   <li>Speech lasts at least {@code minSpeechDuration}; overlapping utterances start at the cursor
 *   <li>The tail after the last utterance becomes silence when it exceeds the threshold, otherwise
 *       the last segment is extended over it
 * </ol>
 *
 * <p>The result starts at 0, ends at the total duration and has no gaps or overlaps, so the
 * segment durations add up to the source duration.
 *
 * <p>Why absorb short gaps instead of dropping them? Because every segment is rendered to a clip
 * of exactly its duration and the clips are concatenated back to back. A gap that belongs to no
 * segment would shift all later speech earlier in the dub.
 */
@Component
public class TimelineSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimelineSegmenter.class);

  private final double silenceGapThreshold;
  private final double minSpeechDuration;

  public TimelineSegmenter(
      @Value("${dubbing.segmentation.silenceGapThreshold}") double silenceGapThreshold,
      @Value("${dubbing.segmentation.minSpeechDuration}") double minSpeechDuration) {
    this.silenceGapThreshold = silenceGapThreshold;
    this.minSpeechDuration = minSpeechDuration;
  }

  /**
   * Build the timeline.
   *
   * @param utterances transcribed utterances, in any order
   * @param totalDuration duration of the source audio in seconds
   * @return ordered segments covering {@code [0, totalDuration)}
   */
  public List<Segment> segment(List<Utterance> utterances, double totalDuration) {
    List<Segment> segments = new ArrayList<>();
    if (totalDuration <= 0) {
      return segments;
    }

    // Diarized utterances usually arrive in order, but sort to be safe
    List<Utterance> ordered = new ArrayList<>(utterances);
    ordered.sort(Comparator.comparingDouble(Utterance::start));

    // Cursor is the end of the last emitted segment; every new segment starts exactly there
    double cursor = 0.0;
    for (Utterance utterance : ordered) {
      String text = utterance.text() == null ? "" : utterance.text().trim();
      if (text.isEmpty()) {
        continue;
      }

      // Overlapping speakers: the later utterance waits for the earlier one to finish
      double start = Math.max(utterance.start(), cursor);
      if (start >= totalDuration) {
        LOGGER.warn(
            "Dropping utterance beyond source duration: start={}s, total={}s",
            utterance.start(),
            totalDuration);
        continue;
      }

      // A real pause becomes its own silence segment
      // A breath between words is folded into the speech that follows it
      if (start - cursor >= silenceGapThreshold) {
        segments.add(Segment.silence(cursor, start));
      } else {
        start = cursor;
      }

      // Zero-length utterances still need a clip to hold their text
      // Nothing may run past the end of the source
      double end = Math.max(utterance.end(), start + minSpeechDuration);
      end = Math.min(end, totalDuration);

      segments.add(Segment.speech(start, end, text, utterance.speakerId()));
      cursor = end;
    }

    // Close the timeline at the source duration
    // Without speech the whole recording is one silence segment
    double remaining = totalDuration - cursor;
    if (segments.isEmpty() || remaining > silenceGapThreshold) {
      segments.add(Segment.silence(cursor, totalDuration));
    } else if (remaining > 0) {
      // Too short to stand alone: stretch the last segment to the end instead
      Segment last = segments.remove(segments.size() - 1);
      segments.add(
          new Segment(
              last.start(),
              totalDuration,
              totalDuration - last.start(),
              last.silence(),
              last.text(),
              last.speakerId(),
              last.voiceId()));
    }

    LOGGER.info(
        "Segmented timeline: {} segments ({} speech) from {} utterances over {}s",
        segments.size(),
        segments.stream().filter(s -> !s.silence()).count(),
        utterances.size(),
        totalDuration);
    return segments;
  }
}

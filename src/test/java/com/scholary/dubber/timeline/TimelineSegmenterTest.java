package com.scholary.dubber.timeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.scholary.dubber.transcription.Utterance;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimelineSegmenterTest {

  private TimelineSegmenter segmenter;

  @BeforeEach
  void setUp() {
    segmenter = new TimelineSegmenter(0.1, 0.05);
  }

  @Test
  void segment_shouldInsertSilenceBetweenAndAfterUtterances() {
    List<Utterance> utterances =
        List.of(
            new Utterance(0.0, 4.0, "Hola", "0", 0.9),
            new Utterance(5.0, 9.0, "Buenos días", "1", 0.9));

    List<Segment> segments = segmenter.segment(utterances, 10.0);

    assertThat(segments).hasSize(4);
    assertThat(segments.get(0).silence()).isFalse();
    assertThat(segments.get(0).text()).isEqualTo("Hola");
    assertThat(segments.get(0).speakerId()).isEqualTo("0");
    assertThat(segments.get(1).silence()).isTrue();
    assertThat(segments.get(1).start()).isEqualTo(4.0);
    assertThat(segments.get(1).end()).isEqualTo(5.0);
    assertThat(segments.get(2).text()).isEqualTo("Buenos días");
    assertThat(segments.get(3).silence()).isTrue();
    assertThat(segments.get(3).end()).isEqualTo(10.0);
  }

  @Test
  void segment_shouldStartWithSilenceWhenSpeechStartsLate() {
    List<Segment> segments =
        segmenter.segment(List.of(new Utterance(1.5, 3.0, "hello", "0", 1.0)), 3.0);

    assertThat(segments).hasSize(2);
    assertThat(segments.get(0).silence()).isTrue();
    assertThat(segments.get(0).duration()).isEqualTo(1.5);
    assertThat(segments.get(1).start()).isEqualTo(1.5);
  }

  @Test
  void segment_shouldAbsorbGapsShorterThanThreshold() {
    List<Utterance> utterances =
        List.of(
            new Utterance(0.0, 2.0, "one", "0", 1.0),
            new Utterance(2.05, 4.0, "two", "0", 1.0));

    List<Segment> segments = segmenter.segment(utterances, 4.0);

    assertThat(segments).hasSize(2);
    assertThat(segments).noneMatch(Segment::silence);
    assertThat(segments.get(1).start()).isEqualTo(2.0);
  }

  @Test
  void segment_shouldCoverWholeDurationWithoutGaps() {
    List<Utterance> utterances =
        List.of(
            new Utterance(0.3, 1.2, "a", "0", 1.0),
            new Utterance(1.0, 2.5, "overlapping", "1", 1.0),
            new Utterance(2.52, 2.52, "instant", "0", 1.0),
            new Utterance(4.0, 6.97, "last", "1", 1.0));

    List<Segment> segments = segmenter.segment(utterances, 7.0);

    assertThat(segments.get(0).start()).isEqualTo(0.0);
    assertThat(segments.get(segments.size() - 1).end()).isEqualTo(7.0);
    double total = 0.0;
    for (int i = 0; i < segments.size(); i++) {
      Segment segment = segments.get(i);
      assertThat(segment.duration()).isGreaterThanOrEqualTo(0.0);
      if (i > 0) {
        assertThat(segment.start()).isCloseTo(segments.get(i - 1).end(), within(1e-9));
      }
      total += segment.duration();
    }
    assertThat(total).isCloseTo(7.0, within(1e-9));
  }

  @Test
  void segment_shouldGiveInstantUtterancesMinimumDuration() {
    List<Segment> segments =
        segmenter.segment(List.of(new Utterance(1.0, 1.0, "uh", "0", 1.0)), 2.0);

    Segment speech = segments.stream().filter(s -> !s.silence()).findFirst().orElseThrow();
    assertThat(speech.duration()).isCloseTo(0.05, within(1e-9));
  }

  @Test
  void segment_shouldReturnSingleSilenceWithoutUtterances() {
    List<Segment> segments = segmenter.segment(List.of(), 12.5);

    assertThat(segments).hasSize(1);
    assertThat(segments.get(0).silence()).isTrue();
    assertThat(segments.get(0).duration()).isEqualTo(12.5);
  }

  @Test
  void segment_shouldDropBlankAndOutOfRangeUtterances() {
    List<Utterance> utterances =
        List.of(
            new Utterance(0.0, 1.0, "  ", "0", 1.0),
            new Utterance(1.0, 2.0, "kept", "0", 1.0),
            new Utterance(5.0, 6.0, "too late", "0", 1.0));

    List<Segment> segments = segmenter.segment(utterances, 3.0);

    assertThat(segments).filteredOn(s -> !s.silence()).extracting(Segment::text)
        .containsExactly("kept");
    assertThat(segments.get(segments.size() - 1).end()).isEqualTo(3.0);
  }

  @Test
  void segment_shouldAbsorbShortTailIntoLastSegment() {
    List<Segment> segments =
        segmenter.segment(List.of(new Utterance(0.0, 2.95, "almost", "0", 1.0)), 3.0);

    assertThat(segments).hasSize(1);
    assertThat(segments.get(0).end()).isEqualTo(3.0);
    assertThat(segments.get(0).duration()).isEqualTo(3.0);
  }

  @Test
  void segment_shouldTreatThresholdAsSilenceBetweenUtterancesButNotAtTheTail() {
    TimelineSegmenter halfSecond = new TimelineSegmenter(0.5, 0.05);
    List<Utterance> utterances =
        List.of(
            new Utterance(0.0, 2.0, "first", "0", 1.0),
            new Utterance(2.5, 9.5, "second", "0", 1.0));

    List<Segment> segments = halfSecond.segment(utterances, 10.0);

    assertThat(segments).hasSize(3);
    assertThat(segments.get(1).silence()).isTrue();
    assertThat(segments.get(1).start()).isEqualTo(2.0);
    assertThat(segments.get(1).end()).isEqualTo(2.5);
    assertThat(segments.get(2).text()).isEqualTo("second");
    assertThat(segments.get(2).end()).isEqualTo(10.0);
    assertThat(segments.get(2).duration()).isEqualTo(7.5);
  }

  @Test
  void segment_shouldClampSpeechToTotalDuration() {
    List<Segment> segments =
        segmenter.segment(List.of(new Utterance(0.0, 3.4, "overrun", "0", 1.0)), 3.0);

    assertThat(segments).hasSize(1);
    assertThat(segments.get(0).end()).isEqualTo(3.0);
  }

  @Test
  void segment_shouldReturnEmptyForZeroDuration() {
    assertThat(segmenter.segment(List.of(), 0.0)).isEmpty();
  }
}

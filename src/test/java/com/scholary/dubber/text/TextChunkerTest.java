package com.scholary.dubber.text;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextChunkerTest {

  private final TextChunker chunker = new TextChunker();

  @Test
  void splitForProcessing_shouldReturnShortTextAsSingleChunk() {
    assertThat(chunker.splitForProcessing("  Hola   mundo ", 1000)).containsExactly("Hola mundo");
  }

  @Test
  void splitForProcessing_shouldReturnEmptyForBlankText() {
    assertThat(chunker.splitForProcessing("   ", 10)).isEmpty();
    assertThat(chunker.splitForProcessing(null, 10)).isEmpty();
  }

  @Test
  void splitForProcessing_shouldPreferSentenceBoundaries() {
    String text = "First sentence here. Second one! Third? Fourth.";

    List<String> chunks = chunker.splitForProcessing(text, 25);

    assertThat(chunks).containsExactly("First sentence here.", "Second one! Third?", "Fourth.");
  }

  @Test
  void splitForProcessing_shouldSplitLongSentencesAtWords() {
    String text = "alpha beta gamma delta epsilon zeta eta theta";

    List<String> chunks = chunker.splitForProcessing(text, 12);

    assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(12));
    assertThat(String.join(" ", chunks)).isEqualTo(text);
  }

  @Test
  void splitForProcessing_shouldKeepOverlongWordWhole() {
    List<String> chunks = chunker.splitForProcessing("a supercalifragilistic b", 5);

    assertThat(chunks).containsExactly("a", "supercalifragilistic", "b");
  }

  @Test
  void splitForProcessing_shouldPreserveContentWhenJoined() {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < 200; i++) {
      text.append("Sentence number ").append(i).append(" goes   here. ");
    }

    List<String> chunks = chunker.splitForProcessing(text.toString(), 1000);

    assertThat(chunks.size()).isGreaterThan(1);
    assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(1000));
    assertThat(String.join(" ", chunks)).isEqualTo(TextChunker.normalize(text.toString()));
  }

  @Test
  void splitForProcessing_shouldRejectNonPositiveLimit() {
    assertThatThrownBy(() -> chunker.splitForProcessing("text", 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

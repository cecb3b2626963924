package com.consullo.supervisor.host;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for output chunking.
 */
public class OutputChunkerTest {

  @Test
  @DisplayName("Should take at most the ceiling and leave the rest pending")
  void take_LongPending_TakesCeiling() {
    final StringBuilder pending = new StringBuilder("a".repeat(1500));

    assertThat(OutputChunker.take(pending, 1024)).hasSize(1024);
    assertThat(pending).hasSize(476);
    assertThat(OutputChunker.take(pending, 1024)).hasSize(476);
    assertThat(pending).isEmpty();
  }

  @Test
  @DisplayName("Should stop before a high surrogate at the ceiling")
  void take_SurrogateAtCeiling_KeepsPair() {
    final StringBuilder pending = new StringBuilder("abc😀");

    assertThat(OutputChunker.take(pending, 4)).isEqualTo("abc");
    assertThat(pending.toString()).isEqualTo("😀");
  }
}

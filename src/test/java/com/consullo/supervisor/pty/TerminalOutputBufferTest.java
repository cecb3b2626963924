package com.consullo.supervisor.pty;

import com.consullo.supervisor.monitor.BufferHealth;
import com.consullo.supervisor.monitor.BufferMetrics;
import com.consullo.supervisor.monitor.HealthStatus;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for output batching, dropping and health classification.
 */
public class TerminalOutputBufferTest {

  private final List<String> delivered = new ArrayList<>();

  @Test
  @DisplayName("Should flush short interactive output immediately")
  void add_UrgentData_FlushesImmediately() {
    final TerminalOutputBuffer buffer = buffer(new OutputBufferConfig(1024, 16, 4, 0.85));

    buffer.add("$ ");
    buffer.add("ls\r\n");

    assertThat(this.delivered).containsExactly("$ ls\r\n");
    assertThat(buffer.bufferMetrics().currentBufferSize()).isZero();
  }

  @Test
  @DisplayName("Should deliver at most one batch per non-urgent flush")
  void flush_NotAll_DeliversOneBatch() {
    final TerminalOutputBuffer buffer = buffer(new OutputBufferConfig(1024, 4, 2, 0.85));

    buffer.add("aaaabbbbccccdddd");
    buffer.flush(false);

    assertThat(this.delivered).containsExactly("aaaabbbb");
    assertThat(buffer.bufferMetrics().currentBufferSize()).isEqualTo(8);

    buffer.flush(true);
    assertThat(this.delivered).containsExactly("aaaabbbb", "ccccdddd");
  }

  @Test
  @DisplayName("Should drop the oldest chunks when utilization exceeds the threshold")
  void add_OverThreshold_DropsOldestChunks() {
    final TerminalOutputBuffer buffer = buffer(new OutputBufferConfig(100, 10, 100, 0.5));

    buffer.add("x".repeat(60));
    buffer.add("y".repeat(10));
    buffer.flush(true);

    final BufferMetrics metrics = buffer.bufferMetrics();
    assertThat(metrics.droppedChunks()).isEqualTo(1);
    assertThat(metrics.totalChunks()).isEqualTo(7);
    assertThat(this.delivered).containsExactly("x".repeat(50) + "y".repeat(10));
  }

  @Test
  @DisplayName("Should report critical health when too many chunks were dropped")
  void bufferHealth_HighDropRate_IsCritical() {
    final TerminalOutputBuffer buffer = buffer(new OutputBufferConfig(100, 10, 100, 0.5));

    buffer.add("x".repeat(60));
    buffer.add("y".repeat(10));
    buffer.flush(true);

    final BufferHealth health = buffer.bufferHealth();
    assertThat(health.droppedChunksPercent()).isGreaterThan(5.0);
    assertThat(health.status()).isEqualTo(HealthStatus.CRITICAL);
  }

  @Test
  @DisplayName("Should report healthy status for an idle buffer")
  void bufferHealth_Idle_IsHealthy() {
    final TerminalOutputBuffer buffer = buffer(new OutputBufferConfig(1024, 16, 4, 0.85));

    assertThat(buffer.bufferHealth().status()).isEqualTo(HealthStatus.HEALTHY);
    assertThat(buffer.bufferMetrics().averageChunkSize()).isZero();
  }

  @Test
  @DisplayName("Should not split a surrogate pair across chunks")
  void add_SurrogatePairAtBoundary_KeepsPairTogether() {
    final TerminalOutputBuffer buffer = buffer(new OutputBufferConfig(1024, 2, 1, 0.85));

    buffer.add("a😀b".repeat(30));
    buffer.flush(false);

    assertThat(this.delivered.get(0)).isEqualTo("a");
  }

  @Test
  @DisplayName("Should classify only short control output as urgent")
  void isUrgent_VariousInputs_ClassifiesByContentAndLength() {
    assertThat(TerminalOutputBuffer.isUrgent("\u001b[32mok")).isTrue();
    assertThat(TerminalOutputBuffer.isUrgent("\u0007")).isTrue();
    assertThat(TerminalOutputBuffer.isUrgent("plain")).isFalse();
    assertThat(TerminalOutputBuffer.isUrgent("line\n".repeat(40))).isFalse();
  }

  private TerminalOutputBuffer buffer(final OutputBufferConfig config) {
    return new TerminalOutputBuffer("t1", config, this.delivered::add);
  }
}

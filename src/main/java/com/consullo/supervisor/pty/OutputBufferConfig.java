package com.consullo.supervisor.pty;

import com.consullo.supervisor.backend.TerminalBackend;

/**
 * Sizing of a terminal's output buffer.
 *
 * @param maxBufferSize capacity in bytes used for utilization
 * @param chunkSize maximum characters per stored chunk
 * @param maxChunksPerFlush chunks delivered by one non-urgent flush
 * @param dropThreshold utilization ratio (0..1) above which the oldest chunks are dropped
 * @since 1.0
 */
public record OutputBufferConfig(
    long maxBufferSize,
    int chunkSize,
    int maxChunksPerFlush,
    double dropThreshold) {

  /**
   * Backend-specific defaults. PTY backends get a larger buffer than pipes.
   *
   * @param backend backend the buffer serves
   * @return configuration
   */
  public static OutputBufferConfig forBackend(final TerminalBackend backend) {
    if (backend == TerminalBackend.SUBPROCESS) {
      return new OutputBufferConfig(8L * 1024 * 1024, 32 * 1024, 50, 0.75);
    }
    return new OutputBufferConfig(16L * 1024 * 1024, 128 * 1024, 100, 0.85);
  }
}

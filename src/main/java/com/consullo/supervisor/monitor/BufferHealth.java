package com.consullo.supervisor.monitor;

/**
 * Health snapshot of a terminal's output buffer.
 *
 * @param status classification
 * @param utilization pending bytes as a percentage of the buffer capacity
 * @param averageLatency average processing latency in milliseconds
 * @param droppedChunksPercent dropped chunks as a percentage of all chunks
 */
public record BufferHealth(
    HealthStatus status,
    double utilization,
    double averageLatency,
    double droppedChunksPercent) {

  /** Reported for terminals that do not expose buffer statistics. */
  public static final BufferHealth UNKNOWN = new BufferHealth(HealthStatus.HEALTHY, 0.0, 0.0, 0.0);
}

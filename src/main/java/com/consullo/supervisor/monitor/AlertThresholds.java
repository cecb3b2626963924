package com.consullo.supervisor.monitor;

/**
 * Warning and critical levels. A value strictly greater than a level triggers it.
 *
 * @param memoryWarning heap bytes
 * @param memoryCritical heap bytes
 * @param latencyWarning milliseconds
 * @param latencyCritical milliseconds
 * @param bufferUtilizationWarning percent
 * @param bufferUtilizationCritical percent
 * @param droppedChunksWarning percent
 * @param droppedChunksCritical percent
 */
public record AlertThresholds(
    long memoryWarning,
    long memoryCritical,
    double latencyWarning,
    double latencyCritical,
    double bufferUtilizationWarning,
    double bufferUtilizationCritical,
    double droppedChunksWarning,
    double droppedChunksCritical) {

  private static final long MB = 1024L * 1024L;

  public static final AlertThresholds DEFAULTS =
      new AlertThresholds(50L * MB, 100L * MB, 50.0, 100.0, 70.0, 85.0, 1.0, 5.0);
}

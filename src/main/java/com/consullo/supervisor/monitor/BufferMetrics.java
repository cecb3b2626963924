package com.consullo.supervisor.monitor;

/**
 * Cumulative output buffer counters.
 *
 * @param totalChunks chunks accepted
 * @param totalBytes bytes accepted
 * @param droppedChunks chunks discarded under pressure
 * @param averageChunkSize running average chunk size in bytes
 * @param maxBufferSize configured capacity in bytes
 * @param currentBufferSize bytes pending delivery
 * @param processingLatency running average delivery latency in milliseconds
 */
public record BufferMetrics(
    long totalChunks,
    long totalBytes,
    long droppedChunks,
    double averageChunkSize,
    long maxBufferSize,
    long currentBufferSize,
    double processingLatency) {

  public static final BufferMetrics EMPTY = new BufferMetrics(0L, 0L, 0L, 0.0, 0L, 0L, 0.0);
}

package com.consullo.supervisor.bridge;

/**
 * Snapshot of a bridge's connection state.
 *
 * @param connected whether the channel pair is up
 * @param reconnectAttempts attempts made since the last successful connection
 * @param queuedMessages requests waiting for a connection
 * @param performance message statistics
 */
public record ConnectionStatus(
    boolean connected,
    int reconnectAttempts,
    int queuedMessages,
    Performance performance) {

  /**
   * @param messageCount requests sent
   * @param totalLatency summed response latency in milliseconds
   * @param avgLatency {@code totalLatency / messageCount}, 0 when nothing was sent
   * @param maxLatency largest response latency in milliseconds
   * @param channelsActive open channel pairs
   */
  public record Performance(
      long messageCount,
      long totalLatency,
      double avgLatency,
      long maxLatency,
      int channelsActive) {
  }
}

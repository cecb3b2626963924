package com.consullo.supervisor.monitor;

/**
 * One sampling result for one terminal.
 */
public record PerformanceSample(
    String terminalId,
    long timestamp,
    String strategy,
    BufferHealth bufferHealth,
    BufferMetrics bufferMetrics,
    SystemMetrics systemMetrics) {
}

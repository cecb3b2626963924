package com.consullo.supervisor.monitor;

/**
 * Aggregate over all registered terminals, using each terminal's latest sample.
 *
 * @param totalTerminals registered terminals
 * @param activeTerminals registered terminals that are running
 * @param totalMemoryUsage sum of sampled heap usage in bytes
 * @param averageLatency mean buffer latency in milliseconds over sampled terminals
 * @param alertCount retained alerts
 * @param healthyTerminals sampled terminals with healthy buffers
 * @param warningTerminals sampled terminals with warning buffers
 * @param criticalTerminals sampled terminals with critical buffers
 */
public record GlobalStats(
    int totalTerminals,
    int activeTerminals,
    long totalMemoryUsage,
    double averageLatency,
    int alertCount,
    int healthyTerminals,
    int warningTerminals,
    int criticalTerminals) {
}

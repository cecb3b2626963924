package com.consullo.supervisor.monitor;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of everything the monitor retains, for offline analysis.
 */
public record PerformanceExport(
    List<String> terminals,
    Map<String, List<PerformanceSample>> metrics,
    Map<String, List<Alert>> alerts,
    GlobalStats globalStats) {
}

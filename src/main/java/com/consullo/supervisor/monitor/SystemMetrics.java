package com.consullo.supervisor.monitor;

/**
 * Process-level figures captured with each sample.
 *
 * @param memoryUsage heap bytes in use
 * @param cpuUsage process CPU time in microseconds, or -1 when unavailable
 * @param pid terminal process id
 * @param running whether the terminal was running
 */
public record SystemMetrics(long memoryUsage, long cpuUsage, long pid, boolean running) {
}

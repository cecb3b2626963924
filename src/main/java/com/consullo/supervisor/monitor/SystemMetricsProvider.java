package com.consullo.supervisor.monitor;

/**
 * Source of process-level figures for samples.
 */
public interface SystemMetricsProvider {

  /**
   * @return heap bytes in use
   */
  long heapUsed();

  /**
   * @return process CPU time in microseconds, or -1 when unavailable
   */
  long cpuTimeMicros();
}

package com.consullo.supervisor.monitor;

/**
 * Callbacks from the {@link PerformanceMonitor}. All methods default to no-ops.
 */
public interface MonitorListener {

  default void onAlert(final Alert alert) {
  }

  default void onPerformanceUpdate(final GlobalStats stats) {
  }

  default void onMonitoringStarted() {
  }

  default void onMonitoringStopped() {
  }
}

package com.consullo.supervisor.monitor;

import org.apache.commons.lang3.Validate;

/**
 * Performance monitor settings.
 *
 * @param intervalMillis sampling period
 * @param maxMetricsHistory samples retained per terminal
 * @param maxAlertsHistory alerts retained per terminal
 * @param thresholds alert levels
 */
public record MonitorConfig(
    long intervalMillis,
    int maxMetricsHistory,
    int maxAlertsHistory,
    AlertThresholds thresholds) {

  public static final MonitorConfig DEFAULTS = new MonitorConfig(5000L, 100, 50, AlertThresholds.DEFAULTS);

  public MonitorConfig {
    Validate.isTrue(intervalMillis > 0, "intervalMillis must be positive");
    Validate.isTrue(maxMetricsHistory > 0, "maxMetricsHistory must be positive");
    Validate.isTrue(maxAlertsHistory > 0, "maxAlertsHistory must be positive");
    Validate.notNull(thresholds, "thresholds must not be null");
  }

  public MonitorConfig withIntervalMillis(final long newInterval) {
    return new MonitorConfig(newInterval, this.maxMetricsHistory, this.maxAlertsHistory, this.thresholds);
  }
}

package com.consullo.supervisor.monitor;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Alert severity. Warning thresholds raise {@link #MEDIUM}, critical ones {@link #HIGH}.
 */
public enum AlertSeverity {
  LOW,
  MEDIUM,
  HIGH;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

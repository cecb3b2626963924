package com.consullo.supervisor.monitor;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * What an alert is about.
 */
public enum AlertType {
  MEMORY,
  LATENCY,
  BUFFER,
  CPU;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

package com.consullo.supervisor.manager;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Where the terminal host runs.
 */
public enum HostMode {
  /** Separate JVM, isolated from supervisor crashes. */
  CHILD_PROCESS,
  /** Same JVM on its own event loop. */
  IN_PROCESS;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }

  public static HostMode fromWireName(final String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
  }
}

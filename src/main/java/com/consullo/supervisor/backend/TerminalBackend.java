package com.consullo.supervisor.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Mechanism used to run a shell.
 *
 * @since 1.0
 */
public enum TerminalBackend {
  /** Native pseudo-terminal (Unix PTY through pty4j). */
  NATIVE_PTY("native-pty"),
  /** Windows pseudo console, build 17763 and later. */
  CONPTY("conpty"),
  /** Legacy Windows console emulation helper. */
  WINPTY("winpty"),
  /** Plain child process over pipes. Always available. */
  SUBPROCESS("subprocess");

  private final String wireName;

  TerminalBackend(final String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return this.wireName;
  }

  @JsonCreator
  public static TerminalBackend fromWireName(final String value) {
    for (final TerminalBackend backend : values()) {
      if (backend.wireName.equals(value)) {
        return backend;
      }
    }
    throw new IllegalArgumentException("Unknown terminal backend: " + value);
  }

  @Override
  public String toString() {
    return this.wireName;
  }
}

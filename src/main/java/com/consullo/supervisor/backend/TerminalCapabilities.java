package com.consullo.supervisor.backend;

/**
 * What a backend can do.
 *
 * @param backend backend these capabilities describe
 * @param supportsResize whether window size changes reach the child
 * @param supportsColors whether color output is expected to work
 * @param supportsInteractivity whether interactive programs behave
 * @param supportsHistory whether console history is preserved
 * @param reliability coarse rating
 * @since 1.0
 */
public record TerminalCapabilities(
    TerminalBackend backend,
    boolean supportsResize,
    boolean supportsColors,
    boolean supportsInteractivity,
    boolean supportsHistory,
    Reliability reliability) {

  /**
   * Static capability table for a backend.
   *
   * @param backend backend to describe
   * @return its capabilities
   */
  public static TerminalCapabilities of(final TerminalBackend backend) {
    switch (backend) {
      case NATIVE_PTY:
        return new TerminalCapabilities(backend, true, true, true, true, Reliability.HIGH);
      case CONPTY:
        return new TerminalCapabilities(backend, true, true, true, true, Reliability.HIGH);
      case WINPTY:
        return new TerminalCapabilities(backend, true, true, true, false, Reliability.MEDIUM);
      case SUBPROCESS:
        return new TerminalCapabilities(backend, false, true, true, true, Reliability.MEDIUM);
      default:
        throw new IllegalArgumentException("Unknown backend: " + backend);
    }
  }
}

package com.consullo.supervisor.monitor;

/**
 * Minimal view of a terminal the performance monitor samples.
 *
 * <p>
 * Terminals that also implement {@link Instrumented} contribute buffer statistics.
 * </p>
 *
 * @since 1.0
 */
public interface MonitoredTerminal {

  long pid();

  boolean isRunning();
}

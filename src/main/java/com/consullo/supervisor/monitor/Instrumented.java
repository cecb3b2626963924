package com.consullo.supervisor.monitor;

/**
 * Optional capability of a monitored terminal that exposes buffer statistics.
 *
 * @since 1.0
 */
public interface Instrumented {

  BufferHealth bufferHealth();

  BufferMetrics bufferMetrics();
}

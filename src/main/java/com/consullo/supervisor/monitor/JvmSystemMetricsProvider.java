package com.consullo.supervisor.monitor;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads heap usage and process CPU time from the platform MXBeans.
 */
public final class JvmSystemMetricsProvider implements SystemMetricsProvider {

  private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
  private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();

  @Override
  public long heapUsed() {
    return this.memory.getHeapMemoryUsage().getUsed();
  }

  @Override
  public long cpuTimeMicros() {
    if (this.os instanceof com.sun.management.OperatingSystemMXBean) {
      final long nanos = ((com.sun.management.OperatingSystemMXBean) this.os).getProcessCpuTime();
      return nanos < 0 ? -1L : nanos / 1000L;
    }
    return -1L;
  }
}

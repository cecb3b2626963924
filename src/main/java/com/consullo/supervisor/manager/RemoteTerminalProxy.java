package com.consullo.supervisor.manager;

import com.consullo.supervisor.monitor.MonitoredTerminal;

/**
 * Stand-in for a terminal that lives in the host process. Registered with the
 * performance monitor.
 */
final class RemoteTerminalProxy implements MonitoredTerminal {

  private final String id;
  private final long pid;
  private final String strategy;
  private volatile boolean running = true;

  RemoteTerminalProxy(final String id, final long pid, final String strategy) {
    this.id = id;
    this.pid = pid;
    this.strategy = strategy;
  }

  String id() {
    return this.id;
  }

  String strategy() {
    return this.strategy;
  }

  void markStopped() {
    this.running = false;
  }

  @Override
  public long pid() {
    return this.pid;
  }

  @Override
  public boolean isRunning() {
    return this.running;
  }
}

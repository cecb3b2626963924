package com.consullo.supervisor.pty;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scriptable {@link Terminal} for tests. Events are emitted on the calling thread.
 */
public final class FakeTerminal implements Terminal {

  private final String id;
  private final long pid;
  private final List<TerminalListener> listeners = new CopyOnWriteArrayList<>();
  private final List<String> writes = new ArrayList<>();
  private final List<int[]> resizes = new ArrayList<>();
  private boolean spawned;
  private boolean running = true;
  private boolean killed;
  private Exception spawnFailure;

  public FakeTerminal(final String id, final long pid) {
    this.id = id;
    this.pid = pid;
  }

  public FakeTerminal failOnSpawn(final Exception failure) {
    this.spawnFailure = failure;
    return this;
  }

  @Override
  public String id() {
    return this.id;
  }

  @Override
  public void spawn() throws Exception {
    if (this.spawnFailure != null) {
      throw this.spawnFailure;
    }
    this.spawned = true;
  }

  @Override
  public void write(final String data) {
    this.writes.add(data);
  }

  @Override
  public void resize(final int cols, final int rows) {
    this.resizes.add(new int[] {cols, rows});
  }

  @Override
  public void kill() {
    this.killed = true;
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

  @Override
  public void addListener(final TerminalListener listener) {
    this.listeners.add(listener);
  }

  public void emitData(final String data) {
    for (final TerminalListener listener : this.listeners) {
      listener.onData(data);
    }
  }

  public void emitExit(final int exitCode, final String signal) {
    this.running = false;
    for (final TerminalListener listener : this.listeners) {
      listener.onExit(exitCode, signal);
    }
  }

  public void emitError(final Exception error) {
    for (final TerminalListener listener : this.listeners) {
      listener.onError(error);
    }
  }

  public boolean isSpawned() {
    return this.spawned;
  }

  public boolean isKilled() {
    return this.killed;
  }

  public List<String> writes() {
    return this.writes;
  }

  public List<int[]> resizes() {
    return this.resizes;
  }
}

package com.consullo.supervisor.pty;

import com.consullo.supervisor.monitor.BufferHealth;
import com.consullo.supervisor.monitor.BufferMetrics;
import com.consullo.supervisor.monitor.Instrumented;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for terminals backed by a {@link Process} whose output is read from a stream.
 *
 * <p>
 * The process is started by {@link #launch()} (called eagerly by the factory so that an
 * unavailable backend is detected at creation). {@link #spawn()} starts a reader thread
 * that feeds the {@link TerminalOutputBuffer} and an exit monitor thread that flushes
 * remaining output before reporting the exit.
 * </p>
 *
 * @since 1.0
 */
public abstract class AbstractStreamTerminal implements Terminal, Instrumented {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractStreamTerminal.class);

  private static final int READ_BUFFER_CHARS = 1024;
  private static final long READER_JOIN_MILLIS = 2000L;
  private static final Map<Integer, String> SIGNAL_NAMES = Map.of(
      1, "SIGHUP", 2, "SIGINT", 3, "SIGQUIT", 6, "SIGABRT", 9, "SIGKILL", 13, "SIGPIPE", 15, "SIGTERM");

  private final String id;
  private final TerminalOptions options;
  private final List<TerminalListener> listeners = new CopyOnWriteArrayList<>();
  private final TerminalOutputBuffer buffer;

  private volatile Process process;
  private volatile boolean running;
  private volatile boolean killed;
  private boolean spawned;
  private Thread readerThread;

  /**
   * @param id terminal id
   * @param options fully resolved options
   * @param bufferConfig output buffer sizing
   */
  protected AbstractStreamTerminal(final String id, final TerminalOptions options,
      final OutputBufferConfig bufferConfig) {
    Validate.notBlank(id, "id must not be blank");
    Validate.notNull(options, "options must not be null");
    Validate.notBlank(options.shell(), "shell must not be blank");
    Validate.notBlank(options.cwd(), "cwd must not be blank");
    this.id = id;
    this.options = options;
    this.buffer = new TerminalOutputBuffer(id, bufferConfig, this::fireData);
  }

  /**
   * Starts the underlying process.
   *
   * @return started process
   * @throws Exception if the process cannot be started
   */
  protected abstract Process startProcess() throws Exception;

  /**
   * Starts the process without delivering output. Idempotent.
   *
   * @throws Exception if the process cannot be started
   */
  public final synchronized void launch() throws Exception {
    if (this.process == null) {
      this.process = startProcess();
      this.running = true;
      LOGGER.debug("Terminal {} started process {} ({})", this.id, this.process.pid(), this.options.shell());
    }
  }

  @Override
  public final synchronized void spawn() throws Exception {
    Validate.validState(!this.spawned, "terminal %s already spawned", this.id);
    launch();
    this.spawned = true;
    this.readerThread = startReaderThread(this.process.getInputStream());
    startExitMonitorThread();
  }

  @Override
  public String id() {
    return this.id;
  }

  protected TerminalOptions options() {
    return this.options;
  }

  protected Process process() {
    return this.process;
  }

  @Override
  public void write(final String data) throws Exception {
    Validate.notNull(data, "data must not be null");
    final Process current = this.process;
    Validate.validState(current != null && this.running, "terminal %s is not running", this.id);
    final OutputStream out = current.getOutputStream();
    synchronized (out) {
      out.write(data.getBytes(StandardCharsets.UTF_8));
      out.flush();
    }
  }

  @Override
  public void kill() throws Exception {
    final Process current = this.process;
    if (current == null) {
      return;
    }
    this.killed = true;
    if (current.isAlive()) {
      current.destroy();
    }
  }

  @Override
  public long pid() {
    final Process current = this.process;
    return current == null ? -1L : current.pid();
  }

  @Override
  public boolean isRunning() {
    return this.running;
  }

  @Override
  public void addListener(final TerminalListener listener) {
    Validate.notNull(listener, "listener must not be null");
    this.listeners.add(listener);
  }

  @Override
  public BufferHealth bufferHealth() {
    return this.buffer.bufferHealth();
  }

  @Override
  public BufferMetrics bufferMetrics() {
    return this.buffer.bufferMetrics();
  }

  private Thread startReaderThread(final InputStream in) {
    final Thread reader = new Thread(() -> {
      final char[] chars = new char[READ_BUFFER_CHARS];
      try (Reader stream = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        int n;
        while ((n = stream.read(chars)) != -1) {
          if (n == 0) {
            continue;
          }
          this.buffer.add(new String(chars, 0, n));
          this.buffer.flush(!stream.ready());
        }
      } catch (final IOException e) {
        // PTYs report EIO once the child side closes.
        if (this.killed || !this.process.isAlive()) {
          LOGGER.debug("Terminal {} output closed: {}", this.id, e.getMessage());
        } else {
          LOGGER.error("Terminal {} read failed", this.id, e);
          this.buffer.clear();
          fireError(e);
        }
      }
    }, "terminal-reader-" + this.id);
    reader.setDaemon(true);
    reader.start();
    return reader;
  }

  private void startExitMonitorThread() {
    final Thread monitor = new Thread(() -> {
      int code;
      try {
        code = this.process.waitFor();
        this.readerThread.join(READER_JOIN_MILLIS);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      this.buffer.flush(true);
      this.running = false;
      final String signal = signalFor(code);
      LOGGER.debug("Terminal {} exited with code {} signal {}", this.id, code, signal);
      for (final TerminalListener listener : this.listeners) {
        try {
          listener.onExit(code, signal);
        } catch (final RuntimeException e) {
          LOGGER.error("Exit listener failed for terminal {}", this.id, e);
        }
      }
    }, "terminal-exit-" + this.id);
    monitor.setDaemon(true);
    monitor.start();
  }

  private void fireData(final String data) {
    for (final TerminalListener listener : this.listeners) {
      try {
        listener.onData(data);
      } catch (final RuntimeException e) {
        LOGGER.error("Data listener failed for terminal {}", this.id, e);
      }
    }
  }

  private void fireError(final Exception error) {
    for (final TerminalListener listener : this.listeners) {
      try {
        listener.onError(error);
      } catch (final RuntimeException e) {
        LOGGER.error("Error listener failed for terminal {}", this.id, e);
      }
    }
  }

  /**
   * Maps a shell-style exit status above 128 to the signal that caused it.
   *
   * @param exitCode exit status
   * @return signal name or null
   */
  static String signalFor(final int exitCode) {
    if (exitCode <= 128 || System.getProperty("os.name", "").startsWith("Windows")) {
      return null;
    }
    return SIGNAL_NAMES.get(exitCode - 128);
  }
}

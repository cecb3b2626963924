package com.consullo.supervisor.host;

import com.consullo.supervisor.loop.EventLoop;
import com.consullo.supervisor.protocol.HostRequest;
import com.consullo.supervisor.protocol.HostResponse;
import com.consullo.supervisor.protocol.TerminalInfo;
import com.consullo.supervisor.pty.Terminal;
import com.consullo.supervisor.pty.TerminalCreateResult;
import com.consullo.supervisor.pty.TerminalFactory;
import com.consullo.supervisor.pty.TerminalListener;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds live terminals and speaks the host side of the request protocol.
 *
 * <p>
 * Every request and terminal event is processed on the host's {@link EventLoop}.
 * Terminal output passes through a {@link ResizeStormFilter}, is accumulated per
 * terminal and drained one bounded chunk per loop turn, so a large burst never
 * monopolizes the loop. On exit the remaining output is flushed before the
 * {@code exit} message.
 * </p>
 *
 * @since 1.0
 */
public final class TerminalHost {

  private static final Logger LOGGER = LoggerFactory.getLogger(TerminalHost.class);

  private final TerminalFactory factory;
  private final HostResponseSink sink;
  private final EventLoop loop;
  private final HostConfig config;
  private final Map<String, HostedTerminal> terminals = new LinkedHashMap<>();
  private boolean shutdown;

  public TerminalHost(final TerminalFactory factory, final HostResponseSink sink, final EventLoop loop,
      final HostConfig config) {
    Validate.notNull(factory, "factory must not be null");
    Validate.notNull(sink, "sink must not be null");
    Validate.notNull(loop, "loop must not be null");
    Validate.notNull(config, "config must not be null");
    this.factory = factory;
    this.sink = sink;
    this.loop = loop;
    this.config = config;
  }

  /**
   * Queues a request for processing.
   *
   * @param request request from the manager
   */
  public void handle(final HostRequest request) {
    Validate.notNull(request, "request must not be null");
    this.loop.execute(() -> dispatch(request));
  }

  /**
   * Kills every terminal. Further create requests are refused.
   *
   * @return completes once all terminals were killed
   */
  public CompletableFuture<Void> shutdown() {
    final CompletableFuture<Void> done = new CompletableFuture<>();
    this.loop.execute(() -> {
      this.shutdown = true;
      for (final HostedTerminal hosted : this.terminals.values()) {
        try {
          hosted.terminal.kill();
        } catch (final Exception e) {
          LOGGER.error("Failed to kill terminal {} during cleanup", hosted.id, e);
        }
      }
      LOGGER.info("Cleaned up {} terminal(s)", this.terminals.size());
      this.terminals.clear();
      done.complete(null);
    });
    return done;
  }

  Set<String> terminalIds() {
    return new LinkedHashSet<>(this.terminals.keySet());
  }

  private void dispatch(final HostRequest request) {
    try {
      if (request.type() == null) {
        throw new IllegalArgumentException("Request has no type");
      }
      switch (request.type()) {
        case CREATE:
          createTerminal(request);
          break;
        case WRITE:
          writeTerminal(request);
          break;
        case RESIZE:
          resizeTerminal(request);
          break;
        case KILL:
          killTerminal(request.id());
          break;
        case LIST:
          send(HostResponse.list(request.id(), describeTerminals()));
          break;
        default:
          LOGGER.warn("Unhandled request type {}", request.type());
          break;
      }
    } catch (final Exception e) {
      LOGGER.error("Failed to handle {} request for {}", request.type(), request.id(), e);
      send(HostResponse.error(request.id(), StringUtils.defaultIfBlank(e.getMessage(), "Unknown error")));
    }
  }

  private void createTerminal(final HostRequest request) throws Exception {
    final String id = request.id();
    Validate.notBlank(id, "Terminal id must not be blank");
    Validate.validState(!this.shutdown, "Terminal host is shutting down");
    Validate.validState(!this.terminals.containsKey(id), "Terminal %s already exists", id);

    final TerminalCreateResult result = this.factory.createTerminal(id, request.options());
    final HostedTerminal hosted = new HostedTerminal(id, result, new ResizeStormFilter(this.config.resizeStorm()));
    final Terminal terminal = result.terminal();
    terminal.addListener(new TerminalListener() {
      @Override
      public void onData(final String data) {
        TerminalHost.this.loop.execute(() -> onTerminalData(hosted, data));
      }

      @Override
      public void onExit(final int exitCode, final String signal) {
        TerminalHost.this.loop.execute(() -> onTerminalExit(hosted, exitCode, signal));
      }

      @Override
      public void onError(final Exception error) {
        TerminalHost.this.loop.execute(() -> onTerminalError(hosted, error));
      }
    });
    try {
      terminal.spawn();
    } catch (final Exception e) {
      killQuietly(terminal);
      throw e;
    }
    this.terminals.put(id, hosted);

    final TerminalInfo info = hosted.info();
    LOGGER.info("Created terminal {} (pid {}, backend {}, shell {})", id, info.pid(), info.backend(), info.shell());
    if (result.fallbackReason() != null) {
      LOGGER.warn("Terminal {}: {}", id, result.fallbackReason());
    }
    send(HostResponse.created(info, result.fallbackReason()));
  }

  private void writeTerminal(final HostRequest request) throws Exception {
    final HostedTerminal hosted = this.terminals.get(request.id());
    if (hosted == null) {
      LOGGER.warn("Write requested for unknown terminal {}", request.id());
      return;
    }
    hosted.terminal.write(request.data() == null ? "" : request.data());
  }

  private void resizeTerminal(final HostRequest request) {
    final HostedTerminal hosted = this.terminals.get(request.id());
    if (hosted == null) {
      LOGGER.warn("Resize requested for unknown terminal {}", request.id());
      return;
    }
    try {
      hosted.terminal.resize(request.cols() == null ? 0 : request.cols(), request.rows() == null ? 0 : request.rows());
    } catch (final Exception e) {
      LOGGER.error("Failed to resize terminal {} to {}x{}", request.id(), request.cols(), request.rows(), e);
    }
  }

  private void killTerminal(final String id) {
    final HostedTerminal hosted = this.terminals.get(id);
    if (hosted == null) {
      LOGGER.warn("Kill requested for unknown terminal {}", id);
      return;
    }
    try {
      hosted.terminal.kill();
    } catch (final Exception e) {
      LOGGER.error("Failed to kill terminal {}", id, e);
      return;
    }
    this.terminals.remove(id);
    LOGGER.info("Killed terminal {}", id);
    send(HostResponse.killed(id));
  }

  private List<TerminalInfo> describeTerminals() {
    final List<TerminalInfo> out = new ArrayList<>(this.terminals.size());
    for (final HostedTerminal hosted : this.terminals.values()) {
      out.add(hosted.info());
    }
    return out;
  }

  private void onTerminalData(final HostedTerminal hosted, final String data) {
    if (!isCurrent(hosted)) {
      return;
    }
    final ResizeStormFilter.Verdict verdict = hosted.stormFilter.inspect(data, this.loop.currentTimeMillis());
    if (verdict == ResizeStormFilter.Verdict.SUPPRESS_STORM_START) {
      LOGGER.error("CRITICAL: suppressing resize signal storm on terminal {} ({} signals in window)",
          hosted.id, hosted.stormFilter.occurrences());
      return;
    }
    if (verdict == ResizeStormFilter.Verdict.SUPPRESS) {
      LOGGER.debug("Suppressed resize signal on terminal {}", hosted.id);
      return;
    }
    hosted.pending.append(data);
    scheduleDrain(hosted);
  }

  private void scheduleDrain(final HostedTerminal hosted) {
    if (hosted.drainScheduled) {
      return;
    }
    hosted.drainScheduled = true;
    this.loop.execute(() -> drainOne(hosted));
  }

  private void drainOne(final HostedTerminal hosted) {
    hosted.drainScheduled = false;
    if (!isCurrent(hosted) || hosted.pending.length() == 0) {
      return;
    }
    send(HostResponse.data(hosted.id, OutputChunker.take(hosted.pending, this.config.chunkSize())));
    if (hosted.pending.length() > 0) {
      scheduleDrain(hosted);
    }
  }

  private void onTerminalExit(final HostedTerminal hosted, final int exitCode, final String signal) {
    if (!isCurrent(hosted)) {
      return;
    }
    while (hosted.pending.length() > 0) {
      send(HostResponse.data(hosted.id, OutputChunker.take(hosted.pending, this.config.chunkSize())));
    }
    this.terminals.remove(hosted.id);
    LOGGER.info("Terminal {} exited with code {}, signal {}", hosted.id, exitCode, signal);
    send(HostResponse.exit(hosted.id, exitCode, signal));
  }

  private void onTerminalError(final HostedTerminal hosted, final Exception error) {
    if (!isCurrent(hosted)) {
      return;
    }
    LOGGER.error("Terminal {} error", hosted.id, error);
    hosted.pending.setLength(0);
    send(HostResponse.error(hosted.id, StringUtils.defaultIfBlank(error.getMessage(), "Unknown error")));
  }

  private boolean isCurrent(final HostedTerminal hosted) {
    return this.terminals.get(hosted.id) == hosted;
  }

  private void send(final HostResponse response) {
    try {
      this.sink.send(response);
    } catch (final Exception e) {
      LOGGER.error("Failed to send {} message for {}", response.type().wireName(), response.id(), e);
    }
  }

  private static void killQuietly(final Terminal terminal) {
    try {
      terminal.kill();
    } catch (final Exception e) {
      LOGGER.debug("Kill after failed spawn also failed: {}", e.getMessage());
    }
  }

  private static final class HostedTerminal {

    private final String id;
    private final TerminalCreateResult result;
    private final Terminal terminal;
    private final ResizeStormFilter stormFilter;
    private final StringBuilder pending = new StringBuilder();
    private boolean drainScheduled;

    private HostedTerminal(final String id, final TerminalCreateResult result, final ResizeStormFilter stormFilter) {
      this.id = id;
      this.result = result;
      this.terminal = result.terminal();
      this.stormFilter = stormFilter;
    }

    private TerminalInfo info() {
      return new TerminalInfo(this.id, this.result.options().shell(), this.result.options().cwd(),
          this.terminal.pid(), this.result.backend().wireName(), this.result.backend().wireName(),
          this.result.capabilities());
    }
  }
}

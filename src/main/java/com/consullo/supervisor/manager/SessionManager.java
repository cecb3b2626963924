package com.consullo.supervisor.manager;

import com.consullo.supervisor.loop.EventLoop;
import com.consullo.supervisor.monitor.Alert;
import com.consullo.supervisor.monitor.GlobalStats;
import com.consullo.supervisor.monitor.PerformanceExport;
import com.consullo.supervisor.monitor.PerformanceMonitor;
import com.consullo.supervisor.monitor.PerformanceSample;
import com.consullo.supervisor.protocol.HostRequest;
import com.consullo.supervisor.protocol.HostResponse;
import com.consullo.supervisor.protocol.TerminalInfo;
import com.consullo.supervisor.pty.TerminalOptions;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supervises the terminal host and exposes terminals to the rest of the application.
 *
 * <p>
 * Create and list calls are correlated with host replies by id and resolve
 * asynchronously. Write, resize and kill are fire-and-forget: failures are logged.
 * When the host exits with a non-zero status it is relaunched once after the restart
 * delay; a clean exit is not restarted. Pending requests survive a host crash and are
 * only rejected by {@link #destroy()}.
 * </p>
 *
 * <p>
 * All state is confined to the manager's {@link EventLoop}; host link callbacks are
 * re-posted onto it and events from a replaced host are ignored.
 * </p>
 *
 * @since 1.0
 */
public final class SessionManager implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

  static final String NOT_INITIALIZED = "PTY Host not initialized";
  static final String DESTROYED = "PTY Manager destroyed";
  static final String UNKNOWN_ERROR = "Unknown error";
  static final String DEFAULT_STRATEGY = "hybrid";

  private final ManagerConfig config;
  private final HostLauncher launcher;
  private final EventLoop loop;
  private final PerformanceMonitor monitor;
  private final List<SessionManagerListener> listeners = new CopyOnWriteArrayList<>();
  private final Map<String, CompletableFuture<TerminalSession>> pendingCreates = new LinkedHashMap<>();
  private final Map<String, CompletableFuture<List<TerminalSession>>> pendingLists = new LinkedHashMap<>();
  private final Map<String, RemoteTerminalProxy> terminals = new LinkedHashMap<>();

  private HostLink hostLink;
  private long hostGeneration;
  private EventLoop.Scheduled restartTask;
  private volatile boolean initialized;
  private volatile boolean destroyed;

  public SessionManager(final ManagerConfig config, final HostLauncher launcher, final EventLoop loop,
      final PerformanceMonitor monitor) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(launcher, "launcher must not be null");
    Validate.notNull(loop, "loop must not be null");
    Validate.notNull(monitor, "monitor must not be null");
    this.config = config;
    this.launcher = launcher;
    this.loop = loop;
    this.monitor = monitor;
  }

  public void addListener(final SessionManagerListener listener) {
    Validate.notNull(listener, "listener must not be null");
    this.listeners.add(listener);
  }

  public void removeListener(final SessionManagerListener listener) {
    this.listeners.remove(listener);
  }

  /**
   * Launches the terminal host.
   */
  public void start() {
    this.loop.execute(this::initializeHost);
  }

  public boolean isInitialized() {
    return this.initialized;
  }

  /**
   * Asks the host to create a terminal.
   *
   * @param options creation options, may be null
   * @return resolves with the session once the host reports it created
   */
  public CompletableFuture<TerminalSession> createTerminal(final TerminalOptions options) {
    final String id = UUID.randomUUID().toString();
    final CompletableFuture<TerminalSession> future = new CompletableFuture<>();
    this.loop.execute(() -> {
      if (this.destroyed) {
        future.completeExceptionally(new IllegalStateException(DESTROYED));
        return;
      }
      this.pendingCreates.put(id, future);
      try {
        send(HostRequest.create(id, options));
      } catch (final Exception e) {
        this.pendingCreates.remove(id);
        future.completeExceptionally(e);
      }
    });
    return future;
  }

  public void writeToTerminal(final String terminalId, final String data) {
    this.loop.execute(() -> sendQuietly(HostRequest.write(terminalId, data), "write to"));
  }

  public void resizeTerminal(final String terminalId, final int cols, final int rows) {
    this.loop.execute(() -> sendQuietly(HostRequest.resize(terminalId, cols, rows), "resize"));
  }

  /**
   * Kills a terminal. It is forgotten immediately, without waiting for the host.
   *
   * @param terminalId terminal id
   */
  public void killTerminal(final String terminalId) {
    this.loop.execute(() -> {
      forget(terminalId);
      sendQuietly(HostRequest.kill(terminalId), "kill");
    });
  }

  /**
   * @return resolves with the terminals the host reports as live
   */
  public CompletableFuture<List<TerminalSession>> listTerminals() {
    final String requestId = UUID.randomUUID().toString();
    final CompletableFuture<List<TerminalSession>> future = new CompletableFuture<>();
    this.loop.execute(() -> {
      if (this.destroyed) {
        future.completeExceptionally(new IllegalStateException(DESTROYED));
        return;
      }
      this.pendingLists.put(requestId, future);
      try {
        send(HostRequest.list(requestId));
      } catch (final Exception e) {
        this.pendingLists.remove(requestId);
        future.completeExceptionally(e);
      }
    });
    return future;
  }

  /**
   * @return ids of terminals created through this manager and not yet gone
   */
  public CompletableFuture<Set<String>> terminalIds() {
    final CompletableFuture<Set<String>> future = new CompletableFuture<>();
    this.loop.execute(() -> future.complete(new LinkedHashSet<>(this.terminals.keySet())));
    return future;
  }

  public GlobalStats getPerformanceMetrics() {
    return this.monitor.getGlobalStats();
  }

  public List<PerformanceSample> getTerminalPerformanceMetrics(final String terminalId, final int limit) {
    return this.monitor.getTerminalMetrics(terminalId, limit);
  }

  public List<Alert> getTerminalAlerts(final String terminalId, final int limit) {
    return this.monitor.getTerminalAlerts(terminalId, limit);
  }

  public PerformanceExport exportPerformanceData() {
    return this.monitor.exportData();
  }

  /**
   * Terminates the host, rejects every pending request and disables restarts.
   * Idempotent.
   */
  public void destroy() {
    this.loop.execute(() -> {
      if (this.destroyed) {
        return;
      }
      this.destroyed = true;
      this.initialized = false;
      if (this.restartTask != null) {
        this.restartTask.cancel();
        this.restartTask = null;
      }
      final HostLink link = this.hostLink;
      this.hostLink = null;
      if (link != null) {
        try {
          link.terminate();
        } catch (final RuntimeException e) {
          LOGGER.error("Failed to terminate terminal host", e);
        }
      }
      final List<CompletableFuture<?>> pending = new ArrayList<>(this.pendingCreates.values());
      pending.addAll(this.pendingLists.values());
      this.pendingCreates.clear();
      this.pendingLists.clear();
      for (final CompletableFuture<?> request : pending) {
        request.completeExceptionally(new IllegalStateException(DESTROYED));
      }
      for (final String id : new ArrayList<>(this.terminals.keySet())) {
        forget(id);
      }
      this.listeners.clear();
      LOGGER.info("Session manager destroyed ({} pending request(s) rejected)", pending.size());
    });
  }

  @Override
  public void close() {
    destroy();
  }

  private void initializeHost() {
    if (this.destroyed) {
      return;
    }
    final long generation = ++this.hostGeneration;
    try {
      this.hostLink = this.launcher.launch(new LinkEvents(generation));
      this.initialized = true;
      LOGGER.info("Terminal host started (pid {})", this.hostLink.pid());
      for (final SessionManagerListener listener : this.listeners) {
        notifySafely(listener::onReady);
      }
    } catch (final Exception e) {
      this.hostLink = null;
      this.initialized = false;
      LOGGER.error("Failed to start terminal host", e);
      emitError(e);
    }
  }

  private void onHostMessage(final long generation, final HostResponse response) {
    if (generation != this.hostGeneration || this.destroyed || response.type() == null) {
      return;
    }
    switch (response.type()) {
      case CREATED:
        handleCreated(response);
        break;
      case DATA:
        for (final SessionManagerListener listener : this.listeners) {
          notifySafely(() -> listener.onTerminalData(response.id(), response.data()));
        }
        break;
      case EXIT:
        if (response.id() != null) {
          forget(response.id());
          final int code = response.exitCode() == null ? 0 : response.exitCode();
          for (final SessionManagerListener listener : this.listeners) {
            notifySafely(() -> listener.onTerminalExit(response.id(), code, response.signal()));
          }
        }
        break;
      case KILLED:
        if (response.id() != null) {
          forget(response.id());
          for (final SessionManagerListener listener : this.listeners) {
            notifySafely(() -> listener.onTerminalKilled(response.id()));
          }
        }
        break;
      case LIST:
        handleList(response);
        break;
      case ERROR:
        handleError(response);
        break;
      default:
        LOGGER.warn("Unhandled message type {} from terminal host", response.type());
        break;
    }
  }

  private void handleCreated(final HostResponse response) {
    if (response.id() == null) {
      LOGGER.error("Created message without id from terminal host");
      return;
    }
    final CompletableFuture<TerminalSession> pending = this.pendingCreates.remove(response.id());
    if (pending == null) {
      LOGGER.warn("Created message for unknown request {}", response.id());
      return;
    }
    final String strategy = StringUtils.defaultIfBlank(response.strategy(), DEFAULT_STRATEGY);
    final long pid = response.pid() == null ? -1L : response.pid();
    final RemoteTerminalProxy proxy = new RemoteTerminalProxy(response.id(), pid, strategy);
    this.terminals.put(response.id(), proxy);
    this.monitor.registerTerminal(response.id(), proxy, strategy);
    LOGGER.info("Terminal {} created (pid {}, strategy {})", response.id(), pid, strategy);
    pending.complete(new TerminalSession(response.id(), pid, response.shell(),
        response.cwd(), strategy, response.backend(), response.capabilities(), response.fallbackReason()));
  }

  private void handleList(final HostResponse response) {
    if (response.requestId() == null) {
      LOGGER.error("List reply without requestId from terminal host");
      return;
    }
    final CompletableFuture<List<TerminalSession>> pending = this.pendingLists.remove(response.requestId());
    if (pending == null) {
      LOGGER.warn("List reply for unknown request {}", response.requestId());
      return;
    }
    final List<TerminalSession> sessions = new ArrayList<>();
    if (response.terminals() != null) {
      for (final TerminalInfo info : response.terminals()) {
        sessions.add(new TerminalSession(info.id(), info.pid(), info.shell(), info.cwd(),
            StringUtils.defaultIfBlank(info.strategy(), DEFAULT_STRATEGY), info.backend(), info.capabilities(), null));
      }
    }
    pending.complete(sessions);
  }

  private void handleError(final HostResponse response) {
    final String message = StringUtils.defaultIfBlank(response.error(), UNKNOWN_ERROR);
    final CompletableFuture<?> pending = response.id() == null ? null : removePending(response.id());
    if (pending != null) {
      pending.completeExceptionally(new TerminalHostException(response.id(), message));
      return;
    }
    LOGGER.error("Unhandled error from PTY Host: {} (terminal {})", message, response.id());
    emitError(new TerminalHostException(response.id(), message));
  }

  private CompletableFuture<?> removePending(final String id) {
    final CompletableFuture<?> create = this.pendingCreates.remove(id);
    return create != null ? create : this.pendingLists.remove(id);
  }

  private void onHostError(final long generation, final Exception error) {
    if (generation != this.hostGeneration || this.destroyed) {
      return;
    }
    LOGGER.error("Terminal host error", error);
    emitError(error);
  }

  private void onHostDisconnect(final long generation) {
    if (generation != this.hostGeneration || this.destroyed) {
      return;
    }
    LOGGER.warn("Terminal host disconnected");
    this.hostLink = null;
    this.initialized = false;
    forgetAll();
  }

  private void onHostExit(final long generation, final int exitCode, final String signal) {
    if (generation != this.hostGeneration || this.destroyed) {
      return;
    }
    LOGGER.warn("Terminal host exited with code {}, signal {}", exitCode, signal);
    this.hostLink = null;
    this.initialized = false;
    forgetAll();
    if (exitCode != 0) {
      scheduleRestart();
    }
  }

  private void scheduleRestart() {
    if (this.restartTask != null) {
      return;
    }
    LOGGER.info("Restarting terminal host in {} ms", this.config.restartDelayMillis());
    this.restartTask = this.loop.schedule(() -> {
      this.restartTask = null;
      initializeHost();
    }, this.config.restartDelayMillis());
  }

  private void send(final HostRequest request) throws Exception {
    final HostLink link = this.hostLink;
    if (link == null || !this.initialized) {
      throw new IllegalStateException(NOT_INITIALIZED);
    }
    link.send(request);
  }

  private void sendQuietly(final HostRequest request, final String action) {
    try {
      send(request);
    } catch (final Exception e) {
      LOGGER.error("Failed to {} terminal {}: {}", action, request.id(), e.getMessage());
    }
  }

  private void forget(final String terminalId) {
    final RemoteTerminalProxy proxy = this.terminals.remove(terminalId);
    if (proxy != null) {
      proxy.markStopped();
    }
    this.monitor.unregisterTerminal(terminalId);
  }

  /**
   * Terminals die with their host; a restarted host starts empty.
   */
  private void forgetAll() {
    if (this.terminals.isEmpty()) {
      return;
    }
    LOGGER.warn("Dropping {} terminal(s) of the lost host", this.terminals.size());
    for (final String id : new ArrayList<>(this.terminals.keySet())) {
      forget(id);
    }
  }

  private void emitError(final Throwable error) {
    for (final SessionManagerListener listener : this.listeners) {
      notifySafely(() -> listener.onError(error));
    }
  }

  private static void notifySafely(final Runnable callback) {
    try {
      callback.run();
    } catch (final RuntimeException e) {
      LOGGER.error("Session manager listener failed", e);
    }
  }

  /**
   * Re-posts link callbacks onto the manager loop, tagged with the host generation.
   */
  private final class LinkEvents implements HostLinkListener {

    private final long generation;

    private LinkEvents(final long generation) {
      this.generation = generation;
    }

    @Override
    public void onMessage(final HostResponse response) {
      SessionManager.this.loop.execute(() -> onHostMessage(this.generation, response));
    }

    @Override
    public void onError(final Exception error) {
      SessionManager.this.loop.execute(() -> onHostError(this.generation, error));
    }

    @Override
    public void onDisconnect() {
      SessionManager.this.loop.execute(() -> onHostDisconnect(this.generation));
    }

    @Override
    public void onExit(final int exitCode, final String signal) {
      SessionManager.this.loop.execute(() -> onHostExit(this.generation, exitCode, signal));
    }
  }
}

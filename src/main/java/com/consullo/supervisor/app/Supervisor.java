package com.consullo.supervisor.app;

import com.consullo.supervisor.bridge.ChannelBridge;
import com.consullo.supervisor.bridge.InMemoryChannelFactory;
import com.consullo.supervisor.bridge.SessionManagerEndpoint;
import com.consullo.supervisor.config.SupervisorConfig;
import com.consullo.supervisor.loop.EventLoop;
import com.consullo.supervisor.loop.SingleThreadEventLoop;
import com.consullo.supervisor.manager.ChildProcessHostLauncher;
import com.consullo.supervisor.manager.HostLauncher;
import com.consullo.supervisor.manager.InProcessHostLauncher;
import com.consullo.supervisor.manager.SessionManager;
import com.consullo.supervisor.monitor.JvmSystemMetricsProvider;
import com.consullo.supervisor.monitor.PerformanceMonitor;
import com.consullo.supervisor.protocol.JsonLineCodec;
import com.consullo.supervisor.pty.TerminalFactory;
import com.consullo.supervisor.remote.RemoteTerminalServer;
import com.consullo.supervisor.remote.RemoteTerminalService;
import java.util.Optional;
import java.util.function.Supplier;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns and wires the supervisor components: event loop, performance monitor, session
 * manager with its host launcher, bridge endpoint and the optional remote server.
 *
 * @since 1.0
 */
public final class Supervisor implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(Supervisor.class);

  private final SupervisorConfig config;
  private final EventLoop loop;
  private final PerformanceMonitor monitor;
  private final SessionManager sessionManager;
  private final InMemoryChannelFactory channels;
  private final RemoteTerminalServer remoteServer;
  private boolean closed;

  /**
   * @param config configuration
   * @param terminals terminal factory used by an in-process host and the remote server
   */
  public Supervisor(final SupervisorConfig config, final TerminalFactory terminals) {
    this(config, terminals, new SingleThreadEventLoop("session-manager"),
        () -> new SingleThreadEventLoop("terminal-host"));
  }

  Supervisor(final SupervisorConfig config, final TerminalFactory terminals, final EventLoop loop,
      final Supplier<EventLoop> hostLoops) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(terminals, "terminals must not be null");
    this.config = config;
    this.loop = loop;
    this.monitor = new PerformanceMonitor(config.monitor(), loop, new JvmSystemMetricsProvider());
    final JsonLineCodec codec = new JsonLineCodec();
    final HostLauncher launcher;
    switch (config.manager().hostMode()) {
      case IN_PROCESS:
        launcher = new InProcessHostLauncher(terminals, hostLoops, config.host());
        break;
      case CHILD_PROCESS:
      default:
        launcher = new ChildProcessHostLauncher(codec, config.manager().hostJvmArgs());
        break;
    }
    this.sessionManager = new SessionManager(config.manager(), launcher, loop, this.monitor);
    this.channels = new InMemoryChannelFactory(loop, new SessionManagerEndpoint(this.sessionManager, loop));
    this.remoteServer = config.remote().enabled()
        ? new RemoteTerminalServer(config.remote(), new RemoteTerminalService(terminals, codec.mapper()), codec.mapper())
        : null;
  }

  /**
   * Launches the terminal host and, if enabled, the remote server.
   *
   * @throws Exception if the remote server fails to start
   */
  public void start() throws Exception {
    LOGGER.info("Starting supervisor (host mode {})", this.config.manager().hostMode().wireName());
    this.sessionManager.start();
    if (this.remoteServer != null) {
      this.remoteServer.start();
    }
  }

  public SessionManager sessionManager() {
    return this.sessionManager;
  }

  public PerformanceMonitor monitor() {
    return this.monitor;
  }

  public Optional<RemoteTerminalServer> remoteServer() {
    return Optional.ofNullable(this.remoteServer);
  }

  /**
   * Creates a bridge to the session manager. Call {@link ChannelBridge#initialize()} to connect.
   *
   * @param channelId channel id
   * @return new bridge
   */
  public ChannelBridge openBridge(final String channelId) {
    return new ChannelBridge(channelId, this.channels, this.loop, this.config.bridge());
  }

  /**
   * @return consumer-facing end of the channel's current connection
   */
  public InMemoryChannelFactory channels() {
    return this.channels;
  }

  @Override
  public synchronized void close() {
    if (this.closed) {
      return;
    }
    this.closed = true;
    LOGGER.info("Stopping supervisor");
    if (this.remoteServer != null) {
      this.remoteServer.close();
    }
    this.sessionManager.destroy();
    this.monitor.destroy();
    this.loop.execute(this.loop::close);
  }
}

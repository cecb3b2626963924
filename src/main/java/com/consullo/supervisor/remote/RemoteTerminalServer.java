package com.consullo.supervisor.remote;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import org.apache.commons.lang3.Validate;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.websocket.server.config.JettyWebSocketServletContainerInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded Jetty server exposing terminals over WebSocket.
 *
 * <p>
 * Endpoints: {@code GET /health}, {@code GET /terminals} and {@code WS /terminal}.
 * Protocol handling lives in {@link RemoteTerminalService}.
 * </p>
 *
 * @since 1.0
 */
public final class RemoteTerminalServer implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(RemoteTerminalServer.class);
  private static final long MAX_TEXT_MESSAGE_SIZE = 1024L * 1024L;

  private final RemoteServerConfig config;
  private final RemoteTerminalService service;
  private final ObjectMapper mapper;
  private Server server;
  private int boundPort;

  public RemoteTerminalServer(final RemoteServerConfig config, final RemoteTerminalService service,
      final ObjectMapper mapper) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(service, "service must not be null");
    Validate.notNull(mapper, "mapper must not be null");
    this.config = config;
    this.service = service;
    this.mapper = mapper;
  }

  /**
   * Binds and starts the server. Does nothing if already running.
   *
   * @throws Exception if Jetty fails to start
   */
  public synchronized void start() throws Exception {
    if (isRunning()) {
      LOGGER.warn("Remote terminal server already running");
      return;
    }
    final Server newServer = new Server();
    final ServerConnector connector = new ServerConnector(newServer);
    connector.setHost(this.config.host());
    connector.setPort(this.config.port());
    newServer.addConnector(connector);

    final ServletContextHandler context = new ServletContextHandler(ServletContextHandler.SESSIONS);
    context.setContextPath("/");
    context.addServlet(new ServletHolder("health", new StatusServlet(this.service, this.mapper)), "/health");
    context.addServlet(new ServletHolder("terminals", new StatusServlet(this.service, this.mapper)), "/terminals");
    JettyWebSocketServletContainerInitializer.configure(context, (servletContext, container) -> {
      container.setMaxTextMessageSize(MAX_TEXT_MESSAGE_SIZE);
      container.setIdleTimeout(Duration.ofMinutes(30));
      container.addMapping("/terminal", (request, response) -> new TerminalWebSocket(this.service));
    });
    newServer.setHandler(context);

    try {
      newServer.start();
    } catch (final Exception e) {
      newServer.stop();
      throw e;
    }
    this.server = newServer;
    this.boundPort = connector.getLocalPort();
    LOGGER.info("Remote terminal server started on {}:{}", this.config.host(), this.boundPort);
    LOGGER.info("WebSocket endpoint: ws://{}:{}/terminal", this.config.host(), this.boundPort);
  }

  /**
   * Kills every remote terminal and stops the server. Does nothing if not running.
   *
   * @throws Exception if Jetty fails to stop
   */
  public synchronized void stop() throws Exception {
    if (this.server == null) {
      return;
    }
    this.service.shutdown();
    try {
      this.server.stop();
    } finally {
      this.server = null;
      LOGGER.info("Remote terminal server stopped");
    }
  }

  public synchronized boolean isRunning() {
    return this.server != null && this.server.isStarted();
  }

  public synchronized ServerStatus getStatus() {
    final int port = this.server != null ? this.boundPort : this.config.port();
    return new ServerStatus(isRunning(), port, this.service.sessionCount(),
        ManagementFactory.getRuntimeMXBean().getUptime() / 1000L);
  }

  @Override
  public void close() {
    try {
      stop();
    } catch (final Exception e) {
      LOGGER.error("Failed to stop remote terminal server", e);
    }
  }
}

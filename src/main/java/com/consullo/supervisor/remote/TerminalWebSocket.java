package com.consullo.supervisor.remote;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jetty endpoint for {@code /terminal}. Adapts one WebSocket to a {@link RemoteConnection}.
 */
final class TerminalWebSocket implements WebSocketListener, RemoteConnection {

  private static final Logger LOGGER = LoggerFactory.getLogger(TerminalWebSocket.class);

  private final RemoteTerminalService service;
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile Session session;
  private volatile String sessionId;

  TerminalWebSocket(final RemoteTerminalService service) {
    this.service = service;
  }

  @Override
  public void onWebSocketConnect(final Session newSession) {
    this.session = newSession;
    this.sessionId = this.service.onConnect(this);
  }

  @Override
  public void onWebSocketText(final String message) {
    this.service.onMessage(this.sessionId, this, message);
  }

  @Override
  public void onWebSocketBinary(final byte[] payload, final int offset, final int len) {
    LOGGER.warn("Ignoring {} byte binary frame from {}", len, this.sessionId);
  }

  @Override
  public void onWebSocketClose(final int statusCode, final String reason) {
    disconnected();
  }

  @Override
  public void onWebSocketError(final Throwable cause) {
    LOGGER.error("Connection error {}", this.sessionId, cause);
    disconnected();
  }

  @Override
  public void send(final String text) throws IOException {
    final Session current = this.session;
    if (current == null) {
      throw new IOException("WebSocket not connected");
    }
    // Jetty allows only one blocking send at a time per session.
    synchronized (this) {
      current.getRemote().sendString(text);
    }
  }

  @Override
  public boolean isOpen() {
    final Session current = this.session;
    return current != null && current.isOpen() && !this.closed.get();
  }

  private void disconnected() {
    if (this.sessionId != null && this.closed.compareAndSet(false, true)) {
      this.service.onClose(this.sessionId);
    }
  }
}

package com.consullo.supervisor.bridge;

import com.consullo.supervisor.loop.EventLoop;
import com.consullo.supervisor.pty.TerminalOptions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconnecting relay between a terminal consumer and the terminal side.
 *
 * <p>
 * Requests issued while disconnected are queued and their futures fail immediately
 * with {@code "MessagePort not connected"}; the queue is drained in order on the next
 * connection. Losing either port schedules a reconnection with exponential backoff
 * ({@link BridgeConfig#delayForAttempt(int)}) until the attempt limit is reached.
 * </p>
 *
 * <p>
 * State is confined to the bridge's {@link EventLoop}; {@link #connectionStatus()} may
 * be called from any thread.
 * </p>
 *
 * @since 1.0
 */
public final class ChannelBridge implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChannelBridge.class);

  static final String NOT_CONNECTED = "MessagePort not connected";
  static final String DISCONNECTED = "MessagePort disconnected";
  private static final int MAX_INFLIGHT = 1024;

  private final String channelId;
  private final ChannelFactory factory;
  private final EventLoop loop;
  private final BridgeConfig config;
  private final List<BridgeListener> listeners = new CopyOnWriteArrayList<>();
  private final Deque<BridgeRequest> queue = new ArrayDeque<>();
  private final Map<String, Long> inflight = new LinkedHashMap<>(16, 0.75f, false) {
    private static final long serialVersionUID = 1L;

    @Override
    protected boolean removeEldestEntry(final Map.Entry<String, Long> eldest) {
      return size() > MAX_INFLIGHT;
    }
  };

  private ChannelPort<BridgeRequest, BridgeResponse> consumerPort;
  private ChannelPort<BridgeResponse, BridgeRequest> hostPort;
  private EventLoop.Scheduled reconnectTask;
  private long generation;
  private long sequence;
  private boolean connected;
  private int reconnectAttempts;
  private long messageCount;
  private long totalLatency;
  private long maxLatency;
  private int channelsActive;

  public ChannelBridge(final String channelId, final ChannelFactory factory, final EventLoop loop,
      final BridgeConfig config) {
    Validate.notBlank(channelId, "channelId must not be blank");
    Validate.notNull(factory, "factory must not be null");
    Validate.notNull(loop, "loop must not be null");
    Validate.notNull(config, "config must not be null");
    this.channelId = channelId;
    this.factory = factory;
    this.loop = loop;
    this.config = config;
  }

  public String channelId() {
    return this.channelId;
  }

  public void addListener(final BridgeListener listener) {
    Validate.notNull(listener, "listener must not be null");
    this.listeners.add(listener);
  }

  public void removeListener(final BridgeListener listener) {
    this.listeners.remove(listener);
  }

  /**
   * Opens the channel pair.
   *
   * @return completes when connected; fails with the setup error, after which a retry is scheduled
   */
  public CompletableFuture<Void> initialize() {
    final CompletableFuture<Void> future = new CompletableFuture<>();
    this.loop.execute(() -> {
      try {
        connect();
        future.complete(null);
      } catch (final Exception e) {
        future.completeExceptionally(e);
      }
    });
    return future;
  }

  public CompletableFuture<Void> createTerminal(final TerminalOptions options) {
    return send(BridgeRequest.Type.CREATE, BridgeRequest.Payload.options(options));
  }

  public CompletableFuture<Void> write(final String data) {
    return send(BridgeRequest.Type.WRITE, BridgeRequest.Payload.text(data));
  }

  public CompletableFuture<Void> resize(final int cols, final int rows) {
    return send(BridgeRequest.Type.RESIZE, BridgeRequest.Payload.size(cols, rows));
  }

  public CompletableFuture<Void> kill() {
    return send(BridgeRequest.Type.KILL, null);
  }

  public CompletableFuture<Void> listTerminals() {
    return send(BridgeRequest.Type.LIST, null);
  }

  /**
   * Drops the current channel, resets the attempt counter and connects again.
   */
  public void reconnect() {
    this.loop.execute(() -> {
      synchronized (this) {
        cancelReconnect();
        this.reconnectAttempts = 0;
        if (this.connected) {
          this.channelsActive = Math.max(0, this.channelsActive - 1);
        }
        this.connected = false;
        dropPorts();
      }
      try {
        connect();
      } catch (final Exception e) {
        LOGGER.error("[{}] Manual reconnection failed: {}", this.channelId, e.getMessage());
      }
    });
  }

  public synchronized ConnectionStatus connectionStatus() {
    final double avg = this.messageCount > 0 ? (double) this.totalLatency / this.messageCount : 0d;
    return new ConnectionStatus(this.connected, this.reconnectAttempts, this.queue.size(),
        new ConnectionStatus.Performance(this.messageCount, this.totalLatency, avg, this.maxLatency,
            this.channelsActive));
  }

  /**
   * Closes both ports, clears the queue and stops reconnecting. Safe before
   * {@link #initialize()}.
   */
  public void cleanup() {
    this.loop.execute(() -> {
      synchronized (this) {
        this.connected = false;
        this.queue.clear();
        this.inflight.clear();
        cancelReconnect();
        dropPorts();
        this.channelsActive = 0;
      }
      LOGGER.info("[{}] Bridge cleaned up", this.channelId);
      for (final BridgeListener listener : this.listeners) {
        notifySafely(listener::onCleanup);
      }
    });
  }

  @Override
  public void close() {
    cleanup();
  }

  private void connect() throws Exception {
    try {
      LOGGER.debug("[{}] Setting up connection", this.channelId);
      final ChannelPair pair = this.factory.open(this.channelId);
      Validate.notNull(pair, "channel factory returned no ports");
      final long current;
      synchronized (this) {
        current = ++this.generation;
        this.consumerPort = pair.consumerPort();
        this.hostPort = pair.hostPort();
      }
      pair.consumerPort().start(request -> onConsumerRequest(current, request),
          () -> onPortClosed(current, "Consumer"));
      pair.hostPort().start(response -> onHostResponse(current, response),
          () -> onPortClosed(current, "Host"));
    } catch (final Exception e) {
      LOGGER.error("[{}] Failed to set up connection: {}", this.channelId, e.getMessage());
      synchronized (this) {
        dropPorts();
      }
      handleConnectionError(e);
      throw e;
    }

    synchronized (this) {
      this.connected = true;
      this.reconnectAttempts = 0;
      this.channelsActive++;
    }
    processQueue();
    LOGGER.info("[{}] Connection established", this.channelId);
    for (final BridgeListener listener : this.listeners) {
      notifySafely(listener::onConnected);
    }
  }

  private CompletableFuture<Void> send(final BridgeRequest.Type type, final BridgeRequest.Payload payload) {
    final CompletableFuture<Void> future = new CompletableFuture<>();
    this.loop.execute(() -> {
      try {
        dispatch(newRequest(type, payload));
        future.complete(null);
      } catch (final RuntimeException e) {
        future.completeExceptionally(e);
      }
    });
    return future;
  }

  private synchronized BridgeRequest newRequest(final BridgeRequest.Type type, final BridgeRequest.Payload payload) {
    final long now = this.loop.currentTimeMillis();
    final String requestId = type.wireName() + "-" + this.channelId + "-" + now + "-" + ++this.sequence;
    return new BridgeRequest(type, this.channelId, payload, now, requestId);
  }

  private void dispatch(final BridgeRequest request) {
    final ChannelPort<BridgeResponse, BridgeRequest> port;
    synchronized (this) {
      port = this.hostPort;
      if (!this.connected || port == null) {
        enqueue(request);
        throw new IllegalStateException(NOT_CONNECTED);
      }
    }
    port.post(request);
    synchronized (this) {
      this.messageCount++;
      if (request.requestId() != null && request.timestamp() != null) {
        this.inflight.put(request.requestId(), request.timestamp());
      }
    }
    LOGGER.debug("[{}] Sent request {} ({})", this.channelId, request.type(), request.requestId());
  }

  private void enqueue(final BridgeRequest request) {
    LOGGER.warn("[{}] Queuing {} request, not connected", this.channelId, request.type());
    if (this.queue.size() >= this.config.maxQueuedMessages()) {
      final BridgeRequest dropped = this.queue.pollFirst();
      LOGGER.warn("[{}] Queue full, dropping oldest request {}", this.channelId, dropped.requestId());
    }
    this.queue.addLast(request);
  }

  private void processQueue() {
    final List<BridgeRequest> pending;
    synchronized (this) {
      if (this.queue.isEmpty()) {
        return;
      }
      pending = new ArrayList<>(this.queue);
      this.queue.clear();
    }
    LOGGER.info("[{}] Processing {} queued request(s)", this.channelId, pending.size());
    for (final BridgeRequest request : pending) {
      try {
        dispatch(request);
      } catch (final RuntimeException e) {
        LOGGER.error("[{}] Failed to process queued request {}: {}", this.channelId, request.requestId(),
            e.getMessage());
        emitError(e);
      }
    }
  }

  private void onConsumerRequest(final long current, final BridgeRequest request) {
    if (current != this.generation) {
      return;
    }
    LOGGER.debug("[{}] Forwarding consumer request {}", this.channelId, request.type());
    try {
      dispatch(request);
    } catch (final RuntimeException e) {
      LOGGER.error("[{}] Failed to forward request: {}", this.channelId, e.getMessage());
      emitError(e);
    }
  }

  private void onHostResponse(final long current, final BridgeResponse response) {
    final ChannelPort<BridgeRequest, BridgeResponse> consumer;
    synchronized (this) {
      if (current != this.generation) {
        return;
      }
      consumer = this.consumerPort;
      if (response.timestamp() != null && response.requestId() != null) {
        final Long sentAt = this.inflight.remove(response.requestId());
        final long latency = sentAt != null
            ? response.timestamp() - sentAt
            : this.loop.currentTimeMillis() - response.timestamp();
        this.totalLatency += Math.max(0L, latency);
        this.maxLatency = Math.max(this.maxLatency, latency);
      }
    }
    final String output = response.data() == null ? null : response.data().output();
    if (StringUtils.isNotEmpty(output)) {
      for (final BridgeListener listener : this.listeners) {
        notifySafely(() -> listener.onData(output));
      }
    }
    for (final BridgeListener listener : this.listeners) {
      notifySafely(() -> listener.onResponse(response));
    }
    if (consumer != null && consumer.isOpen()) {
      try {
        consumer.post(response);
      } catch (final IllegalStateException e) {
        LOGGER.debug("[{}] Consumer port closed while relaying response", this.channelId);
      }
    }
  }

  private void onPortClosed(final long current, final String side) {
    synchronized (this) {
      if (current != this.generation || !this.connected) {
        return;
      }
      this.connected = false;
      this.channelsActive = Math.max(0, this.channelsActive - 1);
      dropPorts();
    }
    LOGGER.warn("[{}] {} port closed", this.channelId, side);
    for (final BridgeListener listener : this.listeners) {
      notifySafely(listener::onDisconnected);
    }
    handleConnectionError(new IllegalStateException(DISCONNECTED));
  }

  private void handleConnectionError(final Exception error) {
    final int attempt;
    final long delay;
    synchronized (this) {
      this.connected = false;
      if (this.reconnectAttempts >= this.config.maxReconnectAttempts()) {
        attempt = -1;
        delay = 0L;
      } else {
        attempt = ++this.reconnectAttempts;
        delay = this.config.delayForAttempt(attempt);
        cancelReconnect();
        this.reconnectTask = this.loop.schedule(this::retry, delay);
      }
    }
    emitError(error);
    if (attempt < 0) {
      LOGGER.error("[{}] Max reconnection attempts reached", this.channelId);
      for (final BridgeListener listener : this.listeners) {
        notifySafely(listener::onMaxReconnectAttemptsReached);
      }
    } else {
      LOGGER.info("[{}] Attempting reconnection {}/{} in {}ms", this.channelId, attempt,
          this.config.maxReconnectAttempts(), delay);
    }
  }

  private void retry() {
    synchronized (this) {
      this.reconnectTask = null;
    }
    try {
      connect();
    } catch (final Exception e) {
      LOGGER.error("[{}] Reconnection failed: {}", this.channelId, e.getMessage());
    }
  }

  private void cancelReconnect() {
    if (this.reconnectTask != null) {
      this.reconnectTask.cancel();
      this.reconnectTask = null;
    }
  }

  /**
   * Forgets and closes the current ports. Their close callbacks are ignored from here on.
   */
  private void dropPorts() {
    this.generation++;
    final ChannelPort<?, ?> consumer = this.consumerPort;
    final ChannelPort<?, ?> host = this.hostPort;
    this.consumerPort = null;
    this.hostPort = null;
    if (consumer != null) {
      consumer.close();
    }
    if (host != null) {
      host.close();
    }
  }

  private void emitError(final Throwable error) {
    for (final BridgeListener listener : this.listeners) {
      notifySafely(() -> listener.onError(error));
    }
  }

  private static void notifySafely(final Runnable callback) {
    try {
      callback.run();
    } catch (final RuntimeException e) {
      LOGGER.error("Bridge listener failed", e);
    }
  }
}

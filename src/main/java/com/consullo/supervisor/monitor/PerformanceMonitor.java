package com.consullo.supervisor.monitor;

import com.consullo.supervisor.loop.EventLoop;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically samples registered terminals, keeps bounded histories and raises
 * threshold alerts.
 *
 * <p>
 * The sampling timer runs on the supplied {@link EventLoop} while at least one
 * terminal is registered. A failure sampling one terminal is logged and does not affect
 * the others. State is guarded by the monitor's lock; listeners are notified outside it.
 * </p>
 *
 * @since 1.0
 */
public final class PerformanceMonitor implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(PerformanceMonitor.class);

  private static final double MB = 1024.0 * 1024.0;

  private final EventLoop loop;
  private final SystemMetricsProvider systemMetrics;
  private final Map<String, Registration> terminals = new LinkedHashMap<>();
  private final Map<String, Deque<PerformanceSample>> metrics = new LinkedHashMap<>();
  private final Map<String, Deque<Alert>> alerts = new LinkedHashMap<>();
  private final List<MonitorListener> listeners = new CopyOnWriteArrayList<>();

  private MonitorConfig config;
  private EventLoop.Scheduled timer;
  private boolean destroyed;

  public PerformanceMonitor(final MonitorConfig config, final EventLoop loop,
      final SystemMetricsProvider systemMetrics) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(loop, "loop must not be null");
    Validate.notNull(systemMetrics, "systemMetrics must not be null");
    this.config = config;
    this.loop = loop;
    this.systemMetrics = systemMetrics;
  }

  public void addListener(final MonitorListener listener) {
    Validate.notNull(listener, "listener must not be null");
    this.listeners.add(listener);
  }

  public void removeListener(final MonitorListener listener) {
    this.listeners.remove(listener);
  }

  /**
   * Starts sampling a terminal. The first registration starts the timer.
   *
   * @param terminalId terminal id
   * @param terminal terminal to sample; buffer statistics are read if it is {@link Instrumented}
   * @param strategy strategy tag recorded with each sample
   */
  public void registerTerminal(final String terminalId, final MonitoredTerminal terminal, final String strategy) {
    Validate.notBlank(terminalId, "terminalId must not be blank");
    Validate.notNull(terminal, "terminal must not be null");
    final boolean start;
    synchronized (this) {
      if (this.destroyed) {
        LOGGER.warn("Monitor destroyed, not registering terminal {}", terminalId);
        return;
      }
      final Instrumented instrumented = terminal instanceof Instrumented ? (Instrumented) terminal : null;
      this.terminals.put(terminalId, new Registration(terminal, instrumented, strategy));
      this.metrics.putIfAbsent(terminalId, new ArrayDeque<>());
      this.alerts.putIfAbsent(terminalId, new ArrayDeque<>());
      start = this.timer == null;
    }
    LOGGER.debug("Registered terminal {} for monitoring", terminalId);
    if (start) {
      startMonitoring();
    }
  }

  /**
   * Stops sampling a terminal and forgets its history. The last unregistration stops
   * the timer.
   *
   * @param terminalId terminal id
   */
  public void unregisterTerminal(final String terminalId) {
    final boolean stop;
    synchronized (this) {
      if (this.terminals.remove(terminalId) == null) {
        return;
      }
      this.metrics.remove(terminalId);
      this.alerts.remove(terminalId);
      stop = this.terminals.isEmpty();
    }
    LOGGER.debug("Unregistered terminal {} from monitoring", terminalId);
    if (stop) {
      stopMonitoring();
    }
  }

  public void startMonitoring() {
    synchronized (this) {
      if (this.timer != null || this.destroyed) {
        return;
      }
      final long interval = this.config.intervalMillis();
      this.timer = this.loop.scheduleAtFixedRate(this::collectMetrics, interval, interval);
    }
    LOGGER.info("Started performance monitoring every {} ms", this.config.intervalMillis());
    for (final MonitorListener listener : this.listeners) {
      notifySafely(listener::onMonitoringStarted);
    }
  }

  public void stopMonitoring() {
    synchronized (this) {
      if (this.timer == null) {
        return;
      }
      this.timer.cancel();
      this.timer = null;
    }
    LOGGER.info("Stopped performance monitoring");
    for (final MonitorListener listener : this.listeners) {
      notifySafely(listener::onMonitoringStopped);
    }
  }

  public synchronized boolean isMonitoring() {
    return this.timer != null;
  }

  /**
   * Samples every registered terminal once, stores the samples, raises alerts and
   * publishes global statistics.
   */
  public void collectMetrics() {
    final List<Alert> raised = new ArrayList<>();
    final GlobalStats stats;
    synchronized (this) {
      final long now = this.loop.currentTimeMillis();
      for (final Map.Entry<String, Registration> entry : this.terminals.entrySet()) {
        final String terminalId = entry.getKey();
        try {
          final PerformanceSample sample = sample(terminalId, entry.getValue(), now);
          append(this.metrics.get(terminalId), sample, this.config.maxMetricsHistory());
          for (final Alert alert : analyze(sample)) {
            append(this.alerts.get(terminalId), alert, this.config.maxAlertsHistory());
            raised.add(alert);
          }
        } catch (final RuntimeException e) {
          LOGGER.error("Error collecting metrics for terminal {}", terminalId, e);
        }
      }
      stats = getGlobalStats();
    }
    for (final Alert alert : raised) {
      LOGGER.warn("Performance alert for terminal {}: {}", alert.terminalId(), alert.message());
      for (final MonitorListener listener : this.listeners) {
        notifySafely(() -> listener.onAlert(alert));
      }
    }
    for (final MonitorListener listener : this.listeners) {
      notifySafely(() -> listener.onPerformanceUpdate(stats));
    }
  }

  public synchronized GlobalStats getGlobalStats() {
    int active = 0;
    long memory = 0L;
    double latency = 0.0;
    int sampled = 0;
    int alertCount = 0;
    int healthy = 0;
    int warning = 0;
    int critical = 0;
    for (final Map.Entry<String, Registration> entry : this.terminals.entrySet()) {
      if (isRunningSafely(entry.getKey(), entry.getValue().terminal)) {
        active++;
      }
      final Deque<PerformanceSample> history = this.metrics.get(entry.getKey());
      final PerformanceSample latest = history == null ? null : history.peekLast();
      if (latest != null) {
        memory += latest.systemMetrics().memoryUsage();
        latency += latest.bufferHealth().averageLatency();
        sampled++;
        switch (latest.bufferHealth().status()) {
          case CRITICAL:
            critical++;
            break;
          case WARNING:
            warning++;
            break;
          default:
            healthy++;
            break;
        }
      }
      final Deque<Alert> terminalAlerts = this.alerts.get(entry.getKey());
      alertCount += terminalAlerts == null ? 0 : terminalAlerts.size();
    }
    return new GlobalStats(this.terminals.size(), active, memory, sampled == 0 ? 0.0 : latency / sampled,
        alertCount, healthy, warning, critical);
  }

  public List<PerformanceSample> getTerminalMetrics(final String terminalId) {
    return getTerminalMetrics(terminalId, 10);
  }

  /**
   * @param terminalId terminal id
   * @param limit maximum samples
   * @return most recent samples, oldest first
   */
  public synchronized List<PerformanceSample> getTerminalMetrics(final String terminalId, final int limit) {
    return tail(this.metrics.get(terminalId), limit);
  }

  public List<Alert> getTerminalAlerts(final String terminalId) {
    return getTerminalAlerts(terminalId, 10);
  }

  public synchronized List<Alert> getTerminalAlerts(final String terminalId, final int limit) {
    return tail(this.alerts.get(terminalId), limit);
  }

  /**
   * Empties a terminal's histories while keeping it registered.
   *
   * @param terminalId terminal id
   */
  public synchronized void clearTerminalData(final String terminalId) {
    if (this.metrics.containsKey(terminalId)) {
      this.metrics.put(terminalId, new ArrayDeque<>());
      this.alerts.put(terminalId, new ArrayDeque<>());
      LOGGER.info("Cleared performance data for terminal {}", terminalId);
    }
  }

  /**
   * Replaces the configuration. A running timer is restarted when the interval changes.
   *
   * @param newConfig configuration
   */
  public void updateConfig(final MonitorConfig newConfig) {
    Validate.notNull(newConfig, "newConfig must not be null");
    final boolean restart;
    synchronized (this) {
      restart = this.timer != null && newConfig.intervalMillis() != this.config.intervalMillis();
      this.config = newConfig;
    }
    LOGGER.info("Performance monitor configuration updated: {}", newConfig);
    if (restart) {
      stopMonitoring();
      startMonitoring();
    }
  }

  public synchronized MonitorConfig config() {
    return this.config;
  }

  public synchronized PerformanceExport exportData() {
    final Map<String, List<PerformanceSample>> samples = new LinkedHashMap<>();
    this.metrics.forEach((id, history) -> samples.put(id, List.copyOf(history)));
    final Map<String, List<Alert>> alertCopy = new LinkedHashMap<>();
    this.alerts.forEach((id, history) -> alertCopy.put(id, List.copyOf(history)));
    return new PerformanceExport(List.copyOf(this.terminals.keySet()), samples, alertCopy, getGlobalStats());
  }

  /**
   * Stops the timer and forgets all terminals, histories and listeners.
   */
  public void destroy() {
    stopMonitoring();
    synchronized (this) {
      this.destroyed = true;
      this.terminals.clear();
      this.metrics.clear();
      this.alerts.clear();
    }
    this.listeners.clear();
    LOGGER.info("Performance monitor destroyed");
  }

  @Override
  public void close() {
    destroy();
  }

  private PerformanceSample sample(final String terminalId, final Registration registration, final long now) {
    final BufferHealth health;
    final BufferMetrics buffer;
    if (registration.instrumented != null) {
      health = registration.instrumented.bufferHealth();
      buffer = registration.instrumented.bufferMetrics();
    } else {
      health = BufferHealth.UNKNOWN;
      buffer = BufferMetrics.EMPTY;
    }
    final SystemMetrics system = new SystemMetrics(this.systemMetrics.heapUsed(), this.systemMetrics.cpuTimeMicros(),
        registration.terminal.pid(), registration.terminal.isRunning());
    return new PerformanceSample(terminalId, now, registration.strategy, health, buffer, system);
  }

  private List<Alert> analyze(final PerformanceSample sample) {
    final AlertThresholds t = this.config.thresholds();
    final List<Alert> out = new ArrayList<>(4);
    final String id = sample.terminalId();
    final long ts = sample.timestamp();

    final long heap = sample.systemMetrics().memoryUsage();
    if (heap > t.memoryCritical()) {
      out.add(new Alert(id, AlertType.MEMORY, AlertSeverity.HIGH,
          "High memory usage: " + Math.round(heap / MB) + "MB",
          "Consider reducing buffer size or closing unused terminals", ts));
    } else if (heap > t.memoryWarning()) {
      out.add(new Alert(id, AlertType.MEMORY, AlertSeverity.MEDIUM,
          "Elevated memory usage: " + Math.round(heap / MB) + "MB",
          "Monitor memory usage and consider optimization", ts));
    }

    final BufferHealth health = sample.bufferHealth();
    if (health.averageLatency() > t.latencyCritical()) {
      out.add(new Alert(id, AlertType.LATENCY, AlertSeverity.HIGH,
          "High buffer latency: " + number(health.averageLatency()) + "ms",
          "Reduce flush interval or increase chunk processing rate", ts));
    } else if (health.averageLatency() > t.latencyWarning()) {
      out.add(new Alert(id, AlertType.LATENCY, AlertSeverity.MEDIUM,
          "Elevated buffer latency: " + number(health.averageLatency()) + "ms",
          "Consider buffer optimization", ts));
    }

    if (health.utilization() > t.bufferUtilizationCritical()) {
      out.add(new Alert(id, AlertType.BUFFER, AlertSeverity.HIGH,
          "Buffer critically full: " + number(health.utilization()) + "%",
          "Increase buffer size or improve processing speed", ts));
    } else if (health.utilization() > t.bufferUtilizationWarning()) {
      out.add(new Alert(id, AlertType.BUFFER, AlertSeverity.MEDIUM,
          "Buffer utilization high: " + number(health.utilization()) + "%",
          "Monitor buffer usage", ts));
    }

    if (health.droppedChunksPercent() > t.droppedChunksCritical()) {
      out.add(new Alert(id, AlertType.BUFFER, AlertSeverity.HIGH,
          "High data loss: " + number(health.droppedChunksPercent()) + "% chunks dropped",
          "Increase buffer size or optimize processing pipeline", ts));
    } else if (health.droppedChunksPercent() > t.droppedChunksWarning()) {
      out.add(new Alert(id, AlertType.BUFFER, AlertSeverity.MEDIUM,
          "Data loss detected: " + number(health.droppedChunksPercent()) + "% chunks dropped",
          "Monitor and consider buffer optimization", ts));
    }
    return out;
  }

  private static String number(final double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value)) {
      return Long.toString((long) value);
    }
    return String.format(Locale.ROOT, "%.2f", value);
  }

  private static <T> void append(final Deque<T> history, final T item, final int max) {
    history.addLast(item);
    while (history.size() > max) {
      history.pollFirst();
    }
  }

  private static <T> List<T> tail(final Deque<T> history, final int limit) {
    if (history == null || limit <= 0) {
      return List.of();
    }
    final List<T> all = new ArrayList<>(history);
    return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
  }

  private static boolean isRunningSafely(final String terminalId, final MonitoredTerminal terminal) {
    try {
      return terminal.isRunning();
    } catch (final RuntimeException e) {
      LOGGER.debug("Could not query terminal {}: {}", terminalId, e.getMessage());
      return false;
    }
  }

  private static void notifySafely(final Runnable callback) {
    try {
      callback.run();
    } catch (final RuntimeException e) {
      LOGGER.error("Performance monitor listener failed", e);
    }
  }

  private static final class Registration {

    private final MonitoredTerminal terminal;
    private final Instrumented instrumented;
    private final String strategy;

    private Registration(final MonitoredTerminal terminal, final Instrumented instrumented, final String strategy) {
      this.terminal = terminal;
      this.instrumented = instrumented;
      this.strategy = strategy;
    }
  }
}

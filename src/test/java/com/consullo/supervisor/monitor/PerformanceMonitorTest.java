package com.consullo.supervisor.monitor;

import com.consullo.supervisor.loop.ManualEventLoop;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for sampling, alerting and history retention.
 */
public class PerformanceMonitorTest {

  private static final long MB = 1024L * 1024L;

  private final ManualEventLoop loop = new ManualEventLoop();
  private final SystemMetricsProvider system = mock(SystemMetricsProvider.class);
  private final List<Alert> alerts = new ArrayList<>();
  private final List<GlobalStats> updates = new ArrayList<>();
  private final List<String> lifecycle = new ArrayList<>();
  private PerformanceMonitor monitor;

  @BeforeEach
  void setUp() {
    when(this.system.heapUsed()).thenReturn(10L * MB);
    when(this.system.cpuTimeMicros()).thenReturn(5_000L);
    this.monitor = new PerformanceMonitor(MonitorConfig.DEFAULTS, this.loop, this.system);
    this.monitor.addListener(new MonitorListener() {
      @Override
      public void onAlert(final Alert alert) {
        PerformanceMonitorTest.this.alerts.add(alert);
      }

      @Override
      public void onPerformanceUpdate(final GlobalStats stats) {
        PerformanceMonitorTest.this.updates.add(stats);
      }

      @Override
      public void onMonitoringStarted() {
        PerformanceMonitorTest.this.lifecycle.add("started");
      }

      @Override
      public void onMonitoringStopped() {
        PerformanceMonitorTest.this.lifecycle.add("stopped");
      }
    });
  }

  @Test
  @DisplayName("Should run the timer only while terminals are registered")
  void register_FirstAndLast_StartsAndStopsTimer() {
    assertThat(this.monitor.isMonitoring()).isFalse();

    this.monitor.registerTerminal("a", new StubTerminal(1L), "native-pty");
    this.monitor.registerTerminal("b", new StubTerminal(2L), "native-pty");
    assertThat(this.monitor.isMonitoring()).isTrue();
    assertThat(this.loop.pendingDelays()).containsExactly(5000L);

    this.monitor.unregisterTerminal("a");
    assertThat(this.monitor.isMonitoring()).isTrue();
    this.monitor.unregisterTerminal("b");

    assertThat(this.monitor.isMonitoring()).isFalse();
    assertThat(this.lifecycle).containsExactly("started", "stopped");
  }

  @Test
  @DisplayName("Should sample each interval and publish global stats")
  void collectMetrics_OnInterval_StoresSamples() {
    final StubTerminal terminal = new StubTerminal(42L);
    this.monitor.registerTerminal("a", terminal, "native-pty");

    this.loop.advance(15_000L);

    final List<PerformanceSample> samples = this.monitor.getTerminalMetrics("a");
    assertThat(samples).hasSize(3);
    assertThat(samples.get(0).systemMetrics().pid()).isEqualTo(42L);
    assertThat(samples.get(0).strategy()).isEqualTo("native-pty");
    assertThat(this.updates).hasSize(3);
    assertThat(this.updates.get(2)).isEqualTo(new GlobalStats(1, 1, 10L * MB, 0.0, 0, 1, 0, 0));
  }

  @Test
  @DisplayName("Should raise memory alerts with severity by threshold")
  void collectMetrics_HighHeap_RaisesMemoryAlert() {
    when(this.system.heapUsed()).thenReturn(120L * MB);
    this.monitor.registerTerminal("a", new StubTerminal(1L), "native-pty");

    this.monitor.collectMetrics();

    assertThat(this.alerts).singleElement().satisfies(alert -> {
      assertThat(alert.type()).isEqualTo(AlertType.MEMORY);
      assertThat(alert.severity()).isEqualTo(AlertSeverity.HIGH);
      assertThat(alert.message()).isEqualTo("High memory usage: 120MB");
    });

    when(this.system.heapUsed()).thenReturn(60L * MB);
    this.monitor.collectMetrics();
    assertThat(this.alerts.get(1).severity()).isEqualTo(AlertSeverity.MEDIUM);
    assertThat(this.alerts.get(1).message()).isEqualTo("Elevated memory usage: 60MB");
  }

  @Test
  @DisplayName("Should raise buffer and latency alerts from instrumented terminals")
  void collectMetrics_UnhealthyBuffer_RaisesBufferAlerts() {
    final InstrumentedStub terminal = new InstrumentedStub(1L,
        new BufferHealth(HealthStatus.CRITICAL, 90.0, 120.0, 2.0));
    this.monitor.registerTerminal("a", terminal, "native-pty");

    this.monitor.collectMetrics();

    assertThat(this.alerts).extracting(Alert::message).containsExactly(
        "High buffer latency: 120ms",
        "Buffer critically full: 90%",
        "Data loss detected: 2% chunks dropped");
    assertThat(this.alerts).extracting(Alert::type)
        .containsExactly(AlertType.LATENCY, AlertType.BUFFER, AlertType.BUFFER);
    assertThat(this.alerts).extracting(Alert::severity)
        .containsExactly(AlertSeverity.HIGH, AlertSeverity.HIGH, AlertSeverity.MEDIUM);
    assertThat(this.monitor.getGlobalStats().criticalTerminals()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should keep sampling other terminals when one fails")
  void collectMetrics_OneTerminalThrows_OthersSampled() {
    final MonitoredTerminal broken = mock(MonitoredTerminal.class);
    when(broken.pid()).thenThrow(new IllegalStateException("gone"));
    this.monitor.registerTerminal("broken", broken, "subprocess");
    this.monitor.registerTerminal("ok", new StubTerminal(7L), "subprocess");

    this.monitor.collectMetrics();

    assertThat(this.monitor.getTerminalMetrics("broken")).isEmpty();
    assertThat(this.monitor.getTerminalMetrics("ok")).hasSize(1);
    assertThat(this.updates).hasSize(1);
  }

  @Test
  @DisplayName("Should bound metric and alert histories")
  void collectMetrics_ManySamples_HistoryBounded() {
    this.monitor.updateConfig(new MonitorConfig(1000L, 3, 2, AlertThresholds.DEFAULTS));
    when(this.system.heapUsed()).thenReturn(200L * MB);
    this.monitor.registerTerminal("a", new StubTerminal(1L), "native-pty");

    for (int i = 0; i < 5; i++) {
      this.monitor.collectMetrics();
    }

    assertThat(this.monitor.getTerminalMetrics("a", 100)).hasSize(3);
    assertThat(this.monitor.getTerminalAlerts("a", 100)).hasSize(2);
    assertThat(this.monitor.getTerminalMetrics("a", 1)).hasSize(1);
    assertThat(this.monitor.exportData().alerts().get("a")).hasSize(2);
  }

  @Test
  @DisplayName("Should restart the timer when the interval changes")
  void updateConfig_NewInterval_RestartsTimer() {
    this.monitor.registerTerminal("a", new StubTerminal(1L), "native-pty");

    this.monitor.updateConfig(MonitorConfig.DEFAULTS.withIntervalMillis(1000L));

    assertThat(this.loop.pendingDelays()).containsExactly(1000L);
    assertThat(this.lifecycle).containsExactly("started", "stopped", "started");
  }

  @Test
  @DisplayName("Should clear histories but keep the terminal registered")
  void clearTerminalData_KeepsRegistration() {
    this.monitor.registerTerminal("a", new StubTerminal(1L), "native-pty");
    this.monitor.collectMetrics();

    this.monitor.clearTerminalData("a");

    assertThat(this.monitor.getTerminalMetrics("a")).isEmpty();
    assertThat(this.monitor.exportData().terminals()).containsExactly("a");
  }

  @Test
  @DisplayName("Should stop and refuse registrations once destroyed")
  void destroy_StopsAndClears() {
    this.monitor.registerTerminal("a", new StubTerminal(1L), "native-pty");

    this.monitor.destroy();
    this.monitor.registerTerminal("b", new StubTerminal(2L), "native-pty");

    assertThat(this.monitor.isMonitoring()).isFalse();
    assertThat(this.monitor.getGlobalStats().totalTerminals()).isZero();
  }

  private static class StubTerminal implements MonitoredTerminal {

    private final long pid;

    StubTerminal(final long pid) {
      this.pid = pid;
    }

    @Override
    public long pid() {
      return this.pid;
    }

    @Override
    public boolean isRunning() {
      return true;
    }
  }

  private static final class InstrumentedStub extends StubTerminal implements Instrumented {

    private final BufferHealth health;

    InstrumentedStub(final long pid, final BufferHealth health) {
      super(pid);
      this.health = health;
    }

    @Override
    public BufferHealth bufferHealth() {
      return this.health;
    }

    @Override
    public BufferMetrics bufferMetrics() {
      return BufferMetrics.EMPTY;
    }
  }
}

package com.consullo.supervisor.bridge;

import com.consullo.supervisor.host.HostConfig;
import com.consullo.supervisor.loop.ManualEventLoop;
import com.consullo.supervisor.manager.InProcessHostLauncher;
import com.consullo.supervisor.manager.ManagerConfig;
import com.consullo.supervisor.manager.SessionManager;
import com.consullo.supervisor.monitor.MonitorConfig;
import com.consullo.supervisor.monitor.PerformanceMonitor;
import com.consullo.supervisor.monitor.SystemMetricsProvider;
import com.consullo.supervisor.pty.FakeTerminal;
import com.consullo.supervisor.pty.FakeTerminalFactory;
import com.consullo.supervisor.pty.TerminalOptions;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Drives a session manager through a bridge and an in-process terminal host.
 */
public class SessionManagerEndpointTest {

  private final ManualEventLoop loop = new ManualEventLoop();
  private final FakeTerminalFactory terminals = new FakeTerminalFactory(12345L);
  private final List<BridgeResponse> responses = new ArrayList<>();
  private final List<String> output = new ArrayList<>();
  private SessionManager manager;
  private SessionManagerEndpoint endpoint;
  private ChannelBridge bridge;

  @BeforeEach
  void setUp() {
    final PerformanceMonitor monitor =
        new PerformanceMonitor(MonitorConfig.DEFAULTS, this.loop, mock(SystemMetricsProvider.class));
    this.manager = new SessionManager(ManagerConfig.DEFAULTS,
        new InProcessHostLauncher(this.terminals, ManualEventLoop::new, HostConfig.DEFAULTS), this.loop, monitor);
    this.manager.start();
    this.endpoint = new SessionManagerEndpoint(this.manager, this.loop);
    this.bridge = new ChannelBridge("ui-1", new InMemoryChannelFactory(this.loop, this.endpoint), this.loop,
        BridgeConfig.DEFAULTS);
    this.bridge.addListener(new BridgeListener() {
      @Override
      public void onData(final String data) {
        SessionManagerEndpointTest.this.output.add(data);
      }

      @Override
      public void onResponse(final BridgeResponse response) {
        SessionManagerEndpointTest.this.responses.add(response);
      }
    });
    this.bridge.initialize().join();
  }

  @AfterEach
  void tearDown() {
    this.bridge.cleanup();
    this.manager.destroy();
  }

  @Test
  @DisplayName("Should create a terminal and bind it to the channel")
  void create_ThroughBridge_BindsSession() {
    this.bridge.createTerminal(new TerminalOptions("/bin/bash", null, null, 120, 40)).join();

    final String sessionId = this.endpoint.sessionFor("ui-1");
    assertThat(sessionId).isNotNull();
    assertThat(this.responses).singleElement().satisfies(response -> {
      assertThat(response.success()).isTrue();
      assertThat(response.data().id()).isEqualTo(sessionId);
      assertThat(response.data().pid()).isEqualTo(12345L);
      assertThat(response.data().name()).isEqualTo("/bin/bash");
    });
    assertThat(this.terminals.options(sessionId).cols()).isEqualTo(120);
  }

  @Test
  @DisplayName("Should route writes to the bound terminal and stream its output back")
  void write_BoundTerminal_RoundTrips() {
    this.bridge.createTerminal(null).join();
    final FakeTerminal terminal = this.terminals.terminal(this.endpoint.sessionFor("ui-1"));

    this.bridge.write("echo hi").join();
    terminal.emitData("hi\r\n");

    assertThat(terminal.writes()).containsExactly("echo hi");
    assertThat(this.output).containsExactly("hi\r\n");
  }

  @Test
  @DisplayName("Should kill the bound terminal and release the channel")
  void kill_BoundTerminal_Released() {
    this.bridge.createTerminal(null).join();
    final FakeTerminal terminal = this.terminals.terminal(this.endpoint.sessionFor("ui-1"));

    this.bridge.kill().join();

    assertThat(terminal.isKilled()).isTrue();
    assertThat(this.endpoint.sessionFor("ui-1")).isNull();
  }

  @Test
  @DisplayName("Should answer list requests with the host's terminals")
  void list_TwoTerminals_Listed() {
    this.bridge.createTerminal(null).join();
    this.manager.createTerminal(null).join();
    this.responses.clear();

    this.bridge.listTerminals().join();

    assertThat(this.responses).singleElement()
        .satisfies(response -> assertThat(response.data().terminals()).hasSize(2));
  }
}

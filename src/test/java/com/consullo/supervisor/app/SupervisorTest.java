package com.consullo.supervisor.app;

import com.consullo.supervisor.bridge.BridgeListener;
import com.consullo.supervisor.bridge.BridgeResponse;
import com.consullo.supervisor.bridge.ChannelBridge;
import com.consullo.supervisor.config.SupervisorConfig;
import com.consullo.supervisor.loop.ManualEventLoop;
import com.consullo.supervisor.manager.HostMode;
import com.consullo.supervisor.manager.ManagerConfig;
import com.consullo.supervisor.manager.TerminalSession;
import com.consullo.supervisor.pty.FakeTerminalFactory;
import com.consullo.supervisor.pty.TerminalOptions;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class SupervisorTest {

  private final ManualEventLoop loop = new ManualEventLoop();
  private final FakeTerminalFactory terminals = new FakeTerminalFactory(4242L);

  private Supervisor inProcess() {
    final SupervisorConfig defaults = SupervisorConfig.DEFAULTS;
    final SupervisorConfig config = new SupervisorConfig(defaults.host(),
        new ManagerConfig(1000L, HostMode.IN_PROCESS, List.of()), defaults.monitor(), defaults.bridge(),
        defaults.remote());
    return new Supervisor(config, this.terminals, this.loop, ManualEventLoop::new);
  }

  @Test
  @DisplayName("Should wire an in-process host that serves terminal requests")
  void start_InProcessMode_CreatesTerminals() throws Exception {
    try (Supervisor supervisor = inProcess()) {
      supervisor.start();

      final TerminalSession session = supervisor.sessionManager().createTerminal(null).join();

      assertThat(session.pid()).isEqualTo(4242L);
      assertThat(supervisor.sessionManager().isInitialized()).isTrue();
      assertThat(supervisor.remoteServer()).isEmpty();
    }
  }

  @Test
  @DisplayName("Should reach the session manager through an opened bridge")
  void openBridge_Initialized_RoutesToManager() throws Exception {
    try (Supervisor supervisor = inProcess()) {
      supervisor.start();
      final List<BridgeResponse> responses = new ArrayList<>();
      final ChannelBridge bridge = supervisor.openBridge("panel");
      bridge.addListener(new BridgeListener() {
        @Override
        public void onResponse(final BridgeResponse response) {
          responses.add(response);
        }
      });
      bridge.initialize().join();

      bridge.createTerminal(new TerminalOptions("/bin/zsh", null, null, 100, 30)).join();

      assertThat(responses).singleElement().satisfies(response -> {
        assertThat(response.success()).isTrue();
        assertThat(response.data().pid()).isEqualTo(4242L);
      });
      assertThat(supervisor.sessionManager().terminalIds().join()).hasSize(1);
    }
  }

  @Test
  @DisplayName("Should kill host terminals and stop the loop once closed")
  void close_WithLiveTerminal_KillsTerminal() throws Exception {
    final Supervisor supervisor = inProcess();
    supervisor.start();
    final TerminalSession session = supervisor.sessionManager().createTerminal(null).join();

    supervisor.close();
    supervisor.close();

    assertThat(this.terminals.terminal(session.id()).isKilled()).isTrue();
    assertThat(this.loop.pendingTimerCount()).isZero();
  }
}

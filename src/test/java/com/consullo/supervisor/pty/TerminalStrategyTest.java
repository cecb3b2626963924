package com.consullo.supervisor.pty;

import com.consullo.supervisor.backend.BackendDetector;
import com.consullo.supervisor.backend.PlatformProbe;
import com.consullo.supervisor.backend.TerminalBackend;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for backend selection, caching and fallback.
 */
public class TerminalStrategyTest {

  private final ShellDefaults defaults = new ShellDefaults(Map.of("SHELL", "/bin/sh", "HOME", "/home/dev"),
      "Linux", "/tmp");
  private final Map<TerminalBackend, TerminalProvider> providers = new EnumMap<>(TerminalBackend.class);
  private PlatformProbe probe;

  @BeforeEach
  void setUp() {
    this.probe = mock(PlatformProbe.class);
    this.providers.put(TerminalBackend.SUBPROCESS, (id, options) -> new FakeTerminal(id, 200L));
  }

  @Test
  @DisplayName("Should create on the detected backend without a fallback reason")
  void createTerminal_NativePtyAvailable_UsesNativePty() throws Exception {
    when(this.probe.nativePtyUsable()).thenReturn(true);
    this.providers.put(TerminalBackend.NATIVE_PTY, (id, options) -> new FakeTerminal(id, 100L));

    final TerminalCreateResult result = strategy().createTerminal("t1", null);

    assertThat(result.backend()).isEqualTo(TerminalBackend.NATIVE_PTY);
    assertThat(result.fallbackReason()).isNull();
    assertThat(result.terminal().pid()).isEqualTo(100L);
  }

  @Test
  @DisplayName("Should fall back to subprocess when the preferred backend fails to start")
  void createTerminal_PreferredFails_FallsBackToSubprocess() throws Exception {
    when(this.probe.nativePtyUsable()).thenReturn(true);
    this.providers.put(TerminalBackend.NATIVE_PTY, (id, options) -> {
      throw new IOException("openpty failed");
    });

    final TerminalCreateResult result = strategy().createTerminal("t1", null);

    assertThat(result.backend()).isEqualTo(TerminalBackend.SUBPROCESS);
    assertThat(result.capabilities().supportsResize()).isFalse();
    assertThat(result.fallbackReason()).isEqualTo("native-pty unavailable (openpty failed), using subprocess backend");
  }

  @Test
  @DisplayName("Should explain degraded reliability when subprocess is the detected backend")
  void createTerminal_SubprocessDetected_ReportsReliability() throws Exception {
    when(this.probe.nativePtyUsable()).thenReturn(false);
    when(this.probe.isWindows()).thenReturn(false);

    final TerminalCreateResult result = strategy().createTerminal("t1", null);

    assertThat(result.fallbackReason()).isEqualTo("Using subprocess backend (medium reliability)");
  }

  @Test
  @DisplayName("Should propagate the failure when even the subprocess backend fails")
  void createTerminal_SubprocessFails_Throws() {
    when(this.probe.nativePtyUsable()).thenReturn(false);
    when(this.probe.isWindows()).thenReturn(false);
    this.providers.put(TerminalBackend.SUBPROCESS, (id, options) -> {
      throw new IOException("no shell");
    });

    assertThatThrownBy(() -> strategy().createTerminal("t1", null)).isInstanceOf(IOException.class)
        .hasMessage("no shell");
  }

  @Test
  @DisplayName("Should resolve default shell, cwd and size before opening")
  void createTerminal_NoOptions_ResolvesDefaults() throws Exception {
    when(this.probe.nativePtyUsable()).thenReturn(false);
    when(this.probe.isWindows()).thenReturn(false);
    final TerminalOptions[] seen = new TerminalOptions[1];
    this.providers.put(TerminalBackend.SUBPROCESS, (id, options) -> {
      seen[0] = options;
      return new FakeTerminal(id, 1L);
    });

    strategy().createTerminal("t1", new TerminalOptions(null, null, null, 120, null));

    assertThat(seen[0].shell()).isEqualTo("/bin/sh");
    assertThat(seen[0].cwd()).isEqualTo("/home/dev");
    assertThat(seen[0].cols()).isEqualTo(120);
    assertThat(seen[0].rows()).isEqualTo(24);
  }

  @Test
  @DisplayName("Should cache detection until refreshed")
  void detectBestStrategy_CalledTwice_DetectsOnce() {
    when(this.probe.nativePtyUsable()).thenReturn(true);
    final TerminalStrategy strategy = strategy();

    strategy.detectBestStrategy();
    strategy.detectBestStrategy();
    verify(this.probe, times(1)).nativePtyUsable();

    strategy.refreshStrategy();
    verify(this.probe, times(2)).nativePtyUsable();
    assertThat(strategy.activeBackend()).isEqualTo(TerminalBackend.NATIVE_PTY);
  }

  private TerminalStrategy strategy() {
    return new TerminalStrategy(new BackendDetector(this.probe), this.defaults, this.providers);
  }
}

package com.consullo.supervisor.host;

import com.consullo.supervisor.loop.ManualEventLoop;
import com.consullo.supervisor.protocol.HostRequest;
import com.consullo.supervisor.protocol.HostResponse;
import com.consullo.supervisor.pty.FakeTerminal;
import com.consullo.supervisor.pty.FakeTerminalFactory;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Replays recorded terminal output through the host.
 *
 * <p>
 * Fixtures are hex-encoded chunks, one per line, so that ESC and CR survive source
 * control unchanged.
 * </p>
 */
public final class ResizeStormFixtureTest {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResizeStormFixtureTest.class);

  @Test
  public void recordedStormIsCollapsed() throws Exception {
    final List<String> chunks = loadHexChunks("fixtures/resize-storm.ansi");
    LOGGER.info("replaying {} chunks", chunks.size());

    final FakeTerminalFactory factory = new FakeTerminalFactory(1L);
    final List<HostResponse> sent = new ArrayList<>();
    final TerminalHost host = new TerminalHost(factory, sent::add, new ManualEventLoop(), HostConfig.DEFAULTS);
    host.handle(HostRequest.create("rec", null));
    final FakeTerminal terminal = factory.terminal("rec");

    for (final String chunk : chunks) {
      terminal.emitData(chunk);
    }

    final StringBuilder forwarded = new StringBuilder();
    for (final HostResponse response : sent) {
      if (response.type() == HostResponse.Type.DATA) {
        forwarded.append(response.data());
      }
    }
    final String signal = chunks.get(0);
    assertThat(forwarded.toString()).isEqualTo(signal + signal + "ls\r\n");
  }

  private static List<String> loadHexChunks(final String resource) throws Exception {
    final List<String> out = new ArrayList<>();
    try (InputStream in = ResizeStormFixtureTest.class.getClassLoader().getResourceAsStream(resource)) {
      assertThat(in).as("fixture %s", resource).isNotNull();
      final BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.US_ASCII));
      String line;
      while ((line = reader.readLine()) != null) {
        line = line.trim();
        if (line.isEmpty() || line.startsWith("#")) {
          continue;
        }
        final byte[] bytes = new byte[line.length() / 2];
        for (int i = 0; i < bytes.length; i++) {
          bytes[i] = (byte) Integer.parseInt(line.substring(i * 2, i * 2 + 2), 16);
        }
        out.add(new String(bytes, StandardCharsets.UTF_8));
      }
    }
    return out;
  }
}

package com.consullo.supervisor.host;

import com.consullo.supervisor.backend.BackendDetector;
import com.consullo.supervisor.backend.SystemPlatformProbe;
import com.consullo.supervisor.config.SupervisorConfig;
import com.consullo.supervisor.config.SupervisorConfigLoader;
import com.consullo.supervisor.loop.SingleThreadEventLoop;
import com.consullo.supervisor.protocol.HostResponse;
import com.consullo.supervisor.protocol.JsonLineCodec;
import com.consullo.supervisor.pty.TerminalStrategy;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the isolated terminal host process.
 *
 * <p>
 * Requests arrive on stdin and replies leave on stdout, one JSON message per line.
 * Logging goes to stderr. When stdin closes (the supervisor went away) or the process
 * receives SIGTERM, every terminal is killed and the process exits with status 0.
 * </p>
 *
 * @since 1.0
 */
public final class TerminalHostMain {

  private static final Logger LOGGER = LoggerFactory.getLogger(TerminalHostMain.class);

  private static final long CLEANUP_TIMEOUT_SECONDS = 5L;

  private TerminalHostMain() {
  }

  public static void main(final String[] args) throws Exception {
    final SupervisorConfig config = SupervisorConfigLoader.loadDefault();
    final JsonLineCodec codec = new JsonLineCodec();
    final SingleThreadEventLoop loop = new SingleThreadEventLoop("terminal-host");
    final Writer stdout = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    final TerminalStrategy strategy = new TerminalStrategy(new BackendDetector(new SystemPlatformProbe()));
    final TerminalHost host = new TerminalHost(strategy, response -> writeLine(stdout, codec, response), loop,
        config.host());

    final AtomicBoolean cleanedUp = new AtomicBoolean();
    final Thread hook = new Thread(() -> {
      if (!cleanedUp.get()) {
        LOGGER.info("Received termination signal, cleaning up");
      }
      cleanup(host, cleanedUp);
      Runtime.getRuntime().halt(0);
    }, "terminal-host-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    LOGGER.info("Terminal host started (pid {})", ProcessHandle.current().pid());
    try (BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
      String line;
      while ((line = stdin.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        try {
          host.handle(codec.decodeRequest(line));
        } catch (final IOException | IllegalArgumentException e) {
          LOGGER.error("Ignoring malformed request: {}", e.getMessage());
        }
      }
    } catch (final IOException e) {
      LOGGER.error("Reading requests failed", e);
    }

    LOGGER.info("Disconnected from supervisor, cleaning up");
    cleanup(host, cleanedUp);
    System.exit(0);
  }

  private static void cleanup(final TerminalHost host, final AtomicBoolean cleanedUp) {
    if (!cleanedUp.compareAndSet(false, true)) {
      return;
    }
    try {
      host.shutdown().get(CLEANUP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    } catch (final ExecutionException | TimeoutException e) {
      LOGGER.error("Cleanup did not complete", e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void writeLine(final Writer out, final JsonLineCodec codec, final HostResponse response)
      throws IOException {
    final String line = codec.encode(response);
    synchronized (out) {
      out.write(line);
      out.write('\n');
      out.flush();
    }
  }
}

package com.consullo.supervisor.manager;

import com.consullo.supervisor.host.TerminalHostMain;
import com.consullo.supervisor.protocol.HostRequest;
import com.consullo.supervisor.protocol.HostResponse;
import com.consullo.supervisor.protocol.JsonLineCodec;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forks the terminal host as a separate JVM.
 *
 * <p>
 * The child runs {@link TerminalHostMain} on this JVM's class path. Requests go to its
 * stdin and replies are read from its stdout, one JSON message per line. Its stderr
 * (logging) is inherited.
 * </p>
 *
 * @since 1.0
 */
public final class ChildProcessHostLauncher implements HostLauncher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChildProcessHostLauncher.class);

  private final JsonLineCodec codec;
  private final List<String> jvmArgs;

  public ChildProcessHostLauncher(final JsonLineCodec codec, final List<String> jvmArgs) {
    Validate.notNull(codec, "codec must not be null");
    this.codec = codec;
    this.jvmArgs = jvmArgs == null ? List.of() : List.copyOf(jvmArgs);
  }

  /**
   * @return command line used to start the host
   */
  List<String> command() {
    final List<String> command = new ArrayList<>();
    command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
    command.addAll(this.jvmArgs);
    command.add("-cp");
    command.add(System.getProperty("java.class.path"));
    command.add(TerminalHostMain.class.getName());
    return command;
  }

  @Override
  public HostLink launch(final HostLinkListener listener) throws Exception {
    Validate.notNull(listener, "listener must not be null");
    final ProcessBuilder builder = new ProcessBuilder(command());
    builder.redirectError(ProcessBuilder.Redirect.INHERIT);
    builder.environment().put("TERMINAL_HOST", "1");
    final Process process = builder.start();
    LOGGER.info("Started terminal host process {}", process.pid());

    final ChildProcessHostLink link = new ChildProcessHostLink(process, this.codec);
    startReader(process, listener);
    process.onExit().thenAccept(p -> listener.onExit(p.exitValue(), null));
    return link;
  }

  private void startReader(final Process process, final HostLinkListener listener) {
    final Thread reader = new Thread(() -> {
      try (BufferedReader in = new BufferedReader(
          new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
        String line;
        while ((line = in.readLine()) != null) {
          if (line.isBlank()) {
            continue;
          }
          final HostResponse response;
          try {
            response = this.codec.decodeResponse(line);
          } catch (final IOException | IllegalArgumentException e) {
            listener.onError(new IOException("Malformed message from terminal host: " + e.getMessage(), e));
            continue;
          }
          listener.onMessage(response);
        }
      } catch (final IOException e) {
        listener.onError(e);
      }
      listener.onDisconnect();
    }, "terminal-host-reader-" + process.pid());
    reader.setDaemon(true);
    reader.start();
  }

  private static final class ChildProcessHostLink implements HostLink {

    private final Process process;
    private final JsonLineCodec codec;
    private final Writer writer;

    private ChildProcessHostLink(final Process process, final JsonLineCodec codec) {
      this.process = process;
      this.codec = codec;
      this.writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    @Override
    public void send(final HostRequest request) throws IOException {
      final String line = this.codec.encode(request);
      synchronized (this.writer) {
        this.writer.write(line);
        this.writer.write('\n');
        this.writer.flush();
      }
    }

    @Override
    public long pid() {
      return this.process.pid();
    }

    @Override
    public void terminate() {
      // Closing stdin lets the host clean up; destroy() sends SIGTERM as well.
      try {
        synchronized (this.writer) {
          this.writer.close();
        }
      } catch (final IOException e) {
        LOGGER.debug("Closing host stdin failed: {}", e.getMessage());
      }
      this.process.destroy();
    }
  }
}

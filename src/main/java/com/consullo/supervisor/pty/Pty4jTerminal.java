package com.consullo.supervisor.pty;

import com.consullo.supervisor.backend.TerminalBackend;
import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Terminal implemented with pty4j.
 *
 * <p>
 * Serves the native PTY backend on Unix and both Windows console backends: ConPTY when
 * requested, WinPTY otherwise.
 * </p>
 *
 * @since 1.0
 */
public final class Pty4jTerminal extends AbstractStreamTerminal {

  private static final Logger LOGGER = LoggerFactory.getLogger(Pty4jTerminal.class);

  private final TerminalBackend backend;

  public Pty4jTerminal(final String id, final TerminalOptions options, final TerminalBackend backend) {
    super(id, options, OutputBufferConfig.forBackend(backend));
    Validate.isTrue(backend != TerminalBackend.SUBPROCESS, "pty4j cannot serve the subprocess backend");
    this.backend = backend;
  }

  @Override
  protected Process startProcess() throws Exception {
    final TerminalOptions options = options();
    final Map<String, String> env = new HashMap<>(System.getenv());
    env.putIfAbsent("TERM", "xterm-256color");
    if (options.env() != null) {
      env.putAll(options.env());
    }

    final PtyProcessBuilder builder = new PtyProcessBuilder(new String[] {options.shell()});
    builder.setDirectory(options.cwd());
    builder.setEnvironment(env);
    builder.setInitialColumns(options.cols());
    builder.setInitialRows(options.rows());
    builder.setConsole(false);
    builder.setUseWinConPty(this.backend == TerminalBackend.CONPTY);
    return builder.start();
  }

  @Override
  public void resize(final int cols, final int rows) throws Exception {
    Validate.isTrue(cols > 0, "cols must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");
    final PtyProcess pty = (PtyProcess) process();
    Validate.validState(pty != null, "terminal %s has no process", id());
    try {
      pty.setWinSize(new WinSize(cols, rows));
    } catch (final RuntimeException e) {
      LOGGER.warn("PTY resize failed for terminal {}: {}", id(), e.getMessage(), e);
      throw e;
    }
  }
}

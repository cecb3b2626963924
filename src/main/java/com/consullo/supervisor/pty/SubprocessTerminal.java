package com.consullo.supervisor.pty;

import com.consullo.supervisor.backend.TerminalBackend;
import java.io.File;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Terminal over plain pipes. Always available; cannot resize.
 */
public final class SubprocessTerminal extends AbstractStreamTerminal {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubprocessTerminal.class);

  public SubprocessTerminal(final String id, final TerminalOptions options) {
    super(id, options, OutputBufferConfig.forBackend(TerminalBackend.SUBPROCESS));
  }

  @Override
  protected Process startProcess() throws Exception {
    final TerminalOptions options = options();
    final ProcessBuilder builder = new ProcessBuilder(options.shell());
    builder.directory(new File(options.cwd()));
    builder.redirectErrorStream(true);
    final Map<String, String> env = builder.environment();
    env.put("TERM", "xterm-256color");
    env.put("COLORTERM", "truecolor");
    env.put("COLUMNS", String.valueOf(options.cols()));
    env.put("LINES", String.valueOf(options.rows()));
    if (options.env() != null) {
      env.putAll(options.env());
    }
    return builder.start();
  }

  @Override
  public void resize(final int cols, final int rows) {
    LOGGER.debug("Terminal {} does not support resize, ignoring {}x{}", id(), cols, rows);
  }
}

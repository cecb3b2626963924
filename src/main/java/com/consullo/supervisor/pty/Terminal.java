package com.consullo.supervisor.pty;

import com.consullo.supervisor.monitor.MonitoredTerminal;

/**
 * A running shell, independent of the backend that hosts it.
 *
 * <p>
 * Listeners must be attached before {@link #spawn()}; output is only delivered after it.
 * </p>
 *
 * @since 1.0
 */
public interface Terminal extends MonitoredTerminal {

  String id();

  /**
   * Starts output delivery and exit monitoring.
   *
   * @throws Exception if the terminal cannot start
   */
  void spawn() throws Exception;

  void write(String data) throws Exception;

  void resize(int cols, int rows) throws Exception;

  void kill() throws Exception;

  void addListener(TerminalListener listener);
}

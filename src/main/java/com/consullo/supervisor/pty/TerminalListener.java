package com.consullo.supervisor.pty;

/**
 * Receives terminal output and lifecycle events. Callbacks arrive on terminal I/O threads.
 */
public interface TerminalListener {

  void onData(String data);

  /**
   * @param exitCode process exit code
   * @param signal terminating signal name, or null
   */
  void onExit(int exitCode, String signal);

  void onError(Exception error);
}

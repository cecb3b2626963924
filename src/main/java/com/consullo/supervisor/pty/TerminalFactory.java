package com.consullo.supervisor.pty;

/**
 * Creates terminals on the best available backend.
 *
 * @since 1.0
 */
public interface TerminalFactory {

  /**
   * Creates a terminal. The process is started; output delivery begins on
   * {@link Terminal#spawn()}.
   *
   * @param id terminal id
   * @param options options, unset fields resolved to defaults
   * @return created terminal and backend information
   * @throws Exception if no backend could start the shell
   */
  TerminalCreateResult createTerminal(String id, TerminalOptions options) throws Exception;
}

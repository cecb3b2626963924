package com.consullo.supervisor.manager;

/**
 * Events from the {@link SessionManager}. Called on the manager's event loop.
 */
public interface SessionManagerListener {

  /** A host was launched and is accepting requests. */
  default void onReady() {
  }

  default void onTerminalData(final String terminalId, final String data) {
  }

  default void onTerminalExit(final String terminalId, final int exitCode, final String signal) {
  }

  default void onTerminalKilled(final String terminalId) {
  }

  /**
   * A failure not tied to a pending request.
   *
   * @param error failure
   */
  default void onError(final Throwable error) {
  }
}

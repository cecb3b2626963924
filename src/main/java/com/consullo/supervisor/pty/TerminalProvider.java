package com.consullo.supervisor.pty;

/**
 * Starts a terminal on one specific backend.
 */
@FunctionalInterface
public interface TerminalProvider {

  Terminal open(String id, TerminalOptions resolvedOptions) throws Exception;
}

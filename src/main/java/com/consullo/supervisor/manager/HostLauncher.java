package com.consullo.supervisor.manager;

/**
 * Starts terminal hosts.
 */
@FunctionalInterface
public interface HostLauncher {

  /**
   * @param listener receives the host's messages and lifecycle events
   * @return link to the started host
   * @throws Exception if the host cannot be started
   */
  HostLink launch(HostLinkListener listener) throws Exception;
}

package com.consullo.supervisor.manager;

import com.consullo.supervisor.protocol.HostResponse;

/**
 * Events from a {@link HostLink}. May be called on any thread.
 */
public interface HostLinkListener {

  void onMessage(HostResponse response);

  void onError(Exception error);

  /** The message channel closed. */
  void onDisconnect();

  /**
   * @param exitCode host exit status
   * @param signal terminating signal, or null
   */
  void onExit(int exitCode, String signal);
}

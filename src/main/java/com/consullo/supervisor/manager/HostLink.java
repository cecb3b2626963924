package com.consullo.supervisor.manager;

import com.consullo.supervisor.protocol.HostRequest;
import java.io.IOException;

/**
 * Connection to one running terminal host.
 *
 * @since 1.0
 */
public interface HostLink {

  /**
   * @param request request to deliver
   * @throws IOException if the host cannot be reached
   */
  void send(HostRequest request) throws IOException;

  /**
   * @return host process id
   */
  long pid();

  /**
   * Asks the host to clean up and exit.
   */
  void terminate();
}

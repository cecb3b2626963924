package com.consullo.supervisor.remote;

import java.io.IOException;

/**
 * A client connection as seen by {@link RemoteTerminalService}.
 */
public interface RemoteConnection {

  /**
   * @param text one serialized envelope
   * @throws IOException if the connection fails while sending
   */
  void send(String text) throws IOException;

  boolean isOpen();
}

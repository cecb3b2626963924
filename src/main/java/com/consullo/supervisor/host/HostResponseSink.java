package com.consullo.supervisor.host;

import com.consullo.supervisor.protocol.HostResponse;

/**
 * Where the terminal host writes its replies and events.
 */
@FunctionalInterface
public interface HostResponseSink {

  void send(HostResponse response) throws Exception;
}

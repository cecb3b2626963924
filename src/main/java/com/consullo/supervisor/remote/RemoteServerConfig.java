package com.consullo.supervisor.remote;

import org.apache.commons.lang3.Validate;

/**
 * Remote terminal server settings.
 *
 * @param enabled whether the application starts the server
 * @param host bind address
 * @param port bind port, 0 for an ephemeral port
 */
public record RemoteServerConfig(boolean enabled, String host, int port) {

  public static final RemoteServerConfig DEFAULTS = new RemoteServerConfig(false, "127.0.0.1", 3001);

  public RemoteServerConfig {
    Validate.notBlank(host, "host must not be blank");
    Validate.inclusiveBetween(0, 65535, port, "port must be between 0 and 65535");
  }

  public RemoteServerConfig withPort(final int newPort) {
    return new RemoteServerConfig(this.enabled, this.host, newPort);
  }
}

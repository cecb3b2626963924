package com.consullo.supervisor.config;

import com.consullo.supervisor.bridge.BridgeConfig;
import com.consullo.supervisor.host.HostConfig;
import com.consullo.supervisor.manager.ManagerConfig;
import com.consullo.supervisor.monitor.MonitorConfig;
import com.consullo.supervisor.remote.RemoteServerConfig;
import org.apache.commons.lang3.Validate;

/**
 * Complete supervisor configuration.
 *
 * @param host terminal host settings
 * @param manager session manager settings
 * @param monitor performance monitor settings
 * @param bridge channel bridge settings
 * @param remote remote terminal server settings
 * @since 1.0
 */
public record SupervisorConfig(
    HostConfig host,
    ManagerConfig manager,
    MonitorConfig monitor,
    BridgeConfig bridge,
    RemoteServerConfig remote) {

  public static final SupervisorConfig DEFAULTS = new SupervisorConfig(HostConfig.DEFAULTS, ManagerConfig.DEFAULTS,
      MonitorConfig.DEFAULTS, BridgeConfig.DEFAULTS, RemoteServerConfig.DEFAULTS);

  public SupervisorConfig {
    Validate.notNull(host, "host must not be null");
    Validate.notNull(manager, "manager must not be null");
    Validate.notNull(monitor, "monitor must not be null");
    Validate.notNull(bridge, "bridge must not be null");
    Validate.notNull(remote, "remote must not be null");
  }
}

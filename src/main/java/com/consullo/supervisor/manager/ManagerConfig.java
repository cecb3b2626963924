package com.consullo.supervisor.manager;

import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Session manager settings.
 *
 * @param restartDelayMillis delay before relaunching a host that exited abnormally
 * @param hostMode where the host runs
 * @param hostJvmArgs extra JVM arguments for a child-process host
 */
public record ManagerConfig(long restartDelayMillis, HostMode hostMode, List<String> hostJvmArgs) {

  public static final ManagerConfig DEFAULTS = new ManagerConfig(1000L, HostMode.CHILD_PROCESS, List.of());

  public ManagerConfig {
    Validate.isTrue(restartDelayMillis >= 0, "restartDelayMillis must not be negative");
    Validate.notNull(hostMode, "hostMode must not be null");
    hostJvmArgs = hostJvmArgs == null ? List.of() : List.copyOf(hostJvmArgs);
  }
}

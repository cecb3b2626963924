package com.consullo.supervisor.backend;

/**
 * Environment facts consulted by {@link BackendDetector}.
 *
 * <p>
 * Implementations may throw; the detector treats a failing probe as "not available".
 * </p>
 *
 * @since 1.0
 */
public interface PlatformProbe {

  boolean isWindows();

  /**
   * @return OS release string, e.g. {@code 10.0.19045} on Windows
   */
  String osRelease();

  /**
   * @return true if a native pseudo-terminal can be opened in this process
   */
  boolean nativePtyUsable();

  /**
   * @param command bare command name
   * @return true if the command resolves on the search path
   */
  boolean commandResolvable(String command);
}

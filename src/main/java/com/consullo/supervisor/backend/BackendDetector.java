package com.consullo.supervisor.backend;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the best available terminal backend for this machine.
 *
 * <p>
 * Priority: native PTY, then ConPTY (Windows build 17763 or later), then WinPTY (when
 * its helper resolves on the path), then subprocess. Detection never fails: any probe
 * error falls through to the subprocess backend.
 * </p>
 *
 * @since 1.0
 */
public final class BackendDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(BackendDetector.class);

  /** First Windows 10 build that ships the pseudo console API. */
  static final int CONPTY_MIN_BUILD = 17763;

  static final String WINPTY_COMMAND = "winpty";

  private final PlatformProbe probe;

  public BackendDetector(final PlatformProbe probe) {
    Validate.notNull(probe, "probe must not be null");
    this.probe = probe;
  }

  /**
   * Detects the best backend.
   *
   * @return capabilities of the chosen backend, never null
   */
  public TerminalCapabilities detectBestBackend() {
    try {
      if (nativePtyAvailable()) {
        LOGGER.info("Using native PTY backend");
        return TerminalCapabilities.of(TerminalBackend.NATIVE_PTY);
      }
      if (this.probe.isWindows()) {
        if (conPtyAvailable()) {
          LOGGER.info("Using ConPTY backend");
          return TerminalCapabilities.of(TerminalBackend.CONPTY);
        }
        if (winPtyAvailable()) {
          LOGGER.info("Using WinPTY backend");
          return TerminalCapabilities.of(TerminalBackend.WINPTY);
        }
      }
    } catch (final RuntimeException e) {
      LOGGER.error("Backend detection failed, falling back to subprocess", e);
    }
    LOGGER.info("Using subprocess backend");
    return TerminalCapabilities.of(TerminalBackend.SUBPROCESS);
  }

  private boolean nativePtyAvailable() {
    try {
      return this.probe.nativePtyUsable();
    } catch (final RuntimeException e) {
      LOGGER.debug("Native PTY not available: {}", e.getMessage());
      return false;
    }
  }

  private boolean conPtyAvailable() {
    try {
      return supportsConPty(this.probe.osRelease());
    } catch (final RuntimeException e) {
      LOGGER.debug("ConPTY check failed: {}", e.getMessage());
      return false;
    }
  }

  private boolean winPtyAvailable() {
    try {
      return this.probe.commandResolvable(WINPTY_COMMAND);
    } catch (final RuntimeException e) {
      LOGGER.debug("WinPTY check failed: {}", e.getMessage());
      return false;
    }
  }

  /**
   * Checks a {@code major.minor.build} release string against the ConPTY minimum.
   *
   * @param release OS release, may be null
   * @return true for Windows 10 build 17763 or later, false when unparsable
   */
  static boolean supportsConPty(final String release) {
    if (release == null) {
      return false;
    }
    final String[] parts = release.trim().split("\\.");
    if (parts.length < 3) {
      return false;
    }
    try {
      final int major = Integer.parseInt(parts[0]);
      final int build = Integer.parseInt(parts[2]);
      return major > 10 || (major == 10 && build >= CONPTY_MIN_BUILD);
    } catch (final NumberFormatException e) {
      return false;
    }
  }

  /**
   * Human-readable description, e.g.
   * {@code winpty (medium reliability, resize, colors, interactive)}.
   *
   * <p>
   * With no features the list renders empty after a trailing comma.
   * </p>
   *
   * @param capabilities capabilities to describe
   * @return description
   */
  public static String describe(final TerminalCapabilities capabilities) {
    final List<String> features = new ArrayList<>(4);
    if (capabilities.supportsResize()) {
      features.add("resize");
    }
    if (capabilities.supportsColors()) {
      features.add("colors");
    }
    if (capabilities.supportsInteractivity()) {
      features.add("interactive");
    }
    if (capabilities.supportsHistory()) {
      features.add("history");
    }
    return capabilities.backend().wireName() + " (" + capabilities.reliability().wireName() + " reliability, "
        + String.join(", ", features) + ")";
  }
}

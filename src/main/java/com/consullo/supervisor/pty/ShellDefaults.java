package com.consullo.supervisor.pty;

import java.util.Locale;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolves missing {@link TerminalOptions} fields from the environment.
 *
 * <p>
 * Shell: {@code COMSPEC} on Windows (PowerShell when it names it, {@code cmd.exe} when
 * unset), {@code SHELL} elsewhere with {@code /bin/zsh} on macOS and {@code /bin/bash} as
 * the fallback. Working directory: {@code HOME}, then the JVM working directory.
 * </p>
 */
public final class ShellDefaults {

  public static final int DEFAULT_COLS = 80;
  public static final int DEFAULT_ROWS = 24;

  private final Map<String, String> environment;
  private final String osName;
  private final String userDir;

  public ShellDefaults(final Map<String, String> environment, final String osName, final String userDir) {
    this.environment = environment == null ? Map.of() : environment;
    this.osName = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
    this.userDir = userDir;
  }

  /**
   * @return defaults for the running JVM
   */
  public static ShellDefaults system() {
    return new ShellDefaults(System.getenv(), System.getProperty("os.name"), System.getProperty("user.dir"));
  }

  public String defaultShell() {
    if (this.osName.startsWith("windows")) {
      final String comspec = this.environment.get("COMSPEC");
      if (comspec != null && comspec.toLowerCase(Locale.ROOT).contains("powershell")) {
        return "powershell.exe";
      }
      return StringUtils.defaultIfBlank(comspec, "cmd.exe");
    }
    final String fallback = this.osName.startsWith("mac") ? "/bin/zsh" : "/bin/bash";
    return StringUtils.defaultIfBlank(this.environment.get("SHELL"), fallback);
  }

  public String defaultCwd() {
    return StringUtils.defaultIfBlank(this.environment.get("HOME"), this.userDir);
  }

  /**
   * Fills every unset field.
   *
   * @param options caller options, may be null
   * @return fully populated options
   */
  public TerminalOptions resolve(final TerminalOptions options) {
    final TerminalOptions in = options == null ? TerminalOptions.DEFAULTS : options;
    return new TerminalOptions(
        StringUtils.defaultIfBlank(in.shell(), defaultShell()),
        StringUtils.defaultIfBlank(in.cwd(), defaultCwd()),
        in.env() == null ? Map.of() : in.env(),
        in.cols() == null || in.cols() <= 0 ? DEFAULT_COLS : in.cols(),
        in.rows() == null || in.rows() <= 0 ? DEFAULT_ROWS : in.rows());
  }
}

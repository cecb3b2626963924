package com.consullo.supervisor.pty;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * Options for creating a terminal. Unset fields are resolved by {@link ShellDefaults}.
 *
 * @param shell shell executable (may be null)
 * @param cwd working directory (may be null)
 * @param env environment variables to add or override (may be null)
 * @param cols initial columns (may be null)
 * @param rows initial rows (may be null)
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TerminalOptions(
    String shell,
    String cwd,
    Map<String, String> env,
    Integer cols,
    Integer rows) {

  /** Options with every field left to the defaults. */
  public static final TerminalOptions DEFAULTS = new TerminalOptions(null, null, null, null, null);

  public TerminalOptions withSize(final int newCols, final int newRows) {
    return new TerminalOptions(this.shell, this.cwd, this.env, newCols, newRows);
  }
}

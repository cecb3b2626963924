package com.consullo.supervisor.manager;

/**
 * Failure reported by the terminal host for a request.
 */
public class TerminalHostException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String terminalId;

  public TerminalHostException(final String terminalId, final String message) {
    super(message);
    this.terminalId = terminalId;
  }

  public String terminalId() {
    return this.terminalId;
  }
}

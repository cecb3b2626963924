package com.consullo.supervisor.monitor;

/**
 * Threshold violation found while sampling a terminal.
 */
public record Alert(
    String terminalId,
    AlertType type,
    AlertSeverity severity,
    String message,
    String recommendation,
    long timestamp) {
}

package com.consullo.supervisor.manager;

import com.consullo.supervisor.backend.TerminalCapabilities;

/**
 * Supervisor-side description of a live terminal.
 *
 * @param id terminal id
 * @param pid shell process id inside the host
 * @param shell shell executable
 * @param cwd working directory
 * @param strategy strategy tag
 * @param backend backend wire name, may be null
 * @param capabilities backend capabilities, may be null
 * @param fallbackReason why a degraded backend is used, or null
 */
public record TerminalSession(
    String id,
    long pid,
    String shell,
    String cwd,
    String strategy,
    String backend,
    TerminalCapabilities capabilities,
    String fallbackReason) {
}

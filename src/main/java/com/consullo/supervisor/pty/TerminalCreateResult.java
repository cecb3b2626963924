package com.consullo.supervisor.pty;

import com.consullo.supervisor.backend.TerminalBackend;
import com.consullo.supervisor.backend.TerminalCapabilities;

/**
 * Outcome of {@link TerminalFactory#createTerminal}.
 *
 * @param terminal created, not yet spawned terminal
 * @param options options after defaults were applied
 * @param backend backend actually used
 * @param capabilities capabilities of that backend
 * @param fallbackReason why a non-preferred or degraded backend is in use, or null
 */
public record TerminalCreateResult(
    Terminal terminal,
    TerminalOptions options,
    TerminalBackend backend,
    TerminalCapabilities capabilities,
    String fallbackReason) {
}

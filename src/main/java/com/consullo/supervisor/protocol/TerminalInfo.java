package com.consullo.supervisor.protocol;

import com.consullo.supervisor.backend.TerminalCapabilities;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One entry of a host {@code list} reply.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TerminalInfo(
    String id,
    String shell,
    String cwd,
    long pid,
    String strategy,
    String backend,
    TerminalCapabilities capabilities) {
}

package com.consullo.supervisor.remote;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Text message exchanged with remote clients.
 *
 * @param type message kind
 * @param terminalId addressed terminal, if any
 * @param data kind-specific payload
 * @param timestamp epoch milliseconds
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RemoteEnvelope(String type, String terminalId, Object data, long timestamp) {
}

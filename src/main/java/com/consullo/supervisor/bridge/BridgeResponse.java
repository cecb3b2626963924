package com.consullo.supervisor.bridge;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Response travelling over a bridge channel back to the consumer.
 *
 * @param success whether the operation succeeded
 * @param data result payload, may be null
 * @param error failure message when not successful
 * @param timestamp time the response was produced, epoch milliseconds
 * @param requestId id of the request answered, null for unsolicited output
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BridgeResponse(
    boolean success,
    Payload data,
    String error,
    Long timestamp,
    String requestId) {

  public static BridgeResponse ok(final Payload data, final long timestamp, final String requestId) {
    return new BridgeResponse(true, data, null, timestamp, requestId);
  }

  public static BridgeResponse failed(final String error, final long timestamp, final String requestId) {
    return new BridgeResponse(false, null, error, timestamp, requestId);
  }

  public static BridgeResponse output(final String output, final long timestamp) {
    return new BridgeResponse(true, new Payload(null, null, null, output, null), null, timestamp, null);
  }

  /**
   * @param id created terminal id
   * @param name terminal display name
   * @param pid shell process id
   * @param output terminal output
   * @param terminals listed terminals
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Payload(String id, String name, Long pid, String output, List<TerminalEntry> terminals) {
  }

  public record TerminalEntry(String id, String name, long pid, boolean isActive) {
  }
}

package com.consullo.supervisor.bridge;

import com.consullo.supervisor.pty.TerminalOptions;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Request travelling over a bridge channel towards the terminal side.
 *
 * @param type operation
 * @param terminalId channel or terminal id
 * @param data operation payload, may be null
 * @param timestamp send time in epoch milliseconds
 * @param requestId correlation id echoed in the response
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BridgeRequest(
    Type type,
    String terminalId,
    Payload data,
    Long timestamp,
    String requestId) {

  public enum Type {
    CREATE,
    WRITE,
    RESIZE,
    KILL,
    LIST,
    DATA;

    @JsonValue
    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Type fromWireName(final String value) {
      return valueOf(value.toUpperCase(Locale.ROOT));
    }
  }

  /**
   * @param text input for write
   * @param cols columns for resize
   * @param rows rows for resize
   * @param options creation options
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Payload(String text, Integer cols, Integer rows, TerminalOptions options) {

    public static Payload text(final String text) {
      return new Payload(text, null, null, null);
    }

    public static Payload size(final int cols, final int rows) {
      return new Payload(null, cols, rows, null);
    }

    public static Payload options(final TerminalOptions options) {
      return new Payload(null, null, null, options);
    }
  }
}

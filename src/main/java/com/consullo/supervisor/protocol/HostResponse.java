package com.consullo.supervisor.protocol;

import com.consullo.supervisor.backend.TerminalCapabilities;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

/**
 * Message from the terminal host to the session manager.
 *
 * <p>
 * Only the fields relevant to the {@link Type} are set; the rest stay null and are
 * omitted on the wire.
 * </p>
 *
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HostResponse(
    Type type,
    String id,
    String requestId,
    String data,
    String error,
    List<TerminalInfo> terminals,
    Integer exitCode,
    String signal,
    String shell,
    String cwd,
    Long pid,
    String strategy,
    String backend,
    TerminalCapabilities capabilities,
    String fallbackReason) {

  /**
   * Response kinds.
   */
  public enum Type {
    CREATED,
    DATA,
    EXIT,
    ERROR,
    KILLED,
    LIST;

    @JsonValue
    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Type fromWireName(final String value) {
      return valueOf(value.toUpperCase(Locale.ROOT));
    }
  }

  public static HostResponse created(final TerminalInfo info, final String fallbackReason) {
    return new HostResponse(Type.CREATED, info.id(), null, null, null, null, null, null, info.shell(), info.cwd(),
        info.pid(), info.strategy(), info.backend(), info.capabilities(), fallbackReason);
  }

  public static HostResponse data(final String id, final String data) {
    return new HostResponse(Type.DATA, id, null, data, null, null, null, null, null, null, null, null, null, null,
        null);
  }

  public static HostResponse exit(final String id, final int exitCode, final String signal) {
    return new HostResponse(Type.EXIT, id, null, null, null, null, exitCode, signal, null, null, null, null, null,
        null, null);
  }

  public static HostResponse error(final String id, final String error) {
    return new HostResponse(Type.ERROR, id, null, null, error, null, null, null, null, null, null, null, null, null,
        null);
  }

  public static HostResponse killed(final String id) {
    return new HostResponse(Type.KILLED, id, null, null, null, null, null, null, null, null, null, null, null, null,
        null);
  }

  public static HostResponse list(final String requestId, final List<TerminalInfo> terminals) {
    return new HostResponse(Type.LIST, null, requestId, null, null, List.copyOf(terminals), null, null, null, null,
        null, null, null, null, null);
  }
}

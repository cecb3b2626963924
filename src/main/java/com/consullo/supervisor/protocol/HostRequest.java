package com.consullo.supervisor.protocol;

import com.consullo.supervisor.pty.TerminalOptions;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import org.apache.commons.lang3.Validate;

/**
 * Message from the session manager to the terminal host.
 *
 * <p>
 * For {@link Type#LIST} the {@code id} carries the request id echoed in the reply.
 * </p>
 *
 * @param type request kind
 * @param id terminal id, or request id for list
 * @param options creation options (create only)
 * @param data input text (write only)
 * @param cols columns (resize only)
 * @param rows rows (resize only)
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HostRequest(
    Type type,
    String id,
    TerminalOptions options,
    String data,
    Integer cols,
    Integer rows) {

  /**
   * Request kinds.
   */
  public enum Type {
    CREATE,
    WRITE,
    RESIZE,
    KILL,
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

  public static HostRequest create(final String id, final TerminalOptions options) {
    Validate.notBlank(id, "id must not be blank");
    return new HostRequest(Type.CREATE, id, options == null ? TerminalOptions.DEFAULTS : options, null, null, null);
  }

  public static HostRequest write(final String id, final String data) {
    Validate.notBlank(id, "id must not be blank");
    Validate.notNull(data, "data must not be null");
    return new HostRequest(Type.WRITE, id, null, data, null, null);
  }

  public static HostRequest resize(final String id, final int cols, final int rows) {
    Validate.notBlank(id, "id must not be blank");
    return new HostRequest(Type.RESIZE, id, null, null, cols, rows);
  }

  public static HostRequest kill(final String id) {
    Validate.notBlank(id, "id must not be blank");
    return new HostRequest(Type.KILL, id, null, null, null, null);
  }

  public static HostRequest list(final String requestId) {
    Validate.notBlank(requestId, "requestId must not be blank");
    return new HostRequest(Type.LIST, requestId, null, null, null, null);
  }
}

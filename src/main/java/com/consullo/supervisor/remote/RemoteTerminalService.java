package com.consullo.supervisor.remote;

import com.consullo.supervisor.pty.Terminal;
import com.consullo.supervisor.pty.TerminalCreateResult;
import com.consullo.supervisor.pty.TerminalFactory;
import com.consullo.supervisor.pty.TerminalListener;
import com.consullo.supervisor.pty.TerminalOptions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Protocol logic of the remote terminal server, independent of the transport.
 *
 * <p>
 * Each connection gets a {@code session-*} id and may create any number of
 * {@code terminal-*} terminals. A connection can only operate on terminals it created;
 * closing it kills them. Malformed messages are answered with an {@code error}
 * envelope and never close the connection.
 * </p>
 *
 * @since 1.0
 */
public final class RemoteTerminalService {

  private static final Logger LOGGER = LoggerFactory.getLogger(RemoteTerminalService.class);
  private static final String ID_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";
  private static final TypeReference<Map<String, String>> ENV_TYPE = new TypeReference<>() {
  };

  private final TerminalFactory factory;
  private final ObjectMapper mapper;
  private final Map<String, RemoteSession> sessions = new ConcurrentHashMap<>();
  // Ids being created; held until the session is in the map.
  private final Set<String> reservedIds = ConcurrentHashMap.newKeySet();

  public RemoteTerminalService(final TerminalFactory factory, final ObjectMapper mapper) {
    Validate.notNull(factory, "factory must not be null");
    Validate.notNull(mapper, "mapper must not be null");
    this.factory = factory;
    this.mapper = mapper;
  }

  /**
   * Registers a connection and sends it the welcome message.
   *
   * @param connection new connection
   * @return connection session id
   */
  public String onConnect(final RemoteConnection connection) {
    final String sessionId = generateId("session");
    LOGGER.info("Client connected: {}", sessionId);
    send(connection, new RemoteEnvelope("connected", null, Map.of("sessionId", sessionId), now()));
    return sessionId;
  }

  /**
   * Handles one text message from a connection.
   */
  public void onMessage(final String sessionId, final RemoteConnection connection, final String text) {
    try {
      final JsonNode message = this.mapper.readTree(text);
      if (message == null || !message.isObject()) {
        throw new IllegalArgumentException("Message must be a JSON object");
      }
      final String type = message.path("type").asText("");
      switch (type) {
        case "create":
          createTerminal(sessionId, connection, message);
          break;
        case "write":
          writeTerminal(sessionId, connection, message);
          break;
        case "resize":
          resizeTerminal(sessionId, message);
          break;
        case "kill":
          killTerminal(sessionId, message);
          break;
        case "list":
          send(connection, new RemoteEnvelope("list", null, Map.of("terminals", describe(sessionId)), now()));
          break;
        default:
          LOGGER.warn("Unknown message type '{}' from {}", type, sessionId);
          break;
      }
    } catch (final IOException | RuntimeException e) {
      LOGGER.error("Error processing message from {}", sessionId, e);
      send(connection, errorEnvelope(null, StringUtils.defaultIfBlank(e.getMessage(), "Unknown error")));
    }
  }

  /**
   * Kills every terminal created by the closed connection.
   *
   * @param sessionId connection session id
   */
  public void onClose(final String sessionId) {
    int killed = 0;
    for (final RemoteSession session : new ArrayList<>(this.sessions.values())) {
      if (session.owner.equals(sessionId) && this.sessions.remove(session.id, session)) {
        killQuietly(session);
        killed++;
      }
    }
    LOGGER.info("Client {} disconnected, killed {} terminal(s)", sessionId, killed);
  }

  public int sessionCount() {
    return this.sessions.size();
  }

  /**
   * @return every live terminal, for the {@code /terminals} endpoint
   */
  public List<Map<String, Object>> describeAll() {
    return describe(null);
  }

  /**
   * Kills every terminal.
   */
  public void shutdown() {
    for (final RemoteSession session : new ArrayList<>(this.sessions.values())) {
      if (this.sessions.remove(session.id, session)) {
        killQuietly(session);
      }
    }
  }

  private void createTerminal(final String sessionId, final RemoteConnection connection, final JsonNode message) {
    final String terminalId = StringUtils.defaultIfBlank(message.path("terminalId").asText(null),
        generateId("terminal"));
    if (!this.reservedIds.add(terminalId)) {
      send(connection, errorEnvelope(terminalId, "Terminal " + terminalId + " already exists"));
      return;
    }
    try {
      if (this.sessions.containsKey(terminalId)) {
        send(connection, errorEnvelope(terminalId, "Terminal " + terminalId + " already exists"));
        return;
      }
      startTerminal(sessionId, connection, message, terminalId);
    } finally {
      this.reservedIds.remove(terminalId);
    }
  }

  private void startTerminal(final String sessionId, final RemoteConnection connection, final JsonNode message,
      final String terminalId) {
    final JsonNode data = message.path("data");
    final TerminalOptions options = new TerminalOptions(
        data.path("shell").asText(null),
        data.path("cwd").asText(null),
        data.has("env") ? this.mapper.convertValue(data.get("env"), ENV_TYPE) : null,
        positiveOr(data.path("cols").asInt(0), 80),
        positiveOr(data.path("rows").asInt(0), 24));
    LOGGER.info("Creating terminal {} for {}", terminalId, sessionId);

    final TerminalCreateResult result;
    try {
      result = this.factory.createTerminal(terminalId, options);
    } catch (final Exception e) {
      LOGGER.error("Failed to create terminal {}", terminalId, e);
      send(connection, errorEnvelope(null, StringUtils.defaultIfBlank(e.getMessage(), "Failed to create terminal")));
      return;
    }
    final Terminal terminal = result.terminal();
    final RemoteSession session = new RemoteSession(terminalId, sessionId, terminal, result.backend().wireName());
    terminal.addListener(new TerminalListener() {
      @Override
      public void onData(final String output) {
        session.touch();
        send(connection, new RemoteEnvelope("data", terminalId, output, now()));
      }

      @Override
      public void onExit(final int exitCode, final String signal) {
        LOGGER.info("Terminal {} exited with code {}", terminalId, exitCode);
        final Map<String, Object> exit = new LinkedHashMap<>();
        exit.put("exitCode", exitCode);
        exit.put("signal", signal);
        send(connection, new RemoteEnvelope("exit", terminalId, exit, now()));
        RemoteTerminalService.this.sessions.remove(terminalId, session);
      }

      @Override
      public void onError(final Exception error) {
        LOGGER.error("Terminal {} error", terminalId, error);
        send(connection, errorEnvelope(terminalId, StringUtils.defaultIfBlank(error.getMessage(), "Unknown error")));
      }
    });
    try {
      terminal.spawn();
    } catch (final Exception e) {
      LOGGER.error("Failed to spawn terminal {}", terminalId, e);
      killQuietly(session);
      send(connection, errorEnvelope(null, StringUtils.defaultIfBlank(e.getMessage(), "Failed to create terminal")));
      return;
    }
    this.sessions.put(terminalId, session);

    final Map<String, Object> created = new LinkedHashMap<>();
    created.put("strategy", session.strategy);
    created.put("fallbackReason", result.fallbackReason());
    created.put("pid", terminal.pid());
    send(connection, new RemoteEnvelope("created", terminalId, created, now()));
  }

  private void writeTerminal(final String sessionId, final RemoteConnection connection, final JsonNode message) {
    final RemoteSession session = owned(sessionId, message, "write");
    if (session == null) {
      return;
    }
    final JsonNode data = message.path("data");
    try {
      session.terminal.write(data.isTextual() ? data.asText() : "");
    } catch (final Exception e) {
      LOGGER.error("Failed to write to terminal {}", session.id, e);
      send(connection, errorEnvelope(session.id, StringUtils.defaultIfBlank(e.getMessage(), "Unknown error")));
      return;
    }
    session.touch();
  }

  private void resizeTerminal(final String sessionId, final JsonNode message) {
    final RemoteSession session = owned(sessionId, message, "resize");
    if (session == null) {
      return;
    }
    final JsonNode data = message.path("data");
    try {
      session.terminal.resize(data.path("cols").asInt(), data.path("rows").asInt());
    } catch (final Exception e) {
      LOGGER.error("Failed to resize terminal {}", session.id, e);
    }
    session.touch();
  }

  private void killTerminal(final String sessionId, final JsonNode message) {
    final RemoteSession session = owned(sessionId, message, "kill");
    if (session == null) {
      return;
    }
    if (this.sessions.remove(session.id, session)) {
      killQuietly(session);
      LOGGER.info("Killed terminal {}", session.id);
    }
  }

  private RemoteSession owned(final String sessionId, final JsonNode message, final String operation) {
    final String terminalId = message.path("terminalId").asText(null);
    final RemoteSession session = terminalId == null ? null : this.sessions.get(terminalId);
    if (session == null) {
      LOGGER.warn("Terminal {} not found for {}", terminalId, operation);
      return null;
    }
    if (!session.owner.equals(sessionId)) {
      LOGGER.warn("Terminal {} is not owned by {}, ignoring {}", terminalId, sessionId, operation);
      return null;
    }
    return session;
  }

  private List<Map<String, Object>> describe(final String owner) {
    final List<Map<String, Object>> out = new ArrayList<>();
    for (final RemoteSession session : this.sessions.values()) {
      if (owner != null && !owner.equals(session.owner)) {
        continue;
      }
      final Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("id", session.id);
      entry.put("strategy", session.strategy);
      entry.put("pid", session.terminal.pid());
      entry.put("isRunning", session.terminal.isRunning());
      entry.put("createdAt", session.createdAt.toString());
      entry.put("lastActivity", session.lastActivity.toString());
      out.add(entry);
    }
    return out;
  }

  private void send(final RemoteConnection connection, final RemoteEnvelope envelope) {
    if (!connection.isOpen()) {
      LOGGER.debug("Dropping {} message, connection closed", envelope.type());
      return;
    }
    try {
      connection.send(this.mapper.writeValueAsString(envelope));
    } catch (final JsonProcessingException e) {
      LOGGER.error("Failed to serialize {} message", envelope.type(), e);
    } catch (final IOException e) {
      LOGGER.warn("Failed to send {} message: {}", envelope.type(), e.getMessage());
    }
  }

  private static RemoteEnvelope errorEnvelope(final String terminalId, final String error) {
    return new RemoteEnvelope("error", terminalId, Map.of("error", error), now());
  }

  private static void killQuietly(final RemoteSession session) {
    try {
      session.terminal.kill();
    } catch (final Exception e) {
      LOGGER.error("Failed to kill terminal {}", session.id, e);
    }
  }

  private static int positiveOr(final int value, final int fallback) {
    return value > 0 ? value : fallback;
  }

  private static long now() {
    return System.currentTimeMillis();
  }

  static String generateId(final String prefix) {
    return prefix + "-" + now() + "-" + RandomStringUtils.random(9, ID_CHARS);
  }

  private static final class RemoteSession {

    private final String id;
    private final String owner;
    private final Terminal terminal;
    private final String strategy;
    private final Instant createdAt = Instant.now();
    private volatile Instant lastActivity = this.createdAt;

    private RemoteSession(final String id, final String owner, final Terminal terminal, final String strategy) {
      this.id = id;
      this.owner = owner;
      this.terminal = terminal;
      this.strategy = strategy;
    }

    private void touch() {
      this.lastActivity = Instant.now();
    }
  }
}

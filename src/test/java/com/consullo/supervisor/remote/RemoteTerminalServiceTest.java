package com.consullo.supervisor.remote;

import com.consullo.supervisor.pty.FakeTerminal;
import com.consullo.supervisor.pty.FakeTerminalFactory;
import com.consullo.supervisor.pty.TerminalFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the remote protocol, independent of Jetty.
 */
public class RemoteTerminalServiceTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final FakeTerminalFactory factory = new FakeTerminalFactory(12345L);
  private final RemoteTerminalService service = new RemoteTerminalService(this.factory, this.mapper);
  private final FakeConnection alice = new FakeConnection();
  private final FakeConnection bob = new FakeConnection();
  private String aliceSession;
  private String bobSession;

  @BeforeEach
  void setUp() {
    this.aliceSession = this.service.onConnect(this.alice);
    this.bobSession = this.service.onConnect(this.bob);
  }

  @Test
  @DisplayName("Should welcome a connection with its session id")
  void onConnect_NewConnection_SendsConnected() throws IOException {
    final JsonNode welcome = this.alice.message(0);

    assertThat(this.aliceSession).matches("session-\\d+-[a-z0-9]{9}");
    assertThat(welcome.path("type").asText()).isEqualTo("connected");
    assertThat(welcome.path("data").path("sessionId").asText()).isEqualTo(this.aliceSession);
    assertThat(welcome.path("timestamp").asLong()).isPositive();
  }

  @Test
  @DisplayName("Should create a terminal with default size and report strategy and pid")
  void create_NoOptions_SendsCreated() throws IOException {
    this.service.onMessage(this.aliceSession, this.alice, "{\"type\":\"create\",\"timestamp\":1}");

    final JsonNode created = this.alice.last();
    final String terminalId = created.path("terminalId").asText();
    assertThat(created.path("type").asText()).isEqualTo("created");
    assertThat(terminalId).matches("terminal-\\d+-[a-z0-9]{9}");
    assertThat(created.path("data").path("pid").asLong()).isEqualTo(12345L);
    assertThat(created.path("data").path("strategy").asText()).isEqualTo("native-pty");
    assertThat(this.factory.terminal(terminalId).isSpawned()).isTrue();
    assertThat(this.factory.options(terminalId).cols()).isEqualTo(80);
    assertThat(this.factory.options(terminalId).rows()).isEqualTo(24);
    assertThat(this.service.sessionCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should pass shell, size and environment through to the terminal factory")
  void create_WithOptions_UsesThem() {
    this.service.onMessage(this.aliceSession, this.alice, "{\"type\":\"create\",\"terminalId\":\"t1\","
        + "\"data\":{\"shell\":\"/bin/zsh\",\"cols\":120,\"rows\":40,\"env\":{\"FOO\":\"bar\"}},\"timestamp\":1}");

    assertThat(this.factory.options("t1").shell()).isEqualTo("/bin/zsh");
    assertThat(this.factory.options("t1").cols()).isEqualTo(120);
    assertThat(this.factory.options("t1").rows()).isEqualTo(40);
    assertThat(this.factory.options("t1").env()).containsEntry("FOO", "bar");
  }

  @Test
  @DisplayName("Should write to an owned terminal and stream its output")
  void write_OwnedTerminal_WritesAndStreams() throws IOException {
    createTerminal("t1", this.aliceSession, this.alice);
    final FakeTerminal terminal = this.factory.terminal("t1");

    this.service.onMessage(this.aliceSession, this.alice,
        "{\"type\":\"write\",\"terminalId\":\"t1\",\"data\":\"ls\\n\",\"timestamp\":1}");
    terminal.emitData("file.txt\r\n");

    assertThat(terminal.writes()).containsExactly("ls\n");
    final JsonNode data = this.alice.last();
    assertThat(data.path("type").asText()).isEqualTo("data");
    assertThat(data.path("terminalId").asText()).isEqualTo("t1");
    assertThat(data.path("data").asText()).isEqualTo("file.txt\r\n");
  }

  @Test
  @DisplayName("Should ignore operations on terminals owned by another connection")
  void write_ForeignTerminal_Ignored() {
    createTerminal("t1", this.aliceSession, this.alice);
    final int bobMessages = this.bob.sent.size();

    this.service.onMessage(this.bobSession, this.bob,
        "{\"type\":\"write\",\"terminalId\":\"t1\",\"data\":\"rm -rf /\\n\",\"timestamp\":1}");
    this.service.onMessage(this.bobSession, this.bob, "{\"type\":\"kill\",\"terminalId\":\"t1\",\"timestamp\":1}");

    assertThat(this.factory.terminal("t1").writes()).isEmpty();
    assertThat(this.factory.terminal("t1").isKilled()).isFalse();
    assertThat(this.bob.sent).hasSize(bobMessages);
  }

  @Test
  @DisplayName("Should resize and kill an owned terminal")
  void resizeAndKill_OwnedTerminal_Applied() {
    createTerminal("t1", this.aliceSession, this.alice);

    this.service.onMessage(this.aliceSession, this.alice,
        "{\"type\":\"resize\",\"terminalId\":\"t1\",\"data\":{\"cols\":132,\"rows\":50},\"timestamp\":1}");
    this.service.onMessage(this.aliceSession, this.alice, "{\"type\":\"kill\",\"terminalId\":\"t1\",\"timestamp\":1}");

    assertThat(this.factory.terminal("t1").resizes()).containsExactly(new int[] {132, 50});
    assertThat(this.factory.terminal("t1").isKilled()).isTrue();
    assertThat(this.service.sessionCount()).isZero();
  }

  @Test
  @DisplayName("Should answer malformed messages with an error and keep the connection usable")
  void onMessage_Malformed_SendsError() throws IOException {
    this.service.onMessage(this.aliceSession, this.alice, "{not json");

    assertThat(this.alice.last().path("type").asText()).isEqualTo("error");
    assertThat(this.alice.last().path("data").path("error").asText()).isNotBlank();

    createTerminal("t1", this.aliceSession, this.alice);
    assertThat(this.alice.last().path("type").asText()).isEqualTo("created");
  }

  @Test
  @DisplayName("Should report a creation failure as an error")
  void create_FactoryFails_SendsError() throws IOException {
    this.factory.failWith(new IllegalStateException("no shell"));

    this.service.onMessage(this.aliceSession, this.alice, "{\"type\":\"create\",\"timestamp\":1}");

    assertThat(this.alice.last().path("type").asText()).isEqualTo("error");
    assertThat(this.alice.last().path("data").path("error").asText()).isEqualTo("no shell");
  }

  @Test
  @DisplayName("Should list only the connection's own terminals")
  void list_TwoConnections_OnlyOwn() throws IOException {
    createTerminal("a1", this.aliceSession, this.alice);
    createTerminal("b1", this.bobSession, this.bob);

    this.service.onMessage(this.aliceSession, this.alice, "{\"type\":\"list\",\"timestamp\":1}");

    final JsonNode terminals = this.alice.last().path("data").path("terminals");
    assertThat(terminals).hasSize(1);
    assertThat(terminals.get(0).path("id").asText()).isEqualTo("a1");
    assertThat(terminals.get(0).path("isRunning").asBoolean()).isTrue();
    assertThat(this.service.describeAll()).hasSize(2);
  }

  @Test
  @DisplayName("Should send exit and forget the terminal when it exits")
  void terminalExit_Running_SendsExit() throws IOException {
    createTerminal("t1", this.aliceSession, this.alice);

    this.factory.terminal("t1").emitExit(2, null);

    final JsonNode exit = this.alice.last();
    assertThat(exit.path("type").asText()).isEqualTo("exit");
    assertThat(exit.path("data").path("exitCode").asInt()).isEqualTo(2);
    assertThat(this.service.sessionCount()).isZero();
  }

  @Test
  @DisplayName("Should kill the terminals of a closed connection only")
  void onClose_Connection_KillsItsTerminals() {
    createTerminal("a1", this.aliceSession, this.alice);
    createTerminal("b1", this.bobSession, this.bob);

    this.service.onClose(this.aliceSession);

    assertThat(this.factory.terminal("a1").isKilled()).isTrue();
    assertThat(this.factory.terminal("b1").isKilled()).isFalse();
    assertThat(this.service.sessionCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should refuse an id another connection is still creating and keep one owned terminal")
  void create_SameIdDuringCreation_SecondRejected() throws IOException {
    final AtomicReference<RemoteTerminalService> racing = new AtomicReference<>();
    final FakeConnection carol = new FakeConnection();
    final TerminalFactory interleaving = (id, options) -> {
      final RemoteTerminalService target = racing.get();
      target.onMessage("session-carol", carol, "{\"type\":\"create\",\"terminalId\":\"" + id + "\",\"timestamp\":1}");
      return this.factory.createTerminal(id, options);
    };
    final RemoteTerminalService service = new RemoteTerminalService(interleaving, this.mapper);
    racing.set(service);
    final String session = service.onConnect(this.alice);

    createTerminal(service, "t1", session, this.alice);

    assertThat(carol.last().path("type").asText()).isEqualTo("error");
    assertThat(carol.last().path("data").path("error").asText()).isEqualTo("Terminal t1 already exists");
    assertThat(this.alice.last().path("type").asText()).isEqualTo("created");
    assertThat(this.factory.created()).containsOnlyKeys("t1");
    assertThat(service.sessionCount()).isEqualTo(1);

    service.onClose(session);
    assertThat(this.factory.terminal("t1").isKilled()).isTrue();
    assertThat(service.sessionCount()).isZero();
  }

  @Test
  @DisplayName("Should release a terminal id when creation fails")
  void create_FactoryFails_IdReusable() throws IOException {
    this.factory.failWith(new IllegalStateException("no pty"));
    createTerminal("t1", this.aliceSession, this.alice);
    assertThat(this.alice.last().path("type").asText()).isEqualTo("error");

    this.factory.failWith(null);
    createTerminal("t1", this.aliceSession, this.alice);

    assertThat(this.alice.last().path("type").asText()).isEqualTo("created");
    assertThat(this.service.sessionCount()).isEqualTo(1);
  }

  private void createTerminal(final String id, final String session, final FakeConnection connection) {
    createTerminal(this.service, id, session, connection);
  }

  private static void createTerminal(final RemoteTerminalService target, final String id, final String session,
      final FakeConnection connection) {
    target.onMessage(session, connection,
        "{\"type\":\"create\",\"terminalId\":\"" + id + "\",\"timestamp\":1}");
  }

  private final class FakeConnection implements RemoteConnection {

    private final List<String> sent = new ArrayList<>();

    @Override
    public void send(final String text) {
      this.sent.add(text);
    }

    @Override
    public boolean isOpen() {
      return true;
    }

    JsonNode message(final int index) throws IOException {
      return RemoteTerminalServiceTest.this.mapper.readTree(this.sent.get(index));
    }

    JsonNode last() throws IOException {
      return message(this.sent.size() - 1);
    }
  }
}

package com.consullo.supervisor.bridge;

import com.consullo.supervisor.loop.EventLoop;
import com.consullo.supervisor.manager.SessionManager;
import com.consullo.supervisor.manager.SessionManagerListener;
import com.consullo.supervisor.manager.TerminalSession;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BridgeEndpoint} backed by a {@link SessionManager}.
 *
 * <p>
 * Each channel owns at most one terminal: {@code create} binds the channel to the new
 * session and later requests on that channel address it. The terminal's output is
 * streamed back on whichever port is currently attached for the channel, so it keeps
 * flowing across reconnects.
 * </p>
 */
public final class SessionManagerEndpoint implements BridgeEndpoint {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionManagerEndpoint.class);

  private final SessionManager manager;
  private final EventLoop loop;
  private final Map<String, ChannelPort<BridgeRequest, BridgeResponse>> ports = new ConcurrentHashMap<>();
  private final Map<String, String> sessionsByChannel = new ConcurrentHashMap<>();

  public SessionManagerEndpoint(final SessionManager manager, final EventLoop loop) {
    Validate.notNull(manager, "manager must not be null");
    Validate.notNull(loop, "loop must not be null");
    this.manager = manager;
    this.loop = loop;
    manager.addListener(new SessionManagerListener() {
      @Override
      public void onTerminalData(final String terminalId, final String data) {
        relayOutput(terminalId, data);
      }

      @Override
      public void onTerminalExit(final String terminalId, final int exitCode, final String signal) {
        unbind(terminalId);
      }

      @Override
      public void onTerminalKilled(final String terminalId) {
        unbind(terminalId);
      }
    });
  }

  @Override
  public void attach(final String channelId, final ChannelPort<BridgeRequest, BridgeResponse> port) {
    this.ports.put(channelId, port);
    port.start(request -> handle(channelId, port, request), () -> this.ports.remove(channelId, port));
    LOGGER.debug("Attached bridge channel {}", channelId);
  }

  /**
   * @param channelId bridge channel id
   * @return terminal bound to the channel, or null
   */
  public String sessionFor(final String channelId) {
    return this.sessionsByChannel.get(channelId);
  }

  private void handle(final String channelId, final ChannelPort<BridgeRequest, BridgeResponse> port,
      final BridgeRequest request) {
    if (request.type() == null) {
      reply(port, BridgeResponse.failed("Request has no type", now(), request.requestId()));
      return;
    }
    final BridgeRequest.Payload payload = request.data();
    final String terminalId = StringUtils.defaultIfBlank(this.sessionsByChannel.get(channelId),
        request.terminalId());
    switch (request.type()) {
      case CREATE:
        this.manager.createTerminal(payload == null ? null : payload.options())
            .whenComplete((session, error) -> {
              if (error != null) {
                reply(port, BridgeResponse.failed(messageOf(error), now(), request.requestId()));
                return;
              }
              this.sessionsByChannel.put(channelId, session.id());
              reply(port, BridgeResponse.ok(new BridgeResponse.Payload(session.id(), session.shell(), session.pid(),
                  null, null), now(), request.requestId()));
            });
        break;
      case WRITE:
        this.manager.writeToTerminal(terminalId, payload == null || payload.text() == null ? "" : payload.text());
        reply(port, BridgeResponse.ok(null, now(), request.requestId()));
        break;
      case RESIZE:
        if (payload == null || payload.cols() == null || payload.rows() == null) {
          reply(port, BridgeResponse.failed("Resize requires cols and rows", now(), request.requestId()));
          break;
        }
        this.manager.resizeTerminal(terminalId, payload.cols(), payload.rows());
        reply(port, BridgeResponse.ok(null, now(), request.requestId()));
        break;
      case KILL:
        this.manager.killTerminal(terminalId);
        this.sessionsByChannel.remove(channelId);
        reply(port, BridgeResponse.ok(null, now(), request.requestId()));
        break;
      case LIST:
        this.manager.listTerminals().whenComplete((sessions, error) -> {
          if (error != null) {
            reply(port, BridgeResponse.failed(messageOf(error), now(), request.requestId()));
            return;
          }
          reply(port, BridgeResponse.ok(new BridgeResponse.Payload(null, null, null, null, toEntries(sessions)),
              now(), request.requestId()));
        });
        break;
      default:
        LOGGER.warn("Ignoring {} request on channel {}", request.type(), channelId);
        break;
    }
  }

  private void relayOutput(final String terminalId, final String data) {
    for (final Map.Entry<String, String> binding : this.sessionsByChannel.entrySet()) {
      if (binding.getValue().equals(terminalId)) {
        final ChannelPort<BridgeRequest, BridgeResponse> port = this.ports.get(binding.getKey());
        if (port != null) {
          reply(port, BridgeResponse.output(data, now()));
        }
      }
    }
  }

  private void unbind(final String terminalId) {
    this.sessionsByChannel.values().removeIf(terminalId::equals);
  }

  private void reply(final ChannelPort<BridgeRequest, BridgeResponse> port, final BridgeResponse response) {
    if (!port.isOpen()) {
      LOGGER.debug("Dropping response {}, port closed", response.requestId());
      return;
    }
    try {
      port.post(response);
    } catch (final IllegalStateException e) {
      LOGGER.debug("Dropping response {}: {}", response.requestId(), e.getMessage());
    }
  }

  private long now() {
    return this.loop.currentTimeMillis();
  }

  private static List<BridgeResponse.TerminalEntry> toEntries(final List<TerminalSession> sessions) {
    return sessions.stream()
        .map(s -> new BridgeResponse.TerminalEntry(s.id(), s.shell(), s.pid(), true))
        .collect(Collectors.toList());
  }

  private static String messageOf(final Throwable error) {
    final Throwable cause = error instanceof CompletionException && error.getCause() != null
        ? error.getCause()
        : error;
    return StringUtils.defaultIfBlank(cause.getMessage(), "Unknown error");
  }
}

package com.consullo.supervisor.manager;

import com.consullo.supervisor.host.HostConfig;
import com.consullo.supervisor.host.TerminalHost;
import com.consullo.supervisor.loop.EventLoop;
import com.consullo.supervisor.protocol.HostRequest;
import com.consullo.supervisor.pty.TerminalFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the terminal host inside the supervisor's JVM.
 *
 * <p>
 * Messages are passed as objects, without serialization. Terminating the link kills
 * the host's terminals and reports a disconnect followed by exit status 0.
 * </p>
 */
public final class InProcessHostLauncher implements HostLauncher {

  private static final Logger LOGGER = LoggerFactory.getLogger(InProcessHostLauncher.class);

  private final TerminalFactory factory;
  private final Supplier<EventLoop> loopFactory;
  private final HostConfig config;

  /**
   * @param factory terminal factory for the host
   * @param loopFactory creates one event loop per launched host
   * @param config host settings
   */
  public InProcessHostLauncher(final TerminalFactory factory, final Supplier<EventLoop> loopFactory,
      final HostConfig config) {
    Validate.notNull(factory, "factory must not be null");
    Validate.notNull(loopFactory, "loopFactory must not be null");
    Validate.notNull(config, "config must not be null");
    this.factory = factory;
    this.loopFactory = loopFactory;
    this.config = config;
  }

  @Override
  public HostLink launch(final HostLinkListener listener) {
    Validate.notNull(listener, "listener must not be null");
    final EventLoop loop = this.loopFactory.get();
    final TerminalHost host = new TerminalHost(this.factory, listener::onMessage, loop, this.config);
    LOGGER.info("Started in-process terminal host");
    return new InProcessHostLink(host, loop, listener);
  }

  private static final class InProcessHostLink implements HostLink {

    private final TerminalHost host;
    private final EventLoop loop;
    private final HostLinkListener listener;
    private final AtomicBoolean terminated = new AtomicBoolean();

    private InProcessHostLink(final TerminalHost host, final EventLoop loop, final HostLinkListener listener) {
      this.host = host;
      this.loop = loop;
      this.listener = listener;
    }

    @Override
    public void send(final HostRequest request) {
      Validate.validState(!this.terminated.get(), "terminal host has been terminated");
      this.host.handle(request);
    }

    @Override
    public long pid() {
      return ProcessHandle.current().pid();
    }

    @Override
    public void terminate() {
      if (!this.terminated.compareAndSet(false, true)) {
        return;
      }
      this.host.shutdown().whenComplete((ignored, error) -> {
        if (error != null) {
          LOGGER.error("In-process host cleanup failed", error);
        }
        this.listener.onDisconnect();
        this.listener.onExit(0, null);
        this.loop.close();
      });
    }
  }
}

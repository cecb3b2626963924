package com.consullo.supervisor.manager;

import com.consullo.supervisor.protocol.HostRequest;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link HostLauncher} that records launches and lets tests play the host side.
 */
final class FakeHostLauncher implements HostLauncher {

  private final List<FakeHostLink> links = new ArrayList<>();
  private Exception failure;

  void failWith(final Exception error) {
    this.failure = error;
  }

  @Override
  public HostLink launch(final HostLinkListener listener) throws Exception {
    if (this.failure != null) {
      throw this.failure;
    }
    final FakeHostLink link = new FakeHostLink(listener, 900L + this.links.size());
    this.links.add(link);
    return link;
  }

  int launches() {
    return this.links.size();
  }

  FakeHostLink current() {
    return this.links.get(this.links.size() - 1);
  }

  FakeHostLink link(final int index) {
    return this.links.get(index);
  }

  static final class FakeHostLink implements HostLink {

    private final HostLinkListener listener;
    private final long pid;
    private final List<HostRequest> sent = new ArrayList<>();
    private boolean terminated;
    private RuntimeException sendFailure;

    private FakeHostLink(final HostLinkListener listener, final long pid) {
      this.listener = listener;
      this.pid = pid;
    }

    @Override
    public void send(final HostRequest request) {
      if (this.sendFailure != null) {
        throw this.sendFailure;
      }
      this.sent.add(request);
    }

    @Override
    public long pid() {
      return this.pid;
    }

    @Override
    public void terminate() {
      this.terminated = true;
    }

    void failSendWith(final RuntimeException error) {
      this.sendFailure = error;
    }

    HostLinkListener listener() {
      return this.listener;
    }

    List<HostRequest> sent() {
      return this.sent;
    }

    HostRequest lastSent() {
      return this.sent.get(this.sent.size() - 1);
    }

    boolean isTerminated() {
      return this.terminated;
    }
  }
}

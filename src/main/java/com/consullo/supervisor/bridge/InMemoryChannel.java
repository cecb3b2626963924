package com.consullo.supervisor.bridge;

import com.consullo.supervisor.loop.EventLoop;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;

/**
 * Channel between two ports in the same JVM. Delivery and close notifications run on
 * the given {@link EventLoop}.
 *
 * @param <A> messages posted by {@link #first()}
 * @param <B> messages posted by {@link #second()}
 */
public final class InMemoryChannel<A, B> {

  private final EventLoop loop;
  private final End<B, A> first;
  private final End<A, B> second;
  private volatile boolean closed;

  public InMemoryChannel(final EventLoop loop) {
    Validate.notNull(loop, "loop must not be null");
    this.loop = loop;
    this.first = new End<>();
    this.second = new End<>();
    this.first.peer = this.second;
    this.second.peer = this.first;
  }

  public ChannelPort<B, A> first() {
    return this.first;
  }

  public ChannelPort<A, B> second() {
    return this.second;
  }

  private void closeChannel() {
    synchronized (this) {
      if (this.closed) {
        return;
      }
      this.closed = true;
    }
    this.loop.execute(() -> {
      this.first.closed();
      this.second.closed();
    });
  }

  private final class End<I, O> implements ChannelPort<I, O> {

    private final Deque<I> held = new ArrayDeque<>();
    private End<O, I> peer;
    private Consumer<I> onMessage;
    private Runnable onClose;

    @Override
    public void start(final Consumer<I> messageHandler, final Runnable closeHandler) {
      Validate.notNull(messageHandler, "messageHandler must not be null");
      Validate.notNull(closeHandler, "closeHandler must not be null");
      InMemoryChannel.this.loop.execute(() -> {
        this.onMessage = messageHandler;
        this.onClose = closeHandler;
        I message;
        while ((message = this.held.pollFirst()) != null && !InMemoryChannel.this.closed) {
          messageHandler.accept(message);
        }
      });
    }

    @Override
    public void post(final O message) {
      Validate.validState(!InMemoryChannel.this.closed, "Channel closed");
      this.peer.receive(message);
    }

    @Override
    public void close() {
      closeChannel();
    }

    @Override
    public boolean isOpen() {
      return !InMemoryChannel.this.closed;
    }

    private void receive(final I message) {
      InMemoryChannel.this.loop.execute(() -> {
        if (InMemoryChannel.this.closed) {
          return;
        }
        if (this.onMessage == null) {
          this.held.addLast(message);
        } else {
          this.onMessage.accept(message);
        }
      });
    }

    private void closed() {
      this.held.clear();
      if (this.onClose != null) {
        this.onClose.run();
      }
    }
  }
}

package com.consullo.supervisor.bridge;

import java.util.function.Consumer;

/**
 * One end of a bidirectional message channel.
 *
 * @param <I> messages received on this end
 * @param <O> messages posted from this end
 */
public interface ChannelPort<I, O> {

  /**
   * Starts delivery. Messages posted before this are held.
   *
   * @param onMessage receives inbound messages
   * @param onClose called once when the channel closes, from either end
   */
  void start(Consumer<I> onMessage, Runnable onClose);

  /**
   * @param message message for the other end
   * @throws IllegalStateException if the channel is closed
   */
  void post(O message);

  /** Closes the channel for both ends. Idempotent. */
  void close();

  boolean isOpen();
}

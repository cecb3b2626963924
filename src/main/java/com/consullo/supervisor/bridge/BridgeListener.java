package com.consullo.supervisor.bridge;

/**
 * Events from a {@link ChannelBridge}, delivered on the bridge's event loop.
 */
public interface BridgeListener {

  default void onConnected() {
  }

  default void onDisconnected() {
  }

  /** Terminal output carried by a response. */
  default void onData(final String output) {
  }

  default void onResponse(final BridgeResponse response) {
  }

  default void onError(final Throwable error) {
  }

  /** Reconnection was abandoned; only {@link ChannelBridge#reconnect()} tries again. */
  default void onMaxReconnectAttemptsReached() {
  }

  default void onCleanup() {
  }
}

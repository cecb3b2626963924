package com.consullo.supervisor.bridge;

import org.apache.commons.lang3.Validate;

/**
 * Reconnection and queueing settings for a {@link ChannelBridge}.
 *
 * @param maxReconnectAttempts retries before giving up
 * @param baseDelayMillis backoff base; attempt {@code n} waits {@code base * 2^n}
 * @param maxDelayMillis backoff ceiling
 * @param maxQueuedMessages requests kept while disconnected; the oldest is dropped beyond this
 * @since 1.0
 */
public record BridgeConfig(
    int maxReconnectAttempts,
    long baseDelayMillis,
    long maxDelayMillis,
    int maxQueuedMessages) {

  public static final BridgeConfig DEFAULTS = new BridgeConfig(5, 1000L, 10_000L, 1000);

  public BridgeConfig {
    Validate.isTrue(maxReconnectAttempts >= 0, "maxReconnectAttempts must be >= 0");
    Validate.isTrue(baseDelayMillis > 0, "baseDelayMillis must be > 0");
    Validate.isTrue(maxDelayMillis >= baseDelayMillis, "maxDelayMillis must be >= baseDelayMillis");
    Validate.isTrue(maxQueuedMessages > 0, "maxQueuedMessages must be > 0");
  }

  /**
   * @param attempt 1-based attempt number
   * @return delay before that attempt
   */
  public long delayForAttempt(final int attempt) {
    final int shift = Math.min(attempt, 30);
    return Math.min(this.baseDelayMillis * (1L << shift), this.maxDelayMillis);
  }
}

package com.consullo.supervisor.bridge;

import com.consullo.supervisor.loop.EventLoop;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.lang3.Validate;

/**
 * Opens in-JVM channel pairs. The host side of each pair is handed to a
 * {@link BridgeEndpoint}; the consumer side is kept for whoever plays the consumer.
 */
public final class InMemoryChannelFactory implements ChannelFactory {

  private final EventLoop loop;
  private final BridgeEndpoint endpoint;
  private final Map<String, ChannelPort<BridgeResponse, BridgeRequest>> consumerEnds = new ConcurrentHashMap<>();

  public InMemoryChannelFactory(final EventLoop loop, final BridgeEndpoint endpoint) {
    Validate.notNull(loop, "loop must not be null");
    Validate.notNull(endpoint, "endpoint must not be null");
    this.loop = loop;
    this.endpoint = endpoint;
  }

  @Override
  public ChannelPair open(final String channelId) {
    Validate.notBlank(channelId, "channelId must not be blank");
    final InMemoryChannel<BridgeRequest, BridgeResponse> consumer = new InMemoryChannel<>(this.loop);
    final InMemoryChannel<BridgeRequest, BridgeResponse> host = new InMemoryChannel<>(this.loop);
    this.consumerEnds.put(channelId, consumer.first());
    this.endpoint.attach(channelId, host.second());
    return new ChannelPair(consumer.second(), host.first());
  }

  /**
   * @param channelId bridge channel id
   * @return consumer end of the most recently opened pair, or null
   */
  public ChannelPort<BridgeResponse, BridgeRequest> consumerEnd(final String channelId) {
    return this.consumerEnds.get(channelId);
  }
}

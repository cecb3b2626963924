package com.consullo.supervisor.bridge;

/**
 * Terminal-side peer of a bridge channel.
 */
public interface BridgeEndpoint {

  /**
   * Takes over a freshly opened port. The endpoint must start it.
   *
   * @param channelId bridge channel id
   * @param port receives requests, posts responses
   */
  void attach(String channelId, ChannelPort<BridgeRequest, BridgeResponse> port);
}

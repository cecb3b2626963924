package com.consullo.supervisor.bridge;

/**
 * Opens channel pairs for a bridge.
 */
public interface ChannelFactory {

  /**
   * @param channelId bridge channel id
   * @return freshly opened ports
   * @throws Exception when the channel cannot be established
   */
  ChannelPair open(String channelId) throws Exception;
}

package com.consullo.supervisor.bridge;

/**
 * The two ports a bridge relays between.
 *
 * @param consumerPort faces the consumer: receives requests, posts responses
 * @param hostPort faces the terminal side: receives responses, posts requests
 */
public record ChannelPair(
    ChannelPort<BridgeRequest, BridgeResponse> consumerPort,
    ChannelPort<BridgeResponse, BridgeRequest> hostPort) {
}

package com.consullo.supervisor.remote;

/**
 * @param running whether the server accepts connections
 * @param port bound port
 * @param sessions live terminal sessions
 * @param uptime seconds since the JVM started
 */
public record ServerStatus(boolean running, int port, int sessions, long uptime) {
}

package com.chatpulse.server.metrics;

/** Payload of {@code channel_mps}, sent to one channel's own subscribers. */
public class ChannelMps {
    public final String channel;
    public final long mps;
    public final String timestamp;

    public ChannelMps(String channel, long mps, String timestamp) {
        this.channel = channel;
        this.mps = mps;
        this.timestamp = timestamp;
    }
}

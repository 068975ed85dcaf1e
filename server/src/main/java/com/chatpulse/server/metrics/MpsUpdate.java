package com.chatpulse.server.metrics;

import java.util.Map;

/** Payload of {@code mps_update}, sent to the global room once per tick. */
public class MpsUpdate {
    public final long mps;
    public final Map<String, Long> channelMps;
    public final String timestamp;

    public MpsUpdate(long mps, Map<String, Long> channelMps, String timestamp) {
        this.mps = mps;
        this.channelMps = channelMps;
        this.timestamp = timestamp;
    }
}

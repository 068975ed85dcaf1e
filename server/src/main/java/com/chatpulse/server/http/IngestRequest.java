package com.chatpulse.server.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Size;

/**
 * Producer request body, shared by the HTTP endpoints and the MQ bridge.
 * {@code channel} is used by room events, {@code event} by global and broadcast-to-all events.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IngestRequest {

    @Size(max = 100)
    public String channel;

    @Size(max = 64)
    public String event;

    public Object data;

    public IngestRequest() {
    }

    public IngestRequest(String channel, String event, Object data) {
        this.channel = channel;
        this.event = event;
        this.data = data;
    }
}

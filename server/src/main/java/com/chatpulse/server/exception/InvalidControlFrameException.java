package com.chatpulse.server.exception;

/**
 * A client frame that could not be parsed or carries an unusable payload.
 * Answered with an {@code error} frame; the connection stays open.
 */
public class InvalidControlFrameException extends RelayException {

    private final String event;

    public InvalidControlFrameException(String event, String message) {
        super(message);
        this.event = event;
    }

    public InvalidControlFrameException(String event, String message, Throwable cause) {
        super(message, cause);
        this.event = event;
    }

    public String getEvent() {
        return event;
    }
}

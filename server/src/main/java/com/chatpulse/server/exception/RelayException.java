package com.chatpulse.server.exception;

/**
 * Base type for errors raised inside the relay.
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}

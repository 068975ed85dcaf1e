package com.chatpulse.server.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidRoomNameException extends RelayException {

    public InvalidRoomNameException(String raw) {
        super("invalid channel name: '" + raw + "'");
    }
}

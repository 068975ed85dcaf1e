package com.chatpulse.server.http;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

final class InternalAuth {

    private InternalAuth() {
    }

    static boolean authorized(String header, String token) {
        if (header == null || token == null || token.isEmpty()) return false;
        byte[] expected = ("Bearer " + token).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, header.getBytes(StandardCharsets.UTF_8));
    }
}

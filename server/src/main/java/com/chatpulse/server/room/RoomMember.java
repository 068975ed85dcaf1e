package com.chatpulse.server.room;

/**
 * Non-owning handle a room keeps for each member. The connection table owns the real object.
 */
public interface RoomMember {

    String connectionId();

    /**
     * Hands an encoded frame to the member's outbound path. Must not block.
     *
     * @return false if the member is closed or refused the frame
     */
    boolean deliver(String frame);
}

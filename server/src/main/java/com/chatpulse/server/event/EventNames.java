package com.chatpulse.server.event;

/** Well-known event names used on the relay socket. */
public final class EventNames {

    public static final String MESSAGE = "message";
    public static final String MESSAGE_DELETED = "message_deleted";
    public static final String MOD_ACTION = "mod_action";
    public static final String CHANNEL_MPS = "channel_mps";
    public static final String MPS_UPDATE = "mps_update";
    public static final String STATS_UPDATE = "stats_update";
    public static final String CHANNEL_STATUS = "channel_status";
    public static final String GLOBAL_MOD_ACTION = "global_mod_action";
    public static final String MESSAGES_FLUSHED = "messages_flushed";

    private EventNames() {
    }
}

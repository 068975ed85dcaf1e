package com.chatpulse.server.event;

/**
 * Entry point for producers (chat ingest, moderation pipeline, status poller, archiver).
 * <p>
 * Every call is fire-and-forget: it returns once the event is queued to each current member and never
 * throws. Events for one room published from one thread reach every member in publish order.
 */
public interface RelayEventPublisher {

    /** A new chat message; counts toward the message rate even when nobody is subscribed. */
    void publishMessage(String channel, Object payload);

    void publishMessageDeleted(String channel, Object payload);

    void publishModAction(String channel, Object payload);

    /** Delivers to subscribers of the global room under the given event name. */
    void publishGlobal(String event, Object payload);

    /** Delivers to every connected client, subscribed or not. */
    void publishToAll(String event, Object payload);

    default void publishStatsUpdate(Object stats) {
        publishGlobal(EventNames.STATS_UPDATE, stats);
    }

    default void publishChannelStatus(Object status) {
        publishGlobal(EventNames.CHANNEL_STATUS, status);
    }

    default void publishGlobalModAction(Object action) {
        publishGlobal(EventNames.GLOBAL_MOD_ACTION, action);
    }
}

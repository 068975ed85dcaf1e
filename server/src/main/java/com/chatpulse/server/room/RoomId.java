package com.chatpulse.server.room;

import com.chatpulse.server.exception.InvalidRoomNameException;

import java.util.Locale;
import java.util.Objects;

/**
 * Normalized identifier of a multicast room: either a chat channel or the single global room.
 * Channel names are compared after {@link #normalize(String)}, so "#Foo", "foo" and "FOO" are one room.
 */
public final class RoomId {

    public static final RoomId GLOBAL = new RoomId("global", true);

    private final String name;
    private final boolean global;

    private RoomId(String name, boolean global) {
        this.name = name;
        this.global = global;
    }

    /**
     * Lowercases the whole string, then strips a single leading '#'.
     */
    public static String normalize(String raw) {
        String lower = raw.toLowerCase(Locale.ROOT);
        return lower.startsWith("#") ? lower.substring(1) : lower;
    }

    /**
     * @throws InvalidRoomNameException if the name is null, blank, or still starts with '#' after normalizing
     */
    public static RoomId channel(String raw) {
        if (raw == null) throw new InvalidRoomNameException("null");
        String normalized = normalize(raw);
        if (normalized.isBlank() || normalized.startsWith("#")) {
            throw new InvalidRoomNameException(raw);
        }
        return new RoomId(normalized, false);
    }

    public String name() {
        return name;
    }

    public boolean isGlobal() {
        return global;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoomId)) return false;
        RoomId other = (RoomId) o;
        return global == other.global && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, global);
    }

    @Override
    public String toString() {
        return global ? "<global>" : "channel:" + name;
    }
}

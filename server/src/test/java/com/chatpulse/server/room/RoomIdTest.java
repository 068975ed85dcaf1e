package com.chatpulse.server.room;

import com.chatpulse.server.exception.InvalidRoomNameException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomIdTest {

    @Test
    void spellingsOfOneChannelAreTheSameRoom() {
        assertThat(RoomId.channel("#Foo")).isEqualTo(RoomId.channel("foo"));
        assertThat(RoomId.channel("FOO")).isEqualTo(RoomId.channel("foo"));
        assertThat(RoomId.channel("#SomeChannel").name()).isEqualTo("somechannel");
    }

    @Test
    void normalizeLowercasesThenStripsOneLeadingHash() {
        assertThat(RoomId.normalize("#Foo")).isEqualTo("foo");
        assertThat(RoomId.normalize("SOMECHANNEL")).isEqualTo("somechannel");
        assertThat(RoomId.normalize("foo#bar")).isEqualTo("foo#bar");
        assertThat(RoomId.normalize("##foo")).isEqualTo("#foo");
    }

    @ParameterizedTest
    @ValueSource(strings = {"foo", "#Foo", "FOO", "#x_y_z", "Caps123", "#a#b"})
    void normalizingAnAcceptedNameTwiceChangesNothing(String raw) {
        String once = RoomId.channel(raw).name();
        assertThat(RoomId.normalize(once)).isEqualTo(once);
        assertThat(RoomId.channel(once).name()).isEqualTo(once);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "#", "   ", "##foo"})
    void rejectsNamesThatDoNotNormalizeToAChannel(String raw) {
        assertThatThrownBy(() -> RoomId.channel(raw)).isInstanceOf(InvalidRoomNameException.class);
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> RoomId.channel(null)).isInstanceOf(InvalidRoomNameException.class);
    }

    @Test
    void globalRoomIsNotTheChannelNamedGlobal() {
        assertThat(RoomId.GLOBAL).isNotEqualTo(RoomId.channel("global"));
        assertThat(RoomId.GLOBAL.isGlobal()).isTrue();
        assertThat(RoomId.channel("global").isGlobal()).isFalse();
    }
}

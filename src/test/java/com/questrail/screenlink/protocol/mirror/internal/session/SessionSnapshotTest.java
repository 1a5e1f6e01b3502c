package com.questrail.screenlink.protocol.mirror.internal.session;

import com.questrail.screenlink.api.SessionState;
import com.questrail.screenlink.api.TransportKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SessionSnapshotTest {

    @Test
    void initialIsDisconnectedAtEpochZero() {
        SessionSnapshot s = SessionSnapshot.initial();

        assertEquals(0L, s.epoch());
        assertEquals(SessionState.DISCONNECTED, s.state());
        assertNull(s.transportKind());
        assertFalse(s.isActive());
    }

    @Test
    void connectingOpensNextEpoch() {
        SessionSnapshot first = SessionSnapshot.initial().connecting(TransportKind.WIFI_SOCKET, "10.0.0.2:9295");
        SessionSnapshot second = first.disconnected().connecting(TransportKind.BLUETOOTH, "AA:BB:CC:DD:EE:FF");

        assertEquals(1L, first.epoch());
        assertEquals(2L, second.epoch());
        assertEquals(TransportKind.BLUETOOTH, second.transportKind());
    }

    @Test
    void laterTransitionsKeepEpochAndTarget() {
        SessionSnapshot connecting = SessionSnapshot.initial().connecting(TransportKind.WIFI_SOCKET, "host");
        SessionSnapshot failed = connecting.connected().failed("peer closed");

        assertEquals(connecting.epoch(), failed.epoch());
        assertEquals("host", failed.target());
        assertEquals("peer closed", failed.cause());
        assertNull(failed.disconnected().cause());
    }

    @Test
    void onlyActiveSnapshotOfSameEpochIsCurrent() {
        SessionSnapshot connected = SessionSnapshot.initial().connecting(TransportKind.WIFI_SOCKET, "host").connected();

        assertTrue(connected.isCurrent(1L));
        assertFalse(connected.isCurrent(0L));
        assertFalse(connected.failed("x").isCurrent(1L));
        assertFalse(connected.disconnected().isCurrent(1L));
    }

    @Test
    void errorRequiresCause() {
        assertThrows(NullPointerException.class,
                () -> new SessionSnapshot(1L, SessionState.ERROR, TransportKind.WIFI_SOCKET, "host", null));
        assertThrows(IllegalArgumentException.class,
                () -> new SessionSnapshot(-1L, SessionState.DISCONNECTED, null, null, null));
    }
}

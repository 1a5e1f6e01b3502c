package com.questrail.screenlink.protocol.mirror.transport.socket;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SocketTargetTest
{
    @Test
    void hostAndPort()
    {
        assertEquals(new SocketTarget("192.168.1.20", 5000), SocketTarget.parse("192.168.1.20:5000", 9295));
    }

    @Test
    void missingPortUsesDefault()
    {
        assertEquals(new SocketTarget("receiver.local", 9295), SocketTarget.parse(" receiver.local ", 9295));
    }

    @Test
    void bracketedIpv6()
    {
        SocketTarget t = SocketTarget.parse("[fe80::1]:7000", 9295);
        assertEquals("fe80::1", t.host());
        assertEquals(7000, t.port());
        assertEquals("[fe80::1]:7000", t.toString());
    }

    @Test
    void rejectsAnythingBeyondHostAndPort()
    {
        assertThrows(IllegalArgumentException.class, () -> SocketTarget.parse("", 9295));
        assertThrows(IllegalArgumentException.class, () -> SocketTarget.parse("user@host:1", 9295));
        assertThrows(IllegalArgumentException.class, () -> SocketTarget.parse("host:1/path", 9295));
        assertThrows(IllegalArgumentException.class, () -> SocketTarget.parse("host:1?q", 9295));
        assertThrows(IllegalArgumentException.class, () -> new SocketTarget("host", 70000));
    }
}

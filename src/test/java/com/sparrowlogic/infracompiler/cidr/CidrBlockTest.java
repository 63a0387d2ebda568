package com.sparrowlogic.infracompiler.cidr;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CidrBlockTest {

    @Test
    void shouldRenderAddressAndPrefix() {
        assertEquals("10.0.0.0/16", CidrBlock.of(Ipv4Address.of(10, 0, 0, 0), 16).toString());
        assertEquals("172.16.0.0/12", CidrBlock.of(Ipv4Address.of(172, 16, 0, 0), 12).toString());
        assertEquals("192.168.1.100/24", CidrBlock.of(Ipv4Address.of(192, 168, 1, 100), 24).toString());
    }

    @Test
    void shouldRejectPrefixAbove32() {
        var error = assertThrows(InvalidPrefixException.class, () -> CidrBlock.of(Ipv4Address.of(192, 168, 0, 0), 33));
        assertEquals(33, error.prefixLength());
        assertDoesNotThrow(() -> CidrBlock.of(Ipv4Address.of(192, 168, 0, 0), 32));
    }

    @Test
    void shouldRejectNegativePrefix() {
        assertThrows(InvalidPrefixException.class, () -> CidrBlock.of(Ipv4Address.ANY, -1));
    }

    @Test
    void shouldKeepHostBitsInAddress() {
        var cidr = CidrBlock.of(Ipv4Address.of(192, 168, 1, 100), 24);

        assertEquals(Ipv4Address.of(192, 168, 1, 100), cidr.address());
        assertEquals(Ipv4Address.of(192, 168, 1, 0), cidr.networkAddress());
        assertEquals(Ipv4Address.of(192, 168, 1, 255), cidr.broadcastAddress());
    }

    @Test
    void shouldComputeNetworkAndBroadcastForCommonPrefixes() {
        assertRange(CidrBlock.of(Ipv4Address.of(192, 168, 0, 0), 16), "192.168.0.0", "192.168.255.255");
        assertRange(CidrBlock.of(Ipv4Address.of(10, 0, 0, 0), 8), "10.0.0.0", "10.255.255.255");
        assertRange(CidrBlock.of(Ipv4Address.of(172, 16, 0, 0), 12), "172.16.0.0", "172.31.255.255");
        assertRange(CidrBlock.of(Ipv4Address.of(10, 0, 0, 0), 31), "10.0.0.0", "10.0.0.1");
    }

    @Test
    void shouldCoverEverythingWithPrefixZero() {
        var cidr = CidrBlock.of(Ipv4Address.of(77, 1, 2, 3), 0);

        assertEquals(Ipv4Address.ANY, cidr.networkAddress());
        assertEquals(Ipv4Address.BROADCAST, cidr.broadcastAddress());
        assertTrue(cidr.contains(Ipv4Address.ANY));
        assertTrue(cidr.contains(Ipv4Address.of(128, 0, 0, 0)));
        assertTrue(cidr.contains(Ipv4Address.BROADCAST));
    }

    @Test
    void shouldCoverSingleAddressWithPrefix32() {
        var address = Ipv4Address.of(192, 168, 0, 1);
        var cidr = CidrBlock.of(address, 32);

        assertEquals(address, cidr.networkAddress());
        assertEquals(address, cidr.broadcastAddress());
        assertTrue(cidr.contains(address));
        assertFalse(cidr.contains(Ipv4Address.of(192, 168, 0, 0)));
        assertFalse(cidr.contains(Ipv4Address.of(192, 168, 0, 2)));
    }

    @Test
    void shouldTestMembershipWithUnsignedOrdering() {
        var upper = CidrBlock.of(Ipv4Address.of(200, 0, 0, 0), 8);

        assertTrue(upper.contains(Ipv4Address.of(200, 255, 255, 255)));
        assertFalse(upper.contains(Ipv4Address.of(10, 0, 0, 1)));
        assertFalse(upper.contains(Ipv4Address.of(201, 0, 0, 0)));

        var local = CidrBlock.of(Ipv4Address.of(192, 168, 0, 0), 24);
        assertTrue(local.contains(Ipv4Address.of(192, 168, 0, 254)));
        assertFalse(local.contains(Ipv4Address.of(192, 168, 1, 1)));
    }

    @Test
    void shouldContainOwnBoundsForEveryPrefix() {
        var addresses = List.of(Ipv4Address.ANY, Ipv4Address.of(127, 0, 0, 1), Ipv4Address.of(192, 168, 7, 9),
            Ipv4Address.of(255, 255, 255, 255));
        for (var address : addresses) {
            for (int prefix = 0; prefix <= 32; prefix++) {
                var cidr = CidrBlock.of(address, prefix);
                assertTrue(cidr.networkAddress().compareTo(address) <= 0, cidr + " network");
                assertTrue(address.compareTo(cidr.broadcastAddress()) <= 0, cidr + " broadcast");
                assertTrue(cidr.contains(cidr.networkAddress()), cidr + " contains network");
                assertTrue(cidr.contains(cidr.broadcastAddress()), cidr + " contains broadcast");
                assertEquals(address + "/" + prefix, cidr.toString());
            }
        }
    }

    @Test
    void shouldParseCidrNotation() {
        var cidr = CidrBlock.parse("10.1.0.0/16");

        assertEquals(Ipv4Address.of(10, 1, 0, 0), cidr.address());
        assertEquals(16, cidr.prefixLength());
        assertEquals(CidrBlock.of(Ipv4Address.of(10, 1, 0, 0), 16), cidr);
    }

    @Test
    void shouldRejectMalformedCidrText() {
        assertThrows(IllegalArgumentException.class, () -> CidrBlock.parse("10.0.0.0"));
        assertThrows(IllegalArgumentException.class, () -> CidrBlock.parse("10.0.0/8"));
        assertThrows(IllegalArgumentException.class, () -> CidrBlock.parse("10.0.0.0/x"));
        assertThrows(IllegalArgumentException.class, () -> CidrBlock.parse(" "));
        assertThrows(InvalidPrefixException.class, () -> CidrBlock.parse("10.0.0.0/40"));
    }

    private static void assertRange(CidrBlock cidr, String network, String broadcast) {
        assertEquals(network, cidr.networkAddress().toString());
        assertEquals(broadcast, cidr.broadcastAddress().toString());
    }
}

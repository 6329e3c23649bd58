package io.github.byzatic.jobscheduler.ssrf_guard;

import com.google.common.net.InetAddresses;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BlockedNetworksTest {

    static boolean isPrivate(String ip) {
        return BlockedNetworks.isPrivateIp(InetAddresses.forString(ip));
    }

    @Test
    void privateAndReservedAddresses() {
        for (String ip : new String[]{
                "10.0.0.1", "172.16.0.1", "172.31.255.255", "192.168.1.1", "127.0.0.1", "169.254.169.254",
                "0.0.0.0", "100.64.0.1", "192.0.0.8", "192.0.2.1", "198.18.0.1", "198.51.100.7", "203.0.113.9",
                "224.0.0.1", "255.255.255.255", "fc00::1", "fd12:3456::1", "::1", "fe80::1", "::"}) {
            assertTrue(isPrivate(ip), ip);
        }
    }

    @Test
    void publicAddresses() {
        for (String ip : new String[]{
                "8.8.8.8", "1.1.1.1", "172.32.0.1", "100.128.0.1", "93.184.215.14",
                "2001:4860:4860::8888", "2606:4700:4700::1111"}) {
            assertFalse(isPrivate(ip), ip);
        }
    }

    @Test
    void nullIsTreatedAsPrivate() {
        assertTrue(BlockedNetworks.isPrivateIp(null));
    }

    @Test
    void ipv4MappedAddressesAreJudgedAsIpv4() throws Exception {
        byte[] mapped = new byte[16];
        mapped[10] = (byte) 0xFF;
        mapped[11] = (byte) 0xFF;
        mapped[12] = 10;
        mapped[15] = 1;
        assertTrue(BlockedNetworks.isPrivateIp(java.net.Inet6Address.getByAddress(null, mapped, -1)));
    }

    @Test
    void blockedHostnames() {
        assertTrue(BlockedNetworks.isBlockedHostname("localhost"));
        assertTrue(BlockedNetworks.isBlockedHostname("LOCALHOST."));
        assertTrue(BlockedNetworks.isBlockedHostname("app.localhost"));
        assertTrue(BlockedNetworks.isBlockedHostname("metadata.google.internal"));
        assertTrue(BlockedNetworks.isBlockedHostname("Metadata.Goog"));
        assertFalse(BlockedNetworks.isBlockedHostname("example.com"));
        assertFalse(BlockedNetworks.isBlockedHostname("notlocalhost.com"));
    }
}

package io.github.byzatic.jobscheduler.ssrf_guard;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Address ranges and hostnames that outbound task requests must never reach.
 */
public final class BlockedNetworks {
    private static final List<CidrBlock> BLOCKS = List.of(
            CidrBlock.parse("0.0.0.0/8"),       // "this" network
            CidrBlock.parse("10.0.0.0/8"),      // RFC 1918
            CidrBlock.parse("100.64.0.0/10"),   // carrier-grade NAT
            CidrBlock.parse("127.0.0.0/8"),     // loopback
            CidrBlock.parse("169.254.0.0/16"),  // link-local, cloud metadata
            CidrBlock.parse("172.16.0.0/12"),   // RFC 1918
            CidrBlock.parse("192.0.0.0/24"),    // IETF protocol assignments
            CidrBlock.parse("192.0.2.0/24"),    // TEST-NET-1
            CidrBlock.parse("192.168.0.0/16"),  // RFC 1918
            CidrBlock.parse("198.18.0.0/15"),   // benchmarking
            CidrBlock.parse("198.51.100.0/24"), // TEST-NET-2
            CidrBlock.parse("203.0.113.0/24"),  // TEST-NET-3
            CidrBlock.parse("224.0.0.0/4"),     // multicast
            CidrBlock.parse("240.0.0.0/4"),     // reserved
            CidrBlock.parse("::/128"),          // unspecified
            CidrBlock.parse("::1/128"),         // loopback
            CidrBlock.parse("fc00::/7"),        // unique local
            CidrBlock.parse("fe80::/10")        // link-local
    );

    private static final Set<String> BLOCKED_HOSTNAMES = Set.of(
            "localhost",
            "metadata.google.internal",
            "metadata.goog"
    );

    private BlockedNetworks() {
    }

    /**
     * @return true if the address falls in a private or reserved range; {@code null} counts as private
     */
    public static boolean isPrivateIp(@Nullable InetAddress address) {
        if (address == null) return true;
        InetAddress candidate = unmapIpv4(address);
        for (CidrBlock block : BLOCKS) {
            if (block.contains(candidate)) return true;
        }
        return false;
    }

    /**
     * Case-insensitive, ignores a trailing dot. Any name under {@code .localhost} is blocked too.
     */
    public static boolean isBlockedHostname(@NotNull String hostname) {
        String lower = hostname.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".")) lower = lower.substring(0, lower.length() - 1);
        return BLOCKED_HOSTNAMES.contains(lower) || lower.endsWith(".localhost");
    }

    // ::ffff:a.b.c.d is judged as a.b.c.d
    private static InetAddress unmapIpv4(InetAddress address) {
        if (!(address instanceof Inet6Address)) return address;
        byte[] b = address.getAddress();
        for (int i = 0; i < 10; i++) {
            if (b[i] != 0) return address;
        }
        if ((b[10] & 0xFF) != 0xFF || (b[11] & 0xFF) != 0xFF) return address;
        try {
            return InetAddress.getByAddress(new byte[]{b[12], b[13], b[14], b[15]});
        } catch (UnknownHostException e) {
            // four bytes are always a valid IPv4 address
            throw new IllegalStateException(e);
        }
    }
}

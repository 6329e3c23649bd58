package io.github.byzatic.jobscheduler.ssrf_guard;

import com.google.common.net.InetAddresses;
import org.jetbrains.annotations.NotNull;

import java.net.InetAddress;

/**
 * An address range in CIDR notation, e.g. {@code 10.0.0.0/8} or {@code fc00::/7}.
 */
final class CidrBlock {
    private final String notation;
    private final byte[] network;
    private final int prefixLength;

    private CidrBlock(String notation, byte[] network, int prefixLength) {
        this.notation = notation;
        this.network = network;
        this.prefixLength = prefixLength;
    }

    /**
     * @throws IllegalArgumentException if the notation is malformed
     */
    static @NotNull CidrBlock parse(@NotNull String cidr) {
        int slash = cidr.indexOf('/');
        if (slash < 0) throw new IllegalArgumentException("Missing prefix length: " + cidr);
        byte[] address = InetAddresses.forString(cidr.substring(0, slash)).getAddress();
        int prefix = Integer.parseInt(cidr.substring(slash + 1));
        if (prefix < 0 || prefix > address.length * 8) {
            throw new IllegalArgumentException("Bad prefix length: " + cidr);
        }
        return new CidrBlock(cidr, address, prefix);
    }

    boolean contains(@NotNull InetAddress address) {
        byte[] candidate = address.getAddress();
        if (candidate.length != network.length) return false;

        int fullBytes = prefixLength / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (candidate[i] != network[i]) return false;
        }
        int remainingBits = prefixLength % 8;
        if (remainingBits == 0) return true;
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (candidate[fullBytes] & mask) == (network[fullBytes] & mask);
    }

    @Override
    public String toString() {
        return notation;
    }
}

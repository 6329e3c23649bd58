package io.github.byzatic.jobscheduler.ssrf_guard;

import okhttp3.Dns;
import org.jetbrains.annotations.NotNull;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Objects;

/**
 * Resolver for the guarded HTTP client. Runs when OkHttp opens a connection, so a hostname that
 * was rebound to a private address after validation is refused here. OkHttp only connects to the
 * addresses returned, which are exactly the ones checked.
 */
public final class SsrfSafeDns implements Dns {
    private final Dns delegate;

    public SsrfSafeDns(@NotNull Dns delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public @NotNull List<InetAddress> lookup(@NotNull String hostname) throws UnknownHostException {
        if (BlockedNetworks.isBlockedHostname(hostname)) {
            throw new UnknownHostException("connection to '" + hostname + "' is blocked");
        }
        List<InetAddress> addresses = delegate.lookup(hostname);
        if (addresses.isEmpty()) {
            throw new UnknownHostException("'" + hostname + "' did not resolve to any IP addresses");
        }
        for (InetAddress address : addresses) {
            if (BlockedNetworks.isPrivateIp(address)) {
                throw new UnknownHostException("connection to private IP " + address.getHostAddress() +
                        " (resolved from '" + hostname + "') is blocked");
            }
        }
        return addresses;
    }
}

package io.github.byzatic.jobscheduler.ssrf_guard;

import com.google.common.base.Strings;
import com.google.common.net.InetAddresses;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobscheduler.ssrf_guard.UrlRejectedException.Reason;
import okhttp3.Dns;
import okhttp3.HttpUrl;
import org.jetbrains.annotations.NotNull;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Validates URLs before the server requests them.
 * <p>
 * A URL passes when it uses {@code http} or {@code https}, names a host that is not on the
 * {@link BlockedNetworks} hostname list and every address the host resolves to is public.
 * IP-literal hosts are judged without a DNS lookup.
 * <p>
 * Validation only covers the moment it runs; the HTTP client built by
 * {@link SafeHttpClientFactory} repeats the address check at connection time and for
 * every redirect.
 */
@ThreadSafe
public final class SsrfGuard {
    private final Dns dns;

    public SsrfGuard() {
        this(Dns.SYSTEM);
    }

    /**
     * @param dns resolver used for hostname lookups
     */
    public SsrfGuard(@NotNull Dns dns) {
        this.dns = Objects.requireNonNull(dns, "dns");
    }

    public @NotNull Dns getDns() {
        return dns;
    }

    /**
     * @return the parsed URL
     * @throws UrlRejectedException if the URL must not be requested
     */
    public @NotNull HttpUrl validateUrl(String rawUrl) throws UrlRejectedException {
        if (Strings.isNullOrEmpty(rawUrl) || rawUrl.isBlank()) {
            throw new UrlRejectedException(Reason.EMPTY_URL, "URL is required");
        }
        String trimmed = rawUrl.trim();

        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            throw new UrlRejectedException(Reason.INVALID_URL, "invalid URL: " + e.getMessage(), e);
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new UrlRejectedException(Reason.DISALLOWED_SCHEME, "only http and https URLs are allowed");
        }
        if (Strings.isNullOrEmpty(uri.getRawAuthority())) {
            throw new UrlRejectedException(Reason.MISSING_HOSTNAME, "URL must have a hostname");
        }

        HttpUrl url = HttpUrl.parse(trimmed);
        if (url == null) {
            throw new UrlRejectedException(Reason.INVALID_URL, "invalid URL: " + trimmed);
        }
        String host = url.host();
        if (host.endsWith(".")) host = host.substring(0, host.length() - 1);
        if (host.isEmpty()) {
            throw new UrlRejectedException(Reason.MISSING_HOSTNAME, "URL must have a hostname");
        }

        if (BlockedNetworks.isBlockedHostname(host)) {
            throw new UrlRejectedException(Reason.BLOCKED_HOSTNAME, "hostname '" + host + "' is not allowed");
        }

        if (InetAddresses.isInetAddress(host)) {
            InetAddress literal = InetAddresses.forString(host);
            if (BlockedNetworks.isPrivateIp(literal)) {
                throw new UrlRejectedException(Reason.PRIVATE_OR_RESERVED_ADDRESS,
                        "private or reserved IP addresses are not allowed (" + host + ")");
            }
            return url;
        }

        checkResolvedAddresses(host);
        return url;
    }

    private void checkResolvedAddresses(String host) throws UrlRejectedException {
        List<InetAddress> addresses;
        try {
            addresses = dns.lookup(host);
        } catch (UnknownHostException e) {
            throw new UrlRejectedException(Reason.DNS_RESOLUTION_FAILED,
                    "cannot resolve hostname '" + host + "': " + e.getMessage(), e);
        }
        if (addresses.isEmpty()) {
            throw new UrlRejectedException(Reason.DNS_RESOLUTION_FAILED,
                    "hostname '" + host + "' did not resolve to any IP addresses");
        }
        for (InetAddress address : addresses) {
            if (BlockedNetworks.isPrivateIp(address)) {
                throw new UrlRejectedException(Reason.PRIVATE_OR_RESERVED_ADDRESS,
                        "hostname '" + host + "' resolves to private/reserved IP address " + address.getHostAddress());
            }
        }
    }
}

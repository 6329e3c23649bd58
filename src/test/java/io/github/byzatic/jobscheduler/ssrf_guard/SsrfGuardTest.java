package io.github.byzatic.jobscheduler.ssrf_guard;

import io.github.byzatic.jobscheduler.ssrf_guard.UrlRejectedException.Reason;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SsrfGuardTest {
    final FakeDns dns = new FakeDns()
            .answer("example.com", "93.184.215.14", "2606:2800:21f:cb07:6820:80da:af6b:8b2c")
            .answer("internal.example", "93.184.215.14", "10.1.2.3")
            .answer("empty.example");
    final SsrfGuard guard = new SsrfGuard(dns);

    Reason rejection(String url) {
        UrlRejectedException e = assertThrows(UrlRejectedException.class, () -> guard.validateUrl(url), url);
        return e.getReason();
    }

    @Test
    void acceptsPublicHttpsUrl() throws Exception {
        HttpUrl url = guard.validateUrl("https://example.com/health");
        assertEquals("example.com", url.host());
        assertEquals("/health", url.encodedPath());
    }

    @Test
    void acceptsPublicIpLiteralWithoutDns() throws Exception {
        guard.validateUrl("http://8.8.8.8/");
        guard.validateUrl("http://[2001:4860:4860::8888]:8080/");
        assertEquals(0, dns.lookups("8.8.8.8"));
    }

    @Test
    void rejectsLoopbackAndMetadataAddresses() {
        assertEquals(Reason.PRIVATE_OR_RESERVED_ADDRESS, rejection("http://127.0.0.1"));
        assertEquals(Reason.PRIVATE_OR_RESERVED_ADDRESS, rejection("http://169.254.169.254/latest/meta-data/"));
        assertEquals(Reason.PRIVATE_OR_RESERVED_ADDRESS, rejection("http://[::1]/"));
        assertEquals(Reason.PRIVATE_OR_RESERVED_ADDRESS, rejection("http://[fe80::1]/"));
    }

    @Test
    void rejectsBlockedHostnames() {
        assertEquals(Reason.BLOCKED_HOSTNAME, rejection("http://localhost:8080"));
        assertEquals(Reason.BLOCKED_HOSTNAME, rejection("http://LocalHost./"));
        assertEquals(Reason.BLOCKED_HOSTNAME, rejection("http://api.localhost/"));
        assertEquals(Reason.BLOCKED_HOSTNAME, rejection("http://metadata.google.internal/"));
        assertEquals(Reason.BLOCKED_HOSTNAME, rejection("http://metadata.goog/computeMetadata/v1/"));
    }

    @Test
    void rejectsOtherSchemes() {
        assertEquals(Reason.DISALLOWED_SCHEME, rejection("ftp://example.com"));
        assertEquals(Reason.DISALLOWED_SCHEME, rejection("file:///etc/passwd"));
        assertEquals(Reason.DISALLOWED_SCHEME, rejection("example.com/health"));
    }

    @Test
    void rejectsEmptyMalformedAndHostlessUrls() {
        assertEquals(Reason.EMPTY_URL, rejection(""));
        assertEquals(Reason.EMPTY_URL, rejection("  "));
        assertEquals(Reason.EMPTY_URL, rejection(null));
        assertEquals(Reason.INVALID_URL, rejection("http://exa mple.com/"));
        assertEquals(Reason.MISSING_HOSTNAME, rejection("http:///path"));
    }

    @Test
    void rejectsWhenAnyResolvedAddressIsPrivate() {
        assertEquals(Reason.PRIVATE_OR_RESERVED_ADDRESS, rejection("https://internal.example/"));
    }

    @Test
    void resolutionFailures() {
        assertEquals(Reason.DNS_RESOLUTION_FAILED, rejection("https://unknown.example/"));
        assertEquals(Reason.DNS_RESOLUTION_FAILED, rejection("https://empty.example/"));
    }
}

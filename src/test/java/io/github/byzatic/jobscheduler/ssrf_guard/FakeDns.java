package io.github.byzatic.jobscheduler.ssrf_guard;

import com.google.common.net.InetAddresses;
import okhttp3.Dns;
import org.jetbrains.annotations.NotNull;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolver with fixed answers. A host may be given several answers, returned one per lookup;
 * the last answer repeats.
 */
public class FakeDns implements Dns {
    private final Map<String, List<List<InetAddress>>> answers = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> lookups = new ConcurrentHashMap<>();

    public FakeDns answer(String host, String... ips) {
        List<InetAddress> addresses = new ArrayList<>();
        for (String ip : ips) addresses.add(InetAddresses.forString(ip));
        answers.computeIfAbsent(host, h -> new ArrayList<>()).add(addresses);
        return this;
    }

    public int lookups(String host) {
        AtomicInteger n = lookups.get(host);
        return n == null ? 0 : n.get();
    }

    @Override
    public @NotNull List<InetAddress> lookup(@NotNull String hostname) throws UnknownHostException {
        int n = lookups.computeIfAbsent(hostname, h -> new AtomicInteger()).getAndIncrement();
        List<List<InetAddress>> list = answers.get(hostname);
        if (list == null) throw new UnknownHostException(hostname + ": no such host");
        return list.get(Math.min(n, list.size() - 1));
    }
}

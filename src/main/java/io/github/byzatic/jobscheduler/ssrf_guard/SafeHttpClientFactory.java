package io.github.byzatic.jobscheduler.ssrf_guard;

import io.github.byzatic.jobscheduler.config.SchedulerConfig;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.jetbrains.annotations.NotNull;

import java.net.Proxy;
import java.util.concurrent.TimeUnit;

/**
 * Builds the {@link OkHttpClient} used for task requests:
 * <ul>
 *     <li>connect-time address checks through {@link SsrfSafeDns} and {@link ConnectedAddressInterceptor}</li>
 *     <li>redirects followed only through {@link RedirectGuardInterceptor}</li>
 *     <li>no proxy, so the checked address is the address connected to</li>
 * </ul>
 * The call timeout is the default task timeout; callers may shorten or extend it per call
 * through {@link okhttp3.Call#timeout()}.
 */
public final class SafeHttpClientFactory {
    private SafeHttpClientFactory() {
    }

    public static @NotNull OkHttpClient create(@NotNull SsrfGuard guard, @NotNull SchedulerConfig config) {
        return new OkHttpClient.Builder()
                .proxy(Proxy.NO_PROXY)
                .dns(new SsrfSafeDns(guard.getDns()))
                .followRedirects(false)
                .followSslRedirects(false)
                .addInterceptor(new RedirectGuardInterceptor(guard, config.getMaxRedirects()))
                .addNetworkInterceptor(new ConnectedAddressInterceptor())
                .connectTimeout(config.getConnectTimeout())
                .readTimeout(0, TimeUnit.SECONDS) // bounded by the call timeout
                .callTimeout(config.getDefaultTaskTimeout())
                .connectionPool(new ConnectionPool(10, 90, TimeUnit.SECONDS))
                .build();
    }
}

package io.github.byzatic.jobscheduler.ssrf_guard;

import io.github.byzatic.jobscheduler.ssrf_guard.UrlRejectedException.Reason;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Application interceptor that follows redirects itself. The client must be built with
 * {@code followRedirects(false)}; every {@code Location} is validated by the {@link SsrfGuard}
 * before it is requested, and at most {@code maxRedirects} hops are followed.
 * <p>
 * Rejections surface as {@link IOException} whose cause is the {@link UrlRejectedException}.
 */
public final class RedirectGuardInterceptor implements Interceptor {
    private final static Logger logger = LoggerFactory.getLogger(RedirectGuardInterceptor.class);

    private final SsrfGuard guard;
    private final int maxRedirects;

    public RedirectGuardInterceptor(@NotNull SsrfGuard guard, int maxRedirects) {
        if (maxRedirects < 0) throw new IllegalArgumentException("maxRedirects must not be negative");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.maxRedirects = maxRedirects;
    }

    @Override
    public @NotNull Response intercept(@NotNull Chain chain) throws IOException {
        Request request = chain.request();
        Response response = chain.proceed(request);

        int redirects = 0;
        while (isRedirect(response.code())) {
            String location = response.header("Location");
            if (location == null) return response;

            HttpUrl current = response.request().url();
            HttpUrl resolved = current.resolve(location);
            String target = resolved != null ? resolved.toString() : location;
            response.close();

            if (++redirects > maxRedirects) {
                throw new IOException("too many redirects",
                        new UrlRejectedException(Reason.TOO_MANY_REDIRECTS, "stopped after " + maxRedirects + " redirects"));
            }

            HttpUrl next;
            try {
                next = guard.validateUrl(target);
            } catch (UrlRejectedException e) {
                throw new IOException("redirect blocked (SSRF protection): " + e.getMessage(), e);
            }
            logger.trace("Following redirect {} -> {}", current, next);

            Request.Builder builder = request.newBuilder().url(next);
            if (!next.host().equals(current.host())) {
                builder.removeHeader("Authorization");
            }
            request = builder.build();
            response = chain.proceed(request);
        }
        return response;
    }

    private static boolean isRedirect(int code) {
        switch (code) {
            case 300:
            case 301:
            case 302:
            case 303:
            case 307:
            case 308:
                return true;
            default:
                return false;
        }
    }
}

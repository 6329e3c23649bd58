package io.github.byzatic.jobscheduler.ssrf_guard;

import okhttp3.Connection;
import okhttp3.Interceptor;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.net.InetAddress;

/**
 * Network interceptor that refuses to send a request over a connection whose remote address is
 * private. OkHttp does not pass IP-literal hosts through {@link okhttp3.Dns}, so this is the
 * connect-time check for them.
 */
public final class ConnectedAddressInterceptor implements Interceptor {
    @Override
    public @NotNull Response intercept(@NotNull Chain chain) throws IOException {
        Connection connection = chain.connection();
        if (connection != null) {
            InetAddress remote = connection.route().socketAddress().getAddress();
            if (BlockedNetworks.isPrivateIp(remote)) {
                throw new IOException("connection to private IP " +
                        (remote == null ? "<unresolved>" : remote.getHostAddress()) + " is blocked");
            }
        }
        return chain.proceed(chain.request());
    }
}

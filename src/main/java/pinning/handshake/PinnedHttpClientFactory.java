package pinning.handshake;

import java.net.http.HttpClient;
import java.time.Duration;
import javax.net.ssl.SSLContext;

public final class PinnedHttpClientFactory {
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private PinnedHttpClientFactory() {
    }

    public static HttpClient create(SSLContext pinnedContext) {
        return HttpClient.newBuilder()
            .sslContext(pinnedContext)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(CONNECT_TIMEOUT)
            .build();
    }
}

package pinning.truststore;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pinning.tls.PlatformTrustVerifier;
import pinning.util.MaterialFiles;
import pinning.util.TarGzExtractor;

/**
 * Loads the anchor store the chain validator trusts. Without an explicit source the JDK default anchors are
 * used; a custom JKS or PKCS12 store can come from a file or an http(s) URL, optionally packed as tar.gz.
 */
public class TrustAnchorLoader {
    private static final Logger log = LoggerFactory.getLogger(TrustAnchorLoader.class);
    private static final List<String> SUPPORTED_TYPES = List.of("PKCS12", "JKS");

    public LoadedTrustAnchors load(StoreSourceType sourceType, String sourceValue, char[] password) throws Exception {
        if (sourceType == StoreSourceType.SYSTEM_DEFAULT) {
            return LoadedTrustAnchors.systemDefault();
        }
        if (password == null) {
            throw new IllegalArgumentException("Password must not be null");
        }
        if (sourceValue == null || sourceValue.isBlank()) {
            throw new IllegalArgumentException("Trust anchor source must not be empty");
        }

        byte[] storeBytes = switch (sourceType) {
            case FILE -> MaterialFiles.read(Path.of(sourceValue.trim()), name -> true);
            case URL -> downloadFromUrl(sourceValue.trim());
            case SYSTEM_DEFAULT -> throw new IllegalStateException("unreachable");
        };

        Exception lastLoadError = null;
        for (String type : SUPPORTED_TYPES) {
            try {
                KeyStore keyStore = KeyStore.getInstance(type);
                try (ByteArrayInputStream in = new ByteArrayInputStream(storeBytes)) {
                    keyStore.load(in, password);
                }
                log.info("Loaded {} trust anchors from {} (type={})", keyStore.size(), sourceValue, type);
                return new LoadedTrustAnchors(keyStore, sourceType, sourceValue, type);
            } catch (IOException | GeneralSecurityException e) {
                lastLoadError = e;
            }
        }

        String details = lastLoadError == null || lastLoadError.getMessage() == null || lastLoadError.getMessage().isBlank()
            ? "unknown reason"
            : lastLoadError.getMessage();
        throw new IllegalArgumentException(
            "Failed to load trust anchors. Check password and store format (JKS/PKCS12). Details: " + details,
            lastLoadError
        );
    }

    public PlatformTrustVerifier verifierFor(LoadedTrustAnchors anchors) throws GeneralSecurityException {
        return PlatformTrustVerifier.fromKeyStore(anchors.keyStore());
    }

    private byte[] downloadFromUrl(String url) throws IOException, InterruptedException {
        URI uri = validateHttpUrl(url);

        HttpClient client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(30))
            .GET()
            .build();
        HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("Failed to download trust anchors from URL. HTTP " + response.statusCode());
        }
        byte[] body = response.body();
        String contentType = response.headers().firstValue("Content-Type").orElse("").toLowerCase(Locale.ROOT);
        if (contentType.contains("gzip") || TarGzExtractor.looksLikeTarGz(uri.getPath(), body)) {
            return TarGzExtractor.extractSingleFile(body);
        }
        return body;
    }

    static URI validateHttpUrl(String rawUrl) {
        URI uri;
        try {
            uri = URI.create(rawUrl == null ? "" : rawUrl.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid URL syntax: " + rawUrl, e);
        }
        if (uri.getScheme() == null || uri.getScheme().isBlank()) {
            throw new IllegalArgumentException("Invalid URL: missing scheme. Use full URL like https://host/anchors.p12");
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("Invalid URL scheme: " + uri.getScheme() + ". Only http/https supported");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new IllegalArgumentException("Invalid URL: missing host. Use FQDN or resolvable host with scheme");
        }
        return uri;
    }
}

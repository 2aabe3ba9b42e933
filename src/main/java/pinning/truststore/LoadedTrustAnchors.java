package pinning.truststore;

import java.security.KeyStore;

/**
 * @param keyStore the anchor store, or {@code null} for the JDK default anchors
 */
public record LoadedTrustAnchors(KeyStore keyStore, StoreSourceType sourceType, String sourceDescription, String storeType) {

    public static LoadedTrustAnchors systemDefault() {
        return new LoadedTrustAnchors(null, StoreSourceType.SYSTEM_DEFAULT, "JDK default trust anchors", "cacerts");
    }
}

package pinning.tls;

import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;

public class PlatformTrustVerifier implements TrustAnchorVerifier {
    private final X509TrustManager trustManager;

    public PlatformTrustVerifier(X509TrustManager trustManager) {
        if (trustManager == null) {
            throw new IllegalArgumentException("Trust manager must not be null");
        }
        this.trustManager = trustManager;
    }

    /**
     * Uses the JDK default anchors (cacerts).
     */
    public static PlatformTrustVerifier systemDefault() throws GeneralSecurityException {
        return fromKeyStore(null);
    }

    public static PlatformTrustVerifier fromKeyStore(KeyStore trustStore) throws GeneralSecurityException {
        TrustManagerFactory trustManagerFactory = TrustManagerFactory.getInstance(
            TrustManagerFactory.getDefaultAlgorithm()
        );
        trustManagerFactory.init(trustStore);
        for (TrustManager manager : trustManagerFactory.getTrustManagers()) {
            if (manager instanceof X509TrustManager x509TrustManager) {
                return new PlatformTrustVerifier(x509TrustManager);
            }
        }
        throw new IllegalStateException("X509TrustManager is not available");
    }

    @Override
    public void verify(X509Certificate[] chain, String authType) throws CertificateException {
        CertificateException lastError = null;
        for (String candidate : candidateAuthTypes(chain[0], authType)) {
            try {
                trustManager.checkServerTrusted(chain, candidate);
                return;
            } catch (CertificateException e) {
                lastError = e;
            } catch (IllegalArgumentException e) {
                lastError = new CertificateException(e.getMessage(), e);
            }
        }
        throw lastError == null ? new CertificateException("Chain could not be verified") : lastError;
    }

    @Override
    public List<X509Certificate> trustAnchors() {
        return List.of(trustManager.getAcceptedIssuers());
    }

    private List<String> candidateAuthTypes(X509Certificate leaf, String reportedAuthType) {
        if (reportedAuthType != null && !reportedAuthType.isBlank()) {
            return List.of(reportedAuthType);
        }
        LinkedHashSet<String> authTypes = new LinkedHashSet<>();
        String keyAlgorithm = leaf.getPublicKey().getAlgorithm();
        if (keyAlgorithm != null && !keyAlgorithm.isBlank()) {
            authTypes.add(keyAlgorithm.toUpperCase());
        }
        if ("EC".equalsIgnoreCase(keyAlgorithm) || "ECDSA".equalsIgnoreCase(keyAlgorithm)) {
            authTypes.add("ECDHE_ECDSA");
            authTypes.add("ECDSA");
        } else if ("RSA".equalsIgnoreCase(keyAlgorithm)) {
            authTypes.add("ECDHE_RSA");
            authTypes.add("RSA");
        }
        authTypes.add("UNKNOWN");
        return new ArrayList<>(authTypes);
    }
}

package pinning.tls;

import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * The platform trust store as seen by {@link ChainValidator}: it verifies signatures up to a known anchor
 * and exposes the anchors it knows.
 */
public interface TrustAnchorVerifier {

    /**
     * @param authType the key exchange reported by the TLS stack, or {@code null} when the caller has none
     * @throws CertificateException when the chain does not verify up to a trusted anchor
     */
    void verify(X509Certificate[] chain, String authType) throws CertificateException;

    List<X509Certificate> trustAnchors();
}

package pinning.identity;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;
import javax.security.auth.DestroyFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pinning.cert.CertificateModel;

/**
 * Private key and certificate chain presented to servers that request a client certificate.
 *
 * <p>Instances are shared read-only by concurrent handshakes until {@link #destroy()} is called by the
 * owning client. Key material never appears in {@link #toString()}.
 */
public final class ClientIdentity {
    private static final Logger log = LoggerFactory.getLogger(ClientIdentity.class);

    private final String alias;
    private final List<CertificateModel> certificateChain;
    private volatile PrivateKey privateKey;

    ClientIdentity(String alias, PrivateKey privateKey, List<CertificateModel> certificateChain) {
        if (certificateChain == null || certificateChain.isEmpty()) {
            throw new IllegalArgumentException("Client certificate chain must not be empty");
        }
        this.alias = alias;
        this.privateKey = privateKey;
        this.certificateChain = List.copyOf(certificateChain);
    }

    public String alias() {
        return alias;
    }

    public PrivateKey privateKey() {
        PrivateKey key = privateKey;
        if (key == null) {
            throw new IllegalStateException("Client identity '" + alias + "' has been destroyed");
        }
        return key;
    }

    public String keyAlgorithm() {
        return privateKey().getAlgorithm();
    }

    public List<CertificateModel> certificateChain() {
        return certificateChain;
    }

    public CertificateModel leaf() {
        return certificateChain.get(0);
    }

    public X509Certificate[] x509Chain() {
        return certificateChain.stream()
            .map(CertificateModel::certificate)
            .toArray(X509Certificate[]::new);
    }

    public boolean isDestroyed() {
        return privateKey == null;
    }

    public void destroy() {
        PrivateKey key = privateKey;
        privateKey = null;
        if (key == null || key.isDestroyed()) {
            return;
        }
        try {
            key.destroy();
        } catch (DestroyFailedException e) {
            // Most JCA keys cannot wipe themselves; dropping the reference is all that is left.
            log.debug("Key of client identity '{}' is not destroyable, reference dropped", alias);
        }
    }

    @Override
    public String toString() {
        return "ClientIdentity[alias=" + alias + ", subject=" + leaf().subjectDn()
            + ", chainLength=" + certificateChain.size() + (isDestroyed() ? ", destroyed" : "") + "]";
    }
}

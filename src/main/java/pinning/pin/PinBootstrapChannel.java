package pinning.pin;

import pinning.cert.CertificateModel;

/**
 * Receives the root certificate of a trusted chain while no pinning reference is configured, so an operator
 * can capture it as the initial pin. Provisioning aid only: the handshake is rejected either way.
 */
@FunctionalInterface
public interface PinBootstrapChannel {
    PinBootstrapChannel DISABLED = (hostname, rootCertificate) -> {
    };

    void rootCertificatePresented(String hostname, CertificateModel rootCertificate);
}

package pinning.pin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pinning.cert.CertificateDecoder;
import pinning.cert.CertificateModel;

public class LoggingPinBootstrapChannel implements PinBootstrapChannel {
    private static final Logger log = LoggerFactory.getLogger("pinning.bootstrap");

    @Override
    public void rootCertificatePresented(String hostname, CertificateModel rootCertificate) {
        log.warn(
            "No pinning reference configured; root presented by {} is {} ({}={}). Base64 DER: {}",
            hostname,
            rootCertificate.subjectDn(),
            rootCertificate.thumbprintAlgorithm().digestName(),
            rootCertificate.thumbprintHex(),
            CertificateDecoder.encodeBase64(rootCertificate)
        );
    }
}

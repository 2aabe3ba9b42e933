package pinning.tls;

import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.List;
import pinning.cert.CertificateModel;

/**
 * Checks a presented server chain for structure, hostname, validity window and platform trust, and resolves
 * the terminal certificate used for pinning. Stateless and safe to share between handshake threads.
 */
public class ChainValidator {
    private final TrustAnchorVerifier trustAnchorVerifier;

    public ChainValidator(TrustAnchorVerifier trustAnchorVerifier) {
        if (trustAnchorVerifier == null) {
            throw new IllegalArgumentException("Trust anchor verifier must not be null");
        }
        this.trustAnchorVerifier = trustAnchorVerifier;
    }

    public CertificateModel validate(List<CertificateModel> presentedChain, String requestedHostname, Instant now)
        throws ChainValidationException {
        return validate(presentedChain, requestedHostname, now, null);
    }

    /**
     * @return the terminal (root) certificate of the verified chain
     */
    public CertificateModel validate(
        List<CertificateModel> presentedChain,
        String requestedHostname,
        Instant now,
        String authType
    ) throws ChainValidationException {
        checkStructure(presentedChain);

        CertificateModel leaf = presentedChain.get(0);
        if (!HostnameMatcher.matches(leaf, requestedHostname)) {
            throw new ChainValidationException(
                ChainError.HOSTNAME_MISMATCH,
                "Certificate for " + leaf.subjectDn() + " does not match host " + requestedHostname
            );
        }

        for (CertificateModel certificate : presentedChain) {
            if (now.isAfter(certificate.notAfter())) {
                throw new ChainValidationException(
                    ChainError.EXPIRED,
                    "Certificate " + certificate.subjectDn() + " expired at " + certificate.notAfter()
                );
            }
            if (now.isBefore(certificate.notBefore())) {
                throw new ChainValidationException(
                    ChainError.EXPIRED,
                    "Certificate " + certificate.subjectDn() + " is not valid before " + certificate.notBefore()
                );
            }
        }

        X509Certificate[] chain = presentedChain.stream()
            .map(CertificateModel::certificate)
            .toArray(X509Certificate[]::new);
        try {
            trustAnchorVerifier.verify(chain, authType);
        } catch (CertificateException e) {
            throw new ChainValidationException(
                ChainError.UNTRUSTED_ROOT,
                "Chain does not verify up to a trusted anchor (" + safeMessage(e) + ")",
                e
            );
        }
        return resolveRoot(presentedChain);
    }

    private void checkStructure(List<CertificateModel> chain) throws ChainValidationException {
        if (chain == null || chain.isEmpty()) {
            throw new ChainValidationException(ChainError.MALFORMED_CHAIN, "Server presented no certificates");
        }
        if (chain.size() < 2) {
            throw new ChainValidationException(
                ChainError.MALFORMED_CHAIN,
                "Server presented only a leaf certificate; an issuing certificate is required"
            );
        }
        for (int i = 0; i < chain.size(); i++) {
            CertificateModel certificate = chain.get(i);
            if (certificate == null) {
                throw new ChainValidationException(
                    ChainError.MALFORMED_CHAIN,
                    "Certificate at chain position " + i + " is missing"
                );
            }
            if (i + 1 < chain.size() && chain.get(i + 1) != null
                && !certificate.certificate().getIssuerX500Principal()
                    .equals(chain.get(i + 1).certificate().getSubjectX500Principal())) {
                throw new ChainValidationException(
                    ChainError.MALFORMED_CHAIN,
                    "Certificate at position " + i + " is not issued by the certificate at position " + (i + 1)
                );
            }
        }
    }

    private CertificateModel resolveRoot(List<CertificateModel> chain) throws ChainValidationException {
        CertificateModel last = chain.get(chain.size() - 1);
        if (last.isSelfIssued()) {
            return last;
        }
        X509Certificate anchor = findIssuer(last.certificate(), trustAnchorVerifier.trustAnchors());
        if (anchor == null) {
            return last;
        }
        try {
            return CertificateModel.of(anchor, chain.size(), last.thumbprintAlgorithm());
        } catch (CertificateException e) {
            throw new ChainValidationException(ChainError.UNTRUSTED_ROOT, "Trust anchor cannot be encoded", e);
        }
    }

    private X509Certificate findIssuer(X509Certificate certificate, List<X509Certificate> pool) {
        for (X509Certificate candidate : pool) {
            if (!certificate.getIssuerX500Principal().equals(candidate.getSubjectX500Principal())) {
                continue;
            }
            try {
                certificate.verify(candidate.getPublicKey());
                return candidate;
            } catch (GeneralSecurityException e) {
                // Same name, different key: keep looking.
            }
        }
        return null;
    }

    private static String safeMessage(Throwable t) {
        if (t.getMessage() == null || t.getMessage().isBlank()) {
            return t.getClass().getSimpleName();
        }
        return t.getMessage();
    }
}

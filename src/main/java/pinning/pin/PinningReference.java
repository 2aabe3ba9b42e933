package pinning.pin;

import java.security.cert.CertificateException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import pinning.cert.CertificateDecoder;
import pinning.cert.CertificateModel;
import pinning.cert.ThumbprintAlgorithm;

/**
 * The pinned root: identity fields and thumbprint of one trusted certificate supplied out-of-band.
 * Built once per client and shared read-only by every handshake.
 */
public record PinningReference(
    String subjectCn,
    String issuerCn,
    String issuerO,
    byte[] thumbprint,
    ThumbprintAlgorithm thumbprintAlgorithm
) {
    public PinningReference {
        Objects.requireNonNull(thumbprintAlgorithm, "thumbprintAlgorithm");
        if (thumbprint == null || thumbprint.length != thumbprintAlgorithm.length()) {
            throw new IllegalArgumentException(
                "Thumbprint must be " + thumbprintAlgorithm.length() + " bytes for " + thumbprintAlgorithm.digestName()
            );
        }
        subjectCn = subjectCn == null ? "" : subjectCn;
        issuerCn = issuerCn == null ? "" : issuerCn;
        issuerO = issuerO == null ? "" : issuerO;
        thumbprint = thumbprint.clone();
    }

    public static PinningReference fromCertificate(CertificateModel certificate) {
        return new PinningReference(
            certificate.subjectCn(),
            certificate.issuerCn(),
            certificate.issuerO(),
            certificate.thumbprint(),
            certificate.thumbprintAlgorithm()
        );
    }

    public static PinningReference fromBase64Der(String base64Der, ThumbprintAlgorithm algorithm)
        throws CertificateException {
        return fromCertificate(CertificateModel.of(CertificateDecoder.decodeBase64(base64Der), 0, algorithm));
    }

    @Override
    public byte[] thumbprint() {
        return thumbprint.clone();
    }

    public String thumbprintHex() {
        return HexFormat.of().withUpperCase().formatHex(thumbprint);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PinningReference that)) {
            return false;
        }
        return subjectCn.equals(that.subjectCn)
            && issuerCn.equals(that.issuerCn)
            && issuerO.equals(that.issuerO)
            && thumbprintAlgorithm == that.thumbprintAlgorithm
            && Arrays.equals(thumbprint, that.thumbprint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectCn, issuerCn, issuerO, thumbprintAlgorithm) * 31 + Arrays.hashCode(thumbprint);
    }

    @Override
    public String toString() {
        return "PinningReference[subjectCn=" + subjectCn + ", issuerCn=" + issuerCn + ", issuerO=" + issuerO
            + ", " + thumbprintAlgorithm.digestName() + "=" + thumbprintHex() + "]";
    }
}

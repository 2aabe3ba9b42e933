package pinning.pin;

import java.security.MessageDigest;
import pinning.cert.CertificateModel;

/**
 * Decides whether a chain's root certificate is the pinned one.
 *
 * <p>All clauses must hold and the thumbprint is compared first. Name clauses are substring matches: the
 * presented value must contain the reference value.
 */
public class PinMatcher {

    public void matches(CertificateModel root, PinningReference reference) throws PinMismatchException {
        if (reference == null) {
            throw new PinMismatchException(PinField.REFERENCE, "No pinning reference is configured");
        }
        byte[] presented = root.thumbprint(reference.thumbprintAlgorithm());
        if (!MessageDigest.isEqual(presented, reference.thumbprint())) {
            throw new PinMismatchException(
                PinField.THUMBPRINT,
                "Root " + reference.thumbprintAlgorithm().digestName() + " thumbprint does not match the pinned "
                    + reference.thumbprintHex()
            );
        }
        if (!root.subjectCn().contains(reference.subjectCn())) {
            throw new PinMismatchException(
                PinField.SUBJECT_CN,
                "Root subject CN '" + root.subjectCn() + "' does not contain '" + reference.subjectCn() + "'"
            );
        }
        if (!root.issuerCn().contains(reference.issuerCn())) {
            throw new PinMismatchException(
                PinField.ISSUER_CN,
                "Root issuer CN '" + root.issuerCn() + "' does not contain '" + reference.issuerCn() + "'"
            );
        }
        if (!root.issuerO().contains(reference.issuerO())) {
            throw new PinMismatchException(
                PinField.ISSUER_O,
                "Root issuer O '" + root.issuerO() + "' does not contain '" + reference.issuerO() + "'"
            );
        }
    }
}

package pinning.check;

import java.util.List;
import java.util.Optional;
import pinning.cert.CertificateModel;
import pinning.handshake.ValidationOutcome;

/**
 * @param outcome            decision of the engine, or {@code null} when the handshake never reached it
 * @param peerChain          chain the server presented, leaf first
 * @param clientCertificateSupplied whether the client identity was handed to the server
 */
public record PinCheckReport(
    boolean success,
    String message,
    ValidationOutcome outcome,
    List<CertificateModel> peerChain,
    boolean clientCertificateSupplied
) {
    public PinCheckReport {
        peerChain = peerChain == null ? List.of() : List.copyOf(peerChain);
    }

    public Optional<CertificateModel> rootCertificate() {
        if (outcome instanceof ValidationOutcome.Accepted accepted) {
            return Optional.of(accepted.rootCertificate());
        }
        if (outcome instanceof ValidationOutcome.RejectedPin rejected) {
            return Optional.of(rejected.rootCertificate());
        }
        return Optional.empty();
    }
}

package pinning.handshake;

import java.util.Objects;
import pinning.cert.CertificateModel;
import pinning.pin.PinField;
import pinning.tls.ChainError;

/**
 * Result of validating one presented server chain. Only {@link Accepted} lets a handshake continue.
 */
public sealed interface ValidationOutcome {

    default boolean accepted() {
        return this instanceof Accepted;
    }

    String describe();

    record Accepted(CertificateModel rootCertificate) implements ValidationOutcome {
        public Accepted {
            Objects.requireNonNull(rootCertificate, "rootCertificate");
        }

        @Override
        public String describe() {
            return "Accepted: pinned root " + rootCertificate.subjectDn();
        }
    }

    record RejectedChain(ChainError error, String reason) implements ValidationOutcome {
        public RejectedChain {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public String describe() {
            return "Rejected chain (" + error + "): " + reason;
        }
    }

    /**
     * The chain itself was trusted, so its root is known even though it is not the pinned one.
     */
    record RejectedPin(PinField field, CertificateModel rootCertificate, String reason) implements ValidationOutcome {
        public RejectedPin {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(rootCertificate, "rootCertificate");
        }

        @Override
        public String describe() {
            return "Rejected pin (" + field + "): " + reason;
        }
    }

    record Aborted(String reason) implements ValidationOutcome {
        @Override
        public String describe() {
            return "Aborted: " + reason;
        }
    }
}

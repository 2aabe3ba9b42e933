package pinning.handshake;

import java.security.cert.CertificateException;

/**
 * Thrown back into the TLS stack so that it aborts a handshake the engine did not accept.
 */
public class HandshakeRejectedException extends CertificateException {
    private static final long serialVersionUID = 1L;

    private final transient ValidationOutcome outcome;

    public HandshakeRejectedException(ValidationOutcome outcome) {
        super(outcome.describe());
        this.outcome = outcome;
    }

    public ValidationOutcome outcome() {
        return outcome;
    }
}

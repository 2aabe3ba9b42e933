package pinning.tls;

import java.security.cert.CertificateException;
import java.util.Objects;

public class ChainValidationException extends CertificateException {
    private static final long serialVersionUID = 1L;

    private final ChainError error;

    public ChainValidationException(ChainError error, String message) {
        this(error, message, null);
    }

    public ChainValidationException(ChainError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public ChainError error() {
        return error;
    }
}

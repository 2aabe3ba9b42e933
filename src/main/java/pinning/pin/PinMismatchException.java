package pinning.pin;

import java.security.cert.CertificateException;
import java.util.Objects;

public class PinMismatchException extends CertificateException {
    private static final long serialVersionUID = 1L;

    private final PinField field;

    public PinMismatchException(PinField field, String message) {
        super(message);
        this.field = Objects.requireNonNull(field, "field");
    }

    public PinField field() {
        return field;
    }
}

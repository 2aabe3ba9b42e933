package pinning.identity;

import java.security.GeneralSecurityException;
import java.util.Objects;

public class IdentityLoadException extends GeneralSecurityException {
    private static final long serialVersionUID = 1L;

    private final IdentityError error;

    public IdentityLoadException(IdentityError error, String message) {
        this(error, message, null);
    }

    public IdentityLoadException(IdentityError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public IdentityError error() {
        return error;
    }
}

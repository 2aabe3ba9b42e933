package pinning.identity;

public enum IdentityError {
    BAD_PASSPHRASE,
    NO_IDENTITY,
    MALFORMED
}

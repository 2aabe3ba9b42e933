package pinning.tls;

public enum ChainError {
    HOSTNAME_MISMATCH,
    EXPIRED,
    UNTRUSTED_ROOT,
    MALFORMED_CHAIN
}

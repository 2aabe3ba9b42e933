package pinning.pin;

public enum PinField {
    THUMBPRINT,
    SUBJECT_CN,
    ISSUER_CN,
    ISSUER_O,
    /** No reference is configured, so nothing can match. */
    REFERENCE
}

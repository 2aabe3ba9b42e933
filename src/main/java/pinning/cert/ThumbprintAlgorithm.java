package pinning.cert;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

public enum ThumbprintAlgorithm {
    SHA1("SHA-1", 20),
    SHA256("SHA-256", 32);

    private final String digestName;
    private final int length;

    ThumbprintAlgorithm(String digestName, int length) {
        this.digestName = digestName;
        this.length = length;
    }

    public String digestName() {
        return digestName;
    }

    public int length() {
        return length;
    }

    public byte[] digest(byte[] encoded) {
        try {
            return MessageDigest.getInstance(digestName).digest(encoded);
        } catch (NoSuchAlgorithmException e) {
            // Both digests are mandatory for every Java platform.
            throw new IllegalStateException(digestName + " is not available", e);
        }
    }

    public static ThumbprintAlgorithm parse(String value) {
        if (value == null || value.isBlank()) {
            return SHA1;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "");
        for (ThumbprintAlgorithm algorithm : values()) {
            if (algorithm.name().equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unsupported thumbprint algorithm: " + value + " (use SHA-1 or SHA-256)");
    }
}

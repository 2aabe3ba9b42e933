package pinning.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import pinning.cert.ThumbprintAlgorithm;
import pinning.truststore.StoreSourceType;
import pinning.util.MaterialFiles;

/**
 * Provisioned inputs of a pinning client. Passwords are kept as char arrays, copied in and out, and never
 * printed. Equality compares their contents.
 */
public record PinningSettings(
    String serverCertificateReference,
    String clientPkcs12Bundle,
    String clientPkcs12Path,
    char[] clientPkcs12Passphrase,
    ThumbprintAlgorithm thumbprintAlgorithm,
    boolean bootstrapEnabled,
    StoreSourceType trustAnchorSource,
    String trustAnchorLocation,
    char[] trustAnchorPassword
) {
    public static final String ENV_SERVER_CERT = "PINNING_SERVER_CERT";
    public static final String ENV_CLIENT_P12 = "PINNING_CLIENT_P12";
    public static final String ENV_CLIENT_P12_PATH = "PINNING_CLIENT_P12_PATH";
    public static final String ENV_CLIENT_P12_PASSWORD = "PINNING_CLIENT_P12_PASSWORD";
    public static final String ENV_THUMBPRINT_ALGORITHM = "PINNING_THUMBPRINT_ALGORITHM";
    public static final String ENV_BOOTSTRAP_ENABLED = "PINNING_BOOTSTRAP_ENABLED";
    public static final String ENV_TRUST_ANCHORS_PATH = "PINNING_TRUST_ANCHORS_PATH";
    public static final String ENV_TRUST_ANCHORS_URL = "PINNING_TRUST_ANCHORS_URL";
    public static final String ENV_TRUST_ANCHORS_PASSWORD = "PINNING_TRUST_ANCHORS_PASSWORD";
    private static final String DEFAULT_TRUST_ANCHORS_PASSWORD = "changeit";

    public PinningSettings {
        if (thumbprintAlgorithm == null) {
            thumbprintAlgorithm = ThumbprintAlgorithm.SHA1;
        }
        if (trustAnchorSource == null) {
            trustAnchorSource = StoreSourceType.SYSTEM_DEFAULT;
        }
        trustAnchorPassword = trustAnchorPassword == null
            ? DEFAULT_TRUST_ANCHORS_PASSWORD.toCharArray()
            : trustAnchorPassword.clone();
        clientPkcs12Passphrase = clientPkcs12Passphrase == null ? null : clientPkcs12Passphrase.clone();
    }

    public static PinningSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static PinningSettings fromEnvironment(Map<String, String> env) {
        String anchorsPath = trimmed(env, ENV_TRUST_ANCHORS_PATH);
        String anchorsUrl = trimmed(env, ENV_TRUST_ANCHORS_URL);
        if (anchorsPath != null && anchorsUrl != null) {
            throw new IllegalArgumentException(
                "Both " + ENV_TRUST_ANCHORS_PATH + " and " + ENV_TRUST_ANCHORS_URL + " are set; choose one"
            );
        }
        String bundle = trimmed(env, ENV_CLIENT_P12);
        String bundlePath = trimmed(env, ENV_CLIENT_P12_PATH);
        if (bundle != null && bundlePath != null) {
            throw new IllegalArgumentException(
                "Both " + ENV_CLIENT_P12 + " and " + ENV_CLIENT_P12_PATH + " are set; choose one"
            );
        }
        String passphrase = env.get(ENV_CLIENT_P12_PASSWORD);
        if ((bundle != null || bundlePath != null) && passphrase == null) {
            throw new IllegalArgumentException(ENV_CLIENT_P12_PASSWORD + " is required when a client bundle is configured");
        }
        String anchorsPassword = trimmed(env, ENV_TRUST_ANCHORS_PASSWORD);

        StoreSourceType anchorSource = StoreSourceType.SYSTEM_DEFAULT;
        if (anchorsPath != null) {
            anchorSource = StoreSourceType.FILE;
        } else if (anchorsUrl != null) {
            anchorSource = StoreSourceType.URL;
        }

        ThumbprintAlgorithm algorithm;
        try {
            algorithm = ThumbprintAlgorithm.parse(env.get(ENV_THUMBPRINT_ALGORITHM));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(ENV_THUMBPRINT_ALGORITHM + ": " + e.getMessage(), e);
        }

        return new PinningSettings(
            trimmed(env, ENV_SERVER_CERT),
            bundle,
            bundlePath,
            passphrase == null ? null : passphrase.toCharArray(),
            algorithm,
            parseBoolean(env, ENV_BOOTSTRAP_ENABLED),
            anchorSource,
            anchorsPath != null ? anchorsPath : anchorsUrl,
            anchorsPassword == null ? null : anchorsPassword.toCharArray()
        );
    }

    @Override
    public char[] clientPkcs12Passphrase() {
        return clientPkcs12Passphrase == null ? null : clientPkcs12Passphrase.clone();
    }

    @Override
    public char[] trustAnchorPassword() {
        return trustAnchorPassword.clone();
    }

    public boolean hasReference() {
        return serverCertificateReference != null && !serverCertificateReference.isBlank();
    }

    public boolean hasClientBundle() {
        return clientPkcs12Bundle != null || clientPkcs12Path != null;
    }

    /**
     * @return the bundle bytes, or {@code null} when no bundle is configured
     */
    public byte[] resolveClientBundle() throws IOException {
        if (clientPkcs12Bundle != null) {
            try {
                return Base64.getMimeDecoder().decode(clientPkcs12Bundle);
            } catch (IllegalArgumentException e) {
                throw new IOException(ENV_CLIENT_P12 + " is not valid Base64", e);
            }
        }
        if (clientPkcs12Path != null) {
            return MaterialFiles.read(Path.of(clientPkcs12Path), MaterialFiles.PKCS12_ENTRY);
        }
        return null;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PinningSettings that)) {
            return false;
        }
        return bootstrapEnabled == that.bootstrapEnabled
            && Objects.equals(serverCertificateReference, that.serverCertificateReference)
            && Objects.equals(clientPkcs12Bundle, that.clientPkcs12Bundle)
            && Objects.equals(clientPkcs12Path, that.clientPkcs12Path)
            && Arrays.equals(clientPkcs12Passphrase, that.clientPkcs12Passphrase)
            && thumbprintAlgorithm == that.thumbprintAlgorithm
            && trustAnchorSource == that.trustAnchorSource
            && Objects.equals(trustAnchorLocation, that.trustAnchorLocation)
            && Arrays.equals(trustAnchorPassword, that.trustAnchorPassword);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(
            serverCertificateReference, clientPkcs12Bundle, clientPkcs12Path, thumbprintAlgorithm,
            bootstrapEnabled, trustAnchorSource, trustAnchorLocation
        );
        result = 31 * result + Arrays.hashCode(clientPkcs12Passphrase);
        return 31 * result + Arrays.hashCode(trustAnchorPassword);
    }

    @Override
    public String toString() {
        return "PinningSettings[reference=" + (hasReference() ? "configured" : "none (bootstrap mode)")
            + ", clientBundle=" + (clientPkcs12Path != null ? clientPkcs12Path : clientPkcs12Bundle != null ? "inline" : "none")
            + ", passphrase=" + (clientPkcs12Passphrase == null ? "none" : "****")
            + ", thumbprint=" + thumbprintAlgorithm.digestName()
            + ", bootstrapEnabled=" + bootstrapEnabled
            + ", trustAnchors=" + trustAnchorSource + (trustAnchorLocation == null ? "" : " " + trustAnchorLocation)
            + "]";
    }

    private static boolean parseBoolean(Map<String, String> env, String name) {
        String value = trimmed(env, name);
        if (value == null) {
            return false;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new IllegalArgumentException(name + " must be true or false, got: " + value);
        };
    }

    private static String trimmed(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

package pinning.config;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import pinning.cert.ThumbprintAlgorithm;
import pinning.truststore.StoreSourceType;

@RunWith(JUnit4.class)
public class PinningSettingsTest {
    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void emptyEnvironmentGivesDefaults() {
        PinningSettings settings = PinningSettings.fromEnvironment(Map.of());

        assertFalse(settings.hasReference());
        assertFalse(settings.hasClientBundle());
        assertSame(ThumbprintAlgorithm.SHA1, settings.thumbprintAlgorithm());
        assertFalse(settings.bootstrapEnabled());
        assertSame(StoreSourceType.SYSTEM_DEFAULT, settings.trustAnchorSource());
        assertNull(settings.trustAnchorLocation());
        assertArrayEquals("changeit".toCharArray(), settings.trustAnchorPassword());
    }

    @Test
    public void readsAllVariables() {
        Map<String, String> env = new HashMap<>();
        env.put(PinningSettings.ENV_SERVER_CERT, "  TUlJQg==  ");
        env.put(PinningSettings.ENV_CLIENT_P12_PATH, "/etc/pinning/client.p12");
        env.put(PinningSettings.ENV_CLIENT_P12_PASSWORD, " secret with spaces ");
        env.put(PinningSettings.ENV_THUMBPRINT_ALGORITHM, "SHA-256");
        env.put(PinningSettings.ENV_BOOTSTRAP_ENABLED, "yes");
        env.put(PinningSettings.ENV_TRUST_ANCHORS_URL, "https://pki.example.com/anchors.p12");
        env.put(PinningSettings.ENV_TRUST_ANCHORS_PASSWORD, "anchors");

        PinningSettings settings = PinningSettings.fromEnvironment(env);

        assertEquals("TUlJQg==", settings.serverCertificateReference());
        assertEquals("/etc/pinning/client.p12", settings.clientPkcs12Path());
        assertArrayEquals(" secret with spaces ".toCharArray(), settings.clientPkcs12Passphrase());
        assertSame(ThumbprintAlgorithm.SHA256, settings.thumbprintAlgorithm());
        assertTrue(settings.bootstrapEnabled());
        assertSame(StoreSourceType.URL, settings.trustAnchorSource());
        assertEquals("https://pki.example.com/anchors.p12", settings.trustAnchorLocation());
        assertArrayEquals("anchors".toCharArray(), settings.trustAnchorPassword());
    }

    @Test
    public void conflictingSourcesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> PinningSettings.fromEnvironment(Map.of(
            PinningSettings.ENV_TRUST_ANCHORS_PATH, "/tmp/anchors.p12",
            PinningSettings.ENV_TRUST_ANCHORS_URL, "https://pki.example.com/anchors.p12"
        )));
        assertThrows(IllegalArgumentException.class, () -> PinningSettings.fromEnvironment(Map.of(
            PinningSettings.ENV_CLIENT_P12, "AAAA",
            PinningSettings.ENV_CLIENT_P12_PATH, "/tmp/client.p12",
            PinningSettings.ENV_CLIENT_P12_PASSWORD, "x"
        )));
    }

    @Test
    public void bundleRequiresPassphrase() {
        IllegalArgumentException e = assertThrows(
            IllegalArgumentException.class,
            () -> PinningSettings.fromEnvironment(Map.of(PinningSettings.ENV_CLIENT_P12, "AAAA"))
        );
        assertTrue(e.getMessage().contains(PinningSettings.ENV_CLIENT_P12_PASSWORD));
    }

    @Test
    public void invalidValuesNameTheirVariable() {
        IllegalArgumentException algorithm = assertThrows(
            IllegalArgumentException.class,
            () -> PinningSettings.fromEnvironment(Map.of(PinningSettings.ENV_THUMBPRINT_ALGORITHM, "MD5"))
        );
        assertTrue(algorithm.getMessage().contains(PinningSettings.ENV_THUMBPRINT_ALGORITHM));

        IllegalArgumentException bootstrap = assertThrows(
            IllegalArgumentException.class,
            () -> PinningSettings.fromEnvironment(Map.of(PinningSettings.ENV_BOOTSTRAP_ENABLED, "maybe"))
        );
        assertTrue(bootstrap.getMessage().contains(PinningSettings.ENV_BOOTSTRAP_ENABLED));
    }

    @Test
    public void toStringHidesSecrets() {
        PinningSettings settings = PinningSettings.fromEnvironment(Map.of(
            PinningSettings.ENV_CLIENT_P12, "QUJDRA==",
            PinningSettings.ENV_CLIENT_P12_PASSWORD, "top-secret"
        ));

        String text = settings.toString();
        assertFalse(text.contains("top-secret"));
        assertFalse(text.contains("QUJDRA=="));
        assertTrue(text.contains("inline"));
    }

    @Test
    public void resolvesInlineBundle() throws Exception {
        PinningSettings settings = PinningSettings.fromEnvironment(Map.of(
            PinningSettings.ENV_CLIENT_P12, Base64.getEncoder().encodeToString(new byte[] {1, 2, 3}),
            PinningSettings.ENV_CLIENT_P12_PASSWORD, "x"
        ));

        assertArrayEquals(new byte[] {1, 2, 3}, settings.resolveClientBundle());
    }

    @Test
    public void resolvesBundleFromFile() throws Exception {
        Path bundle = temporaryFolder.newFile("client.p12").toPath();
        Files.write(bundle, new byte[] {4, 5, 6});
        PinningSettings settings = PinningSettings.fromEnvironment(Map.of(
            PinningSettings.ENV_CLIENT_P12_PATH, bundle.toString(),
            PinningSettings.ENV_CLIENT_P12_PASSWORD, "x"
        ));

        assertArrayEquals(new byte[] {4, 5, 6}, settings.resolveClientBundle());
    }

    @Test
    public void missingBundleFileIsAnIoError() {
        PinningSettings settings = PinningSettings.fromEnvironment(Map.of(
            PinningSettings.ENV_CLIENT_P12_PATH, temporaryFolder.getRoot().toPath().resolve("absent.p12").toString(),
            PinningSettings.ENV_CLIENT_P12_PASSWORD, "x"
        ));

        assertThrows(IOException.class, settings::resolveClientBundle);
    }

    @Test
    public void noBundleResolvesToNull() throws Exception {
        assertNull(PinningSettings.fromEnvironment(Map.of()).resolveClientBundle());
    }

    @Test
    public void passwordsAreCopiedAndComparedByContent() {
        char[] passphrase = "s3cret".toCharArray();
        PinningSettings settings = new PinningSettings(
            null, "AAAA", null, passphrase, null, false, null, null, null
        );

        passphrase[0] = 'x';
        settings.clientPkcs12Passphrase()[1] = 'x';
        assertArrayEquals("s3cret".toCharArray(), settings.clientPkcs12Passphrase());

        PinningSettings same = new PinningSettings(
            null, "AAAA", null, "s3cret".toCharArray(), null, false, null, null, "changeit".toCharArray()
        );
        assertEquals(same, settings);
        assertEquals(same.hashCode(), settings.hashCode());
        assertNotEquals(
            new PinningSettings(null, "AAAA", null, "other".toCharArray(), null, false, null, null, null),
            settings
        );
    }
}

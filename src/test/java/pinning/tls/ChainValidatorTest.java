package pinning.tls;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import pinning.TestCertificates;
import pinning.TestCertificates.Credential;
import pinning.cert.CertificateModel;
import pinning.cert.ThumbprintAlgorithm;

@RunWith(JUnit4.class)
public class ChainValidatorTest {
    private static Credential root;
    private static Credential otherRoot;
    private static Credential intermediate;
    private static Credential leaf;
    private static Credential expiredLeaf;
    private static PlatformTrustVerifier trustingRoot;

    @BeforeClass
    public static void createCertificates() throws Exception {
        root = TestCertificates.root("CN=Validator Root, O=Pinning Labs");
        otherRoot = TestCertificates.root("CN=Rogue Root, O=Somebody Else");
        intermediate = TestCertificates.intermediate(root, "CN=Validator Issuing CA, O=Pinning Labs");
        leaf = TestCertificates.leaf(root, "CN=api.example.com", "*.example.com");
        Instant now = Instant.now();
        expiredLeaf = TestCertificates.leaf(
            root, "CN=api.example.com", now.minus(Duration.ofDays(30)), now.minus(Duration.ofDays(1)), "*.example.com"
        );
        trustingRoot = PlatformTrustVerifier.fromKeyStore(TestCertificates.trustStore(root.certificate()));
    }

    @Test
    public void acceptsTrustedChainAndReturnsItsRoot() throws Exception {
        ChainValidator validator = new ChainValidator(trustingRoot);

        CertificateModel resolved = validator.validate(chain(leaf, root), "api.example.com", Instant.now());

        assertEquals(root.certificate(), resolved.certificate());
        assertEquals(1, resolved.chainIndex());
    }

    @Test
    public void resolvesRootFromTrustAnchorsWhenChainStopsAtIntermediate() throws Exception {
        Credential issuedLeaf = TestCertificates.leaf(intermediate, "CN=api.example.com", "api.example.com");
        ChainValidator validator = new ChainValidator(trustingRoot);

        CertificateModel resolved = validator.validate(chain(issuedLeaf, intermediate), "api.example.com", Instant.now());

        assertEquals(root.certificate(), resolved.certificate());
        assertEquals(2, resolved.chainIndex());
    }

    @Test
    public void rejectsEmptyAndLeafOnlyChains() {
        ChainValidator validator = new ChainValidator(trustingRoot);

        assertError(ChainError.MALFORMED_CHAIN, () -> validator.validate(List.of(), "api.example.com", Instant.now()));
        assertError(ChainError.MALFORMED_CHAIN, () -> validator.validate(null, "api.example.com", Instant.now()));
        assertError(ChainError.MALFORMED_CHAIN, () -> validator.validate(chain(leaf), "api.example.com", Instant.now()));
    }

    @Test
    public void rejectsChainWithBrokenIssuerLinkage() {
        ChainValidator validator = new ChainValidator(trustingRoot);

        assertError(
            ChainError.MALFORMED_CHAIN,
            () -> validator.validate(chain(leaf, otherRoot), "api.example.com", Instant.now())
        );
    }

    @Test
    public void rejectsHostnameMismatch() {
        ChainValidator validator = new ChainValidator(trustingRoot);

        assertError(ChainError.HOSTNAME_MISMATCH, () -> validator.validate(chain(leaf, root), "example.com", Instant.now()));
        assertError(
            ChainError.HOSTNAME_MISMATCH,
            () -> validator.validate(chain(leaf, root), "api.example.org", Instant.now())
        );
    }

    @Test
    public void rejectsExpiredCertificateAnywhereInChain() {
        ChainValidator validator = new ChainValidator(trustingRoot);

        assertError(
            ChainError.EXPIRED,
            () -> validator.validate(chain(expiredLeaf, root), "api.example.com", Instant.now())
        );
        Instant afterRootExpiry = root.certificate().getNotAfter().toInstant().plusSeconds(60);
        assertError(
            ChainError.EXPIRED,
            () -> validator.validate(chain(leaf, root), "api.example.com", afterRootExpiry)
        );
    }

    @Test
    public void rejectsNotYetValidCertificateAsExpired() {
        ChainValidator validator = new ChainValidator(trustingRoot);
        Instant beforeIssue = leaf.certificate().getNotBefore().toInstant().minusSeconds(60);

        assertError(ChainError.EXPIRED, () -> validator.validate(chain(leaf, root), "api.example.com", beforeIssue));
    }

    @Test
    public void hostnameIsCheckedBeforeExpiry() {
        ChainValidator validator = new ChainValidator(trustingRoot);

        assertError(
            ChainError.HOSTNAME_MISMATCH,
            () -> validator.validate(chain(expiredLeaf, root), "example.com", Instant.now())
        );
    }

    @Test
    public void rejectsChainNotAnchoredInTrustStore() throws Exception {
        Credential rogueLeaf = TestCertificates.leaf(otherRoot, "CN=api.example.com", "api.example.com");
        ChainValidator validator = new ChainValidator(trustingRoot);

        ChainValidationException e = assertError(
            ChainError.UNTRUSTED_ROOT,
            () -> validator.validate(chain(rogueLeaf, otherRoot), "api.example.com", Instant.now())
        );
        assertTrue(e.getCause() instanceof CertificateException);
    }

    @Test
    public void trustIsNotConsultedForExpiredChains() {
        RecordingVerifier verifier = new RecordingVerifier();
        ChainValidator validator = new ChainValidator(verifier);

        assertError(
            ChainError.EXPIRED,
            () -> validator.validate(chain(expiredLeaf, root), "api.example.com", Instant.now())
        );
        assertEquals(0, verifier.calls.size());
    }

    @Test
    public void passesReportedAuthTypeToTrustVerifier() throws Exception {
        RecordingVerifier verifier = new RecordingVerifier();
        ChainValidator validator = new ChainValidator(verifier);

        validator.validate(chain(leaf, root), "api.example.com", Instant.now(), "ECDHE_RSA");

        assertEquals(List.of("ECDHE_RSA"), verifier.calls);
    }

    @Test
    public void requiresTrustVerifier() {
        assertThrows(IllegalArgumentException.class, () -> new ChainValidator(null));
    }

    private static ChainValidationException assertError(ChainError expected, ThrowingValidation validation) {
        ChainValidationException e = assertThrows(ChainValidationException.class, validation::run);
        assertSame(expected, e.error());
        return e;
    }

    private static List<CertificateModel> chain(Credential... credentials) {
        List<CertificateModel> models = new ArrayList<>();
        try {
            for (int i = 0; i < credentials.length; i++) {
                models.add(CertificateModel.of(credentials[i].certificate(), i, ThumbprintAlgorithm.SHA1));
            }
        } catch (CertificateException e) {
            throw new AssertionError(e);
        }
        return models;
    }

    private interface ThrowingValidation {
        void run() throws Exception;
    }

    private static final class RecordingVerifier implements TrustAnchorVerifier {
        private final List<String> calls = new ArrayList<>();

        @Override
        public void verify(X509Certificate[] chain, String authType) {
            calls.add(String.valueOf(authType));
        }

        @Override
        public List<X509Certificate> trustAnchors() {
            return List.of();
        }
    }
}

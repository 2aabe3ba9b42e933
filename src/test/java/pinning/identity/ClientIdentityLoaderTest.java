package pinning.identity;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import pinning.TestCertificates;
import pinning.TestCertificates.Credential;
import pinning.cert.ThumbprintAlgorithm;

@RunWith(JUnit4.class)
public class ClientIdentityLoaderTest {
    private static final char[] PASSWORD = "bundle-secret".toCharArray();

    private static Credential clientRoot;
    private static Credential firstClient;
    private static Credential secondClient;
    private static byte[] singleIdentityBundle;

    @BeforeClass
    public static void createBundles() throws Exception {
        clientRoot = TestCertificates.root("CN=Client Root, O=Pinning Labs");
        firstClient = TestCertificates.leaf(clientRoot, "CN=first-client");
        secondClient = TestCertificates.leaf(clientRoot, "CN=second-client");
        singleIdentityBundle = TestCertificates.pkcs12(PASSWORD, clientRoot.certificate(), firstClient);
    }

    @Test
    public void loadsSingleIdentityWithChain() throws Exception {
        ClientIdentity identity = new ClientIdentityLoader().load(singleIdentityBundle, PASSWORD);

        assertEquals("first-client", identity.leaf().subjectCn());
        assertEquals(2, identity.certificateChain().size());
        assertEquals(firstClient.certificate(), identity.x509Chain()[0]);
        assertEquals(clientRoot.certificate(), identity.x509Chain()[1]);
        assertEquals("RSA", identity.keyAlgorithm());
    }

    @Test
    public void usesConfiguredThumbprintAlgorithm() throws Exception {
        ClientIdentity identity = new ClientIdentityLoader(ThumbprintAlgorithm.SHA256).load(singleIdentityBundle, PASSWORD);

        assertEquals(32, identity.leaf().thumbprint().length);
    }

    @Test
    public void wrongPassphraseIsBadPassphrase() {
        ClientIdentityLoader loader = new ClientIdentityLoader();

        IdentityLoadException e = assertThrows(
            IdentityLoadException.class,
            () -> loader.load(singleIdentityBundle, "wrong".toCharArray())
        );
        assertSame(IdentityError.BAD_PASSPHRASE, e.error());
        assertFalse(loader.cached().isPresent());
    }

    @Test
    public void missingPassphraseIsBadPassphrase() {
        IdentityLoadException e = assertThrows(
            IdentityLoadException.class,
            () -> new ClientIdentityLoader().load(singleIdentityBundle, null)
        );
        assertSame(IdentityError.BAD_PASSPHRASE, e.error());
    }

    @Test
    public void garbageBytesAreMalformed() {
        IdentityLoadException e = assertThrows(
            IdentityLoadException.class,
            () -> new ClientIdentityLoader().load("definitely not pkcs12".getBytes(StandardCharsets.US_ASCII), PASSWORD)
        );
        assertSame(IdentityError.MALFORMED, e.error());
    }

    @Test
    public void emptyBundleIsMalformed() {
        IdentityLoadException e = assertThrows(
            IdentityLoadException.class,
            () -> new ClientIdentityLoader().load(new byte[0], PASSWORD)
        );
        assertSame(IdentityError.MALFORMED, e.error());
    }

    @Test
    public void certificateOnlyBundleHasNoIdentity() throws Exception {
        byte[] bundle = TestCertificates.certificateOnlyPkcs12(PASSWORD, clientRoot.certificate());

        IdentityLoadException e = assertThrows(
            IdentityLoadException.class,
            () -> new ClientIdentityLoader().load(bundle, PASSWORD)
        );
        assertSame(IdentityError.NO_IDENTITY, e.error());
    }

    @Test
    public void firstEntryWinsWhenBundleHoldsSeveralIdentities() throws Exception {
        byte[] bundle = TestCertificates.pkcs12(PASSWORD, clientRoot.certificate(), firstClient, secondClient);

        ClientIdentity identity = new ClientIdentityLoader().load(bundle, PASSWORD);

        assertEquals("client-0", identity.alias());
        assertEquals("first-client", identity.leaf().subjectCn());
    }

    @Test
    public void secondLoadReturnsCachedIdentityWithoutDecoding() throws Exception {
        ClientIdentityLoader loader = new ClientIdentityLoader();

        ClientIdentity first = loader.load(singleIdentityBundle, PASSWORD);
        ClientIdentity second = loader.load(singleIdentityBundle.clone(), PASSWORD);

        assertSame(first, second);
        assertEquals(1, loader.decodeCount());
        assertSame(first, loader.cached().get());
    }

    @Test
    public void failedLoadIsNotCached() throws Exception {
        ClientIdentityLoader loader = new ClientIdentityLoader();

        assertThrows(IdentityLoadException.class, () -> loader.load(singleIdentityBundle, "wrong".toCharArray()));
        ClientIdentity identity = loader.load(singleIdentityBundle, PASSWORD);

        assertEquals("first-client", identity.leaf().subjectCn());
        assertEquals(2, loader.decodeCount());
    }

    @Test
    public void differentBundleAfterLoadIsRefused() throws Exception {
        ClientIdentityLoader loader = new ClientIdentityLoader();
        loader.load(singleIdentityBundle, PASSWORD);
        byte[] otherBundle = TestCertificates.pkcs12(PASSWORD, clientRoot.certificate(), secondClient);

        assertThrows(IllegalStateException.class, () -> loader.load(otherBundle, PASSWORD));
    }

    @Test
    public void concurrentFirstLoadsDecodeOnce() throws Exception {
        ClientIdentityLoader loader = new ClientIdentityLoader();
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<ClientIdentity>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<ClientIdentity> task = () -> {
                    start.await();
                    return loader.load(singleIdentityBundle, PASSWORD);
                };
                results.add(executor.submit(task));
            }
            start.countDown();
            ClientIdentity first = results.get(0).get();
            for (Future<ClientIdentity> result : results) {
                assertSame(first, result.get());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, loader.decodeCount());
    }

    @Test
    public void disposeDestroysCachedIdentity() throws Exception {
        ClientIdentityLoader loader = new ClientIdentityLoader();
        ClientIdentity identity = loader.load(singleIdentityBundle, PASSWORD);

        loader.dispose();

        assertTrue(identity.isDestroyed());
        assertThrows(IllegalStateException.class, identity::privateKey);
        assertFalse(identity.toString().contains("PRIVATE"));
    }
}

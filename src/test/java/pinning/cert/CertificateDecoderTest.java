package pinning.cert;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import pinning.TestCertificates;
import pinning.TestCertificates.Credential;

@RunWith(JUnit4.class)
public class CertificateDecoderTest {
    private static Credential root;

    @BeforeClass
    public static void createCertificates() throws Exception {
        root = TestCertificates.root("CN=Decoder Root, O=Pinning Labs");
    }

    @Test
    public void decodesBase64Der() throws Exception {
        CertificateModel model = CertificateModel.of(root.certificate(), 0);

        X509Certificate decoded = CertificateDecoder.decodeBase64(CertificateDecoder.encodeBase64(model));

        assertEquals(root.certificate(), decoded);
    }

    @Test
    public void decodesPemWithLineBreaks() throws Exception {
        String pem = CertificateDecoder.encodePem(CertificateModel.of(root.certificate(), 0));

        assertTrue(pem.startsWith("-----BEGIN CERTIFICATE-----\n"));
        assertEquals(root.certificate(), CertificateDecoder.decodeSingle(pem.getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    public void rejectsBlankAndInvalidInput() {
        assertThrows(CertificateException.class, () -> CertificateDecoder.decodeBase64("  "));
        assertThrows(CertificateException.class, () -> CertificateDecoder.decodeBase64("not base64 at all!"));
        assertThrows(CertificateException.class, () -> CertificateDecoder.decodeBase64("AAAA"));
    }
}

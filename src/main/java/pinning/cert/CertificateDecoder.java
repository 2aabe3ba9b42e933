package pinning.cert;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;

public final class CertificateDecoder {
    private CertificateDecoder() {
    }

    public static X509Certificate decodeBase64(String base64Der) throws CertificateException {
        if (base64Der == null || base64Der.isBlank()) {
            throw new CertificateException("Certificate value is empty");
        }
        byte[] der;
        try {
            der = Base64.getMimeDecoder().decode(base64Der.trim());
        } catch (IllegalArgumentException e) {
            throw new CertificateException("Certificate value is not valid Base64", e);
        }
        return decodeSingle(der);
    }

    public static X509Certificate decodeSingle(byte[] encoded) throws CertificateException {
        List<X509Certificate> certificates = decodeAll(encoded);
        if (certificates.size() != 1) {
            throw new CertificateException("Expected exactly one certificate, found " + certificates.size());
        }
        return certificates.get(0);
    }

    /**
     * Parses DER or PEM input; PEM input may hold several certificates.
     */
    public static List<X509Certificate> decodeAll(byte[] encoded) throws CertificateException {
        if (encoded == null || encoded.length == 0) {
            throw new CertificateException("Certificate bytes are empty");
        }
        CertificateFactory factory = CertificateFactory.getInstance("X.509");
        Collection<? extends Certificate> generated = factory.generateCertificates(new ByteArrayInputStream(encoded));
        List<X509Certificate> certificates = new ArrayList<>();
        for (Certificate cert : generated) {
            if (cert instanceof X509Certificate x509) {
                certificates.add(x509);
            }
        }
        return certificates;
    }

    public static String encodeBase64(CertificateModel certificate) {
        return Base64.getEncoder().encodeToString(certificate.rawBytes());
    }

    public static String encodePem(CertificateModel certificate) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
            .encodeToString(certificate.rawBytes());
        return "-----BEGIN CERTIFICATE-----\n" + body + "\n-----END CERTIFICATE-----\n";
    }
}

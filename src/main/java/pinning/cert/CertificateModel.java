package pinning.cert;

import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import javax.security.auth.x500.X500Principal;

/**
 * Immutable view of a parsed X.509 certificate as it appears at one position of a presented chain.
 *
 * <p>The thumbprint is always derived from the encoded bytes when the model is built; callers cannot
 * supply one. Missing CN or O attributes are represented as empty strings.
 */
public final class CertificateModel {
    private static final int SAN_DNS_NAME = 2;
    private static final int SAN_IP_ADDRESS = 7;

    private final X509Certificate certificate;
    private final byte[] rawBytes;
    private final int chainIndex;
    private final ThumbprintAlgorithm thumbprintAlgorithm;
    private final byte[] thumbprint;
    private final String subjectDn;
    private final String issuerDn;
    private final String subjectCn;
    private final String issuerCn;
    private final String issuerO;
    private final String serialNumberHex;
    private final Instant notBefore;
    private final Instant notAfter;
    private final List<String> dnsNames;
    private final List<String> ipAddresses;

    private CertificateModel(X509Certificate certificate, int chainIndex, ThumbprintAlgorithm thumbprintAlgorithm)
        throws CertificateException {
        this.certificate = certificate;
        this.rawBytes = certificate.getEncoded();
        this.chainIndex = chainIndex;
        this.thumbprintAlgorithm = thumbprintAlgorithm;
        this.thumbprint = thumbprintAlgorithm.digest(rawBytes);
        this.subjectDn = certificate.getSubjectX500Principal().getName();
        this.issuerDn = certificate.getIssuerX500Principal().getName();
        this.subjectCn = attribute(certificate.getSubjectX500Principal(), "CN");
        this.issuerCn = attribute(certificate.getIssuerX500Principal(), "CN");
        this.issuerO = attribute(certificate.getIssuerX500Principal(), "O");
        this.serialNumberHex = certificate.getSerialNumber().toString(16);
        this.notBefore = certificate.getNotBefore().toInstant();
        this.notAfter = certificate.getNotAfter().toInstant();
        this.dnsNames = alternativeNames(certificate, SAN_DNS_NAME);
        this.ipAddresses = alternativeNames(certificate, SAN_IP_ADDRESS);
    }

    public static CertificateModel of(X509Certificate certificate, int chainIndex, ThumbprintAlgorithm algorithm)
        throws CertificateException {
        Objects.requireNonNull(certificate, "certificate");
        Objects.requireNonNull(algorithm, "algorithm");
        if (chainIndex < 0) {
            throw new IllegalArgumentException("Chain index must not be negative: " + chainIndex);
        }
        return new CertificateModel(certificate, chainIndex, algorithm);
    }

    public static CertificateModel of(X509Certificate certificate, int chainIndex) throws CertificateException {
        return of(certificate, chainIndex, ThumbprintAlgorithm.SHA1);
    }

    public static List<CertificateModel> chainOf(X509Certificate[] chain, ThumbprintAlgorithm algorithm)
        throws CertificateException {
        List<CertificateModel> models = new ArrayList<>();
        for (int i = 0; i < chain.length; i++) {
            if (chain[i] == null) {
                throw new CertificateException("Certificate at chain position " + i + " is missing");
            }
            models.add(of(chain[i], i, algorithm));
        }
        return List.copyOf(models);
    }

    public X509Certificate certificate() {
        return certificate;
    }

    public byte[] rawBytes() {
        return rawBytes.clone();
    }

    public int chainIndex() {
        return chainIndex;
    }

    public boolean isLeaf() {
        return chainIndex == 0;
    }

    public ThumbprintAlgorithm thumbprintAlgorithm() {
        return thumbprintAlgorithm;
    }

    public byte[] thumbprint() {
        return thumbprint.clone();
    }

    public byte[] thumbprint(ThumbprintAlgorithm algorithm) {
        if (algorithm == thumbprintAlgorithm) {
            return thumbprint.clone();
        }
        return algorithm.digest(rawBytes);
    }

    public String thumbprintHex() {
        return HexFormat.of().withUpperCase().formatHex(thumbprint);
    }

    public String subjectDn() {
        return subjectDn;
    }

    public String issuerDn() {
        return issuerDn;
    }

    public String subjectCn() {
        return subjectCn;
    }

    public String issuerCn() {
        return issuerCn;
    }

    public String issuerO() {
        return issuerO;
    }

    public String serialNumberHex() {
        return serialNumberHex;
    }

    public Instant notBefore() {
        return notBefore;
    }

    public Instant notAfter() {
        return notAfter;
    }

    public List<String> dnsNames() {
        return dnsNames;
    }

    public List<String> ipAddresses() {
        return ipAddresses;
    }

    public boolean isSelfIssued() {
        return certificate.getIssuerX500Principal().equals(certificate.getSubjectX500Principal());
    }

    public boolean isValidAt(Instant instant) {
        return !instant.isBefore(notBefore) && !instant.isAfter(notAfter);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CertificateModel that)) {
            return false;
        }
        return chainIndex == that.chainIndex && Arrays.equals(rawBytes, that.rawBytes);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(rawBytes) + chainIndex;
    }

    @Override
    public String toString() {
        return "CertificateModel[" + chainIndex + "] subject=" + subjectDn + ", issuer=" + issuerDn
            + ", " + thumbprintAlgorithm.digestName() + "=" + thumbprintHex();
    }

    private static String attribute(X500Principal principal, String type) {
        try {
            LdapName name = new LdapName(principal.getName(X500Principal.RFC2253));
            // LdapName indexes RDNs right to left; the leftmost (most specific) value wins.
            for (int i = name.size() - 1; i >= 0; i--) {
                Rdn rdn = name.getRdns().get(i);
                if (type.equalsIgnoreCase(rdn.getType())) {
                    return String.valueOf(rdn.getValue());
                }
            }
            return "";
        } catch (InvalidNameException e) {
            throw new IllegalArgumentException("Distinguished name cannot be parsed: " + principal, e);
        }
    }

    private static List<String> alternativeNames(X509Certificate certificate, int wantedType)
        throws CertificateException {
        Collection<List<?>> sanEntries = certificate.getSubjectAlternativeNames();
        if (sanEntries == null || sanEntries.isEmpty()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (List<?> entry : sanEntries) {
            if (entry == null || entry.size() < 2) {
                continue;
            }
            Object typeObj = entry.get(0);
            Object valueObj = entry.get(1);
            if (typeObj instanceof Integer type && type == wantedType && valueObj instanceof String value) {
                result.add(value);
            }
        }
        return List.copyOf(result);
    }
}

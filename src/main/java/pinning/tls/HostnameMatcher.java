package pinning.tls;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import pinning.cert.CertificateModel;

/**
 * Matches a requested host against the identity of a leaf certificate.
 *
 * <p>Subject Alternative Names take precedence: when a certificate carries any dNSName entries the subject
 * CN is ignored. A {@code *.} prefix stands for exactly one non-empty left-most label and is only honoured
 * with at least two labels after it. IP literals are compared by address bytes against iPAddress entries, so
 * {@code ::1} matches an entry the platform renders as {@code 0:0:0:0:0:0:0:1}.
 */
public final class HostnameMatcher {
    private static final Pattern IPV4_LITERAL = Pattern.compile(
        "(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(\\.(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)){3}"
    );

    private HostnameMatcher() {
    }

    public static boolean matches(CertificateModel leaf, String requestedHostname) {
        String hostname = normalize(requestedHostname);
        if (hostname.isEmpty()) {
            return false;
        }
        if (isIpLiteral(hostname)) {
            byte[] requested = addressBytes(hostname);
            return requested != null && leaf.ipAddresses().stream()
                .map(ip -> addressBytes(normalize(ip)))
                .anyMatch(presented -> Arrays.equals(requested, presented));
        }
        List<String> dnsNames = leaf.dnsNames();
        if (!dnsNames.isEmpty()) {
            return dnsNames.stream().anyMatch(pattern -> matchesPattern(hostname, pattern));
        }
        return matchesPattern(hostname, leaf.subjectCn());
    }

    static boolean matchesPattern(String hostname, String rawPattern) {
        String pattern = normalize(rawPattern);
        if (pattern.isEmpty()) {
            return false;
        }
        if (!pattern.startsWith("*.")) {
            return !pattern.contains("*") && pattern.equals(hostname);
        }
        String suffix = pattern.substring(1);
        if (suffix.indexOf('*') >= 0 || suffix.indexOf('.', 1) < 0) {
            return false;
        }
        if (!hostname.endsWith(suffix)) {
            return false;
        }
        String firstLabel = hostname.substring(0, hostname.length() - suffix.length());
        return !firstLabel.isEmpty() && firstLabel.indexOf('.') < 0;
    }

    private static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String trimmed = name.trim().toLowerCase(Locale.ROOT);
        if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed.endsWith(".") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private static boolean isIpLiteral(String hostname) {
        return hostname.indexOf(':') >= 0 || IPV4_LITERAL.matcher(hostname).matches();
    }

    /**
     * @return the address bytes, or {@code null} when the value is not a valid address literal
     */
    private static byte[] addressBytes(String literal) {
        // Only literals reach InetAddress, which then never performs a lookup.
        if (literal.isEmpty() || !isIpLiteral(literal)) {
            return null;
        }
        try {
            return InetAddress.getByName(literal).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }
}

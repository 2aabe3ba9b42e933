package pinning.check;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.List;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLSession;
import javax.net.ssl.SSLSocket;
import pinning.cert.CertificateModel;
import pinning.handshake.HandshakeAttempt;
import pinning.handshake.HandshakeCallbacks;
import pinning.handshake.HandshakeDecisionOrchestrator;
import pinning.handshake.HandshakeState;
import pinning.handshake.PinnedSslContextFactory;
import pinning.handshake.ValidationOutcome;

/**
 * Runs one pinned mutual-TLS handshake against a host and reports what the engine decided.
 */
public class PinCheckService {
    private static final int CONNECT_TIMEOUT_MS = 5000;
    private static final int READ_TIMEOUT_MS = 5000;

    private final HandshakeDecisionOrchestrator orchestrator;

    public PinCheckService(HandshakeDecisionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public PinCheckReport check(String host, int port) {
        if (host == null || host.isBlank()) {
            return new PinCheckReport(false, "Host is required", null, List.of(), false);
        }
        RecordingCallbacks recorder = new RecordingCallbacks(orchestrator);
        String target = host + ":" + port;
        try {
            SSLContext context = PinnedSslContextFactory.create(recorder, orchestrator.clientIdentity().orElse(null));
            try (Socket raw = new Socket()) {
                raw.connect(new InetSocketAddress(host, port), CONNECT_TIMEOUT_MS);
                raw.setSoTimeout(READ_TIMEOUT_MS);
                try (SSLSocket socket = (SSLSocket) context.getSocketFactory().createSocket(raw, host, port, true)) {
                    socket.startHandshake();
                    SSLSession session = socket.getSession();
                    return report(true, "Pinned handshake with " + target + " succeeded (" + session.getProtocol() + ")", recorder);
                }
            }
        } catch (UnknownHostException e) {
            return report(false, "Pin check failed: host is unreachable or DNS name is invalid (" + host + ")", recorder);
        } catch (ConnectException e) {
            return report(false, "Pin check failed: unable to reach " + target + " (connection refused/unreachable)", recorder);
        } catch (SocketTimeoutException e) {
            return report(false, "Pin check failed: network timeout while connecting or during TLS handshake to " + target, recorder);
        } catch (SSLHandshakeException e) {
            return report(false, "Pin check failed: handshake with " + target + " was aborted (" + safeMessage(e) + ")", recorder);
        } catch (SSLException e) {
            return report(false, "Pin check failed: TLS negotiation with " + target + " failed (" + safeMessage(e) + ")", recorder);
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            return report(false, "Pin check failed: " + safeMessage(e), recorder);
        }
    }

    private PinCheckReport report(boolean connected, String message, RecordingCallbacks recorder) {
        HandshakeAttempt attempt = recorder.lastAttempt;
        if (attempt == null) {
            return new PinCheckReport(false, message, null, List.of(), false);
        }
        ValidationOutcome outcome = attempt.outcome().orElse(null);
        boolean supplied = attempt.state() == HandshakeState.CLIENT_CERT_SUPPLIED;
        String fullMessage = message;
        List<CertificateModel> chain = List.of();
        try {
            chain = CertificateModel.chainOf(
                attempt.presentedChain().toArray(X509Certificate[]::new),
                orchestrator.thumbprintAlgorithm()
            );
        } catch (CertificateException e) {
            fullMessage = message + "; presented chain cannot be decoded (" + safeMessage(e) + ")";
        }
        boolean success = connected && outcome != null && outcome.accepted();
        return new PinCheckReport(success, fullMessage, outcome, chain, supplied);
    }

    private static String safeMessage(Throwable t) {
        if (t == null || t.getMessage() == null || t.getMessage().isBlank()) {
            return t == null ? "unknown error" : t.getClass().getSimpleName();
        }
        return t.getMessage();
    }

    private static final class RecordingCallbacks implements HandshakeCallbacks {
        private final HandshakeCallbacks delegate;
        private volatile HandshakeAttempt lastAttempt;

        private RecordingCallbacks(HandshakeCallbacks delegate) {
            this.delegate = delegate;
        }

        @Override
        public HandshakeAttempt beginHandshake(String hostname) {
            HandshakeAttempt attempt = delegate.beginHandshake(hostname);
            lastAttempt = attempt;
            return attempt;
        }
    }
}

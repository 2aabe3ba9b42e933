package pinning.handshake;

import java.net.Socket;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.Optional;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLSession;
import javax.net.ssl.SSLSessionBindingEvent;
import javax.net.ssl.SSLSessionBindingListener;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.X509ExtendedTrustManager;

/**
 * JSSE binding of the "received server certificate" step. Each call begins a {@link HandshakeAttempt}
 * for the peer host of the handshake session and keeps it in that session for
 * {@link ClientIdentityKeyManager}.
 */
public class PinningTrustManager extends X509ExtendedTrustManager {
    static final String ATTEMPT_SESSION_KEY = "pinning.handshake.attempt";

    private final HandshakeCallbacks callbacks;

    public PinningTrustManager(HandshakeCallbacks callbacks) {
        if (callbacks == null) {
            throw new IllegalArgumentException("Handshake callbacks must not be null");
        }
        this.callbacks = callbacks;
    }

    public static Optional<HandshakeAttempt> attemptOf(SSLSession session) {
        if (session == null) {
            return Optional.empty();
        }
        Object value = session.getValue(ATTEMPT_SESSION_KEY);
        if (value instanceof AttemptBinding binding) {
            return Optional.of(binding.attempt());
        }
        return Optional.empty();
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket)
        throws CertificateException {
        if (!(socket instanceof SSLSocket sslSocket)) {
            throw new CertificateException("Server chain can only be validated on a TLS socket");
        }
        validate(chain, authType, sslSocket.getHandshakeSession());
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine)
        throws CertificateException {
        if (engine == null) {
            throw new CertificateException("Server chain can only be validated with a TLS engine");
        }
        validate(chain, authType, engine.getHandshakeSession());
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        throw new CertificateException("Server chain cannot be validated without the handshake's peer host");
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket)
        throws CertificateException {
        checkClientTrusted(chain, authType);
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine)
        throws CertificateException {
        checkClientTrusted(chain, authType);
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        throw new CertificateException("This trust manager only validates servers");
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return new X509Certificate[0];
    }

    private void validate(X509Certificate[] chain, String authType, SSLSession handshakeSession)
        throws CertificateException {
        if (handshakeSession == null) {
            throw new CertificateException("Not in handshake; no session available");
        }
        HandshakeAttempt attempt = callbacks.beginHandshake(handshakeSession.getPeerHost());
        handshakeSession.putValue(ATTEMPT_SESSION_KEY, new AttemptBinding(attempt));
        ValidationOutcome outcome = attempt.presentChainForValidation(chain, authType);
        if (!outcome.accepted()) {
            throw new HandshakeRejectedException(outcome);
        }
    }

    private record AttemptBinding(HandshakeAttempt attempt) implements SSLSessionBindingListener {
        @Override
        public void valueBound(SSLSessionBindingEvent event) {
        }

        @Override
        public void valueUnbound(SSLSessionBindingEvent event) {
            attempt.close();
        }
    }
}

package pinning.handshake;

import java.net.Socket;
import java.security.Principal;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Optional;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLSession;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.X509ExtendedKeyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pinning.identity.ClientIdentity;

/**
 * JSSE binding of the "server requests client certificate" step. The client alias is offered only to a
 * handshake whose server chain was accepted by {@link PinningTrustManager}.
 */
public class ClientIdentityKeyManager extends X509ExtendedKeyManager {
    private static final Logger log = LoggerFactory.getLogger(ClientIdentityKeyManager.class);

    private final ClientIdentity identity;

    /**
     * @param identity the pre-loaded identity, or {@code null} to never present a client certificate
     */
    public ClientIdentityKeyManager(ClientIdentity identity) {
        this.identity = identity;
    }

    @Override
    public String chooseClientAlias(String[] keyTypes, Principal[] issuers, Socket socket) {
        SSLSession session = socket instanceof SSLSocket sslSocket ? sslSocket.getHandshakeSession() : null;
        return chooseFor(keyTypes, session);
    }

    @Override
    public String chooseEngineClientAlias(String[] keyTypes, Principal[] issuers, SSLEngine engine) {
        return chooseFor(keyTypes, engine == null ? null : engine.getHandshakeSession());
    }

    @Override
    public String[] getClientAliases(String keyType, Principal[] issuers) {
        if (identity == null || identity.isDestroyed() || !identity.keyAlgorithm().equals(keyType)) {
            return null;
        }
        return new String[] {identity.alias()};
    }

    @Override
    public X509Certificate[] getCertificateChain(String alias) {
        if (!ownsAlias(alias)) {
            return null;
        }
        return identity.x509Chain();
    }

    @Override
    public PrivateKey getPrivateKey(String alias) {
        if (!ownsAlias(alias)) {
            return null;
        }
        return identity.privateKey();
    }

    @Override
    public String[] getServerAliases(String keyType, Principal[] issuers) {
        throw new UnsupportedOperationException("getServerAliases(String, Principal[]) not supported for client");
    }

    @Override
    public String chooseServerAlias(String keyType, Principal[] issuers, Socket socket) {
        throw new UnsupportedOperationException("chooseServerAlias(String, Principal[], Socket) not supported for client");
    }

    @Override
    public String chooseEngineServerAlias(String keyType, Principal[] issuers, SSLEngine engine) {
        throw new UnsupportedOperationException("chooseEngineServerAlias(String, Principal[], SSLEngine) not supported for client");
    }

    private String chooseFor(String[] keyTypes, SSLSession handshakeSession) {
        if (identity == null || identity.isDestroyed() || !supportsAnyKeyType(keyTypes)) {
            return null;
        }
        Optional<HandshakeAttempt> attempt = PinningTrustManager.attemptOf(handshakeSession);
        if (attempt.isEmpty() || !attempt.get().isAccepted()) {
            log.warn("Client certificate requested before the server chain was accepted; none presented");
            return null;
        }
        return attempt.get().supplyClientIdentity()
            .map(ClientIdentity::alias)
            .orElse(null);
    }

    private boolean supportsAnyKeyType(String[] keyTypes) {
        if (keyTypes == null) {
            return false;
        }
        String keyAlgorithm = identity.keyAlgorithm();
        for (String keyType : keyTypes) {
            if (keyAlgorithm.equals(keyType)) {
                return true;
            }
        }
        return false;
    }

    private boolean ownsAlias(String alias) {
        return identity != null && alias != null && alias.equals(identity.alias());
    }
}

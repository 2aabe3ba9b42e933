package pinning.handshake;

import java.security.GeneralSecurityException;
import javax.net.ssl.KeyManager;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import pinning.identity.ClientIdentity;

public final class PinnedSslContextFactory {
    private PinnedSslContextFactory() {
    }

    public static SSLContext create(HandshakeDecisionOrchestrator orchestrator) throws GeneralSecurityException {
        return create(orchestrator, orchestrator.clientIdentity().orElse(null));
    }

    public static SSLContext create(HandshakeCallbacks callbacks, ClientIdentity identity)
        throws GeneralSecurityException {
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(
            new KeyManager[] {new ClientIdentityKeyManager(identity)},
            new TrustManager[] {new PinningTrustManager(callbacks)},
            null
        );
        return context;
    }
}

package pinning;

import java.io.IOException;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.time.Clock;
import java.util.Optional;
import javax.net.ssl.SSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pinning.config.PinningSettings;
import pinning.handshake.HandshakeDecisionOrchestrator;
import pinning.handshake.PinnedHttpClientFactory;
import pinning.handshake.PinnedSslContextFactory;
import pinning.identity.ClientIdentity;
import pinning.identity.ClientIdentityLoader;
import pinning.identity.IdentityError;
import pinning.identity.IdentityLoadException;
import pinning.pin.LoggingPinBootstrapChannel;
import pinning.pin.PinBootstrapChannel;
import pinning.pin.PinningReference;
import pinning.tls.ChainValidator;
import pinning.tls.TrustAnchorVerifier;

/**
 * A pinned mutual-TLS client: the reference, the client identity and the orchestrator are built once here and
 * shared by every connection made through {@link #sslContext()} or {@link #httpClient()}.
 *
 * <p>Construction fails when no client bundle is configured or when it cannot be turned into an identity;
 * no connection is ever attempted without one.
 */
public final class PinningClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PinningClient.class);

    private final PinningSettings settings;
    private final ClientIdentityLoader identityLoader;
    private final HandshakeDecisionOrchestrator orchestrator;
    private final SSLContext sslContext;

    private PinningClient(
        PinningSettings settings,
        ClientIdentityLoader identityLoader,
        HandshakeDecisionOrchestrator orchestrator,
        SSLContext sslContext
    ) {
        this.settings = settings;
        this.identityLoader = identityLoader;
        this.orchestrator = orchestrator;
        this.sslContext = sslContext;
    }

    public static PinningClient create(PinningSettings settings, TrustAnchorVerifier trustAnchors)
        throws GeneralSecurityException {
        return create(settings, trustAnchors, null, Clock.systemUTC());
    }

    /**
     * @param bootstrapChannel receives roots in bootstrap mode; {@code null} selects the logging channel.
     *                         Only used when the settings enable bootstrap disclosure.
     */
    public static PinningClient create(
        PinningSettings settings,
        TrustAnchorVerifier trustAnchors,
        PinBootstrapChannel bootstrapChannel,
        Clock clock
    ) throws GeneralSecurityException {
        PinningReference reference = null;
        if (settings.hasReference()) {
            try {
                reference = PinningReference.fromBase64Der(
                    settings.serverCertificateReference(),
                    settings.thumbprintAlgorithm()
                );
            } catch (CertificateException e) {
                throw new CertificateException(PinningSettings.ENV_SERVER_CERT + " cannot be parsed: " + e.getMessage(), e);
            }
        } else {
            log.warn("No pinning reference configured; every handshake will be rejected");
        }

        ClientIdentityLoader identityLoader = new ClientIdentityLoader(settings.thumbprintAlgorithm());
        if (!settings.hasClientBundle()) {
            throw new IdentityLoadException(
                IdentityError.NO_IDENTITY,
                "No client bundle configured; set " + PinningSettings.ENV_CLIENT_P12 + " or " + PinningSettings.ENV_CLIENT_P12_PATH
            );
        }
        byte[] bundle;
        try {
            bundle = settings.resolveClientBundle();
        } catch (IOException e) {
            throw new IdentityLoadException(IdentityError.MALFORMED, "Client bundle cannot be read: " + e.getMessage(), e);
        }
        ClientIdentity identity = identityLoader.load(bundle, settings.clientPkcs12Passphrase());

        PinBootstrapChannel channel = PinBootstrapChannel.DISABLED;
        if (settings.bootstrapEnabled()) {
            channel = bootstrapChannel == null ? new LoggingPinBootstrapChannel() : bootstrapChannel;
        }

        HandshakeDecisionOrchestrator orchestrator = HandshakeDecisionOrchestrator.builder(new ChainValidator(trustAnchors))
            .setReference(reference)
            .setClientIdentity(identity)
            .setBootstrapChannel(channel)
            .setClock(clock)
            .setThumbprintAlgorithm(settings.thumbprintAlgorithm())
            .build();
        SSLContext sslContext = PinnedSslContextFactory.create(orchestrator);
        log.info("Pinning client ready: {}", settings);
        return new PinningClient(settings, identityLoader, orchestrator, sslContext);
    }

    public PinningSettings settings() {
        return settings;
    }

    public HandshakeDecisionOrchestrator orchestrator() {
        return orchestrator;
    }

    public Optional<ClientIdentity> clientIdentity() {
        return orchestrator.clientIdentity();
    }

    public SSLContext sslContext() {
        return sslContext;
    }

    public HttpClient httpClient() {
        return PinnedHttpClientFactory.create(sslContext);
    }

    @Override
    public void close() {
        identityLoader.dispose();
    }
}

package pinning.handshake;

import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pinning.cert.CertificateModel;
import pinning.cert.ThumbprintAlgorithm;
import pinning.identity.ClientIdentity;
import pinning.pin.PinBootstrapChannel;
import pinning.pin.PinField;
import pinning.pin.PinMatcher;
import pinning.pin.PinMismatchException;
import pinning.pin.PinningReference;
import pinning.tls.ChainError;
import pinning.tls.ChainValidationException;
import pinning.tls.ChainValidator;

/**
 * Composes chain validation and pin matching into the accept/reject decision for each handshake, and hands
 * the pre-loaded client identity to accepted handshakes.
 *
 * <p>One instance is built per client and passed to the transport binding. It holds no mutable state, so
 * concurrent handshakes share it freely.
 */
public class HandshakeDecisionOrchestrator implements HandshakeCallbacks {
    private static final Logger log = LoggerFactory.getLogger(HandshakeDecisionOrchestrator.class);

    private final ChainValidator chainValidator;
    private final PinMatcher pinMatcher;
    private final PinningReference reference;
    private final ClientIdentity clientIdentity;
    private final PinBootstrapChannel bootstrapChannel;
    private final Clock clock;
    private final ThumbprintAlgorithm thumbprintAlgorithm;

    private HandshakeDecisionOrchestrator(Builder builder) {
        if (builder.chainValidator == null) {
            throw new IllegalArgumentException("Chain validator must not be null");
        }
        this.chainValidator = builder.chainValidator;
        this.pinMatcher = builder.pinMatcher;
        this.reference = builder.reference;
        this.clientIdentity = builder.clientIdentity;
        this.bootstrapChannel = builder.bootstrapChannel;
        this.clock = builder.clock;
        this.thumbprintAlgorithm = builder.reference == null
            ? builder.thumbprintAlgorithm
            : builder.reference.thumbprintAlgorithm();
    }

    public static Builder builder(ChainValidator chainValidator) {
        return new Builder(chainValidator);
    }

    @Override
    public HandshakeAttempt beginHandshake(String hostname) {
        return new HandshakeAttempt(hostname, this);
    }

    public Optional<PinningReference> reference() {
        return Optional.ofNullable(reference);
    }

    public Optional<ClientIdentity> clientIdentity() {
        return Optional.ofNullable(clientIdentity);
    }

    public ThumbprintAlgorithm thumbprintAlgorithm() {
        return thumbprintAlgorithm;
    }

    /**
     * Runs the chain gate, then the pin gate. The pin is never evaluated for a chain that failed validation.
     */
    public ValidationOutcome evaluate(X509Certificate[] presentedChain, String hostname, String authType) {
        ValidationOutcome outcome = decide(presentedChain, hostname, authType);
        if (outcome.accepted()) {
            log.debug("Handshake with {} accepted", hostname);
        } else {
            log.warn("Handshake with {} rejected. {}", hostname, outcome.describe());
        }
        return outcome;
    }

    private ValidationOutcome decide(X509Certificate[] presentedChain, String hostname, String authType) {
        List<CertificateModel> chain;
        try {
            chain = CertificateModel.chainOf(
                presentedChain == null ? new X509Certificate[0] : presentedChain,
                thumbprintAlgorithm
            );
        } catch (CertificateException | IllegalArgumentException e) {
            return new ValidationOutcome.RejectedChain(ChainError.MALFORMED_CHAIN, safeMessage(e));
        }

        CertificateModel root;
        try {
            root = chainValidator.validate(chain, hostname, clock.instant(), authType);
        } catch (ChainValidationException e) {
            return new ValidationOutcome.RejectedChain(e.error(), safeMessage(e));
        }

        if (reference == null) {
            bootstrapChannel.rootCertificatePresented(hostname, root);
        }
        try {
            pinMatcher.matches(root, reference);
        } catch (PinMismatchException e) {
            return new ValidationOutcome.RejectedPin(e.field(), root, safeMessage(e));
        }
        return new ValidationOutcome.Accepted(root);
    }

    private static String safeMessage(Throwable t) {
        if (t.getMessage() == null || t.getMessage().isBlank()) {
            return t.getClass().getSimpleName();
        }
        return t.getMessage();
    }

    public static class Builder {
        private final ChainValidator chainValidator;
        private PinMatcher pinMatcher = new PinMatcher();
        private PinningReference reference;
        private ClientIdentity clientIdentity;
        private PinBootstrapChannel bootstrapChannel = PinBootstrapChannel.DISABLED;
        private Clock clock = Clock.systemUTC();
        private ThumbprintAlgorithm thumbprintAlgorithm = ThumbprintAlgorithm.SHA1;

        private Builder(ChainValidator chainValidator) {
            this.chainValidator = chainValidator;
        }

        public Builder setPinMatcher(PinMatcher pinMatcher) {
            this.pinMatcher = pinMatcher;
            return this;
        }

        public Builder setReference(PinningReference reference) {
            this.reference = reference;
            return this;
        }

        public Builder setClientIdentity(ClientIdentity clientIdentity) {
            this.clientIdentity = clientIdentity;
            return this;
        }

        public Builder setBootstrapChannel(PinBootstrapChannel bootstrapChannel) {
            this.bootstrapChannel = bootstrapChannel == null ? PinBootstrapChannel.DISABLED : bootstrapChannel;
            return this;
        }

        public Builder setClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder setThumbprintAlgorithm(ThumbprintAlgorithm thumbprintAlgorithm) {
            this.thumbprintAlgorithm = thumbprintAlgorithm;
            return this;
        }

        public HandshakeDecisionOrchestrator build() {
            return new HandshakeDecisionOrchestrator(this);
        }
    }
}

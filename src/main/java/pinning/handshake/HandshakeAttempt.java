package pinning.handshake;

import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pinning.identity.ClientIdentity;

/**
 * State machine of a single connection attempt.
 *
 * <pre>
 * AWAITING_SERVER_CERT -> VALIDATING -> ACCEPTED | REJECTED
 * ACCEPTED -> CLIENT_CERT_SUPPLIED -> CLOSED
 * ACCEPTED -> CLOSED
 * </pre>
 *
 * {@code REJECTED} and {@code CLOSED} are final. Cancelling before validation has completed turns the
 * outcome into {@link ValidationOutcome.Aborted}; an attempt is never accepted without a full validation pass.
 */
public final class HandshakeAttempt {
    private static final Logger log = LoggerFactory.getLogger(HandshakeAttempt.class);

    private final String hostname;
    private final HandshakeDecisionOrchestrator orchestrator;
    private final AtomicReference<HandshakeState> state = new AtomicReference<>(HandshakeState.AWAITING_SERVER_CERT);
    private volatile ValidationOutcome outcome;
    private volatile List<X509Certificate> presentedChain = List.of();

    HandshakeAttempt(String hostname, HandshakeDecisionOrchestrator orchestrator) {
        this.hostname = hostname;
        this.orchestrator = orchestrator;
    }

    public String hostname() {
        return hostname;
    }

    public HandshakeState state() {
        return state.get();
    }

    public Optional<ValidationOutcome> outcome() {
        return Optional.ofNullable(outcome);
    }

    public List<X509Certificate> presentedChain() {
        return presentedChain;
    }

    public boolean isAccepted() {
        HandshakeState current = state.get();
        return current == HandshakeState.ACCEPTED || current == HandshakeState.CLIENT_CERT_SUPPLIED;
    }

    public ValidationOutcome presentChainForValidation(X509Certificate[] chain) {
        return presentChainForValidation(chain, null);
    }

    public ValidationOutcome presentChainForValidation(X509Certificate[] chain, String authType) {
        if (!state.compareAndSet(HandshakeState.AWAITING_SERVER_CERT, HandshakeState.VALIDATING)) {
            HandshakeState current = state.get();
            if (current == HandshakeState.CLOSED && outcome instanceof ValidationOutcome.Aborted aborted) {
                return aborted;
            }
            throw new IllegalStateException("Server chain for " + hostname + " was already presented (state=" + current + ")");
        }

        if (chain != null) {
            presentedChain = Arrays.stream(chain).filter(Objects::nonNull).toList();
        }
        ValidationOutcome decided = orchestrator.evaluate(chain, hostname, authType);
        outcome = decided;
        HandshakeState next = decided.accepted() ? HandshakeState.ACCEPTED : HandshakeState.REJECTED;
        if (!state.compareAndSet(HandshakeState.VALIDATING, next)) {
            decided = new ValidationOutcome.Aborted("Handshake with " + hostname + " was cancelled during validation");
            outcome = decided;
        }
        return decided;
    }

    /**
     * Hands out the identity loaded when the client was built. Repeated calls within the same handshake
     * return the same identity.
     *
     * @return empty when the client was built without an identity
     * @throws IllegalStateException unless the server chain has been accepted
     */
    public Optional<ClientIdentity> supplyClientIdentity() {
        while (true) {
            HandshakeState current = state.get();
            if (current == HandshakeState.CLIENT_CERT_SUPPLIED) {
                return orchestrator.clientIdentity();
            }
            if (current != HandshakeState.ACCEPTED) {
                throw new IllegalStateException(
                    "Client certificate requested by " + hostname + " before the server was accepted (state=" + current + ")"
                );
            }
            if (state.compareAndSet(HandshakeState.ACCEPTED, HandshakeState.CLIENT_CERT_SUPPLIED)) {
                log.debug("Supplying client identity to {}", hostname);
                return orchestrator.clientIdentity();
            }
        }
    }

    public void cancel() {
        closeWith("Handshake with " + hostname + " was cancelled");
    }

    public void close() {
        closeWith("Handshake with " + hostname + " was closed before validation");
    }

    private void closeWith(String abortReason) {
        while (true) {
            HandshakeState current = state.get();
            if (current.isTerminal()) {
                return;
            }
            if (state.compareAndSet(current, HandshakeState.CLOSED)) {
                if (current == HandshakeState.AWAITING_SERVER_CERT) {
                    outcome = new ValidationOutcome.Aborted(abortReason);
                }
                return;
            }
        }
    }
}

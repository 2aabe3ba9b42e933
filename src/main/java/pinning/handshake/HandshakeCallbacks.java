package pinning.handshake;

/**
 * What a transport binding needs from the decision engine. A binding begins one attempt per handshake,
 * presents the server chain to it and, once accepted, asks it for the client identity.
 */
public interface HandshakeCallbacks {

    HandshakeAttempt beginHandshake(String hostname);
}

package pinning.handshake;

public enum HandshakeState {
    AWAITING_SERVER_CERT,
    VALIDATING,
    ACCEPTED,
    REJECTED,
    CLIENT_CERT_SUPPLIED,
    CLOSED;

    public boolean isTerminal() {
        return this == REJECTED || this == CLOSED;
    }
}

package in.papertick.transport.ws;

/**
 * Live channel session lifecycle. CLOSED is terminal; a reconnect is a new session.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED;

    public boolean canTransitionTo(ConnectionState next) {
        return switch (this) {
            case CONNECTING -> next == OPEN || next == CLOSING;
            case OPEN -> next == CLOSING;
            case CLOSING -> next == CLOSED;
            case CLOSED -> false;
        };
    }
}

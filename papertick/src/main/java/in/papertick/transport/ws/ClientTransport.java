package in.papertick.transport.ws;

import java.io.IOException;

/**
 * Outbound half of one live connection. {@link #send} may block on a slow peer;
 * only the session's sender task calls it.
 */
public interface ClientTransport {

    void send(String text) throws IOException;

    /**
     * Start a close handshake. Must not block.
     */
    void close(int code, String reason);

    /**
     * Drop the connection without a handshake. Unblocks a {@link #send} stuck on the peer.
     */
    void abort();

    String remoteAddress();
}

package in.papertick.transport.ws;

/**
 * WebSocket close codes used on the live channel (RFC 6455 section 7.4).
 */
public final class CloseCodes {
    public static final int NORMAL = 1000;
    public static final int GOING_AWAY = 1001;
    public static final int ABNORMAL = 1006;
    public static final int SERVICE_RESTART = 1012;

    private CloseCodes() {}

    /**
     * A restart close tells the consumer to reconnect with backoff starting from the shortest delay.
     */
    public static boolean isServerRestart(int code) {
        return code == SERVICE_RESTART;
    }
}

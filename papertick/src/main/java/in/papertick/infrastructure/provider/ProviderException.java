package in.papertick.infrastructure.provider;

/**
 * Failure of a single upstream quote call.
 * Transient failures are worth retrying; permanent ones are reported as-is.
 */
public class ProviderException extends Exception {
    private final boolean transientFailure;

    public ProviderException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public ProviderException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}

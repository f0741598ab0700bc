package in.papertick.service.broker;

/**
 * Thrown when an {@link Account} is written from a thread other than its owner.
 * This is a programming error: the caller must stop rather than continue with
 * possibly corrupted cash or positions.
 */
public class AccountOwnershipException extends IllegalStateException {
    public AccountOwnershipException(String message) {
        super(message);
    }
}

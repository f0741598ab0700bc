package in.papertick.domain.account;

/**
 * Paper orders either fill immediately at the tick price or are rejected.
 */
public enum OrderStatus {
    FILLED,
    REJECTED
}

package in.papertick.domain.signal;

/**
 * Trading signal kind. HOLD is the no-op default.
 */
public enum SignalKind {
    BUY,
    SELL,
    HOLD
}

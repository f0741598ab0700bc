package in.papertick.infrastructure.provider;

import in.papertick.domain.data.ProviderEvent;

/**
 * Produces the next tick for a symbol, or a tick-level error.
 *
 * Implementations never throw for data problems; failures come back as
 * {@link ProviderEvent#ofError}. A call may block (network) and must honour
 * thread interruption so a stopped pipeline is not held up.
 */
public interface MarketDataProvider extends AutoCloseable {

    String name();

    ProviderEvent nextTick(String symbol);

    /**
     * Forget any per-symbol state after the symbol is unsubscribed.
     */
    default void release(String symbol) {
    }

    @Override
    default void close() {
    }
}

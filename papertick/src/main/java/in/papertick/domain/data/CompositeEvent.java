package in.papertick.domain.data;

import in.papertick.domain.account.AccountView;
import in.papertick.domain.signal.IndicatorSnapshot;
import in.papertick.domain.signal.Signal;

import java.util.Objects;

/**
 * Everything one tick produced: the tick, its indicators, the strategy signal and
 * the account after the broker acted.
 */
public record CompositeEvent(
    Tick tick,
    IndicatorSnapshot indicators,
    Signal signal,
    AccountView account
) {
    public CompositeEvent {
        Objects.requireNonNull(tick, "tick");
        Objects.requireNonNull(indicators, "indicators");
        Objects.requireNonNull(signal, "signal");
        Objects.requireNonNull(account, "account");
    }

    public String symbol() {
        return tick.symbol();
    }
}

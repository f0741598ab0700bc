package in.papertick.service.strategy;

import in.papertick.domain.data.Tick;
import in.papertick.domain.signal.IndicatorSnapshot;
import in.papertick.domain.signal.Signal;

/**
 * Edge-triggered signal rule.
 *
 * Implementations are stateless; the previous tick's indicators come from
 * {@link StrategyMemory}, so one instance serves every symbol.
 */
public interface TradingStrategy {

    String name();

    /**
     * @param current  indicators after this tick
     * @param previous indicators after the symbol's previous tick,
     *                 {@link IndicatorSnapshot#EMPTY} on the first tick
     */
    Signal evaluate(Tick tick, IndicatorSnapshot current, IndicatorSnapshot previous);
}

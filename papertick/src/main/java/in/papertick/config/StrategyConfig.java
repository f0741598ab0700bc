package in.papertick.config;

import java.util.Objects;

/**
 * Strategy selection plus the indicator periods it needs.
 * All three periods are always set so the indicator engine can report every value.
 */
public record StrategyConfig(
    StrategyType type,
    int shortPeriod,
    int longPeriod,
    int rsiPeriod,
    double oversold,
    double overbought
) {
    public enum StrategyType {
        MA_CROSSOVER,
        RSI_THRESHOLD
    }

    public StrategyConfig {
        Objects.requireNonNull(type, "strategy type");
        if (shortPeriod <= 0 || longPeriod <= 0 || rsiPeriod <= 0) {
            throw new IllegalArgumentException("Indicator periods must be positive");
        }
        if (shortPeriod >= longPeriod) {
            throw new IllegalArgumentException(
                "shortPeriod must be less than longPeriod: " + shortPeriod + " >= " + longPeriod);
        }
        if (oversold < 0 || overbought > 100 || oversold >= overbought) {
            throw new IllegalArgumentException(
                "RSI thresholds must satisfy 0 <= oversold < overbought <= 100");
        }
    }

    public static StrategyConfig maCrossover(int shortPeriod, int longPeriod) {
        return new StrategyConfig(StrategyType.MA_CROSSOVER, shortPeriod, longPeriod, 14, 30.0, 70.0);
    }

    public static StrategyConfig rsiThreshold(int period, double oversold, double overbought) {
        return new StrategyConfig(StrategyType.RSI_THRESHOLD, 10, 30, period, oversold, overbought);
    }
}

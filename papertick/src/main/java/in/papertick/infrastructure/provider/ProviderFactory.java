package in.papertick.infrastructure.provider;

import in.papertick.config.ProviderConfig;

/**
 * Picks the provider variant once from validated configuration.
 */
public final class ProviderFactory {

    private ProviderFactory() {}

    public static MarketDataProvider create(ProviderConfig cfg) {
        return switch (cfg.type()) {
            case SIMULATED -> new SimulatedProvider(cfg.simulated());
            case POLLED_HTTP -> new PolledHttpProvider(cfg.polledHttp());
        };
    }
}

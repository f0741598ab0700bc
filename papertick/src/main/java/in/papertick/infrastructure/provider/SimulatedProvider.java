package in.papertick.infrastructure.provider;

import in.papertick.config.ProviderConfig;
import in.papertick.domain.data.ProviderEvent;
import in.papertick.domain.data.Tick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Geometric random walk: price = max(0.01, price × exp(N(drift, volatility))).
 *
 * Each symbol gets its own generator seeded from (seed, symbol), so a seeded run
 * yields the same sequence per symbol however the pipelines interleave.
 */
public final class SimulatedProvider implements MarketDataProvider {
    private static final Logger log = LoggerFactory.getLogger(SimulatedProvider.class);

    private static final double FLOOR_PRICE = 0.01;
    private static final int PRICE_SCALE = 4;

    private final ProviderConfig.Simulated cfg;
    private final ConcurrentMap<String, Walk> walks = new ConcurrentHashMap<>();

    public SimulatedProvider(ProviderConfig.Simulated cfg) {
        this.cfg = cfg;
        log.info("[PROVIDER] Simulated walk start={} drift={} vol={} seed={}",
            cfg.startPrice(), cfg.drift(), cfg.volatility(), cfg.seed());
    }

    @Override
    public String name() {
        return "simulated";
    }

    @Override
    public ProviderEvent nextTick(String symbol) {
        Walk walk = walks.computeIfAbsent(symbol, this::newWalk);
        BigDecimal price = walk.step();
        return ProviderEvent.ofTick(new Tick(symbol, price, Instant.now()));
    }

    @Override
    public void release(String symbol) {
        walks.remove(symbol);
    }

    private Walk newWalk(String symbol) {
        Random rng = cfg.seed() == null
            ? new Random()
            : new Random(cfg.seed() * 31 + symbol.hashCode());
        return new Walk(rng, cfg.startPrice().doubleValue(), cfg.drift(), cfg.volatility());
    }

    private static final class Walk {
        private final Random rng;
        private final double drift;
        private final double volatility;
        private double price;

        Walk(Random rng, double start, double drift, double volatility) {
            this.rng = rng;
            this.price = start;
            this.drift = drift;
            this.volatility = volatility;
        }

        synchronized BigDecimal step() {
            double r = drift + volatility * rng.nextGaussian();
            price = Math.max(FLOOR_PRICE, price * Math.exp(r));
            BigDecimal px = BigDecimal.valueOf(price).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
            return px.signum() > 0 ? px : BigDecimal.valueOf(FLOOR_PRICE);
        }
    }
}

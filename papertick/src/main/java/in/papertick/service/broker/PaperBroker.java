package in.papertick.service.broker;

import in.papertick.config.BrokerConfig;
import in.papertick.domain.account.AccountView;
import in.papertick.domain.account.OrderRecord;
import in.papertick.domain.account.OrderSide;
import in.papertick.domain.account.Position;
import in.papertick.domain.data.Tick;
import in.papertick.domain.signal.Signal;
import in.papertick.infrastructure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Simulated order execution against one shared {@link Account}.
 *
 * Every mutation runs on a single writer thread, so symbol pipelines running in
 * parallel cannot lose cash or position updates. Callers submit a tick plus its
 * signal and receive the resulting {@link AccountView}.
 *
 * Rules:
 * - every tick marks the symbol's price, trade or not
 * - BUY sizes via {@link PositionSizingPolicy}; rejected with position_open or insufficient_cash
 * - SELL liquidates the whole position; rejected with no_position
 * - rejections only change last_order
 */
public final class PaperBroker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PaperBroker.class);

    static final String REJECT_INSUFFICIENT_CASH = "insufficient_cash";
    static final String REJECT_NO_POSITION = "no_position";
    static final String REJECT_POSITION_OPEN = "position_open";

    private static final int AVG_SCALE = 6;

    private final Account account;
    private final PositionSizingPolicy sizing;
    private final long lotSize;
    private final boolean allowAveraging;
    private final PipelineMetrics metrics;
    private final ExecutorService writer = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "paper-broker-writer");
        t.setDaemon(true);
        return t;
    });

    public PaperBroker(BrokerConfig cfg, PipelineMetrics metrics) {
        this(cfg.startingCash(), PositionSizingPolicy.from(cfg), cfg.lotSize(), cfg.allowAveraging(), metrics);
    }

    public PaperBroker(BigDecimal startingCash, PositionSizingPolicy sizing, long lotSize,
                       boolean allowAveraging, PipelineMetrics metrics) {
        if (lotSize <= 0) {
            throw new IllegalArgumentException("lotSize must be positive: " + lotSize);
        }
        this.account = new Account(startingCash);
        this.sizing = sizing;
        this.lotSize = lotSize;
        this.allowAveraging = allowAveraging;
        this.metrics = metrics;
        log.info("[BROKER] Paper account opened with cash={} sizing={} lot={} averaging={}",
            startingCash, sizing.getClass().getSimpleName(), lotSize, allowAveraging);
    }

    /**
     * Mark the tick's price, act on the signal and return the account afterwards.
     */
    public CompletableFuture<AccountView> onTick(Tick tick, Signal signal) {
        return CompletableFuture.supplyAsync(() -> apply(tick, signal), writer);
    }

    public CompletableFuture<AccountView> view() {
        return CompletableFuture.supplyAsync(account::view, writer);
    }

    /**
     * Drop the mark price of an unsubscribed symbol unless a position still needs it.
     */
    public CompletableFuture<Void> forget(String symbol) {
        return CompletableFuture.runAsync(() -> account.forgetMark(symbol), writer);
    }

    AccountView apply(Tick tick, Signal signal) {
        account.mark(tick.symbol(), tick.price());

        switch (signal.kind()) {
            case BUY -> buy(tick.symbol(), tick.price(), tick.timestamp());
            case SELL -> sell(tick.symbol(), tick.price(), tick.timestamp());
            case HOLD -> {
            }
        }
        return account.view();
    }

    private void buy(String symbol, BigDecimal price, Instant ts) {
        Position pos = account.position(symbol);
        BigDecimal cash = account.cash();

        if (pos.isOpen() && !allowAveraging) {
            reject(symbol, OrderSide.BUY, 0, price, REJECT_POSITION_OPEN, ts);
            return;
        }

        long qty = sizing.quantity(cash, price, lotSize);
        BigDecimal cost = price.multiply(BigDecimal.valueOf(qty));
        if (qty <= 0 || cost.compareTo(cash) > 0) {
            reject(symbol, OrderSide.BUY, qty, price, REJECT_INSUFFICIENT_CASH, ts);
            return;
        }

        long newQty = pos.qty() + qty;
        BigDecimal newAvg = pos.avgPrice().multiply(BigDecimal.valueOf(pos.qty()))
            .add(cost)
            .divide(BigDecimal.valueOf(newQty), AVG_SCALE, RoundingMode.HALF_UP);

        account.setCash(cash.subtract(cost));
        account.setPosition(new Position(symbol, newQty, newAvg));
        fill(OrderRecord.filled(symbol, OrderSide.BUY, qty, price, ts));
    }

    private void sell(String symbol, BigDecimal price, Instant ts) {
        Position pos = account.position(symbol);
        if (!pos.isOpen()) {
            reject(symbol, OrderSide.SELL, 0, price, REJECT_NO_POSITION, ts);
            return;
        }

        BigDecimal proceeds = price.multiply(BigDecimal.valueOf(pos.qty()));
        account.setCash(account.cash().add(proceeds));
        account.setPosition(Position.flat(symbol));
        fill(OrderRecord.filled(symbol, OrderSide.SELL, pos.qty(), price, ts));
    }

    private void fill(OrderRecord order) {
        account.setLastOrder(order);
        metrics.recordOrder(order.side().name(), order.status().name());
        log.info("[BROKER] FILLED {} {} x{} @ {} cash={}",
            order.side(), order.symbol(), order.qty(), order.price(), account.cash());
    }

    private void reject(String symbol, OrderSide side, long qty, BigDecimal price, String reason, Instant ts) {
        OrderRecord order = OrderRecord.rejected(symbol, side, qty, price, reason, ts);
        account.setLastOrder(order);
        metrics.recordOrder(side.name(), order.status().name());
        log.info("[BROKER] REJECTED {} {} @ {}: {}", side, symbol, price, reason);
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[BROKER] Writer stopped");
    }
}

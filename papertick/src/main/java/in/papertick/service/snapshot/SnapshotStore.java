package in.papertick.service.snapshot;

import in.papertick.domain.account.AccountView;
import in.papertick.domain.data.CompositeEvent;
import in.papertick.domain.data.Tick;
import in.papertick.domain.signal.IndicatorSnapshot;
import in.papertick.domain.signal.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory latest state per subscribed symbol plus the latest account view.
 * Serves the pull endpoint and the snapshot message primed on connect.
 */
public final class SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final ConcurrentHashMap<String, SymbolState> states = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();
    private volatile AccountView account;

    public SnapshotStore(AccountView initialAccount) {
        this.account = initialAccount;
    }

    /**
     * Start tracking a symbol. Updates for unregistered symbols are ignored.
     */
    public void register(String symbol) {
        if (states.putIfAbsent(symbol, SymbolState.empty(symbol)) == null) {
            order.add(symbol);
        }
    }

    public void remove(String symbol) {
        if (states.remove(symbol) != null) {
            order.remove(symbol);
            log.debug("Removed {} from snapshot", symbol);
        }
    }

    /**
     * Overwrite the symbol's latest state and, if newer, the account.
     *
     * @return false when the symbol is not registered
     */
    public boolean update(CompositeEvent event) {
        SymbolState next = states.computeIfPresent(event.symbol(), (s, prev) -> prev.withTick(event));
        if (next == null) {
            return false;
        }
        updateAccount(event.account());
        return true;
    }

    /**
     * @return false when the symbol is not registered
     */
    public boolean recordError(String symbol, String error) {
        return states.computeIfPresent(symbol, (s, prev) -> prev.withError(error)) != null;
    }

    public synchronized void updateAccount(AccountView view) {
        if (view.isNewerThan(account)) {
            account = view;
        }
    }

    public boolean contains(String symbol) {
        return states.containsKey(symbol);
    }

    public SymbolState state(String symbol) {
        return states.get(symbol);
    }

    /**
     * Immutable copy of the current state.
     */
    public Snapshot view() {
        Map<String, SymbolState> copy = new LinkedHashMap<>();
        List<String> symbols = new ArrayList<>();
        for (String symbol : order) {
            SymbolState st = states.get(symbol);
            if (st != null) {
                symbols.add(symbol);
                copy.put(symbol, st);
            }
        }
        return new Snapshot(Instant.now(), symbols, account, copy);
    }

    public void clear() {
        states.clear();
        order.clear();
        log.info("Snapshot store cleared");
    }

    public int size() {
        return states.size();
    }

    /**
     * Latest known state for one symbol. Fields are null until the first tick or error.
     */
    public record SymbolState(
        String symbol,
        Tick lastTick,
        IndicatorSnapshot indicators,
        Signal signal,
        Instant lastOkTs,
        String lastError,
        long tickCount
    ) {
        static SymbolState empty(String symbol) {
            return new SymbolState(symbol, null, null, null, null, null, 0);
        }

        SymbolState withTick(CompositeEvent e) {
            return new SymbolState(symbol, e.tick(), e.indicators(), e.signal(),
                e.tick().timestamp(), lastError, tickCount + 1);
        }

        SymbolState withError(String error) {
            return new SymbolState(symbol, lastTick, indicators, signal, lastOkTs, error, tickCount);
        }

        public boolean hasTick() {
            return lastTick != null;
        }
    }

    public record Snapshot(
        Instant ts,
        List<String> symbols,
        AccountView account,
        Map<String, SymbolState> states
    ) {
        public Snapshot {
            symbols = List.copyOf(symbols);
            states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
        }
    }
}

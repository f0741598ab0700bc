package in.papertick.service.broker;

import in.papertick.domain.account.AccountView;
import in.papertick.domain.account.OrderRecord;
import in.papertick.domain.account.Position;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable paper account: cash, positions, latest mark prices and last order.
 *
 * The first thread that writes becomes the owner; a write from any other thread
 * throws {@link AccountOwnershipException}. Equity is never stored.
 */
final class Account {

    private final AtomicReference<Thread> owner = new AtomicReference<>();
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final Map<String, BigDecimal> marks = new LinkedHashMap<>();

    private BigDecimal cash;
    private OrderRecord lastOrder;
    private long revision;

    Account(BigDecimal startingCash) {
        if (startingCash.signum() < 0) {
            throw new IllegalArgumentException("startingCash cannot be negative: " + startingCash);
        }
        this.cash = startingCash;
    }

    void mark(String symbol, BigDecimal price) {
        checkWriter();
        marks.put(symbol, price);
    }

    void setCash(BigDecimal newCash) {
        checkWriter();
        if (newCash.signum() < 0) {
            throw new IllegalStateException("cash would go negative: " + newCash);
        }
        cash = newCash;
    }

    void setPosition(Position position) {
        checkWriter();
        if (position.isOpen()) {
            positions.put(position.symbol(), position);
        } else {
            positions.remove(position.symbol());
        }
    }

    void setLastOrder(OrderRecord order) {
        checkWriter();
        lastOrder = order;
    }

    BigDecimal cash() {
        return cash;
    }

    Position position(String symbol) {
        return positions.getOrDefault(symbol, Position.flat(symbol));
    }

    OrderRecord lastOrder() {
        return lastOrder;
    }

    BigDecimal markPrice(String symbol) {
        return marks.get(symbol);
    }

    /**
     * cash + Σ qty × latest known price. A position whose symbol was never marked
     * is valued at its average price.
     */
    BigDecimal equity() {
        BigDecimal eq = cash;
        for (Position p : positions.values()) {
            BigDecimal px = marks.getOrDefault(p.symbol(), p.avgPrice());
            eq = eq.add(px.multiply(BigDecimal.valueOf(p.qty())));
        }
        return eq;
    }

    AccountView view() {
        List<Position> open = new ArrayList<>(positions.values());
        return new AccountView(cash, equity(), open, lastOrder, revision);
    }

    /**
     * Drop marks and state for a symbol that is no longer traded and has no position.
     */
    void forgetMark(String symbol) {
        checkWriter();
        if (!positions.containsKey(symbol)) {
            marks.remove(symbol);
        }
    }

    private void checkWriter() {
        Thread current = Thread.currentThread();
        if (!owner.compareAndSet(null, current)) {
            Thread bound = owner.get();
            if (bound != current) {
                throw new AccountOwnershipException(
                    "Account written from thread '" + current.getName() + "' but owned by '" + bound.getName() + "'");
            }
        }
        revision++;
    }
}

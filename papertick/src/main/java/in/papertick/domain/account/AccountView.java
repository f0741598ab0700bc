package in.papertick.domain.account;

import java.math.BigDecimal;
import java.util.List;

/**
 * Immutable copy of the paper account, taken on the broker's writer thread.
 * Only open positions are listed.
 *
 * @param revision count of account writes when the view was taken; a higher revision is newer
 */
public record AccountView(
    BigDecimal cash,
    BigDecimal equity,
    List<Position> positions,
    OrderRecord lastOrder,
    long revision
) {
    public AccountView {
        positions = List.copyOf(positions);
    }

    public boolean isNewerThan(AccountView other) {
        return other == null || revision >= other.revision;
    }
}

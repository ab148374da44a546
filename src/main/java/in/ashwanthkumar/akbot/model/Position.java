package in.ashwanthkumar.akbot.model;

import com.google.common.base.Preconditions;
import lombok.*;

/**
 * Net open position on one contract. A long position has a positive quantity
 * with op BUY, a short position a positive quantity with op SELL.
 */
@RequiredArgsConstructor(staticName = "of")
@Getter
@EqualsAndHashCode
@ToString
public class Position {
    private final String symbol;
    private final OrderOp op;
    @With
    private final int quantity;
    // average entry price
    @With
    private final double price;

    public boolean isLong() {
        return op == OrderOp.BUY;
    }

    /**
     * Reduce (or reverse) this position with an opposite fill.
     *
     * @param exitOp   op of the fill, must be the opposite of this position
     * @param exitQty  filled quantity
     * @param exitPrice fill price
     * @return the remaining position and the realised pnl of the matched quantity
     */
    public PositionExecutionResult exitWith(OrderOp exitOp, int exitQty, double exitPrice) {
        Preconditions.checkArgument(exitOp != op, "Can't exit a %s position with another %s fill", op.name(), exitOp.name());
        Preconditions.checkArgument(exitQty > 0, "Exit quantity must be positive, got %s", exitQty);

        int matched = Math.min(exitQty, quantity);
        double pnl = isLong() ? (exitPrice - price) * matched : (price - exitPrice) * matched;

        Position remaining;
        if (exitQty > quantity) {
            // over-filled, the excess opens a position on the other side
            remaining = Position.of(symbol, exitOp, exitQty - quantity, exitPrice);
        } else {
            remaining = withQuantity(quantity - exitQty);
        }
        return new PositionExecutionResult(remaining, pnl);
    }
}

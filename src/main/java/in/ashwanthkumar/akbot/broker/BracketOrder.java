package in.ashwanthkumar.akbot.broker;

import in.ashwanthkumar.akbot.model.OrderOp;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Market entry with a take-profit limit and a stop-loss stop, submitted together.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class BracketOrder {
    private final Contract contract;
    // op of the entry leg, the exit legs use the opposite op
    private final OrderOp op;
    private final int quantity;
    // price the TP/SL distances were computed from
    private final double referencePrice;
    private final double takeProfit;
    private final double stopLoss;

    public OrderOp exitOp() {
        return op.opposite();
    }
}

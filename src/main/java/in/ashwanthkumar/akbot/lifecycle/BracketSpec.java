package in.ashwanthkumar.akbot.lifecycle;

import com.google.common.base.Preconditions;
import in.ashwanthkumar.akbot.broker.BracketOrder;
import in.ashwanthkumar.akbot.broker.Contract;
import in.ashwanthkumar.akbot.model.OrderOp;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Sizing of the bracket an instance sends: quantity and the take-profit / stop-loss distance in ticks.
 */
@Getter
@ToString
public class BracketSpec {
    private final int quantity;
    private final double tickSize;
    private final int slTicks;
    private final int tpTicksLong;
    private final int tpTicksShort;

    @Builder
    private BracketSpec(Integer quantity, Double tickSize, Integer slTicks, Integer tpTicksLong, Integer tpTicksShort) {
        this.quantity = quantity == null ? 1 : quantity;
        this.tickSize = tickSize == null ? 0.01 : tickSize;
        this.slTicks = slTicks == null ? 20 : slTicks;
        this.tpTicksLong = tpTicksLong == null ? 60 : tpTicksLong;
        this.tpTicksShort = tpTicksShort == null ? 60 : tpTicksShort;
        Preconditions.checkArgument(this.quantity > 0, "quantity must be positive, got %s", this.quantity);
        Preconditions.checkArgument(this.tickSize > 0, "tickSize must be positive, got %s", this.tickSize);
        Preconditions.checkArgument(this.slTicks > 0 && this.tpTicksLong > 0 && this.tpTicksShort > 0,
                "TP/SL distances must be positive");
    }

    /**
     * Price the bracket legs around the reference price.
     */
    public BracketOrder bracket(Contract contract, OrderOp op, double referencePrice) {
        double takeProfit;
        double stopLoss;
        if (op == OrderOp.BUY) {
            takeProfit = round(referencePrice + tickSize * tpTicksLong);
            stopLoss = round(referencePrice - tickSize * slTicks);
        } else {
            takeProfit = round(referencePrice - tickSize * tpTicksShort);
            stopLoss = round(referencePrice + tickSize * slTicks);
        }
        return new BracketOrder(contract, op, quantity, referencePrice, takeProfit, stopLoss);
    }

    private static double round(double price) {
        return BigDecimal.valueOf(price).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}

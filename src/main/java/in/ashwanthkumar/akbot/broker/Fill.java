package in.ashwanthkumar.akbot.broker;

import in.ashwanthkumar.akbot.model.OrderOp;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Execution report for one order, keyed by the broker order id.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class Fill {
    private final String orderId;
    private final Contract contract;
    private final OrderOp op;
    private final int quantity;
    private final double price;
    private final Instant time;
}

package in.ashwanthkumar.akbot.lifecycle;

import in.ashwanthkumar.akbot.model.OrderOp;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Duration;

/**
 * Entry request produced by a strategy policy.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor(staticName = "of")
public class Signal {
    private final OrderOp op;
    private final String reason;
    // time to wait after the signal before the bracket is sent, zero sends on the same tick
    private final Duration delay;

    public static Signal immediate(OrderOp op, String reason) {
        return Signal.of(op, reason, Duration.ZERO);
    }
}

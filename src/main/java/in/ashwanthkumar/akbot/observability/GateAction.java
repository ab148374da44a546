package in.ashwanthkumar.akbot.observability;

import in.ashwanthkumar.akbot.lifecycle.TradePhase;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * A force-close or shutdown the gate fired on a tick.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class GateAction {
    private final Type type;
    private final Instant time;
    // phase the instance was in when the action fired
    private final TradePhase phase;
    private final boolean positionOpen;

    public enum Type {
        FORCE_CLOSE,
        SHUTDOWN
    }
}

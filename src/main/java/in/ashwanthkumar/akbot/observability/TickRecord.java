package in.ashwanthkumar.akbot.observability;

import in.ashwanthkumar.akbot.lifecycle.TradePhase;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * Price and CCI observed on one processed tick, plus whatever the policy annotated.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class TickRecord {
    private final String instance;
    private final Instant time;
    private final double price;
    // null while CCI is unavailable
    private final Double cci;
    private final TradePhase phase;
    private final Map<String, Object> annotations;
}

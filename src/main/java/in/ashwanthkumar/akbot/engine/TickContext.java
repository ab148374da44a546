package in.ashwanthkumar.akbot.engine;

import in.ashwanthkumar.akbot.indicator.CciReading;
import in.ashwanthkumar.akbot.indicator.EmaSnapshot;
import in.ashwanthkumar.akbot.lifecycle.TradePhase;
import in.ashwanthkumar.akbot.schedule.GateDecision;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * What one tick produced, handed to the strategy policy and returned to the caller.
 * Price is empty when no sample was fetched (blocked window, skipped or rejected sample),
 * CCI is empty while it is unavailable.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class TickContext {
    private final Instant time;
    private final GateDecision gate;
    private final TradePhase phase;
    private final Double price;
    private final CciReading cciReading;
    private final EmaSnapshot emas;

    public static TickContext withoutPrice(Instant time, GateDecision gate, TradePhase phase, EmaSnapshot emas) {
        return new TickContext(time, gate, phase, null, null, emas);
    }

    public OptionalDouble price() {
        return price == null ? OptionalDouble.empty() : OptionalDouble.of(price);
    }

    public OptionalDouble cci() {
        return cciReading == null ? OptionalDouble.empty() : OptionalDouble.of(cciReading.getValue());
    }

    public Optional<CciReading> cciReading() {
        return Optional.ofNullable(cciReading);
    }

    public boolean isIdle() {
        return phase == TradePhase.IDLE;
    }
}

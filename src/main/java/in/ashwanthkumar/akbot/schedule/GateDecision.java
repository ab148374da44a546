package in.ashwanthkumar.akbot.schedule;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Optional;

/**
 * Outcome of evaluating the trading window for one tick.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class GateDecision {
    // whether a new bracket may be opened on this tick, open positions are monitored either way
    private final boolean tradingAllowed;
    private final boolean mustForceClose;
    private final boolean mustShutdown;
    // why new entries are blocked, null when trading is allowed
    private final String blockReason;

    public static GateDecision open() {
        return new GateDecision(true, false, false, null);
    }

    public Optional<String> blockReason() {
        return Optional.ofNullable(blockReason);
    }
}

package in.ashwanthkumar.akbot.engine;

import in.ashwanthkumar.akbot.indicator.IndicatorEngine;
import in.ashwanthkumar.akbot.lifecycle.Signal;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Strategy specific entry logic plugged into the {@link TickOrchestrator}.
 */
public interface SignalPolicy {
    /**
     * Invoked once for every tick that produced a price.
     *
     * @param context    price, CCI, EMAs, gate decision and phase of this tick
     * @param indicators indicator engine of the instance, for anything the context doesn't carry
     * @return entry signal, only acted upon while the instance is IDLE and new orders are allowed
     */
    Optional<Signal> onTick(TickContext context, IndicatorEngine indicators);

    /**
     * Extra values attached to the tick record, e.g. the EMAs the policy filters on.
     */
    default Map<String, Object> annotate(IndicatorEngine indicators) {
        return Collections.emptyMap();
    }
}

package in.ashwanthkumar.akbot.observability;

import in.ashwanthkumar.akbot.indicator.IndicatorSnapshot;
import in.ashwanthkumar.akbot.lifecycle.PhaseTransition;

import java.time.Instant;

/**
 * Destination of the structured events the engine emits. Implementations decide
 * where they go: log files, console, CSV journal.
 */
public interface TradingEventSink {
    void onTransition(String instance, PhaseTransition transition);

    void onGateAction(String instance, GateAction action);

    void onTick(TickRecord record);

    void onIndicators(String instance, Instant time, IndicatorSnapshot snapshot);

    void onWarning(String instance, Instant time, String message);
}

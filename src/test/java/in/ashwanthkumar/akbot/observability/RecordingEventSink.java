package in.ashwanthkumar.akbot.observability;

import in.ashwanthkumar.akbot.indicator.IndicatorSnapshot;
import in.ashwanthkumar.akbot.lifecycle.PhaseTransition;
import in.ashwanthkumar.akbot.lifecycle.TradePhase;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps every event in memory, in the order they were emitted.
 */
public class RecordingEventSink implements TradingEventSink {
    public final List<PhaseTransition> transitions = new ArrayList<>();
    public final List<GateAction> gateActions = new ArrayList<>();
    public final List<TickRecord> ticks = new ArrayList<>();
    public final List<IndicatorSnapshot> snapshots = new ArrayList<>();
    public final List<String> warnings = new ArrayList<>();
    // event kinds in emission order, e.g. "FORCE_CLOSE", "transition", "tick"
    public final List<String> order = new ArrayList<>();

    @Override
    public void onTransition(String instance, PhaseTransition transition) {
        transitions.add(transition);
        order.add("transition");
    }

    @Override
    public void onGateAction(String instance, GateAction action) {
        gateActions.add(action);
        order.add(action.getType().name());
    }

    @Override
    public void onTick(TickRecord record) {
        ticks.add(record);
        order.add("tick");
    }

    @Override
    public void onIndicators(String instance, Instant time, IndicatorSnapshot snapshot) {
        snapshots.add(snapshot);
        order.add("indicators");
    }

    @Override
    public void onWarning(String instance, Instant time, String message) {
        warnings.add(message);
        order.add("warning");
    }

    public List<TradePhase> phases() {
        return transitions.stream().map(PhaseTransition::getTo).collect(Collectors.toList());
    }

    public void clear() {
        transitions.clear();
        gateActions.clear();
        ticks.clear();
        snapshots.clear();
        warnings.clear();
        order.clear();
    }
}

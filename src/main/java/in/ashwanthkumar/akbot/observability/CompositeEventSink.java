package in.ashwanthkumar.akbot.observability;

import com.google.common.collect.ImmutableList;
import in.ashwanthkumar.akbot.indicator.IndicatorSnapshot;
import in.ashwanthkumar.akbot.lifecycle.PhaseTransition;

import java.time.Instant;
import java.util.List;

public class CompositeEventSink implements TradingEventSink {
    private final List<TradingEventSink> sinks;

    public CompositeEventSink(List<TradingEventSink> sinks) {
        this.sinks = ImmutableList.copyOf(sinks);
    }

    public static TradingEventSink of(TradingEventSink... sinks) {
        return new CompositeEventSink(ImmutableList.copyOf(sinks));
    }

    @Override
    public void onTransition(String instance, PhaseTransition transition) {
        sinks.forEach(sink -> sink.onTransition(instance, transition));
    }

    @Override
    public void onGateAction(String instance, GateAction action) {
        sinks.forEach(sink -> sink.onGateAction(instance, action));
    }

    @Override
    public void onTick(TickRecord record) {
        sinks.forEach(sink -> sink.onTick(record));
    }

    @Override
    public void onIndicators(String instance, Instant time, IndicatorSnapshot snapshot) {
        sinks.forEach(sink -> sink.onIndicators(instance, time, snapshot));
    }

    @Override
    public void onWarning(String instance, Instant time, String message) {
        sinks.forEach(sink -> sink.onWarning(instance, time, message));
    }
}

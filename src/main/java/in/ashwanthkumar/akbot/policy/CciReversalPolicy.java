package in.ashwanthkumar.akbot.policy;

import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;
import in.ashwanthkumar.akbot.engine.SignalPolicy;
import in.ashwanthkumar.akbot.engine.TickContext;
import in.ashwanthkumar.akbot.indicator.EmaSnapshot;
import in.ashwanthkumar.akbot.indicator.IndicatorEngine;
import in.ashwanthkumar.akbot.lifecycle.Signal;
import in.ashwanthkumar.akbot.model.OrderOp;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * CCI recovering from beyond a level, e.g. -120 back above -120 and still rising.
 * Trades only in the direction of the fast/slow EMA trend.
 */
public class CciReversalPolicy implements SignalPolicy {
    private final double level;
    private final EvictingQueue<Double> recent = EvictingQueue.create(3);

    public CciReversalPolicy(double level) {
        this.level = level;
    }

    public CciReversalPolicy() {
        this(120);
    }

    @Override
    public Optional<Signal> onTick(TickContext context, IndicatorEngine indicators) {
        OptionalDouble cci = context.cci();
        if (cci.isEmpty()) {
            return Optional.empty();
        }
        recent.add(cci.getAsDouble());
        if (recent.size() < 3) {
            return Optional.empty();
        }
        List<Double> v = ImmutableList.copyOf(recent);
        boolean longSetup = v.get(0) < -level && v.get(1) > -level && v.get(2) > v.get(1);
        boolean shortSetup = v.get(0) >= level && v.get(1) < level && v.get(2) < v.get(1);

        EmaSnapshot emas = context.getEmas();
        if (emas.getFast() == null || emas.getSlow() == null) {
            return Optional.empty();
        }
        if (longSetup && emas.getFast() > emas.getSlow()) {
            return Optional.of(Signal.immediate(OrderOp.BUY, "LONG CCI reversal with fast EMA above slow"));
        }
        if (shortSetup && emas.getFast() < emas.getSlow()) {
            return Optional.of(Signal.immediate(OrderOp.SELL, "SHORT CCI reversal with fast EMA below slow"));
        }
        return Optional.empty();
    }
}

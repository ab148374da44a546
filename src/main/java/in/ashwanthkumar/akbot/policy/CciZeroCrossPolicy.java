package in.ashwanthkumar.akbot.policy;

import com.google.common.collect.ImmutableMap;
import in.ashwanthkumar.akbot.engine.SignalPolicy;
import in.ashwanthkumar.akbot.engine.TickContext;
import in.ashwanthkumar.akbot.indicator.EmaSnapshot;
import in.ashwanthkumar.akbot.indicator.IndicatorEngine;
import in.ashwanthkumar.akbot.lifecycle.Signal;
import in.ashwanthkumar.akbot.model.OrderOp;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * CCI crossing zero, confirmed by price on the same side of the fast EMA.
 * The bracket goes out only after the confirmation delay.
 */
public class CciZeroCrossPolicy implements SignalPolicy {
    public static final Duration DEFAULT_DELAY = Duration.ofMinutes(3);

    private final Duration delay;
    private Double lastCci;

    public CciZeroCrossPolicy(Duration delay) {
        this.delay = delay;
    }

    public CciZeroCrossPolicy() {
        this(DEFAULT_DELAY);
    }

    @Override
    public Optional<Signal> onTick(TickContext context, IndicatorEngine indicators) {
        OptionalDouble cci = context.cci();
        if (cci.isEmpty()) {
            return Optional.empty();
        }
        Double previous = lastCci;
        double current = cci.getAsDouble();
        lastCci = current;

        OptionalDouble fast = context.getEmas().fastValue();
        if (previous == null || fast.isEmpty()) {
            return Optional.empty();
        }
        double price = context.price().getAsDouble();
        if (previous < 0 && current > 0 && price > fast.getAsDouble()) {
            return Optional.of(Signal.of(OrderOp.BUY, "BUY CCI cross", delay));
        }
        if (previous > 0 && current < 0 && price < fast.getAsDouble()) {
            return Optional.of(Signal.of(OrderOp.SELL, "SELL CCI cross", delay));
        }
        return Optional.empty();
    }

    @Override
    public Map<String, Object> annotate(IndicatorEngine indicators) {
        EmaSnapshot emas = indicators.emas();
        ImmutableMap.Builder<String, Object> values = ImmutableMap.builder();
        if (emas.getFast() != null) {
            values.put("EMA" + indicators.getConfig().getEmaFastPeriod(), emas.getFast());
        }
        if (emas.getSlow() != null) {
            values.put("EMA" + indicators.getConfig().getEmaSlowPeriod(), emas.getSlow());
        }
        return values.build();
    }
}

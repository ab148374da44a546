package in.ashwanthkumar.akbot.policy;

import com.google.common.base.Preconditions;
import in.ashwanthkumar.akbot.engine.SignalPolicy;
import in.ashwanthkumar.akbot.engine.TickContext;
import in.ashwanthkumar.akbot.indicator.IndicatorEngine;
import in.ashwanthkumar.akbot.lifecycle.Signal;
import in.ashwanthkumar.akbot.model.OrderOp;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Fades CCI extremes: SELL above +threshold, BUY below -threshold, on the same tick.
 */
public class CciThresholdPolicy implements SignalPolicy {
    private final double threshold;

    public CciThresholdPolicy(double threshold) {
        Preconditions.checkArgument(threshold > 0, "Threshold must be positive, got %s", threshold);
        this.threshold = threshold;
    }

    public CciThresholdPolicy() {
        this(200);
    }

    @Override
    public Optional<Signal> onTick(TickContext context, IndicatorEngine indicators) {
        OptionalDouble cci = context.cci();
        if (cci.isEmpty()) {
            return Optional.empty();
        }
        double value = cci.getAsDouble();
        if (value > threshold) {
            return Optional.of(Signal.immediate(OrderOp.SELL, String.format("CCI %.2f above +%.0f", value, threshold)));
        }
        if (value < -threshold) {
            return Optional.of(Signal.immediate(OrderOp.BUY, String.format("CCI %.2f below -%.0f", value, threshold)));
        }
        return Optional.empty();
    }
}

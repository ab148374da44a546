package in.ashwanthkumar.akbot.indicator;

import com.google.common.base.Preconditions;
import lombok.Getter;

import java.util.OptionalDouble;

/**
 * Incrementally maintained exponential moving average of a single span.
 */
public class Ema {
    @Getter
    private final int span;
    @Getter
    private final double alpha;
    // prior value used for the very first smoothing step, null means seed from the first price
    private final Double seed;
    private Double value;

    public Ema(int span, Double seed) {
        Preconditions.checkArgument(span > 0, "EMA span must be positive, got %s", span);
        this.span = span;
        this.alpha = 2.0 / (span + 1);
        this.seed = seed;
    }

    public Ema(int span) {
        this(span, null);
    }

    /**
     * @param price latest price
     * @return the new EMA value
     */
    public double update(double price) {
        Double prev = value != null ? value : seed;
        value = prev == null ? price : alpha * price + (1 - alpha) * prev;
        return value;
    }

    /**
     * @return the current EMA, empty until the first price was seen
     */
    public OptionalDouble value() {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean isDefined() {
        return value != null;
    }
}

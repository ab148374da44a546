package in.ashwanthkumar.akbot.indicator;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.OptionalDouble;

@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class CciReading {
    private final CciMode mode;
    private final double value;
    // last defined CCI before this one, null on the first reading
    private final Double previous;
    // mean typical price of the window
    private final double mean;
    // stdev or mean absolute deviation depending on the mode
    private final double dispersion;

    public OptionalDouble previousValue() {
        return previous == null ? OptionalDouble.empty() : OptionalDouble.of(previous);
    }

    public Trend trend() {
        if (previous == null || previous == value) {
            return Trend.FLAT;
        }
        return value > previous ? Trend.RISING : Trend.FALLING;
    }

    public enum Trend {
        RISING,
        FALLING,
        FLAT
    }
}

package in.ashwanthkumar.akbot.indicator;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.OptionalDouble;
import java.util.SortedMap;

/**
 * Point in time copy of every EMA the engine maintains. Undefined values are null.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class EmaSnapshot {
    private final Double single;
    private final Double fast;
    private final Double slow;
    // span -> value, only spans that have seen a sample
    private final SortedMap<Integer, Double> multi;

    public OptionalDouble singleValue() {
        return single == null ? OptionalDouble.empty() : OptionalDouble.of(single);
    }

    public OptionalDouble fastValue() {
        return fast == null ? OptionalDouble.empty() : OptionalDouble.of(fast);
    }

    public OptionalDouble slowValue() {
        return slow == null ? OptionalDouble.empty() : OptionalDouble.of(slow);
    }

    public OptionalDouble multiValue(int span) {
        Double value = multi.get(span);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}

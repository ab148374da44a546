package in.ashwanthkumar.akbot.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.OptionalDouble;

/**
 * One price observation of a contract, produced once per tick.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class PriceSample {
    // When the sample was taken
    private final Instant time;
    // Last traded price
    private final double price;
    // OHLC values are optional, brokers that return only a snapshot price leave them null
    private final Double high;
    private final Double low;
    private final Double close;

    public static PriceSample of(Instant time, double price) {
        return new PriceSample(time, price, null, null, null);
    }

    public static PriceSample ohlc(Instant time, double high, double low, double close) {
        return new PriceSample(time, close, high, low, close);
    }

    /**
     * Typical price of this sample
     *
     * @return (high + low + close) / 3 when the bar is available, else the raw price
     */
    public double typicalPrice() {
        if (high == null || low == null || close == null) {
            return price;
        }
        return (high + low + close) / 3.0;
    }

    public OptionalDouble highPrice() {
        return high == null ? OptionalDouble.empty() : OptionalDouble.of(high);
    }

    public OptionalDouble lowPrice() {
        return low == null ? OptionalDouble.empty() : OptionalDouble.of(low);
    }
}

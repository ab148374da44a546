package in.ashwanthkumar.akbot.indicator;

import in.ashwanthkumar.akbot.model.PriceSample;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Keeps the bounded price history of one strategy instance and updates every
 * configured indicator once per sample. Never reads the wall clock.
 */
@Slf4j
public class IndicatorEngine {
    private static final double CCI_CONSTANT = 0.015;

    @Getter
    private final IndicatorConfig config;
    private final PriceHistory history;
    private final Ema single;
    private final Ema fast;
    private final Ema slow;
    private final SortedMap<Integer, Ema> multi = new TreeMap<>();

    private CciReading lastCci;
    private String cciUnavailableReason = "no samples yet";
    private Double previousCci;
    @Getter
    private long samplesSeen;

    public IndicatorEngine(IndicatorConfig config) {
        this.config = config;
        this.history = new PriceHistory(config.getHistoryCap());
        this.single = new Ema(config.getEmaPeriod(), config.getInitialEma());
        this.fast = new Ema(config.getEmaFastPeriod(), config.getInitialEma());
        this.slow = new Ema(config.getEmaSlowPeriod(), config.getInitialEma());
        for (Integer span : config.getEmaSpans()) {
            multi.put(span, new Ema(span, config.getInitialEma()));
        }
    }

    /**
     * Feed one sample to the history and every indicator.
     *
     * @param sample latest price sample
     * @throws InvalidSampleException when the price or any bar value is NaN, infinite or not positive
     */
    public void update(PriceSample sample) {
        validate(sample);
        history.append(sample);
        samplesSeen++;

        double price = sample.getPrice();
        single.update(price);
        fast.update(price);
        slow.update(price);
        for (Ema ema : multi.values()) {
            ema.update(price);
        }
        computeCci();
    }

    public EmaSnapshot emas() {
        SortedMap<Integer, Double> values = new TreeMap<>();
        for (Map.Entry<Integer, Ema> entry : multi.entrySet()) {
            entry.getValue().value().ifPresent(v -> values.put(entry.getKey(), v));
        }
        return new EmaSnapshot(valueOrNull(single), valueOrNull(fast), valueOrNull(slow), Collections.unmodifiableSortedMap(values));
    }

    /**
     * @return CCI of the latest sample
     * @throws IndicatorUnavailableException when fewer than 14 samples exist or the window has no dispersion
     */
    public CciReading cci() {
        if (lastCci == null) {
            throw new IndicatorUnavailableException(cciUnavailableReason);
        }
        return lastCci;
    }

    public Optional<CciReading> currentCci() {
        return Optional.ofNullable(lastCci);
    }

    public CciMode cciMode() {
        return config.getCciMode();
    }

    public PriceHistory history() {
        return history;
    }

    public IndicatorSnapshot snapshot() {
        return new IndicatorSnapshot(samplesSeen, emas(), lastCci);
    }

    private void computeCci() {
        int period = IndicatorConfig.CCI_PERIOD;
        if (history.size() < period) {
            lastCci = null;
            cciUnavailableReason = String.format("CCI needs %d samples, have %d", period, history.size());
            return;
        }

        double[] tp = history.lastTypicalPrices(period);
        double mean = mean(tp);
        double dispersion = isFlat(tp) ? 0.0
                : config.getCciMode() == CciMode.CLASSIC ? meanAbsoluteDeviation(tp, mean) : sampleStdev(tp, mean);
        if (dispersion == 0.0) {
            lastCci = null;
            cciUnavailableReason = "CCI window has zero dispersion";
            log.debug("Zero dispersion over the last {} typical prices, CCI undefined", period);
            return;
        }

        double value = (tp[period - 1] - mean) / (CCI_CONSTANT * dispersion);
        lastCci = new CciReading(config.getCciMode(), value, previousCci, mean, dispersion);
        previousCci = value;
    }

    private static void validate(PriceSample sample) {
        if (sample == null) {
            throw new InvalidSampleException("Sample is missing");
        }
        double price = sample.getPrice();
        if (!Double.isFinite(price) || price <= 0) {
            throw new InvalidSampleException("Rejected price " + price + " at " + sample.getTime());
        }
        validateBar("high", sample.getHigh(), sample);
        validateBar("low", sample.getLow(), sample);
        validateBar("close", sample.getClose(), sample);
        if (!Double.isFinite(sample.typicalPrice())) {
            throw new InvalidSampleException("Rejected typical price " + sample.typicalPrice() + " at " + sample.getTime());
        }
    }

    private static void validateBar(String field, Double value, PriceSample sample) {
        if (value != null && (!Double.isFinite(value) || value <= 0)) {
            throw new InvalidSampleException("Rejected " + field + " " + value + " at " + sample.getTime());
        }
    }

    // identical values must give exactly zero dispersion, the float mean may not be exact
    private static boolean isFlat(double[] values) {
        for (double v : values) {
            if (v != values[0]) {
                return false;
            }
        }
        return true;
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    static double sampleStdev(double[] values, double mean) {
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    static double meanAbsoluteDeviation(double[] values, double mean) {
        double sum = 0;
        for (double v : values) {
            sum += Math.abs(v - mean);
        }
        return sum / values.length;
    }

    private static Double valueOrNull(Ema ema) {
        return ema.isDefined() ? ema.value().getAsDouble() : null;
    }
}

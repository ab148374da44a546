package in.ashwanthkumar.akbot.indicator;

import com.google.common.collect.ImmutableSet;
import in.ashwanthkumar.akbot.model.PriceSample;
import org.junit.Test;

import java.time.Instant;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;

public class IndicatorEngineTest {
    private static final Instant T0 = Instant.parse("2025-03-10T08:00:00Z");
    // 6.5 / (0.015 * sqrt(17.5))
    private static final double STDEV_CCI = 103.5864;
    // 6.5 / (0.015 * 3.5)
    private static final double CLASSIC_CCI = 123.8095;

    @Test
    public void testCciIsUnavailableWithFewerThan14Samples() {
        IndicatorEngine engine = new IndicatorEngine(IndicatorConfig.defaults());
        for (int i = 1; i <= 13; i++) {
            feed(engine, i, 100 + i);
            assertThat(engine.currentCci().isPresent(), is(false));
            try {
                engine.cci();
                fail("CCI must be unavailable after " + i + " samples");
            } catch (IndicatorUnavailableException expected) {
                // not yet available
            }
        }
        feed(engine, 14, 114);
        assertThat(engine.currentCci().isPresent(), is(true));
    }

    @Test
    public void testStdevCci() {
        IndicatorEngine engine = engine(CciMode.STDEV);
        feedRamp(engine);

        CciReading reading = engine.cci();
        assertThat(reading.getMode(), is(CciMode.STDEV));
        assertThat(reading.getValue(), closeTo(STDEV_CCI, 1e-3));
        assertThat(reading.getMean(), closeTo(107.5, 1e-9));
        assertThat(reading.getDispersion(), closeTo(Math.sqrt(17.5), 1e-9));
        assertThat(reading.getPrevious(), is(nullValue()));
    }

    @Test
    public void testClassicCci() {
        IndicatorEngine engine = engine(CciMode.CLASSIC);
        feedRamp(engine);

        CciReading reading = engine.cci();
        assertThat(reading.getMode(), is(CciMode.CLASSIC));
        assertThat(reading.getValue(), closeTo(CLASSIC_CCI, 1e-3));
        assertThat(reading.getDispersion(), closeTo(3.5, 1e-9));
    }

    @Test
    public void testCciOfConstantPricesIsUndefinedInBothModes() {
        for (CciMode mode : CciMode.values()) {
            IndicatorEngine engine = engine(mode);
            for (int i = 0; i < 20; i++) {
                feed(engine, i, 4321.25);
            }
            assertThat(mode.name(), engine.currentCci().isPresent(), is(false));
        }
    }

    @Test
    public void testCciUsesTypicalPriceOfBars() {
        IndicatorEngine engine = engine(CciMode.STDEV);
        for (int i = 1; i <= 14; i++) {
            double tp = 100 + i;
            // high and low symmetric around the close, the typical price is the close
            engine.update(PriceSample.ohlc(T0.plusSeconds(i), tp + 2, tp - 2, tp));
        }
        assertThat(engine.cci().getValue(), closeTo(STDEV_CCI, 1e-3));
    }

    @Test
    public void testPreviousKeepsTheLastDefinedValue() {
        IndicatorEngine engine = engine(CciMode.STDEV);
        feedRamp(engine);
        double first = engine.cci().getValue();

        feed(engine, 15, 100);
        CciReading reading = engine.cci();
        assertThat(reading.getPrevious(), closeTo(first, 1e-9));
        assertThat(reading.trend(), is(CciReading.Trend.FALLING));
    }

    @Test
    public void testInvalidSamplesAreRejectedWithoutMutation() {
        IndicatorEngine engine = engine(CciMode.STDEV);
        feedRamp(engine);
        IndicatorSnapshot before = engine.snapshot();

        double[] invalid = {Double.NaN, Double.POSITIVE_INFINITY, 0.0, -5.0};
        for (double price : invalid) {
            try {
                feed(engine, 99, price);
                fail("Price " + price + " must be rejected");
            } catch (InvalidSampleException expected) {
                // rejected
            }
        }
        assertThat(engine.snapshot(), is(before));
        assertThat(engine.history().size(), is(14));
    }

    @Test
    public void testBarsWithInvalidHighOrLowAreRejectedWithoutMutation() {
        IndicatorEngine engine = engine(CciMode.STDEV);
        for (int i = 1; i <= 13; i++) {
            engine.update(PriceSample.ohlc(T0.plusSeconds(10L * i), 100 + i + 1, 100 + i - 1, 100 + i));
        }
        assertThat(engine.history().size(), is(13));

        PriceSample[] invalid = {
                PriceSample.ohlc(T0.plusSeconds(140), Double.NaN, 113, 114),
                PriceSample.ohlc(T0.plusSeconds(140), 115, Double.NEGATIVE_INFINITY, 114),
                PriceSample.ohlc(T0.plusSeconds(140), 115, 0.0, 114),
                PriceSample.ohlc(T0.plusSeconds(140), Double.MAX_VALUE, Double.MAX_VALUE, 114),
        };
        for (PriceSample sample : invalid) {
            try {
                engine.update(sample);
                fail(sample + " must be rejected");
            } catch (InvalidSampleException expected) {
                // rejected
            }
        }
        assertThat(engine.history().size(), is(13));
        assertThat(engine.currentCci().isPresent(), is(false));

        engine.update(PriceSample.ohlc(T0.plusSeconds(140), 115, 113, 114));
        assertThat(engine.currentCci().get().getValue(), closeTo(STDEV_CCI, 1e-3));
    }

    @Test
    public void testEmasAreUnsetBeforeTheFirstSample() {
        IndicatorEngine engine = new IndicatorEngine(IndicatorConfig.builder().emaSpans(ImmutableSet.of(5, 20)).build());
        EmaSnapshot emas = engine.emas();
        assertThat(emas.getSingle(), is(nullValue()));
        assertThat(emas.getFast(), is(nullValue()));
        assertThat(emas.getSlow(), is(nullValue()));
        assertThat(emas.getMulti().isEmpty(), is(true));

        feed(engine, 0, 100);
        emas = engine.emas();
        assertThat(emas.getSingle(), is(100.0));
        assertThat(emas.getMulti().keySet(), contains(5, 20));
    }

    @Test
    public void testSpansAreEvaluatedIndependently() {
        IndicatorEngine engine = new IndicatorEngine(IndicatorConfig.builder()
                .emaFastPeriod(3)
                .emaSlowPeriod(9)
                .emaSpans(ImmutableSet.of(3, 9))
                .build());
        Ema three = new Ema(3);
        Ema nine = new Ema(9);
        double[] prices = {100, 102, 101, 105, 98};
        for (int i = 0; i < prices.length; i++) {
            feed(engine, i, prices[i]);
            three.update(prices[i]);
            nine.update(prices[i]);
        }
        EmaSnapshot emas = engine.emas();
        assertThat(emas.getFast(), closeTo(three.value().getAsDouble(), 1e-12));
        assertThat(emas.getSlow(), closeTo(nine.value().getAsDouble(), 1e-12));
        assertThat(emas.multiValue(3).getAsDouble(), closeTo(three.value().getAsDouble(), 1e-12));
        assertThat(emas.multiValue(9).getAsDouble(), closeTo(nine.value().getAsDouble(), 1e-12));
    }

    @Test
    public void testHistoryIsBoundedByTheLargestWindow() {
        IndicatorConfig config = IndicatorConfig.builder().emaPeriod(5).emaFastPeriod(5).emaSlowPeriod(30).build();
        assertThat(config.getHistoryCap(), is(30));

        IndicatorEngine engine = new IndicatorEngine(config);
        for (int i = 0; i < 100; i++) {
            feed(engine, i, 100 + i % 7);
        }
        assertThat(engine.history().size(), is(30));
        assertThat(engine.getSamplesSeen(), is(100L));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testHistoryCapBelowTheCciPeriodIsRejected() {
        IndicatorConfig.builder().historyCap(10).build();
    }

    private static IndicatorEngine engine(CciMode mode) {
        return new IndicatorEngine(IndicatorConfig.builder().cciMode(mode).build());
    }

    private static void feedRamp(IndicatorEngine engine) {
        for (int i = 1; i <= 14; i++) {
            feed(engine, i, 100 + i);
        }
    }

    private static void feed(IndicatorEngine engine, int second, double price) {
        engine.update(PriceSample.of(T0.plusSeconds(second), price));
    }
}

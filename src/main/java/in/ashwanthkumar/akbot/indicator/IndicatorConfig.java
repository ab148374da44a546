package in.ashwanthkumar.akbot.indicator;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Set;

@Getter
@ToString
public class IndicatorConfig {
    public static final int CCI_PERIOD = 14;

    private final int emaPeriod;
    private final int emaFastPeriod;
    private final int emaSlowPeriod;
    private final ImmutableSortedSet<Integer> emaSpans;
    private final CciMode cciMode;
    // prior value for the first smoothing step, null seeds every EMA from the first price
    private final Double initialEma;
    private final int historyCap;

    @Builder
    private IndicatorConfig(Integer emaPeriod, Integer emaFastPeriod, Integer emaSlowPeriod, Set<Integer> emaSpans,
                            CciMode cciMode, Double initialEma, Integer historyCap) {
        this.emaPeriod = emaPeriod == null ? 10 : emaPeriod;
        this.emaFastPeriod = emaFastPeriod == null ? 10 : emaFastPeriod;
        this.emaSlowPeriod = emaSlowPeriod == null ? 200 : emaSlowPeriod;
        this.emaSpans = emaSpans == null ? ImmutableSortedSet.of() : ImmutableSortedSet.copyOf(emaSpans);
        this.cciMode = cciMode == null ? CciMode.STDEV : cciMode;
        this.initialEma = initialEma;

        Preconditions.checkArgument(this.emaPeriod > 0, "emaPeriod must be positive, got %s", this.emaPeriod);
        Preconditions.checkArgument(this.emaFastPeriod > 0, "emaFastPeriod must be positive, got %s", this.emaFastPeriod);
        Preconditions.checkArgument(this.emaSlowPeriod > 0, "emaSlowPeriod must be positive, got %s", this.emaSlowPeriod);
        for (Integer span : this.emaSpans) {
            Preconditions.checkArgument(span > 0, "EMA spans must be positive, got %s", span);
        }
        Preconditions.checkArgument(initialEma == null || (Double.isFinite(initialEma) && initialEma > 0),
                "initialEma must be a positive number, got %s", initialEma);

        int required = requiredHistory();
        this.historyCap = historyCap == null ? required : historyCap;
        Preconditions.checkArgument(this.historyCap >= CCI_PERIOD,
                "historyCap must hold at least %s samples for CCI, got %s", CCI_PERIOD, this.historyCap);
    }

    /**
     * @return largest window any indicator needs, never below the CCI period
     */
    public int requiredHistory() {
        int max = Math.max(CCI_PERIOD, Math.max(emaPeriod, Math.max(emaFastPeriod, emaSlowPeriod)));
        if (!emaSpans.isEmpty()) {
            max = Math.max(max, emaSpans.last());
        }
        return max;
    }

    public static IndicatorConfig defaults() {
        return IndicatorConfig.builder().build();
    }
}

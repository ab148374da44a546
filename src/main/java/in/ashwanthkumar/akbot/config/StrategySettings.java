package in.ashwanthkumar.akbot.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of one strategy instance as they appear in the config file. Nullable fields
 * fall back to the defaults of the component they configure.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
public class StrategySettings {
    private String name;
    private String policy = StrategyFactory.CCI_THRESHOLD;
    private ContractSettings contract;
    private int checkIntervalSeconds = 10;

    private Double initialEma;
    private Integer emaPeriod;
    private Integer emaFastPeriod;
    private Integer emaSlowPeriod;
    private List<Integer> emaSpans = new ArrayList<>();
    private boolean multiEmaDiagnostics;
    private int diagnosticsEvery = 10;
    private boolean classicCci;
    private Integer historyCap;

    private String tradeTimezone;
    // "HH:mm" in tradeTimezone
    private String tradeStart;
    private String pauseStart;
    private String pauseEnd;
    private String newOrderCutoff;
    private String forceClose;
    private String shutdownAt;

    private Double tickSize;
    private Integer slTicks;
    private Integer tpTicksLong;
    private Integer tpTicksShort;
    private Integer quantity;
    private Integer signalDelaySeconds;
}

package in.ashwanthkumar.akbot.config;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import in.ashwanthkumar.akbot.broker.BrokerGateway;
import in.ashwanthkumar.akbot.broker.Contract;
import in.ashwanthkumar.akbot.broker.PriceFetcher;
import in.ashwanthkumar.akbot.engine.SignalPolicy;
import in.ashwanthkumar.akbot.engine.TickOrchestrator;
import in.ashwanthkumar.akbot.indicator.CciMode;
import in.ashwanthkumar.akbot.indicator.IndicatorConfig;
import in.ashwanthkumar.akbot.indicator.IndicatorEngine;
import in.ashwanthkumar.akbot.lifecycle.BracketSpec;
import in.ashwanthkumar.akbot.lifecycle.TradeLifecycle;
import in.ashwanthkumar.akbot.observability.TradingEventSink;
import in.ashwanthkumar.akbot.policy.CciReversalPolicy;
import in.ashwanthkumar.akbot.policy.CciThresholdPolicy;
import in.ashwanthkumar.akbot.policy.CciZeroCrossPolicy;
import in.ashwanthkumar.akbot.schedule.ScheduleConfig;
import in.ashwanthkumar.akbot.schedule.TradingWindowGate;
import org.apache.commons.lang3.StringUtils;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Set;

/**
 * Turns {@link StrategySettings} into a wired {@link TickOrchestrator}. Shared defaults
 * from {@link BotConfig} are applied here, the settings objects themselves are never changed.
 */
public class StrategyFactory {
    public static final String CCI_THRESHOLD = "cci-threshold";
    public static final String CCI_ZERO_CROSS = "cci-zero-cross";
    public static final String CCI_REVERSAL = "cci-reversal";
    public static final Set<String> POLICIES = ImmutableSet.of(CCI_THRESHOLD, CCI_ZERO_CROSS, CCI_REVERSAL);

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final BotConfig config;

    public StrategyFactory(BotConfig config) {
        this.config = config;
    }

    /**
     * @throws ConfigurationException on the first invalid setting
     */
    public void validate(StrategySettings settings) {
        checkInterval(settings);
        contract(settings);
        indicatorConfig(settings);
        schedule(settings);
        bracketSpec(settings);
        policy(settings);
    }

    public TickOrchestrator create(StrategySettings settings, BrokerGateway broker, PriceFetcher fetcher,
                                   TradingEventSink sink, Instant createdAt) {
        Contract contract = contract(settings);
        TradeLifecycle lifecycle = new TradeLifecycle(settings.getName(), contract, broker, bracketSpec(settings), sink, createdAt);
        return TickOrchestrator.builder()
                .instance(settings.getName())
                .contract(contract)
                .gate(new TradingWindowGate(schedule(settings)))
                .indicators(new IndicatorEngine(indicatorConfig(settings)))
                .lifecycle(lifecycle)
                .broker(broker)
                .fetcher(fetcher)
                .policy(policy(settings))
                .sink(sink)
                .diagnosticsEvery(settings.isMultiEmaDiagnostics() ? settings.getDiagnosticsEvery() : 0)
                .build();
    }

    public Duration checkInterval(StrategySettings settings) {
        if (settings.getCheckIntervalSeconds() <= 0) {
            throw invalid(settings, "checkIntervalSeconds must be positive, got " + settings.getCheckIntervalSeconds());
        }
        return Duration.ofSeconds(settings.getCheckIntervalSeconds());
    }

    public Contract contract(StrategySettings settings) {
        if (StringUtils.isBlank(settings.getName())) {
            throw new ConfigurationException("Every strategy needs a name");
        }
        ContractSettings c = settings.getContract();
        if (c == null) {
            throw invalid(settings, "missing contract");
        }
        try {
            return Contract.validated(c.getSymbol(), c.getExchange(), c.getCurrency(), c.getExpiry());
        } catch (IllegalArgumentException e) {
            throw invalid(settings, e.getMessage());
        }
    }

    public IndicatorConfig indicatorConfig(StrategySettings settings) {
        try {
            Preconditions.checkArgument(settings.getEmaSpans() == null || !settings.getEmaSpans().contains(null),
                    "EMA spans must be positive, got %s", settings.getEmaSpans());
            return IndicatorConfig.builder()
                    .emaPeriod(settings.getEmaPeriod())
                    .emaFastPeriod(settings.getEmaFastPeriod())
                    .emaSlowPeriod(settings.getEmaSlowPeriod())
                    .emaSpans(settings.getEmaSpans() == null ? null : ImmutableSet.copyOf(settings.getEmaSpans()))
                    .cciMode(CciMode.of(settings.isClassicCci()))
                    .initialEma(settings.getInitialEma())
                    .historyCap(settings.getHistoryCap())
                    .build();
        } catch (IllegalArgumentException e) {
            throw invalid(settings, e.getMessage());
        }
    }

    public ScheduleConfig schedule(StrategySettings settings) {
        String forceClose = StringUtils.defaultIfBlank(settings.getForceClose(), config.getDefaultForceClose());
        String cutoff = StringUtils.defaultIfBlank(settings.getNewOrderCutoff(), config.getTradeEnd());
        try {
            return ScheduleConfig.builder()
                    .tradeTimezone(zone(settings, settings.getTradeTimezone()))
                    .tradeStart(time(settings, "tradeStart", settings.getTradeStart()))
                    .pauseStart(time(settings, "pauseStart", settings.getPauseStart()))
                    .pauseEnd(time(settings, "pauseEnd", settings.getPauseEnd()))
                    .newOrderCutoff(time(settings, "newOrderCutoff", cutoff))
                    .forceClose(time(settings, "forceClose", forceClose))
                    .shutdownAt(time(settings, "shutdownAt", settings.getShutdownAt()))
                    .build();
        } catch (IllegalArgumentException e) {
            throw invalid(settings, e.getMessage());
        }
    }

    public BracketSpec bracketSpec(StrategySettings settings) {
        try {
            return BracketSpec.builder()
                    .quantity(settings.getQuantity())
                    .tickSize(settings.getTickSize())
                    .slTicks(settings.getSlTicks())
                    .tpTicksLong(settings.getTpTicksLong())
                    .tpTicksShort(settings.getTpTicksShort())
                    .build();
        } catch (IllegalArgumentException e) {
            throw invalid(settings, e.getMessage());
        }
    }

    public SignalPolicy policy(StrategySettings settings) {
        String policy = StringUtils.defaultString(settings.getPolicy());
        switch (policy) {
            case CCI_THRESHOLD:
                return new CciThresholdPolicy();
            case CCI_ZERO_CROSS:
                Integer delay = settings.getSignalDelaySeconds();
                if (delay != null && delay < 0) {
                    throw invalid(settings, "signalDelaySeconds can't be negative, got " + delay);
                }
                return new CciZeroCrossPolicy(delay == null ? CciZeroCrossPolicy.DEFAULT_DELAY : Duration.ofSeconds(delay));
            case CCI_REVERSAL:
                return new CciReversalPolicy();
            default:
                throw invalid(settings, "unknown policy '" + policy + "', expected one of " + POLICIES);
        }
    }

    private ZoneId zone(StrategySettings settings, String zone) {
        if (StringUtils.isBlank(zone)) {
            return null;
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw invalid(settings, "unknown time zone " + zone);
        }
    }

    private LocalTime time(StrategySettings settings, String field, String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return LocalTime.parse(value.trim(), HH_MM);
        } catch (DateTimeException e) {
            throw invalid(settings, field + " must be HH:mm, got '" + value + "'");
        }
    }

    private static ConfigurationException invalid(StrategySettings settings, String message) {
        return new ConfigurationException("Strategy " + settings.getName() + ": " + message);
    }
}

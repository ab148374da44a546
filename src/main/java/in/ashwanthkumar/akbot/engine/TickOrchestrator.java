package in.ashwanthkumar.akbot.engine;

import in.ashwanthkumar.akbot.broker.BrokerGateway;
import in.ashwanthkumar.akbot.broker.Contract;
import in.ashwanthkumar.akbot.broker.FetchTimeoutException;
import in.ashwanthkumar.akbot.broker.Fill;
import in.ashwanthkumar.akbot.broker.PriceFetcher;
import in.ashwanthkumar.akbot.indicator.IndicatorEngine;
import in.ashwanthkumar.akbot.indicator.InvalidSampleException;
import in.ashwanthkumar.akbot.lifecycle.Signal;
import in.ashwanthkumar.akbot.lifecycle.TradeLifecycle;
import in.ashwanthkumar.akbot.model.PriceSample;
import in.ashwanthkumar.akbot.observability.GateAction;
import in.ashwanthkumar.akbot.observability.TickRecord;
import in.ashwanthkumar.akbot.observability.TradingEventSink;
import in.ashwanthkumar.akbot.schedule.GateDecision;
import in.ashwanthkumar.akbot.schedule.TradingWindowGate;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Per tick entry point of a strategy instance. One tick runs:
 * <ol>
 *     <li>pending fills are applied to the lifecycle</li>
 *     <li>the gate is evaluated, force-close then shutdown are actioned</li>
 *     <li>when no new entry is allowed and nothing is open, the tick ends without fetching a price</li>
 *     <li>one price is fetched and fed to the indicators</li>
 *     <li>stop monitoring, the policy's signal and the pending signal are applied to the lifecycle</li>
 * </ol>
 * No exception from fetching or sampling leaves a tick, they are reported as warnings and the tick is skipped.
 */
@Slf4j
public class TickOrchestrator {
    @Getter
    private final String instance;
    @Getter
    private final Contract contract;
    private final TradingWindowGate gate;
    @Getter
    private final IndicatorEngine indicators;
    @Getter
    private final TradeLifecycle lifecycle;
    private final PriceFetcher fetcher;
    private final SignalPolicy policy;
    private final TradingEventSink sink;
    // emit an indicator snapshot every N processed ticks, 0 disables it
    private final int diagnosticsEvery;

    private final Queue<Fill> fills = new ConcurrentLinkedQueue<>();
    @Getter
    private boolean finished;
    @Getter
    private long processedTicks;

    @Builder
    private TickOrchestrator(String instance, Contract contract, TradingWindowGate gate, IndicatorEngine indicators,
                             TradeLifecycle lifecycle, BrokerGateway broker, PriceFetcher fetcher, SignalPolicy policy,
                             TradingEventSink sink, int diagnosticsEvery) {
        this.instance = instance;
        this.contract = contract;
        this.gate = gate;
        this.indicators = indicators;
        this.lifecycle = lifecycle;
        this.fetcher = fetcher == null ? broker : fetcher;
        this.policy = policy;
        this.sink = sink;
        this.diagnosticsEvery = diagnosticsEvery;
        broker.addFillListener(fills::add);
    }

    public TickContext tick(Instant now) {
        MDC.put("strategy", instance);
        try {
            return process(now);
        } finally {
            MDC.remove("strategy");
        }
    }

    private TickContext process(Instant now) {
        if (finished) {
            throw new IllegalStateException(instance + " has already shut down");
        }
        drainFills();

        GateDecision decision = gate.evaluate(now);
        if (decision.isMustForceClose()) {
            sink.onGateAction(instance, new GateAction(GateAction.Type.FORCE_CLOSE, now, lifecycle.getPhase(), lifecycle.hasOpenPosition()));
            lifecycle.forceClose(now);
        }
        if (decision.isMustShutdown()) {
            sink.onGateAction(instance, new GateAction(GateAction.Type.SHUTDOWN, now, lifecycle.getPhase(), lifecycle.hasOpenPosition()));
            lifecycle.shutdown(now);
            finished = true;
            return TickContext.withoutPrice(now, decision, lifecycle.getPhase(), indicators.emas());
        }

        if (!decision.isTradingAllowed() && !lifecycle.hasOpenPosition()) {
            // drops a pending signal, nothing to monitor
            lifecycle.advance(now, false, Double.NaN);
            log.debug("[{}] New entries blocked: {}", instance, decision.getBlockReason());
            return TickContext.withoutPrice(now, decision, lifecycle.getPhase(), indicators.emas());
        }

        Optional<PriceSample> sample = fetch(now);
        if (sample.isEmpty()) {
            return TickContext.withoutPrice(now, decision, lifecycle.getPhase(), indicators.emas());
        }
        double price = sample.get().getPrice();
        processedTicks++;
        // fills triggered by the broker while we were fetching
        drainFills();
        lifecycle.checkStop(price, now);

        TickContext context = context(now, decision, price);
        Optional<Signal> signal = policy.onTick(context, indicators);
        if (signal.isPresent() && decision.isTradingAllowed()) {
            lifecycle.onSignal(signal.get(), now);
        }
        lifecycle.advance(now, decision.isTradingAllowed(), price);

        context = context(now, decision, price);
        sink.onTick(new TickRecord(instance, now, price, context.getCciReading() == null ? null : context.getCciReading().getValue(),
                lifecycle.getPhase(), policy.annotate(indicators)));
        if (diagnosticsEvery > 0 && processedTicks % diagnosticsEvery == 0) {
            sink.onIndicators(instance, now, indicators.snapshot());
        }
        return context;
    }

    private Optional<PriceSample> fetch(Instant now) {
        PriceSample sample;
        try {
            sample = fetcher.fetchPrice(contract);
        } catch (FetchTimeoutException e) {
            sink.onWarning(instance, now, "Tick skipped: " + e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.debug("[{}] Price fetch failed", instance, e);
            sink.onWarning(instance, now, "Tick skipped, price fetch failed: " + e.getMessage());
            return Optional.empty();
        }
        try {
            indicators.update(sample);
        } catch (InvalidSampleException e) {
            sink.onWarning(instance, now, "Tick skipped, indicators preserved: " + e.getMessage());
            return Optional.empty();
        }
        return Optional.of(sample);
    }

    private TickContext context(Instant now, GateDecision decision, double price) {
        return new TickContext(now, decision, lifecycle.getPhase(), price, indicators.currentCci().orElse(null), indicators.emas());
    }

    private void drainFills() {
        Fill fill;
        while ((fill = fills.poll()) != null) {
            lifecycle.onFill(fill);
        }
    }
}

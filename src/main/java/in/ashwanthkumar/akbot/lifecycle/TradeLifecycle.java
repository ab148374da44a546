package in.ashwanthkumar.akbot.lifecycle;

import in.ashwanthkumar.akbot.broker.*;
import in.ashwanthkumar.akbot.model.OrderOp;
import in.ashwanthkumar.akbot.observability.TradingEventSink;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Owns the {@link TradePhase} of one instance and the bookkeeping of its bracket.
 * <p>
 * IDLE -> SIGNAL_PENDING -> BRACKET_SENT -> ACTIVE -> (EXITING ->) CLOSED -> IDLE.
 * Force-close and shutdown can cut in from any phase. Every transition is reported
 * to the {@link TradingEventSink} with the time spent in the previous phase.
 * <p>
 * Not thread safe, driven by the single polling loop of its instance.
 */
@Slf4j
public class TradeLifecycle {
    private final String instance;
    private final Contract contract;
    private final BrokerGateway broker;
    @Getter
    private final BracketSpec bracketSpec;
    private final TradingEventSink sink;

    @Getter
    private TradePhase phase = TradePhase.IDLE;
    private Instant phaseEnteredAt;

    private Signal pendingSignal;
    private Instant signalAt;
    private BracketOrder bracket;
    private BracketHandles handles;
    private String flattenOrderId;
    @Getter
    private int submissionFailures;

    public TradeLifecycle(String instance, Contract contract, BrokerGateway broker, BracketSpec bracketSpec,
                          TradingEventSink sink, Instant createdAt) {
        this.instance = instance;
        this.contract = contract;
        this.broker = broker;
        this.bracketSpec = bracketSpec;
        this.sink = sink;
        this.phaseEnteredAt = createdAt;
    }

    /**
     * Accept a qualified entry signal. Only an IDLE instance takes new signals.
     *
     * @return true when the signal was accepted
     */
    public boolean onSignal(Signal signal, Instant now) {
        if (phase != TradePhase.IDLE) {
            log.debug("[{}] Ignoring {} signal while {}", instance, signal.getOp(), phase);
            return false;
        }
        pendingSignal = signal;
        signalAt = now;
        transition(TradePhase.SIGNAL_PENDING, signal.getReason(), now);
        return true;
    }

    /**
     * Move a pending signal forward: drop it when the gate blocks new orders, send the
     * bracket once its delay has elapsed. A rejected bracket keeps the signal pending
     * so the next tick retries.
     *
     * @param referencePrice latest price, used to price the bracket legs
     */
    public void advance(Instant now, boolean newOrdersAllowed, double referencePrice) {
        if (phase == TradePhase.EXITING && flattenOrderId == null) {
            retryFlatten(now);
            return;
        }
        if (phase != TradePhase.SIGNAL_PENDING) {
            return;
        }
        if (!newOrdersAllowed) {
            clearSignal();
            transition(TradePhase.IDLE, "signal discarded, new orders blocked", now);
            return;
        }
        Duration waited = Duration.between(signalAt, now);
        if (waited.compareTo(pendingSignal.getDelay()) < 0) {
            log.debug("[{}] Waiting {}s more before sending the bracket", instance,
                    pendingSignal.getDelay().minus(waited).getSeconds());
            return;
        }

        BracketOrder order = bracketSpec.bracket(contract, pendingSignal.getOp(), referencePrice);
        try {
            BracketHandles submitted = broker.submitBracket(order);
            bracket = order;
            handles = submitted;
            submissionFailures = 0;
            clearSignal();
            transition(TradePhase.BRACKET_SENT, String.format("%s bracket sent, TP %.2f SL %.2f",
                    order.getOp(), order.getTakeProfit(), order.getStopLoss()), now);
        } catch (OrderSubmissionException e) {
            submissionFailures++;
            sink.onWarning(instance, now, String.format("Bracket submission failed (attempt %d), retrying next tick: %s",
                    submissionFailures, e.getMessage()));
        }
    }

    /**
     * Apply an execution report from the broker.
     */
    public void onFill(Fill fill) {
        String orderId = fill.getOrderId();
        Instant now = fill.getTime();
        switch (phase) {
            case BRACKET_SENT:
                if (handles.getEntryId().equals(orderId)) {
                    transition(TradePhase.ACTIVE, String.format("entry filled @ %.2f", fill.getPrice()), now);
                } else if (handles.isExitLeg(orderId)) {
                    // entry report overtaken by the exit leg
                    transition(TradePhase.ACTIVE, "entry filled", now);
                    close(exitLegReason(orderId, fill), now);
                } else {
                    ignored(fill);
                }
                break;
            case ACTIVE:
                if (handles.isExitLeg(orderId)) {
                    close(exitLegReason(orderId, fill), now);
                } else {
                    ignored(fill);
                }
                break;
            case EXITING:
                if (orderId.equals(flattenOrderId)) {
                    close(String.format("flatten filled @ %.2f", fill.getPrice()), now);
                } else if (handles != null && handles.isExitLeg(orderId)) {
                    close(exitLegReason(orderId, fill), now);
                } else {
                    ignored(fill);
                }
                break;
            default:
                ignored(fill);
        }
    }

    /**
     * Watch the stop independently of the broker's stop order. A LONG breaches at or
     * below the stop, a SHORT at or above it. A breach cancels the working legs and flattens.
     *
     * @return true when a breach was detected on this call
     */
    public boolean checkStop(double price, Instant now) {
        if (phase != TradePhase.ACTIVE || bracket == null) {
            return false;
        }
        double stop = bracket.getStopLoss();
        boolean breached = bracket.getOp() == OrderOp.BUY ? price <= stop : price >= stop;
        if (!breached) {
            return false;
        }
        transition(TradePhase.EXITING, String.format("stop breached @ %.2f vs SL %.2f", price, stop), now);
        broker.cancelAll(contract);
        retryFlatten(now);
        return true;
    }

    /**
     * Daily force-close: flatten whatever is open and go back to IDLE, the loop keeps running.
     */
    public void forceClose(Instant now) {
        flattenAndReset("force-close", now);
    }

    /**
     * Final cancel and flatten before the polling loop exits.
     */
    public void shutdown(Instant now) {
        flattenAndReset("shutdown", now);
    }

    /**
     * @return true while the broker may hold a position or working orders for this instance
     */
    public boolean hasOpenPosition() {
        return phase.holdsOrders();
    }

    public Optional<BracketHandles> handles() {
        return Optional.ofNullable(handles);
    }

    public Optional<BracketOrder> bracket() {
        return Optional.ofNullable(bracket);
    }

    public Optional<Signal> pendingSignal() {
        return Optional.ofNullable(pendingSignal);
    }

    public Duration timeInPhase(Instant now) {
        return nonNegative(Duration.between(phaseEnteredAt, now));
    }

    private void flattenAndReset(String reason, Instant now) {
        broker.cancelAll(contract);
        switch (phase) {
            case IDLE:
                if (broker.hasOpenPosition(contract)) {
                    // position the lifecycle doesn't own, flatten it without a transition
                    flattenQuietly(reason, now);
                }
                break;
            case SIGNAL_PENDING:
                clearSignal();
                transition(TradePhase.IDLE, reason + ", pending signal dropped", now);
                break;
            default:
                boolean positionOpen = phase != TradePhase.BRACKET_SENT || broker.hasOpenPosition(contract);
                if (!positionOpen) {
                    clearBracket();
                    transition(TradePhase.IDLE, reason + ", unfilled bracket cancelled", now);
                } else if (flattenQuietly(reason, now)) {
                    close(reason, now);
                } else if (phase != TradePhase.EXITING) {
                    flattenOrderId = null;
                    transition(TradePhase.EXITING, reason + ", flatten rejected, retrying", now);
                }
        }
    }

    private boolean flattenQuietly(String reason, Instant now) {
        try {
            broker.flatten(contract);
            return true;
        } catch (OrderSubmissionException e) {
            sink.onWarning(instance, now, reason + ": flatten failed: " + e.getMessage());
            return false;
        }
    }

    private void retryFlatten(Instant now) {
        try {
            Optional<String> closingOrder = broker.flatten(contract);
            if (closingOrder.isPresent()) {
                flattenOrderId = closingOrder.get();
            } else {
                close("nothing left to flatten", now);
            }
        } catch (OrderSubmissionException e) {
            submissionFailures++;
            sink.onWarning(instance, now, String.format("Flatten failed (attempt %d), retrying next tick: %s",
                    submissionFailures, e.getMessage()));
        }
    }

    // CLOSED is a pass-through, the reset to IDLE happens in the same step
    private void close(String reason, Instant now) {
        transition(TradePhase.CLOSED, reason, now);
        clearBracket();
        transition(TradePhase.IDLE, "reset after close", now);
    }

    private void transition(TradePhase to, String reason, Instant now) {
        TradePhase from = phase;
        Duration inPrevious = nonNegative(Duration.between(phaseEnteredAt, now));
        phase = to;
        phaseEnteredAt = now;
        sink.onTransition(instance, new PhaseTransition(from, to, reason, inPrevious, now));
    }

    private String exitLegReason(String orderId, Fill fill) {
        String leg = handles.getTakeProfitId().equals(orderId) ? "take-profit" : "stop-loss";
        return String.format("%s filled @ %.2f", leg, fill.getPrice());
    }

    private void ignored(Fill fill) {
        log.debug("[{}] Ignoring fill {} while {}", instance, fill.getOrderId(), phase);
    }

    private void clearSignal() {
        pendingSignal = null;
        signalAt = null;
    }

    private void clearBracket() {
        bracket = null;
        handles = null;
        flattenOrderId = null;
        submissionFailures = 0;
    }

    private static Duration nonNegative(Duration duration) {
        return duration.isNegative() ? Duration.ZERO : duration;
    }
}

package in.ashwanthkumar.akbot.engine;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative polling loop of one strategy instance. Each tick is fully processed before
 * the next one is considered. A tick that overruns its slot makes the loop skip the
 * missed slots instead of queueing them. The loop ends after the tick on which the gate
 * signalled shutdown.
 */
@Slf4j
public class StrategyRunner implements Runnable {
    @Getter
    private final TickOrchestrator orchestrator;
    private final Duration interval;
    private final Clock clock;
    @Getter
    private long skippedSlots;
    @Getter
    private long failedTicks;

    public StrategyRunner(TickOrchestrator orchestrator, Duration interval, Clock clock) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Check interval must be positive, got " + interval);
        }
        this.orchestrator = orchestrator;
        this.interval = interval;
        this.clock = clock;
    }

    @Override
    public void run() {
        String instance = orchestrator.getInstance();
        log.info("[{}] Running on {} every {}ms", instance, orchestrator.getContract(), interval.toMillis());
        Instant slot = clock.instant();
        while (!orchestrator.isFinished()) {
            runOnce(slot);
            if (orchestrator.isFinished()) {
                break;
            }
            slot = nextSlot(slot);
            if (!sleepUntil(slot)) {
                log.warn("[{}] Interrupted between ticks, leaving the loop in phase {}", instance, orchestrator.getLifecycle().getPhase());
                return;
            }
        }
        log.info("[{}] Shut down after {} processed ticks", instance, orchestrator.getProcessedTicks());
    }

    void runOnce(Instant slot) {
        try {
            orchestrator.tick(clock.instant());
        } catch (RuntimeException e) {
            // the lifecycle keeps its phase, a live order stays tracked across the failure
            failedTicks++;
            log.error("[{}] Tick at {} failed in phase {}", orchestrator.getInstance(), slot, orchestrator.getLifecycle().getPhase(), e);
        }
    }

    private Instant nextSlot(Instant previous) {
        Instant next = previous.plus(interval);
        Instant now = clock.instant();
        while (!next.isAfter(now)) {
            skippedSlots++;
            next = next.plus(interval);
        }
        return next;
    }

    private boolean sleepUntil(Instant slot) {
        long millis = Duration.between(clock.instant(), slot).toMillis();
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

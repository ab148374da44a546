package in.ashwanthkumar.akbot.schedule;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Decides per tick whether new entries are permitted and whether force-close or
 * shutdown must act. The checks run in a fixed order: force-close, pause window,
 * trading start / new-order cutoff, shutdown.
 * <p>
 * The only state kept is the next force-close trigger, which moves to the following
 * day once it fires so it fires at most once per day.
 */
@Slf4j
public class TradingWindowGate {
    @Getter
    private final ScheduleConfig schedule;
    private ZonedDateTime nextForceClose;

    public TradingWindowGate(ScheduleConfig schedule) {
        this.schedule = schedule;
    }

    public GateDecision evaluate(Instant now) {
        ZonedDateTime local = now.atZone(schedule.getTradeTimezone());
        LocalTime time = local.toLocalTime();

        // 1. force-close
        boolean forceClose = false;
        if (schedule.getForceClose() != null) {
            if (nextForceClose == null) {
                nextForceClose = firstForceClose(local);
            }
            if (!local.isBefore(nextForceClose)) {
                forceClose = true;
                nextForceClose = rollForward(local);
                log.debug("Force-close fired at {}, next trigger {}", local, nextForceClose);
            }
        }

        // 2. pause window, 3. trading start and new-order cutoff
        String blockReason = null;
        if (schedule.hasPauseWindow() && !time.isBefore(schedule.getPauseStart()) && time.isBefore(schedule.getPauseEnd())) {
            blockReason = "pause window " + schedule.getPauseStart() + "-" + schedule.getPauseEnd();
        } else if (schedule.getTradeStart() != null && time.isBefore(schedule.getTradeStart())) {
            blockReason = "before trading start " + schedule.getTradeStart();
        } else if (schedule.getNewOrderCutoff() != null && !time.isBefore(schedule.getNewOrderCutoff())) {
            blockReason = "after new order cutoff " + schedule.getNewOrderCutoff();
        }

        // 4. shutdown
        boolean shutdown = schedule.getShutdownAt() != null && !time.isBefore(schedule.getShutdownAt());

        return new GateDecision(blockReason == null, forceClose, shutdown, blockReason);
    }

    /**
     * @return next instant force-close fires, empty before the first evaluation or when not configured
     */
    public Optional<ZonedDateTime> nextForceClose() {
        return Optional.ofNullable(nextForceClose);
    }

    // an instance started after today's trigger force-closes on its first tick
    private ZonedDateTime firstForceClose(ZonedDateTime now) {
        return now.toLocalDate().atTime(schedule.getForceClose()).atZone(schedule.getTradeTimezone());
    }

    // next daily trigger after the one that fired, skipping only triggers already behind us
    private ZonedDateTime rollForward(ZonedDateTime firedAt) {
        LocalDate day = nextForceClose.toLocalDate().plusDays(1);
        ZonedDateTime next = day.atTime(schedule.getForceClose()).atZone(schedule.getTradeTimezone());
        while (!next.isAfter(firedAt)) {
            day = day.plusDays(1);
            next = day.atTime(schedule.getForceClose()).atZone(schedule.getTradeTimezone());
        }
        return next;
    }
}

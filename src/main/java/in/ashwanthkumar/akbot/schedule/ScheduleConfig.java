package in.ashwanthkumar.akbot.schedule;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Wall-clock schedule of one strategy instance. Every time is local to {@link #getTradeTimezone()}.
 * Immutable once built.
 */
@Getter
@ToString
public class ScheduleConfig {
    public static final ZoneId DEFAULT_TIMEZONE = ZoneId.of("Asia/Jerusalem");

    private final ZoneId tradeTimezone;
    // new entries are blocked before this time of day
    private final LocalTime tradeStart;
    // new entries are blocked inside [pauseStart, pauseEnd)
    private final LocalTime pauseStart;
    private final LocalTime pauseEnd;
    // new entries are blocked at or after this time of day
    private final LocalTime newOrderCutoff;
    // open positions are flattened once a day at this time, the loop keeps running
    private final LocalTime forceClose;
    // orders are cancelled, positions flattened and the loop stops at this time
    private final LocalTime shutdownAt;

    @Builder
    private ScheduleConfig(ZoneId tradeTimezone, LocalTime tradeStart, LocalTime pauseStart, LocalTime pauseEnd,
                           LocalTime newOrderCutoff, LocalTime forceClose, LocalTime shutdownAt) {
        Preconditions.checkArgument((pauseStart == null) == (pauseEnd == null),
                "Pause window needs both start and end, got %s - %s", pauseStart, pauseEnd);
        if (pauseStart != null) {
            Preconditions.checkArgument(pauseStart.isBefore(pauseEnd),
                    "Pause window start %s must be before its end %s", pauseStart, pauseEnd);
        }
        if (tradeStart != null && newOrderCutoff != null) {
            Preconditions.checkArgument(tradeStart.isBefore(newOrderCutoff),
                    "Trading start %s must be before the new order cutoff %s", tradeStart, newOrderCutoff);
        }
        this.tradeTimezone = tradeTimezone == null ? DEFAULT_TIMEZONE : tradeTimezone;
        this.tradeStart = tradeStart;
        this.pauseStart = pauseStart;
        this.pauseEnd = pauseEnd;
        this.newOrderCutoff = newOrderCutoff;
        this.forceClose = forceClose;
        this.shutdownAt = shutdownAt;
    }

    public Optional<LocalTime> forceCloseTime() {
        return Optional.ofNullable(forceClose);
    }

    public Optional<LocalTime> shutdownTime() {
        return Optional.ofNullable(shutdownAt);
    }

    public boolean hasPauseWindow() {
        return pauseStart != null;
    }

    public static ScheduleConfig unrestricted(ZoneId zone) {
        return ScheduleConfig.builder().tradeTimezone(zone).build();
    }
}

package in.ashwanthkumar.akbot.schedule;

import org.junit.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class TradingWindowGateTest {
    private static final ZoneId ZONE = ZoneId.of("Asia/Jerusalem");
    private static final LocalDate DAY = LocalDate.of(2025, 3, 10);

    private static final ScheduleConfig FORCE_CLOSE_AND_SHUTDOWN = ScheduleConfig.builder()
            .tradeTimezone(ZONE)
            .forceClose(LocalTime.of(21, 45))
            .shutdownAt(LocalTime.of(22, 50))
            .build();

    @Test
    public void testForceCloseWithoutShutdown() {
        GateDecision decision = new TradingWindowGate(FORCE_CLOSE_AND_SHUTDOWN).evaluate(at(DAY, 21, 45, 0));
        assertThat(decision.isMustForceClose(), is(true));
        assertThat(decision.isMustShutdown(), is(false));
        assertThat(decision.isTradingAllowed(), is(true));
    }

    @Test
    public void testForceCloseAndShutdownOnTheSameTick() {
        GateDecision decision = new TradingWindowGate(FORCE_CLOSE_AND_SHUTDOWN).evaluate(at(DAY, 22, 50, 0));
        assertThat(decision.isMustForceClose(), is(true));
        assertThat(decision.isMustShutdown(), is(true));
    }

    @Test
    public void testNothingFiresBeforeTheTriggers() {
        GateDecision decision = new TradingWindowGate(FORCE_CLOSE_AND_SHUTDOWN).evaluate(at(DAY, 21, 44, 59));
        assertThat(decision.isMustForceClose(), is(false));
        assertThat(decision.isMustShutdown(), is(false));
    }

    @Test
    public void testForceCloseFiresOncePerDay() {
        ScheduleConfig schedule = ScheduleConfig.builder().tradeTimezone(ZONE).forceClose(LocalTime.of(21, 45)).build();
        TradingWindowGate gate = new TradingWindowGate(schedule);

        assertThat(gate.evaluate(at(DAY, 21, 0, 0)).isMustForceClose(), is(false));
        assertThat(gate.evaluate(at(DAY, 21, 45, 10)).isMustForceClose(), is(true));
        assertThat(gate.nextForceClose().get(), is(DAY.plusDays(1).atTime(21, 45).atZone(ZONE)));
        for (int minute = 46; minute < 60; minute++) {
            assertThat(gate.evaluate(at(DAY, 21, minute, 0)).isMustForceClose(), is(false));
        }
        assertThat(gate.evaluate(at(DAY, 23, 59, 59)).isMustForceClose(), is(false));

        LocalDate next = DAY.plusDays(1);
        assertThat(gate.evaluate(at(next, 0, 0, 1)).isMustForceClose(), is(false));
        assertThat(gate.evaluate(at(next, 21, 44, 59)).isMustForceClose(), is(false));
        assertThat(gate.evaluate(at(next, 21, 45, 0)).isMustForceClose(), is(true));
        assertThat(gate.evaluate(at(next, 21, 45, 10)).isMustForceClose(), is(false));
    }

    @Test
    public void testLateFireKeepsTheNextDaysTrigger() {
        ScheduleConfig schedule = ScheduleConfig.builder().tradeTimezone(ZONE).forceClose(LocalTime.of(21, 45)).build();
        TradingWindowGate gate = new TradingWindowGate(schedule);

        assertThat(gate.evaluate(at(DAY, 20, 0, 0)).isMustForceClose(), is(false));
        // no tick until after midnight, the missed trigger fires late but only once
        assertThat(gate.evaluate(at(DAY.plusDays(1), 0, 30, 0)).isMustForceClose(), is(true));
        assertThat(gate.nextForceClose().get(), is(DAY.plusDays(1).atTime(21, 45).atZone(ZONE)));
        assertThat(gate.evaluate(at(DAY.plusDays(1), 21, 44, 59)).isMustForceClose(), is(false));
        assertThat(gate.evaluate(at(DAY.plusDays(1), 21, 45, 0)).isMustForceClose(), is(true));
        assertThat(gate.nextForceClose().get(), is(DAY.plusDays(2).atTime(21, 45).atZone(ZONE)));
    }

    @Test
    public void testTriggersMissedForDaysFireOnce() {
        ScheduleConfig schedule = ScheduleConfig.builder().tradeTimezone(ZONE).forceClose(LocalTime.of(21, 45)).build();
        TradingWindowGate gate = new TradingWindowGate(schedule);

        assertThat(gate.evaluate(at(DAY, 20, 0, 0)).isMustForceClose(), is(false));
        assertThat(gate.evaluate(at(DAY.plusDays(3), 22, 0, 0)).isMustForceClose(), is(true));
        assertThat(gate.nextForceClose().get(), is(DAY.plusDays(4).atTime(21, 45).atZone(ZONE)));
        assertThat(gate.evaluate(at(DAY.plusDays(3), 23, 0, 0)).isMustForceClose(), is(false));
    }

    @Test
    public void testPauseWindowBlocksNewEntries() {
        ScheduleConfig schedule = ScheduleConfig.builder()
                .tradeTimezone(ZONE)
                .pauseStart(LocalTime.of(16, 20))
                .pauseEnd(LocalTime.of(16, 40))
                .build();
        TradingWindowGate gate = new TradingWindowGate(schedule);

        assertThat(gate.evaluate(at(DAY, 16, 19, 59)).isTradingAllowed(), is(true));
        GateDecision paused = gate.evaluate(at(DAY, 16, 20, 0));
        assertThat(paused.isTradingAllowed(), is(false));
        assertThat(paused.blockReason().isPresent(), is(true));
        assertThat(gate.evaluate(at(DAY, 16, 39, 59)).isTradingAllowed(), is(false));
        assertThat(gate.evaluate(at(DAY, 16, 40, 0)).isTradingAllowed(), is(true));
    }

    @Test
    public void testTradingStartAndCutoff() {
        ScheduleConfig schedule = ScheduleConfig.builder()
                .tradeTimezone(ZONE)
                .tradeStart(LocalTime.of(8, 0))
                .newOrderCutoff(LocalTime.of(23, 0))
                .build();
        TradingWindowGate gate = new TradingWindowGate(schedule);

        assertThat(gate.evaluate(at(DAY, 7, 59, 59)).isTradingAllowed(), is(false));
        assertThat(gate.evaluate(at(DAY, 8, 0, 0)).isTradingAllowed(), is(true));
        assertThat(gate.evaluate(at(DAY, 22, 59, 59)).isTradingAllowed(), is(true));
        GateDecision cutoff = gate.evaluate(at(DAY, 23, 0, 0));
        assertThat(cutoff.isTradingAllowed(), is(false));
        assertThat(cutoff.isMustShutdown(), is(false));
    }

    @Test
    public void testTimesAreReadInTheTradeTimezone() {
        ScheduleConfig schedule = ScheduleConfig.builder()
                .tradeTimezone(ZoneId.of("America/Chicago"))
                .newOrderCutoff(LocalTime.of(15, 0))
                .build();
        TradingWindowGate gate = new TradingWindowGate(schedule);

        // 15:00 in Jerusalem is still morning in Chicago
        assertThat(gate.evaluate(at(DAY, 15, 0, 0)).isTradingAllowed(), is(true));
        Instant chicagoAfternoon = ZonedDateTime.of(DAY, LocalTime.of(15, 1), ZoneId.of("America/Chicago")).toInstant();
        assertThat(gate.evaluate(chicagoAfternoon).isTradingAllowed(), is(false));
    }

    @Test
    public void testUnrestrictedScheduleAlwaysAllowsTrading() {
        TradingWindowGate gate = new TradingWindowGate(ScheduleConfig.unrestricted(ZONE));
        GateDecision decision = gate.evaluate(at(DAY, 3, 0, 0));
        assertThat(decision, is(GateDecision.open()));
        assertThat(gate.nextForceClose().isPresent(), is(false));
    }

    static Instant at(LocalDate day, int hour, int minute, int second) {
        return ZonedDateTime.of(day, LocalTime.of(hour, minute, second), ZONE).toInstant();
    }
}

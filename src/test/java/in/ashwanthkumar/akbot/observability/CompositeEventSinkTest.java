package in.ashwanthkumar.akbot.observability;

import in.ashwanthkumar.akbot.lifecycle.PhaseTransition;
import in.ashwanthkumar.akbot.lifecycle.TradePhase;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class CompositeEventSinkTest {
    private static final Instant T0 = Instant.parse("2025-03-10T08:00:00Z");

    @Test
    public void testEveryEventReachesEverySink() {
        RecordingEventSink first = new RecordingEventSink();
        RecordingEventSink second = new RecordingEventSink();
        // the log sink must accept the same events without failing
        TradingEventSink sink = CompositeEventSink.of(first, new Slf4jEventSink(), second);

        sink.onTransition("mes", new PhaseTransition(TradePhase.IDLE, TradePhase.SIGNAL_PENDING, "cross", Duration.ZERO, T0));
        sink.onGateAction("mes", new GateAction(GateAction.Type.SHUTDOWN, T0, TradePhase.IDLE, false));
        sink.onTick(new TickRecord("mes", T0, 100.0, null, TradePhase.IDLE, Collections.singletonMap("EMA10", 99.5)));
        sink.onWarning("mes", T0, "fetch timed out");

        assertThat(first.order, is(second.order));
        assertThat(first.order.size(), is(4));
    }
}

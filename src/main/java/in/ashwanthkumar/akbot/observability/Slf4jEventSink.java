package in.ashwanthkumar.akbot.observability;

import in.ashwanthkumar.akbot.indicator.CciReading;
import in.ashwanthkumar.akbot.indicator.IndicatorSnapshot;
import in.ashwanthkumar.akbot.lifecycle.PhaseTransition;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Writes every event to the application log. Instances on the {@link ConsoleAllowList}
 * are mirrored to the {@code console} logger as well.
 */
@Slf4j
public class Slf4jEventSink implements TradingEventSink {
    private static final Logger CONSOLE = LoggerFactory.getLogger("console");

    @Override
    public void onTransition(String instance, PhaseTransition t) {
        emit(instance, false, "[{}] {} -> {} ({}) after {}ms in {}",
                instance, t.getFrom(), t.getTo(), t.getReason(), t.getDurationInPrevious().toMillis(), t.getFrom());
    }

    @Override
    public void onGateAction(String instance, GateAction action) {
        emit(instance, false, "[{}] {} at {} in phase {}, position open: {}",
                instance, action.getType(), action.getTime(), action.getPhase(), action.isPositionOpen());
    }

    @Override
    public void onTick(TickRecord record) {
        String cci = record.getCci() == null ? "n/a" : String.format("%.2f", record.getCci());
        String extras = record.getAnnotations().entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(" | "));
        emit(record.getInstance(), false, "[{}] {} price: {} | CCI: {} | phase: {}{}",
                record.getInstance(), record.getTime(), record.getPrice(), cci, record.getPhase(),
                extras.isEmpty() ? "" : " | " + extras);
    }

    @Override
    public void onIndicators(String instance, Instant time, IndicatorSnapshot snapshot) {
        String emas = snapshot.getEmas().getMulti().entrySet().stream()
                .map(e -> String.format("EMA(%d)=%.2f", e.getKey(), e.getValue()))
                .collect(Collectors.joining(" | "));
        String cci = snapshot.cciReading()
                .map(Slf4jEventSink::describe)
                .orElse("CCI n/a");
        emit(instance, false, "[{}] {} snapshot after {} samples: {} | {}", instance, time, snapshot.getSamplesSeen(), emas, cci);
    }

    @Override
    public void onWarning(String instance, Instant time, String message) {
        emit(instance, true, "[{}] {} {}", instance, time, message);
    }

    private static String describe(CciReading reading) {
        return String.format("CCI=%.2f (%s, prev %s) mean=%.2f dispersion=%.4f", reading.getValue(), reading.trend(),
                reading.getPrevious() == null ? "-" : String.format("%.2f", reading.getPrevious()),
                reading.getMean(), reading.getDispersion());
    }

    private static void emit(String instance, boolean warning, String format, Object... args) {
        if (warning) {
            log.warn(format, args);
        } else {
            log.info(format, args);
        }
        if (ConsoleAllowList.allows(instance)) {
            if (warning) {
                CONSOLE.warn(format, args);
            } else {
                CONSOLE.info(format, args);
            }
        }
    }
}

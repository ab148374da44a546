package in.ashwanthkumar.akbot.observability;

import in.ashwanthkumar.akbot.indicator.IndicatorSnapshot;
import in.ashwanthkumar.akbot.lifecycle.PhaseTransition;
import lombok.extern.slf4j.Slf4j;
import tech.tablesaw.api.DateTimeColumn;
import tech.tablesaw.api.DoubleColumn;
import tech.tablesaw.api.StringColumn;
import tech.tablesaw.api.Table;

import java.io.File;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Collects one row per processed tick and every phase transition, so a session
 * can be exported to CSV and inspected afterwards. Safe to share between instances.
 */
@Slf4j
public class TickJournal implements TradingEventSink {
    private final ZoneId zone;
    private final Table ticks;
    private final Table transitions;

    public TickJournal(ZoneId zone) {
        this.zone = zone;
        this.ticks = Table.create("ticks",
                StringColumn.create("Instance"),
                DateTimeColumn.create("Time"),
                DoubleColumn.create("Price"),
                DoubleColumn.create("CCI"),
                StringColumn.create("Phase"));
        this.transitions = Table.create("transitions",
                StringColumn.create("Instance"),
                DateTimeColumn.create("Time"),
                StringColumn.create("From"),
                StringColumn.create("To"),
                StringColumn.create("Reason"),
                DoubleColumn.create("SecondsInPrevious"));
    }

    @Override
    public synchronized void onTick(TickRecord record) {
        ticks.stringColumn("Instance").append(record.getInstance());
        ticks.dateTimeColumn("Time").append(local(record.getTime()));
        ticks.doubleColumn("Price").append(record.getPrice());
        if (record.getCci() == null) {
            ticks.doubleColumn("CCI").appendMissing();
        } else {
            ticks.doubleColumn("CCI").append(record.getCci());
        }
        ticks.stringColumn("Phase").append(record.getPhase().name());
    }

    @Override
    public synchronized void onTransition(String instance, PhaseTransition transition) {
        transitions.stringColumn("Instance").append(instance);
        transitions.dateTimeColumn("Time").append(local(transition.getTime()));
        transitions.stringColumn("From").append(transition.getFrom().name());
        transitions.stringColumn("To").append(transition.getTo().name());
        transitions.stringColumn("Reason").append(transition.getReason());
        transitions.doubleColumn("SecondsInPrevious").append(transition.getDurationInPrevious().toMillis() / 1000.0);
    }

    @Override
    public void onGateAction(String instance, GateAction action) {
        // the transitions it causes are journaled
    }

    @Override
    public void onIndicators(String instance, Instant time, IndicatorSnapshot snapshot) {
    }

    @Override
    public void onWarning(String instance, Instant time, String message) {
    }

    public synchronized Table ticks() {
        return ticks.copy();
    }

    public synchronized Table transitions() {
        return transitions.copy();
    }

    /**
     * Write the journal as two CSV files, {@code <prefix>-ticks.csv} and {@code <prefix>-transitions.csv}.
     */
    public synchronized void writeCsv(File directory, String prefix) {
        if (!directory.exists() && !directory.mkdirs()) {
            throw new IllegalStateException("Could not create " + directory.getAbsolutePath());
        }
        File ticksFile = new File(directory, prefix + "-ticks.csv");
        File transitionsFile = new File(directory, prefix + "-transitions.csv");
        try {
            ticks.write().csv(ticksFile);
            transitions.write().csv(transitionsFile);
        } catch (Exception e) {
            throw new RuntimeException("Could not write the journal to " + directory.getAbsolutePath(), e);
        }
        log.info("Journal written: {} ticks to {}, {} transitions to {}", ticks.rowCount(), ticksFile, transitions.rowCount(), transitionsFile);
    }

    private LocalDateTime local(Instant time) {
        return LocalDateTime.ofInstant(time, zone);
    }
}

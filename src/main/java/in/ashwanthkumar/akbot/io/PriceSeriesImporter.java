package in.ashwanthkumar.akbot.io;

import in.ashwanthkumar.akbot.model.PriceSample;
import in.ashwanthkumar.akbot.plugins.OhlcCsvTransformation;
import in.ashwanthkumar.akbot.plugins.TableTransformation;
import lombok.extern.slf4j.Slf4j;
import tech.tablesaw.api.DateTimeColumn;
import tech.tablesaw.api.Table;
import tech.tablesaw.api.NumericColumn;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a recorded price series for replay.
 */
@Slf4j
public class PriceSeriesImporter {
    // We shouldn't be doing any changes to the table after the initial transformation
    private final Table table;

    public PriceSeriesImporter(Table table, TableTransformation transformation) {
        // keep a copy, so we're not affected by any lingering references to the transformed table
        this.table = transformation.transform(table).copy();
    }

    public static PriceSeriesImporter fromCsv(String path) {
        return fromCsv(path, new OhlcCsvTransformation());
    }

    public static PriceSeriesImporter fromCsv(String path, TableTransformation transformation) {
        log.info("Loading the price series {}", path);
        Table t = Table.read().file(path);
        return new PriceSeriesImporter(t, transformation);
    }

    public Table getTable() {
        return table;
    }

    /**
     * @param zone zone the bar times were recorded in
     * @return one sample per row, in time order. Samples carry the full bar when High and Low are present.
     */
    public List<PriceSample> samples(ZoneId zone) {
        DateTimeColumn time = table.dateTimeColumn(OhlcCsvTransformation.TIME_COLUMN);
        NumericColumn<?> close = table.numberColumn("Close");
        boolean hasBar = table.containsColumn("High") && table.containsColumn("Low");
        NumericColumn<?> high = hasBar ? table.numberColumn("High") : null;
        NumericColumn<?> low = hasBar ? table.numberColumn("Low") : null;

        List<PriceSample> samples = new ArrayList<>(table.rowCount());
        for (int i = 0; i < table.rowCount(); i++) {
            Instant at = time.get(i).atZone(zone).toInstant();
            if (hasBar && !high.isMissing(i) && !low.isMissing(i)) {
                samples.add(PriceSample.ohlc(at, high.getDouble(i), low.getDouble(i), close.getDouble(i)));
            } else {
                samples.add(PriceSample.of(at, close.getDouble(i)));
            }
        }
        return samples;
    }
}

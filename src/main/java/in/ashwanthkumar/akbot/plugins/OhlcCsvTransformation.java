package in.ashwanthkumar.akbot.plugins;

import lombok.extern.slf4j.Slf4j;
import tech.tablesaw.api.DateTimeColumn;
import tech.tablesaw.api.Table;
import tech.tablesaw.columns.Column;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Bars exported from the broker's chart: {@code Date/Time,Open,High,Low,Close}. Open, High and
 * Low are optional. Rows without a Close are dropped.
 */
@Slf4j
public class OhlcCsvTransformation implements TableTransformation {
    public static final String SOURCE_TIME_COLUMN = "Date/Time";
    public static final String TIME_COLUMN = "Time";
    public static final DateTimeFormatter SOURCE_FORMAT = DateTimeFormatter.ofPattern("dd-MM-yyyy HH:mm:ss");

    @Override
    public Table transform(Table table) {
        // Step 1: Parse the Date/Time as LocalDateTime, tablesaw may already have detected it
        Column<?> raw = table.column(SOURCE_TIME_COLUMN);
        DateTimeColumn parsed = DateTimeColumn.create(TIME_COLUMN);
        for (int i = 0; i < raw.size(); i++) {
            Object value = raw.get(i);
            if (value instanceof LocalDateTime) {
                parsed.append((LocalDateTime) value);
            } else {
                parsed.append(LocalDateTime.parse(raw.getString(i).trim(), SOURCE_FORMAT));
            }
        }
        table.addColumns(parsed);
        table.removeColumns(SOURCE_TIME_COLUMN);

        // Step 2: Drop the bars that never closed and order by time
        int before = table.rowCount();
        Table cleaned = table.dropWhere(table.numberColumn("Close").isMissing());
        if (cleaned.rowCount() != before) {
            log.warn("Dropped {} rows without a Close price", before - cleaned.rowCount());
        }
        return cleaned.sortAscendingOn(TIME_COLUMN);
    }
}

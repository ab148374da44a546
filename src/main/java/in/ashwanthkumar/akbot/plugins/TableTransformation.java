package in.ashwanthkumar.akbot.plugins;

import tech.tablesaw.api.Table;

public interface TableTransformation {
    /**
     * Transform the parsed Table
     *
     * @param input Table that is parsed from the CSV
     * @return Table with a {@code Time} date-time column and numeric price columns, sorted by time.
     */
    Table transform(Table input);
}

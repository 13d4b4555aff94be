package enricher.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A loaded input table: header names plus rows in file order.
 */
public record Table(List<String> headers, List<Row> rows) {

    public Table {
        Objects.requireNonNull(headers, "headers is required");
        Objects.requireNonNull(rows, "rows is required");
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }

    /** Build a table from raw records, normalising every record to the header width. */
    public static Table of(List<String> headers, List<List<String>> records) {
        List<Row> rows = new ArrayList<>(records.size());
        for (List<String> record : records) {
            rows.add(Row.of(headers, record));
        }
        return new Table(headers, rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return headers.size();
    }

    /** First {@code n} rows (or all if there are fewer). */
    public List<Row> head(int n) {
        return rows.subList(0, Math.min(Math.max(n, 0), rows.size()));
    }

    /** Values of one column, top to bottom. */
    public List<String> column(int index) {
        return rows.stream().map(r -> r.get(index)).toList();
    }
}

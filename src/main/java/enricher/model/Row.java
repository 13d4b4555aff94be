package enricher.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable input record: column name to text value, in the table's header order.
 * Records shorter than the header are padded with empty strings, longer ones are
 * cut to the header width.
 */
public final class Row {
    private final List<String> headers;
    private final List<String> values;

    private Row(List<String> headers, List<String> values) {
        this.headers = headers;
        this.values = values;
    }

    /**
     * Build a row from raw cell values.
     *
     * @param headers column names, shared between all rows of a table
     * @param cells   raw cell values (may be shorter or longer than headers)
     */
    public static Row of(List<String> headers, List<String> cells) {
        Objects.requireNonNull(headers, "headers is required");
        Objects.requireNonNull(cells, "cells is required");
        List<String> values = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            String cell = i < cells.size() ? cells.get(i) : null;
            values.add(cell == null ? "" : cell);
        }
        return new Row(List.copyOf(headers), Collections.unmodifiableList(values));
    }

    public List<String> headers() {
        return headers;
    }

    /** Cell values in header order. */
    public List<String> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    /** Value of a column, or null if the column does not exist. */
    public String get(String column) {
        int idx = headers.indexOf(column);
        return idx < 0 ? null : values.get(idx);
    }

    public String get(int index) {
        return values.get(index);
    }

    /** Ordered view (header order) of this row. */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            map.put(headers.get(i), values.get(i));
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Row row))
            return false;
        return headers.equals(row.headers) && values.equals(row.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(headers, values);
    }

    @Override
    public String toString() {
        return "Row" + asMap();
    }
}

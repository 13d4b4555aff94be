package enricher.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of processing one {@link RowTask}.
 * Exactly one result is produced per dispatched task.
 */
public final class RowResult {

    /** Prefix of the value written into every target cell of a failed row. */
    public static final String FAILURE_PREFIX = "ERROR: ";

    private final int rowIndex;
    private final Row row;
    private final Map<String, String> values;
    private final String failure; // null on success
    private final long costUnits;

    private RowResult(int rowIndex, Row row, Map<String, String> values, String failure, long costUnits) {
        this.rowIndex = rowIndex;
        this.row = row;
        this.values = values;
        this.failure = failure;
        this.costUnits = costUnits;
    }

    public static RowResult success(RowTask task, Map<String, String> values, long costUnits) {
        Objects.requireNonNull(values, "values is required");
        return new RowResult(task.rowIndex(), task.row(),
                Collections.unmodifiableMap(new LinkedHashMap<>(values)), null, costUnits);
    }

    /**
     * Failed row: every target column carries {@code "ERROR: <description>"}
     * so the output table never has a hole where a value is expected.
     */
    public static RowResult failure(RowTask task, List<ColumnSpec> targets, String description, long costUnits) {
        String message = description == null || description.isBlank() ? "unknown error" : description;
        String sentinel = sentinel(message);
        Map<String, String> values = new LinkedHashMap<>();
        for (ColumnSpec spec : targets) {
            values.put(spec.name(), sentinel);
        }
        return new RowResult(task.rowIndex(), task.row(), Collections.unmodifiableMap(values), message, costUnits);
    }

    public static String sentinel(String description) {
        return FAILURE_PREFIX + description;
    }

    public static boolean isSentinel(String value) {
        return value != null && value.startsWith(FAILURE_PREFIX);
    }

    public int rowIndex() {
        return rowIndex;
    }

    public Row row() {
        return row;
    }

    /** Produced value per target column name. */
    public Map<String, String> values() {
        return values;
    }

    public String failure() {
        return failure;
    }

    public boolean isFailure() {
        return failure != null;
    }

    public long costUnits() {
        return costUnits;
    }

    @Override
    public String toString() {
        return "RowResult{rowIndex=" + rowIndex + (isFailure() ? ", failure='" + failure + "'" : ", ok")
                + ", cost=" + costUnits + "}";
    }
}

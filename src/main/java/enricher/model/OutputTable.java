package enricher.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The input table widened by one column per target spec.
 *
 * <p>Cells live in a flat row-major array addressed by row index. Target cells
 * start out empty (the placeholder) and are overwritten as results arrive.
 * Not thread-safe: the result sink is the only writer and also the only reader
 * while a run is in progress.</p>
 */
public final class OutputTable {

    public static final String PLACEHOLDER = "";

    private final List<String> headers;
    private final List<ColumnSpec> targets;
    private final int sourceWidth;
    private final int width;
    private final int rowCount;
    private final String[] cells;
    private final int[] writes;

    private OutputTable(List<String> sourceHeaders, List<ColumnSpec> targets, int rowCount) {
        List<String> all = new ArrayList<>(sourceHeaders);
        all.addAll(ColumnSpec.names(targets));
        this.headers = Collections.unmodifiableList(all);
        this.targets = List.copyOf(targets);
        this.sourceWidth = sourceHeaders.size();
        this.width = all.size();
        this.rowCount = rowCount;
        this.cells = new String[rowCount * width];
        this.writes = new int[rowCount];
    }

    /**
     * Create the output table for a run.
     *
     * @throws IllegalArgumentException if a target column clashes with an input column
     */
    public static OutputTable widen(Table input, List<ColumnSpec> targets) {
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("at least one target column is required");
        }
        for (ColumnSpec spec : targets) {
            if (input.headers().contains(spec.name())) {
                throw new IllegalArgumentException("column already exists in input: " + spec.name());
            }
        }

        OutputTable table = new OutputTable(input.headers(), targets, input.rowCount());
        for (int r = 0; r < input.rowCount(); r++) {
            Row row = input.rows().get(r);
            int base = r * table.width;
            for (int c = 0; c < table.sourceWidth; c++) {
                table.cells[base + c] = row.get(c);
            }
            Arrays.fill(table.cells, base + table.sourceWidth, base + table.width, PLACEHOLDER);
        }
        return table;
    }

    /**
     * Write a result's values into the target range of its row.
     * Target columns missing from {@code values} are set to the empty string.
     */
    public void apply(int rowIndex, Map<String, String> values) {
        if (rowIndex < 0 || rowIndex >= rowCount) {
            throw new IllegalArgumentException("row index out of range: " + rowIndex + " (rows=" + rowCount + ")");
        }
        int base = rowIndex * width + sourceWidth;
        for (int i = 0; i < targets.size(); i++) {
            String value = values.get(targets.get(i).name());
            cells[base + i] = value == null ? "" : value;
        }
        writes[rowIndex]++;
    }

    /** Full header list: input columns followed by target columns. */
    public List<String> headers() {
        return headers;
    }

    public List<ColumnSpec> targets() {
        return targets;
    }

    public int rowCount() {
        return rowCount;
    }

    public int width() {
        return width;
    }

    public String cell(int rowIndex, int column) {
        return cells[rowIndex * width + column];
    }

    /** Copy of one row, all columns. */
    public List<String> row(int rowIndex) {
        int base = rowIndex * width;
        return List.of(Arrays.copyOfRange(cells, base, base + width));
    }

    /** Copy of the whole table, row order equal to input order. */
    public List<List<String>> rows() {
        List<List<String>> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            rows.add(row(r));
        }
        return rows;
    }

    /** Target-column values of one row. */
    public List<String> targetValues(int rowIndex) {
        int base = rowIndex * width + sourceWidth;
        return List.of(Arrays.copyOfRange(cells, base, base + targets.size()));
    }

    /** Number of times a result has been applied to this row. */
    public int writeCount(int rowIndex) {
        return writes[rowIndex];
    }

    public boolean isWritten(int rowIndex) {
        return writes[rowIndex] > 0;
    }

    public int writtenRows() {
        int n = 0;
        for (int w : writes) {
            if (w > 0)
                n++;
        }
        return n;
    }
}

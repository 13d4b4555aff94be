package enricher.service;

import enricher.model.Row;
import enricher.model.Table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

/**
 * Column analysis and row sampling for table previews.
 */
public final class ColumnProfiler {

    public static final int SAMPLE_VALUES = 5;
    public static final int SAMPLE_WIDTH = 15;

    private ColumnProfiler() {
    }

    public static List<ColumnProfile> profile(Table table) {
        List<ColumnProfile> profiles = new ArrayList<>(table.columnCount());
        for (int i = 0; i < table.columnCount(); i++) {
            List<String> values = table.column(i);
            Set<String> unique = new LinkedHashSet<>(values);

            List<String> samples = new ArrayList<>();
            for (String v : unique) {
                if (samples.size() == SAMPLE_VALUES)
                    break;
                samples.add(truncate(v, SAMPLE_WIDTH));
            }

            profiles.add(new ColumnProfile(i, table.headers().get(i), DataType.detect(values),
                    unique.size(), countNulls(values), values.size(), samples));
        }
        return profiles;
    }

    /** Blank, {@code null} and {@code nil} (any case) count as null. */
    public static int countNulls(List<String> values) {
        int count = 0;
        for (String v : values) {
            String t = v == null ? "" : v.trim().toLowerCase(Locale.ROOT);
            if (t.isEmpty() || t.equals("null") || t.equals("nil"))
                count++;
        }
        return count;
    }

    /**
     * Rows to display: the first {@code count}, or {@code count} distinct random
     * rows when {@code random} is set. All rows when the table is not larger.
     */
    public static List<Row> selectRows(Table table, int count, boolean random, Random rng) {
        if (table.rowCount() <= count)
            return table.rows();
        if (!random)
            return table.head(count);

        List<Integer> indices = new ArrayList<>(table.rowCount());
        for (int i = 0; i < table.rowCount(); i++) {
            indices.add(i);
        }
        Collections.shuffle(indices, rng);

        List<Row> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            rows.add(table.rows().get(indices.get(i)));
        }
        return rows;
    }

    /** Cut to {@code max} characters, the last three replaced by {@code ...}. */
    public static String truncate(String s, int max) {
        if (s.length() <= max)
            return s;
        if (max <= 3)
            return "...";
        return s.substring(0, max - 3) + "...";
    }
}

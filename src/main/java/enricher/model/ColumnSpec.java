package enricher.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A column the pipeline must produce for every row.
 * The type hint is carried through to the prompt only; values are always text.
 */
public record ColumnSpec(String name, String typeHint) {

    public static final String DEFAULT_TYPE = "string";

    public ColumnSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("column name must not be blank");
        }
        name = name.trim();
        typeHint = typeHint == null || typeHint.isBlank()
                ? DEFAULT_TYPE
                : typeHint.trim().toLowerCase(Locale.ROOT);
    }

    public static ColumnSpec of(String name) {
        return new ColumnSpec(name, DEFAULT_TYPE);
    }

    /**
     * Parse a comma-separated list such as {@code "country,risk_level:number"}.
     * Empty entries are skipped; duplicate names are rejected.
     */
    public static List<ColumnSpec> parseList(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("columns to generate are required");
        }
        List<ColumnSpec> specs = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String part : spec.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty())
                continue;

            ColumnSpec column;
            int colon = trimmed.indexOf(':');
            if (colon >= 0) {
                column = new ColumnSpec(trimmed.substring(0, colon), trimmed.substring(colon + 1));
            } else {
                column = ColumnSpec.of(trimmed);
            }

            if (!seen.add(column.name())) {
                throw new IllegalArgumentException("duplicate column: " + column.name());
            }
            specs.add(column);
        }
        if (specs.isEmpty()) {
            throw new IllegalArgumentException("columns to generate are required");
        }
        return List.copyOf(specs);
    }

    public static List<String> names(List<ColumnSpec> specs) {
        return specs.stream().map(ColumnSpec::name).toList();
    }
}

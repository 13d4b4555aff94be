package enricher.service;

import java.util.List;

/**
 * Summary of one input column, as shown by the preview command.
 */
public record ColumnProfile(
        int index,
        String name,
        DataType type,
        int uniqueCount,
        int nullCount,
        int totalCount,
        List<String> samples) {

    public ColumnProfile {
        samples = List.copyOf(samples);
    }
}

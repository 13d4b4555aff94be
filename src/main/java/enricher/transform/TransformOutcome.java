package enricher.transform;

import enricher.model.ColumnSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Successful transform: one value per target column and the cost units spent.
 */
public record TransformOutcome(Map<String, String> values, long costUnits) {

    public TransformOutcome {
        values = Map.copyOf(values);
        if (costUnits < 0) {
            throw new IllegalArgumentException("costUnits must be >= 0");
        }
    }

    /** Target names this outcome has no value for, in target order. */
    public List<String> missing(List<ColumnSpec> targets) {
        List<String> missing = new ArrayList<>();
        for (ColumnSpec spec : targets) {
            if (!values.containsKey(spec.name())) {
                missing.add(spec.name());
            }
        }
        return missing;
    }

    /** Failure message for an incomplete outcome: {@code response missing fields: [a, b]}. */
    public static String missingMessage(List<String> missing) {
        return "response missing fields: " + missing;
    }
}
